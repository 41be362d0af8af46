/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.colbridge.reader;

import org.colbridge.utils.CloseableIterator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.NoSuchElementException;

/**
 * 把 {@link RecordReader} 包装为逐条读取的 {@link CloseableIterator}。
 *
 * <p>当前批次读完后先释放它,再读取下一个批次。读取器抛出的 {@link IOException} 被包装为
 * {@link UncheckedIOException},运行时异常原样抛出。
 */
public class RecordReaderIterator<T> implements CloseableIterator<T> {

    private final RecordReader<T> reader;
    private RecordReader.RecordIterator<T> currentIterator;
    private boolean started;
    private boolean finished;
    private boolean advanced;
    private T currentResult;

    public RecordReaderIterator(RecordReader<T> reader) {
        this.reader = reader;
        this.started = false;
        this.finished = false;
        this.advanced = false;
        this.currentResult = null;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        advanceIfNeeded();
        return currentResult != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        advanced = false;
        return currentResult;
    }

    private void advanceIfNeeded() {
        if (advanced) {
            return;
        }
        advanced = true;
        currentResult = null;

        try {
            if (!started) {
                started = true;
                currentIterator = reader.readBatch();
            }
            while (currentIterator != null) {
                currentResult = currentIterator.next();
                if (currentResult != null) {
                    return;
                }
                currentIterator.releaseBatch();
                // readBatch may fail, do not release the same batch again in close()
                currentIterator = null;
                currentIterator = reader.readBatch();
            }
            finished = true;
        } catch (IOException e) {
            finished = true;
            throw new UncheckedIOException(e);
        } catch (RuntimeException e) {
            finished = true;
            throw e;
        }
    }

    @Override
    public void close() throws Exception {
        finished = true;
        try {
            if (currentIterator != null) {
                currentIterator.releaseBatch();
                currentIterator = null;
            }
        } finally {
            reader.close();
        }
    }
}
