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

import org.colbridge.annotation.Public;
import org.colbridge.utils.CloseableIterator;

import javax.annotation.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 按批次读取记录的读取器。
 *
 * <p>每次 {@link #readBatch()} 返回一个批次的迭代器,调用方读完后必须调用
 * {@link RecordIterator#releaseBatch()},之后才能读取下一个批次。返回 null 表示输入已经读完。
 *
 * @param <T> 记录类型
 */
@Public
public interface RecordReader<T> extends Closeable {

    /** 读取下一个批次,输入读完时返回 null。 */
    @Nullable
    RecordIterator<T> readBatch() throws IOException;

    /** 关闭读取器并释放它持有的全部资源,重复调用没有副作用。 */
    @Override
    void close() throws IOException;

    /**
     * 一个批次内的记录迭代器。
     *
     * @param <T> 记录类型
     */
    interface RecordIterator<T> {

        /** 返回下一条记录,批次读完时返回 null。 */
        @Nullable
        T next() throws IOException;

        /** 释放当前批次,之后本迭代器返回过的记录都不再有效。 */
        void releaseBatch();

        default <R> RecordReader.RecordIterator<R> transform(Function<T, R> function) {
            RecordReader.RecordIterator<T> thisIterator = this;
            return new RecordReader.RecordIterator<R>() {
                @Nullable
                @Override
                public R next() throws IOException {
                    T next = thisIterator.next();
                    if (next == null) {
                        return null;
                    }
                    return function.apply(next);
                }

                @Override
                public void releaseBatch() {
                    thisIterator.releaseBatch();
                }
            };
        }
    }

    // -------------------------------------------------------------------------
    //                     Util methods
    // -------------------------------------------------------------------------

    /** 消费全部剩余记录,结束或出错时关闭读取器。 */
    default void forEachRemaining(Consumer<? super T> action) throws IOException {
        RecordReader.RecordIterator<T> batch;
        T record;

        try {
            while ((batch = readBatch()) != null) {
                while ((record = batch.next()) != null) {
                    action.accept(record);
                }
                batch.releaseBatch();
            }
        } finally {
            close();
        }
    }

    default <R> RecordReader<R> transform(Function<T, R> function) {
        RecordReader<T> thisReader = this;
        return new RecordReader<R>() {
            @Nullable
            @Override
            public RecordIterator<R> readBatch() throws IOException {
                RecordIterator<T> iterator = thisReader.readBatch();
                if (iterator == null) {
                    return null;
                }
                return iterator.transform(function);
            }

            @Override
            public void close() throws IOException {
                thisReader.close();
            }
        };
    }

    default CloseableIterator<T> toCloseableIterator() {
        return new RecordReaderIterator<>(this);
    }
}
