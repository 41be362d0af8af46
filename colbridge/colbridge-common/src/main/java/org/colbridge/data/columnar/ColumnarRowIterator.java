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

package org.colbridge.data.columnar;

import org.colbridge.data.InternalRow;
import org.colbridge.reader.RecordReader;

import javax.annotation.Nullable;

/**
 * 逐行遍历一个列式批次的 {@link RecordReader.RecordIterator}。
 *
 * <p>返回的始终是同一个 {@link ColumnarRow} 实例。批次读完后调用 {@link #releaseBatch()},
 * 由回收器释放批次占用的缓冲区;回收器只会执行一次。
 */
public class ColumnarRowIterator implements RecordReader.RecordIterator<InternalRow> {

    private final ColumnarRow row;
    @Nullable private Runnable recycler;

    private int num;
    private int index;

    public ColumnarRowIterator(ColumnarRow row, @Nullable Runnable recycler) {
        this.row = row;
        this.recycler = recycler;
        reset();
    }

    /** 从第一行重新开始,行数取自当前批次。 */
    public void reset() {
        this.num = row.batch().getNumRows();
        this.index = 0;
    }

    @Nullable
    @Override
    public InternalRow next() {
        if (index < num) {
            row.setRowId(index++);
            return row;
        } else {
            return null;
        }
    }

    @Override
    public void releaseBatch() {
        Runnable toRun = recycler;
        recycler = null;
        if (toRun != null) {
            toRun.run();
        }
    }
}
