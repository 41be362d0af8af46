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

package org.colbridge.engine;

import org.colbridge.data.InternalRow;
import org.colbridge.data.RowConverter;
import org.colbridge.task.TaskContext;
import org.colbridge.types.RowType;
import org.colbridge.utils.CloseableIterator;
import org.colbridge.utils.InternalRowUtils;

import com.google.common.collect.Iterators;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.colbridge.utils.Preconditions.checkArgument;
import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 由 {@link LocalExecutionEngine} 执行的数据集,每个分区由一个 {@link PartitionReader} 提供。
 *
 * <p>{@link #collect()} 等动作方法在引擎中执行全部分区,读取器产出的行在任务内被复制或转换,
 * 任务结束后读取器持有的资源即被释放。
 */
public class LocalDataset implements PartitionedDataset {

    private final LocalExecutionEngine engine;
    private final RowType rowType;
    private final List<PartitionReader> readers;

    LocalDataset(LocalExecutionEngine engine, RowType rowType, List<PartitionReader> readers) {
        this.engine = checkNotNull(engine);
        this.rowType = checkNotNull(rowType);
        this.readers = Collections.unmodifiableList(new ArrayList<>(readers));
    }

    @Override
    public RowType rowType() {
        return rowType;
    }

    @Override
    public int numPartitions() {
        return readers.size();
    }

    @Override
    public CloseableIterator<InternalRow> compute(int partition, TaskContext context)
            throws Exception {
        checkArgument(
                partition >= 0 && partition < readers.size(),
                "Partition %s out of range [0, %s).",
                partition,
                readers.size());
        return readers.get(partition).read(context);
    }

    /** 按分区顺序收集全部行,返回的行与数据源不共享状态。 */
    public List<InternalRow> collect() {
        return engine.mapPartitionsAndCollect(
                this,
                (rows, context) ->
                        Iterators.<InternalRow, InternalRow>transform(
                                rows, row -> InternalRowUtils.copyRow(row, rowType)));
    }

    /** 按分区顺序收集全部行,每行转换为普通 Java 值。 */
    public List<Object[]> collectExternal(ZoneId sessionZone) {
        RowConverter converter = new RowConverter(rowType, sessionZone);
        return engine.mapPartitionsAndCollect(
                this, (rows, context) -> Iterators.transform(rows, converter::toExternal));
    }

    public long count() {
        List<Long> counts =
                engine.mapPartitionsAndCollect(
                        this,
                        (rows, context) ->
                                Collections.singletonList((long) Iterators.size(rows))
                                        .iterator());
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }
}
