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

package org.colbridge;

import org.colbridge.arrow.ArrowBatchDecoder;
import org.colbridge.arrow.ArrowBatchEncoder;
import org.colbridge.arrow.ArrowBatchStreamWriter;
import org.colbridge.engine.ExecutionEngine;
import org.colbridge.engine.PartitionReader;
import org.colbridge.engine.PartitionedDataset;
import org.colbridge.types.DataTypeJsonParser;
import org.colbridge.types.RowType;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 分区数据集与 Arrow IPC 流之间的转换入口。
 *
 * <h2>编码方向</h2>
 *
 * <p>在每个分区上运行 {@link ArrowBatchEncoder},按分区顺序收集全部批次,再由
 * {@link ArrowBatchStreamWriter} 拼接成一个带 schema 和结束标记的流。
 *
 * <h2>解码方向</h2>
 *
 * <p>为每个分区的负载创建一个基于 {@link ArrowBatchDecoder} 的读取器,通过
 * {@link ExecutionEngine#createDataset} 构造数据集。
 *
 * <h2>内存管理</h2>
 *
 * <p>实例持有一个大小受 {@link BridgeOptions#ARROW_MEMORY_MAX} 限制的根分配器,每个任务从中划出自己的内存区域。
 * {@link #close()} 关闭根分配器,调用之前必须确保由本实例产生的数据集都不再被读取。
 *
 * @param <D> 引擎产出的数据集类型
 */
public class ArrowConverters<D extends PartitionedDataset> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ArrowConverters.class);

    private final ExecutionEngine<D> engine;
    private final BridgeOptions options;
    private final BufferAllocator rootAllocator;

    public ArrowConverters(ExecutionEngine<D> engine, BridgeOptions options) {
        this.engine = checkNotNull(engine, "engine must not be null");
        this.options = checkNotNull(options, "options must not be null");
        this.rootAllocator = new RootAllocator(options.arrowMemoryMax());
    }

    /** 按配置的批次大小和会话时区把数据集编码为一个完整的 Arrow 流。 */
    public byte[] toArrowBatchStream(PartitionedDataset dataset) throws IOException {
        return toArrowBatchStream(
                dataset, options.maxRecordsPerBatch(), options.sessionTimeZone());
    }

    public byte[] toArrowBatchStream(
            PartitionedDataset dataset, int maxRecordsPerBatch, String timeZoneId)
            throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeArrowBatchStream(dataset, out, maxRecordsPerBatch, timeZoneId);
        return out.toByteArray();
    }

    public void writeArrowBatchStream(PartitionedDataset dataset, OutputStream out)
            throws IOException {
        writeArrowBatchStream(
                dataset, out, options.maxRecordsPerBatch(), options.sessionTimeZone());
    }

    /**
     * 把数据集编码为 Arrow 流写入 {@code out},写完后不关闭 {@code out}。
     *
     * <p>批次按分区编号顺序、分区内按产生顺序写出。
     */
    public void writeArrowBatchStream(
            PartitionedDataset dataset,
            OutputStream out,
            int maxRecordsPerBatch,
            String timeZoneId)
            throws IOException {
        RowType rowType = dataset.rowType();
        long taskMemory = options.arrowTaskMemoryMax();
        List<byte[]> batches =
                engine.mapPartitionsAndCollect(
                        dataset,
                        (rows, context) ->
                                ArrowBatchEncoder.toBatchIterator(
                                        rows,
                                        rowType,
                                        maxRecordsPerBatch,
                                        timeZoneId,
                                        rootAllocator,
                                        taskMemory,
                                        context));

        ArrowBatchStreamWriter writer = new ArrowBatchStreamWriter(rowType, out, timeZoneId);
        writer.writeBatches(batches.iterator());
        writer.end();
        LOG.debug(
                "Wrote arrow stream of {} batches from {} partitions.",
                writer.getBatchCount(),
                dataset.numPartitions());
    }

    /**
     * 由每个分区的负载构造数据集。
     *
     * @param payloadsPerPartition 第 i 个元素是第 i 个分区的负载,每个负载是一个完整的 Arrow 流
     *     或若干条裸的 record batch 消息
     * @param rowType 负载中数据的行类型
     */
    public D toDataset(List<? extends Iterable<byte[]>> payloadsPerPartition, RowType rowType) {
        checkNotNull(payloadsPerPartition, "payloadsPerPartition must not be null");
        checkNotNull(rowType, "rowType must not be null");
        long taskMemory = options.arrowTaskMemoryMax();
        List<PartitionReader> readers = new ArrayList<>(payloadsPerPartition.size());
        for (Iterable<byte[]> payloads : payloadsPerPartition) {
            readers.add(
                    context ->
                            ArrowBatchDecoder.fromPayloadIterator(
                                    payloads.iterator(),
                                    rowType,
                                    rootAllocator,
                                    taskMemory,
                                    context));
        }
        return engine.createDataset(rowType, readers);
    }

    /** 同 {@link #toDataset(List, RowType)},行类型以 JSON 形式给出。 */
    public D toDataset(List<? extends Iterable<byte[]>> payloadsPerPartition, String schemaJson) {
        return toDataset(payloadsPerPartition, DataTypeJsonParser.parseRowType(schemaJson));
    }

    @Override
    public void close() {
        LOG.debug(
                "Closing root arrow allocator, peak memory allocation {} bytes.",
                rootAllocator.getPeakMemoryAllocation());
        rootAllocator.close();
    }
}
