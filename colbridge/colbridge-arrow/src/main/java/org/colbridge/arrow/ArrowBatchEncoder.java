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

package org.colbridge.arrow;

import org.colbridge.arrow.memory.BufferArena;
import org.colbridge.arrow.writer.ArrowWriter;
import org.colbridge.data.InternalRow;
import org.colbridge.task.TaskContext;
import org.colbridge.types.RowType;
import org.colbridge.utils.ExceptionUtils;
import org.colbridge.utils.IOUtils;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.WriteChannel;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.ipc.message.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 把一个分区的行迭代器编码为 Arrow record batch 序列。
 *
 * <h2>核心功能</h2>
 *
 * <ul>
 *   <li>按需拉取:行是逐条拉取的,不会一次性读入整个分区
 *   <li>批次上限:每个批次最多包含 {@code maxRecordsPerBatch} 行,{@code maxRecordsPerBatch <= 0}
 *       时全部行放在一个批次中,空输入不产生批次
 *   <li>自包含输出:每个批次是一条独立的 Arrow IPC record batch 消息
 * </ul>
 *
 * <h2>工作原理</h2>
 *
 * <ol>
 *   <li>在父分配器下创建任务内存区域,分配 root 和各列的 {@link ArrowWriter}
 *   <li>每次 {@code next()} 先检查任务是否被终止,再写入不超过上限的行并序列化
 *   <li>无论成功还是失败,写出一个批次后都重置列写入器
 *   <li>输入读完时释放 root 和内存区域
 * </ol>
 *
 * <h2>异常处理</h2>
 *
 * <p>无法写入某一列的值抛出 {@link org.colbridge.data.ConversionException},重置写入器时的异常作为
 * suppressed 附加在原异常上。被终止的任务抛出 {@link org.colbridge.task.TaskKilledException}。
 *
 * <h2>资源释放</h2>
 *
 * <p>释放同时注册为任务结束回调,迭代被中途放弃时仍会在任务结束时释放。两条路径只会真正释放一次。
 *
 * <h2>线程安全性</h2>
 *
 * <p>返回的迭代器不是线程安全的,只能在所属任务的线程中使用。
 */
public class ArrowBatchEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(ArrowBatchEncoder.class);

    private ArrowBatchEncoder() {}

    public static Iterator<byte[]> toBatchIterator(
            Iterator<InternalRow> rows,
            RowType rowType,
            int maxRecordsPerBatch,
            String timeZoneId,
            BufferAllocator parentAllocator,
            TaskContext context) {
        return toBatchIterator(
                rows,
                rowType,
                maxRecordsPerBatch,
                timeZoneId,
                parentAllocator,
                Long.MAX_VALUE,
                context);
    }

    /**
     * 创建批次迭代器。
     *
     * @param rows 分区内的行,按顺序拉取
     * @param rowType 行类型,决定 Arrow schema
     * @param maxRecordsPerBatch 每个批次的最大行数,小于等于 0 表示不限制
     * @param timeZoneId 带本地时区时间戳列写入 schema 的时区
     * @param parentAllocator 任务内存区域的父分配器
     * @param maxAllocation 任务内存区域的容量上限(字节)
     * @param context 当前任务的上下文
     */
    public static Iterator<byte[]> toBatchIterator(
            Iterator<InternalRow> rows,
            RowType rowType,
            int maxRecordsPerBatch,
            String timeZoneId,
            BufferAllocator parentAllocator,
            long maxAllocation,
            TaskContext context) {
        checkNotNull(rows, "rows must not be null");
        checkNotNull(rowType, "rowType must not be null");
        checkNotNull(context, "context must not be null");
        BatchIterator iterator =
                new BatchIterator(
                        rows,
                        rowType,
                        maxRecordsPerBatch,
                        timeZoneId,
                        parentAllocator,
                        maxAllocation,
                        context);
        context.addTaskCompletionListener(ctx -> iterator.release());
        return iterator;
    }

    private static class BatchIterator implements Iterator<byte[]> {

        private final Iterator<InternalRow> rows;
        private final int maxRecordsPerBatch;
        private final TaskContext context;

        private final BufferArena arena;
        private final VectorSchemaRoot root;
        private final ArrowWriter arrowWriter;
        private final VectorUnloader unloader;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private int batchCount;

        private BatchIterator(
                Iterator<InternalRow> rows,
                RowType rowType,
                int maxRecordsPerBatch,
                String timeZoneId,
                BufferAllocator parentAllocator,
                long maxAllocation,
                TaskContext context) {
            this.rows = rows;
            this.maxRecordsPerBatch = maxRecordsPerBatch;
            this.context = context;
            this.arena =
                    new BufferArena(
                            parentAllocator,
                            "toBatchIterator-p" + context.partitionId(),
                            maxAllocation);
            VectorSchemaRoot createdRoot = null;
            try {
                createdRoot =
                        VectorSchemaRoot.create(
                                ArrowUtils.toArrowSchema(rowType, timeZoneId),
                                arena.getAllocator());
                this.arrowWriter = ArrowWriter.create(createdRoot, rowType);
            } catch (RuntimeException e) {
                if (createdRoot != null) {
                    createdRoot.close();
                }
                arena.close();
                throw e;
            }
            this.root = createdRoot;
            this.unloader = new VectorUnloader(root);
        }

        @Override
        public boolean hasNext() {
            if (released.get()) {
                return false;
            }
            if (rows.hasNext()) {
                return true;
            }
            release();
            return false;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            context.killTaskIfInterrupted();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            WriteChannel channel = new WriteChannel(Channels.newChannel(out));
            try {
                ExceptionUtils.tryWithSafeFinally(
                        () -> {
                            while (rows.hasNext()
                                    && (maxRecordsPerBatch <= 0
                                            || arrowWriter.getRowCount() < maxRecordsPerBatch)) {
                                arrowWriter.write(rows.next());
                            }
                            arrowWriter.finish();
                            try (ArrowRecordBatch batch = unloader.getRecordBatch()) {
                                MessageSerializer.serialize(channel, batch);
                            }
                            batchCount++;
                            LOG.debug(
                                    "Encoded batch {} of partition {} with {} rows ({} bytes).",
                                    batchCount,
                                    context.partitionId(),
                                    root.getRowCount(),
                                    channel.getCurrentPosition());
                        },
                        arrowWriter::reset);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (Exception e) {
                throw ExceptionUtils.rethrowUnchecked(e);
            }
            return out.toByteArray();
        }

        private void release() {
            if (released.compareAndSet(false, true)) {
                LOG.debug(
                        "Releasing arrow batch encoder of partition {} after {} batches.",
                        context.partitionId(),
                        batchCount);
                try {
                    IOUtils.closeAll(root, arena);
                } catch (Exception e) {
                    throw ExceptionUtils.rethrowUnchecked(e);
                }
            }
        }
    }
}
