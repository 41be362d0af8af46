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

import org.colbridge.arrow.converter.Arrow2ColumnVectorConverter;
import org.colbridge.arrow.memory.BufferArena;
import org.colbridge.data.InternalRow;
import org.colbridge.data.columnar.ColumnVector;
import org.colbridge.data.columnar.ColumnarRow;
import org.colbridge.data.columnar.ColumnarRowIterator;
import org.colbridge.data.columnar.VectorizedColumnBatch;
import org.colbridge.reader.RecordReader;
import org.colbridge.reader.RecordReaderIterator;
import org.colbridge.task.TaskContext;
import org.colbridge.task.TaskKilledException;
import org.colbridge.types.RowType;
import org.colbridge.utils.CloseableIterator;
import org.colbridge.utils.ExceptionUtils;
import org.colbridge.utils.IOUtils;

import org.apache.arrow.flatbuf.MessageHeader;
import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.util.DataSizeRoundingUtil;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.TypeLayout;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ReadChannel;
import org.apache.arrow.vector.ipc.message.ArrowFieldNode;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.ipc.message.MessageMetadataResult;
import org.apache.arrow.vector.ipc.message.MessageSerializer;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 把一组 Arrow IPC 字节负载解码为行。
 *
 * <h2>核心功能</h2>
 *
 * <ul>
 *   <li>两种负载:完整的流(schema 消息、若干批次、结束标记),或者一条或多条裸的 record batch 消息
 *   <li>结构校验:完整流的 schema 必须与期望的行类型一致,裸批次按期望的向量检查缓冲区布局
 *   <li>按批读取:实现 {@link RecordReader},每次 {@link #readBatch()} 只反序列化一个批次
 * </ul>
 *
 * <h2>工作原理</h2>
 *
 * <ol>
 *   <li>逐个取出负载,先读取消息长度前缀,确认剩余字节足够后再读取消息
 *   <li>schema 消息只允许出现在负载开头,record batch 消息载入到复用的 root 中
 *   <li>返回的行是 root 上的 {@link ColumnarRow} 视图,读下一个批次之前清空当前批次的缓冲区
 *   <li>所有负载读完后释放 root 和内存区域
 * </ol>
 *
 * <h2>异常处理</h2>
 *
 * <p>字节被截断、消息类型不符合预期、schema 或批次布局不一致、结束标记之后还有数据,或者完整流缺少结束标记,
 * 都会抛出 {@link DeserializationException},抛出之前先释放全部资源。
 *
 * <h2>线程安全性</h2>
 *
 * <p>该类不是线程安全的。{@link #close()} 和任务结束回调可能来自其他线程,释放只会执行一次。
 */
public class ArrowBatchDecoder implements RecordReader<InternalRow> {

    private static final Logger LOG = LoggerFactory.getLogger(ArrowBatchDecoder.class);

    private static final int CONTINUATION_MARKER = 0xFFFFFFFF;

    private final Iterator<byte[]> payloads;
    private final TaskContext context;
    private final Schema expectedSchema;

    private final BufferArena arena;
    private final VectorSchemaRoot root;
    private final VectorLoader loader;
    private final ColumnarRow row;
    private final AtomicBoolean released = new AtomicBoolean(false);

    @Nullable private PayloadState current;
    private int payloadCount;
    private int batchCount;

    public ArrowBatchDecoder(
            Iterator<byte[]> payloads,
            RowType rowType,
            BufferAllocator parentAllocator,
            long maxAllocation,
            TaskContext context) {
        this.payloads = checkNotNull(payloads, "payloads must not be null");
        this.context = checkNotNull(context, "context must not be null");
        // 时区只用于构造 root,比较 schema 时不考虑时区
        this.expectedSchema = ArrowUtils.toArrowSchema(rowType, "UTC");
        this.arena =
                new BufferArena(
                        parentAllocator,
                        "fromPayloadIterator-p" + context.partitionId(),
                        maxAllocation);
        VectorSchemaRoot createdRoot = null;
        try {
            createdRoot = VectorSchemaRoot.create(expectedSchema, arena.getAllocator());
            ColumnVector[] vectors = new ColumnVector[rowType.getFieldCount()];
            for (int i = 0; i < vectors.length; i++) {
                vectors[i] =
                        Arrow2ColumnVectorConverter.construct(rowType.getTypeAt(i))
                                .convertVector(createdRoot.getVector(i));
            }
            this.row = new ColumnarRow(new VectorizedColumnBatch(vectors));
        } catch (RuntimeException e) {
            if (createdRoot != null) {
                createdRoot.close();
            }
            arena.close();
            throw e;
        }
        this.root = createdRoot;
        this.loader = new VectorLoader(root);
    }

    /**
     * 创建单次遍历的行迭代器,资源释放同时注册为任务结束回调。
     *
     * <p>返回的行是复用的视图,调用方如果需要保留某一行,必须先复制。
     */
    public static CloseableIterator<InternalRow> fromPayloadIterator(
            Iterator<byte[]> payloads,
            RowType rowType,
            BufferAllocator parentAllocator,
            TaskContext context) {
        return fromPayloadIterator(payloads, rowType, parentAllocator, Long.MAX_VALUE, context);
    }

    public static CloseableIterator<InternalRow> fromPayloadIterator(
            Iterator<byte[]> payloads,
            RowType rowType,
            BufferAllocator parentAllocator,
            long maxAllocation,
            TaskContext context) {
        ArrowBatchDecoder decoder =
                new ArrowBatchDecoder(payloads, rowType, parentAllocator, maxAllocation, context);
        context.addTaskCompletionListener(ctx -> decoder.close());
        return new RecordReaderIterator<>(decoder);
    }

    @Nullable
    @Override
    public RecordIterator<InternalRow> readBatch() throws IOException {
        if (released.get()) {
            return null;
        }
        try {
            context.killTaskIfInterrupted();
            return readNextBatch();
        } catch (DeserializationException | TaskKilledException e) {
            releaseOnFailure(e);
            throw e;
        } catch (IOException | RuntimeException e) {
            DeserializationException wrapped =
                    new DeserializationException(
                            String.format(
                                    "Failed to deserialize arrow payload %d of partition %d.",
                                    payloadCount, context.partitionId()),
                            e);
            releaseOnFailure(wrapped);
            throw wrapped;
        }
    }

    @Nullable
    private RecordIterator<InternalRow> readNextBatch() throws IOException {
        while (true) {
            if (current == null) {
                if (!payloads.hasNext()) {
                    LOG.debug(
                            "Decoded {} batches from {} payloads of partition {}.",
                            batchCount,
                            payloadCount,
                            context.partitionId());
                    release();
                    return null;
                }
                current = new PayloadState(checkNotNull(payloads.next()));
                payloadCount++;
                continue;
            }

            MessageMetadataResult message = current.nextMessage();
            if (message == null) {
                current = null;
                continue;
            }

            byte headerType = message.getMessage().headerType();
            if (headerType == MessageHeader.Schema && current.messageCount == 1) {
                validateSchema(MessageSerializer.deserializeSchema(message.getMessage()));
                current.framed = true;
            } else if (headerType == MessageHeader.RecordBatch) {
                loadBatch(message);
                return new ColumnarRowIterator(row, this::recycleBatch);
            } else {
                throw new DeserializationException(
                        String.format(
                                "Unexpected arrow message of type %s at message %d of payload %d.",
                                MessageHeader.name(headerType),
                                current.messageCount,
                                payloadCount));
            }
        }
    }

    private void validateSchema(Schema actual) {
        if (!ArrowUtils.schemaEquals(expectedSchema, actual)) {
            throw new DeserializationException(
                    String.format(
                            "Arrow stream schema %s does not match the expected schema %s.",
                            actual, expectedSchema));
        }
    }

    private void loadBatch(MessageMetadataResult message) throws IOException {
        current.checkAvailable(message.getMessageBodyLength(), "record batch body");
        // body 的所有权交给 batch,不需要单独释放
        ArrowBuf body =
                MessageSerializer.readMessageBody(
                        current.channel, message.getMessageBodyLength(), arena.getAllocator());
        try (ArrowRecordBatch batch = MessageSerializer.deserializeRecordBatch(message, body)) {
            if (!current.framed) {
                validateLayout(batch);
            }
            loader.load(batch);
        }
        row.batch().setNumRows(root.getRowCount());
        batchCount++;
        LOG.debug(
                "Loaded batch {} of partition {} with {} rows.",
                batchCount,
                context.partitionId(),
                root.getRowCount());
    }

    /**
     * 裸批次没有 schema 消息,这里按期望的向量检查字段节点数、缓冲区个数和定长数据缓冲区的长度。
     *
     * <p>编码端写出的定长数据缓冲区长度恰好是 {@code 行数 * 类型宽度},允许对齐到 8 字节。
     */
    private void validateLayout(ArrowRecordBatch batch) {
        List<FieldVector> vectors = root.getFieldVectors();
        List<ArrowFieldNode> nodes = batch.getNodes();
        List<ArrowBuf> buffers = batch.getBuffers();
        if (nodes.size() != vectors.size()) {
            throw layoutMismatch(
                    String.format(
                            "has %d field nodes but %d fields are expected",
                            nodes.size(), vectors.size()));
        }
        int bufferIndex = 0;
        for (int i = 0; i < vectors.size(); i++) {
            FieldVector vector = vectors.get(i);
            int bufferCount = TypeLayout.getTypeBufferCount(vector.getField().getType());
            if (bufferIndex + bufferCount > buffers.size()) {
                throw layoutMismatch(
                        String.format(
                                "has too few buffers for field '%s'", vector.getName()));
            }
            if (vector instanceof BaseFixedWidthVector) {
                long valueCount = nodes.get(i).getLength();
                long expected =
                        vector instanceof BitVector
                                ? (valueCount + 7) / 8
                                : valueCount * ((BaseFixedWidthVector) vector).getTypeWidth();
                // 第一个是有效位缓冲区,第二个是数据缓冲区
                long actual = buffers.get(bufferIndex + 1).capacity();
                if (actual < expected
                        || actual > DataSizeRoundingUtil.roundUpTo8Multiple(expected)) {
                    throw layoutMismatch(
                            String.format(
                                    "has a %d byte data buffer for %d values of field '%s' (%s)",
                                    actual, valueCount, vector.getName(), vector.getMinorType()));
                }
            }
            bufferIndex += bufferCount;
        }
        if (bufferIndex != buffers.size()) {
            throw layoutMismatch(
                    String.format(
                            "has %d buffers but %d are expected", buffers.size(), bufferIndex));
        }
    }

    private DeserializationException layoutMismatch(String detail) {
        return new DeserializationException(
                String.format(
                        "Record batch %d of payload %d does not match the expected schema %s: it %s.",
                        batchCount + 1, payloadCount, expectedSchema, detail));
    }

    private void recycleBatch() {
        if (!released.get()) {
            root.clear();
        }
    }

    private void releaseOnFailure(Throwable failure) {
        try {
            release();
        } catch (Throwable t) {
            failure.addSuppressed(t);
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            LOG.debug("Releasing arrow batch decoder of partition {}.", context.partitionId());
            current = null;
            try {
                IOUtils.closeAll(root, arena);
            } catch (Exception e) {
                throw ExceptionUtils.rethrowUnchecked(e);
            }
        }
    }

    @Override
    public void close() {
        release();
    }

    /** 一个负载的读取状态。 */
    private class PayloadState {

        private final byte[] bytes;
        private final ReadChannel channel;

        private boolean framed;
        private boolean endOfStream;
        private int messageCount;

        private PayloadState(byte[] bytes) {
            this.bytes = bytes;
            this.channel = new ReadChannel(new ByteArrayReadableSeekableByteChannel(bytes));
        }

        private long remaining() {
            return bytes.length - channel.bytesRead();
        }

        /** 读取下一条消息的元数据,负载读完或遇到结束标记时返回 null。 */
        @Nullable
        private MessageMetadataResult nextMessage() throws IOException {
            long remaining = remaining();
            if (endOfStream) {
                if (remaining > 0) {
                    throw new DeserializationException(
                            String.format(
                                    "Found %d trailing bytes after end of stream in payload %d.",
                                    remaining, payloadCount));
                }
                return null;
            }
            if (remaining == 0) {
                if (framed) {
                    throw new DeserializationException(
                            String.format(
                                    "Arrow stream in payload %d ended without end-of-stream marker.",
                                    payloadCount));
                }
                return null;
            }

            checkAvailable(4, "message length prefix");
            int prefixLength = 4;
            int length = readIntAt(0);
            if (length == CONTINUATION_MARKER) {
                checkAvailable(8, "message length prefix");
                prefixLength = 8;
                length = readIntAt(4);
            }
            if (length == 0) {
                skip(prefixLength);
                endOfStream = true;
                return nextMessage();
            }
            if (length < 0) {
                throw new DeserializationException(
                        String.format(
                                "Invalid arrow message length %d in payload %d.",
                                length, payloadCount));
            }
            checkAvailable((long) prefixLength + length, "message metadata");

            MessageMetadataResult result = MessageSerializer.readMessage(channel);
            if (result == null) {
                throw new DeserializationException(
                        String.format(
                                "Unexpected end of arrow message in payload %d.", payloadCount));
            }
            messageCount++;
            return result;
        }

        private void checkAvailable(long needed, String what) {
            if (remaining() < needed) {
                throw new DeserializationException(
                        String.format(
                                "Truncated arrow payload %d: %s needs %d bytes but only %d remain.",
                                payloadCount, what, needed, remaining()));
            }
        }

        private int readIntAt(int offset) {
            return ByteBuffer.wrap(bytes, (int) channel.bytesRead() + offset, 4)
                    .order(ByteOrder.LITTLE_ENDIAN)
                    .getInt();
        }

        private void skip(int n) throws IOException {
            channel.readFully(ByteBuffer.allocate(n));
        }
    }
}
