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

import org.colbridge.data.BinaryString;
import org.colbridge.data.Decimal;
import org.colbridge.data.GenericRow;
import org.colbridge.data.InternalRow;
import org.colbridge.data.Timestamp;
import org.colbridge.reader.RecordReader;
import org.colbridge.task.LocalTaskContext;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;
import org.colbridge.utils.CloseableIterator;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ArrowBatchDecoder}. */
class ArrowBatchDecoderTest {

    private static final RowType ROW_TYPE =
            RowType.builder()
                    .field("id", DataTypes.INT())
                    .field("name", DataTypes.STRING())
                    .build();

    private static final List<InternalRow> ROWS =
            Arrays.<InternalRow>asList(
                    GenericRow.of(1, BinaryString.fromString("a")),
                    GenericRow.of(2, null),
                    GenericRow.of(3, BinaryString.fromString("c")));

    private BufferAllocator allocator;

    @BeforeEach
    void before() {
        allocator = new RootAllocator();
    }

    @AfterEach
    void after() {
        assertThat(allocator.getChildAllocators()).isEmpty();
        allocator.close();
    }

    @Test
    void testThreeRowsInTwoBatches() throws Exception {
        List<byte[]> batches = ArrowTestUtils.encodeBatches(ROWS, ROW_TYPE, 2, allocator);
        assertThat(batches).hasSize(2);

        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        List<InternalRow> decoded = ArrowTestUtils.decode(stream, ROW_TYPE, allocator);

        assertThat(decoded).containsExactlyElementsOf(ROWS);
        assertThat(decoded.get(1).isNullAt(1)).isTrue();
    }

    @Test
    void testBatchAtATime() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        LocalTaskContext context = new LocalTaskContext(0, 0);
        ArrowBatchDecoder decoder =
                new ArrowBatchDecoder(
                        Collections.singletonList(stream).iterator(),
                        ROW_TYPE,
                        allocator,
                        Long.MAX_VALUE,
                        context);

        RecordReader.RecordIterator<InternalRow> first = decoder.readBatch();
        assertThat(first).isNotNull();
        assertThat(first.next().getInt(0)).isEqualTo(1);
        assertThat(first.next().getInt(0)).isEqualTo(2);
        assertThat(first.next()).isNull();
        first.releaseBatch();

        RecordReader.RecordIterator<InternalRow> second = decoder.readBatch();
        assertThat(second).isNotNull();
        InternalRow row = second.next();
        assertThat(row.getInt(0)).isEqualTo(3);
        assertThat(row.getString(1).toString()).isEqualTo("c");
        assertThat(second.next()).isNull();
        second.releaseBatch();

        assertThat(decoder.readBatch()).isNull();
        assertThat(allocator.getChildAllocators()).isEmpty();
        decoder.close();
    }

    @Test
    void testRoundTripAllTypes() throws Exception {
        RowType rowType =
                RowType.builder()
                        .field("b", DataTypes.BOOLEAN())
                        .field("t", DataTypes.TINYINT())
                        .field("s", DataTypes.SMALLINT())
                        .field("i", DataTypes.INT().notNull())
                        .field("l", DataTypes.BIGINT())
                        .field("f", DataTypes.FLOAT())
                        .field("d", DataTypes.DOUBLE())
                        .field("dec", DataTypes.DECIMAL(10, 2))
                        .field("c", DataTypes.CHAR(3))
                        .field("str", DataTypes.STRING())
                        .field("bin", DataTypes.BYTES())
                        .field("date", DataTypes.DATE())
                        .field("ts0", DataTypes.TIMESTAMP(0))
                        .field("ts3", DataTypes.TIMESTAMP(3))
                        .field("ts9", DataTypes.TIMESTAMP(9))
                        .field("ltz6", DataTypes.TIMESTAMP_WITH_LOCAL_TIME_ZONE(6))
                        .build();

        List<InternalRow> rows = new ArrayList<>();
        rows.add(
                GenericRow.of(
                        true,
                        (byte) -1,
                        (short) 300,
                        42,
                        Long.MAX_VALUE,
                        1.5f,
                        -2.25d,
                        Decimal.fromBigDecimal(new BigDecimal("12345678.91"), 10, 2),
                        BinaryString.fromString("abc"),
                        BinaryString.fromString("中文"),
                        new byte[] {0, 1, 2},
                        19000,
                        Timestamp.fromEpochMillis(-5000L),
                        Timestamp.fromEpochMillis(1700000000123L),
                        Timestamp.fromEpochMillis(1700000000123L, 456789),
                        Timestamp.fromMicros(1700000000123456L)));
        Object[] nulls = new Object[rowType.getFieldCount()];
        nulls[3] = 0;
        rows.add(GenericRow.of(nulls));

        byte[] stream = ArrowTestUtils.encodeStream(rows, rowType, 10, allocator);
        List<InternalRow> decoded = ArrowTestUtils.decode(stream, rowType, allocator);

        assertThat(decoded).containsExactlyElementsOf(rows);
    }

    @Test
    void testBarePayloads() throws Exception {
        List<byte[]> batches = ArrowTestUtils.encodeBatches(ROWS, ROW_TYPE, 1, allocator);
        assertThat(batches).hasSize(3);

        List<InternalRow> decoded = ArrowTestUtils.decode(batches, ROW_TYPE, allocator);
        assertThat(decoded).containsExactlyElementsOf(ROWS);

        // 多条裸消息拼接在一个负载中
        ByteArrayOutputStream concatenated = new ByteArrayOutputStream();
        for (byte[] batch : batches) {
            concatenated.write(batch);
        }
        assertThat(ArrowTestUtils.decode(concatenated.toByteArray(), ROW_TYPE, allocator))
                .containsExactlyElementsOf(ROWS);
    }

    @Test
    void testEmptyStream() throws Exception {
        byte[] stream =
                ArrowTestUtils.encodeStream(
                        Collections.<InternalRow>emptyList(), ROW_TYPE, 2, allocator);
        assertThat(ArrowTestUtils.decode(stream, ROW_TYPE, allocator)).isEmpty();
        assertThat(
                        ArrowTestUtils.decode(
                                Collections.<byte[]>emptyList(), ROW_TYPE, allocator))
                .isEmpty();
    }

    @Test
    void testMissingTerminator() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        byte[] truncated = Arrays.copyOf(stream, stream.length - 4);

        assertThatThrownBy(() -> ArrowTestUtils.decode(truncated, ROW_TYPE, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("end-of-stream");
    }

    @Test
    void testTruncatedMessage() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        byte[] truncated = Arrays.copyOf(stream, stream.length - 20);

        assertThatThrownBy(() -> ArrowTestUtils.decode(truncated, ROW_TYPE, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void testTrailingBytesAfterTerminator() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        byte[] padded = Arrays.copyOf(stream, stream.length + 3);

        assertThatThrownBy(() -> ArrowTestUtils.decode(padded, ROW_TYPE, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("trailing bytes");
    }

    @Test
    void testGarbageBytes() {
        byte[] garbage = new byte[64];
        for (int i = 0; i < garbage.length; i++) {
            garbage[i] = (byte) (i * 31 + 7);
        }

        assertThatThrownBy(() -> ArrowTestUtils.decode(garbage, ROW_TYPE, allocator))
                .isInstanceOf(DeserializationException.class);
    }

    @Test
    void testSchemaMismatch() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        RowType other =
                RowType.builder()
                        .field("id", DataTypes.BIGINT())
                        .field("name", DataTypes.STRING())
                        .build();

        assertThatThrownBy(() -> ArrowTestUtils.decode(stream, other, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void testBareBatchLayoutMismatch() throws Exception {
        RowType longType = RowType.builder().field("v", DataTypes.BIGINT()).build();
        List<byte[]> longBatches =
                ArrowTestUtils.encodeBatches(
                        Arrays.<InternalRow>asList(GenericRow.of(5000000000L), GenericRow.of(7L)),
                        longType,
                        0,
                        allocator);

        RowType intType = RowType.builder().field("v", DataTypes.INT()).build();
        assertThatThrownBy(() -> ArrowTestUtils.decode(longBatches, intType, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("data buffer");

        RowType stringType = RowType.builder().field("v", DataTypes.STRING()).build();
        List<byte[]> stringBatches =
                ArrowTestUtils.encodeBatches(
                        Arrays.<InternalRow>asList(
                                GenericRow.of(BinaryString.fromString("x")),
                                GenericRow.of(BinaryString.fromString("y"))),
                        stringType,
                        0,
                        allocator);
        assertThatThrownBy(() -> ArrowTestUtils.decode(stringBatches, longType, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("does not match");

        // 字段数不一致
        assertThatThrownBy(() -> ArrowTestUtils.decode(longBatches, ROW_TYPE, allocator))
                .isInstanceOf(DeserializationException.class)
                .hasMessageContaining("field nodes");
    }

    @Test
    void testCancellationAfterFirstBatchReleasesOnce() throws Exception {
        byte[] stream = ArrowTestUtils.encodeStream(ROWS, ROW_TYPE, 2, allocator);
        LocalTaskContext context = new LocalTaskContext(0, 0);
        CloseableIterator<InternalRow> iterator =
                ArrowBatchDecoder.fromPayloadIterator(
                        Collections.singletonList(stream).iterator(),
                        ROW_TYPE,
                        allocator,
                        context);

        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.next().getInt(0)).isEqualTo(1);
        assertThat(allocator.getAllocatedMemory()).isGreaterThan(0);

        context.markInterrupted();
        context.markTaskCompleted(null);
        assertThat(allocator.getChildAllocators()).isEmpty();
        assertThat(allocator.getAllocatedMemory()).isZero();

        // 迭代器关闭再次释放不会出错
        iterator.close();
        assertThat(allocator.getChildAllocators()).isEmpty();
    }
}
