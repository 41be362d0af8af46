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
import org.colbridge.data.ConversionException;
import org.colbridge.data.GenericRow;
import org.colbridge.data.InternalRow;
import org.colbridge.task.LocalTaskContext;
import org.colbridge.task.TaskKilledException;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.ipc.ReadChannel;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.ipc.message.MessageSerializer;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ArrowBatchEncoder}. */
class ArrowBatchEncoderTest {

    private static final RowType ROW_TYPE =
            RowType.builder()
                    .field("id", DataTypes.INT().notNull())
                    .field("name", DataTypes.STRING())
                    .build();

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

    private static List<InternalRow> rows(int count) {
        List<InternalRow> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(GenericRow.of(i, BinaryString.fromString("name-" + i)));
        }
        return rows;
    }

    private int rowCountOf(byte[] batch) throws IOException {
        ReadChannel channel = new ReadChannel(new ByteArrayReadableSeekableByteChannel(batch));
        try (ArrowRecordBatch recordBatch =
                MessageSerializer.deserializeRecordBatch(channel, allocator)) {
            return recordBatch.getLength();
        }
    }

    @Test
    void testBatchesAreBounded() throws Exception {
        List<byte[]> batches = ArrowTestUtils.encodeBatches(rows(25), ROW_TYPE, 10, allocator);

        assertThat(batches).hasSize(3);
        assertThat(rowCountOf(batches.get(0))).isEqualTo(10);
        assertThat(rowCountOf(batches.get(1))).isEqualTo(10);
        assertThat(rowCountOf(batches.get(2))).isEqualTo(5);
    }

    @Test
    void testNonPositiveLimitProducesOneBatch() throws Exception {
        List<byte[]> unlimited = ArrowTestUtils.encodeBatches(rows(25), ROW_TYPE, 0, allocator);
        assertThat(unlimited).hasSize(1);
        assertThat(rowCountOf(unlimited.get(0))).isEqualTo(25);

        List<byte[]> negative = ArrowTestUtils.encodeBatches(rows(7), ROW_TYPE, -1, allocator);
        assertThat(negative).hasSize(1);
        assertThat(rowCountOf(negative.get(0))).isEqualTo(7);
    }

    @Test
    void testEmptyInputProducesNoBatchesAndReleases() {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        Collections.<InternalRow>emptyIterator(),
                        ROW_TYPE,
                        10,
                        "UTC",
                        allocator,
                        context);

        assertThat(allocator.getChildAllocators()).hasSize(1);
        assertThat(iterator.hasNext()).isFalse();
        assertThat(allocator.getChildAllocators()).isEmpty();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testReleaseHappensOnceAcrossPaths() throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        rows(3).iterator(), ROW_TYPE, 2, "UTC", allocator, context);

        while (iterator.hasNext()) {
            iterator.next();
        }
        assertThat(allocator.getChildAllocators()).isEmpty();
        assertThat(iterator.hasNext()).isFalse();

        // 任务结束回调再次释放不会出错
        context.markTaskCompleted(null);
        assertThat(allocator.getAllocatedMemory()).isZero();
    }

    @Test
    void testAbandonedIterationReleasedOnTaskCompletion() throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        rows(10).iterator(), ROW_TYPE, 2, "UTC", allocator, context);

        iterator.next();
        assertThat(allocator.getChildAllocators()).hasSize(1);

        context.markTaskCompleted(null);
        assertThat(allocator.getChildAllocators()).isEmpty();
        assertThat(iterator.hasNext()).isFalse();
    }

    @Test
    void testConversionErrorResetsWriter() throws Exception {
        List<InternalRow> input = new ArrayList<>();
        input.add(GenericRow.of(1, BinaryString.fromString("a")));
        input.add(GenericRow.of(null, BinaryString.fromString("b")));
        input.add(GenericRow.of(3, BinaryString.fromString("c")));

        LocalTaskContext context = new LocalTaskContext(0, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        input.iterator(), ROW_TYPE, 0, "UTC", allocator, context);

        assertThatThrownBy(iterator::next)
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("'id'");

        // 写入器已经复位,剩余的行从一个空批次开始写
        byte[] rest = iterator.next();
        assertThat(rowCountOf(rest)).isEqualTo(1);

        context.markTaskCompleted(null);
    }

    @Test
    void testTypeMismatchIsConversionError() throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        Collections.<InternalRow>singletonList(GenericRow.of("1", null))
                                .iterator(),
                        ROW_TYPE,
                        0,
                        "UTC",
                        allocator,
                        context);

        assertThatThrownBy(iterator::next)
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("'id'")
                .hasCauseInstanceOf(ClassCastException.class);
        context.markTaskCompleted(null);
    }

    @Test
    void testKilledTaskStops() throws Exception {
        LocalTaskContext context = new LocalTaskContext(2, 0);
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        rows(10).iterator(), ROW_TYPE, 2, "UTC", allocator, context);

        iterator.next();
        context.markInterrupted();
        assertThatThrownBy(iterator::next).isInstanceOf(TaskKilledException.class);

        context.markTaskCompleted(null);
        assertThat(allocator.getChildAllocators()).isEmpty();
    }
}
