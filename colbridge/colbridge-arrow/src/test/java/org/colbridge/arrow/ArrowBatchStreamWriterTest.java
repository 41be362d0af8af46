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
import org.colbridge.data.GenericRow;
import org.colbridge.data.InternalRow;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link ArrowBatchStreamWriter}. */
class ArrowBatchStreamWriterTest {

    private static final RowType ROW_TYPE =
            RowType.builder()
                    .field("id", DataTypes.INT())
                    .field("name", DataTypes.STRING())
                    .build();

    private BufferAllocator allocator;

    @BeforeEach
    void before() {
        allocator = new RootAllocator();
    }

    @AfterEach
    void after() {
        allocator.close();
    }

    @Test
    void testSchemaFirstAndTerminatorLast() throws Exception {
        TrackingOutputStream out = new TrackingOutputStream();
        ArrowBatchStreamWriter writer = new ArrowBatchStreamWriter(ROW_TYPE, out, "UTC");

        byte[] header = out.toByteArray();
        assertThat(header.length).isGreaterThan(8);
        // 0xFFFFFFFF 续接标记开头
        assertThat(Arrays.copyOf(header, 4))
                .containsExactly((byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF);

        writer.writeBatches(Collections.<byte[]>emptyIterator());
        writer.end();

        byte[] stream = out.toByteArray();
        assertThat(stream.length).isEqualTo(header.length + 4);
        assertThat(Arrays.copyOfRange(stream, stream.length - 4, stream.length))
                .containsExactly(0, 0, 0, 0);
        assertThat(out.closed).isFalse();
        assertThat(out.flushed).isTrue();
    }

    @Test
    void testBatchesWrittenVerbatimInOrder() throws Exception {
        byte[] first = new byte[] {1, 2, 3};
        byte[] second = new byte[] {4, 5};
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ArrowBatchStreamWriter writer = new ArrowBatchStreamWriter(ROW_TYPE, out, "UTC");
        int headerLength = out.size();

        writer.writeBatches(Arrays.asList(first, second).iterator());

        byte[] stream = out.toByteArray();
        assertThat(Arrays.copyOfRange(stream, headerLength, stream.length))
                .containsExactly(1, 2, 3, 4, 5);
        assertThat(writer.getBatchCount()).isEqualTo(2);
    }

    @Test
    void testReadableByArrowStreamReader() throws Exception {
        List<InternalRow> rows =
                Arrays.<InternalRow>asList(
                        GenericRow.of(1, BinaryString.fromString("a")),
                        GenericRow.of(2, null),
                        GenericRow.of(3, BinaryString.fromString("c")));
        byte[] stream = ArrowTestUtils.encodeStream(rows, ROW_TYPE, 2, allocator);

        try (ArrowStreamReader reader =
                new ArrowStreamReader(new ByteArrayInputStream(stream), allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            assertThat(root.getSchema().getFields()).hasSize(2);

            assertThat(reader.loadNextBatch()).isTrue();
            assertThat(root.getRowCount()).isEqualTo(2);
            assertThat(((IntVector) root.getVector("id")).get(1)).isEqualTo(2);
            assertThat(root.getVector("name").isNull(1)).isTrue();

            assertThat(reader.loadNextBatch()).isTrue();
            assertThat(root.getRowCount()).isEqualTo(1);
            assertThat(((VarCharVector) root.getVector("name")).getObject(0).toString())
                    .isEqualTo("c");

            assertThat(reader.loadNextBatch()).isFalse();
        }
    }

    private static class TrackingOutputStream extends ByteArrayOutputStream {

        private boolean closed;
        private boolean flushed;

        @Override
        public void flush() {
            flushed = true;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
