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

import org.colbridge.data.BinaryString;
import org.colbridge.data.InternalRow;
import org.colbridge.data.columnar.BytesColumnVector;
import org.colbridge.data.columnar.ColumnVector;
import org.colbridge.data.columnar.ColumnarRow;
import org.colbridge.data.columnar.ColumnarRowIterator;
import org.colbridge.data.columnar.IntColumnVector;
import org.colbridge.data.columnar.VectorizedColumnBatch;
import org.colbridge.types.DataType;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;
import org.colbridge.utils.InternalRowUtils;

import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link RecordReaderIterator} over {@link ColumnarRowIterator} batches. */
class RecordReaderIteratorTest {

    private static final RowType ROW_TYPE =
            RowType.of(
                    new DataType[] {DataTypes.INT(), DataTypes.STRING()},
                    new String[] {"id", "name"});

    @Test
    void testIteratesAllBatchesAndReleasesEach() throws Exception {
        List<Integer> released = new ArrayList<>();
        TestReader reader =
                new TestReader(
                        Arrays.asList(new int[] {1, 2}, new int[] {}, new int[] {3}), released);

        List<InternalRow> rows = new ArrayList<>();
        try (RecordReaderIterator<InternalRow> iterator = new RecordReaderIterator<>(reader)) {
            while (iterator.hasNext()) {
                rows.add(InternalRowUtils.copyRow(iterator.next(), ROW_TYPE));
            }
            assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
        }

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).getInt(0)).isEqualTo(1);
        assertThat(rows.get(2).getString(1)).isEqualTo(BinaryString.fromString("v3"));
        assertThat(rows.get(1).isNullAt(1)).isTrue();
        assertThat(released).containsExactly(0, 1, 2);
        assertThat(reader.closed).isTrue();
    }

    @Test
    void testCloseReleasesCurrentBatch() throws Exception {
        List<Integer> released = new ArrayList<>();
        TestReader reader =
                new TestReader(Arrays.asList(new int[] {1, 2}, new int[] {3}), released);

        RecordReaderIterator<InternalRow> iterator = new RecordReaderIterator<>(reader);
        assertThat(iterator.next().getInt(0)).isEqualTo(1);
        iterator.close();

        assertThat(released).containsExactly(0);
        assertThat(reader.closed).isTrue();
        assertThat(iterator.hasNext()).isFalse();
    }

    @Test
    void testRuntimeExceptionIsNotWrapped() {
        RecordReader<InternalRow> failing =
                new RecordReader<InternalRow>() {
                    @Nullable
                    @Override
                    public RecordIterator<InternalRow> readBatch() {
                        throw new IllegalStateException("broken");
                    }

                    @Override
                    public void close() {}
                };
        Iterator<InternalRow> iterator = failing.toCloseableIterator();
        assertThatThrownBy(iterator::hasNext)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("broken");
    }

    /** Emits one columnar batch per int array; even ids have a null name. */
    private static class TestReader implements RecordReader<InternalRow> {

        private final Iterator<int[]> batches;
        private final List<Integer> released;
        private int batchIndex;
        private boolean closed;

        private TestReader(List<int[]> batches, List<Integer> released) {
            this.batches = batches.iterator();
            this.released = released;
        }

        @Nullable
        @Override
        public RecordIterator<InternalRow> readBatch() {
            if (!batches.hasNext()) {
                return null;
            }
            int[] ids = batches.next();
            IntColumnVector idVector =
                    new IntColumnVector() {
                        @Override
                        public int getInt(int i) {
                            return ids[i];
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return false;
                        }
                    };
            BytesColumnVector nameVector =
                    new BytesColumnVector() {
                        @Override
                        public Bytes getBytes(int i) {
                            byte[] bytes = ("v" + ids[i]).getBytes(StandardCharsets.UTF_8);
                            return new Bytes(bytes, 0, bytes.length);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return ids[i] % 2 == 0;
                        }
                    };
            VectorizedColumnBatch batch =
                    new VectorizedColumnBatch(new ColumnVector[] {idVector, nameVector});
            batch.setNumRows(ids.length);
            int index = batchIndex++;
            return new ColumnarRowIterator(new ColumnarRow(batch), () -> released.add(index));
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
