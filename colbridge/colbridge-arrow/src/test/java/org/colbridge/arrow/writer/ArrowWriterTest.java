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

package org.colbridge.arrow.writer;

import org.colbridge.arrow.ArrowUtils;
import org.colbridge.data.BinaryString;
import org.colbridge.data.ConversionException;
import org.colbridge.data.Decimal;
import org.colbridge.data.GenericRow;
import org.colbridge.data.Timestamp;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ArrowWriter}. */
class ArrowWriterTest {

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
    void testWriteFinishReset() {
        RowType rowType =
                RowType.builder()
                        .field("name", DataTypes.STRING())
                        .field("amount", DataTypes.DECIMAL(5, 2))
                        .field("ts", DataTypes.TIMESTAMP(6))
                        .build();
        try (VectorSchemaRoot root =
                VectorSchemaRoot.create(ArrowUtils.toArrowSchema(rowType, "UTC"), allocator)) {
            ArrowWriter writer = ArrowWriter.create(root, rowType);
            writer.write(
                    GenericRow.of(
                            BinaryString.fromString("x"),
                            Decimal.fromBigDecimal(new BigDecimal("1.5"), 5, 2),
                            Timestamp.fromMicros(1_000_001L)));
            writer.write(GenericRow.of(null, null, null));
            writer.finish();

            assertThat(root.getRowCount()).isEqualTo(2);
            assertThat(((VarCharVector) root.getVector(0)).getObject(0).toString())
                    .isEqualTo("x");
            assertThat(((DecimalVector) root.getVector(1)).getObject(0))
                    .isEqualTo(new BigDecimal("1.50"));
            assertThat(((TimeStampVector) root.getVector(2)).get(0)).isEqualTo(1_000_001L);
            assertThat(root.getVector(0).isNull(1)).isTrue();

            writer.reset();
            assertThat(writer.getRowCount()).isZero();
            assertThat(root.getRowCount()).isZero();
        }
    }

    @Test
    void testDecimalOverflow() {
        RowType rowType = RowType.builder().field("amount", DataTypes.DECIMAL(5, 2)).build();
        try (VectorSchemaRoot root =
                VectorSchemaRoot.create(ArrowUtils.toArrowSchema(rowType, "UTC"), allocator)) {
            ArrowWriter writer = ArrowWriter.create(root, rowType);
            Decimal tooLarge = Decimal.fromBigDecimal(new BigDecimal("123456.78"), 10, 2);

            assertThatThrownBy(() -> writer.write(GenericRow.of(tooLarge)))
                    .isInstanceOf(ConversionException.class)
                    .hasMessageContaining("'amount'");
        }
    }

    @Test
    void testNullInNotNullField() {
        RowType rowType = RowType.builder().field("id", DataTypes.INT().notNull()).build();
        try (VectorSchemaRoot root =
                VectorSchemaRoot.create(ArrowUtils.toArrowSchema(rowType, "UTC"), allocator)) {
            ArrowWriter writer = ArrowWriter.create(root, rowType);

            assertThatThrownBy(() -> writer.write(GenericRow.of((Object) null)))
                    .isInstanceOf(ConversionException.class)
                    .hasMessageContaining("non-nullable field 'id'");
        }
    }
}
