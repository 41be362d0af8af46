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

package org.colbridge.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link DataType} and its subclasses. */
class DataTypesTest {

    @Test
    void testSqlStrings() {
        assertThat(DataTypes.INT().asSQLString()).isEqualTo("INT");
        assertThat(DataTypes.INT().notNull().asSQLString()).isEqualTo("INT NOT NULL");
        assertThat(DataTypes.STRING().asSQLString()).isEqualTo("STRING");
        assertThat(DataTypes.VARCHAR(10).asSQLString()).isEqualTo("VARCHAR(10)");
        assertThat(DataTypes.BYTES().asSQLString()).isEqualTo("BYTES");
        assertThat(DataTypes.DECIMAL(10, 2).asSQLString()).isEqualTo("DECIMAL(10, 2)");
        assertThat(DataTypes.TIMESTAMP(3).asSQLString()).isEqualTo("TIMESTAMP(3)");
        assertThat(DataTypes.TIMESTAMP_WITH_LOCAL_TIME_ZONE().notNull().asSQLString())
                .isEqualTo("TIMESTAMP(6) WITH LOCAL TIME ZONE NOT NULL");
    }

    @Test
    void testNullability() {
        DataType type = DataTypes.BIGINT();
        assertThat(type.isNullable()).isTrue();
        assertThat(type.notNull().isNullable()).isFalse();
        assertThat(type.notNull()).isNotEqualTo(type);
        assertThat(type.notNull().equalsIgnoreNullable(type)).isTrue();
        assertThat(type.notNull().nullable()).isEqualTo(type);
    }

    @Test
    void testInvalidParameters() {
        assertThatThrownBy(() -> new DecimalType(39, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecimalType(5, 6))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimestampType(10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CharType(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRowType() {
        RowType rowType =
                RowType.builder()
                        .field("id", DataTypes.INT().notNull())
                        .field("name", DataTypes.STRING(), "user name")
                        .build();

        assertThat(rowType.getFieldCount()).isEqualTo(2);
        assertThat(rowType.getFieldNames()).containsExactly("id", "name");
        assertThat(rowType.getTypeAt(0)).isEqualTo(DataTypes.INT().notNull());
        assertThat(rowType.getFieldIndex("name")).isEqualTo(1);
        assertThat(rowType.getFieldIndex("missing")).isEqualTo(-1);
        assertThat(rowType.getField("name").description()).isEqualTo("user name");
        assertThat(rowType.asSQLString())
                .isEqualTo("ROW<`id` INT NOT NULL, `name` STRING COMMENT 'user name'>");
    }

    @Test
    void testDuplicateFieldNames() {
        assertThatThrownBy(
                        () ->
                                RowType.of(
                                        new DataType[] {DataTypes.INT(), DataTypes.INT()},
                                        new String[] {"a", "a"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Found duplicates: [a]");
        assertThatThrownBy(
                        () ->
                                RowType.of(
                                        new DataType[] {DataTypes.INT()}, new String[] {" "}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTypeParameters() {
        assertThat(DataTypeChecks.getPrecision(DataTypes.DECIMAL(20, 4))).isEqualTo(20);
        assertThat(DataTypeChecks.getScale(DataTypes.DECIMAL(20, 4))).isEqualTo(4);
        assertThat(DataTypeChecks.getScale(DataTypes.INT())).isEqualTo(0);
        assertThat(DataTypeChecks.getPrecision(DataTypes.TIMESTAMP_LTZ_MILLIS())).isEqualTo(3);
        assertThat(DataTypeChecks.getLength(DataTypes.CHAR(8))).isEqualTo(8);
        assertThatThrownBy(() -> DataTypeChecks.getLength(DataTypes.INT()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
