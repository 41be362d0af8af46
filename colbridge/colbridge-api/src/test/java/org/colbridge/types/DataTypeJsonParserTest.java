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

/** Tests for {@link DataTypeJsonParser}. */
class DataTypeJsonParserTest {

    @Test
    void testAtomicTypes() {
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("INT NOT NULL"))
                .isEqualTo(DataTypes.INT().notNull());
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("integer"))
                .isEqualTo(DataTypes.INT());
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("DECIMAL(10, 2)"))
                .isEqualTo(DataTypes.DECIMAL(10, 2));
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("VARCHAR(5) NOT NULL"))
                .isEqualTo(DataTypes.VARCHAR(5).notNull());
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("STRING"))
                .isEqualTo(DataTypes.STRING());
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("BYTES"))
                .isEqualTo(DataTypes.BYTES());
        assertThat(DataTypeJsonParser.parseAtomicTypeSQLString("TIMESTAMP(3)"))
                .isEqualTo(DataTypes.TIMESTAMP(3));
        assertThat(
                        DataTypeJsonParser.parseAtomicTypeSQLString(
                                "TIMESTAMP(9) WITH LOCAL TIME ZONE"))
                .isEqualTo(DataTypes.TIMESTAMP_WITH_LOCAL_TIME_ZONE(9));
    }

    @Test
    void testRowTypeJsonRoundTrip() {
        RowType rowType =
                RowType.builder()
                        .field("id", DataTypes.INT().notNull())
                        .field("name", DataTypes.STRING(), "it's a name")
                        .field("price", DataTypes.DECIMAL(12, 3))
                        .field("ts", DataTypes.TIMESTAMP_LTZ_MILLIS())
                        .field("payload", DataTypes.VARBINARY(16))
                        .build();

        String json = rowType.toJson();
        assertThat(json).startsWith("{\"type\":\"ROW\",\"fields\":[");
        assertThat(DataTypeJsonParser.parseRowType(json)).isEqualTo(rowType);
    }

    @Test
    void testMissingIdUsesPosition() {
        RowType rowType =
                DataTypeJsonParser.parseRowType(
                        "{\"type\":\"ROW\",\"fields\":[{\"name\":\"a\",\"type\":\"BIGINT\"}]}");
        assertThat(rowType.getFields().get(0).id()).isEqualTo(0);
        assertThat(rowType.getTypeAt(0)).isEqualTo(DataTypes.BIGINT());
    }

    @Test
    void testInvalidJson() {
        assertThatThrownBy(() -> DataTypeJsonParser.parseRowType("{not json"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataTypeJsonParser.parseRowType("\"INT\""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected a ROW type");
        assertThatThrownBy(() -> DataTypeJsonParser.parseAtomicTypeSQLString("GEOMETRY"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported data type");
    }
}
