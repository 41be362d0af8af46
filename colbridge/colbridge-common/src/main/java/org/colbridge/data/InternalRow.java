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

package org.colbridge.data;

import org.colbridge.annotation.Public;
import org.colbridge.types.DataType;

import javax.annotation.Nullable;

import java.io.Serializable;

import static org.colbridge.types.DataTypeChecks.getPrecision;
import static org.colbridge.types.DataTypeChecks.getScale;

/**
 * 行数据的内部表示:固定字段数、按位置访问的值序列,null 由 {@link #isNullAt(int)} 显式标记。
 *
 * <p>逻辑类型与内部值类型的对应关系:
 *
 * <ul>
 *   <li>{@code CHAR} / {@code VARCHAR} 对应 {@link BinaryString}
 *   <li>{@code BOOLEAN} 对应 {@code boolean}
 *   <li>{@code BINARY} / {@code VARBINARY} 对应 {@code byte[]}
 *   <li>{@code DECIMAL} 对应 {@link Decimal}
 *   <li>{@code TINYINT} / {@code SMALLINT} / {@code INT} / {@code BIGINT} 对应 {@code byte} /
 *       {@code short} / {@code int} / {@code long}
 *   <li>{@code FLOAT} / {@code DOUBLE} 对应 {@code float} / {@code double}
 *   <li>{@code DATE} 对应 {@code int},即自纪元起的天数
 *   <li>{@code TIMESTAMP} / {@code TIMESTAMP WITH LOCAL TIME ZONE} 对应 {@link Timestamp}
 * </ul>
 *
 * <p>实现可能是可复用的视图(例如列式批次上的行),需要跨迭代保留时应先拷贝。
 */
@Public
public interface InternalRow extends DataGetters {

    int getFieldCount();

    static Class<?> getDataClass(DataType type) {
        // ordered by type root definition
        switch (type.getTypeRoot()) {
            case CHAR:
            case VARCHAR:
                return BinaryString.class;
            case BOOLEAN:
                return Boolean.class;
            case BINARY:
            case VARBINARY:
                return byte[].class;
            case DECIMAL:
                return Decimal.class;
            case TINYINT:
                return Byte.class;
            case SMALLINT:
                return Short.class;
            case INTEGER:
            case DATE:
                return Integer.class;
            case BIGINT:
                return Long.class;
            case FLOAT:
                return Float.class;
            case DOUBLE:
                return Double.class;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
            case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
                return Timestamp.class;
            default:
                throw new IllegalArgumentException("Illegal type: " + type);
        }
    }

    /**
     * 为指定位置的字段创建访问器。
     *
     * <p>可空字段的访问器会先检查 null;非空字段直接读取。
     */
    static FieldGetter createFieldGetter(DataType fieldType, int fieldPos) {
        final FieldGetter fieldGetter;
        // ordered by type root definition
        switch (fieldType.getTypeRoot()) {
            case CHAR:
            case VARCHAR:
                fieldGetter = row -> row.getString(fieldPos);
                break;
            case BOOLEAN:
                fieldGetter = row -> row.getBoolean(fieldPos);
                break;
            case BINARY:
            case VARBINARY:
                fieldGetter = row -> row.getBinary(fieldPos);
                break;
            case DECIMAL:
                final int decimalPrecision = getPrecision(fieldType);
                final int decimalScale = getScale(fieldType);
                fieldGetter = row -> row.getDecimal(fieldPos, decimalPrecision, decimalScale);
                break;
            case TINYINT:
                fieldGetter = row -> row.getByte(fieldPos);
                break;
            case SMALLINT:
                fieldGetter = row -> row.getShort(fieldPos);
                break;
            case INTEGER:
            case DATE:
                fieldGetter = row -> row.getInt(fieldPos);
                break;
            case BIGINT:
                fieldGetter = row -> row.getLong(fieldPos);
                break;
            case FLOAT:
                fieldGetter = row -> row.getFloat(fieldPos);
                break;
            case DOUBLE:
                fieldGetter = row -> row.getDouble(fieldPos);
                break;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
            case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
                final int timestampPrecision = getPrecision(fieldType);
                fieldGetter = row -> row.getTimestamp(fieldPos, timestampPrecision);
                break;
            default:
                String msg =
                        String.format(
                                "type %s not support in %s",
                                fieldType.getTypeRoot().toString(), InternalRow.class.getName());
                throw new IllegalArgumentException(msg);
        }
        if (!fieldType.isNullable()) {
            return fieldGetter;
        }
        return row -> {
            if (row.isNullAt(fieldPos)) {
                return null;
            }
            return fieldGetter.getFieldOrNull(row);
        };
    }

    /** 读取行中某个字段的访问器。 */
    interface FieldGetter extends Serializable {
        @Nullable
        Object getFieldOrNull(InternalRow row);
    }
}
