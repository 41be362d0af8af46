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

import org.colbridge.types.DataField;
import org.colbridge.types.DataType;
import org.colbridge.types.DecimalType;
import org.colbridge.types.RowType;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 在外部行({@code Object[]},字段值为普通 Java 对象)与 {@link InternalRow} 之间转换。
 *
 * <p>外部值与字段类型的对应关系:
 *
 * <ul>
 *   <li>整数类型接受不超过目标宽度的 {@link Byte}/{@link Short}/{@link Integer}/{@link Long}
 *   <li>{@code FLOAT} 接受 {@link Float};{@code DOUBLE} 接受 {@link Float} 和 {@link Double}
 *   <li>{@code DECIMAL} 接受 {@link BigDecimal}、{@link BigInteger} 和整数
 *   <li>字符串类型接受 {@link String};二进制类型接受 {@code byte[]}
 *   <li>{@code DATE} 接受 {@link LocalDate}
 *   <li>{@code TIMESTAMP} 接受 {@link LocalDateTime}
 *   <li>{@code TIMESTAMP WITH LOCAL TIME ZONE} 接受 {@link Instant},以及按会话时区解释的
 *       {@link LocalDateTime}
 * </ul>
 *
 * <p>已经是内部数据结构的值原样保留。无法表示的值抛出 {@link ConversionException}。
 */
public class RowConverter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RowType rowType;
    private final ZoneId sessionZone;

    public RowConverter(RowType rowType, ZoneId sessionZone) {
        this.rowType = checkNotNull(rowType);
        this.sessionZone = checkNotNull(sessionZone);
    }

    public RowType rowType() {
        return rowType;
    }

    public InternalRow toInternal(Object[] external) {
        List<DataField> fields = rowType.getFields();
        if (external == null || external.length != fields.size()) {
            throw new ConversionException(
                    String.format(
                            "Row arity %s does not match schema %s.",
                            external == null ? "null" : String.valueOf(external.length),
                            rowType.asSQLString()));
        }
        GenericRow row = new GenericRow(external.length);
        for (int i = 0; i < external.length; i++) {
            DataField field = fields.get(i);
            row.setField(i, toInternal(external[i], field));
        }
        return row;
    }

    public Object[] toExternal(InternalRow row) {
        Object[] external = new Object[rowType.getFieldCount()];
        for (int i = 0; i < external.length; i++) {
            DataType type = rowType.getTypeAt(i);
            Object value = InternalRow.createFieldGetter(type, i).getFieldOrNull(row);
            external[i] = toExternal(value, type);
        }
        return external;
    }

    private Object toInternal(Object value, DataField field) {
        if (value == null) {
            return null;
        }
        DataType type = field.type();
        Object converted;
        try {
            converted = convert(value, type);
        } catch (ArithmeticException e) {
            throw mismatch(value, field, e);
        }
        if (converted == null) {
            throw mismatch(value, field, null);
        }
        return converted;
    }

    private Object convert(Object value, DataType type) {
        switch (type.getTypeRoot()) {
            case BOOLEAN:
                return value instanceof Boolean ? value : null;
            case TINYINT:
                return value instanceof Byte ? value : null;
            case SMALLINT:
                if (value instanceof Short) {
                    return value;
                }
                return value instanceof Byte ? (short) (byte) value : null;
            case INTEGER:
                if (value instanceof Integer) {
                    return value;
                }
                return value instanceof Byte || value instanceof Short
                        ? ((Number) value).intValue()
                        : null;
            case BIGINT:
                if (value instanceof Long) {
                    return value;
                }
                return value instanceof Byte || value instanceof Short || value instanceof Integer
                        ? ((Number) value).longValue()
                        : null;
            case FLOAT:
                return value instanceof Float ? value : null;
            case DOUBLE:
                if (value instanceof Double) {
                    return value;
                }
                return value instanceof Float ? ((Float) value).doubleValue() : null;
            case DECIMAL:
                return toDecimal(value, (DecimalType) type);
            case CHAR:
            case VARCHAR:
                if (value instanceof BinaryString) {
                    return value;
                }
                return value instanceof String ? BinaryString.fromString((String) value) : null;
            case BINARY:
            case VARBINARY:
                return value instanceof byte[] ? value : null;
            case DATE:
                if (value instanceof LocalDate) {
                    return Math.toIntExact(((LocalDate) value).toEpochDay());
                }
                return value instanceof Integer ? value : null;
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                if (value instanceof Timestamp) {
                    return value;
                } else if (value instanceof LocalDateTime) {
                    return Timestamp.fromLocalDateTime((LocalDateTime) value);
                }
                return null;
            case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
                if (value instanceof Timestamp) {
                    return value;
                } else if (value instanceof Instant) {
                    return Timestamp.fromInstant((Instant) value);
                } else if (value instanceof LocalDateTime) {
                    return Timestamp.fromInstant(
                            ((LocalDateTime) value).atZone(sessionZone).toInstant());
                }
                return null;
            default:
                throw new UnsupportedOperationException("Unsupported type: " + type);
        }
    }

    private static Decimal toDecimal(Object value, DecimalType type) {
        if (value instanceof Decimal) {
            return (Decimal) value;
        }
        BigDecimal bigDecimal;
        if (value instanceof BigDecimal) {
            bigDecimal = (BigDecimal) value;
        } else if (value instanceof BigInteger) {
            bigDecimal = new BigDecimal((BigInteger) value);
        } else if (value instanceof Byte
                || value instanceof Short
                || value instanceof Integer
                || value instanceof Long) {
            bigDecimal = BigDecimal.valueOf(((Number) value).longValue());
        } else {
            return null;
        }
        Decimal decimal = Decimal.fromBigDecimal(bigDecimal, type.getPrecision(), type.getScale());
        if (decimal == null) {
            throw new ArithmeticException(
                    String.format("%s does not fit into %s", bigDecimal, type.asSQLString()));
        }
        return decimal;
    }

    private Object toExternal(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        switch (type.getTypeRoot()) {
            case CHAR:
            case VARCHAR:
                return value.toString();
            case DECIMAL:
                return ((Decimal) value).toBigDecimal();
            case DATE:
                return LocalDate.ofEpochDay((Integer) value);
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return ((Timestamp) value).toLocalDateTime();
            case TIMESTAMP_WITH_LOCAL_TIME_ZONE:
                return ((Timestamp) value).toInstant();
            default:
                return value;
        }
    }

    private static ConversionException mismatch(Object value, DataField field, Throwable cause) {
        String message =
                String.format(
                        "Cannot convert value '%s' of class %s to field '%s' of type %s.",
                        value, value.getClass().getName(), field.name(), field.type());
        return cause == null
                ? new ConversionException(message)
                : new ConversionException(message + " " + cause.getMessage(), cause);
    }
}
