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

import org.colbridge.types.BigIntType;
import org.colbridge.types.BinaryType;
import org.colbridge.types.BooleanType;
import org.colbridge.types.CharType;
import org.colbridge.types.DataField;
import org.colbridge.types.DataType;
import org.colbridge.types.DataTypeVisitor;
import org.colbridge.types.DateType;
import org.colbridge.types.DecimalType;
import org.colbridge.types.DoubleType;
import org.colbridge.types.FloatType;
import org.colbridge.types.IntType;
import org.colbridge.types.LocalZonedTimestampType;
import org.colbridge.types.RowType;
import org.colbridge.types.SmallIntType;
import org.colbridge.types.TimestampType;
import org.colbridge.types.TinyIntType;
import org.colbridge.types.VarBinaryType;
import org.colbridge.types.VarCharType;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link RowType} 与 Arrow {@link Schema} 之间的类型映射。
 *
 * <p>映射规则:
 *
 * <ul>
 *   <li>CHAR / VARCHAR 映射为 Utf8,BINARY / VARBINARY 映射为 Binary
 *   <li>DATE 映射为 Date(DAY),取值为自纪元起的天数
 *   <li>TIMESTAMP 映射为不带时区的 Timestamp;TIMESTAMP WITH LOCAL TIME ZONE 映射为带会话时区的
 *       Timestamp,两者的时间单位都由精度决定
 * </ul>
 *
 * <p>嵌套类型不支持,会抛出 {@link UnsupportedOperationException}。
 */
public class ArrowUtils {

    private ArrowUtils() {}

    public static Schema toArrowSchema(RowType rowType, String timeZoneId) {
        List<Field> fields = new ArrayList<>(rowType.getFieldCount());
        for (DataField field : rowType.getFields()) {
            fields.add(toArrowField(field.name(), field.type(), timeZoneId));
        }
        return new Schema(fields);
    }

    public static Field toArrowField(String fieldName, DataType dataType, String timeZoneId) {
        ArrowType arrowType = dataType.accept(new ArrowTypeVisitor(timeZoneId));
        FieldType fieldType = new FieldType(dataType.isNullable(), arrowType, null);
        return new Field(fieldName, fieldType, null);
    }

    /** 根据时间戳精度选择 Arrow 时间单位:0 为秒,1-3 为毫秒,4-6 为微秒,7-9 为纳秒。 */
    public static TimeUnit timeUnitForPrecision(int precision) {
        if (precision == 0) {
            return TimeUnit.SECOND;
        } else if (precision <= 3) {
            return TimeUnit.MILLISECOND;
        } else if (precision <= 6) {
            return TimeUnit.MICROSECOND;
        } else {
            return TimeUnit.NANOSECOND;
        }
    }

    /**
     * 比较两个 Arrow schema 是否兼容:字段数量、字段名和 Arrow 类型都相同。
     *
     * <p>带时区时间戳的时区元数据不参与比较,只比较时间单位以及是否带时区。
     */
    public static boolean schemaEquals(Schema expected, Schema actual) {
        List<Field> expectedFields = expected.getFields();
        List<Field> actualFields = actual.getFields();
        if (expectedFields.size() != actualFields.size()) {
            return false;
        }
        for (int i = 0; i < expectedFields.size(); i++) {
            Field e = expectedFields.get(i);
            Field a = actualFields.get(i);
            if (!e.getName().equals(a.getName()) || !typeEquals(e.getType(), a.getType())) {
                return false;
            }
        }
        return true;
    }

    private static boolean typeEquals(ArrowType expected, ArrowType actual) {
        if (expected instanceof ArrowType.Timestamp && actual instanceof ArrowType.Timestamp) {
            ArrowType.Timestamp e = (ArrowType.Timestamp) expected;
            ArrowType.Timestamp a = (ArrowType.Timestamp) actual;
            return e.getUnit() == a.getUnit()
                    && (e.getTimezone() == null) == (a.getTimezone() == null);
        }
        return expected.equals(actual);
    }

    private static class ArrowTypeVisitor implements DataTypeVisitor<ArrowType> {

        private final String timeZoneId;

        private ArrowTypeVisitor(String timeZoneId) {
            this.timeZoneId = timeZoneId;
        }

        @Override
        public ArrowType visit(CharType charType) {
            return ArrowType.Utf8.INSTANCE;
        }

        @Override
        public ArrowType visit(VarCharType varCharType) {
            return ArrowType.Utf8.INSTANCE;
        }

        @Override
        public ArrowType visit(BooleanType booleanType) {
            return ArrowType.Bool.INSTANCE;
        }

        @Override
        public ArrowType visit(BinaryType binaryType) {
            return ArrowType.Binary.INSTANCE;
        }

        @Override
        public ArrowType visit(VarBinaryType varBinaryType) {
            return ArrowType.Binary.INSTANCE;
        }

        @Override
        public ArrowType visit(DecimalType decimalType) {
            return new ArrowType.Decimal(decimalType.getPrecision(), decimalType.getScale(), 128);
        }

        @Override
        public ArrowType visit(TinyIntType tinyIntType) {
            return new ArrowType.Int(8, true);
        }

        @Override
        public ArrowType visit(SmallIntType smallIntType) {
            return new ArrowType.Int(16, true);
        }

        @Override
        public ArrowType visit(IntType intType) {
            return new ArrowType.Int(32, true);
        }

        @Override
        public ArrowType visit(BigIntType bigIntType) {
            return new ArrowType.Int(64, true);
        }

        @Override
        public ArrowType visit(FloatType floatType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        }

        @Override
        public ArrowType visit(DoubleType doubleType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        }

        @Override
        public ArrowType visit(DateType dateType) {
            return new ArrowType.Date(DateUnit.DAY);
        }

        @Override
        public ArrowType visit(TimestampType timestampType) {
            return new ArrowType.Timestamp(
                    timeUnitForPrecision(timestampType.getPrecision()), null);
        }

        @Override
        public ArrowType visit(LocalZonedTimestampType localZonedTimestampType) {
            return new ArrowType.Timestamp(
                    timeUnitForPrecision(localZonedTimestampType.getPrecision()), timeZoneId);
        }

        @Override
        public ArrowType visit(RowType rowType) {
            throw new UnsupportedOperationException(
                    "Unsupported data type for arrow conversion: " + rowType.asSQLString());
        }
    }
}
