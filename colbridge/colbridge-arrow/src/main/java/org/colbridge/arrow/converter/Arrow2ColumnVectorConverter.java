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

package org.colbridge.arrow.converter;

import org.colbridge.data.Decimal;
import org.colbridge.data.Timestamp;
import org.colbridge.data.columnar.BooleanColumnVector;
import org.colbridge.data.columnar.ByteColumnVector;
import org.colbridge.data.columnar.BytesColumnVector;
import org.colbridge.data.columnar.ColumnVector;
import org.colbridge.data.columnar.DecimalColumnVector;
import org.colbridge.data.columnar.DoubleColumnVector;
import org.colbridge.data.columnar.FloatColumnVector;
import org.colbridge.data.columnar.IntColumnVector;
import org.colbridge.data.columnar.LongColumnVector;
import org.colbridge.data.columnar.ShortColumnVector;
import org.colbridge.data.columnar.TimestampColumnVector;
import org.colbridge.types.BigIntType;
import org.colbridge.types.BinaryType;
import org.colbridge.types.BooleanType;
import org.colbridge.types.CharType;
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

import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * 把 Arrow 向量包装为 {@link ColumnVector} 的转换器。
 *
 * <p>包装不复制数据,读取直接访问 Arrow 缓冲区;向量被清空后包装也随之失效。
 */
@FunctionalInterface
public interface Arrow2ColumnVectorConverter {

    ColumnVector convertVector(FieldVector vector);

    static Arrow2ColumnVectorConverter construct(DataType type) {
        return type.accept(Arrow2ColumnVectorConverterVisitor.INSTANCE);
    }

    /** 按字段类型选择转换器的访问者。 */
    class Arrow2ColumnVectorConverterVisitor
            implements DataTypeVisitor<Arrow2ColumnVectorConverter> {

        private static final Arrow2ColumnVectorConverterVisitor INSTANCE =
                new Arrow2ColumnVectorConverterVisitor();

        @Override
        public Arrow2ColumnVectorConverter visit(CharType charType) {
            return vector -> new ArrowStringColumnVector((VarCharVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(VarCharType varCharType) {
            return vector -> new ArrowStringColumnVector((VarCharVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(BooleanType booleanType) {
            return vector ->
                    new BooleanColumnVector() {
                        @Override
                        public boolean getBoolean(int i) {
                            return ((BitVector) vector).get(i) != 0;
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(BinaryType binaryType) {
            return vector -> new ArrowBinaryColumnVector((VarBinaryVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(VarBinaryType varBinaryType) {
            return vector -> new ArrowBinaryColumnVector((VarBinaryVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(DecimalType decimalType) {
            return vector ->
                    new DecimalColumnVector() {
                        @Override
                        public Decimal getDecimal(int i, int precision, int scale) {
                            return Decimal.fromBigDecimal(
                                    ((DecimalVector) vector).getObject(i), precision, scale);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(TinyIntType tinyIntType) {
            return vector ->
                    new ByteColumnVector() {
                        @Override
                        public byte getByte(int i) {
                            return ((TinyIntVector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(SmallIntType smallIntType) {
            return vector ->
                    new ShortColumnVector() {
                        @Override
                        public short getShort(int i) {
                            return ((SmallIntVector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(IntType intType) {
            return vector ->
                    new IntColumnVector() {
                        @Override
                        public int getInt(int i) {
                            return ((IntVector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(BigIntType bigIntType) {
            return vector ->
                    new LongColumnVector() {
                        @Override
                        public long getLong(int i) {
                            return ((BigIntVector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(FloatType floatType) {
            return vector ->
                    new FloatColumnVector() {
                        @Override
                        public float getFloat(int i) {
                            return ((Float4Vector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(DoubleType doubleType) {
            return vector ->
                    new DoubleColumnVector() {
                        @Override
                        public double getDouble(int i) {
                            return ((Float8Vector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(DateType dateType) {
            return vector ->
                    new IntColumnVector() {
                        @Override
                        public int getInt(int i) {
                            return ((DateDayVector) vector).get(i);
                        }

                        @Override
                        public boolean isNullAt(int i) {
                            return vector.isNull(i);
                        }
                    };
        }

        @Override
        public Arrow2ColumnVectorConverter visit(TimestampType timestampType) {
            return vector -> new ArrowTimestampColumnVector((TimeStampVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(
                LocalZonedTimestampType localZonedTimestampType) {
            return vector -> new ArrowTimestampColumnVector((TimeStampVector) vector);
        }

        @Override
        public Arrow2ColumnVectorConverter visit(RowType rowType) {
            throw new UnsupportedOperationException(
                    "Unsupported data type for arrow reader: " + rowType.asSQLString());
        }
    }

    /** Utf8 列。 */
    class ArrowStringColumnVector implements BytesColumnVector {

        private final VarCharVector vector;

        ArrowStringColumnVector(VarCharVector vector) {
            this.vector = vector;
        }

        @Override
        public Bytes getBytes(int i) {
            byte[] bytes = vector.get(i);
            return new Bytes(bytes, 0, bytes.length);
        }

        @Override
        public boolean isNullAt(int i) {
            return vector.isNull(i);
        }
    }

    /** Binary 列。 */
    class ArrowBinaryColumnVector implements BytesColumnVector {

        private final VarBinaryVector vector;

        ArrowBinaryColumnVector(VarBinaryVector vector) {
            this.vector = vector;
        }

        @Override
        public Bytes getBytes(int i) {
            byte[] bytes = vector.get(i);
            return new Bytes(bytes, 0, bytes.length);
        }

        @Override
        public boolean isNullAt(int i) {
            return vector.isNull(i);
        }
    }

    /** 任意时间单位的 Timestamp 列,读出时换算为 {@link Timestamp}。 */
    class ArrowTimestampColumnVector implements TimestampColumnVector {

        private final TimeStampVector vector;
        private final TimeUnit unit;

        ArrowTimestampColumnVector(TimeStampVector vector) {
            this.vector = vector;
            this.unit = ((ArrowType.Timestamp) vector.getField().getType()).getUnit();
        }

        @Override
        public Timestamp getTimestamp(int i, int precision) {
            long value = vector.get(i);
            switch (unit) {
                case SECOND:
                    return Timestamp.fromEpochMillis(value * 1000L);
                case MILLISECOND:
                    return Timestamp.fromEpochMillis(value);
                case MICROSECOND:
                    return Timestamp.fromMicros(value);
                case NANOSECOND:
                    return Timestamp.fromNanos(value);
                default:
                    throw new UnsupportedOperationException("Unsupported time unit: " + unit);
            }
        }

        @Override
        public boolean isNullAt(int i) {
            return vector.isNull(i);
        }
    }
}
