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

import org.colbridge.data.ConversionException;
import org.colbridge.data.DataGetters;
import org.colbridge.data.Decimal;
import org.colbridge.data.Timestamp;
import org.colbridge.types.DataType;

import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
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

/** 各个类型的 {@link ArrowFieldWriter} 实现。 */
public class ArrowFieldWriters {

    private ArrowFieldWriters() {}

    /** BOOLEAN。 */
    public static class BooleanWriter extends ArrowFieldWriter<BitVector> {

        public BooleanWriter(BitVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getBoolean(pos) ? 1 : 0);
        }
    }

    /** TINYINT。 */
    public static class TinyIntWriter extends ArrowFieldWriter<TinyIntVector> {

        public TinyIntWriter(TinyIntVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getByte(pos));
        }
    }

    /** SMALLINT。 */
    public static class SmallIntWriter extends ArrowFieldWriter<SmallIntVector> {

        public SmallIntWriter(SmallIntVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getShort(pos));
        }
    }

    /** INT。 */
    public static class IntWriter extends ArrowFieldWriter<IntVector> {

        public IntWriter(IntVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getInt(pos));
        }
    }

    /** BIGINT。 */
    public static class BigIntWriter extends ArrowFieldWriter<BigIntVector> {

        public BigIntWriter(BigIntVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getLong(pos));
        }
    }

    /** FLOAT。 */
    public static class FloatWriter extends ArrowFieldWriter<Float4Vector> {

        public FloatWriter(Float4Vector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getFloat(pos));
        }
    }

    /** DOUBLE。 */
    public static class DoubleWriter extends ArrowFieldWriter<Float8Vector> {

        public DoubleWriter(Float8Vector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getDouble(pos));
        }
    }

    /**
     * DECIMAL。值先按列的精度和标度重新规整,超出精度时抛出 {@link ConversionException}。
     */
    public static class DecimalWriter extends ArrowFieldWriter<DecimalVector> {

        private final int precision;
        private final int scale;

        public DecimalWriter(
                DecimalVector fieldVector, DataType dataType, int precision, int scale) {
            super(fieldVector, dataType);
            this.precision = precision;
            this.scale = scale;
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            Decimal value = getters.getDecimal(pos, precision, scale);
            Decimal rescaled = Decimal.fromBigDecimal(value.toBigDecimal(), precision, scale);
            if (rescaled == null) {
                throw new ConversionException(
                        String.format(
                                "Decimal value %s of field '%s' exceeds DECIMAL(%d, %d).",
                                value, getFieldName(), precision, scale));
            }
            fieldVector.setSafe(rowIndex, rescaled.toBigDecimal());
        }
    }

    /** CHAR、VARCHAR 和 STRING,按 UTF-8 字节写入。 */
    public static class StringWriter extends ArrowFieldWriter<VarCharVector> {

        public StringWriter(VarCharVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            byte[] bytes = getters.getString(pos).toBytes();
            fieldVector.setSafe(rowIndex, bytes, 0, bytes.length);
        }
    }

    /** BINARY、VARBINARY 和 BYTES。 */
    public static class BinaryWriter extends ArrowFieldWriter<VarBinaryVector> {

        public BinaryWriter(VarBinaryVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            byte[] bytes = getters.getBinary(pos);
            fieldVector.setSafe(rowIndex, bytes, 0, bytes.length);
        }
    }

    /** DATE,自纪元起的天数。 */
    public static class DateWriter extends ArrowFieldWriter<DateDayVector> {

        public DateWriter(DateDayVector fieldVector, DataType dataType) {
            super(fieldVector, dataType);
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            fieldVector.setSafe(rowIndex, getters.getInt(pos));
        }
    }

    /**
     * TIMESTAMP 和 TIMESTAMP WITH LOCAL TIME ZONE。
     *
     * <p>两者在行中都以 {@link Timestamp} 表示,按向量的时间单位换算为 long 写入。
     */
    public static class TimestampWriter extends ArrowFieldWriter<TimeStampVector> {

        private final int precision;
        private final TimeUnit unit;

        public TimestampWriter(TimeStampVector fieldVector, DataType dataType, int precision) {
            super(fieldVector, dataType);
            this.precision = precision;
            this.unit = ((ArrowType.Timestamp) fieldVector.getField().getType()).getUnit();
        }

        @Override
        protected void doWrite(int rowIndex, DataGetters getters, int pos) {
            Timestamp timestamp = getters.getTimestamp(pos, precision);
            fieldVector.setSafe(rowIndex, toEpochValue(timestamp, unit));
        }
    }

    static long toEpochValue(Timestamp timestamp, TimeUnit unit) {
        switch (unit) {
            case SECOND:
                return Math.floorDiv(timestamp.getMillisecond(), 1000L);
            case MILLISECOND:
                return timestamp.getMillisecond();
            case MICROSECOND:
                return timestamp.toMicros();
            case NANOSECOND:
                return timestamp.toNanos();
            default:
                throw new UnsupportedOperationException("Unsupported time unit: " + unit);
        }
    }
}
