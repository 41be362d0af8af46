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

import org.colbridge.types.BigIntType;
import org.colbridge.types.BinaryType;
import org.colbridge.types.BooleanType;
import org.colbridge.types.CharType;
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
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * 按字段类型选择 {@link ArrowFieldWriter} 的访问者。
 *
 * <p>向量由 {@link org.colbridge.arrow.ArrowUtils#toArrowSchema} 生成的 schema 分配,
 * 因此这里可以直接把向量强转为对应的具体类型。
 */
public class ArrowFieldWriterFactoryVisitor implements DataTypeVisitor<ArrowFieldWriterFactory> {

    public static final ArrowFieldWriterFactoryVisitor INSTANCE =
            new ArrowFieldWriterFactoryVisitor();

    @Override
    public ArrowFieldWriterFactory visit(CharType charType) {
        return vector -> new ArrowFieldWriters.StringWriter((VarCharVector) vector, charType);
    }

    @Override
    public ArrowFieldWriterFactory visit(VarCharType varCharType) {
        return vector -> new ArrowFieldWriters.StringWriter((VarCharVector) vector, varCharType);
    }

    @Override
    public ArrowFieldWriterFactory visit(BooleanType booleanType) {
        return vector -> new ArrowFieldWriters.BooleanWriter((BitVector) vector, booleanType);
    }

    @Override
    public ArrowFieldWriterFactory visit(BinaryType binaryType) {
        return vector -> new ArrowFieldWriters.BinaryWriter((VarBinaryVector) vector, binaryType);
    }

    @Override
    public ArrowFieldWriterFactory visit(VarBinaryType varBinaryType) {
        return vector ->
                new ArrowFieldWriters.BinaryWriter((VarBinaryVector) vector, varBinaryType);
    }

    @Override
    public ArrowFieldWriterFactory visit(DecimalType decimalType) {
        return vector ->
                new ArrowFieldWriters.DecimalWriter(
                        (DecimalVector) vector,
                        decimalType,
                        decimalType.getPrecision(),
                        decimalType.getScale());
    }

    @Override
    public ArrowFieldWriterFactory visit(TinyIntType tinyIntType) {
        return vector -> new ArrowFieldWriters.TinyIntWriter((TinyIntVector) vector, tinyIntType);
    }

    @Override
    public ArrowFieldWriterFactory visit(SmallIntType smallIntType) {
        return vector ->
                new ArrowFieldWriters.SmallIntWriter((SmallIntVector) vector, smallIntType);
    }

    @Override
    public ArrowFieldWriterFactory visit(IntType intType) {
        return vector -> new ArrowFieldWriters.IntWriter((IntVector) vector, intType);
    }

    @Override
    public ArrowFieldWriterFactory visit(BigIntType bigIntType) {
        return vector -> new ArrowFieldWriters.BigIntWriter((BigIntVector) vector, bigIntType);
    }

    @Override
    public ArrowFieldWriterFactory visit(FloatType floatType) {
        return vector -> new ArrowFieldWriters.FloatWriter((Float4Vector) vector, floatType);
    }

    @Override
    public ArrowFieldWriterFactory visit(DoubleType doubleType) {
        return vector -> new ArrowFieldWriters.DoubleWriter((Float8Vector) vector, doubleType);
    }

    @Override
    public ArrowFieldWriterFactory visit(DateType dateType) {
        return vector -> new ArrowFieldWriters.DateWriter((DateDayVector) vector, dateType);
    }

    @Override
    public ArrowFieldWriterFactory visit(TimestampType timestampType) {
        return vector ->
                new ArrowFieldWriters.TimestampWriter(
                        (TimeStampVector) vector, timestampType, timestampType.getPrecision());
    }

    @Override
    public ArrowFieldWriterFactory visit(LocalZonedTimestampType localZonedTimestampType) {
        return vector ->
                new ArrowFieldWriters.TimestampWriter(
                        (TimeStampVector) vector,
                        localZonedTimestampType,
                        localZonedTimestampType.getPrecision());
    }

    @Override
    public ArrowFieldWriterFactory visit(RowType rowType) {
        throw new UnsupportedOperationException(
                "Unsupported data type for arrow writer: " + rowType.asSQLString());
    }
}
