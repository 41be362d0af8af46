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

import java.util.OptionalInt;

/**
 * 读取类型参数(长度、精度、标度)的工具方法。
 *
 * <p>在不支持该参数的类型上调用会抛出 {@link IllegalArgumentException}。
 */
public final class DataTypeChecks {

    private static final ScaleExtractor SCALE_EXTRACTOR = new ScaleExtractor();

    public static int getLength(DataType dataType) {
        return require(DataTypes.getLength(dataType), "length", dataType);
    }

    public static int getPrecision(DataType dataType) {
        return require(DataTypes.getPrecision(dataType), "precision", dataType);
    }

    /** 返回标度,整数类型的标度为 0。 */
    public static int getScale(DataType dataType) {
        return dataType.accept(SCALE_EXTRACTOR);
    }

    private static int require(OptionalInt value, String property, DataType dataType) {
        if (value.isPresent()) {
            return value.getAsInt();
        }
        throw new IllegalArgumentException(
                String.format("Type %s does not define a %s.", dataType, property));
    }

    private DataTypeChecks() {
        // no instantiation
    }

    private static class ScaleExtractor extends DataTypeDefaultVisitor<Integer> {

        @Override
        public Integer visit(DecimalType decimalType) {
            return decimalType.getScale();
        }

        @Override
        public Integer visit(TinyIntType tinyIntType) {
            return 0;
        }

        @Override
        public Integer visit(SmallIntType smallIntType) {
            return 0;
        }

        @Override
        public Integer visit(IntType intType) {
            return 0;
        }

        @Override
        public Integer visit(BigIntType bigIntType) {
            return 0;
        }

        @Override
        protected Integer defaultMethod(DataType dataType) {
            throw new IllegalArgumentException(
                    String.format("Type %s does not define a scale.", dataType));
        }
    }
}
