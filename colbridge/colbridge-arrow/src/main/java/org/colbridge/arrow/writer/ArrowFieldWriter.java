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
import org.colbridge.types.DataType;

import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.FieldVector;

/**
 * 把一列的值逐行追加到 Arrow 向量中的写入器。
 *
 * <p>每个写入器维护自己已写入的行数;{@link #finish()} 把行数提交到向量上,{@link #reset()}
 * 清空向量以便写入下一个批次。写入失败统一转换为 {@link ConversionException},异常信息中带有字段名。
 *
 * @param <V> Arrow 向量类型
 */
public abstract class ArrowFieldWriter<V extends FieldVector> {

    protected final V fieldVector;
    private final DataType dataType;
    private final String fieldName;

    private int count;

    protected ArrowFieldWriter(V fieldVector, DataType dataType) {
        this.fieldVector = fieldVector;
        this.dataType = dataType;
        this.fieldName = fieldVector.getField().getName();
    }

    public V getFieldVector() {
        return fieldVector;
    }

    public String getFieldName() {
        return fieldName;
    }

    /** 已写入当前批次的行数。 */
    public int getCount() {
        return count;
    }

    /** 写入 {@code getters} 第 {@code pos} 个位置上的值。 */
    public void write(DataGetters getters, int pos) {
        try {
            if (getters.isNullAt(pos)) {
                if (!dataType.isNullable()) {
                    throw new ConversionException(
                            String.format(
                                    "Null value for non-nullable field '%s' of type %s.",
                                    fieldName, dataType.asSQLString()));
                }
                setNull(count);
            } else {
                doWrite(count, getters, pos);
            }
        } catch (ClassCastException | ArithmeticException | UnsupportedOperationException e) {
            throw new ConversionException(
                    String.format(
                            "Cannot write value to field '%s' of type %s.",
                            fieldName, dataType.asSQLString()),
                    e);
        }
        count++;
    }

    /** 把行数提交到向量上。 */
    public void finish() {
        fieldVector.setValueCount(count);
    }

    /** 清空向量中的数据,保留已分配的缓冲区。 */
    public void reset() {
        fieldVector.reset();
        count = 0;
    }

    private void setNull(int rowIndex) {
        if (fieldVector instanceof BaseFixedWidthVector) {
            ((BaseFixedWidthVector) fieldVector).setNull(rowIndex);
        } else if (fieldVector instanceof BaseVariableWidthVector) {
            ((BaseVariableWidthVector) fieldVector).setNull(rowIndex);
        } else {
            throw new UnsupportedOperationException(
                    "Unsupported vector type: " + fieldVector.getClass().getName());
        }
    }

    protected abstract void doWrite(int rowIndex, DataGetters getters, int pos);
}
