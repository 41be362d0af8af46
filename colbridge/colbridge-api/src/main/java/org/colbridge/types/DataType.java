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

import org.colbridge.annotation.Public;
import org.colbridge.utils.Preconditions;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * 描述一个字段的逻辑数据类型。
 *
 * <p>每个数据类型由类型根({@link DataTypeRoot})、可空性以及可选的类型参数(精度、长度等)组成。
 * 类型实例不可变,修改可空性会返回新的实例。
 *
 * <p>使用示例:
 * <pre>{@code
 * DataType id = DataTypes.INT().notNull();
 * DataType name = DataTypes.STRING();
 * }</pre>
 *
 * @see DataTypes
 * @see DataTypeVisitor
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean isNullable;

    private final DataTypeRoot typeRoot;

    public DataType(boolean isNullable, DataTypeRoot typeRoot) {
        this.isNullable = isNullable;
        this.typeRoot = Preconditions.checkNotNull(typeRoot);
    }

    /** 该类型的值是否可以为 {@code null}。 */
    public boolean isNullable() {
        return isNullable;
    }

    public DataTypeRoot getTypeRoot() {
        return typeRoot;
    }

    public boolean is(DataTypeRoot typeRoot) {
        return this.typeRoot == typeRoot;
    }

    public boolean isAnyOf(DataTypeRoot... typeRoots) {
        return Arrays.stream(typeRoots).anyMatch(tr -> this.typeRoot == tr);
    }

    /**
     * 返回该类型的深拷贝,并使用给定的可空性。
     *
     * @param isNullable 拷贝后类型的可空性
     */
    public abstract DataType copy(boolean isNullable);

    public final DataType copy() {
        return copy(isNullable);
    }

    public DataType notNull() {
        return copy(false);
    }

    public DataType nullable() {
        return copy(true);
    }

    /** 忽略可空性比较两个类型。 */
    public boolean equalsIgnoreNullable(DataType o) {
        return Objects.equals(this.copy(true), o.copy(true));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return isNullable == that.isNullable && typeRoot == that.typeRoot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(isNullable, typeRoot);
    }

    /**
     * 返回 SQL 风格的类型字符串,例如 {@code INT NOT NULL}、{@code VARCHAR(10)}。
     *
     * <p>该字符串同时是类型的 JSON 表示,能够被 {@link DataTypeJsonParser} 解析回来。
     */
    public abstract String asSQLString();

    public void serializeJson(JsonGenerator generator) throws IOException {
        generator.writeString(asSQLString());
    }

    protected String withNullability(String format, Object... params) {
        if (!isNullable) {
            return String.format(format + " NOT NULL", params);
        }
        return String.format(format, params);
    }

    @Override
    public String toString() {
        return asSQLString();
    }

    public abstract <R> R accept(DataTypeVisitor<R> visitor);
}
