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
import org.colbridge.utils.StringUtils;

import com.fasterxml.jackson.core.JsonGenerator;

import javax.annotation.Nullable;

import java.io.IOException;
import java.io.Serializable;
import java.util.Objects;

import static org.colbridge.utils.StringUtils.escapeIdentifier;
import static org.colbridge.utils.StringUtils.escapeSingleQuotes;

/**
 * {@link RowType} 中的一个字段,由 ID、名称、类型和可选描述组成。
 *
 * <p>字段 ID 只用于标识,跨进程交换 schema 时与名称一起写入 JSON。
 */
@Public
public final class DataField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int id;

    /** 字段名称,在同一个 RowType 中必须唯一。 */
    private final String name;

    private final DataType type;

    private final @Nullable String description;

    public DataField(int id, String name, DataType type) {
        this(id, name, type, null);
    }

    public DataField(int id, String name, DataType type, @Nullable String description) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.description = description;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public DataType type() {
        return type;
    }

    @Nullable
    public String description() {
        return description;
    }

    public DataField newName(String newName) {
        return new DataField(id, newName, type, description);
    }

    public DataField newType(DataType newType) {
        return new DataField(id, name, newType, description);
    }

    public DataField copy() {
        return new DataField(id, name, type.copy(), description);
    }

    public DataField copy(boolean isNullable) {
        return new DataField(id, name, type.copy(isNullable), description);
    }

    /**
     * 返回字段的 SQL 表示。
     *
     * <p>格式: {@code `name` type [COMMENT 'description']}
     */
    public String asSQLString() {
        StringBuilder sb = new StringBuilder();
        sb.append(escapeIdentifier(name)).append(" ").append(type.asSQLString());
        if (StringUtils.isNotEmpty(description)) {
            sb.append(" COMMENT '").append(escapeSingleQuotes(description)).append("'");
        }
        return sb.toString();
    }

    public void serializeJson(JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeNumberField("id", id());
        generator.writeStringField("name", name());
        generator.writeFieldName("type");
        type.serializeJson(generator);
        if (description() != null) {
            generator.writeStringField("description", description());
        }
        generator.writeEndObject();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataField field = (DataField) o;
        return id == field.id
                && Objects.equals(name, field.name)
                && Objects.equals(type, field.type)
                && Objects.equals(description, field.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, description);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
