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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把 JSON 形式的类型描述解析为 {@link DataType}。
 *
 * <p>原子类型以 SQL 字符串表示(例如 {@code "INT NOT NULL"}、{@code "DECIMAL(10, 2)"}、
 * {@code "TIMESTAMP(3) WITH LOCAL TIME ZONE"}),行类型以对象表示:
 *
 * <pre>{@code
 * {"type":"ROW","fields":[{"id":0,"name":"id","type":"INT NOT NULL"}]}
 * }</pre>
 */
public final class DataTypeJsonParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String NOT_NULL_SUFFIX = " NOT NULL";

    private static final Pattern TYPE_WITH_PARAMS =
            Pattern.compile("^([A-Z_]+)\\s*\\(\\s*(\\d+)\\s*(?:,\\s*(\\d+)\\s*)?\\)(.*)$");

    private DataTypeJsonParser() {}

    public static RowType parseRowType(String json) {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse row type json: " + json, e);
        }
        DataType type = parseDataType(node);
        if (!(type instanceof RowType)) {
            throw new IllegalArgumentException("Expected a ROW type but found: " + type);
        }
        return (RowType) type;
    }

    public static DataType parseDataType(JsonNode json) {
        if (json == null || json.isNull()) {
            throw new IllegalArgumentException("Type json must not be null.");
        }
        if (json.isTextual()) {
            return parseAtomicTypeSQLString(json.asText());
        }
        if (json.isObject()) {
            String typeString = json.path("type").asText("");
            boolean isNullable = !typeString.endsWith(NOT_NULL_SUFFIX);
            String root = isNullable ? typeString : stripNotNull(typeString);
            if (!"ROW".equals(root)) {
                throw new IllegalArgumentException("Unsupported type json: " + json);
            }
            return new RowType(isNullable, parseFields(json.get("fields")));
        }
        throw new IllegalArgumentException("Unsupported type json: " + json);
    }

    private static List<DataField> parseFields(JsonNode fieldsJson) {
        if (fieldsJson == null || !fieldsJson.isArray()) {
            throw new IllegalArgumentException("ROW type json must contain a 'fields' array.");
        }
        List<DataField> fields = new ArrayList<>();
        for (JsonNode fieldJson : fieldsJson) {
            JsonNode name = fieldJson.get("name");
            if (name == null || !name.isTextual()) {
                throw new IllegalArgumentException("Field json must contain a 'name': " + fieldJson);
            }
            int id = fieldJson.has("id") ? fieldJson.get("id").asInt() : fields.size();
            DataType type = parseDataType(fieldJson.get("type"));
            JsonNode description = fieldJson.get("description");
            fields.add(
                    new DataField(
                            id,
                            name.asText(),
                            type,
                            description == null || description.isNull()
                                    ? null
                                    : description.asText()));
        }
        return fields;
    }

    /** 解析原子类型的 SQL 字符串,例如 {@code VARCHAR(10) NOT NULL}。 */
    public static DataType parseAtomicTypeSQLString(String string) {
        String normalized = string.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        boolean isNullable = !normalized.endsWith(NOT_NULL_SUFFIX);
        if (!isNullable) {
            normalized = stripNotNull(normalized);
        }
        return parseNullableAtomicType(normalized, string).copy(isNullable);
    }

    private static DataType parseNullableAtomicType(String type, String original) {
        switch (type) {
            case "BOOLEAN":
                return new BooleanType();
            case "TINYINT":
                return new TinyIntType();
            case "SMALLINT":
                return new SmallIntType();
            case "INT":
            case "INTEGER":
                return new IntType();
            case "BIGINT":
                return new BigIntType();
            case "FLOAT":
                return new FloatType();
            case "DOUBLE":
                return new DoubleType();
            case "DATE":
                return new DateType();
            case "STRING":
                return VarCharType.STRING_TYPE;
            case "BYTES":
                return VarBinaryType.BYTES_TYPE;
            case "DECIMAL":
                return new DecimalType();
            case "TIMESTAMP":
                return new TimestampType();
            case "TIMESTAMP WITH LOCAL TIME ZONE":
            case "TIMESTAMP_LTZ":
                return new LocalZonedTimestampType();
            default:
                break;
        }

        Matcher matcher = TYPE_WITH_PARAMS.matcher(type);
        if (!matcher.matches()) {
            throw unsupported(original);
        }
        String root = matcher.group(1);
        int first = Integer.parseInt(matcher.group(2));
        String second = matcher.group(3);
        String rest = matcher.group(4).trim();
        if (second != null) {
            if ("DECIMAL".equals(root) && rest.isEmpty()) {
                return new DecimalType(first, Integer.parseInt(second));
            }
            throw unsupported(original);
        }
        switch (root) {
            case "CHAR":
                return rest.isEmpty() ? new CharType(first) : throwUnsupported(original);
            case "VARCHAR":
                return rest.isEmpty() ? new VarCharType(first) : throwUnsupported(original);
            case "BINARY":
                return rest.isEmpty() ? new BinaryType(first) : throwUnsupported(original);
            case "VARBINARY":
                return rest.isEmpty() ? new VarBinaryType(first) : throwUnsupported(original);
            case "DECIMAL":
                return rest.isEmpty() ? new DecimalType(first, 0) : throwUnsupported(original);
            case "TIMESTAMP":
                if (rest.isEmpty()) {
                    return new TimestampType(first);
                } else if ("WITH LOCAL TIME ZONE".equals(rest)) {
                    return new LocalZonedTimestampType(first);
                }
                throw unsupported(original);
            case "TIMESTAMP_LTZ":
                return rest.isEmpty()
                        ? new LocalZonedTimestampType(first)
                        : throwUnsupported(original);
            default:
                throw unsupported(original);
        }
    }

    private static String stripNotNull(String type) {
        return type.substring(0, type.length() - NOT_NULL_SUFFIX.length()).trim();
    }

    private static DataType throwUnsupported(String type) {
        throw unsupported(type);
    }

    private static IllegalArgumentException unsupported(String type) {
        return new IllegalArgumentException("Unsupported data type: " + type);
    }
}
