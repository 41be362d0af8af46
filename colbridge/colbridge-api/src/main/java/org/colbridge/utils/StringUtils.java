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

package org.colbridge.utils;

import javax.annotation.Nullable;

/** 字符串工具方法。 */
public final class StringUtils {

    public static boolean isNullOrWhitespaceOnly(@Nullable String str) {
        if (str == null || str.length() == 0) {
            return true;
        }

        final int len = str.length();
        for (int i = 0; i < len; i++) {
            if (!Character.isWhitespace(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isNotEmpty(@Nullable String str) {
        return str != null && !str.isEmpty();
    }

    /** 用反引号包裹 SQL 标识符,标识符中的反引号会被转义。 */
    public static String escapeIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    public static String escapeSingleQuotes(String text) {
        return text.replace("'", "''");
    }

    private StringUtils() {}
}
