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

/**
 * 数据类型的根分类。
 *
 * <p>类型根描述类型本身而不包含参数,例如 {@code DECIMAL(12, 3)} 的类型根是 {@link #DECIMAL}。
 * 编解码器按类型根选择列写入器和列读取器。
 */
@Public
public enum DataTypeRoot {
    CHAR,

    VARCHAR,

    BOOLEAN,

    BINARY,

    VARBINARY,

    DECIMAL,

    TINYINT,

    SMALLINT,

    INTEGER,

    BIGINT,

    FLOAT,

    DOUBLE,

    DATE,

    TIMESTAMP_WITHOUT_TIME_ZONE,

    TIMESTAMP_WITH_LOCAL_TIME_ZONE,

    ROW
}
