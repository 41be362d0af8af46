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

package org.colbridge.data;

import org.colbridge.annotation.Public;

/**
 * 按位置读取字段值的访问接口,由 {@link InternalRow} 继承。
 *
 * <p>读取前必须先用 {@link #isNullAt(int)} 判断是否为 null,对 null 字段调用其它 getter 的结果未定义。
 */
@Public
public interface DataGetters {

    boolean isNullAt(int pos);

    boolean getBoolean(int pos);

    byte getByte(int pos);

    short getShort(int pos);

    int getInt(int pos);

    long getLong(int pos);

    float getFloat(int pos);

    double getDouble(int pos);

    BinaryString getString(int pos);

    /** 精度和标度用于还原十进制数,因为底层存储可能与精度相关。 */
    Decimal getDecimal(int pos, int precision, int scale);

    /** 精度用于还原时间戳,因为底层存储可能与精度相关。 */
    Timestamp getTimestamp(int pos, int precision);

    byte[] getBinary(int pos);
}
