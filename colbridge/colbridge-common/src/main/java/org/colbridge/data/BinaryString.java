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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 以 UTF-8 字节保存的字符串,对应 {@code CHAR} / {@code VARCHAR} 字段的内部值。
 *
 * <p>与 Arrow 的 {@code Utf8} 向量之间可以直接复制字节,不需要经过 {@link String} 编解码。
 * 比较按无符号字节字典序进行,与按 Unicode 码点比较的结果一致。
 */
@Public
public final class BinaryString implements Comparable<BinaryString>, Serializable {

    private static final long serialVersionUID = 1L;

    public static final BinaryString EMPTY_UTF8 = new BinaryString(new byte[0]);

    private final byte[] bytes;

    private transient String javaObject;

    private BinaryString(byte[] bytes) {
        this.bytes = bytes;
    }

    public static @Nullable BinaryString fromString(@Nullable String str) {
        if (str == null) {
            return null;
        }
        BinaryString string = new BinaryString(str.getBytes(StandardCharsets.UTF_8));
        string.javaObject = str;
        return string;
    }

    /** 使用给定的 UTF-8 字节创建字符串,字节数组不会被复制。 */
    public static BinaryString fromBytes(byte[] bytes) {
        return new BinaryString(bytes);
    }

    public static BinaryString fromBytes(byte[] bytes, int offset, int numBytes) {
        return new BinaryString(Arrays.copyOfRange(bytes, offset, offset + numBytes));
    }

    /** 返回底层 UTF-8 字节,调用方不得修改。 */
    public byte[] toBytes() {
        return bytes;
    }

    public int getSizeInBytes() {
        return bytes.length;
    }

    public BinaryString copy() {
        return new BinaryString(Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public String toString() {
        String str = javaObject;
        if (str == null) {
            javaObject = str = new String(bytes, StandardCharsets.UTF_8);
        }
        return str;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryString)) {
            return false;
        }
        return Arrays.equals(bytes, ((BinaryString) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(@Nonnull BinaryString other) {
        int len = Math.min(bytes.length, other.bytes.length);
        for (int i = 0; i < len; i++) {
            int res = (bytes[i] & 0xFF) - (other.bytes[i] & 0xFF);
            if (res != 0) {
                return res;
            }
        }
        return bytes.length - other.bytes.length;
    }
}
