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

import org.colbridge.data.BinaryString;
import org.colbridge.data.Decimal;
import org.colbridge.data.GenericRow;
import org.colbridge.data.InternalRow;
import org.colbridge.types.DataType;
import org.colbridge.types.RowType;

import java.util.Arrays;

/** {@link InternalRow} 相关的工具方法。 */
public class InternalRowUtils {

    /**
     * 深拷贝一行,返回与原行不共享任何可变状态的 {@link GenericRow}。
     *
     * <p>用于在可复用的行视图(例如列式批次上的行)失效之前保留数据。
     */
    public static GenericRow copyRow(InternalRow row, RowType rowType) {
        GenericRow ret = new GenericRow(row.getFieldCount());

        for (int i = 0; i < row.getFieldCount(); ++i) {
            DataType fieldType = rowType.getTypeAt(i);
            Object value = InternalRow.createFieldGetter(fieldType, i).getFieldOrNull(row);
            ret.setField(i, copy(value, fieldType));
        }

        return ret;
    }

    public static Object copy(Object o, DataType type) {
        if (o == null) {
            return null;
        }
        if (o instanceof BinaryString) {
            return ((BinaryString) o).copy();
        } else if (o instanceof Decimal) {
            return ((Decimal) o).copy();
        } else if (o instanceof byte[]) {
            byte[] bytes = (byte[]) o;
            return Arrays.copyOf(bytes, bytes.length);
        }
        return o;
    }

    private InternalRowUtils() {}
}
