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

import org.colbridge.data.InternalRow;
import org.colbridge.types.RowType;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.List;

import static org.colbridge.utils.Preconditions.checkArgument;

/**
 * 把 {@link InternalRow} 按列写入一个 {@link VectorSchemaRoot}。
 *
 * <p>典型用法:多次 {@link #write},然后 {@link #finish} 提交行数,卸载批次后 {@link #reset}。
 */
public class ArrowWriter {

    private final VectorSchemaRoot root;
    private final ArrowFieldWriter<?>[] fieldWriters;

    private int rowCount;

    private ArrowWriter(VectorSchemaRoot root, ArrowFieldWriter<?>[] fieldWriters) {
        this.root = root;
        this.fieldWriters = fieldWriters;
    }

    /** 为 {@code root} 的每一列创建写入器,列的顺序与 {@code rowType} 一致。 */
    public static ArrowWriter create(VectorSchemaRoot root, RowType rowType) {
        List<FieldVector> vectors = root.getFieldVectors();
        checkArgument(
                vectors.size() == rowType.getFieldCount(),
                "Vector count %s does not match field count %s.",
                vectors.size(),
                rowType.getFieldCount());

        ArrowFieldWriter<?>[] writers = new ArrowFieldWriter<?>[vectors.size()];
        for (int i = 0; i < writers.length; i++) {
            FieldVector vector = vectors.get(i);
            vector.allocateNew();
            writers[i] =
                    rowType.getTypeAt(i)
                            .accept(ArrowFieldWriterFactoryVisitor.INSTANCE)
                            .create(vector);
        }
        return new ArrowWriter(root, writers);
    }

    public VectorSchemaRoot getRoot() {
        return root;
    }

    /** 当前批次已写入的行数。 */
    public int getRowCount() {
        return rowCount;
    }

    public void write(InternalRow row) {
        for (int i = 0; i < fieldWriters.length; i++) {
            fieldWriters[i].write(row, i);
        }
        rowCount++;
    }

    /** 提交当前批次的行数,之后 {@link #getRoot()} 可以被卸载为一个 record batch。 */
    public void finish() {
        root.setRowCount(rowCount);
        for (ArrowFieldWriter<?> writer : fieldWriters) {
            writer.finish();
        }
    }

    /** 清空当前批次,写入器可以继续写入下一个批次。 */
    public void reset() {
        root.setRowCount(0);
        for (ArrowFieldWriter<?> writer : fieldWriters) {
            writer.reset();
        }
        rowCount = 0;
    }
}
