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

package org.colbridge.arrow;

import org.colbridge.data.InternalRow;
import org.colbridge.task.LocalTaskContext;
import org.colbridge.types.RowType;
import org.colbridge.utils.InternalRowUtils;

import org.apache.arrow.memory.BufferAllocator;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** 编解码测试共用的工具方法。 */
final class ArrowTestUtils {

    static final String TIME_ZONE = "Asia/Shanghai";

    static List<byte[]> encodeBatches(
            List<? extends InternalRow> rows,
            RowType rowType,
            int maxRecordsPerBatch,
            BufferAllocator allocator)
            throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        List<byte[]> batches = new ArrayList<>();
        Iterator<byte[]> iterator =
                ArrowBatchEncoder.toBatchIterator(
                        new ArrayList<InternalRow>(rows).iterator(),
                        rowType,
                        maxRecordsPerBatch,
                        TIME_ZONE,
                        allocator,
                        context);
        iterator.forEachRemaining(batches::add);
        context.markTaskCompleted(null);
        return batches;
    }

    static byte[] encodeStream(
            List<? extends InternalRow> rows,
            RowType rowType,
            int maxRecordsPerBatch,
            BufferAllocator allocator)
            throws Exception {
        List<byte[]> batches = encodeBatches(rows, rowType, maxRecordsPerBatch, allocator);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ArrowBatchStreamWriter writer = new ArrowBatchStreamWriter(rowType, out, TIME_ZONE);
        writer.writeBatches(batches.iterator());
        writer.end();
        return out.toByteArray();
    }

    static List<InternalRow> decode(
            List<byte[]> payloads, RowType rowType, BufferAllocator allocator) throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        List<InternalRow> result = new ArrayList<>();
        try {
            ArrowBatchDecoder.fromPayloadIterator(payloads.iterator(), rowType, allocator, context)
                    .forEachRemaining(row -> result.add(InternalRowUtils.copyRow(row, rowType)));
        } catch (Throwable t) {
            context.markTaskCompleted(t);
            throw t;
        }
        context.markTaskCompleted(null);
        return result;
    }

    static List<InternalRow> decode(byte[] payload, RowType rowType, BufferAllocator allocator)
            throws Exception {
        return decode(Collections.singletonList(payload), rowType, allocator);
    }

    private ArrowTestUtils() {}
}
