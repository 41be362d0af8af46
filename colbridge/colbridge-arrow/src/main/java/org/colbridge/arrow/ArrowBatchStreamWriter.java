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

import org.colbridge.types.RowType;

import org.apache.arrow.vector.ipc.WriteChannel;
import org.apache.arrow.vector.ipc.message.MessageSerializer;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.util.Iterator;

/**
 * 把已经序列化好的 record batch 拼接成一个自描述的 Arrow IPC 流。
 *
 * <h2>流格式</h2>
 *
 * <pre>
 * [schema 消息][batch_1]...[batch_N][00 00 00 00]
 * </pre>
 *
 * <p>schema 消息在构造时写出,批次原样写出,{@link #end()} 写出 4 字节小端 0 作为结束标记。
 *
 * <h2>重要提示</h2>
 *
 * <p>写出的目标流不会被关闭,由调用方负责。写入失败时 {@link IOException} 直接抛出,已经写出的字节不会回滚。
 */
public class ArrowBatchStreamWriter {

    private final OutputStream out;
    private final WriteChannel channel;

    private long batchCount;

    public ArrowBatchStreamWriter(RowType rowType, OutputStream out, String timeZoneId)
            throws IOException {
        this(ArrowUtils.toArrowSchema(rowType, timeZoneId), out);
    }

    public ArrowBatchStreamWriter(Schema schema, OutputStream out) throws IOException {
        this.out = out;
        this.channel = new WriteChannel(Channels.newChannel(out));
        MessageSerializer.serialize(channel, schema);
    }

    /** 依次写出每个批次的字节。 */
    public void writeBatches(Iterator<byte[]> batches) throws IOException {
        while (batches.hasNext()) {
            channel.write(batches.next());
            batchCount++;
        }
    }

    /** 写出结束标记并刷新目标流。 */
    public void end() throws IOException {
        channel.writeIntLittleEndian(0);
        out.flush();
    }

    public long getBatchCount() {
        return batchCount;
    }
}
