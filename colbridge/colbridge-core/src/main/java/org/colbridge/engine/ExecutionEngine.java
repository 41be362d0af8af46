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

package org.colbridge.engine;

import org.colbridge.annotation.Public;
import org.colbridge.types.RowType;

import java.util.List;

/**
 * 执行分区任务的引擎。
 *
 * <p>每个分区在一个独立的任务中执行,任务拥有自己的 {@link org.colbridge.task.TaskContext};
 * 任务内注册的资源在任务结束时释放。
 *
 * @param <D> 引擎产出的数据集类型
 */
@Public
public interface ExecutionEngine<D extends PartitionedDataset> extends AutoCloseable {

    /**
     * 在每个分区上执行 {@code function},按分区编号顺序拼接全部输出。
     *
     * <p>任意一个分区失败时,其余分区被终止,第一个失败原样抛出。
     */
    <T> List<T> mapPartitionsAndCollect(PartitionedDataset dataset, PartitionFunction<T> function);

    /** 由每个分区的读取器构造数据集,第 i 个读取器对应第 i 个分区。 */
    D createDataset(RowType rowType, List<PartitionReader> readers);
}
