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
import org.colbridge.data.InternalRow;
import org.colbridge.task.TaskContext;

import java.util.Iterator;

/**
 * 在一个分区上执行的函数。
 *
 * <p>输入的行可能是复用的视图,函数需要保留的数据必须在拉取下一行之前复制出来。
 * 返回的迭代器在同一个任务中被读完,任务结束后其中引用的资源会被释放。
 *
 * @param <T> 输出元素类型
 */
@Public
@FunctionalInterface
public interface PartitionFunction<T> {

    Iterator<T> apply(Iterator<InternalRow> rows, TaskContext context) throws Exception;
}
