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

package org.colbridge.task;

import org.colbridge.annotation.Public;

/**
 * 一个分区任务的运行上下文。
 *
 * <p>任务内创建的资源(例如 Arrow 缓冲区)通过 {@link #addTaskCompletionListener} 注册释放回调,
 * 无论任务成功、失败还是被终止,回调都会在任务结束时执行。
 */
@Public
public interface TaskContext {

    int partitionId();

    int attemptNumber();

    /**
     * 注册任务结束时执行的回调。回调按注册的逆序执行,每个回调只执行一次。
     *
     * <p>如果任务已经结束,回调会被立即执行。
     */
    TaskContext addTaskCompletionListener(TaskCompletionListener listener);

    /** 任务是否已经被要求终止。 */
    boolean isInterrupted();

    /** 如果任务已经被要求终止,抛出 {@link TaskKilledException}。 */
    default void killTaskIfInterrupted() {
        if (isInterrupted()) {
            throw new TaskKilledException(
                    String.format(
                            "Task for partition %d (attempt %d) was killed.",
                            partitionId(), attemptNumber()));
        }
    }
}
