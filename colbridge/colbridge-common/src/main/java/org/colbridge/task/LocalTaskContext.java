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

import org.colbridge.utils.ExceptionUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 本地执行的 {@link TaskContext} 实现。
 *
 * <p>{@link #markTaskCompleted(Throwable)} 按注册的逆序执行全部回调,且只执行一次。
 * 任务本身失败时,回调的异常作为 suppressed 附加到任务异常上;任务成功时,回调的异常被抛出。
 */
@ThreadSafe
public class LocalTaskContext implements TaskContext {

    private static final Logger LOG = LoggerFactory.getLogger(LocalTaskContext.class);

    private final int partitionId;
    private final int attemptNumber;

    private final Deque<TaskCompletionListener> listeners = new ArrayDeque<>();

    private volatile boolean interrupted;
    private boolean completed;

    public LocalTaskContext(int partitionId, int attemptNumber) {
        this.partitionId = partitionId;
        this.attemptNumber = attemptNumber;
    }

    @Override
    public int partitionId() {
        return partitionId;
    }

    @Override
    public int attemptNumber() {
        return attemptNumber;
    }

    @Override
    public TaskContext addTaskCompletionListener(TaskCompletionListener listener) {
        checkNotNull(listener, "listener must not be null");
        boolean runNow;
        synchronized (this) {
            runNow = completed;
            if (!runNow) {
                listeners.push(listener);
            }
        }
        if (runNow) {
            try {
                listener.onTaskCompletion(this);
            } catch (Exception e) {
                throw ExceptionUtils.rethrowUnchecked(e);
            }
        }
        return this;
    }

    @Override
    public boolean isInterrupted() {
        return interrupted;
    }

    /** 要求任务终止,任务在下一次检查 {@link #killTaskIfInterrupted()} 时停止。 */
    public void markInterrupted() {
        interrupted = true;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    /**
     * 标记任务结束并执行全部回调。
     *
     * @param failure 任务失败时的异常,成功时为 null
     * @throws Exception 任务成功但有回调失败时抛出第一个回调异常
     */
    public void markTaskCompleted(@Nullable Throwable failure) throws Exception {
        Deque<TaskCompletionListener> toRun;
        synchronized (this) {
            if (completed) {
                return;
            }
            completed = true;
            toRun = new ArrayDeque<>(listeners);
            listeners.clear();
        }

        Exception listenerFailure = null;
        for (TaskCompletionListener listener : toRun) {
            try {
                listener.onTaskCompletion(this);
            } catch (Exception e) {
                LOG.warn(
                        "Completion listener of task for partition {} failed.", partitionId, e);
                listenerFailure = ExceptionUtils.firstOrSuppressed(e, listenerFailure);
            }
        }

        if (listenerFailure != null) {
            if (failure != null) {
                failure.addSuppressed(listenerFailure);
            } else {
                throw listenerFailure;
            }
        }
    }
}
