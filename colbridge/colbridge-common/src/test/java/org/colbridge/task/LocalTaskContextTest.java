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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link LocalTaskContext}. */
class LocalTaskContextTest {

    @Test
    void testListenersRunOnceInReverseOrder() throws Exception {
        LocalTaskContext context = new LocalTaskContext(3, 0);
        List<String> calls = new ArrayList<>();
        context.addTaskCompletionListener(ctx -> calls.add("first"));
        context.addTaskCompletionListener(ctx -> calls.add("second"));

        context.markTaskCompleted(null);
        context.markTaskCompleted(null);

        assertThat(calls).containsExactly("second", "first");
        assertThat(context.isCompleted()).isTrue();
    }

    @Test
    void testListenerAddedAfterCompletionRunsImmediately() throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        context.markTaskCompleted(null);
        List<Integer> calls = new ArrayList<>();
        context.addTaskCompletionListener(ctx -> calls.add(ctx.partitionId()));
        assertThat(calls).containsExactly(0);
    }

    @Test
    void testListenerFailureSuppressedOntoTaskFailure() throws Exception {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        List<String> calls = new ArrayList<>();
        context.addTaskCompletionListener(ctx -> calls.add("still runs"));
        context.addTaskCompletionListener(
                ctx -> {
                    throw new IllegalStateException("listener");
                });

        RuntimeException taskFailure = new RuntimeException("task");
        context.markTaskCompleted(taskFailure);

        assertThat(calls).containsExactly("still runs");
        assertThat(taskFailure.getSuppressed()).hasSize(1);
        assertThat(taskFailure.getSuppressed()[0]).hasMessage("listener");
    }

    @Test
    void testListenerFailureThrownWithoutTaskFailure() {
        LocalTaskContext context = new LocalTaskContext(0, 0);
        context.addTaskCompletionListener(
                ctx -> {
                    throw new IllegalStateException("listener");
                });
        assertThatThrownBy(() -> context.markTaskCompleted(null)).hasMessage("listener");
    }

    @Test
    void testKill() {
        LocalTaskContext context = new LocalTaskContext(5, 1);
        context.killTaskIfInterrupted();
        context.markInterrupted();
        assertThatThrownBy(context::killTaskIfInterrupted)
                .isInstanceOf(TaskKilledException.class)
                .hasMessageContaining("partition 5");
    }
}
