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

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ExceptionUtils}. */
class ExceptionUtilsTest {

    @Test
    void testFirstOrSuppressed() {
        Exception first = new Exception("first");
        Exception second = new Exception("second");
        assertThat(ExceptionUtils.firstOrSuppressed(first, null)).isSameAs(first);
        assertThat(ExceptionUtils.firstOrSuppressed(second, first)).isSameAs(first);
        assertThat(first.getSuppressed()).containsExactly(second);
    }

    @Test
    void testFinallyFailureIsSuppressed() {
        IllegalStateException original = new IllegalStateException("action");
        assertThatThrownBy(
                        () ->
                                ExceptionUtils.tryWithSafeFinally(
                                        () -> {
                                            throw original;
                                        },
                                        () -> {
                                            throw new RuntimeException("finally");
                                        }))
                .isSameAs(original);
        assertThat(original.getSuppressed()).hasSize(1);
        assertThat(original.getSuppressed()[0]).hasMessage("finally");
    }

    @Test
    void testFinallyRunsOnSuccess() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        ExceptionUtils.tryWithSafeFinally(() -> {}, () -> ran.set(true));
        assertThat(ran).isTrue();

        assertThatThrownBy(
                        () ->
                                ExceptionUtils.tryWithSafeFinally(
                                        () -> {},
                                        () -> {
                                            throw new IllegalStateException("finally");
                                        }))
                .hasMessage("finally");
    }

    @Test
    void testCloseAllCollectsFailures() {
        AtomicBoolean closed = new AtomicBoolean();
        assertThatThrownBy(
                        () ->
                                IOUtils.closeAll(
                                        () -> {
                                            throw new Exception("a");
                                        },
                                        () -> closed.set(true),
                                        () -> {
                                            throw new Exception("b");
                                        }))
                .hasMessage("a")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(closed).isTrue();
    }
}
