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

package org.colbridge.arrow.memory;

import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BufferArena}. */
class BufferArenaTest {

    @Test
    void testCloseIsIdempotent() {
        try (BufferAllocator parent = new RootAllocator()) {
            BufferArena arena = new BufferArena(parent, "task-0", Long.MAX_VALUE);
            assertThat(arena.getName()).isEqualTo("task-0");
            assertThat(parent.getChildAllocators()).hasSize(1);

            arena.close();
            arena.close();

            assertThat(arena.isClosed()).isTrue();
            assertThat(parent.getChildAllocators()).isEmpty();
        }
    }

    @Test
    void testCapacityIsBounded() {
        try (BufferAllocator parent = new RootAllocator();
                BufferArena arena = new BufferArena(parent, "bounded", 1024)) {
            try (ArrowBuf buf = arena.getAllocator().buffer(512)) {
                assertThat(buf.capacity()).isGreaterThanOrEqualTo(512);
            }
            assertThatThrownBy(() -> arena.getAllocator().buffer(4096))
                    .isInstanceOf(OutOfMemoryException.class);
        }
    }
}
