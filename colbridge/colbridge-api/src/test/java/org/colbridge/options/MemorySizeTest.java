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

package org.colbridge.options;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link MemorySize}. */
class MemorySizeTest {

    @Test
    void testParse() {
        assertThat(MemorySize.parse("123").getBytes()).isEqualTo(123L);
        assertThat(MemorySize.parse("2 kb").getBytes()).isEqualTo(2048L);
        assertThat(MemorySize.parse("64m").getMebiBytes()).isEqualTo(64);
        assertThat(MemorySize.parse("1 G").getBytes()).isEqualTo(1L << 30);
    }

    @Test
    void testToString() {
        assertThat(MemorySize.ofMebiBytes(64).toString()).isEqualTo("64 mb");
        assertThat(MemorySize.ofBytes(1000).toString()).isEqualTo("1000 bytes");
        assertThat(MemorySize.parse(MemorySize.MAX_VALUE.toString()))
                .isEqualTo(MemorySize.MAX_VALUE);
    }

    @Test
    void testInvalid() {
        assertThatThrownBy(() -> MemorySize.parse("12 parsecs"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MemorySize.parse("mb"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> MemorySize.parse("99999999999 tb"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numeric overflow");
    }
}
