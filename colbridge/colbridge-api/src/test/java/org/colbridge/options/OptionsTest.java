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

import org.colbridge.BridgeOptions;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options} and {@link BridgeOptions}. */
class OptionsTest {

    @Test
    void testDefaults() {
        BridgeOptions options = new BridgeOptions(new Options());
        assertThat(options.maxRecordsPerBatch()).isEqualTo(10000);
        assertThat(options.arrowMemoryMax()).isEqualTo(Long.MAX_VALUE);
        assertThat(options.engineParallelism()).isPositive();
    }

    @Test
    void testTypedValues() {
        Map<String, String> map = new HashMap<>();
        map.put("arrow.max-records-per-batch", "2");
        map.put("session.time-zone", "Asia/Shanghai");
        map.put("arrow.memory.task-max", "64 mb");
        BridgeOptions options = new BridgeOptions(map);

        assertThat(options.maxRecordsPerBatch()).isEqualTo(2);
        assertThat(options.sessionTimeZone()).isEqualTo("Asia/Shanghai");
        assertThat(options.arrowTaskMemoryMax()).isEqualTo(64L << 20);
    }

    @Test
    void testFallbackKey() {
        Options options = new Options();
        options.setString("arrow.maxRecordsPerBatch", "7");
        assertThat(options.get(BridgeOptions.ARROW_MAX_RECORDS_PER_BATCH)).isEqualTo(7);
        assertThat(options.contains(BridgeOptions.ARROW_MAX_RECORDS_PER_BATCH)).isTrue();
    }

    @Test
    void testInvalidValues() {
        Options options = new Options();
        options.setString("arrow.max-records-per-batch", "many");
        assertThatThrownBy(() -> options.get(BridgeOptions.ARROW_MAX_RECORDS_PER_BATCH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("arrow.max-records-per-batch");

        options.set(BridgeOptions.ENGINE_PARALLELISM, 0);
        assertThatThrownBy(() -> new BridgeOptions(options).engineParallelism())
                .isInstanceOf(IllegalArgumentException.class);

        options.setString("session.time-zone", "Mars/Olympus");
        assertThatThrownBy(() -> new BridgeOptions(options).sessionTimeZone())
                .isInstanceOf(RuntimeException.class);
    }
}
