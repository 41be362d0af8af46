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

package org.colbridge;

import org.colbridge.options.ConfigOption;
import org.colbridge.options.MemorySize;
import org.colbridge.options.Options;

import java.io.Serializable;
import java.time.ZoneId;
import java.util.Map;

import static org.colbridge.options.ConfigOptions.key;
import static org.colbridge.utils.Preconditions.checkArgument;

/**
 * 行数据与 Arrow 批次互转的配置项。
 *
 * <p>静态字段定义配置项本身,实例方法从一组 {@link Options} 中读取并校验配置值。
 */
public class BridgeOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 每个 Arrow 批次的最大行数,小于等于 0 表示把一个分区的全部行写入同一个批次。 */
    public static final ConfigOption<Integer> ARROW_MAX_RECORDS_PER_BATCH =
            key("arrow.max-records-per-batch")
                    .intType()
                    .defaultValue(10000)
                    .withFallbackKeys("arrow.maxRecordsPerBatch")
                    .withDescription(
                            "Maximum number of rows written into one Arrow record batch. "
                                    + "A value less than or equal to 0 puts all rows of a partition into a single batch.");

    public static final ConfigOption<String> SESSION_TIME_ZONE =
            key("session.time-zone")
                    .stringType()
                    .defaultValue(ZoneId.systemDefault().getId())
                    .withDescription(
                            "Session time zone id. It is recorded in the Arrow type of "
                                    + "TIMESTAMP WITH LOCAL TIME ZONE columns and used to interpret local date-times.");

    public static final ConfigOption<MemorySize> ARROW_MEMORY_MAX =
            key("arrow.memory.max")
                    .memoryType()
                    .defaultValue(MemorySize.MAX_VALUE)
                    .withDescription("Upper bound of the root Arrow allocator.");

    public static final ConfigOption<MemorySize> ARROW_MEMORY_TASK_MAX =
            key("arrow.memory.task-max")
                    .memoryType()
                    .defaultValue(MemorySize.MAX_VALUE)
                    .withDescription(
                            "Upper bound of the child allocator created for every encode or decode task.");

    public static final ConfigOption<Integer> ENGINE_PARALLELISM =
            key("engine.parallelism")
                    .intType()
                    .defaultValue(Runtime.getRuntime().availableProcessors())
                    .withDescription("Number of threads of the local execution engine.");

    private final Options options;

    public BridgeOptions(Map<String, String> options) {
        this(Options.fromMap(options));
    }

    public BridgeOptions(Options options) {
        this.options = options;
    }

    public Options toConfiguration() {
        return options;
    }

    public int maxRecordsPerBatch() {
        return options.get(ARROW_MAX_RECORDS_PER_BATCH);
    }

    public String sessionTimeZone() {
        String zone = options.get(SESSION_TIME_ZONE);
        // 未知的时区 id 在这里直接报错
        ZoneId.of(zone);
        return zone;
    }

    public long arrowMemoryMax() {
        return options.get(ARROW_MEMORY_MAX).getBytes();
    }

    public long arrowTaskMemoryMax() {
        return options.get(ARROW_MEMORY_TASK_MAX).getBytes();
    }

    public int engineParallelism() {
        int parallelism = options.get(ENGINE_PARALLELISM);
        checkArgument(
                parallelism > 0,
                "%s must be positive, but is %s.",
                ENGINE_PARALLELISM.key(),
                parallelism);
        return parallelism;
    }
}
