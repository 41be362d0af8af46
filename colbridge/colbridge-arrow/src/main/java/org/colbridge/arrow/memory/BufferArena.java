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

import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个任务独占的 Arrow 内存区域。
 *
 * <p>从调用方持有的父分配器中划出一个有容量上限的子分配器。任务内分配的所有缓冲区都来自这个子分配器,
 * 任务结束时 {@link #close()} 一次性释放。{@link #close()} 可以在多条清理路径上重复调用,
 * 子分配器只会被关闭一次。
 */
@ThreadSafe
public class BufferArena implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BufferArena.class);

    private final BufferAllocator allocator;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BufferArena(BufferAllocator parent, String name, long maxAllocation) {
        this.allocator = parent.newChildAllocator(name, 0, maxAllocation);
    }

    public BufferAllocator getAllocator() {
        return allocator;
    }

    public String getName() {
        return allocator.getName();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.debug(
                    "Releasing arena {}, peak memory allocation {} bytes.",
                    allocator.getName(),
                    allocator.getPeakMemoryAllocation());
            allocator.close();
        }
    }
}
