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

import org.colbridge.data.BinaryString;
import org.colbridge.data.GenericRow;
import org.colbridge.data.InternalRow;
import org.colbridge.types.DataTypes;
import org.colbridge.types.RowType;
import org.colbridge.utils.CloseableIterator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link LocalExecutionEngine} and {@link LocalDataset}. */
class LocalExecutionEngineTest {

    private static final RowType ROW_TYPE =
            RowType.builder()
                    .field("id", DataTypes.INT())
                    .field("name", DataTypes.STRING())
                    .build();

    private LocalExecutionEngine engine;

    @BeforeEach
    void before() {
        engine = new LocalExecutionEngine(4);
    }

    @AfterEach
    void after() {
        engine.close();
    }

    private static List<Object[]> externalRows(int count) {
        List<Object[]> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(new Object[] {i, "name-" + i});
        }
        return rows;
    }

    @Test
    void testResultsInPartitionOrder() {
        List<PartitionReader> readers = new ArrayList<>();
        for (int p = 0; p < 8; p++) {
            int partition = p;
            readers.add(
                    context -> {
                        // 编号小的分区更晚完成
                        Thread.sleep((8 - partition) * 5L);
                        return CloseableIterator.adapterForIterator(
                                Collections.<InternalRow>singletonList(
                                                GenericRow.of(
                                                        partition,
                                                        BinaryString.fromString("p" + partition)))
                                        .iterator());
                    });
        }
        LocalDataset dataset = engine.createDataset(ROW_TYPE, readers);

        List<InternalRow> rows = dataset.collect();

        assertThat(rows).hasSize(8);
        for (int i = 0; i < rows.size(); i++) {
            assertThat(rows.get(i).getInt(0)).isEqualTo(i);
        }
    }

    @Test
    void testParallelizeAndCollect() {
        LocalDataset dataset = engine.parallelize(ROW_TYPE, externalRows(10), 3, ZoneId.of("UTC"));

        assertThat(dataset.numPartitions()).isEqualTo(3);
        assertThat(dataset.count()).isEqualTo(10);

        List<Object[]> collected = dataset.collectExternal(ZoneId.of("UTC"));
        assertThat(collected).hasSize(10);
        for (int i = 0; i < 10; i++) {
            assertThat(collected.get(i)).containsExactly(i, "name-" + i);
        }
    }

    @Test
    void testMorePartitionsThanRows() {
        LocalDataset dataset = engine.parallelize(ROW_TYPE, externalRows(2), 5);
        assertThat(dataset.numPartitions()).isEqualTo(5);
        assertThat(dataset.collect()).hasSize(2);
    }

    @Test
    void testFirstFailureRethrownAndOthersKilled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger released = new AtomicInteger();
        List<PartitionReader> readers = new ArrayList<>();
        readers.add(
                context -> {
                    context.addTaskCompletionListener(ctx -> released.incrementAndGet());
                    started.countDown();
                    return CloseableIterator.adapterForIterator(
                            new Iterator<InternalRow>() {
                                @Override
                                public boolean hasNext() {
                                    context.killTaskIfInterrupted();
                                    return true;
                                }

                                @Override
                                public InternalRow next() {
                                    return GenericRow.of(1, null);
                                }
                            });
                });
        readers.add(
                context -> {
                    started.await(10, TimeUnit.SECONDS);
                    throw new IllegalStateException("boom");
                });
        LocalDataset dataset = engine.createDataset(ROW_TYPE, readers);

        assertThatThrownBy(dataset::count)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertThat(released.get()).isEqualTo(1);
    }

    @Test
    void testKilledTasksReleasedBeforeFailureRethrown() {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean(false);
        List<PartitionReader> readers = new ArrayList<>();
        readers.add(
                context -> {
                    context.addTaskCompletionListener(
                            ctx -> {
                                // 释放较慢的分区
                                Thread.sleep(200);
                                released.set(true);
                            });
                    started.countDown();
                    return CloseableIterator.adapterForIterator(
                            new Iterator<InternalRow>() {
                                @Override
                                public boolean hasNext() {
                                    context.killTaskIfInterrupted();
                                    return true;
                                }

                                @Override
                                public InternalRow next() {
                                    return GenericRow.of(1, null);
                                }
                            });
                });
        readers.add(
                context -> {
                    started.await(10, TimeUnit.SECONDS);
                    throw new IllegalStateException("boom");
                });
        // 排队中的分区也要在抛出之前结束
        for (int p = 0; p < 6; p++) {
            readers.add(
                    context ->
                            CloseableIterator.adapterForIterator(
                                    Collections.<InternalRow>emptyIterator()));
        }
        LocalDataset dataset = engine.createDataset(ROW_TYPE, readers);

        assertThatThrownBy(dataset::count).hasMessage("boom");
        assertThat(released.get()).isTrue();
    }

    @Test
    void testCheckedFailureWrappedOnce() {
        List<PartitionReader> readers =
                Collections.<PartitionReader>singletonList(
                        context -> {
                            throw new IOException("io");
                        });
        LocalDataset dataset = engine.createDataset(ROW_TYPE, readers);

        assertThatThrownBy(dataset::collect)
                .isInstanceOf(RuntimeException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasRootCauseMessage("io");
    }

    @Test
    void testInvalidParallelism() {
        assertThatThrownBy(() -> new LocalExecutionEngine(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }
}
