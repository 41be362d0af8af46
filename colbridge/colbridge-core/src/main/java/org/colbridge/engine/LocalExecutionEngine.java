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

import org.colbridge.BridgeOptions;
import org.colbridge.data.InternalRow;
import org.colbridge.data.RowConverter;
import org.colbridge.task.LocalTaskContext;
import org.colbridge.types.RowType;
import org.colbridge.utils.CloseableIterator;
import org.colbridge.utils.ExceptionUtils;
import org.colbridge.utils.ExecutorThreadFactory;

import com.google.common.collect.Iterators;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.colbridge.utils.Preconditions.checkArgument;
import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 在本 JVM 的固定大小线程池中执行分区任务的引擎。
 *
 * <p>每个分区提交一个任务,任务结束时(成功、失败或被终止)执行其 {@link LocalTaskContext}
 * 上注册的释放回调。输出按分区编号顺序拼接。
 *
 * <p>某个分区失败后,其余任务被标记为终止,引擎等待它们全部结束(从而释放资源)后,原样抛出第一个失败。
 */
public class LocalExecutionEngine implements ExecutionEngine<LocalDataset> {

    private static final Logger LOG = LoggerFactory.getLogger(LocalExecutionEngine.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final int parallelism;
    private final ExecutorService executor;

    public LocalExecutionEngine(BridgeOptions options) {
        this(options.engineParallelism());
    }

    public LocalExecutionEngine(int parallelism) {
        checkArgument(parallelism > 0, "parallelism must be positive, but is %s.", parallelism);
        this.parallelism = parallelism;
        this.executor =
                Executors.newFixedThreadPool(
                        parallelism, new ExecutorThreadFactory("colbridge-local-engine"));
    }

    public int parallelism() {
        return parallelism;
    }

    @Override
    public <T> List<T> mapPartitionsAndCollect(
            PartitionedDataset dataset, PartitionFunction<T> function) {
        checkNotNull(dataset, "dataset must not be null");
        checkNotNull(function, "function must not be null");

        int numPartitions = dataset.numPartitions();
        LOG.debug("Running {} partition tasks with parallelism {}.", numPartitions, parallelism);

        List<LocalTaskContext> contexts = new ArrayList<>(numPartitions);
        List<Future<PartitionResult<T>>> futures = new ArrayList<>(numPartitions);
        CompletionService<PartitionResult<T>> completionService =
                new ExecutorCompletionService<>(executor);
        for (int i = 0; i < numPartitions; i++) {
            LocalTaskContext context = new LocalTaskContext(i, 0);
            contexts.add(context);
            futures.add(completionService.submit(() -> runTask(dataset, function, context)));
        }

        List<List<T>> outputs = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            outputs.add(null);
        }
        try {
            for (int i = 0; i < numPartitions; i++) {
                PartitionResult<T> result = completionService.take().get();
                outputs.set(result.partition, result.output);
            }
        } catch (ExecutionException e) {
            killAndAwait(contexts, futures);
            throw ExceptionUtils.rethrowUnchecked(e.getCause());
        } catch (InterruptedException e) {
            killAndAwait(contexts, futures);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for partition tasks.", e);
        }

        List<T> collected = new ArrayList<>();
        for (List<T> output : outputs) {
            collected.addAll(output);
        }
        return collected;
    }

    private static <T> PartitionResult<T> runTask(
            PartitionedDataset dataset, PartitionFunction<T> function, LocalTaskContext context)
            throws Exception {
        Throwable failure = null;
        try {
            context.killTaskIfInterrupted();
            CloseableIterator<InternalRow> rows = dataset.compute(context.partitionId(), context);
            context.addTaskCompletionListener(ctx -> rows.close());

            Iterator<T> output = function.apply(rows, context);
            List<T> collected = new ArrayList<>();
            while (output.hasNext()) {
                context.killTaskIfInterrupted();
                collected.add(output.next());
            }
            LOG.debug(
                    "Partition {} produced {} elements.", context.partitionId(), collected.size());
            return new PartitionResult<>(context.partitionId(), collected);
        } catch (Throwable t) {
            failure = t;
            throw t;
        } finally {
            context.markTaskCompleted(failure);
        }
    }

    /**
     * 标记全部任务终止,并等待每个任务执行完毕。
     *
     * <p>不能调用 {@link Future#cancel}:运行中的任务被取消后 {@code get()} 立即返回,不会等到完成回调执行。
     * 尚未开始的任务在开始时检查终止标记并立即失败。
     */
    private static void killAndAwait(
            List<LocalTaskContext> contexts, List<? extends Future<?>> futures) {
        for (LocalTaskContext context : contexts) {
            context.markInterrupted();
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                LOG.debug("Partition task ended after kill.", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * 把外部行平均切分为 {@code numPartitions} 个分区,行在各自的任务中按需转换为内部行。
     *
     * @param rowType 行类型
     * @param rows 外部行,每个元素是按字段顺序排列的 Java 值
     * @param numPartitions 分区数
     * @param sessionZone 解释带本地时区时间戳时使用的时区
     */
    public LocalDataset parallelize(
            RowType rowType, List<Object[]> rows, int numPartitions, ZoneId sessionZone) {
        checkArgument(
                numPartitions > 0, "numPartitions must be positive, but is %s.", numPartitions);
        RowConverter converter = new RowConverter(rowType, sessionZone);
        int total = rows.size();
        List<PartitionReader> readers = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            int from = (int) ((long) i * total / numPartitions);
            int to = (int) ((long) (i + 1) * total / numPartitions);
            List<Object[]> slice = rows.subList(from, to);
            readers.add(
                    context ->
                            CloseableIterator.adapterForIterator(
                                    Iterators.transform(slice.iterator(), converter::toInternal)));
        }
        return createDataset(rowType, readers);
    }

    public LocalDataset parallelize(RowType rowType, List<Object[]> rows, int numPartitions) {
        return parallelize(rowType, rows, numPartitions, ZoneId.systemDefault());
    }

    @Override
    public LocalDataset createDataset(RowType rowType, List<PartitionReader> readers) {
        return new LocalDataset(this, rowType, readers);
    }

    @Override
    public void close() {
        if (!MoreExecutors.shutdownAndAwaitTermination(
                executor, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            LOG.warn(
                    "Local engine executor did not terminate within {} seconds.",
                    SHUTDOWN_TIMEOUT_SECONDS);
        }
    }

    private static class PartitionResult<T> {

        private final int partition;
        private final List<T> output;

        private PartitionResult(int partition, List<T> output) {
            this.partition = partition;
            this.output = output;
        }
    }
}
