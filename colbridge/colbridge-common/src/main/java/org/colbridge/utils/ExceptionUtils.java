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

import javax.annotation.Nullable;

/** 异常处理相关的工具方法。 */
public final class ExceptionUtils {

    /**
     * 合并两个异常:如果之前没有异常则返回新异常,否则把新异常作为 suppressed 附加到之前的异常上。
     *
     * <pre>{@code
     * Exception ex = null;
     * for (AutoCloseable c : closeables) {
     *     try {
     *         c.close();
     *     } catch (Exception e) {
     *         ex = ExceptionUtils.firstOrSuppressed(e, ex);
     *     }
     * }
     * }</pre>
     */
    public static <T extends Throwable> T firstOrSuppressed(T newException, @Nullable T previous) {
        if (newException == null) {
            throw new NullPointerException("newException must not be null");
        }

        if (previous == null || previous == newException) {
            return newException;
        } else {
            previous.addSuppressed(newException);
            return previous;
        }
    }

    /**
     * 执行 {@code action},无论成功与否都执行 {@code finallyAction}。
     *
     * <p>{@code action} 失败时,{@code finallyAction} 的异常作为 suppressed 附加到原异常上,
     * 不会覆盖原异常。
     */
    public static void tryWithSafeFinally(ThrowingRunnable action, ThrowingRunnable finallyAction)
            throws Exception {
        Throwable original = null;
        try {
            action.run();
        } catch (Throwable t) {
            original = t;
            throw t;
        } finally {
            if (original == null) {
                finallyAction.run();
            } else {
                try {
                    finallyAction.run();
                } catch (Throwable t) {
                    original.addSuppressed(t);
                }
            }
        }
    }

    /**
     * 如果是运行时异常或 Error 则原样抛出,否则包装为 {@link RuntimeException} 抛出。
     */
    public static RuntimeException rethrowUnchecked(Throwable t) {
        if (t instanceof Error) {
            throw (Error) t;
        } else if (t instanceof RuntimeException) {
            throw (RuntimeException) t;
        } else {
            throw new RuntimeException(t);
        }
    }

    /** 可以抛出受检异常的 {@link Runnable}。 */
    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }

    private ExceptionUtils() {}
}
