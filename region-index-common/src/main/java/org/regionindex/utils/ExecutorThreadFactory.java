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

package org.regionindex.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 为检索线程池创建守护线程的工厂。
 *
 * <p>线程名为 {@code <poolName>-thread-<n>}。默认的未捕获异常处理器只记录 ERROR 日志,不终止进程,
 * 检索任务的异常由 {@link java.util.concurrent.Future} 传回调用方。
 */
public class ExecutorThreadFactory implements ThreadFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorThreadFactory.class);

    private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER =
            (t, e) -> LOG.error("Uncaught exception in thread '{}'.", t.getName(), e);

    private final AtomicInteger threadNumber = new AtomicInteger(1);

    private final String namePrefix;

    private final int threadPriority;

    @Nullable private final Thread.UncaughtExceptionHandler exceptionHandler;

    public ExecutorThreadFactory(String poolName) {
        this(poolName, LOGGING_HANDLER);
    }

    public ExecutorThreadFactory(
            String poolName, @Nullable Thread.UncaughtExceptionHandler exceptionHandler) {
        this(poolName, Thread.NORM_PRIORITY, exceptionHandler);
    }

    ExecutorThreadFactory(
            final String poolName,
            final int threadPriority,
            @Nullable final Thread.UncaughtExceptionHandler exceptionHandler) {
        this.namePrefix = checkNotNull(poolName, "poolName") + "-thread-";
        this.threadPriority = threadPriority;
        this.exceptionHandler = exceptionHandler;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread t = new Thread(runnable, namePrefix + threadNumber.getAndIncrement());
        t.setDaemon(true);
        t.setPriority(threadPriority);

        if (exceptionHandler != null) {
            t.setUncaughtExceptionHandler(exceptionHandler);
        }

        return t;
    }
}
