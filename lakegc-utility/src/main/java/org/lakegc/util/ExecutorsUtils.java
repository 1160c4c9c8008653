/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lakegc.util;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;


/**
 * Helpers for the per-run worker pools used by the mark and sweep phases.
 */
public class ExecutorsUtils {

  public static final long EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT = 60;
  public static final TimeUnit EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT_TIMEUNIT = TimeUnit.SECONDS;

  private ExecutorsUtils() {
  }

  /**
   * Get a new {@link ThreadFactory} producing daemon threads named after <code>nameFormat</code> whose uncaught
   * exceptions are logged through <code>logger</code>.
   */
  public static ThreadFactory newDaemonThreadFactory(Optional<Logger> logger, Optional<String> nameFormat) {
    ThreadFactoryBuilder builder = new ThreadFactoryBuilder().setDaemon(true);
    if (nameFormat.isPresent()) {
      builder.setNameFormat(nameFormat.get());
    }
    return builder.setUncaughtExceptionHandler(new LoggingUncaughtExceptionHandler(logger)).build();
  }

  /**
   * Create a fixed size pool for one phase of one run.
   */
  public static ExecutorService newFixedThreadPool(int threads, Logger logger, String nameFormat) {
    Preconditions.checkArgument(threads > 0, "Thread count must be positive, got %s", threads);
    return Executors.newFixedThreadPool(threads, newDaemonThreadFactory(Optional.of(logger), Optional.of(nameFormat)));
  }

  /**
   * Shutdown an {@link ExecutorService} gradually, first disabling new task submissions and later cancelling
   * existing tasks.
   *
   * @param executorService the {@link ExecutorService} to shutdown
   * @param timeout the maximum time to wait for the {@code ExecutorService} to terminate
   * @param unit the time unit of the timeout argument
   */
  public static void shutdownExecutorService(ExecutorService executorService, long timeout, TimeUnit unit) {
    Preconditions.checkNotNull(unit);
    executorService.shutdown();
    try {
      long halfTimeoutNanos = TimeUnit.NANOSECONDS.convert(timeout, unit) / 2;
      if (!executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS)) {
        executorService.shutdownNow();
        executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }

  public static void shutdownExecutorService(ExecutorService executorService) {
    shutdownExecutorService(executorService, EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT,
        EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT_TIMEUNIT);
  }

  /**
   * Unwrap the cause of an {@link ExecutionException} thrown by a task, rethrowing it as the checked
   * <code>declaredType</code> when it is one and as an unchecked exception otherwise.
   */
  public static <X extends Exception> X unwrapExecutionException(ExecutionException ee, Class<X> declaredType)
      throws X {
    Throwable cause = ee.getCause() == null ? ee : ee.getCause();
    Throwables.throwIfInstanceOf(cause, declaredType);
    Throwables.throwIfUnchecked(cause);
    throw new IllegalStateException("Unexpected checked exception from task", cause);
  }
}
