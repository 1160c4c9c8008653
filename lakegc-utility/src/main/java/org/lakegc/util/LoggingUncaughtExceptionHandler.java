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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Optional;


/**
 * Logs exceptions escaping the worker threads of the mark and sweep pools.
 */
public class LoggingUncaughtExceptionHandler implements Thread.UncaughtExceptionHandler {

  private final Logger logger;

  public LoggingUncaughtExceptionHandler(Optional<Logger> logger) {
    this.logger = logger.or(LoggerFactory.getLogger(LoggingUncaughtExceptionHandler.class));
  }

  @Override
  public void uncaughtException(Thread t, Throwable e) {
    this.logger.error(String.format("Thread %s threw an uncaught exception: %s", t.getName(), e), e);
  }
}
