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

package org.lakegc.util.retry;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.github.rholder.retry.WaitStrategy;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.lakegc.configuration.ConfigurationKeys;


/**
 * Factory class that builds {@link RetryerBuilder}s from a config block.
 *
 * <p>
 *   Keys are relative to the block, e.g. for the control plane client the block at
 *   {@link ConfigurationKeys#HTTP_RETRY_PREFIX} holds {@code max}, {@code min_wait_ms} and {@code max_wait_ms}.
 *   Callers add their own result and exception predicates before building.
 * </p>
 *
 * @param <T> result type of the retried call
 */
public class RetryerFactory<T> {

  public static final String RETRY_MAX = "max";
  public static final String RETRY_MIN_WAIT_MS = "min_wait_ms";
  public static final String RETRY_MAX_WAIT_MS = "max_wait_ms";
  public static final String RETRY_TYPE = "type";

  private static final Config DEFAULTS;
  static {
    Map<String, Object> configMap = ImmutableMap.<String, Object>builder()
        .put(RETRY_MAX, ConfigurationKeys.DEFAULT_HTTP_RETRY_MAX)
        .put(RETRY_MIN_WAIT_MS, ConfigurationKeys.DEFAULT_HTTP_RETRY_MIN_WAIT_MS)
        .put(RETRY_MAX_WAIT_MS, ConfigurationKeys.DEFAULT_HTTP_RETRY_MAX_WAIT_MS)
        .put(RETRY_TYPE, RetryType.EXPONENTIAL.name())
        .build();
    DEFAULTS = ConfigFactory.parseMap(configMap);
  }

  public enum RetryType {
    EXPONENTIAL,
    FIXED;
  }

  private RetryerFactory() {
  }

  /**
   * @return the config block at <code>path</code> with the defaults applied, or the defaults alone if absent
   */
  public static Config retryConfig(Config config, String path) {
    Config block = config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    return block.withFallback(DEFAULTS);
  }

  /**
   * Number of attempts allowed by the config block: the first call plus {@code max} retries.
   */
  public static int maxAttempts(Config retryConfig) {
    return retryConfig.withFallback(DEFAULTS).getInt(RETRY_MAX) + 1;
  }

  public static WaitStrategy newWaitStrategy(Config retryConfig) {
    Config config = retryConfig.withFallback(DEFAULTS);
    long minWait = config.getLong(RETRY_MIN_WAIT_MS);
    long maxWait = config.getLong(RETRY_MAX_WAIT_MS);
    RetryType type = RetryType.valueOf(config.getString(RETRY_TYPE).toUpperCase());
    switch (type) {
      case EXPONENTIAL:
        return new ExponentialBackoffWaitStrategy(minWait, maxWait, TimeUnit.MILLISECONDS);
      case FIXED:
        return WaitStrategies.fixedWait(minWait, TimeUnit.MILLISECONDS);
      default:
        throw new IllegalArgumentException(type + " is not supported");
    }
  }

  /**
   * Creates a builder with the wait and stop strategies of the config block, blocking through <code>context</code>.
   */
  public static <T> RetryerBuilder<T> newBuilder(Config retryConfig, CallContext context) {
    return RetryerBuilder.<T>newBuilder()
        .withWaitStrategy(newWaitStrategy(retryConfig))
        .withStopStrategy(StopStrategies.stopAfterAttempt(maxAttempts(retryConfig)))
        .withBlockStrategy(new CallContextBlockStrategy(context));
  }
}
