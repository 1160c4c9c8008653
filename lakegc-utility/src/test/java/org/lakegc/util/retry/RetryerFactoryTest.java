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

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.lakegc.configuration.ConfigurationKeys;


@Test(groups = { "lakegc.util.retry" })
public class RetryerFactoryTest {

  private static final Config FAST = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
      ConfigurationKeys.HTTP_RETRY_MAX_KEY, 3,
      ConfigurationKeys.HTTP_RETRY_MIN_WAIT_MS_KEY, 1,
      ConfigurationKeys.HTTP_RETRY_MAX_WAIT_MS_KEY, 2));

  @Test
  public void testDefaults() {
    Config retryConfig = RetryerFactory.retryConfig(ConfigFactory.empty(), ConfigurationKeys.HTTP_RETRY_PREFIX);
    Assert.assertEquals(RetryerFactory.maxAttempts(retryConfig), ConfigurationKeys.DEFAULT_HTTP_RETRY_MAX + 1);
    Assert.assertEquals(retryConfig.getLong(RetryerFactory.RETRY_MIN_WAIT_MS), 200L);
    Assert.assertEquals(retryConfig.getLong(RetryerFactory.RETRY_MAX_WAIT_MS), 30000L);
    Assert.assertTrue(RetryerFactory.newWaitStrategy(retryConfig) instanceof ExponentialBackoffWaitStrategy);
  }

  @Test
  public void testStopsAfterRetryMaxPlusOneAttempts() throws Exception {
    Config retryConfig = RetryerFactory.retryConfig(FAST, ConfigurationKeys.HTTP_RETRY_PREFIX);
    Retryer<Boolean> retryer = RetryerFactory.<Boolean>newBuilder(retryConfig, CallContext.background())
        .retryIfResult(Predicates.equalTo(Boolean.FALSE))
        .build();

    final AtomicInteger calls = new AtomicInteger();
    try {
      retryer.call(new Callable<Boolean>() {
        @Override
        public Boolean call() {
          calls.incrementAndGet();
          return Boolean.FALSE;
        }
      });
      Assert.fail();
    } catch (RetryException e) {
      Assert.assertEquals(e.getNumberOfFailedAttempts(), 4);
    }
    Assert.assertEquals(calls.get(), 4);
  }

  @Test
  public void testSucceedsOnceResultIsAccepted() throws Exception {
    Config retryConfig = RetryerFactory.retryConfig(FAST, ConfigurationKeys.HTTP_RETRY_PREFIX);
    Retryer<Integer> retryer = RetryerFactory.<Integer>newBuilder(retryConfig, CallContext.background())
        .retryIfResult(Predicates.equalTo(429))
        .build();

    final AtomicInteger calls = new AtomicInteger();
    int status = retryer.call(new Callable<Integer>() {
      @Override
      public Integer call() {
        return calls.incrementAndGet() < 3 ? 429 : 200;
      }
    });
    Assert.assertEquals(status, 200);
    Assert.assertEquals(calls.get(), 3);
  }

  @Test
  public void testCancelledContextStopsBackoff() throws ExecutionException {
    Config retryConfig = RetryerFactory.retryConfig(ConfigFactory.empty(), ConfigurationKeys.HTTP_RETRY_PREFIX);
    CallContext context = CallContext.cancellable();
    context.cancel();
    Retryer<Boolean> retryer = RetryerFactory.<Boolean>newBuilder(retryConfig, context)
        .retryIfResult(Predicates.equalTo(Boolean.FALSE))
        .build();

    final AtomicInteger calls = new AtomicInteger();
    try {
      retryer.call(new Callable<Boolean>() {
        @Override
        public Boolean call() {
          calls.incrementAndGet();
          return Boolean.FALSE;
        }
      });
      Assert.fail();
    } catch (RetryException e) {
      Assert.assertEquals(e.getNumberOfFailedAttempts(), 1);
    } finally {
      // The retryer restores the interrupt flag when a wait is cut short.
      Thread.interrupted();
    }
    Assert.assertEquals(calls.get(), 1);
  }

  @Test
  public void testFixedWait() {
    Config retryConfig = RetryerFactory.retryConfig(ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        ConfigurationKeys.HTTP_RETRY_PREFIX + "." + RetryerFactory.RETRY_TYPE, "fixed")),
        ConfigurationKeys.HTTP_RETRY_PREFIX);
    Assert.assertFalse(RetryerFactory.newWaitStrategy(retryConfig) instanceof ExponentialBackoffWaitStrategy);
  }
}
