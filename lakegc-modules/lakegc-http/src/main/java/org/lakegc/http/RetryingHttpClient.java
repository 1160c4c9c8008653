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

package org.lakegc.http;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.google.common.base.Optional;
import com.google.common.base.Predicate;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.util.retry.CallContext;
import org.lakegc.util.retry.RetriesExhaustedException;
import org.lakegc.util.retry.RetryDecision;
import org.lakegc.util.retry.RetryerFactory;

import lombok.extern.slf4j.Slf4j;


/**
 * A synchronous HTTP client that retries calls according to {@link HttpRetryPolicy}, backing off exponentially
 * between attempts.
 *
 * <p>
 *   Every attempt reads the whole response into an {@link HttpResult} and releases its connection. Backoff waits
 *   end early when the {@link CallContext} of the call is done, and no attempt starts once it is.
 * </p>
 */
@Slf4j
public class RetryingHttpClient implements Closeable {

  public static final int MAX_REDIRECTS = 10;

  private static final Config FALLBACK = ConfigFactory.parseMap(ImmutableMap.<String, Object>builder()
      .put(ConfigurationKeys.HTTP_MAX_IDLE_CONNS_PER_HOST_KEY, ConfigurationKeys.DEFAULT_HTTP_MAX_IDLE_CONNS_PER_HOST)
      .put(ConfigurationKeys.HTTP_MAX_TOTAL_CONNS_KEY, ConfigurationKeys.DEFAULT_HTTP_MAX_TOTAL_CONNS)
      .put(ConfigurationKeys.HTTP_REQUEST_TIMEOUT_MS_KEY, ConfigurationKeys.DEFAULT_HTTP_REQUEST_TIMEOUT_MS)
      .put(ConfigurationKeys.HTTP_CONNECTION_TIMEOUT_MS_KEY, ConfigurationKeys.DEFAULT_HTTP_CONNECTION_TIMEOUT_MS)
      .build());

  private final CloseableHttpClient client;
  private final Config retryConfig;
  private final HttpRetryPolicy policy;

  public RetryingHttpClient(Config config) {
    this(config, new HttpRetryPolicy());
  }

  public RetryingHttpClient(Config config, HttpRetryPolicy policy) {
    config = config.withFallback(FALLBACK);
    this.retryConfig = RetryerFactory.retryConfig(config, ConfigurationKeys.HTTP_RETRY_PREFIX);
    this.policy = policy;

    RequestConfig requestConfig = RequestConfig.copy(RequestConfig.DEFAULT)
        .setSocketTimeout(config.getInt(ConfigurationKeys.HTTP_REQUEST_TIMEOUT_MS_KEY))
        .setConnectTimeout(config.getInt(ConfigurationKeys.HTTP_CONNECTION_TIMEOUT_MS_KEY))
        .setConnectionRequestTimeout(config.getInt(ConfigurationKeys.HTTP_CONNECTION_TIMEOUT_MS_KEY))
        .setMaxRedirects(MAX_REDIRECTS)
        .build();

    PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(config.getInt(ConfigurationKeys.HTTP_MAX_TOTAL_CONNS_KEY));
    connectionManager.setDefaultMaxPerRoute(config.getInt(ConfigurationKeys.HTTP_MAX_IDLE_CONNS_PER_HOST_KEY));

    this.client = HttpClientBuilder.create()
        .disableCookieManagement()
        .useSystemProperties()
        .disableAutomaticRetries()
        .setDefaultRequestConfig(requestConfig)
        .setConnectionManager(connectionManager)
        .build();
  }

  /**
   * Execute <code>request</code> until it yields a non retryable outcome or the retry budget is spent.
   *
   * @return the first result with a non retryable status
   * @throws org.lakegc.util.retry.ContextDoneException if the context is done before a final outcome
   * @throws RetriesExhaustedException if every allowed attempt had a retryable outcome
   * @throws IOException the transport error of an attempt that is not retried
   */
  public HttpResult execute(final HttpUriRequest request, final CallContext context) throws IOException {
    final String target = request.getMethod() + " " + request.getURI();
    Retryer<HttpResult> retryer = RetryerFactory.<HttpResult>newBuilder(this.retryConfig, context)
        .retryIfResult(new Predicate<HttpResult>() {
          @Override
          public boolean apply(HttpResult result) {
            return policy.shouldRetry(context, result.getStatusCode()).isRetry();
          }
        })
        .retryIfException(new Predicate<Throwable>() {
          @Override
          public boolean apply(Throwable t) {
            return t instanceof Exception && policy.shouldRetry(context, (Exception) t).isRetry();
          }
        })
        .withRetryListener(new RetryListener() {
          @Override
          public <V> void onRetry(Attempt<V> attempt) {
            if (attempt.hasException()) {
              log.warn(String.format("Attempt %d of %s failed: %s", attempt.getAttemptNumber(), target,
                  attempt.getExceptionCause()));
            } else if (attempt.getResult() instanceof HttpResult
                && HttpRetryPolicy.isRetryableStatus(((HttpResult) attempt.getResult()).getStatusCode())) {
              log.warn(String.format("Attempt %d of %s returned status %d", attempt.getAttemptNumber(), target,
                  ((HttpResult) attempt.getResult()).getStatusCode()));
            }
          }
        })
        .build();

    try {
      HttpResult result = retryer.call(new Callable<HttpResult>() {
        @Override
        public HttpResult call() throws IOException {
          context.checkNotDone();
          try (CloseableHttpResponse response = client.execute(request)) {
            return HttpResult.of(response);
          }
        }
      });
      // A retryable status only gets here when the context ended during the attempt.
      if (HttpRetryPolicy.isRetryableStatus(result.getStatusCode())) {
        context.checkNotDone();
      }
      return result;
    } catch (ExecutionException ee) {
      Throwable cause = ee.getCause() == null ? ee : ee.getCause();
      if (cause instanceof Exception) {
        RetryDecision decision = this.policy.shouldRetry(context, (Exception) cause);
        if (decision.getError().isPresent()) {
          Throwables.throwIfInstanceOf(decision.getError().get(), IOException.class);
        }
      }
      Throwables.throwIfInstanceOf(cause, IOException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IOException("Failed to execute " + target, cause);
    } catch (RetryException re) {
      if (context.isDone()) {
        // The retryer marks the thread interrupted when a backoff wait is cut short by the context.
        Thread.interrupted();
        throw context.getError().get();
      }
      Attempt<?> last = re.getLastFailedAttempt();
      if (last.hasException()) {
        throw new RetriesExhaustedException(target, re.getNumberOfFailedAttempts(), last.getExceptionCause());
      }
      Optional<Integer> status = last.getResult() instanceof HttpResult
          ? Optional.of(((HttpResult) last.getResult()).getStatusCode()) : Optional.<Integer>absent();
      if (status.isPresent()) {
        throw new RetriesExhaustedException(target, re.getNumberOfFailedAttempts(), status.get());
      }
      throw new IOException("Failed to execute " + target, re);
    }
  }

  @Override
  public void close() throws IOException {
    this.client.close();
  }
}
