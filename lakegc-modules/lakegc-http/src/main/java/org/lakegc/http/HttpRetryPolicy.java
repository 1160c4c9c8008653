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

import org.apache.http.client.RedirectException;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;

import org.lakegc.util.retry.CallContext;
import org.lakegc.util.retry.ContextDoneException;
import org.lakegc.util.retry.RetryDecision;


/**
 * Decides whether a control plane call is tried again.
 *
 * <ul>
 *   <li>A done {@link CallContext} ends the call with the context error.</li>
 *   <li>A transport error caused by too many redirects ends the call with that error.</li>
 *   <li>Any other transport error is retried.</li>
 *   <li>Status 429 and 5xx are retried.</li>
 *   <li>Every other status ends the call without error; the caller interprets it.</li>
 * </ul>
 */
public class HttpRetryPolicy {

  public static final int TOO_MANY_REQUESTS = 429;

  public RetryDecision shouldRetry(CallContext context, Optional<Integer> statusCode, Optional<Exception> error) {
    Optional<ContextDoneException> done = context.getError();
    if (done.isPresent()) {
      return RetryDecision.fail(done.get());
    }
    if (error.isPresent()) {
      if (isRedirectFailure(error.get())) {
        return RetryDecision.fail(error.get());
      }
      return RetryDecision.retry(error.get());
    }
    if (statusCode.isPresent() && isRetryableStatus(statusCode.get())) {
      return RetryDecision.retry();
    }
    return RetryDecision.done();
  }

  public RetryDecision shouldRetry(CallContext context, int statusCode) {
    return shouldRetry(context, Optional.of(statusCode), Optional.<Exception>absent());
  }

  public RetryDecision shouldRetry(CallContext context, Exception error) {
    return shouldRetry(context, Optional.<Integer>absent(), Optional.of(error));
  }

  public static boolean isRetryableStatus(int statusCode) {
    return statusCode == TOO_MANY_REQUESTS || (statusCode >= 500 && statusCode <= 599);
  }

  private static boolean isRedirectFailure(Exception error) {
    for (Throwable cause : Throwables.getCausalChain(error)) {
      if (cause instanceof RedirectException) {
        return true;
      }
    }
    return false;
  }
}
