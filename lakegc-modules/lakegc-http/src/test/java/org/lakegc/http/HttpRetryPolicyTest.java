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

import java.io.IOException;

import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.RedirectException;
import org.joda.time.Instant;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import org.lakegc.util.retry.CallContext;
import org.lakegc.util.retry.ContextDoneException;
import org.lakegc.util.retry.RetryDecision;


@Test(groups = { "lakegc.http" })
public class HttpRetryPolicyTest {

  private final HttpRetryPolicy policy = new HttpRetryPolicy();

  @Test
  public void testDeadlineExceededIsNotRetried() {
    CallContext context = CallContext.background().withDeadline(new Instant(0L));
    RetryDecision decision = this.policy.shouldRetry(context, 503);
    Assert.assertFalse(decision.isRetry());
    Assert.assertEquals(decision.getError().get().getMessage(), ContextDoneException.DEADLINE_EXCEEDED_MESSAGE);
  }

  @Test
  public void testCanceledIsNotRetried() {
    CallContext context = CallContext.cancellable();
    context.cancel();
    RetryDecision decision = this.policy.shouldRetry(context, new IOException("connection reset"));
    Assert.assertFalse(decision.isRetry());
    Assert.assertEquals(decision.getError().get().getMessage(), ContextDoneException.CANCELED_MESSAGE);
  }

  @Test
  public void testTooManyRedirectsSurfacesTransportError() {
    ClientProtocolException error =
        new ClientProtocolException(new RedirectException("stopped after 5 redirects"));
    RetryDecision decision = this.policy.shouldRetry(CallContext.background(), error);
    Assert.assertFalse(decision.isRetry());
    Assert.assertSame(decision.getError().get(), error);
  }

  @Test
  public void testTransportErrorIsRetried() {
    IOException error = new IOException("connection refused");
    RetryDecision decision = this.policy.shouldRetry(CallContext.background(), error);
    Assert.assertTrue(decision.isRetry());
  }

  @DataProvider(name = "statuses")
  public Object[][] statuses() {
    return new Object[][] {
        { 429, true },
        { 500, true },
        { 502, true },
        { 503, true },
        { 200, false },
        { 201, false },
        { 401, false },
        { 404, false }
    };
  }

  @Test(dataProvider = "statuses")
  public void testStatusClassification(int status, boolean retry) {
    RetryDecision decision = this.policy.shouldRetry(CallContext.background(), status);
    Assert.assertEquals(decision.isRetry(), retry);
    Assert.assertFalse(decision.getError().isPresent());
  }
}
