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

import com.google.common.base.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Verdict of a retry policy for one attempt: whether to try again, and the error to surface to the caller when the
 * attempt is final.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RetryDecision {

  private static final RetryDecision RETRY = new RetryDecision(true, Optional.<Exception>absent());
  private static final RetryDecision DONE = new RetryDecision(false, Optional.<Exception>absent());

  private final boolean retry;
  private final Optional<Exception> error;

  private RetryDecision(boolean retry, Optional<Exception> error) {
    this.retry = retry;
    this.error = error;
  }

  public static RetryDecision retry() {
    return RETRY;
  }

  public static RetryDecision done() {
    return DONE;
  }

  public static RetryDecision fail(Exception error) {
    return new RetryDecision(false, Optional.of(error));
  }

  /** A retryable outcome that also carries the error seen, so it can be reported if the budget runs out. */
  public static RetryDecision retry(Exception error) {
    return new RetryDecision(true, Optional.of(error));
  }
}
