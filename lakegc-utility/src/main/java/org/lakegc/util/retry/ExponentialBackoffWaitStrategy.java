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

import java.util.concurrent.TimeUnit;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.WaitStrategy;
import com.google.common.base.Preconditions;


/**
 * Waits <code>min * 2^(n-1)</code> after the n-th failed attempt, never more than <code>max</code>.
 */
public class ExponentialBackoffWaitStrategy implements WaitStrategy {

  private final long minWaitMillis;
  private final long maxWaitMillis;

  public ExponentialBackoffWaitStrategy(long minWait, long maxWait, TimeUnit unit) {
    Preconditions.checkArgument(minWait >= 0, "Minimum wait must not be negative, got %s", minWait);
    Preconditions.checkArgument(maxWait >= minWait, "Maximum wait %s is below minimum wait %s", maxWait, minWait);
    this.minWaitMillis = unit.toMillis(minWait);
    this.maxWaitMillis = unit.toMillis(maxWait);
  }

  @Override
  public long computeSleepTime(Attempt failedAttempt) {
    return backoff(failedAttempt.getAttemptNumber());
  }

  public long backoff(long attemptNumber) {
    Preconditions.checkArgument(attemptNumber >= 1, "Attempt numbers start at 1, got %s", attemptNumber);
    long shift = attemptNumber - 1;
    if (this.minWaitMillis == 0) {
      return 0L;
    }
    if (shift >= Long.numberOfLeadingZeros(this.minWaitMillis) - 1) {
      return this.maxWaitMillis;
    }
    return Math.min(this.maxWaitMillis, this.minWaitMillis << shift);
  }
}
