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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.joda.time.DateTimeUtils;
import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;


/**
 * Cancellation and deadline carrier for a unit of work: a garbage collection run, a sweep, or a single control plane
 * call. Waits performed through {@link #sleep(long)} return early once the context is done.
 *
 * <p>
 *   A child created by {@link #withDeadline(Instant)} or {@link #withTimeout(long)} is done when its parent is.
 *   Cancelling a child does not cancel the parent.
 * </p>
 */
public class CallContext {

  private static final CallContext BACKGROUND = new CallContext(Optional.<CallContext>absent(),
      Optional.<Instant>absent()) {
    @Override
    public void cancel() {
      throw new UnsupportedOperationException("The background context cannot be cancelled");
    }
  };

  private final Optional<CallContext> parent;
  private final Optional<Instant> deadline;
  private final CountDownLatch canceled = new CountDownLatch(1);

  private CallContext(Optional<CallContext> parent, Optional<Instant> deadline) {
    this.parent = parent;
    this.deadline = deadline;
  }

  /**
   * @return a context that is never done
   */
  public static CallContext background() {
    return BACKGROUND;
  }

  /**
   * @return a new cancellable context without deadline
   */
  public static CallContext cancellable() {
    return new CallContext(Optional.<CallContext>absent(), Optional.<Instant>absent());
  }

  public CallContext withDeadline(Instant deadline) {
    Preconditions.checkNotNull(deadline, "Deadline is null.");
    return new CallContext(Optional.of(this), Optional.of(deadline));
  }

  public CallContext withTimeout(long timeoutMillis) {
    Preconditions.checkArgument(timeoutMillis >= 0, "Timeout must not be negative, got %s", timeoutMillis);
    return withDeadline(new Instant(DateTimeUtils.currentTimeMillis() + timeoutMillis));
  }

  public void cancel() {
    this.canceled.countDown();
  }

  public boolean isDone() {
    return getError().isPresent();
  }

  /**
   * @return the reason this context is done, absent while it is still live
   */
  public Optional<ContextDoneException> getError() {
    if (this.canceled.getCount() == 0) {
      return Optional.of(ContextDoneException.canceled());
    }
    if (this.deadline.isPresent() && DateTimeUtils.currentTimeMillis() >= this.deadline.get().getMillis()) {
      return Optional.of(ContextDoneException.deadlineExceeded());
    }
    if (this.parent.isPresent()) {
      return this.parent.get().getError();
    }
    return Optional.absent();
  }

  public void checkNotDone() throws ContextDoneException {
    Optional<ContextDoneException> error = getError();
    if (error.isPresent()) {
      throw error.get();
    }
  }

  /**
   * Wait for <code>millis</code> milliseconds or until the context is done, whichever comes first.
   *
   * @return true if the full wait elapsed, false if the context finished first
   */
  public boolean sleep(long millis) throws InterruptedException {
    long remaining = millis;
    while (remaining > 0) {
      if (isDone()) {
        return false;
      }
      long slice = Math.min(remaining, millisUntilDeadline());
      long start = DateTimeUtils.currentTimeMillis();
      if (awaitCancellation(slice)) {
        return false;
      }
      remaining -= Math.max(1L, DateTimeUtils.currentTimeMillis() - start);
    }
    return !isDone();
  }

  private boolean awaitCancellation(long millis) throws InterruptedException {
    if (this.canceled.await(Math.max(0L, millis), TimeUnit.MILLISECONDS)) {
      return true;
    }
    return this.parent.isPresent() && this.parent.get().isDone();
  }

  /** Parents are polled at most every 100ms. */
  private long millisUntilDeadline() {
    long bound = this.parent.isPresent() ? 100L : Long.MAX_VALUE;
    if (this.deadline.isPresent()) {
      bound = Math.min(bound, Math.max(0L, this.deadline.get().getMillis() - DateTimeUtils.currentTimeMillis()));
    }
    return bound;
  }
}
