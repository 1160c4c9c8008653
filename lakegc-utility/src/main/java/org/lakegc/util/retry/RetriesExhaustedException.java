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

import java.io.IOException;

import com.google.common.base.Optional;


/**
 * Thrown when every attempt allowed by the retry budget ended in a retryable outcome. Carries the last transport
 * error as its cause, or the last retryable status code.
 */
public class RetriesExhaustedException extends IOException {

  private static final long serialVersionUID = 1L;

  private final int attempts;
  private final Optional<Integer> lastStatusCode;

  public RetriesExhaustedException(String target, int attempts, Throwable lastError) {
    super(String.format("Giving up on %s after %d attempts: %s", target, attempts, lastError), lastError);
    this.attempts = attempts;
    this.lastStatusCode = Optional.absent();
  }

  public RetriesExhaustedException(String target, int attempts, int lastStatusCode) {
    super(String.format("Giving up on %s after %d attempts, last status %d", target, attempts, lastStatusCode));
    this.attempts = attempts;
    this.lastStatusCode = Optional.of(lastStatusCode);
  }

  public int getAttempts() {
    return this.attempts;
  }

  public Optional<Integer> getLastStatusCode() {
    return this.lastStatusCode;
  }
}
