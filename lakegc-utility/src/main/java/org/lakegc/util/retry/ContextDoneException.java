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


/**
 * Thrown when a {@link CallContext} is cancelled or its deadline passes. Never retried.
 */
public class ContextDoneException extends IOException {

  private static final long serialVersionUID = 1L;

  public static final String CANCELED_MESSAGE = "context canceled";
  public static final String DEADLINE_EXCEEDED_MESSAGE = "context deadline exceeded";

  private final boolean deadlineExceeded;

  private ContextDoneException(String message, boolean deadlineExceeded) {
    super(message);
    this.deadlineExceeded = deadlineExceeded;
  }

  public static ContextDoneException canceled() {
    return new ContextDoneException(CANCELED_MESSAGE, false);
  }

  public static ContextDoneException deadlineExceeded() {
    return new ContextDoneException(DEADLINE_EXCEEDED_MESSAGE, true);
  }

  public boolean isDeadlineExceeded() {
    return this.deadlineExceeded;
  }
}
