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

import com.github.rholder.retry.BlockStrategy;
import com.google.common.base.Preconditions;


/**
 * A {@link BlockStrategy} whose backoff waits end as soon as the {@link CallContext} is done. A wait cut short this
 * way surfaces as an {@link InterruptedException} so that the retryer stops; callers tell it apart from a real
 * interruption through {@link CallContext#isDone()}.
 */
public class CallContextBlockStrategy implements BlockStrategy {

  private final CallContext context;

  public CallContextBlockStrategy(CallContext context) {
    this.context = Preconditions.checkNotNull(context);
  }

  @Override
  public void block(long sleepTime) throws InterruptedException {
    if (!this.context.sleep(sleepTime)) {
      throw new InterruptedException(this.context.getError().isPresent()
          ? this.context.getError().get().getMessage() : ContextDoneException.CANCELED_MESSAGE);
    }
  }
}
