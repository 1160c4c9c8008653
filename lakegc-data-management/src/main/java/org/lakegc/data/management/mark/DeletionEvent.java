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

package org.lakegc.data.management.mark;

import org.joda.time.Instant;

import com.google.common.base.Preconditions;

import org.lakegc.data.management.retention.RetentionPolicyEngine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The event that started the retention clock of an address on one branch: either a commit that removed the address
 * from the tree, or the deletion of a branch that still held it.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DeletionEvent {

  private final String branch;
  private final Instant time;
  private final int retentionDays;
  private final boolean implicit;

  public DeletionEvent(String branch, Instant time, int retentionDays, boolean implicit) {
    this.branch = Preconditions.checkNotNull(branch);
    this.time = Preconditions.checkNotNull(time);
    this.retentionDays = retentionDays;
    this.implicit = implicit;
  }

  public boolean isExpired(Instant now) {
    return RetentionPolicyEngine.isExpired(this.time, this.retentionDays, now);
  }
}
