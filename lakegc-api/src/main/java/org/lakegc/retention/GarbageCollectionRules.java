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

package org.lakegc.retention;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * An immutable snapshot of the garbage collection rules of a repository: an ordered list of per-branch
 * {@link RetentionRule}s and the retention applied to every branch without a rule of its own.
 *
 * <p>
 *   Instances are not validated on construction so that rules read from the control plane can be reported as a
 *   whole; validation happens once per run before the ancestry walk starts.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class GarbageCollectionRules {

  private final ImmutableList<RetentionRule> branches;
  private final int defaultRetentionDays;

  public GarbageCollectionRules(List<RetentionRule> branches, int defaultRetentionDays) {
    Preconditions.checkNotNull(branches, "Branch rules are null.");
    this.branches = ImmutableList.copyOf(branches);
    this.defaultRetentionDays = defaultRetentionDays;
  }

  public static GarbageCollectionRules withDefault(int defaultRetentionDays) {
    return new GarbageCollectionRules(ImmutableList.<RetentionRule>of(), defaultRetentionDays);
  }
}
