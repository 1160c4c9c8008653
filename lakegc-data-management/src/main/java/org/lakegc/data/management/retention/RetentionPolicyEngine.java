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

package org.lakegc.data.management.retention;

import java.util.List;
import java.util.Set;

import org.joda.time.Duration;
import org.joda.time.Instant;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.lakegc.exception.ValidationException;
import org.lakegc.retention.GarbageCollectionRules;
import org.lakegc.retention.RetentionRule;


/**
 * Resolves the retention that applies to a branch and decides whether a deletion event has aged out of it.
 *
 * <p>
 *   A day is exactly 24 hours of elapsed time. An event whose age equals the retention is expired.
 * </p>
 */
public class RetentionPolicyEngine {

  private RetentionPolicyEngine() {
  }

  /**
   * @return the retention of the rule for <code>branchId</code>, or the default retention if no rule names it
   */
  public static int effectiveRetentionDays(GarbageCollectionRules rules, String branchId) {
    Preconditions.checkNotNull(rules, "Rules are null.");
    for (RetentionRule rule : rules.getBranches()) {
      if (rule.getBranchId().equals(branchId)) {
        return rule.getRetentionDays();
      }
    }
    return rules.getDefaultRetentionDays();
  }

  /**
   * @param referenceTime time of the deletion event
   * @param retentionDays retention that applies to the event
   * @param now evaluation time
   * @return true iff at least <code>retentionDays</code> days elapsed between <code>referenceTime</code> and
   *         <code>now</code>
   */
  public static boolean isExpired(Instant referenceTime, int retentionDays, Instant now) {
    Preconditions.checkArgument(retentionDays >= 0, "Retention must not be negative, got %s", retentionDays);
    return !now.isBefore(referenceTime.plus(Duration.standardDays(retentionDays)));
  }

  /**
   * Reject rules with a negative retention, an empty branch id or the same branch listed twice.
   *
   * @throws ValidationException listing every violation found
   */
  public static void validate(GarbageCollectionRules rules) throws ValidationException {
    Preconditions.checkNotNull(rules, "Rules are null.");
    List<String> violations = Lists.newArrayList();
    if (rules.getDefaultRetentionDays() < 0) {
      violations.add("default retention is negative: " + rules.getDefaultRetentionDays());
    }

    Set<String> seen = Sets.newHashSet();
    for (RetentionRule rule : rules.getBranches()) {
      if (Strings.isNullOrEmpty(rule.getBranchId())) {
        violations.add("branch rule without branch id");
        continue;
      }
      if (!seen.add(rule.getBranchId())) {
        violations.add("duplicate rule for branch " + rule.getBranchId());
      }
      if (rule.getRetentionDays() < 0) {
        violations.add(String.format("retention of branch %s is negative: %d", rule.getBranchId(),
            rule.getRetentionDays()));
      }
    }

    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }
}
