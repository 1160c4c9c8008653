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

package org.lakegc.commit;

import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The former tip of a deleted branch. Its commits are still present in storage but no live branch reaches them.
 *
 * <p>
 *   The branch name and the deletion time are known only when the control plane recorded them.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class DanglingRoot {

  private final String commitId;
  private final Optional<String> branchName;
  private final Optional<Instant> deletedAt;

  public DanglingRoot(String commitId, Optional<String> branchName, Optional<Instant> deletedAt) {
    this.commitId = Preconditions.checkNotNull(commitId, "Dangling commit id is null.");
    this.branchName = Preconditions.checkNotNull(branchName);
    this.deletedAt = Preconditions.checkNotNull(deletedAt);
  }

  public static DanglingRoot of(String commitId) {
    return new DanglingRoot(commitId, Optional.<String>absent(), Optional.<Instant>absent());
  }

  /**
   * A readable name for log messages: the former branch name when known, the commit id otherwise.
   */
  public String displayName() {
    return this.branchName.or(this.commitId);
  }
}
