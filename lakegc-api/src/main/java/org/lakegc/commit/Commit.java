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

import java.util.List;

import org.joda.time.Instant;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * An immutable commit record. Parents are referenced by id only, so a commit can be looked up after every branch
 * pointing at it is gone.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Commit {

  private final String id;
  private final ImmutableList<String> parents;
  private final Instant creationTime;
  private final String treeId;

  public Commit(String id, List<String> parents, Instant creationTime, String treeId) {
    this.id = Preconditions.checkNotNull(id, "Commit id is null.");
    this.parents = ImmutableList.copyOf(Preconditions.checkNotNull(parents, "Parents of %s are null.", id));
    this.creationTime = Preconditions.checkNotNull(creationTime, "Creation time of %s is null.", id);
    this.treeId = Preconditions.checkNotNull(treeId, "Tree of %s is null.", id);
  }

  public boolean isRoot() {
    return this.parents.isEmpty();
  }
}
