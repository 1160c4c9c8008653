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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;

import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.lakegc.commit.Commit;
import org.lakegc.exception.AncestryReadException;
import org.lakegc.storage.ObjectAddress;

import lombok.Getter;


/**
 * What the ancestry of one branch tip says about each address: whether any commit held it, and when it was last
 * removed from the tree.
 */
@Getter
class BranchHistory {

  private final String branch;
  private final Commit tip;
  private final ImmutableSet<ObjectAddress> tipAddresses;
  private final Set<ObjectAddress> held;
  private final Map<ObjectAddress, Instant> lastDeletion;
  private final int commitsWalked;

  private BranchHistory(String branch, Commit tip, ImmutableSet<ObjectAddress> tipAddresses,
      Set<ObjectAddress> held, Map<ObjectAddress, Instant> lastDeletion, int commitsWalked) {
    this.branch = branch;
    this.tip = tip;
    this.tipAddresses = tipAddresses;
    this.held = held;
    this.lastDeletion = lastDeletion;
    this.commitsWalked = commitsWalked;
  }

  /**
   * Walk every commit reachable from <code>tipId</code> through all parents, each commit once. A deletion event is
   * recorded for every address that a parent tree holds and the child tree does not, at the child creation time.
   */
  static BranchHistory walk(CommitArena arena, String branch, String tipId) throws AncestryReadException {
    Commit tip = arena.getCommit(tipId);
    Set<ObjectAddress> held = Sets.newHashSet();
    Map<ObjectAddress, Instant> lastDeletion = Maps.newHashMap();
    Set<String> visited = Sets.newHashSet(tipId);
    Deque<Commit> pending = new ArrayDeque<>();
    pending.push(tip);

    while (!pending.isEmpty()) {
      Commit commit = pending.pop();
      ImmutableSet<ObjectAddress> addresses = arena.getAddresses(commit);
      held.addAll(addresses);

      for (String parentId : commit.getParents()) {
        Commit parent = arena.getCommit(parentId);
        for (ObjectAddress address : arena.getAddresses(parent)) {
          if (!addresses.contains(address)) {
            Instant previous = lastDeletion.get(address);
            if (previous == null || commit.getCreationTime().isAfter(previous)) {
              lastDeletion.put(address, commit.getCreationTime());
            }
          }
        }
        if (visited.add(parentId)) {
          pending.push(parent);
        }
      }
    }

    return new BranchHistory(branch, tip, arena.getAddresses(tip), held, lastDeletion, visited.size());
  }

  boolean holds(ObjectAddress address) {
    return this.held.contains(address);
  }

  Optional<Instant> lastDeletionOf(ObjectAddress address) {
    return Optional.fromNullable(this.lastDeletion.get(address));
  }
}
