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

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.typesafe.config.Config;

import org.lakegc.commit.Branch;
import org.lakegc.commit.CommitGraph;
import org.lakegc.commit.DanglingRoot;
import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.data.management.retention.RetentionPolicyEngine;
import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.MarkStore;
import org.lakegc.retention.GarbageCollectionRules;
import org.lakegc.storage.ObjectAddress;
import org.lakegc.util.ConfigUtils;
import org.lakegc.util.ExecutorsUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Computes the set of addresses that no branch needs any more and publishes it as a {@link MarkManifest}.
 *
 * <p>
 *   Every live branch and every dangling root (the former tip of a deleted branch) is walked back to its roots. An
 *   address is a candidate when no live branch tip holds it and, on every branch whose history ever held it, the
 *   event that ended its life on that branch is older than the retention of that branch:
 *   <ul>
 *     <li>live branch: the most recent commit that removed the address, with the retention of the branch;</li>
 *     <li>dangling root still holding the address: the creation of the dangling tip, with the default retention;</li>
 *     <li>dangling root no longer holding it: the most recent commit that removed it, with the default retention.</li>
 *   </ul>
 * </p>
 *
 * <p>
 *   Branches and dangling roots are listed once at the start of the run and walked concurrently over a shared
 *   {@link CommitArena}. If any commit or tree cannot be read the run fails and nothing is published.
 * </p>
 */
@Slf4j
public class ReachabilityMarker {

  private final CommitGraph graph;
  private final MarkStore markStore;
  private final int threads;

  public ReachabilityMarker(CommitGraph graph, MarkStore markStore, Config config) {
    this.graph = Preconditions.checkNotNull(graph);
    this.markStore = Preconditions.checkNotNull(markStore);
    this.threads = ConfigUtils.getInt(config, ConfigurationKeys.MARK_THREADS_KEY,
        ConfigurationKeys.DEFAULT_MARK_THREADS);
  }

  /**
   * Mark the garbage of the repository and persist the manifest under <code>markId</code>, replacing any manifest
   * previously stored under that id.
   *
   * @param markId id to publish the manifest under
   * @param rules retention rules of the repository
   * @param now the time retention is evaluated at, also the creation time of the manifest
   * @return the published manifest
   * @throws org.lakegc.exception.ValidationException if the rules are malformed, before any commit is read
   * @throws org.lakegc.exception.AncestryReadException if a commit or tree cannot be read
   * @throws IOException if the branches cannot be listed or the manifest cannot be stored
   */
  public MarkManifest mark(String markId, GarbageCollectionRules rules, Instant now) throws IOException {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(markId), "Mark id is null or empty.");
    RetentionPolicyEngine.validate(rules);

    String repository = this.graph.getRepository();
    List<Branch> branches = this.graph.listBranches();
    List<DanglingRoot> danglingRoots = this.graph.listDanglingRoots();
    log.info(String.format("Marking repository %s as %s: %d branches, %d dangling roots", repository, markId,
        branches.size(), danglingRoots.size()));

    CommitArena arena = new CommitArena(this.graph);
    List<BranchHistory> live = Lists.newArrayList();
    List<BranchHistory> dangling = Lists.newArrayList();
    walkAll(arena, branches, danglingRoots, live, dangling);

    List<ObjectAddress> candidates = findCandidates(rules, live, dangling, now);
    log.info(String.format("Walked %d commits and %d trees of repository %s, found %d candidates",
        arena.commitCount(), arena.treeCount(), repository, candidates.size()));

    MarkManifest manifest = new MarkManifest(markId, repository, now, candidates);
    this.markStore.put(manifest);
    return manifest;
  }

  private void walkAll(final CommitArena arena, List<Branch> branches, List<DanglingRoot> danglingRoots,
      List<BranchHistory> live, List<BranchHistory> dangling) throws IOException {
    ExecutorService executor = ExecutorsUtils.newFixedThreadPool(this.threads, log, "lakegc-mark-%d");
    try {
      List<Future<BranchHistory>> liveWalks = Lists.newArrayList();
      for (final Branch branch : branches) {
        liveWalks.add(executor.submit(new Callable<BranchHistory>() {
          @Override
          public BranchHistory call() throws IOException {
            return BranchHistory.walk(arena, branch.getName(), branch.getCommitId());
          }
        }));
      }
      Map<Future<BranchHistory>, DanglingRoot> danglingWalks = Maps.newLinkedHashMap();
      for (final DanglingRoot root : danglingRoots) {
        danglingWalks.put(executor.submit(new Callable<BranchHistory>() {
          @Override
          public BranchHistory call() throws IOException {
            return BranchHistory.walk(arena, root.displayName(), root.getCommitId());
          }
        }), root);
      }

      for (Future<BranchHistory> walk : liveWalks) {
        BranchHistory history = await(walk);
        log.debug(String.format("Branch %s: %d commits", history.getBranch(), history.getCommitsWalked()));
        live.add(history);
      }
      for (Map.Entry<Future<BranchHistory>, DanglingRoot> walk : danglingWalks.entrySet()) {
        BranchHistory history = await(walk.getKey());
        log.debug(String.format("Dangling root %s (deleted at %s): %d commits", history.getBranch(),
            walk.getValue().getDeletedAt().orNull(), history.getCommitsWalked()));
        dangling.add(history);
      }
    } finally {
      ExecutorsUtils.shutdownExecutorService(executor);
    }
  }

  private static BranchHistory await(Future<BranchHistory> walk) throws IOException {
    try {
      return walk.get();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while walking branch history", ie);
    } catch (ExecutionException ee) {
      throw ExecutorsUtils.unwrapExecutionException(ee, IOException.class);
    }
  }

  private static List<ObjectAddress> findCandidates(GarbageCollectionRules rules, List<BranchHistory> live,
      List<BranchHistory> dangling, Instant now) {
    Set<ObjectAddress> retained = Sets.newHashSet();
    Set<ObjectAddress> seen = Sets.newHashSet();
    for (BranchHistory history : live) {
      retained.addAll(history.getTipAddresses());
      seen.addAll(history.getHeld());
    }
    for (BranchHistory history : dangling) {
      seen.addAll(history.getHeld());
    }

    List<ObjectAddress> candidates = Lists.newArrayList();
    for (ObjectAddress address : Sets.difference(seen, retained)) {
      if (allExpired(rules, address, live, dangling, now)) {
        candidates.add(address);
      }
    }
    Collections.sort(candidates);
    return candidates;
  }

  private static boolean allExpired(GarbageCollectionRules rules, ObjectAddress address, List<BranchHistory> live,
      List<BranchHistory> dangling, Instant now) {
    for (BranchHistory history : live) {
      if (!history.holds(address)) {
        continue;
      }
      Optional<Instant> deletion = history.lastDeletionOf(address);
      if (!deletion.isPresent()) {
        // Unreachable: an address held in the history but not at the tip was removed by some commit.
        log.warn(String.format("No deletion of %s found on branch %s, keeping it", address, history.getBranch()));
        return false;
      }
      DeletionEvent event = new DeletionEvent(history.getBranch(), deletion.get(),
          RetentionPolicyEngine.effectiveRetentionDays(rules, history.getBranch()), false);
      if (!isExpired(address, event, now)) {
        return false;
      }
    }

    for (BranchHistory history : dangling) {
      if (!history.holds(address)) {
        continue;
      }
      DeletionEvent event;
      if (history.getTipAddresses().contains(address)) {
        // Counted from the dangling tip's creation, whatever time the branch itself was deleted.
        event = new DeletionEvent(history.getBranch(), history.getTip().getCreationTime(),
            rules.getDefaultRetentionDays(), true);
      } else {
        event = new DeletionEvent(history.getBranch(), history.lastDeletionOf(address).get(),
            rules.getDefaultRetentionDays(), false);
      }
      if (!isExpired(address, event, now)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isExpired(ObjectAddress address, DeletionEvent event, Instant now) {
    if (event.isExpired(now)) {
      return true;
    }
    if (log.isDebugEnabled()) {
      log.debug(String.format("Keeping %s, retained by %s", address, event));
    }
    return false;
  }
}
