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
import java.util.concurrent.ExecutionException;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.UncheckedExecutionException;

import org.lakegc.commit.Commit;
import org.lakegc.commit.CommitGraph;
import org.lakegc.commit.Tree;
import org.lakegc.exception.AncestryReadException;
import org.lakegc.storage.ObjectAddress;


/**
 * Per-run cache of the commits and trees read from a {@link CommitGraph}, keyed by id. Branch walks share one arena
 * so that history common to several branches is read once. Safe for concurrent use.
 */
public class CommitArena {

  private final CommitGraph graph;
  private final LoadingCache<String, Commit> commits;
  private final LoadingCache<String, ImmutableSet<ObjectAddress>> trees;

  public CommitArena(final CommitGraph graph) {
    this.graph = graph;
    this.commits = CacheBuilder.newBuilder().build(new CacheLoader<String, Commit>() {
      @Override
      public Commit load(String commitId) throws IOException {
        return graph.getCommit(commitId);
      }
    });
    this.trees = CacheBuilder.newBuilder().build(new CacheLoader<String, ImmutableSet<ObjectAddress>>() {
      @Override
      public ImmutableSet<ObjectAddress> load(String treeId) throws IOException {
        Tree tree = graph.getTree(treeId);
        return tree.addresses();
      }
    });
  }

  public String getRepository() {
    return this.graph.getRepository();
  }

  public Commit getCommit(String commitId) throws AncestryReadException {
    try {
      return this.commits.get(commitId);
    } catch (ExecutionException | UncheckedExecutionException e) {
      throw new AncestryReadException(String.format("Failed to read commit %s of repository %s", commitId,
          getRepository()), e.getCause());
    }
  }

  /**
   * @return the distinct addresses of the tree of <code>commit</code>
   */
  public ImmutableSet<ObjectAddress> getAddresses(Commit commit) throws AncestryReadException {
    try {
      return this.trees.get(commit.getTreeId());
    } catch (ExecutionException | UncheckedExecutionException e) {
      throw new AncestryReadException(String.format("Failed to read tree %s of commit %s in repository %s",
          commit.getTreeId(), commit.getId(), getRepository()), e.getCause());
    }
  }

  public long commitCount() {
    return this.commits.size();
  }

  public long treeCount() {
    return this.trees.size();
  }
}
