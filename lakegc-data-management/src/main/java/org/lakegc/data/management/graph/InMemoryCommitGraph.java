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

package org.lakegc.data.management.graph;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.lakegc.commit.Branch;
import org.lakegc.commit.Commit;
import org.lakegc.commit.CommitGraph;
import org.lakegc.commit.DanglingRoot;
import org.lakegc.commit.Tree;


/**
 * A {@link CommitGraph} held in memory. Branches can be moved and deleted after construction; deleting a branch
 * turns its tip into a {@link DanglingRoot}.
 */
public class InMemoryCommitGraph implements CommitGraph {

  private final String repository;
  private final Map<String, Commit> commits = new ConcurrentHashMap<>();
  private final Map<String, Tree> trees = new ConcurrentHashMap<>();
  private final Map<String, String> branches = Maps.newLinkedHashMap();
  private final List<DanglingRoot> danglingRoots = Lists.newArrayList();

  public InMemoryCommitGraph(String repository) {
    this.repository = Preconditions.checkNotNull(repository);
  }

  @Override
  public String getRepository() {
    return this.repository;
  }

  public InMemoryCommitGraph putTree(Tree tree) {
    this.trees.put(tree.getId(), tree);
    return this;
  }

  public InMemoryCommitGraph putCommit(Commit commit) {
    this.commits.put(commit.getId(), commit);
    return this;
  }

  /**
   * Create or move a branch.
   */
  public synchronized InMemoryCommitGraph setBranch(String name, String commitId) {
    this.branches.put(name, commitId);
    return this;
  }

  /**
   * Delete a branch, leaving its tip behind as a dangling root.
   *
   * @param deletedAt when the branch was deleted, absent if not recorded
   */
  public synchronized InMemoryCommitGraph deleteBranch(String name, Optional<Instant> deletedAt) {
    String tip = this.branches.remove(name);
    Preconditions.checkArgument(tip != null, "Branch %s does not exist", name);
    this.danglingRoots.add(new DanglingRoot(tip, Optional.of(name), deletedAt));
    return this;
  }

  public synchronized InMemoryCommitGraph addDanglingRoot(DanglingRoot root) {
    this.danglingRoots.add(root);
    return this;
  }

  @Override
  public synchronized List<Branch> listBranches() {
    ImmutableList.Builder<Branch> result = ImmutableList.builder();
    for (Map.Entry<String, String> branch : this.branches.entrySet()) {
      result.add(new Branch(branch.getKey(), branch.getValue()));
    }
    return result.build();
  }

  @Override
  public synchronized List<DanglingRoot> listDanglingRoots() {
    return ImmutableList.copyOf(this.danglingRoots);
  }

  @Override
  public Commit getCommit(String commitId) throws IOException {
    Commit commit = this.commits.get(commitId);
    if (commit == null) {
      throw new IOException(String.format("Commit %s not found in repository %s", commitId, this.repository));
    }
    return commit;
  }

  @Override
  public Tree getTree(String treeId) throws IOException {
    Tree tree = this.trees.get(treeId);
    if (tree == null) {
      throw new IOException(String.format("Tree %s not found in repository %s", treeId, this.repository));
    }
    return tree;
  }
}
