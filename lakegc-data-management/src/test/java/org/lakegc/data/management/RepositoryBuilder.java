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

package org.lakegc.data.management;

import java.util.Map;

import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.lakegc.commit.Commit;
import org.lakegc.commit.Tree;
import org.lakegc.data.management.graph.InMemoryCommitGraph;
import org.lakegc.storage.ObjectAddress;


/**
 * Builds a repository history commit by commit on top of an {@link InMemoryCommitGraph}, uploading the objects it
 * references to an {@link InMemoryObjectStore}.
 */
public class RepositoryBuilder {

  private final InMemoryCommitGraph graph;
  private final InMemoryObjectStore objectStore;
  private final Map<String, String> tips = Maps.newHashMap();
  private final Map<String, Map<String, ObjectAddress>> entries = Maps.newHashMap();
  private int sequence = 0;

  public RepositoryBuilder(String repository, InMemoryObjectStore objectStore) {
    this.graph = new InMemoryCommitGraph(repository);
    this.objectStore = objectStore;
  }

  public InMemoryCommitGraph getGraph() {
    return this.graph;
  }

  public String tipOf(String branch) {
    return this.tips.get(branch);
  }

  /** Start a branch with an empty root commit. */
  public String init(String branch, Instant time) {
    return commit(branch, time, ImmutableList.<String>of(), Maps.<String, ObjectAddress>newHashMap());
  }

  public RepositoryBuilder branch(String name, String from) {
    String tip = this.tips.get(from);
    this.tips.put(name, tip);
    this.graph.setBranch(name, tip);
    return this;
  }

  /** Commit an upload of <code>key</code> at <code>path</code>. */
  public String upload(String branch, String path, String key, Instant time) {
    this.objectStore.upload(key);
    Map<String, ObjectAddress> tree = Maps.newHashMap(this.entries.get(this.tips.get(branch)));
    tree.put(path, ObjectAddress.of(key));
    return commit(branch, time, ImmutableList.of(this.tips.get(branch)), tree);
  }

  /** Commit the removal of <code>path</code>. */
  public String delete(String branch, String path, Instant time) {
    Map<String, ObjectAddress> tree = Maps.newHashMap(this.entries.get(this.tips.get(branch)));
    tree.remove(path);
    return commit(branch, time, ImmutableList.of(this.tips.get(branch)), tree);
  }

  /** Commit a merge of <code>source</code> into <code>target</code>; paths of both sides are kept. */
  public String merge(String source, String target, Instant time) {
    Map<String, ObjectAddress> tree = Maps.newHashMap(this.entries.get(this.tips.get(target)));
    tree.putAll(this.entries.get(this.tips.get(source)));
    return commit(target, time, ImmutableList.of(this.tips.get(target), this.tips.get(source)), tree);
  }

  public RepositoryBuilder deleteBranch(String branch, Optional<Instant> deletedAt) {
    this.graph.deleteBranch(branch, deletedAt);
    this.tips.remove(branch);
    return this;
  }

  private String commit(String branch, Instant time, ImmutableList<String> parents,
      Map<String, ObjectAddress> tree) {
    this.sequence++;
    String commitId = "c" + this.sequence;
    String treeId = "t" + this.sequence;
    this.graph.putTree(new Tree(treeId, tree));
    this.graph.putCommit(new Commit(commitId, parents, time, treeId));
    this.graph.setBranch(branch, commitId);
    this.entries.put(commitId, tree);
    this.tips.put(branch, commitId);
    return commitId;
  }
}
