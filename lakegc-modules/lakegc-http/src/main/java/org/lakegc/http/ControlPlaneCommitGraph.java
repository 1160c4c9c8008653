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

package org.lakegc.http;

import java.io.IOException;
import java.util.List;

import org.lakegc.commit.Branch;
import org.lakegc.commit.Commit;
import org.lakegc.commit.CommitGraph;
import org.lakegc.commit.DanglingRoot;
import org.lakegc.commit.Tree;


/**
 * {@link CommitGraph} of one repository, read from the control plane.
 */
public class ControlPlaneCommitGraph implements CommitGraph {

  private final ControlPlaneClient client;
  private final String repository;

  public ControlPlaneCommitGraph(ControlPlaneClient client, String repository) {
    this.client = client;
    this.repository = repository;
  }

  @Override
  public String getRepository() {
    return this.repository;
  }

  @Override
  public List<Branch> listBranches() throws IOException {
    return this.client.listBranches(this.repository);
  }

  @Override
  public List<DanglingRoot> listDanglingRoots() throws IOException {
    return this.client.listDanglingRoots(this.repository);
  }

  @Override
  public Commit getCommit(String commitId) throws IOException {
    return this.client.getCommit(this.repository, commitId);
  }

  @Override
  public Tree getTree(String treeId) throws IOException {
    return this.client.getTree(this.repository, treeId);
  }
}
