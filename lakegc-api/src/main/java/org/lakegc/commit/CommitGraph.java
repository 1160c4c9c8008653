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

import java.io.IOException;
import java.util.List;


/**
 * Read access to the commit history of one repository.
 *
 * <p>
 *   Commits and trees are addressed by id. Implementations must be safe for concurrent use since branches are
 *   walked in parallel.
 * </p>
 */
public interface CommitGraph {

  /**
   * @return the name of the repository this graph belongs to
   */
  String getRepository();

  /**
   * @return every branch that currently exists, with its tip commit
   * @throws IOException if the branch list cannot be read
   */
  List<Branch> listBranches() throws IOException;

  /**
   * @return the former tips of deleted branches that are still present in storage
   * @throws IOException if the dangling commits cannot be read
   */
  List<DanglingRoot> listDanglingRoots() throws IOException;

  /**
   * @param commitId id of the commit
   * @return the commit
   * @throws IOException if the commit does not exist or cannot be read
   */
  Commit getCommit(String commitId) throws IOException;

  /**
   * @param treeId id of the tree, as referenced by {@link Commit#getTreeId()}
   * @return the tree
   * @throws IOException if the tree does not exist or cannot be read
   */
  Tree getTree(String treeId) throws IOException;
}
