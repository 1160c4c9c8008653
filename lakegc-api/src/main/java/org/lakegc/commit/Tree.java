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

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import org.lakegc.storage.ObjectAddress;


/**
 * The logical path to {@link ObjectAddress} mapping of a commit.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Tree {

  private final String id;
  private final ImmutableMap<String, ObjectAddress> entries;

  public Tree(String id, Map<String, ObjectAddress> entries) {
    this.id = Preconditions.checkNotNull(id, "Tree id is null.");
    this.entries = ImmutableMap.copyOf(entries);
  }

  /**
   * @return the distinct addresses referenced by this tree
   */
  public ImmutableSet<ObjectAddress> addresses() {
    return ImmutableSet.copyOf(this.entries.values());
  }
}
