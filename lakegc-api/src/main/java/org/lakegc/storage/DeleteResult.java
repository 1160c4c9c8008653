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

package org.lakegc.storage;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Outcome of one bulk delete call. Every requested key ends up either in {@link #getDeleted()} or in
 * {@link #getFailed()}; a key the backend did not confirm is a failure.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DeleteResult {

  private static final DeleteResult EMPTY =
      new DeleteResult(ImmutableList.<String>of(), ImmutableList.<String>of(), ImmutableList.<String>of());

  private final ImmutableList<String> requested;
  private final ImmutableList<String> deleted;
  private final ImmutableList<String> failed;

  private DeleteResult(List<String> requested, List<String> deleted, List<String> failed) {
    this.requested = ImmutableList.copyOf(requested);
    this.deleted = ImmutableList.copyOf(deleted);
    this.failed = ImmutableList.copyOf(failed);
  }

  public static DeleteResult empty() {
    return EMPTY;
  }

  /**
   * Builds a result from the keys requested and the subset confirmed by the backend, keeping the request order.
   * Confirmations for keys that were never requested are ignored.
   */
  public static DeleteResult of(List<String> requested, Collection<String> confirmed) {
    Set<String> confirmedSet = ImmutableSet.copyOf(confirmed);
    ImmutableList.Builder<String> deleted = ImmutableList.builder();
    ImmutableList.Builder<String> failed = ImmutableList.builder();
    for (String key : requested) {
      if (confirmedSet.contains(key)) {
        deleted.add(key);
      } else {
        failed.add(key);
      }
    }
    return new DeleteResult(requested, deleted.build(), failed.build());
  }

  /**
   * A result in which no requested key was confirmed, used when the bulk call itself failed.
   */
  public static DeleteResult allFailed(List<String> requested) {
    return new DeleteResult(requested, ImmutableList.<String>of(), requested);
  }

  public boolean isComplete() {
    return this.failed.isEmpty();
  }
}
