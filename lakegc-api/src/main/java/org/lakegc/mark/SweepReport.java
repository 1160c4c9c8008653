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

package org.lakegc.mark;

import java.util.List;

import org.joda.time.Instant;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import org.lakegc.storage.ObjectAddress;


/**
 * Audit record of one sweep of a {@link MarkManifest}: which addresses the backend confirmed removed and which it
 * did not.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = {"removed", "failed"})
public class SweepReport {

  private final String markId;
  private final Instant createdAt;
  private final ImmutableList<ObjectAddress> removed;
  private final ImmutableList<ObjectAddress> failed;

  public SweepReport(String markId, Instant createdAt, List<ObjectAddress> removed, List<ObjectAddress> failed) {
    this.markId = Preconditions.checkNotNull(markId, "Mark id is null.");
    this.createdAt = Preconditions.checkNotNull(createdAt, "Creation time is null.");
    this.removed = ImmutableList.copyOf(removed);
    this.failed = ImmutableList.copyOf(failed);
  }

  public boolean isComplete() {
    return this.failed.isEmpty();
  }
}
