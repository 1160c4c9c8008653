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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import org.lakegc.storage.ObjectAddress;


/**
 * The garbage candidates of one mark run. A manifest is never modified once written; marking again under the same
 * id replaces it.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "addresses")
public class MarkManifest {

  private final String markId;
  private final String repository;
  private final Instant createdAt;
  private final ImmutableList<ObjectAddress> addresses;

  public MarkManifest(String markId, String repository, Instant createdAt, List<ObjectAddress> addresses) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(markId), "Mark id is null or empty.");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(repository), "Repository is null or empty.");
    this.markId = markId;
    this.repository = repository;
    this.createdAt = Preconditions.checkNotNull(createdAt, "Creation time is null.");
    this.addresses = ImmutableList.copyOf(addresses);
  }

  public int size() {
    return this.addresses.size();
  }
}
