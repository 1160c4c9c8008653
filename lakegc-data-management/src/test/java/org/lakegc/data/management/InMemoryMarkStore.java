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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.MarkStore;
import org.lakegc.mark.SweepReport;


/**
 * A {@link MarkStore} held in memory.
 */
public class InMemoryMarkStore implements MarkStore {

  private final Map<String, MarkManifest> manifests = new ConcurrentHashMap<>();
  private final Map<String, List<SweepReport>> reports = new ConcurrentHashMap<>();

  private static String key(String repository, String markId) {
    return Joiner.on('/').join(repository, markId);
  }

  @Override
  public void put(MarkManifest manifest) {
    this.manifests.put(key(manifest.getRepository(), manifest.getMarkId()), manifest);
  }

  @Override
  public Optional<MarkManifest> get(String repository, String markId) {
    return Optional.fromNullable(this.manifests.get(key(repository, markId)));
  }

  @Override
  public boolean exists(String repository, String markId) {
    return this.manifests.containsKey(key(repository, markId));
  }

  @Override
  public synchronized void putSweepReport(String repository, SweepReport report) {
    String key = key(repository, report.getMarkId());
    if (!this.reports.containsKey(key)) {
      this.reports.put(key, Lists.<SweepReport>newArrayList());
    }
    this.reports.get(key).add(report);
  }

  @Override
  public synchronized List<SweepReport> getSweepReports(String repository, String markId) {
    List<SweepReport> stored = this.reports.get(key(repository, markId));
    return stored == null ? ImmutableList.<SweepReport>of() : ImmutableList.copyOf(stored);
  }
}
