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

import java.io.IOException;
import java.util.List;

import com.google.common.base.Optional;


/**
 * Durable storage of {@link MarkManifest}s and the {@link SweepReport}s produced from them, keyed by repository and
 * mark id.
 */
public interface MarkStore {

  /**
   * Publish a manifest, replacing any manifest previously stored under the same repository and mark id. Readers
   * never observe a partially written manifest.
   */
  void put(MarkManifest manifest) throws IOException;

  Optional<MarkManifest> get(String repository, String markId) throws IOException;

  boolean exists(String repository, String markId) throws IOException;

  void putSweepReport(String repository, SweepReport report) throws IOException;

  /**
   * @return the sweep reports stored for the mark id, oldest first
   */
  List<SweepReport> getSweepReports(String repository, String markId) throws IOException;
}
