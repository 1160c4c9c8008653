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

package org.lakegc.runtime;

import com.google.common.base.Optional;

import org.lakegc.mark.GarbageCollectionMode;
import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.SweepReport;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;


/**
 * Outcome of one garbage collection run. The manifest is present when the run marked, the report when it swept.
 */
@Getter
@AllArgsConstructor
@ToString
public class GarbageCollectionResult {

  private final String repository;
  private final GarbageCollectionMode mode;
  private final String markId;
  private final Optional<MarkManifest> manifest;
  private final Optional<SweepReport> sweepReport;

  /**
   * @return false if the run swept and some candidates could not be removed
   */
  public boolean isComplete() {
    return !this.sweepReport.isPresent() || this.sweepReport.get().isComplete();
  }
}
