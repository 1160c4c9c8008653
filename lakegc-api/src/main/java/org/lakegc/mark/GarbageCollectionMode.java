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

/**
 * Phases executed by a garbage collection run.
 */
public enum GarbageCollectionMode {
  MARK("mark", true, false),
  SWEEP("sweep", false, true),
  MARK_AND_SWEEP("both", true, true);

  private final String cliName;
  private final boolean mark;
  private final boolean sweep;

  GarbageCollectionMode(String cliName, boolean mark, boolean sweep) {
    this.cliName = cliName;
    this.mark = mark;
    this.sweep = sweep;
  }

  public boolean doMark() {
    return this.mark;
  }

  public boolean doSweep() {
    return this.sweep;
  }

  public String getCliName() {
    return this.cliName;
  }

  /**
   * Accepts both the command line names ({@code mark}, {@code sweep}, {@code both}) and the enum constant names.
   */
  public static GarbageCollectionMode forName(String name) {
    for (GarbageCollectionMode mode : values()) {
      if (mode.cliName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(name + " is not a supported garbage collection mode");
  }
}
