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

import java.util.List;


/**
 * Batched physical deletion against one storage backend family.
 *
 * <p>
 *   Keys passed in are object addresses relative to the storage namespace of the repository; each implementation
 *   translates them into its own addressing scheme with {@link #constructRemoveKeyNames(List, String)}.
 * </p>
 */
public interface BulkRemover {

  /**
   * @return the maximum number of objects the backend accepts in one bulk delete call
   */
  int getMaxBulkSize();

  /**
   * Translate relative keys into backend native key names.
   *
   * @param keys keys of the objects to remove
   * @param storageNamespace the storage namespace URI the objects are stored under
   * @return the native key names, in the order of {@code keys}; empty if {@code keys} is empty
   */
  List<String> constructRemoveKeyNames(List<String> keys, String storageNamespace);

  /**
   * Delete the given objects with a single bulk call.
   *
   * <p>
   *   The backend response is authoritative: only keys the backend confirms are reported deleted. A failing call
   *   does not throw, it yields a {@link DeleteResult} with the affected keys marked failed. An empty key list
   *   returns {@link DeleteResult#empty()} without calling the backend.
   * </p>
   *
   * @param keys keys of the objects to remove, at most {@link #getMaxBulkSize()} of them
   * @param storageNamespace the storage namespace URI the objects are stored under
   * @return the relative keys confirmed deleted and the ones that were not
   */
  DeleteResult deleteObjects(List<String> keys, String storageNamespace);
}
