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

package org.lakegc.exception;

/**
 * Thrown when a sweep is requested for a mark id that has no manifest.
 */
public class MarkNotFoundException extends GarbageCollectionException {

  private static final long serialVersionUID = 1L;

  private final String markId;

  public MarkNotFoundException(String repository, String markId) {
    super(String.format("No mark manifest found for mark id %s in repository %s", markId, repository));
    this.markId = markId;
  }

  public String getMarkId() {
    return this.markId;
  }
}
