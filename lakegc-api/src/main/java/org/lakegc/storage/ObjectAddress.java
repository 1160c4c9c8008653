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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * Opaque identifier of a physical blob, relative to the storage namespace of its repository.
 *
 * <p>
 *   Many logical paths in many commits may share one address.
 * </p>
 */
@Getter
@EqualsAndHashCode
public class ObjectAddress implements Comparable<ObjectAddress> {

  private final String key;

  public ObjectAddress(String key) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(key), "Object address is null or empty.");
    this.key = key;
  }

  public static ObjectAddress of(String key) {
    return new ObjectAddress(key);
  }

  @Override
  public int compareTo(ObjectAddress other) {
    return this.key.compareTo(other.key);
  }

  @Override
  public String toString() {
    return this.key;
  }
}
