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

import java.net.URI;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.typesafe.config.Config;

import org.lakegc.aws.AWSConfigurationKeys;
import org.lakegc.aws.S3BulkRemover;
import org.lakegc.azure.AzureBlobBulkRemover;
import org.lakegc.azure.AzureBlobStorageUtils;
import org.lakegc.storage.BulkRemover;


/**
 * Creates the {@link BulkRemover} of a storage backend.
 */
public class BulkRemoverFactory {

  /**
   * Supported storage backends, named by their storage type tag.
   */
  public enum StorageType {
    S3,
    AZURE;

    public static Optional<StorageType> forTag(String tag) {
      return Enums.getIfPresent(StorageType.class, tag.trim().toUpperCase());
    }
  }

  private final Config config;

  public BulkRemoverFactory(Config config) {
    this.config = config;
  }

  /**
   * Create the {@link BulkRemover} for <code>storageType</code>, or for the scheme of <code>storageNamespace</code>
   * when no type is given.
   *
   * @throws IllegalArgumentException if the type tag is unknown or the namespace matches no backend
   */
  public BulkRemover newBulkRemover(Optional<String> storageType, String storageNamespace) {
    StorageType type = storageType.isPresent() ? resolveTag(storageType.get()) : resolveNamespace(storageNamespace);
    switch (type) {
      case S3:
        return new S3BulkRemover(this.config);
      case AZURE:
        return new AzureBlobBulkRemover(this.config);
      default:
        throw new IllegalArgumentException("Unsupported storage type: " + type);
    }
  }

  static StorageType resolveTag(String tag) {
    Optional<StorageType> type = StorageType.forTag(tag);
    if (!type.isPresent()) {
      throw new IllegalArgumentException("Unknown storage type: " + tag);
    }
    return type.get();
  }

  static StorageType resolveNamespace(String storageNamespace) {
    URI uri = URI.create(storageNamespace);
    if (AWSConfigurationKeys.S3_SCHEME.equalsIgnoreCase(uri.getScheme())
        || AWSConfigurationKeys.S3A_SCHEME.equalsIgnoreCase(uri.getScheme())) {
      return StorageType.S3;
    }
    if (AzureBlobStorageUtils.isAzureBlobNamespace(uri)) {
      return StorageType.AZURE;
    }
    throw new IllegalArgumentException("Cannot infer the storage type of namespace " + storageNamespace);
  }
}
