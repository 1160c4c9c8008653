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

package org.lakegc.aws;

import java.net.URI;
import java.util.List;
import java.util.Map;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.DeleteObjectsRequest;
import com.amazonaws.services.s3.model.DeleteObjectsResult;
import com.amazonaws.services.s3.model.MultiObjectDeleteException;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.typesafe.config.Config;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.storage.BulkRemover;
import org.lakegc.storage.DeleteResult;
import org.lakegc.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * {@link BulkRemover} for namespaces of the form {@code s3://bucket/prefix/}, deleting with {@code DeleteObjects}.
 *
 * <p>
 *   Keys that S3 reports as missing count as deleted. Keys reported with any other error are failures, as are all
 *   keys of a call that fails as a whole or that names a namespace without a parseable bucket.
 * </p>
 */
@Slf4j
public class S3BulkRemover implements BulkRemover {

  private static final String NO_SUCH_KEY = "NoSuchKey";

  private final Supplier<AmazonS3> s3Supplier;
  private final int loggedKeys;

  public S3BulkRemover(Supplier<AmazonS3> s3Supplier, Config config) {
    this.s3Supplier = Preconditions.checkNotNull(s3Supplier);
    this.loggedKeys = ConfigUtils.getInt(config, ConfigurationKeys.SWEEP_LOGGED_KEYS_KEY,
        ConfigurationKeys.DEFAULT_SWEEP_LOGGED_KEYS);
  }

  public S3BulkRemover(Config config) {
    this(AmazonS3ClientFactory.memoized(config), config);
  }

  @Override
  public int getMaxBulkSize() {
    return AWSConfigurationKeys.S3_MAX_BULK_SIZE;
  }

  @Override
  public List<String> constructRemoveKeyNames(List<String> keys, String storageNamespace) {
    if (keys.isEmpty()) {
      return ImmutableList.of();
    }
    String prefix = keyPrefix(storageNamespace);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (String key : keys) {
      names.add(prefix + key);
    }
    return names.build();
  }

  @Override
  public DeleteResult deleteObjects(List<String> keys, String storageNamespace) {
    if (keys.isEmpty()) {
      return DeleteResult.empty();
    }
    Preconditions.checkArgument(keys.size() <= getMaxBulkSize(), "At most %s keys per call, got %s",
        getMaxBulkSize(), keys.size());

    String bucket;
    List<String> names;
    try {
      bucket = bucket(storageNamespace);
      names = constructRemoveKeyNames(keys, storageNamespace);
    } catch (IllegalArgumentException e) {
      log.warn(String.format("Cannot remove %d keys from storage namespace %s", keys.size(), storageNamespace), e);
      return DeleteResult.allFailed(keys);
    }
    Map<String, String> logicalKeys = Maps.newHashMap();
    for (int i = 0; i < keys.size(); i++) {
      logicalKeys.put(names.get(i), keys.get(i));
    }
    log.info(String.format("Removing %d keys from bucket %s: %s", names.size(), bucket,
        Joiner.on(", ").join(names.subList(0, Math.min(this.loggedKeys, names.size())))));

    DeleteObjectsRequest request = new DeleteObjectsRequest(bucket).withKeys(names.toArray(new String[0]))
        .withQuiet(false);
    List<String> confirmed = Lists.newArrayList();
    try {
      DeleteObjectsResult result = this.s3Supplier.get().deleteObjects(request);
      for (DeleteObjectsResult.DeletedObject deleted : result.getDeletedObjects()) {
        confirm(deleted.getKey(), logicalKeys, confirmed);
      }
    } catch (MultiObjectDeleteException e) {
      for (DeleteObjectsResult.DeletedObject deleted : e.getDeletedObjects()) {
        confirm(deleted.getKey(), logicalKeys, confirmed);
      }
      for (MultiObjectDeleteException.DeleteError error : e.getErrors()) {
        if (NO_SUCH_KEY.equals(error.getCode())) {
          log.debug(String.format("Key %s is already absent from bucket %s", error.getKey(), bucket));
          confirm(error.getKey(), logicalKeys, confirmed);
        } else {
          log.warn(String.format("Failed to remove key %s from bucket %s: %s %s", error.getKey(), bucket,
              error.getCode(), error.getMessage()));
        }
      }
    } catch (AmazonClientException e) {
      log.warn(String.format("Bulk removal of %d keys from bucket %s failed", keys.size(), bucket), e);
      return DeleteResult.allFailed(keys);
    }
    return DeleteResult.of(keys, confirmed);
  }

  private static void confirm(String name, Map<String, String> logicalKeys, List<String> confirmed) {
    String key = logicalKeys.get(name);
    if (key != null) {
      confirmed.add(key);
    }
  }

  /**
   * @return the path of <code>storageNamespace</code> without leading slash and with a trailing slash
   */
  static String keyPrefix(String storageNamespace) {
    String path = Strings.nullToEmpty(URI.create(storageNamespace).getPath());
    if (!path.endsWith("/")) {
      path = path + "/";
    }
    return path.startsWith("/") ? path.substring(1) : path;
  }

  static String bucket(String storageNamespace) {
    URI uri = URI.create(storageNamespace);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(uri.getHost()), "No bucket in storage namespace %s",
        storageNamespace);
    return uri.getHost();
  }
}
