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

package org.lakegc.azure;

import java.util.List;

import com.azure.core.http.rest.Response;
import com.azure.core.util.Context;
import com.azure.storage.blob.batch.BlobBatch;
import com.azure.storage.blob.batch.BlobBatchClient;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.storage.BulkRemover;
import org.lakegc.storage.DeleteResult;
import org.lakegc.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * {@link BulkRemover} for Azure Blob namespaces, deleting blobs and their snapshots with one blob batch per call.
 *
 * <p>
 *   A blob is deleted when its sub-request returns a 2xx status. A 404 means the blob was already gone; it is logged
 *   and reported failed like any other status. When the batch itself fails every key is reported failed.
 * </p>
 */
@Slf4j
public class AzureBlobBulkRemover implements BulkRemover {

  private static final int NOT_FOUND = 404;

  private final Function<String, BlobBatchClient> clientProvider;
  private final int loggedKeys;

  /**
   * @param clientProvider returns the batch client of the storage account of a namespace
   */
  public AzureBlobBulkRemover(Function<String, BlobBatchClient> clientProvider, Config config) {
    this.clientProvider = Preconditions.checkNotNull(clientProvider);
    this.loggedKeys = ConfigUtils.getInt(config, ConfigurationKeys.SWEEP_LOGGED_KEYS_KEY,
        ConfigurationKeys.DEFAULT_SWEEP_LOGGED_KEYS);
  }

  public AzureBlobBulkRemover(Config config) {
    this(newClientProvider(new BlobBatchClientFactory(config)), config);
  }

  private static Function<String, BlobBatchClient> newClientProvider(final BlobBatchClientFactory factory) {
    return new Function<String, BlobBatchClient>() {
      @Override
      public BlobBatchClient apply(String storageNamespace) {
        return factory.newClient(storageNamespace);
      }
    };
  }

  @Override
  public int getMaxBulkSize() {
    return AzureConfigurationKeys.AZURE_BLOB_MAX_BULK_SIZE;
  }

  @Override
  public List<String> constructRemoveKeyNames(List<String> keys, String storageNamespace) {
    if (keys.isEmpty()) {
      return ImmutableList.of();
    }
    String prefix = storageNamespace.endsWith("/") ? storageNamespace : storageNamespace + "/";
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

    List<String> urls = constructRemoveKeyNames(keys, storageNamespace);
    log.info(String.format("Removing %d blobs: %s", urls.size(),
        Joiner.on(", ").join(urls.subList(0, Math.min(this.loggedKeys, urls.size())))));

    List<Response<Void>> responses = Lists.newArrayListWithCapacity(urls.size());
    try {
      BlobBatchClient client = this.clientProvider.apply(storageNamespace);
      BlobBatch batch = client.getBlobBatch();
      for (String url : urls) {
        responses.add(batch.deleteBlob(url, DeleteSnapshotsOptionType.INCLUDE, null));
      }
      client.submitBatchWithResponse(batch, false, null, Context.NONE);
    } catch (RuntimeException e) {
      log.warn(String.format("Blob batch of %d deletions under %s failed", urls.size(), storageNamespace), e);
      return DeleteResult.allFailed(keys);
    }

    List<String> confirmed = Lists.newArrayList();
    for (int i = 0; i < keys.size(); i++) {
      int status = statusOf(responses.get(i), urls.get(i));
      if (status >= 200 && status < 300) {
        confirmed.add(keys.get(i));
      } else if (status == NOT_FOUND) {
        log.info(String.format("Blob %s is already absent", urls.get(i)));
      } else {
        log.warn(String.format("Failed to remove blob %s: status %d", urls.get(i), status));
      }
    }
    return DeleteResult.of(keys, confirmed);
  }

  /** Sub-requests that failed may throw when inspected; their status is then taken from the error. */
  private static int statusOf(Response<Void> response, String url) {
    try {
      return response.getStatusCode();
    } catch (BlobStorageException e) {
      return e.getStatusCode();
    } catch (RuntimeException e) {
      log.warn(String.format("No status for deletion of blob %s", url), e);
      return -1;
    }
  }
}
