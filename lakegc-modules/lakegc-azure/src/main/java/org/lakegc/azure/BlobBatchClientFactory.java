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

import java.net.URI;
import java.time.Duration;

import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.batch.BlobBatchClient;
import com.azure.storage.blob.batch.BlobBatchClientBuilder;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import com.google.common.base.Optional;
import com.typesafe.config.Config;

import org.lakegc.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Builds the {@link BlobBatchClient} of the storage account of a namespace, authenticated with the shared key
 * configured for the account.
 */
@Slf4j
public class BlobBatchClientFactory {

  private final Config config;

  public BlobBatchClientFactory(Config config) {
    this.config = config;
  }

  public BlobBatchClient newClient(String storageNamespace) {
    URI uri = URI.create(storageNamespace);
    String accountUrl = AzureBlobStorageUtils.uriToStorageAccountUrl(uri);
    String accountName = AzureBlobStorageUtils.uriToStorageAccountName(uri);
    String keyProperty = String.format(AzureConfigurationKeys.STORAGE_ACCOUNT_KEY_PATTERN, accountName);
    Optional<String> accountKey = ConfigUtils.getOptionalString(this.config, keyProperty);
    if (!accountKey.isPresent()) {
      throw new IllegalStateException(String.format("Missing shared key %s for storage account %s", keyProperty,
          accountName));
    }
    int maxTries = ConfigUtils.getInt(this.config, AzureConfigurationKeys.MAX_TRIES_KEY,
        AzureConfigurationKeys.DEFAULT_MAX_TRIES);

    BlobServiceClient serviceClient = new BlobServiceClientBuilder()
        .endpoint(accountUrl)
        .credential(new StorageSharedKeyCredential(accountName, accountKey.get()))
        .retryOptions(new RequestRetryOptions(RetryPolicyType.EXPONENTIAL, maxTries, (Duration) null, null, null, null))
        .buildClient();
    log.info(String.format("Created blob batch client for %s", accountUrl));
    return new BlobBatchClientBuilder(serviceClient).buildClient();
  }
}
