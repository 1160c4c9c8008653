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

import org.lakegc.configuration.ConfigurationKeys;


/**
 * A central place for configuration related constants of the Azure Blob backend.
 */
public class AzureConfigurationKeys {

  public static final String AZURE_CONF_PREFIX = ConfigurationKeys.LAKEGC_PREFIX + "azure.";

  /**
   * Shared key of a storage account, the account name replaces {@code %s}.
   */
  public static final String STORAGE_ACCOUNT_KEY_PATTERN = AZURE_CONF_PREFIX + "account.%s.key";

  public static final String MAX_TRIES_KEY = AZURE_CONF_PREFIX + "max.tries";
  public static final int DEFAULT_MAX_TRIES = 4;

  public static final int AZURE_BLOB_MAX_BULK_SIZE = 256;

  public static final String HTTPS_SCHEME = "https";
  public static final String BLOB_HOST_SUFFIX = ".blob.core.windows.net";
}
