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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;


/**
 * Parsing of Azure Blob storage namespaces of the form
 * {@code https://<account>.blob.core.windows.net/<container>/<prefix>}.
 */
public class AzureBlobStorageUtils {

  private AzureBlobStorageUtils() {
  }

  /**
   * @return the endpoint of the storage account, e.g. {@code https://account.blob.core.windows.net}
   */
  public static String uriToStorageAccountUrl(URI uri) {
    return uri.getScheme() + "://" + host(uri);
  }

  /**
   * @return the storage account name, the first label of the host
   */
  public static String uriToStorageAccountName(URI uri) {
    String host = host(uri);
    int dot = host.indexOf('.');
    return dot < 0 ? host : host.substring(0, dot);
  }

  public static boolean isAzureBlobNamespace(URI uri) {
    return AzureConfigurationKeys.HTTPS_SCHEME.equalsIgnoreCase(uri.getScheme()) && uri.getHost() != null
        && uri.getHost().toLowerCase().endsWith(AzureConfigurationKeys.BLOB_HOST_SUFFIX);
  }

  private static String host(URI uri) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(uri.getHost()), "No storage account in %s", uri);
    return uri.getHost();
  }
}
