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

package org.lakegc.configuration;

import java.util.concurrent.TimeUnit;


/**
 * A central place for all configuration property keys used by the garbage collector.
 *
 * <p>
 *   Backend specific keys live next to the backend implementation, see for instance
 *   {@code AWSConfigurationKeys} and {@code AzureConfigurationKeys}.
 * </p>
 */
public class ConfigurationKeys {

  public static final String LAKEGC_PREFIX = "lakegc.";

  /**
   * Run configuration properties.
   */
  public static final String REPOSITORY_KEY = LAKEGC_PREFIX + "repository";
  public static final String MODE_KEY = LAKEGC_PREFIX + "mode";
  public static final String DEFAULT_MODE = "both";
  public static final String MARK_ID_KEY = LAKEGC_PREFIX + "mark.id";

  /**
   * Mark phase configuration properties.
   */
  public static final String MARK_THREADS_KEY = LAKEGC_PREFIX + "mark.threads";
  public static final int DEFAULT_MARK_THREADS = 8;
  public static final String MARK_STORE_DIR_KEY = LAKEGC_PREFIX + "mark.store.dir";
  public static final String DEFAULT_MARK_STORE_DIR = "file:///tmp/lakegc/marks";
  public static final String LOCAL_FS_URI = "file:///";

  /**
   * Sweep phase configuration properties.
   */
  public static final String SWEEP_PARALLELISM_KEY = LAKEGC_PREFIX + "sweep.parallelism";
  public static final int DEFAULT_SWEEP_PARALLELISM = 4;
  public static final String SWEEP_BATCH_SIZE_KEY = LAKEGC_PREFIX + "sweep.batch.size";
  public static final String SWEEP_LOGGED_KEYS_KEY = LAKEGC_PREFIX + "sweep.logged.keys";
  public static final int DEFAULT_SWEEP_LOGGED_KEYS = 100;

  /**
   * Storage configuration properties.
   */
  public static final String STORAGE_TYPE_KEY = LAKEGC_PREFIX + "storage.type";
  public static final String STORAGE_NAMESPACE_KEY = LAKEGC_PREFIX + "storage.namespace";

  /**
   * Control plane configuration properties.
   */
  public static final String API_URL_KEY = LAKEGC_PREFIX + "api.url";
  public static final String API_ACCESS_KEY_KEY = LAKEGC_PREFIX + "api.access_key";
  public static final String API_SECRET_KEY_KEY = LAKEGC_PREFIX + "api.secret_key";

  public static final String HTTP_RETRY_PREFIX = LAKEGC_PREFIX + "http.retry";
  public static final String HTTP_RETRY_MAX_KEY = HTTP_RETRY_PREFIX + ".max";
  public static final int DEFAULT_HTTP_RETRY_MAX = 4;
  public static final String HTTP_RETRY_MIN_WAIT_MS_KEY = HTTP_RETRY_PREFIX + ".min_wait_ms";
  public static final long DEFAULT_HTTP_RETRY_MIN_WAIT_MS = TimeUnit.MILLISECONDS.toMillis(200L);
  public static final String HTTP_RETRY_MAX_WAIT_MS_KEY = HTTP_RETRY_PREFIX + ".max_wait_ms";
  public static final long DEFAULT_HTTP_RETRY_MAX_WAIT_MS = TimeUnit.SECONDS.toMillis(30L);
  public static final String HTTP_MAX_IDLE_CONNS_PER_HOST_KEY = LAKEGC_PREFIX + "http.max.idle.conns.per.host";
  public static final int DEFAULT_HTTP_MAX_IDLE_CONNS_PER_HOST = 100;
  public static final String HTTP_MAX_TOTAL_CONNS_KEY = LAKEGC_PREFIX + "http.max.total.conns";
  public static final int DEFAULT_HTTP_MAX_TOTAL_CONNS = 200;
  public static final String HTTP_REQUEST_TIMEOUT_MS_KEY = LAKEGC_PREFIX + "http.request.timeout_ms";
  public static final long DEFAULT_HTTP_REQUEST_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(60L);
  public static final String HTTP_CONNECTION_TIMEOUT_MS_KEY = LAKEGC_PREFIX + "http.connection.timeout_ms";
  public static final long DEFAULT_HTTP_CONNECTION_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(10L);
}
