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

import org.lakegc.configuration.ConfigurationKeys;


/**
 * A central place for configuration related constants of the S3 backend.
 */
public class AWSConfigurationKeys {

  public static final String AWS_CONF_PREFIX = ConfigurationKeys.LAKEGC_PREFIX + "aws.";

  public static final String AWS_REGION_KEY = AWS_CONF_PREFIX + "region";
  public static final String DEFAULT_AWS_REGION = "us-east-1";

  // Optional endpoint for S3 compatible stores
  public static final String S3_ENDPOINT_KEY = AWS_CONF_PREFIX + "s3.endpoint";
  public static final String S3_PATH_STYLE_ACCESS_KEY = AWS_CONF_PREFIX + "s3.path.style.access";

  public static final String S3_MAX_ERROR_RETRY_KEY = AWS_CONF_PREFIX + "s3.max.error.retry";
  public static final int DEFAULT_S3_MAX_ERROR_RETRY = 20;

  public static final int S3_MAX_BULK_SIZE = 1000;

  public static final String S3_SCHEME = "s3";
  public static final String S3A_SCHEME = "s3a";
}
