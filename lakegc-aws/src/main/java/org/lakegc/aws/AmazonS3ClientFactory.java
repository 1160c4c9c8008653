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

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.typesafe.config.Config;

import org.lakegc.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Builds the {@link AmazonS3} client used to delete objects. Credentials come from the default AWS provider chain.
 */
@Slf4j
public class AmazonS3ClientFactory {

  private AmazonS3ClientFactory() {
  }

  /**
   * @return a supplier creating the client on first use and returning the same client afterwards
   */
  public static Supplier<AmazonS3> memoized(final Config config) {
    return Suppliers.memoize(new Supplier<AmazonS3>() {
      @Override
      public AmazonS3 get() {
        return newClient(config);
      }
    });
  }

  public static AmazonS3 newClient(Config config) {
    String region = ConfigUtils.getString(config, AWSConfigurationKeys.AWS_REGION_KEY,
        AWSConfigurationKeys.DEFAULT_AWS_REGION);
    int maxErrorRetry = ConfigUtils.getInt(config, AWSConfigurationKeys.S3_MAX_ERROR_RETRY_KEY,
        AWSConfigurationKeys.DEFAULT_S3_MAX_ERROR_RETRY);
    Optional<String> endpoint = ConfigUtils.getOptionalString(config, AWSConfigurationKeys.S3_ENDPOINT_KEY);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withCredentials(DefaultAWSCredentialsProviderChain.getInstance())
        .withClientConfiguration(new ClientConfiguration().withMaxErrorRetry(maxErrorRetry))
        .withPathStyleAccessEnabled(ConfigUtils.getBoolean(config, AWSConfigurationKeys.S3_PATH_STYLE_ACCESS_KEY,
            false));
    if (endpoint.isPresent()) {
      builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(endpoint.get(), region));
    } else {
      builder.withRegion(region);
    }
    log.info(String.format("Created S3 client for region %s%s", region,
        endpoint.isPresent() ? " at " + endpoint.get() : ""));
    return builder.build();
  }
}
