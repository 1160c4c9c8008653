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
import java.util.List;

import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.azure.core.http.rest.Response;
import com.azure.core.util.Context;
import com.azure.storage.blob.batch.BlobBatch;
import com.azure.storage.blob.batch.BlobBatchClient;
import com.azure.storage.blob.models.BlobRequestConditions;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.google.common.base.Function;
import com.google.common.base.Functions;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.ConfigFactory;

import org.lakegc.storage.DeleteResult;


/**
 * Unit tests for {@link AzureBlobBulkRemover} and {@link AzureBlobStorageUtils}.
 */
@Test(groups = { "lakegc.azure" })
public class AzureBlobBulkRemoverTest {

  private static final String NAMESPACE = "https://account.blob.core.windows.net/container/repo";

  private BlobBatchClient client;
  private BlobBatch batch;
  private AzureBlobBulkRemover remover;

  @BeforeMethod
  public void setUp() {
    this.client = Mockito.mock(BlobBatchClient.class);
    this.batch = Mockito.mock(BlobBatch.class);
    Mockito.when(this.client.getBlobBatch()).thenReturn(this.batch);
    @SuppressWarnings("unchecked")
    Function<String, BlobBatchClient> provider = (Function) Functions.constant(this.client);
    this.remover = new AzureBlobBulkRemover(provider, ConfigFactory.empty());
  }

  @SuppressWarnings("unchecked")
  private static Response<Void> response(int status) {
    Response<Void> response = Mockito.mock(Response.class);
    Mockito.when(response.getStatusCode()).thenReturn(status);
    return response;
  }

  @Test
  public void testStorageAccount() {
    URI uri = URI.create(NAMESPACE);
    Assert.assertEquals(AzureBlobStorageUtils.uriToStorageAccountUrl(uri), "https://account.blob.core.windows.net");
    Assert.assertEquals(AzureBlobStorageUtils.uriToStorageAccountName(uri), "account");
    Assert.assertTrue(AzureBlobStorageUtils.isAzureBlobNamespace(uri));
    Assert.assertFalse(AzureBlobStorageUtils.isAzureBlobNamespace(URI.create("s3://bucket/repo")));
  }

  @Test
  public void testConstructRemoveKeyNames() {
    List<String> expected = ImmutableList.of(NAMESPACE + "/a", NAMESPACE + "/b/c");
    Assert.assertEquals(this.remover.getMaxBulkSize(), 256);
    Assert.assertEquals(this.remover.constructRemoveKeyNames(ImmutableList.of("a", "b/c"), NAMESPACE), expected);
    Assert.assertEquals(this.remover.constructRemoveKeyNames(ImmutableList.of("a", "b/c"), NAMESPACE + "/"),
        expected);
    Assert.assertTrue(this.remover.constructRemoveKeyNames(ImmutableList.<String>of(), NAMESPACE).isEmpty());
  }

  @Test
  public void testEmptyKeysMakeNoCall() {
    Assert.assertEquals(this.remover.deleteObjects(ImmutableList.<String>of(), NAMESPACE), DeleteResult.empty());
    Mockito.verifyNoInteractions(this.client);
  }

  @Test
  public void testPerBlobStatuses() {
    Response<Void> accepted = response(202);
    Response<Void> missing = response(404);
    Response<Void> denied = response(403);
    Response<Void> broken = response(0);
    Mockito.when(broken.getStatusCode()).thenThrow(new IllegalStateException("no response"));
    Mockito.when(this.batch.deleteBlob(Mockito.anyString(), Mockito.eq(DeleteSnapshotsOptionType.INCLUDE),
        Mockito.nullable(BlobRequestConditions.class))).thenReturn(accepted, missing, denied, broken);

    DeleteResult result = this.remover.deleteObjects(ImmutableList.of("a", "b", "c", "d"), NAMESPACE);
    Assert.assertEquals(result.getDeleted(), ImmutableList.of("a"));
    Assert.assertEquals(result.getFailed(), ImmutableList.of("b", "c", "d"));

    ArgumentCaptor<String> urls = ArgumentCaptor.forClass(String.class);
    Mockito.verify(this.batch, Mockito.times(4)).deleteBlob(urls.capture(),
        Mockito.eq(DeleteSnapshotsOptionType.INCLUDE), Mockito.nullable(BlobRequestConditions.class));
    Assert.assertEquals(urls.getAllValues(),
        ImmutableList.of(NAMESPACE + "/a", NAMESPACE + "/b", NAMESPACE + "/c", NAMESPACE + "/d"));
    Mockito.verify(this.client).submitBatchWithResponse(Mockito.same(this.batch), Mockito.eq(false),
        Mockito.nullable(Duration.class), Mockito.eq(Context.NONE));
  }

  @Test
  public void testBatchFailureFailsEveryKey() {
    Response<Void> accepted = response(202);
    Mockito.when(this.batch.deleteBlob(Mockito.anyString(), Mockito.eq(DeleteSnapshotsOptionType.INCLUDE),
        Mockito.nullable(BlobRequestConditions.class))).thenReturn(accepted);
    Mockito.when(this.client.submitBatchWithResponse(Mockito.same(this.batch), Mockito.eq(false),
        Mockito.nullable(Duration.class), Mockito.eq(Context.NONE))).thenThrow(new RuntimeException("timeout"));

    DeleteResult result = this.remover.deleteObjects(ImmutableList.of("a", "b"), NAMESPACE);
    Assert.assertTrue(result.getDeleted().isEmpty());
    Assert.assertEquals(result.getFailed(), ImmutableList.of("a", "b"));
  }

  @Test
  public void testMissingAccountKey() {
    try {
      new BlobBatchClientFactory(ConfigFactory.empty()).newClient(NAMESPACE);
      Assert.fail("Expected a missing key to be reported");
    } catch (IllegalStateException e) {
      Assert.assertTrue(e.getMessage().contains("lakegc.azure.account.account.key"));
    }
  }
}
