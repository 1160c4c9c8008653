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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.joda.time.DateTimeUtils;
import org.joda.time.Duration;
import org.joda.time.Instant;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.lakegc.commit.Commit;
import org.lakegc.commit.Tree;
import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.data.management.graph.InMemoryCommitGraph;
import org.lakegc.exception.MarkNotFoundException;
import org.lakegc.exception.ValidationException;
import org.lakegc.http.ControlPlaneClient;
import org.lakegc.mark.GarbageCollectionMode;
import org.lakegc.metastore.FsMarkStore;
import org.lakegc.retention.GarbageCollectionRules;
import org.lakegc.storage.BulkRemover;
import org.lakegc.storage.DeleteResult;
import org.lakegc.storage.ObjectAddress;
import org.lakegc.util.retry.CallContext;


@Test(groups = { "lakegc.runtime" }, singleThreaded = true)
public class GarbageCollectorTest {

  private static final String REPO = "repo1";
  private static final String NAMESPACE = "s3://bucket/repo1";

  private File rootDir;
  private FsMarkStore markStore;
  private ControlPlaneClient controlPlane;
  private BulkRemoverFactory removerFactory;
  private RecordingRemover remover;
  private InMemoryCommitGraph graph;

  /**
   * Removes whatever it is asked to and remembers the native key names.
   */
  private static class RecordingRemover implements BulkRemover {
    private final List<String> removed = Lists.newArrayList();

    @Override
    public int getMaxBulkSize() {
      return 2;
    }

    @Override
    public List<String> constructRemoveKeyNames(List<String> keys, String storageNamespace) {
      List<String> names = Lists.newArrayList();
      for (String key : keys) {
        names.add(storageNamespace + "/" + key);
      }
      return names;
    }

    @Override
    public synchronized DeleteResult deleteObjects(List<String> keys, String storageNamespace) {
      this.removed.addAll(constructRemoveKeyNames(keys, storageNamespace));
      return DeleteResult.of(keys, keys);
    }
  }

  @BeforeMethod
  public void setUp() throws IOException {
    this.rootDir = Files.createTempDirectory("lakegc-runtime").toFile();
    this.markStore = new FsMarkStore(this.rootDir.toURI().toString());
    this.controlPlane = Mockito.mock(ControlPlaneClient.class);
    Mockito.when(this.controlPlane.getStorageNamespace(REPO)).thenReturn(NAMESPACE);
    Mockito.when(this.controlPlane.getGarbageCollectionRules(REPO)).thenReturn(GarbageCollectionRules.withDefault(7));
    this.remover = new RecordingRemover();
    this.removerFactory = Mockito.mock(BulkRemoverFactory.class);
    Mockito.when(this.removerFactory.newBulkRemover(Mockito.<Optional<String>>any(), Mockito.anyString()))
        .thenReturn(this.remover);

    // main: c1 adds data/a and data/b ten days ago, c2 deletes data/a eight days ago
    Instant now = new Instant(DateTimeUtils.currentTimeMillis());
    this.graph = new InMemoryCommitGraph(REPO)
        .putTree(new Tree("t1", ImmutableMap.of("a", ObjectAddress.of("data/a"), "b", ObjectAddress.of("data/b"))))
        .putTree(new Tree("t2", ImmutableMap.of("b", ObjectAddress.of("data/b"))))
        .putCommit(new Commit("c1", ImmutableList.<String>of(), now.minus(Duration.standardDays(10)), "t1"))
        .putCommit(new Commit("c2", ImmutableList.of("c1"), now.minus(Duration.standardDays(8)), "t2"))
        .setBranch("main", "c2");
  }

  @AfterMethod
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(this.rootDir);
  }

  private GarbageCollector newCollector(Config config) {
    return new GarbageCollector(REPO, this.controlPlane, this.graph, this.markStore, this.removerFactory, config);
  }

  @Test
  public void testMarkAndSweep() throws IOException {
    GarbageCollectionResult result = newCollector(ConfigFactory.empty())
        .run(GarbageCollectionMode.MARK_AND_SWEEP, Optional.<String>absent(), CallContext.background());

    Assert.assertFalse(result.getMarkId().isEmpty());
    Assert.assertEquals(result.getManifest().get().getAddresses(), ImmutableList.of(ObjectAddress.of("data/a")));
    Assert.assertEquals(result.getSweepReport().get().getRemoved(), ImmutableList.of(ObjectAddress.of("data/a")));
    Assert.assertTrue(result.isComplete());
    Assert.assertEquals(this.remover.removed, ImmutableList.of(NAMESPACE + "/data/a"));
    Assert.assertTrue(this.markStore.exists(REPO, result.getMarkId()));
    Assert.assertEquals(this.markStore.getSweepReports(REPO, result.getMarkId()).size(), 1);
    Mockito.verify(this.removerFactory).newBulkRemover(Optional.<String>absent(), NAMESPACE);
  }

  @Test
  public void testMarkOnlyLeavesStorageAlone() throws IOException {
    GarbageCollectionResult result = newCollector(ConfigFactory.empty())
        .run(GarbageCollectionMode.MARK, Optional.of("mark-1"), CallContext.background());

    Assert.assertEquals(result.getMarkId(), "mark-1");
    Assert.assertEquals(result.getManifest().get().size(), 1);
    Assert.assertFalse(result.getSweepReport().isPresent());
    Assert.assertTrue(this.remover.removed.isEmpty());
    Mockito.verify(this.controlPlane, Mockito.never()).getStorageNamespace(Mockito.anyString());
    Mockito.verifyNoInteractions(this.removerFactory);
  }

  @Test
  public void testSweepOnlyUsesStoredMark() throws IOException {
    GarbageCollector collector = newCollector(ConfigFactory.empty());
    collector.run(GarbageCollectionMode.MARK, Optional.of("mark-2"), CallContext.background());
    GarbageCollectionResult result =
        collector.run(GarbageCollectionMode.SWEEP, Optional.of("mark-2"), CallContext.background());

    Assert.assertFalse(result.getManifest().isPresent());
    Assert.assertEquals(result.getSweepReport().get().getRemoved(), ImmutableList.of(ObjectAddress.of("data/a")));
    Mockito.verify(this.controlPlane, Mockito.times(1)).getGarbageCollectionRules(REPO);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testSweepRequiresMarkId() throws IOException {
    newCollector(ConfigFactory.empty())
        .run(GarbageCollectionMode.SWEEP, Optional.<String>absent(), CallContext.background());
  }

  @Test
  public void testSweepOfUnknownMark() throws IOException {
    try {
      newCollector(ConfigFactory.empty())
          .run(GarbageCollectionMode.SWEEP, Optional.of("never-marked"), CallContext.background());
      Assert.fail("Expected the missing manifest to fail the sweep");
    } catch (MarkNotFoundException e) {
      Assert.assertEquals(e.getMarkId(), "never-marked");
    }
    Assert.assertTrue(this.remover.removed.isEmpty());
  }

  @Test
  public void testConfiguredNamespaceAndType() throws IOException {
    Config config = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        ConfigurationKeys.STORAGE_NAMESPACE_KEY, "s3a://other/prefix",
        ConfigurationKeys.STORAGE_TYPE_KEY, "s3"));
    newCollector(config).run(GarbageCollectionMode.MARK_AND_SWEEP, Optional.of("mark-3"), CallContext.background());

    Mockito.verify(this.controlPlane, Mockito.never()).getStorageNamespace(Mockito.anyString());
    Mockito.verify(this.removerFactory).newBulkRemover(Optional.of("s3"), "s3a://other/prefix");
    Assert.assertEquals(this.remover.removed, ImmutableList.of("s3a://other/prefix/data/a"));
  }

  @Test
  public void testInvalidRulesWriteNoManifest() throws IOException {
    Mockito.when(this.controlPlane.getGarbageCollectionRules(REPO)).thenReturn(GarbageCollectionRules.withDefault(-1));
    try {
      newCollector(ConfigFactory.empty())
          .run(GarbageCollectionMode.MARK_AND_SWEEP, Optional.of("mark-4"), CallContext.background());
      Assert.fail("Expected the negative default retention to be rejected");
    } catch (ValidationException e) {
      Assert.assertEquals(e.getViolations(), ImmutableList.of("default retention is negative: -1"));
    }
    Assert.assertFalse(this.markStore.exists(REPO, "mark-4"));
    Assert.assertTrue(this.remover.removed.isEmpty());
  }

  @Test
  public void testCanceledRunDoesNotMark() throws IOException {
    CallContext context = CallContext.cancellable();
    context.cancel();
    try {
      newCollector(ConfigFactory.empty()).run(GarbageCollectionMode.MARK, Optional.of("mark-5"), context);
      Assert.fail("Expected the canceled context to stop the run");
    } catch (IOException e) {
      Assert.assertEquals(e.getMessage(), "context canceled");
    }
    Assert.assertFalse(this.markStore.exists(REPO, "mark-5"));
  }
}
