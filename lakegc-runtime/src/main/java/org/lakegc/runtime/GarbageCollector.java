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

import java.io.Closeable;
import java.io.IOException;
import java.util.UUID;

import org.joda.time.DateTimeUtils;
import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.io.Closer;
import com.typesafe.config.Config;

import org.lakegc.commit.CommitGraph;
import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.data.management.mark.ReachabilityMarker;
import org.lakegc.data.management.sweep.SweepExecutor;
import org.lakegc.http.ControlPlaneClient;
import org.lakegc.http.ControlPlaneCommitGraph;
import org.lakegc.mark.GarbageCollectionMode;
import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.MarkStore;
import org.lakegc.mark.SweepReport;
import org.lakegc.metastore.FsMarkStore;
import org.lakegc.retention.GarbageCollectionRules;
import org.lakegc.storage.BulkRemover;
import org.lakegc.util.ConfigUtils;
import org.lakegc.util.retry.CallContext;

import lombok.extern.slf4j.Slf4j;


/**
 * Runs the mark and sweep phases of one repository according to a {@link GarbageCollectionMode}.
 *
 * <p>
 *   Retention rules are read from the control plane once per run. The storage namespace is read from the control plane
 *   too, unless {@link ConfigurationKeys#STORAGE_NAMESPACE_KEY} overrides it. When the run sweeps, the namespace and
 *   the {@link BulkRemover} are resolved before marking so that a misconfigured backend fails the run before a new
 *   manifest is written.
 * </p>
 */
@Slf4j
public class GarbageCollector implements Closeable {

  private final String repository;
  private final ControlPlaneClient controlPlane;
  private final CommitGraph graph;
  private final MarkStore markStore;
  private final BulkRemoverFactory removerFactory;
  private final Config config;
  private final Closer closer = Closer.create();

  public GarbageCollector(String repository, ControlPlaneClient controlPlane, CommitGraph graph, MarkStore markStore,
      BulkRemoverFactory removerFactory, Config config) {
    this.repository = Preconditions.checkNotNull(repository, "Repository is null.");
    this.controlPlane = this.closer.register(controlPlane);
    this.graph = graph;
    this.markStore = markStore;
    this.removerFactory = removerFactory;
    this.config = config;
  }

  /**
   * Wire a collector against the control plane, mark store and storage backends named in <code>config</code>.
   */
  public static GarbageCollector fromConfig(String repository, Config config, CallContext context) throws IOException {
    ControlPlaneClient controlPlane = ControlPlaneClient.fromConfig(config, context);
    try {
      return new GarbageCollector(repository, controlPlane, new ControlPlaneCommitGraph(controlPlane, repository),
          FsMarkStore.fromConfig(config), new BulkRemoverFactory(config), config);
    } catch (IOException | RuntimeException e) {
      controlPlane.close();
      throw e;
    }
  }

  /**
   * Run the phases of <code>mode</code>.
   *
   * @param markId id of the manifest to write or sweep; generated when absent and the run marks
   * @param context cancellation of the run
   * @throws IllegalArgumentException if the run only sweeps and no mark id is given
   * @throws org.lakegc.exception.GarbageCollectionException if the rules are invalid, the ancestry cannot be read
   *         or no manifest is stored under the mark id
   */
  public GarbageCollectionResult run(GarbageCollectionMode mode, Optional<String> markId, CallContext context)
      throws IOException {
    Preconditions.checkArgument(mode.doMark() || markId.isPresent(), "Mode %s requires a mark id",
        mode.getCliName());
    String id = markId.isPresent() ? markId.get() : UUID.randomUUID().toString();
    log.info(String.format("Starting garbage collection of %s in mode %s with mark id %s", this.repository,
        mode.getCliName(), id));

    Optional<String> storageNamespace = Optional.absent();
    Optional<BulkRemover> remover = Optional.absent();
    if (mode.doSweep()) {
      storageNamespace = Optional.of(resolveStorageNamespace());
      remover = Optional.of(this.removerFactory.newBulkRemover(
          ConfigUtils.getOptionalString(this.config, ConfigurationKeys.STORAGE_TYPE_KEY), storageNamespace.get()));
    }

    Optional<MarkManifest> manifest = Optional.absent();
    if (mode.doMark()) {
      context.checkNotDone();
      GarbageCollectionRules rules = this.controlPlane.getGarbageCollectionRules(this.repository);
      log.info(String.format("Retention of %s: default %d days, %d branch rules", this.repository,
          rules.getDefaultRetentionDays(), rules.getBranches().size()));
      Instant now = new Instant(DateTimeUtils.currentTimeMillis());
      manifest = Optional.of(new ReachabilityMarker(this.graph, this.markStore, this.config).mark(id, rules, now));
    }

    Optional<SweepReport> report = Optional.absent();
    if (mode.doSweep()) {
      report = Optional.of(new SweepExecutor(this.markStore, remover.get(), this.config)
          .sweep(this.repository, id, storageNamespace.get(), context));
    }

    GarbageCollectionResult result = new GarbageCollectionResult(this.repository, mode, id, manifest, report);
    log.info("Finished garbage collection: " + result);
    return result;
  }

  private String resolveStorageNamespace() throws IOException {
    Optional<String> configured = ConfigUtils.getOptionalString(this.config, ConfigurationKeys.STORAGE_NAMESPACE_KEY);
    if (configured.isPresent()) {
      return configured.get();
    }
    return this.controlPlane.getStorageNamespace(this.repository);
  }

  @Override
  public void close() throws IOException {
    this.closer.close();
  }
}
