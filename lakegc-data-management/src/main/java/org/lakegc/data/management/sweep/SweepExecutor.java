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

package org.lakegc.data.management.sweep;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.joda.time.DateTimeUtils;
import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.exception.MarkNotFoundException;
import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.MarkStore;
import org.lakegc.mark.SweepReport;
import org.lakegc.storage.BulkRemover;
import org.lakegc.storage.DeleteResult;
import org.lakegc.storage.ObjectAddress;
import org.lakegc.util.ConfigUtils;
import org.lakegc.util.ExecutorsUtils;
import org.lakegc.util.retry.CallContext;

import lombok.extern.slf4j.Slf4j;


/**
 * Removes the addresses of a stored {@link MarkManifest} through a {@link BulkRemover}.
 *
 * <p>
 *   Addresses are split into batches no larger than {@link BulkRemover#getMaxBulkSize()} (and
 *   {@link ConfigurationKeys#SWEEP_BATCH_SIZE_KEY} when set) which run on a pool of
 *   {@link ConfigurationKeys#SWEEP_PARALLELISM_KEY} threads. Reachability is never recomputed; only addresses in the
 *   manifest are attempted. Keys the backend does not confirm are reported failed and left for a later sweep of the
 *   same mark id.
 * </p>
 *
 * <p>
 *   Once the {@link CallContext} is done no further batch is started. Batches already running complete, and the
 *   addresses of batches never started are reported failed.
 * </p>
 */
@Slf4j
public class SweepExecutor {

  private final MarkStore markStore;
  private final BulkRemover remover;
  private final int parallelism;
  private final int batchSize;

  public SweepExecutor(MarkStore markStore, BulkRemover remover, Config config) {
    this.markStore = Preconditions.checkNotNull(markStore);
    this.remover = Preconditions.checkNotNull(remover);
    this.parallelism = ConfigUtils.getInt(config, ConfigurationKeys.SWEEP_PARALLELISM_KEY,
        ConfigurationKeys.DEFAULT_SWEEP_PARALLELISM);
    int configuredBatchSize = ConfigUtils.getInt(config, ConfigurationKeys.SWEEP_BATCH_SIZE_KEY, Integer.MAX_VALUE);
    Preconditions.checkArgument(configuredBatchSize > 0, "%s must be positive, got %s",
        ConfigurationKeys.SWEEP_BATCH_SIZE_KEY, configuredBatchSize);
    this.batchSize = Math.min(remover.getMaxBulkSize(), configuredBatchSize);
  }

  public int getBatchSize() {
    return this.batchSize;
  }

  /**
   * Sweep the manifest stored under <code>markId</code> and persist the resulting {@link SweepReport}.
   *
   * @param repository repository the mark belongs to
   * @param markId id of the manifest to sweep
   * @param storageNamespace storage namespace URI of the repository
   * @param context cancellation of the sweep
   * @throws MarkNotFoundException if no manifest is stored under <code>markId</code>
   */
  public SweepReport sweep(String repository, String markId, String storageNamespace, CallContext context)
      throws IOException {
    Optional<MarkManifest> manifest = this.markStore.get(repository, markId);
    if (!manifest.isPresent()) {
      throw new MarkNotFoundException(repository, markId);
    }
    log.info(String.format("Sweeping %d addresses of mark %s in %s, batches of %d on %d threads",
        manifest.get().size(), markId, storageNamespace, this.batchSize, this.parallelism));

    List<String> removed = Lists.newArrayList();
    List<String> failed = Lists.newArrayList();
    if (manifest.get().size() > 0) {
      for (DeleteResult result : deleteInBatches(keys(manifest.get()), storageNamespace, context)) {
        removed.addAll(result.getDeleted());
        failed.addAll(result.getFailed());
      }
    }

    SweepReport report = new SweepReport(markId, new Instant(DateTimeUtils.currentTimeMillis()), addresses(removed),
        addresses(failed));
    this.markStore.putSweepReport(repository, report);
    if (report.isComplete()) {
      log.info(String.format("Sweep of mark %s removed %d objects", markId, removed.size()));
    } else {
      log.warn(String.format("Sweep of mark %s removed %d objects, %d could not be removed", markId, removed.size(),
          failed.size()));
    }
    return report;
  }

  private List<DeleteResult> deleteInBatches(List<String> keys, final String storageNamespace,
      final CallContext context) throws IOException {
    ExecutorService executor = ExecutorsUtils.newFixedThreadPool(this.parallelism, log, "lakegc-sweep-%d");
    List<Future<DeleteResult>> futures = Lists.newArrayList();
    try {
      for (final List<String> batch : Lists.partition(keys, this.batchSize)) {
        futures.add(executor.submit(new Callable<DeleteResult>() {
          @Override
          public DeleteResult call() {
            return deleteBatch(batch, storageNamespace, context);
          }
        }));
      }

      List<DeleteResult> results = Lists.newArrayList();
      for (Future<DeleteResult> future : futures) {
        try {
          results.add(future.get());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IOException("Interrupted while sweeping", ie);
        } catch (ExecutionException ee) {
          throw ExecutorsUtils.unwrapExecutionException(ee, IOException.class);
        }
      }
      return results;
    } finally {
      ExecutorsUtils.shutdownExecutorService(executor);
    }
  }

  private DeleteResult deleteBatch(List<String> batch, String storageNamespace, CallContext context) {
    if (context.isDone()) {
      log.debug(String.format("Skipping batch of %d keys: %s", batch.size(), context.getError().get().getMessage()));
      return DeleteResult.allFailed(batch);
    }
    DeleteResult result = this.remover.deleteObjects(batch, storageNamespace);
    if (!result.isComplete()) {
      log.warn(String.format("%d of %d keys were not confirmed deleted", result.getFailed().size(), batch.size()));
    }
    return result;
  }

  private static List<String> keys(MarkManifest manifest) {
    List<String> keys = Lists.newArrayListWithCapacity(manifest.size());
    for (ObjectAddress address : manifest.getAddresses()) {
      keys.add(address.getKey());
    }
    return keys;
  }

  private static List<ObjectAddress> addresses(List<String> keys) {
    List<ObjectAddress> addresses = Lists.newArrayListWithCapacity(keys.size());
    for (String key : keys) {
      addresses.add(ObjectAddress.of(key));
    }
    return addresses;
  }
}
