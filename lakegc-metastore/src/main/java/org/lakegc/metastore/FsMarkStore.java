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

package org.lakegc.metastore;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.PathFilter;
import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.io.Closer;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.mark.MarkManifest;
import org.lakegc.mark.MarkStore;
import org.lakegc.mark.SweepReport;
import org.lakegc.storage.ObjectAddress;
import org.lakegc.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * An implementation of {@link MarkStore} backed by a Hadoop {@link FileSystem}.
 *
 * <p>
 *   Layout: {@code <root>/<repository>/<markId>/manifest.json} holds the manifest and
 *   {@code <root>/<repository>/<markId>/sweep-<epochMillis>.json} one file per sweep. Files are JSON.
 * </p>
 *
 * <p>
 *   A manifest is first written to a temporary file in the same directory and renamed into place, so readers see
 *   either the previous manifest or the complete new one.
 * </p>
 */
@Slf4j
public class FsMarkStore implements MarkStore {

  public static final String TMP_FILE_PREFIX = "_tmp_";
  public static final String MANIFEST_FILE_NAME = "manifest.json";
  public static final String SWEEP_REPORT_PREFIX = "sweep-";
  public static final String JSON_EXTENSION = ".json";

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .setPrettyPrinting()
      .create();

  private static final PathFilter SWEEP_REPORT_FILTER = new PathFilter() {
    @Override
    public boolean accept(Path path) {
      return path.getName().startsWith(SWEEP_REPORT_PREFIX) && path.getName().endsWith(JSON_EXTENSION);
    }
  };

  protected final FileSystem fs;

  // Root directory of the mark store
  protected final Path storeRootDir;

  public FsMarkStore(FileSystem fs, String storeRootDir) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(storeRootDir), "Store root dir is null or empty.");
    this.fs = Preconditions.checkNotNull(fs);
    this.storeRootDir = new Path(storeRootDir);
  }

  public FsMarkStore(String storeUrl) throws IOException {
    this(new Path(storeUrl));
  }

  public FsMarkStore(Path storePath) throws IOException {
    this(storePath.getFileSystem(new Configuration()), storePath.toUri().getPath());
  }

  /**
   * Create a store rooted at {@link ConfigurationKeys#MARK_STORE_DIR_KEY}.
   */
  public static FsMarkStore fromConfig(Config config) throws IOException {
    return new FsMarkStore(ConfigUtils.getString(config, ConfigurationKeys.MARK_STORE_DIR_KEY,
        ConfigurationKeys.DEFAULT_MARK_STORE_DIR));
  }

  @Override
  public void put(MarkManifest manifest) throws IOException {
    Preconditions.checkNotNull(manifest, "Manifest is null.");
    Path markDir = getMarkDir(manifest.getRepository(), manifest.getMarkId());
    writeAtomically(markDir, MANIFEST_FILE_NAME, ManifestRecord.fromManifest(manifest));
    log.info(String.format("Published manifest %s of repository %s with %d addresses to %s", manifest.getMarkId(),
        manifest.getRepository(), manifest.size(), markDir));
  }

  @Override
  public Optional<MarkManifest> get(String repository, String markId) throws IOException {
    Path manifestPath = new Path(getMarkDir(repository, markId), MANIFEST_FILE_NAME);
    if (!this.fs.exists(manifestPath)) {
      return Optional.absent();
    }
    return Optional.of(read(manifestPath, ManifestRecord.class).toManifest());
  }

  @Override
  public boolean exists(String repository, String markId) throws IOException {
    return this.fs.exists(new Path(getMarkDir(repository, markId), MANIFEST_FILE_NAME));
  }

  @Override
  public void putSweepReport(String repository, SweepReport report) throws IOException {
    Preconditions.checkNotNull(report, "Sweep report is null.");
    Path markDir = getMarkDir(repository, report.getMarkId());
    String fileName = SWEEP_REPORT_PREFIX + report.getCreatedAt().getMillis() + JSON_EXTENSION;
    writeAtomically(markDir, fileName, SweepReportRecord.fromReport(report));
    log.info(String.format("Stored sweep report of mark %s at %s", report.getMarkId(), new Path(markDir, fileName)));
  }

  @Override
  public List<SweepReport> getSweepReports(String repository, String markId) throws IOException {
    Path markDir = getMarkDir(repository, markId);
    if (!this.fs.exists(markDir)) {
      return Collections.emptyList();
    }

    List<FileStatus> statuses = Lists.newArrayList(this.fs.listStatus(markDir, SWEEP_REPORT_FILTER));
    Collections.sort(statuses, new Comparator<FileStatus>() {
      @Override
      public int compare(FileStatus left, FileStatus right) {
        return Long.compare(reportMillis(left.getPath()), reportMillis(right.getPath()));
      }
    });

    List<SweepReport> reports = Lists.newArrayList();
    for (FileStatus status : statuses) {
      reports.add(read(status.getPath(), SweepReportRecord.class).toReport());
    }
    return reports;
  }

  private Path getMarkDir(String repository, String markId) {
    checkPathSegment(repository, "Repository");
    checkPathSegment(markId, "Mark id");
    return new Path(new Path(this.storeRootDir, repository), markId);
  }

  private static void checkPathSegment(String segment, String what) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(segment), "%s is null or empty.", what);
    Preconditions.checkArgument(!segment.contains(Path.SEPARATOR) && !segment.startsWith("."),
        "%s %s is not a valid path segment.", what, segment);
  }

  private static long reportMillis(Path path) {
    String name = path.getName();
    try {
      return Long.parseLong(name.substring(SWEEP_REPORT_PREFIX.length(), name.length() - JSON_EXTENSION.length()));
    } catch (NumberFormatException nfe) {
      return Long.MAX_VALUE;
    }
  }

  private void writeAtomically(Path dir, String fileName, Object record) throws IOException {
    if (!this.fs.exists(dir) && !this.fs.mkdirs(dir)) {
      throw new IOException("Failed to create directory " + dir);
    }

    Path tmpPath = new Path(dir, TMP_FILE_PREFIX + fileName);
    Closer closer = Closer.create();
    try {
      Writer writer = closer.register(new OutputStreamWriter(this.fs.create(tmpPath, true), StandardCharsets.UTF_8));
      GSON.toJson(record, writer);
    } catch (Throwable t) {
      throw closer.rethrow(t);
    } finally {
      closer.close();
    }

    renamePath(tmpPath, new Path(dir, fileName));
  }

  private void renamePath(Path src, Path dst) throws IOException {
    if (this.fs.exists(dst) && !this.fs.delete(dst, false)) {
      throw new IOException(String.format("Failed to replace %s", dst));
    }
    if (!this.fs.rename(src, dst)) {
      throw new IOException(String.format("Failed to rename %s to %s", src, dst));
    }
  }

  private <T> T read(Path path, Class<T> recordClass) throws IOException {
    Closer closer = Closer.create();
    try {
      Reader reader = closer.register(new InputStreamReader(this.fs.open(path), StandardCharsets.UTF_8));
      T record = GSON.fromJson(reader, recordClass);
      if (record == null) {
        throw new IOException("Empty mark store file " + path);
      }
      return record;
    } catch (JsonParseException jpe) {
      throw closer.rethrow(new IOException("Malformed mark store file " + path, jpe));
    } catch (Throwable t) {
      throw closer.rethrow(t);
    } finally {
      closer.close();
    }
  }

  /** JSON form of a {@link MarkManifest}. */
  private static class ManifestRecord {
    private String markId;
    private String repository;
    private long createdAt;
    private List<String> addresses;

    static ManifestRecord fromManifest(MarkManifest manifest) {
      ManifestRecord record = new ManifestRecord();
      record.markId = manifest.getMarkId();
      record.repository = manifest.getRepository();
      record.createdAt = manifest.getCreatedAt().getMillis();
      record.addresses = keys(manifest.getAddresses());
      return record;
    }

    MarkManifest toManifest() {
      return new MarkManifest(this.markId, this.repository, new Instant(this.createdAt), addresses(this.addresses));
    }
  }

  /** JSON form of a {@link SweepReport}. */
  private static class SweepReportRecord {
    private String markId;
    private long createdAt;
    private List<String> removed;
    private List<String> failed;

    static SweepReportRecord fromReport(SweepReport report) {
      SweepReportRecord record = new SweepReportRecord();
      record.markId = report.getMarkId();
      record.createdAt = report.getCreatedAt().getMillis();
      record.removed = keys(report.getRemoved());
      record.failed = keys(report.getFailed());
      return record;
    }

    SweepReport toReport() {
      return new SweepReport(this.markId, new Instant(this.createdAt), addresses(this.removed),
          addresses(this.failed));
    }
  }

  private static List<String> keys(List<ObjectAddress> addresses) {
    List<String> keys = Lists.newArrayListWithCapacity(addresses.size());
    for (ObjectAddress address : addresses) {
      keys.add(address.getKey());
    }
    return keys;
  }

  private static List<ObjectAddress> addresses(List<String> keys) {
    List<ObjectAddress> addresses = Lists.newArrayList();
    if (keys != null) {
      for (String key : keys) {
        addresses.add(ObjectAddress.of(key));
      }
    }
    return addresses;
  }
}
