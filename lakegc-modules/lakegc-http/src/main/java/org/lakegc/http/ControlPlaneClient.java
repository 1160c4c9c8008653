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

package org.lakegc.http;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.joda.time.Instant;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.BaseEncoding;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

import org.lakegc.commit.Branch;
import org.lakegc.commit.Commit;
import org.lakegc.commit.DanglingRoot;
import org.lakegc.commit.Tree;
import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.retention.GarbageCollectionRules;
import org.lakegc.retention.RetentionRule;
import org.lakegc.storage.ObjectAddress;
import org.lakegc.util.ConfigUtils;
import org.lakegc.util.retry.CallContext;

import lombok.extern.slf4j.Slf4j;


/**
 * Client of the versioning control plane: repository metadata, garbage collection rules and the commit graph.
 *
 * <p>
 *   Every call goes through a {@link RetryingHttpClient} bound to the {@link CallContext} given at construction.
 *   Answers with a non 2xx status that are not retried surface as {@link ControlPlaneException}.
 * </p>
 */
@Slf4j
public class ControlPlaneClient implements Closeable {

  public static final int BRANCHES_PAGE_SIZE = 1000;

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .create();

  private final URI apiUrl;
  private final Optional<String> authorization;
  private final RetryingHttpClient httpClient;
  private final CallContext context;

  public ControlPlaneClient(URI apiUrl, Optional<String> accessKey, Optional<String> secretKey,
      RetryingHttpClient httpClient, CallContext context) {
    Preconditions.checkArgument(accessKey.isPresent() == secretKey.isPresent(),
        "Access key and secret key must be configured together.");
    this.apiUrl = Preconditions.checkNotNull(apiUrl, "Control plane URL is null.");
    this.authorization = accessKey.isPresent()
        ? Optional.of("Basic " + BaseEncoding.base64()
            .encode((accessKey.get() + ":" + secretKey.get()).getBytes(StandardCharsets.UTF_8)))
        : Optional.<String>absent();
    this.httpClient = httpClient;
    this.context = context;
  }

  /**
   * Build a client from {@link ConfigurationKeys#API_URL_KEY} and the optional access and secret keys.
   */
  public static ControlPlaneClient fromConfig(Config config, CallContext context) {
    Preconditions.checkArgument(ConfigUtils.hasNonEmptyPath(config, ConfigurationKeys.API_URL_KEY),
        "Missing required property %s", ConfigurationKeys.API_URL_KEY);
    return new ControlPlaneClient(URI.create(config.getString(ConfigurationKeys.API_URL_KEY)),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.API_ACCESS_KEY_KEY),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.API_SECRET_KEY_KEY),
        new RetryingHttpClient(config), context);
  }

  public String getStorageNamespace(String repository) throws IOException {
    RepositoryRecord record = get(RepositoryRecord.class, ImmutableMap.<String, String>of(),
        "repositories", repository);
    if (record.storageNamespace == null) {
      throw new IOException("Repository " + repository + " has no storage namespace");
    }
    return record.storageNamespace;
  }

  public GarbageCollectionRules getGarbageCollectionRules(String repository) throws IOException {
    RulesRecord record = get(RulesRecord.class, ImmutableMap.<String, String>of(),
        "repositories", repository, "gc", "rules");
    List<RetentionRule> rules = new ArrayList<>();
    if (record.branches != null) {
      for (RuleRecord rule : record.branches) {
        rules.add(new RetentionRule(rule.branchId, rule.retentionDays));
      }
    }
    return new GarbageCollectionRules(rules, record.defaultRetentionDays);
  }

  public void setGarbageCollectionRules(String repository, GarbageCollectionRules rules) throws IOException {
    RulesRecord record = new RulesRecord();
    record.defaultRetentionDays = rules.getDefaultRetentionDays();
    record.branches = new ArrayList<>();
    for (RetentionRule rule : rules.getBranches()) {
      RuleRecord ruleRecord = new RuleRecord();
      ruleRecord.branchId = rule.getBranchId();
      ruleRecord.retentionDays = rule.getRetentionDays();
      record.branches.add(ruleRecord);
    }
    HttpPut put = new HttpPut(uri(ImmutableMap.<String, String>of(), "repositories", repository, "gc", "rules"));
    put.setEntity(new StringEntity(GSON.toJson(record), ContentType.APPLICATION_JSON));
    HttpResult result = execute(put);
    checkSuccess(put, result);
  }

  /**
   * List every branch of <code>repository</code>, following pagination until the last page.
   */
  public List<Branch> listBranches(String repository) throws IOException {
    List<Branch> branches = new ArrayList<>();
    String after = "";
    while (true) {
      BranchPageRecord page = get(BranchPageRecord.class,
          ImmutableMap.of("after", after, "amount", Integer.toString(BRANCHES_PAGE_SIZE)),
          "repositories", repository, "branches");
      if (page.results != null) {
        for (BranchRecord branch : page.results) {
          branches.add(new Branch(branch.id, branch.commitId));
        }
      }
      if (page.pagination == null || !page.pagination.hasMore) {
        break;
      }
      Preconditions.checkState(page.pagination.nextOffset != null && !page.pagination.nextOffset.equals(after),
          "Branch listing of %s did not advance past '%s'", repository, after);
      after = page.pagination.nextOffset;
    }
    log.debug(String.format("Listed %d branches of %s", branches.size(), repository));
    return branches;
  }

  public List<DanglingRoot> listDanglingRoots(String repository) throws IOException {
    DanglingPageRecord page = get(DanglingPageRecord.class, ImmutableMap.<String, String>of(),
        "repositories", repository, "gc", "dangling");
    List<DanglingRoot> roots = new ArrayList<>();
    if (page.results != null) {
      for (DanglingRecord root : page.results) {
        roots.add(new DanglingRoot(root.commitId, Optional.fromNullable(root.branch),
            root.deletedAt == null ? Optional.<Instant>absent() : Optional.of(new Instant(root.deletedAt * 1000L))));
      }
    }
    return roots;
  }

  public Commit getCommit(String repository, String commitId) throws IOException {
    CommitRecord record = get(CommitRecord.class, ImmutableMap.<String, String>of(),
        "repositories", repository, "commits", commitId);
    if (record.creationDate == null || record.treeId == null) {
      throw new IOException(String.format("Commit %s of %s is missing its creation date or tree", commitId,
          repository));
    }
    return new Commit(record.id == null ? commitId : record.id,
        record.parents == null ? ImmutableList.<String>of() : record.parents,
        new Instant(record.creationDate * 1000L), record.treeId);
  }

  public Tree getTree(String repository, String treeId) throws IOException {
    TreeRecord record = get(TreeRecord.class, ImmutableMap.<String, String>of(),
        "repositories", repository, "trees", treeId);
    Map<String, ObjectAddress> entries = new LinkedHashMap<>();
    if (record.entries != null) {
      for (TreeEntryRecord entry : record.entries) {
        entries.put(entry.path, ObjectAddress.of(entry.address));
      }
    }
    return new Tree(treeId, entries);
  }

  /**
   * @return whether <code>path</code> exists at <code>ref</code>
   */
  public boolean objectExists(String repository, String ref, String path) throws IOException {
    HttpHead head = new HttpHead(uri(ImmutableMap.of("ref", ref, "path", path), "repositories", repository,
        "objects"));
    HttpResult result = execute(head);
    if (result.getStatusCode() == HttpStatus.SC_NOT_FOUND) {
      return false;
    }
    checkSuccess(head, result);
    return true;
  }

  private <T> T get(Class<T> type, Map<String, String> query, String... segments) throws IOException {
    HttpGet get = new HttpGet(uri(query, segments));
    HttpResult result = execute(get);
    checkSuccess(get, result);
    try {
      T parsed = GSON.fromJson(result.getBody(), type);
      if (parsed == null) {
        throw new IOException("Empty response from " + get.getURI());
      }
      return parsed;
    } catch (JsonParseException jpe) {
      throw new IOException("Malformed response from " + get.getURI(), jpe);
    }
  }

  private HttpResult execute(HttpUriRequest request) throws IOException {
    request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    if (this.authorization.isPresent()) {
      request.setHeader(HttpHeaders.AUTHORIZATION, this.authorization.get());
    }
    return this.httpClient.execute(request, this.context);
  }

  private static void checkSuccess(HttpUriRequest request, HttpResult result) throws ControlPlaneException {
    if (!result.isSuccess()) {
      throw new ControlPlaneException(String.format("%s %s returned status %d: %s", request.getMethod(),
          request.getURI(), result.getStatusCode(), result.getBody()), result.getStatusCode());
    }
  }

  private URI uri(Map<String, String> query, String... segments) throws IOException {
    try {
      URIBuilder builder = new URIBuilder(this.apiUrl);
      List<String> path = Lists.newArrayList();
      for (String segment : builder.getPathSegments()) {
        if (!segment.isEmpty()) {
          path.add(segment);
        }
      }
      path.addAll(Arrays.asList(segments));
      builder.setPathSegments(path);
      for (Map.Entry<String, String> entry : query.entrySet()) {
        builder.addParameter(entry.getKey(), entry.getValue());
      }
      return builder.build();
    } catch (URISyntaxException use) {
      throw new IOException("Invalid control plane URL " + this.apiUrl, use);
    }
  }

  @Override
  public void close() throws IOException {
    this.httpClient.close();
  }

  private static class RepositoryRecord {
    private String id;
    private String storageNamespace;
  }

  private static class RulesRecord {
    private int defaultRetentionDays;
    private List<RuleRecord> branches;
  }

  private static class RuleRecord {
    private String branchId;
    private int retentionDays;
  }

  private static class BranchPageRecord {
    private List<BranchRecord> results;
    private PaginationRecord pagination;
  }

  private static class BranchRecord {
    private String id;
    private String commitId;
  }

  private static class PaginationRecord {
    private boolean hasMore;
    private String nextOffset;
  }

  private static class DanglingPageRecord {
    private List<DanglingRecord> results;
  }

  private static class DanglingRecord {
    private String commitId;
    private String branch;
    private Long deletedAt;
  }

  private static class CommitRecord {
    private String id;
    private List<String> parents;
    private Long creationDate;
    private String treeId;
  }

  private static class TreeRecord {
    private List<TreeEntryRecord> entries;
  }

  private static class TreeEntryRecord {
    private String path;
    private String address;
  }
}
