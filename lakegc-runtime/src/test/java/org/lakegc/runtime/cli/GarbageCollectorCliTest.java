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

package org.lakegc.runtime.cli;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.joda.time.DateTimeUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.lakegc.metastore.FsMarkStore;
import org.lakegc.util.retry.CallContext;


@Test(groups = { "lakegc.runtime" }, singleThreaded = true)
public class GarbageCollectorCliTest {

  private static final long DAY_SECONDS = 24L * 3600L;

  private File workDir;
  private HttpServer server;
  private StringWriter output;
  private GarbageCollectorCli cli;

  @BeforeClass
  public void setUp() throws IOException {
    this.workDir = Files.createTempDirectory("lakegc-cli").toFile();

    long nowSeconds = DateTimeUtils.currentTimeMillis() / 1000L;
    final Map<String, String> responses = ImmutableMap.<String, String>builder()
        .put("/api/v1/repositories/repo1", "{\"id\":\"repo1\",\"storage_namespace\":\"s3://bucket/repo1\"}")
        .put("/api/v1/repositories/repo1/gc/rules", "{\"default_retention_days\":1,\"branches\":[]}")
        .put("/api/v1/repositories/repo1/branches",
            "{\"results\":[{\"id\":\"main\",\"commit_id\":\"c2\"}],\"pagination\":{\"has_more\":false}}")
        .put("/api/v1/repositories/repo1/gc/dangling", "{\"results\":[]}")
        .put("/api/v1/repositories/repo1/commits/c1", "{\"id\":\"c1\",\"parents\":[],\"creation_date\":"
            + (nowSeconds - 5 * DAY_SECONDS) + ",\"tree_id\":\"t1\"}")
        .put("/api/v1/repositories/repo1/commits/c2", "{\"id\":\"c2\",\"parents\":[\"c1\"],\"creation_date\":"
            + (nowSeconds - 3 * DAY_SECONDS) + ",\"tree_id\":\"t2\"}")
        .put("/api/v1/repositories/repo1/trees/t1",
            "{\"entries\":[{\"path\":\"old.csv\",\"address\":\"data/old\"},{\"path\":\"new.csv\",\"address\":\"data/new\"}]}")
        .put("/api/v1/repositories/repo1/trees/t2", "{\"entries\":[{\"path\":\"new.csv\",\"address\":\"data/new\"}]}")
        .build();

    this.server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    this.server.createContext("/", new HttpHandler() {
      @Override
      public void handle(HttpExchange exchange) throws IOException {
        String response = responses.get(exchange.getRequestURI().getPath());
        byte[] body = (response == null ? "{\"message\":\"not found\"}" : response).getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(response == null ? 404 : 200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
          os.write(body);
        }
      }
    });
    this.server.start();
  }

  @BeforeMethod
  public void newCli() {
    this.output = new StringWriter();
    this.cli = new GarbageCollectorCli(new PrintWriter(this.output, true));
  }

  @AfterClass(alwaysRun = true)
  public void tearDown() throws IOException {
    this.server.stop(0);
    FileUtils.deleteDirectory(this.workDir);
  }

  private String writeConfig(String name, String apiUrl) throws IOException {
    File config = new File(this.workDir, name);
    String hocon = "lakegc {\n"
        + "  api.url = \"" + apiUrl + "\"\n"
        + "  mark.store.dir = \"" + new File(this.workDir, "marks").toURI() + "\"\n"
        + "  http.retry { max = 0, min_wait_ms = 1, max_wait_ms = 1 }\n"
        + "}\n";
    FileUtils.writeStringToFile(config, hocon, StandardCharsets.UTF_8);
    return config.getAbsolutePath();
  }

  private String apiUrl() {
    return "http://localhost:" + this.server.getAddress().getPort() + "/api/v1";
  }

  @Test
  public void testMarkRun() throws IOException {
    String config = writeConfig("mark.conf", apiUrl());
    int exitCode = this.cli.run(new String[] {"-r", "repo1", "-m", "mark", "-i", "cli-mark", "-c", config},
        CallContext.background());

    Assert.assertEquals(exitCode, GarbageCollectorCli.EXIT_SUCCESS, this.output.toString());
    Assert.assertTrue(this.output.toString().contains("marked 1"), this.output.toString());
    FsMarkStore markStore = new FsMarkStore(new File(this.workDir, "marks").toURI().toString());
    Assert.assertEquals(markStore.get("repo1", "cli-mark").get().getAddresses().get(0).getKey(), "data/old");
  }

  @Test
  public void testHelp() {
    Assert.assertEquals(this.cli.run(new String[] {"-h"}, CallContext.background()), GarbageCollectorCli.EXIT_SUCCESS);
    Assert.assertTrue(this.output.toString().contains("--repository"));
  }

  @Test
  public void testUsageErrors() {
    Assert.assertEquals(this.cli.run(new String[0], CallContext.background()), GarbageCollectorCli.EXIT_USAGE);
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo1", "-m", "sweep"}, CallContext.background()),
        GarbageCollectorCli.EXIT_USAGE);
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo1", "-m", "compact"}, CallContext.background()),
        GarbageCollectorCli.EXIT_USAGE);
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo1", "--unknown"}, CallContext.background()),
        GarbageCollectorCli.EXIT_USAGE);
    Assert.assertTrue(this.output.toString().contains("Mode sweep requires a mark id"));
  }

  @Test
  public void testMissingConfigFileIsFatal() {
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo1", "-m", "mark", "-c",
        new File(this.workDir, "missing.conf").getAbsolutePath()}, CallContext.background()),
        GarbageCollectorCli.EXIT_FAILURE);
  }

  @Test
  public void testMissingManifestIsFatal() throws IOException {
    String config = writeConfig("sweep.conf", apiUrl());
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo1", "-m", "sweep", "-i", "never-marked", "-c", config},
        CallContext.background()), GarbageCollectorCli.EXIT_FAILURE);
    Assert.assertTrue(this.output.toString().contains("never-marked"), this.output.toString());
  }

  @Test
  public void testUnknownRepositoryIsFatal() throws IOException {
    String config = writeConfig("unknown.conf", apiUrl());
    Assert.assertEquals(this.cli.run(new String[] {"-r", "repo2", "-m", "mark", "-c", config},
        CallContext.background()), GarbageCollectorCli.EXIT_FAILURE);
  }
}
