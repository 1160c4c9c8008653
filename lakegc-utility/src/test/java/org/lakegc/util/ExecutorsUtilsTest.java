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

package org.lakegc.util;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.Assert;
import org.testng.annotations.Test;


@Test(groups = { "lakegc.util" })
public class ExecutorsUtilsTest {

  private static final Logger LOG = LoggerFactory.getLogger(ExecutorsUtilsTest.class);

  @Test
  public void testNamedDaemonThreads() throws Exception {
    ExecutorService executor = ExecutorsUtils.newFixedThreadPool(2, LOG, "test-pool-%d");
    try {
      Future<String> name = executor.submit(new Callable<String>() {
        @Override
        public String call() {
          Assert.assertTrue(Thread.currentThread().isDaemon());
          return Thread.currentThread().getName();
        }
      });
      Assert.assertTrue(name.get().startsWith("test-pool-"));
    } finally {
      ExecutorsUtils.shutdownExecutorService(executor);
    }
    Assert.assertTrue(executor.isShutdown());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRejectsEmptyPool() {
    ExecutorsUtils.newFixedThreadPool(0, LOG, "empty-%d");
  }

  @Test
  public void testUnwrapExecutionException() {
    IOException io = new IOException("boom");
    try {
      ExecutorsUtils.unwrapExecutionException(new ExecutionException(io), IOException.class);
      Assert.fail();
    } catch (IOException e) {
      Assert.assertSame(e, io);
    }

    IllegalStateException unchecked = new IllegalStateException("bad");
    try {
      ExecutorsUtils.unwrapExecutionException(new ExecutionException(unchecked), IOException.class);
      Assert.fail();
    } catch (IllegalStateException e) {
      Assert.assertSame(e, unchecked);
    } catch (IOException e) {
      Assert.fail("Unexpected checked exception", e);
    }
  }
}
