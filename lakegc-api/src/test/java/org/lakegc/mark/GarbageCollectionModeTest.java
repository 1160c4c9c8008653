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

package org.lakegc.mark;

import org.testng.Assert;
import org.testng.annotations.Test;


@Test(groups = { "lakegc.api" })
public class GarbageCollectionModeTest {

  @Test
  public void testForName() {
    Assert.assertEquals(GarbageCollectionMode.forName("mark"), GarbageCollectionMode.MARK);
    Assert.assertEquals(GarbageCollectionMode.forName("SWEEP"), GarbageCollectionMode.SWEEP);
    Assert.assertEquals(GarbageCollectionMode.forName("both"), GarbageCollectionMode.MARK_AND_SWEEP);
    Assert.assertEquals(GarbageCollectionMode.forName("mark_and_sweep"), GarbageCollectionMode.MARK_AND_SWEEP);
  }

  @Test
  public void testPhases() {
    Assert.assertTrue(GarbageCollectionMode.MARK.doMark());
    Assert.assertFalse(GarbageCollectionMode.MARK.doSweep());
    Assert.assertFalse(GarbageCollectionMode.SWEEP.doMark());
    Assert.assertTrue(GarbageCollectionMode.MARK_AND_SWEEP.doMark() && GarbageCollectionMode.MARK_AND_SWEEP.doSweep());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownMode() {
    GarbageCollectionMode.forName("compact");
  }
}
