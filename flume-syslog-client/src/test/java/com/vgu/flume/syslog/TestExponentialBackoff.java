/*
   Copyright 2013 Vincent.Gu

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
 */
package com.vgu.flume.syslog;

import com.google.common.base.Supplier;
import org.junit.Assert;
import org.junit.Test;

public class TestExponentialBackoff {

  @Test
  public void testGrowsToCapAndResets() {
    ExponentialBackoff backoff = ExponentialBackoff.builder()
        .initialDelayMillis(100)
        .maxDelayMillis(500)
        .build();
    Assert.assertEquals(100, backoff.nextDelayMillis());
    Assert.assertEquals(200, backoff.nextDelayMillis());
    Assert.assertEquals(400, backoff.nextDelayMillis());
    Assert.assertEquals(500, backoff.nextDelayMillis());
    Assert.assertEquals(500, backoff.nextDelayMillis());
    backoff.reset();
    Assert.assertEquals(100, backoff.nextDelayMillis());
  }

  @Test
  public void testJitterNeverExceedsMax() {
    ExponentialBackoff backoff = ExponentialBackoff.builder()
        .initialDelayMillis(1000)
        .maxDelayMillis(1000)
        .jitterFactor(0.2)
        .build();
    for (int i = 0; i < 100; i++) {
      long delay = backoff.nextDelayMillis();
      Assert.assertTrue("delay " + delay, delay >= 800 && delay <= 1000);
    }
  }

  @Test
  public void testJitterBelowMax() {
    ExponentialBackoff backoff = ExponentialBackoff.builder()
        .initialDelayMillis(1000)
        .maxDelayMillis(4000)
        .jitterFactor(0.5)
        .build();
    for (int i = 0; i < 100; i++) {
      backoff.reset();
      long delay = backoff.nextDelayMillis();
      Assert.assertTrue("delay " + delay, delay >= 500 && delay <= 1500);
    }
  }

  @Test
  public void testSupplierHandsOutIndependentPolicies() {
    Supplier<ExponentialBackoff> supplier = ExponentialBackoff.builder()
        .initialDelayMillis(100)
        .maxDelayMillis(1000)
        .buildSupplier();
    ExponentialBackoff first = supplier.get();
    ExponentialBackoff second = supplier.get();
    Assert.assertNotSame(first, second);
    Assert.assertEquals(100, first.nextDelayMillis());
    Assert.assertEquals(200, first.nextDelayMillis());
    Assert.assertEquals(100, second.nextDelayMillis());
  }

  @Test
  public void testNone() {
    ExponentialBackoff backoff = ExponentialBackoff.none();
    for (int i = 0; i < 5; i++) {
      Assert.assertEquals(0, backoff.nextDelayMillis());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInitialAboveMaxRejected() {
    ExponentialBackoff.builder().initialDelayMillis(10).maxDelayMillis(5)
        .build();
  }
}
