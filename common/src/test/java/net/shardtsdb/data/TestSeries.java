// This file is part of OpenTSDB.
// Copyright (C) 2018  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.shardtsdb.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class TestSeries {

  @Test
  public void builder() throws Exception {
    final Series series = Series.newBuilder()
        .setKey("cpu{host=a}")
        .addLabel("host", "a")
        .addLabel("dc", "lga")
        .addSample(1000, 1)
        .addSample(2000, Double.NaN)
        .build();
    assertEquals("cpu{host=a}", series.key());
    assertEquals(ImmutableMap.of("dc", "lga", "host", "a"), series.labels());
    assertEquals("dc", series.labels().firstKey());
    assertEquals(2, series.size());
    assertEquals(1000, series.timestamp(0));
    assertEquals(1, series.value(0), 0.001);
    assertEquals(2000, series.timestamp(1));
    assertEquals(Double.NaN, series.value(1), 0.001);
  }

  @Test
  public void growsPastInitialCapacity() throws Exception {
    final Series.Builder builder = Series.newBuilder().setKey("a");
    for (int i = 0; i < 100; i++) {
      builder.addSample(i, i * 2);
    }
    final Series series = builder.build();
    assertEquals(100, series.size());
    assertEquals(99, series.timestamp(99));
    assertEquals(198, series.value(99), 0.001);
  }

  @Test
  public void setLabelsReplaces() throws Exception {
    final Series series = Series.newBuilder()
        .setKey("a")
        .addLabel("host", "a")
        .setLabels(ImmutableMap.of("dc", "lga"))
        .build();
    assertEquals(ImmutableMap.of("dc", "lga"), series.labels());
  }

  @Test
  public void lowerBound() throws Exception {
    final Series series = Series.newBuilder()
        .setKey("a")
        .addSample(1000, 1)
        .addSample(2000, 2)
        .addSample(3000, 3)
        .build();
    assertEquals(0, series.lowerBound(Long.MIN_VALUE));
    assertEquals(0, series.lowerBound(1000));
    assertEquals(1, series.lowerBound(1001));
    assertEquals(2, series.lowerBound(3000));
    assertEquals(3, series.lowerBound(3001));
    assertEquals(0, Series.newBuilder().setKey("b").build().lowerBound(5));
  }

  @Test
  public void invalid() throws Exception {
    try {
      Series.newBuilder().build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Series.newBuilder().setKey("a").addSample(2000, 1).addSample(1000, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      Series.newBuilder().setKey("a").addSample(1000, 1).addSample(1000, 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
