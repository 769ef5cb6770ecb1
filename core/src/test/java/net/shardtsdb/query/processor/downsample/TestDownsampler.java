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
package net.shardtsdb.query.processor.downsample;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import net.shardtsdb.data.Series;
import net.shardtsdb.data.types.numeric.aggregators.Aggregators;
import net.shardtsdb.query.AggregationArgs;

public class TestDownsampler {
  private Series series;

  @Before
  public void before() throws Exception {
    series = Series.newBuilder()
        .setKey("cpu")
        .addLabel("host", "a")
        .addSample(1000, 1)
        .addSample(1500, 2)
        .addSample(2000, 3)
        .addSample(2999, 4)
        .addSample(3000, 5)
        .build();
  }

  @Test
  public void passThrough() throws Exception {
    assertSame(series, Downsampler.downsample(series, 0, Long.MAX_VALUE, null));
    assertSame(series, Downsampler.downsample(series, 1000, 3000, null));
  }

  @Test
  public void rangeIsInclusive() throws Exception {
    final Series result = Downsampler.downsample(series, 1500, 2999, null);
    assertNotSame(series, result);
    assertEquals("cpu", result.key());
    assertEquals("a", result.labels().get("host"));
    assertEquals(3, result.size());
    assertEquals(1500, result.timestamp(0));
    assertEquals(2999, result.timestamp(2));
  }

  @Test
  public void rangeOutside() throws Exception {
    assertEquals(0, Downsampler.downsample(series, 4000, 5000, null).size());
    assertEquals(0, Downsampler.downsample(series, 0, 999, null).size());
  }

  @Test
  public void buckets() throws Exception {
    final Series result = Downsampler.downsample(series, 0, Long.MAX_VALUE,
        new AggregationArgs(Aggregators.SUM, 1000));
    assertEquals(3, result.size());
    assertEquals(1000, result.timestamp(0));
    assertEquals(3, result.value(0), 0.001);
    assertEquals(2000, result.timestamp(1));
    assertEquals(7, result.value(1), 0.001);
    assertEquals(3000, result.timestamp(2));
    assertEquals(5, result.value(2), 0.001);
  }

  @Test
  public void bucketsWithinRange() throws Exception {
    final Series result = Downsampler.downsample(series, 1500, 2500,
        new AggregationArgs(Aggregators.COUNT, 2000));
    assertEquals(2, result.size());
    assertEquals(0, result.timestamp(0));
    assertEquals(1, result.value(0), 0.001);
    assertEquals(2000, result.timestamp(1));
    assertEquals(1, result.value(1), 0.001);
  }

  @Test
  public void negativeTimestampsAlign() throws Exception {
    final Series negative = Series.newBuilder()
        .setKey("neg")
        .addSample(-1500, 1)
        .addSample(-1000, 2)
        .addSample(-1, 3)
        .build();
    final Series result = Downsampler.downsample(negative, Long.MIN_VALUE,
        Long.MAX_VALUE, new AggregationArgs(Aggregators.LAST, 1000));
    assertEquals(2, result.size());
    assertEquals(-2000, result.timestamp(0));
    assertEquals(1, result.value(0), 0.001);
    assertEquals(-1000, result.timestamp(1));
    assertEquals(3, result.value(1), 0.001);
  }

  @Test
  public void nullSeries() throws Exception {
    try {
      Downsampler.downsample(null, 0, 1, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
