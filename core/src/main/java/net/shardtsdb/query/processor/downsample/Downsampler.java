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

import net.shardtsdb.data.Series;
import net.shardtsdb.data.types.numeric.aggregators.Accumulator;
import net.shardtsdb.query.AggregationArgs;

/**
 * Restricts a series to a time range and optionally folds its samples into
 * fixed width buckets. Buckets are aligned on multiples of the bucket width,
 * the bucket timestamp is the start of the bucket and buckets without samples
 * are not emitted.
 *
 * @since 3.0
 */
public final class Downsampler {

  private Downsampler() {
    // Statics only.
  }

  /**
   * Computes the samples of the series within the range.
   * @param series A non-null series.
   * @param start The inclusive range start in ms.
   * @param end The inclusive range end in ms.
   * @param aggregation The bucketing, null to keep the raw samples.
   * @return A new series with the same key and labels. The source series is
   * returned as is if it lies completely within the range and no aggregation
   * was requested.
   */
  public static Series downsample(final Series series,
                                  final long start,
                                  final long end,
                                  final AggregationArgs aggregation) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final int from = series.lowerBound(start);
    final int to = end == Long.MAX_VALUE ?
        series.size() : series.lowerBound(end + 1);
    if (aggregation == null && from == 0 && to == series.size()) {
      return series;
    }

    final Series.Builder builder = Series.newBuilder()
        .setKey(series.key())
        .setLabels(series.labels());
    if (aggregation == null) {
      for (int i = from; i < to; i++) {
        builder.addSample(series.timestamp(i), series.value(i));
      }
      return builder.build();
    }

    final Accumulator accumulator = aggregation.aggregator().newAccumulator();
    long bucket = Long.MIN_VALUE;
    for (int i = from; i < to; i++) {
      final long current = aggregation.bucketStart(series.timestamp(i));
      if (current != bucket) {
        if (accumulator.count() > 0) {
          builder.addSample(bucket, accumulator.value());
        }
        accumulator.reset();
        bucket = current;
      }
      accumulator.add(series.value(i));
    }
    if (accumulator.count() > 0) {
      builder.addSample(bucket, accumulator.value());
    }
    return builder.build();
  }
}
