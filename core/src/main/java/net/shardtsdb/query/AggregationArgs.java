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
package net.shardtsdb.query;

import com.google.common.base.Objects;

import net.shardtsdb.data.types.numeric.aggregators.Aggregator;

/**
 * The time bucketing of a range query: the function applied per bucket and
 * the bucket width.
 * 
 * @since 3.0
 */
public class AggregationArgs {
  
  /** The function folding each bucket. */
  private final Aggregator aggregator;
  
  /** The bucket width in ms. */
  private final long time_delta;
  
  /**
   * Default ctor.
   * @param aggregator A non-null aggregator.
   * @param time_delta The bucket width in ms, greater than 0.
   */
  public AggregationArgs(final Aggregator aggregator, final long time_delta) {
    if (aggregator == null) {
      throw new IllegalArgumentException("Aggregator cannot be null.");
    }
    if (time_delta <= 0) {
      throw new IllegalArgumentException("Time delta must be greater than 0.");
    }
    this.aggregator = aggregator;
    this.time_delta = time_delta;
  }
  
  /** @return The aggregator. */
  public Aggregator aggregator() {
    return aggregator;
  }
  
  /** @return The bucket width in ms. */
  public long timeDelta() {
    return time_delta;
  }
  
  /**
   * @param timestamp A timestamp in ms.
   * @return The start of the bucket the timestamp falls in.
   */
  public long bucketStart(final long timestamp) {
    return timestamp - Math.floorMod(timestamp, time_delta);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final AggregationArgs other = (AggregationArgs) o;
    return aggregator.name().equals(other.aggregator.name())
        && time_delta == other.time_delta;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(aggregator.name(), time_delta);
  }
  
  @Override
  public String toString() {
    return aggregator.name() + "/" + time_delta;
  }
}
