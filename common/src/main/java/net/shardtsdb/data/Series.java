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

import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A time series reconstructed from a shard: its key, its labels and its
 * samples sorted by timestamp. Instances are immutable.
 *
 * @since 3.0
 */
public class Series {

  /** The unique key of the series. */
  private final String key;

  /** The labels, sorted by key. */
  private final SortedMap<String, String> labels;

  /** The sample timestamps in ms, ascending. */
  private final long[] timestamps;

  /** The sample values, parallel to {@link #timestamps}. */
  private final double[] values;

  protected Series(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    key = builder.key;
    labels = builder.labels.build();
    timestamps = Arrays.copyOf(builder.timestamps, builder.size);
    values = Arrays.copyOf(builder.values, builder.size);
  }

  /** @return The series key. */
  public String key() {
    return key;
  }

  /** @return The immutable, sorted labels. */
  public SortedMap<String, String> labels() {
    return labels;
  }

  /** @return The number of samples. */
  public int size() {
    return timestamps.length;
  }

  /**
   * @param index A sample index from 0 to {@link #size()} exclusive.
   * @return The timestamp of the sample in ms.
   */
  public long timestamp(final int index) {
    return timestamps[index];
  }

  /**
   * @param index A sample index from 0 to {@link #size()} exclusive.
   * @return The value of the sample.
   */
  public double value(final int index) {
    return values[index];
  }

  /**
   * Finds the first sample at or after the timestamp.
   * @param timestamp The timestamp in ms.
   * @return The index, {@link #size()} if every sample is earlier.
   */
  public int lowerBound(final long timestamp) {
    int low = 0;
    int high = timestamps.length;
    while (low < high) {
      final int mid = (low + high) >>> 1;
      if (timestamps[mid] < timestamp) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  @Override
  public String toString() {
    return "Series{key=" + key + ", labels=" + labels
        + ", samples=" + timestamps.length + "}";
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for a series. Samples must be appended in strictly ascending
   * timestamp order.
   */
  public static class Builder {
    private String key;
    private ImmutableSortedMap.Builder<String, String> labels =
        ImmutableSortedMap.naturalOrder();
    private long[] timestamps = new long[8];
    private double[] values = new double[8];
    private int size;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder addLabel(final String label, final String value) {
      labels.put(label, value);
      return this;
    }

    public Builder setLabels(final Map<String, String> labels) {
      this.labels = ImmutableSortedMap.naturalOrder();
      this.labels.putAll(labels);
      return this;
    }

    /**
     * Appends a sample.
     * @param timestamp The timestamp in ms, greater than the last one.
     * @param value The value.
     * @return The builder.
     * @throws IllegalArgumentException if the timestamp is out of order.
     */
    public Builder addSample(final long timestamp, final double value) {
      if (size > 0 && timestamps[size - 1] >= timestamp) {
        throw new IllegalArgumentException("Timestamp " + timestamp
            + " must be greater than the previous timestamp "
            + timestamps[size - 1]);
      }
      if (size == timestamps.length) {
        timestamps = Arrays.copyOf(timestamps, size * 2);
        values = Arrays.copyOf(values, size * 2);
      }
      timestamps[size] = timestamp;
      values[size++] = value;
      return this;
    }

    public Series build() {
      return new Series(this);
    }
  }
}
