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

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.shardtsdb.query.filter.PredicateList;
import net.shardtsdb.query.processor.groupby.Reducer;

/**
 * The parsed arguments of a multi series range query. The instance owns one
 * reference on its predicate list and gives it back on {@link #close()}.
 * Everything else is immutable.
 *
 * @since 3.0
 */
public class RangeQueryArgs implements AutoCloseable {

  /** The count value meaning no cap. */
  public static final long NO_COUNT = -1;

  private final long start_timestamp;
  private final long end_timestamp;
  private final AggregationArgs aggregation;
  private final long count;
  private final boolean reverse;
  private final boolean with_labels;
  private final List<String> selected_labels;
  private final PredicateList predicates;
  private final String group_by_label;
  private final Reducer reducer;

  /** Guards the predicate reference. */
  private final AtomicBoolean closed;

  protected RangeQueryArgs(final Builder builder) {
    if (builder.predicates == null) {
      throw new IllegalArgumentException("Predicates cannot be null.");
    }
    if (builder.end_timestamp < builder.start_timestamp) {
      throw new IllegalArgumentException("End timestamp "
          + builder.end_timestamp + " is before start timestamp "
          + builder.start_timestamp);
    }
    if (builder.count != NO_COUNT && builder.count < 0) {
      throw new IllegalArgumentException("Count must be " + NO_COUNT
          + " or greater than or equal to 0.");
    }
    if (Strings.isNullOrEmpty(builder.group_by_label) !=
        (builder.reducer == null)) {
      throw new IllegalArgumentException("Group by label and reducer must "
          + "be set together.");
    }
    if (builder.with_labels && !builder.selected_labels.isEmpty()) {
      throw new IllegalArgumentException("With labels and selected labels "
          + "are mutually exclusive.");
    }
    start_timestamp = builder.start_timestamp;
    end_timestamp = builder.end_timestamp;
    aggregation = builder.aggregation;
    count = builder.count;
    reverse = builder.reverse;
    with_labels = builder.with_labels;
    selected_labels = ImmutableList.copyOf(builder.selected_labels);
    predicates = builder.predicates;
    group_by_label = Strings.emptyToNull(builder.group_by_label);
    reducer = builder.reducer;
    closed = new AtomicBoolean();
  }

  /** @return The inclusive range start in ms. */
  public long startTimestamp() {
    return start_timestamp;
  }

  /** @return The inclusive range end in ms. */
  public long endTimestamp() {
    return end_timestamp;
  }

  /** @return The bucket aggregation, null if raw samples are requested. */
  public AggregationArgs aggregation() {
    return aggregation;
  }

  /** @return The result cap, {@link #NO_COUNT} for none. */
  public long count() {
    return count;
  }

  /** @return Whether results are emitted newest first. */
  public boolean reverse() {
    return reverse;
  }

  /** @return Whether every label is replied. */
  public boolean withLabels() {
    return with_labels;
  }

  /** @return The labels to reply, empty unless requested. */
  public List<String> selectedLabels() {
    return selected_labels;
  }

  /** @return The predicate list. */
  public PredicateList predicates() {
    return predicates;
  }

  /** @return The label to group by, null if no grouping is requested. */
  public String groupByLabel() {
    return group_by_label;
  }

  /** @return The cross series reducer, null unless grouping. */
  public Reducer reducer() {
    return reducer;
  }

  /** @return True if a group by was requested. */
  public boolean isGrouped() {
    return group_by_label != null;
  }

  /** @return True once closed. */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Releases the predicate reference. Only the first call has an effect.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      predicates.release();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start_timestamp)
        .add("end", end_timestamp)
        .add("aggregation", aggregation)
        .add("count", count)
        .add("reverse", reverse)
        .add("withLabels", with_labels)
        .add("selectedLabels", selected_labels)
        .add("predicates", predicates)
        .add("groupBy", group_by_label)
        .add("reducer", reducer)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder. The predicate reference passed to
   * {@link #setPredicates(PredicateList)} moves into the built arguments.
   */
  public static class Builder {
    private long start_timestamp = 0;
    private long end_timestamp = Long.MAX_VALUE;
    private AggregationArgs aggregation;
    private long count = NO_COUNT;
    private boolean reverse;
    private boolean with_labels;
    private List<String> selected_labels = ImmutableList.of();
    private PredicateList predicates;
    private String group_by_label;
    private Reducer reducer;

    public Builder setStartTimestamp(final long start_timestamp) {
      this.start_timestamp = start_timestamp;
      return this;
    }

    public Builder setEndTimestamp(final long end_timestamp) {
      this.end_timestamp = end_timestamp;
      return this;
    }

    public Builder setAggregation(final AggregationArgs aggregation) {
      this.aggregation = aggregation;
      return this;
    }

    public Builder setCount(final long count) {
      this.count = count;
      return this;
    }

    public Builder setReverse(final boolean reverse) {
      this.reverse = reverse;
      return this;
    }

    public Builder setWithLabels(final boolean with_labels) {
      this.with_labels = with_labels;
      return this;
    }

    public Builder setSelectedLabels(final List<String> selected_labels) {
      this.selected_labels = selected_labels == null ?
          ImmutableList.<String>of() : selected_labels;
      return this;
    }

    public Builder setPredicates(final PredicateList predicates) {
      this.predicates = predicates;
      return this;
    }

    public Builder setGroupBy(final String group_by_label,
                              final Reducer reducer) {
      this.group_by_label = group_by_label;
      this.reducer = reducer;
      return this;
    }

    public RangeQueryArgs build() {
      return new RangeQueryArgs(this);
    }
  }
}
