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

import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.MoreObjects;

import net.shardtsdb.query.filter.PredicateList;

/**
 * The argument handed to every shard local mapper of a distributed plan. It
 * owns exactly one reference on the predicate list, taken over from the
 * caller at construction time, and gives it back on {@link #close()}.
 * <p>
 * The instance itself has a single owner: the plan definition it is attached
 * to. Engines close it once the definition and every execution started from
 * it are gone.
 *
 * @since 3.0
 */
public class ShardQueryArgs implements AutoCloseable {

  /** The predicates to match series against. */
  private final PredicateList predicates;

  /** The time range, both 0 for lookups without a range. */
  private final long start_timestamp;
  private final long end_timestamp;

  /** Whether or not the mappers have to ship the labels. */
  private final boolean with_labels;

  /** Guards the predicate reference. */
  private final AtomicBoolean closed;

  /**
   * Default ctor. Takes ownership of one reference on the predicate list;
   * callers that keep using the list must retain it before.
   * @param predicates A non-null predicate list.
   * @param start_timestamp The start of the range in ms.
   * @param end_timestamp The end of the range in ms.
   * @param with_labels Whether or not to ship labels.
   */
  public ShardQueryArgs(final PredicateList predicates,
                        final long start_timestamp,
                        final long end_timestamp,
                        final boolean with_labels) {
    if (predicates == null) {
      throw new IllegalArgumentException("Predicates cannot be null.");
    }
    this.predicates = predicates;
    this.start_timestamp = start_timestamp;
    this.end_timestamp = end_timestamp;
    this.with_labels = with_labels;
    closed = new AtomicBoolean();
  }

  /** @return The predicate list. */
  public PredicateList predicates() {
    if (closed.get()) {
      throw new IllegalStateException("Arguments were already closed.");
    }
    return predicates;
  }

  /** @return The number of predicates. */
  public int count() {
    return predicates().size();
  }

  /** @return The range start in ms. */
  public long startTimestamp() {
    return start_timestamp;
  }

  /** @return The range end in ms. */
  public long endTimestamp() {
    return end_timestamp;
  }

  /** @return Whether or not labels are shipped. */
  public boolean withLabels() {
    return with_labels;
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
        .add("predicates", predicates)
        .add("start", start_timestamp)
        .add("end", end_timestamp)
        .add("withLabels", with_labels)
        .toString();
  }
}
