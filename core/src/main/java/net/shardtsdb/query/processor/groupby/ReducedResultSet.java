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
package net.shardtsdb.query.processor.groupby;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.shardtsdb.data.Series;
import net.shardtsdb.query.RangeQueryArgs;
import net.shardtsdb.query.SeriesFormatter;
import net.shardtsdb.query.SeriesFormatter.FormattedSeries;

/**
 * The reduced stage of a grouped range query: exactly one series per group.
 * The only thing left to do is {@link #format(boolean, List, long,
 * boolean)}, which applies the client visible cap and ordering once, across
 * groups.
 *
 * @since 3.0
 */
public class ReducedResultSet {

  /** Ascending group value order. */
  private static final Comparator<Group> BY_VALUE = new Comparator<Group>() {
    @Override
    public int compare(final Group a, final Group b) {
      return a.value.compareTo(b.value);
    }
  };

  /** The groups sorted by value. */
  private final List<Group> groups;

  /** Set once the reply was written. */
  private boolean formatted;

  ReducedResultSet(final List<Group> groups) {
    final List<Group> sorted = Lists.newArrayList(groups);
    Collections.sort(sorted, BY_VALUE);
    this.groups = ImmutableList.copyOf(sorted);
  }

  /** @return The number of groups. */
  public int size() {
    return groups.size();
  }

  /** @return The reduced series, ordered by ascending group value. */
  public List<Series> series() {
    final List<Series> series = Lists.newArrayListWithCapacity(groups.size());
    for (final Group group : groups) {
      series.add(group.series);
    }
    return series;
  }

  /**
   * Formats the final reply: at most {@code count} reduced series, ordered
   * by group value, descending if reversed. The samples of each series are
   * ordered and capped the same way.
   * @param with_labels Whether or not to write every label.
   * @param selected_labels A possibly empty list of labels to write.
   * @param count The cap, {@link RangeQueryArgs#NO_COUNT} for none.
   * @param reverse Whether or not to reverse the order.
   * @return The entries in reply order.
   * @throws IllegalStateException if called a second time.
   */
  public List<FormattedSeries> format(final boolean with_labels,
                                      final List<String> selected_labels,
                                      final long count,
                                      final boolean reverse) {
    if (formatted) {
      throw new IllegalStateException("Result set was already formatted.");
    }
    formatted = true;

    final SeriesFormatter formatter = new SeriesFormatter(with_labels,
        selected_labels, Long.MIN_VALUE, Long.MAX_VALUE, null, count, reverse);
    final int limit = count == RangeQueryArgs.NO_COUNT ?
        groups.size() : (int) Math.min(groups.size(), count);
    final List<FormattedSeries> entries = Lists.newArrayListWithCapacity(limit);
    for (int i = 0; i < limit; i++) {
      final int idx = reverse ? groups.size() - 1 - i : i;
      entries.add(formatter.format(groups.get(idx).series));
    }
    return entries;
  }

  /** A group value and its reduced series. */
  static class Group {
    final String value;
    final Series series;

    Group(final String value, final Series series) {
      this.value = value;
      this.series = series;
    }
  }
}
