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
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.shardtsdb.data.Series;
import net.shardtsdb.data.types.numeric.aggregators.Accumulator;
import net.shardtsdb.query.AggregationArgs;
import net.shardtsdb.query.processor.downsample.Downsampler;

/**
 * Collects series into groups keyed on the value of one label, then folds each
 * group into a single series with a {@link Reducer}.
 * <p>
 * This is the collecting stage. {@link #reduce(long, long, AggregationArgs,
 * Reducer)} can be called once and hands over to a {@link ReducedResultSet}
 * that takes care of the capped, ordered output. Instances are not thread
 * safe.
 *
 * @since 3.0
 */
public class GroupedResultSet {
  private static final Logger LOG = LoggerFactory.getLogger(
      GroupedResultSet.class);

  /** Label added to reduced series, naming the reducer. */
  public static final String REDUCER_LABEL = "__reducer__";

  /** Label added to reduced series, listing the source series keys. */
  public static final String SOURCE_LABEL = "__source__";

  /** Orders group members so the reduction sees a stable order. */
  private static final Comparator<Series> BY_KEY = new Comparator<Series>() {
    @Override
    public int compare(final Series a, final Series b) {
      return a.key().compareTo(b.key());
    }
  };

  /** The label to group on. */
  private final String label;

  /** Group value to members. */
  private final Map<String, List<Series>> groups;

  /** Set once reduced. */
  private boolean reduced;

  /**
   * Default ctor.
   * @param label The non-null and non-empty label to group on.
   */
  public GroupedResultSet(final String label) {
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Group by label cannot be null "
          + "or empty.");
    }
    this.label = label;
    groups = Maps.newHashMap();
  }

  /** @return The label the series are grouped on. */
  public String label() {
    return label;
  }

  /**
   * Adds the series to the group of its label value.
   * @param series A non-null series.
   * @return True if added, false if the series lacks the label.
   */
  public boolean addSeries(final Series series) {
    if (reduced) {
      throw new IllegalStateException("Result set was already reduced.");
    }
    final String value = series.labels().get(label);
    if (value == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Series " + series.key() + " does not have the label "
            + label + ", skipping.");
      }
      return false;
    }
    List<Series> members = groups.get(value);
    if (members == null) {
      members = Lists.newArrayList();
      groups.put(value, members);
    }
    members.add(series);
    return true;
  }

  /** @return The number of distinct label values seen. */
  public int groups() {
    return groups.size();
  }

  /**
   * @param value A label value.
   * @return The members of the group, empty if unknown.
   */
  public List<Series> group(final String value) {
    final List<Series> members = groups.get(value);
    return members == null ?
        Collections.<Series>emptyList() : Collections.unmodifiableList(members);
  }

  /**
   * Folds every group into one series. Each member is range limited and
   * bucketed first, then the reducer is applied per timestamp across the
   * members that have a sample there. No count or ordering is applied here.
   * @param start The inclusive range start in ms.
   * @param end The inclusive range end in ms.
   * @param aggregation An optional per member bucketing.
   * @param reducer A non-null reducer.
   * @return The reduced stage, with one series per group.
   * @throws IllegalStateException if called a second time.
   */
  public ReducedResultSet reduce(final long start,
                                 final long end,
                                 final AggregationArgs aggregation,
                                 final Reducer reducer) {
    if (reducer == null) {
      throw new IllegalArgumentException("Reducer cannot be null.");
    }
    if (reduced) {
      throw new IllegalStateException("Result set was already reduced.");
    }
    reduced = true;

    final List<ReducedResultSet.Group> results =
        Lists.newArrayListWithCapacity(groups.size());
    for (final Entry<String, List<Series>> entry : groups.entrySet()) {
      results.add(new ReducedResultSet.Group(entry.getKey(),
          reduceGroup(entry.getKey(), entry.getValue(), start, end,
              aggregation, reducer)));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Reduced " + groups.size() + " groups on label " + label
          + " with " + reducer);
    }
    groups.clear();
    return new ReducedResultSet(results);
  }

  private Series reduceGroup(final String value,
                             final List<Series> members,
                             final long start,
                             final long end,
                             final AggregationArgs aggregation,
                             final Reducer reducer) {
    Collections.sort(members, BY_KEY);
    final TreeMap<Long, Accumulator> timestamps = new TreeMap<Long, Accumulator>();
    final List<String> sources = Lists.newArrayListWithCapacity(members.size());
    for (final Series member : members) {
      sources.add(member.key());
      final Series samples = Downsampler.downsample(
          member, start, end, aggregation);
      for (int i = 0; i < samples.size(); i++) {
        Accumulator accumulator = timestamps.get(samples.timestamp(i));
        if (accumulator == null) {
          accumulator = reducer.newAccumulator();
          timestamps.put(samples.timestamp(i), accumulator);
        }
        accumulator.add(samples.value(i));
      }
    }

    final Series.Builder builder = Series.newBuilder()
        .setKey(label + "=" + value)
        .addLabel(label, value)
        .addLabel(REDUCER_LABEL, reducer.label())
        .addLabel(SOURCE_LABEL, Joiner.on(',').join(sources));
    for (final Entry<Long, Accumulator> entry : timestamps.entrySet()) {
      if (entry.getValue().count() > 0) {
        builder.addSample(entry.getKey(), entry.getValue().value());
      }
    }
    return builder.build();
  }
}
