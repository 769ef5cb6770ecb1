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
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.shardtsdb.data.types.numeric.aggregators.Aggregators;
import net.shardtsdb.query.filter.PredicateList;
import net.shardtsdb.query.filter.PredicateParser;
import net.shardtsdb.query.processor.groupby.Reducer;

/**
 * Parses a multi series range command:
 * <pre>
 * MRANGE|MREVRANGE start end [COUNT n] [AGGREGATION fn bucket]
 *   [WITHLABELS | SELECTED_LABELS label...] FILTER predicate...
 *   [GROUPBY label REDUCE reducer]
 * </pre>
 * {@code start} may be {@code -} for the earliest and {@code end} may be
 * {@code +} for the latest timestamp. The first element of the argument
 * list is the command name.
 *
 * @since 3.0
 */
public final class RangeQueryArgsParser {

  public static final String FILTER = "FILTER";
  public static final String COUNT = "COUNT";
  public static final String AGGREGATION = "AGGREGATION";
  public static final String WITHLABELS = "WITHLABELS";
  public static final String SELECTED_LABELS = "SELECTED_LABELS";
  public static final String GROUPBY = "GROUPBY";
  public static final String REDUCE = "REDUCE";

  private static final Set<String> KEYWORDS = ImmutableSet.of(
      FILTER, COUNT, AGGREGATION, WITHLABELS, SELECTED_LABELS, GROUPBY, REDUCE);

  private RangeQueryArgsParser() {
    // Statics only.
  }

  /**
   * Parses the arguments.
   * @param argv The command name followed by its arguments.
   * @param reverse Whether the command was the reversed variant.
   * @return The parsed arguments, owning the only reference on their
   * predicate list.
   * @throws QueryArgumentException if the command is malformed.
   * @throws QueryValidationException if the filter has no positive matcher.
   */
  public static RangeQueryArgs parse(final List<String> argv,
                                     final boolean reverse) {
    if (argv == null || argv.size() < 5) {
      throw wrongArity(argv);
    }
    final int filter = indexOf(argv, FILTER, 3);
    if (filter < 0) {
      throw wrongArity(argv);
    }
    final int group_by = indexOf(argv, GROUPBY, filter + 1);
    final int predicates_end = group_by < 0 ? argv.size() : group_by;

    final RangeQueryArgs.Builder builder = RangeQueryArgs.newBuilder()
        .setStartTimestamp(parseStart(argv.get(1)))
        .setEndTimestamp(parseEnd(argv.get(2)))
        .setReverse(reverse);

    boolean with_labels = false;
    List<String> selected = null;
    int i = 3;
    while (i < filter) {
      final String token = argv.get(i).toUpperCase(Locale.ROOT);
      if (token.equals(COUNT)) {
        if (i + 1 >= filter) {
          throw new QueryArgumentException("TSDB: Couldn't parse COUNT");
        }
        builder.setCount(parseCount(argv.get(i + 1)));
        i += 2;
      } else if (token.equals(AGGREGATION)) {
        if (i + 2 >= filter) {
          throw new QueryArgumentException("TSDB: Couldn't parse AGGREGATION");
        }
        builder.setAggregation(parseAggregation(argv.get(i + 1),
            argv.get(i + 2)));
        i += 3;
      } else if (token.equals(WITHLABELS)) {
        with_labels = true;
        i++;
      } else if (token.equals(SELECTED_LABELS)) {
        selected = Lists.newArrayList();
        i++;
        while (i < filter &&
            !KEYWORDS.contains(argv.get(i).toUpperCase(Locale.ROOT))) {
          selected.add(argv.get(i++));
        }
        if (selected.isEmpty()) {
          throw new QueryArgumentException(
              "TSDB: SELECTED_LABELS requires at least one label");
        }
      } else {
        throw new QueryArgumentException("TSDB: Unknown argument: "
            + argv.get(i));
      }
    }
    if (with_labels && selected != null) {
      throw new QueryArgumentException(
          "TSDB: cannot accept WITHLABELS and SELECTED_LABELS together");
    }
    builder.setWithLabels(with_labels)
           .setSelectedLabels(selected);

    if (group_by >= 0) {
      if (argv.size() != group_by + 4 ||
          !argv.get(group_by + 2).equalsIgnoreCase(REDUCE)) {
        throw new QueryArgumentException(
            "TSDB: GROUPBY requires a label and a REDUCE reducer");
      }
      final Reducer reducer;
      try {
        reducer = Reducer.fromString(argv.get(group_by + 3));
      } catch (IllegalArgumentException e) {
        throw new QueryArgumentException("TSDB: Invalid reducer: "
            + argv.get(group_by + 3), e);
      }
      builder.setGroupBy(argv.get(group_by + 1), reducer);
    }

    if (filter + 1 >= predicates_end) {
      throw wrongArity(argv);
    }
    final PredicateList predicates = PredicateParser.parse(
        argv.subList(filter + 1, predicates_end));
    try {
      PredicateParser.validateMatchers(predicates);
      return builder.setPredicates(predicates).build();
    } catch (RuntimeException e) {
      predicates.release();
      if (e instanceof QueryExecutionException) {
        throw e;
      }
      throw new QueryArgumentException("TSDB: " + e.getMessage(), e);
    }
  }

  static long parseStart(final String token) {
    if (token.equals("-")) {
      return 0;
    }
    try {
      return Long.parseLong(token);
    } catch (NumberFormatException e) {
      throw new QueryArgumentException("TSDB: wrong fromTimestamp", e);
    }
  }

  static long parseEnd(final String token) {
    if (token.equals("+")) {
      return Long.MAX_VALUE;
    }
    try {
      return Long.parseLong(token);
    } catch (NumberFormatException e) {
      throw new QueryArgumentException("TSDB: wrong toTimestamp", e);
    }
  }

  static long parseCount(final String token) {
    try {
      final long count = Long.parseLong(token);
      if (count < 0) {
        throw new QueryArgumentException("TSDB: Invalid COUNT value");
      }
      return count;
    } catch (NumberFormatException e) {
      throw new QueryArgumentException("TSDB: Couldn't parse COUNT", e);
    }
  }

  static AggregationArgs parseAggregation(final String function,
                                          final String bucket) {
    final long time_delta;
    try {
      time_delta = Long.parseLong(bucket);
    } catch (NumberFormatException e) {
      throw new QueryArgumentException("TSDB: Couldn't parse AGGREGATION", e);
    }
    if (time_delta <= 0) {
      throw new QueryArgumentException(
          "TSDB: bucketDuration must be greater than zero");
    }
    try {
      return new AggregationArgs(Aggregators.get(function), time_delta);
    } catch (NoSuchElementException e) {
      throw new QueryArgumentException("TSDB: Unknown aggregation type", e);
    }
  }

  private static int indexOf(final List<String> argv,
                             final String keyword,
                             final int from) {
    for (int i = from; i < argv.size(); i++) {
      if (argv.get(i).equalsIgnoreCase(keyword)) {
        return i;
      }
    }
    return -1;
  }

  private static QueryArgumentException wrongArity(final List<String> argv) {
    final String command = argv == null || argv.isEmpty() ?
        "MRANGE" : argv.get(0);
    return new QueryArgumentException("ERR wrong number of arguments for '"
        + command + "' command");
  }
}
