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
package net.shardtsdb.query.execution;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.shardtsdb.data.Record;
import net.shardtsdb.data.RecordType;
import net.shardtsdb.data.Series;
import net.shardtsdb.data.SeriesRecord;
import net.shardtsdb.query.RangeQueryArgs;
import net.shardtsdb.query.SeriesFormatter;
import net.shardtsdb.query.SeriesFormatter.FormattedSeries;
import net.shardtsdb.query.processor.groupby.GroupedResultSet;
import net.shardtsdb.query.processor.groupby.ReducedResultSet;
import net.shardtsdb.rpc.BlockedClient;
import net.shardtsdb.rpc.ReplyContext;

/**
 * Completion for multi series range queries. Takes the series out of every
 * series record, skipping records of any other type, then either replies one
 * entry per series or groups, reduces and replies one entry per group.
 * <p>
 * Owns the range arguments, and through them a predicate reference, from
 * construction until {@link #release()}.
 *
 * @since 3.0
 */
public class RangeMergeCompletion extends AbstractCompletion {
  private static final Logger LOG = LoggerFactory.getLogger(
      RangeMergeCompletion.class);

  /** The parsed query, moved in from the dispatcher. */
  private final RangeQueryArgs args;

  /** The series taken out of the records. */
  private final List<Series> series;

  /** The reply entries, computed before anything is written. */
  private List<FormattedSeries> entries;

  /** Records that were not series records. */
  private int skipped;

  /**
   * Default ctor.
   * @param plan The non-null running plan.
   * @param client The non-null blocked client.
   * @param args The non-null arguments. Ownership moves to this completion.
   */
  public RangeMergeCompletion(final ExecutionPlan plan,
                              final BlockedClient client,
                              final RangeQueryArgs args) {
    super(plan, client);
    if (args == null) {
      throw new IllegalArgumentException("Arguments cannot be null.");
    }
    this.args = args;
    series = Lists.newArrayList();
  }

  @Override
  protected void prepare() {
    final int records = plan.recordCount();
    for (int i = 0; i < records; i++) {
      final Record record = plan.record(i);
      if (record.type() != RecordType.SERIES ||
          !(record instanceof SeriesRecord)) {
        skipped++;
        if (LOG.isDebugEnabled()) {
          LOG.debug("Skipping record of type " + record.type()
              + " at index " + i + " of plan " + plan);
        }
        continue;
      }
      series.add(((SeriesRecord) record).intoSeries());
    }

    if (args.isGrouped()) {
      final GroupedResultSet groups = new GroupedResultSet(args.groupByLabel());
      for (final Series s : series) {
        groups.addSeries(s);
      }
      // the cap and the ordering apply to the final output only
      final ReducedResultSet reduced = groups.reduce(args.startTimestamp(),
                                                     args.endTimestamp(),
                                                     args.aggregation(),
                                                     args.reducer());
      entries = reduced.format(args.withLabels(),
                               args.selectedLabels(),
                               args.count(),
                               args.reverse());
      return;
    }
    final SeriesFormatter formatter = SeriesFormatter.fromArgs(args);
    entries = Lists.newArrayListWithCapacity(series.size());
    for (final Series s : series) {
      entries.add(formatter.format(s));
    }
  }

  @Override
  protected void write(final ReplyContext context) {
    SeriesFormatter.reply(context, entries);
  }

  @Override
  protected void release() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Releasing " + series.size() + " series, skipped "
          + skipped + " records of plan " + plan);
    }
    series.clear();
    entries = null;
    args.close();
  }

  /** @return The number of records that were not series records. */
  public int skipped() {
    return skipped;
  }

  /** @return The arguments owned by this completion. */
  public RangeQueryArgs args() {
    return args;
  }
}
