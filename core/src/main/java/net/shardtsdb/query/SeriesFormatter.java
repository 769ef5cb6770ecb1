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
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.shardtsdb.data.Series;
import net.shardtsdb.query.processor.downsample.Downsampler;
import net.shardtsdb.rpc.ReplyWriter;

/**
 * Writes a series as one reply element:
 * <pre>
 * [key, [[label, value]...], [[timestamp, value]...]]
 * </pre>
 * The samples are limited to the range, bucketed if an aggregation is set,
 * emitted oldest first (newest first if reversed) and capped by the count.
 * Labels are all written with {@code withLabels}, only the selected ones
 * (null valued if missing) with selected labels and none otherwise.
 * <p>
 * {@link #format(Series)} does all the work that can fail so that writing
 * the result cannot stop halfway through a reply.
 *
 * @since 3.0
 */
public class SeriesFormatter {

  private final boolean with_labels;
  private final List<String> selected_labels;
  private final long start;
  private final long end;
  private final AggregationArgs aggregation;
  private final long count;
  private final boolean reverse;

  /**
   * Default ctor.
   * @param with_labels Whether or not to write every label.
   * @param selected_labels A possibly empty list of labels to write.
   * @param start The inclusive range start in ms.
   * @param end The inclusive range end in ms.
   * @param aggregation An optional bucketing.
   * @param count The sample cap, {@link RangeQueryArgs#NO_COUNT} for none.
   * @param reverse Whether or not to emit newest first.
   */
  public SeriesFormatter(final boolean with_labels,
                         final List<String> selected_labels,
                         final long start,
                         final long end,
                         final AggregationArgs aggregation,
                         final long count,
                         final boolean reverse) {
    this.with_labels = with_labels;
    this.selected_labels = selected_labels == null ?
        ImmutableList.<String>of() : selected_labels;
    this.start = start;
    this.end = end;
    this.aggregation = aggregation;
    this.count = count;
    this.reverse = reverse;
  }

  /**
   * @param args Non-null range query arguments.
   * @return A formatter applying every option of the arguments.
   */
  public static SeriesFormatter fromArgs(final RangeQueryArgs args) {
    return new SeriesFormatter(args.withLabels(),
                               args.selectedLabels(),
                               args.startTimestamp(),
                               args.endTimestamp(),
                               args.aggregation(),
                               args.count(),
                               args.reverse());
  }

  /**
   * Downsamples, orders and caps the series and resolves its labels.
   * @param series A non-null series.
   * @return The entry ready to be written.
   */
  public FormattedSeries format(final Series series) {
    final Series samples = Downsampler.downsample(
        series, start, end, aggregation);
    final int limit = count == RangeQueryArgs.NO_COUNT ?
        samples.size() : (int) Math.min(samples.size(), count);
    final long[] timestamps = new long[limit];
    final double[] values = new double[limit];
    for (int i = 0; i < limit; i++) {
      final int idx = reverse ? samples.size() - 1 - i : i;
      timestamps[i] = samples.timestamp(idx);
      values[i] = samples.value(idx);
    }
    return new FormattedSeries(series.key(), labels(series), timestamps,
        values);
  }

  /**
   * Writes an array of formatted entries.
   * @param writer A non-null writer.
   * @param entries The non-null entries in reply order.
   */
  public static void reply(final ReplyWriter writer,
                           final List<FormattedSeries> entries) {
    writer.replyWithArray(entries.size());
    for (final FormattedSeries entry : entries) {
      entry.reply(writer);
    }
  }

  private List<String[]> labels(final Series series) {
    final List<String[]> labels = Lists.newArrayList();
    if (with_labels) {
      for (final Entry<String, String> label : series.labels().entrySet()) {
        labels.add(new String[] { label.getKey(), label.getValue() });
      }
    } else {
      for (final String label : selected_labels) {
        // missing labels are written as nulls
        labels.add(new String[] { label, series.labels().get(label) });
      }
    }
    return labels;
  }

  /**
   * One series with everything computed. Writing it only emits reply
   * primitives.
   */
  public static class FormattedSeries {
    private final String key;
    private final List<String[]> labels;
    private final long[] timestamps;
    private final double[] values;

    FormattedSeries(final String key,
                    final List<String[]> labels,
                    final long[] timestamps,
                    final double[] values) {
      this.key = key;
      this.labels = labels;
      this.timestamps = timestamps;
      this.values = values;
    }

    /** @return The series key. */
    public String key() {
      return key;
    }

    /** @return The number of samples to write. */
    public int size() {
      return timestamps.length;
    }

    /**
     * Writes the entry.
     * @param writer A non-null writer.
     */
    public void reply(final ReplyWriter writer) {
      writer.replyWithArray(3);
      writer.replyWithString(key);
      writer.replyWithArray(labels.size());
      for (final String[] label : labels) {
        writer.replyWithArray(2);
        writer.replyWithString(label[0]);
        if (label[1] == null) {
          writer.replyWithNull();
        } else {
          writer.replyWithString(label[1]);
        }
      }
      writer.replyWithArray(timestamps.length);
      for (int i = 0; i < timestamps.length; i++) {
        writer.replyWithArray(2);
        writer.replyWithLong(timestamps[i]);
        writer.replyWithDouble(values[i]);
      }
    }
  }
}
