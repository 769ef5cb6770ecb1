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

import java.util.Map.Entry;

import net.shardtsdb.rpc.ReplyWriter;

/**
 * A record carrying a whole series across shards. The series can be taken
 * out of the record once via {@link #intoSeries()}, after which the record is
 * empty.
 *
 * @since 3.0
 */
public class SeriesRecord implements Record {

  /** The wrapped series, null once taken. */
  private Series series;

  /**
   * Default ctor.
   * @param series A non-null series.
   */
  public SeriesRecord(final Series series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    this.series = series;
  }

  /**
   * Moves the series out of the record.
   * @return The series.
   * @throws IllegalStateException if the series was already taken.
   */
  public synchronized Series intoSeries() {
    if (series == null) {
      throw new IllegalStateException("Series was already taken from record.");
    }
    final Series taken = series;
    series = null;
    return taken;
  }

  /** @return True if the series is still held by the record. */
  public synchronized boolean hasSeries() {
    return series != null;
  }

  @Override
  public RecordType type() {
    return RecordType.SERIES;
  }

  /**
   * Writes {@code [key, [[label, value]...], [[timestamp, value]...]]}.
   */
  @Override
  public synchronized void sendReply(final ReplyWriter writer) {
    if (series == null) {
      writer.replyWithNull();
      return;
    }
    writer.replyWithArray(3);
    writer.replyWithString(series.key());
    writer.replyWithArray(series.labels().size());
    for (final Entry<String, String> label : series.labels().entrySet()) {
      writer.replyWithArray(2);
      writer.replyWithString(label.getKey());
      writer.replyWithString(label.getValue());
    }
    writer.replyWithArray(series.size());
    for (int i = 0; i < series.size(); i++) {
      writer.replyWithArray(2);
      writer.replyWithLong(series.timestamp(i));
      writer.replyWithDouble(series.value(i));
    }
  }

  @Override
  public synchronized String toString() {
    return "SeriesRecord{" + (series == null ? "<taken>" : series) + "}";
  }
}
