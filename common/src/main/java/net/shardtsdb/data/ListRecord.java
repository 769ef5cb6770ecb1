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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.shardtsdb.rpc.ReplyWriter;

/**
 * An ordered list of nested records, written as a nested array.
 * 
 * @since 3.0
 */
public class ListRecord implements Record {
  private final List<Record> records;
  
  /**
   * Default ctor.
   * @param records A non-null list of non-null records.
   */
  public ListRecord(final List<? extends Record> records) {
    if (records == null) {
      throw new IllegalArgumentException("Records cannot be null.");
    }
    this.records = ImmutableList.copyOf(records);
  }
  
  /** @return The immutable list of nested records. */
  public List<Record> records() {
    return records;
  }
  
  @Override
  public RecordType type() {
    return RecordType.LIST;
  }

  @Override
  public void sendReply(final ReplyWriter writer) {
    writer.replyWithArray(records.size());
    for (final Record record : records) {
      record.sendReply(writer);
    }
  }
  
  @Override
  public String toString() {
    return records.toString();
  }
}
