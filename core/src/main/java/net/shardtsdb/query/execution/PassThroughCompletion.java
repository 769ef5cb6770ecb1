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

import com.google.common.collect.Lists;

import net.shardtsdb.data.Record;
import net.shardtsdb.rpc.BlockedClient;
import net.shardtsdb.rpc.ReplyContext;

/**
 * Completion for point lookups and index queries: replies an array with
 * every collected record, each written through its own reply contract. The
 * records are read from the plan before the array header goes out.
 *
 * @since 3.0
 */
public class PassThroughCompletion extends AbstractCompletion {

  /** The records in collection order. */
  private final List<Record> records;

  public PassThroughCompletion(final ExecutionPlan plan,
                               final BlockedClient client) {
    super(plan, client);
    records = Lists.newArrayList();
  }

  @Override
  protected void prepare() {
    final int count = plan.recordCount();
    for (int i = 0; i < count; i++) {
      records.add(plan.record(i));
    }
  }

  @Override
  protected void write(final ReplyContext context) {
    context.replyWithArray(records.size());
    for (final Record record : records) {
      record.sendReply(context);
    }
  }

  @Override
  protected void release() {
    records.clear();
  }
}
