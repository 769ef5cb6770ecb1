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

import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.concurrent.ExecutorService;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.shardtsdb.data.DoubleRecord;
import net.shardtsdb.data.ListRecord;
import net.shardtsdb.data.LongRecord;
import net.shardtsdb.data.Record;
import net.shardtsdb.data.Series;
import net.shardtsdb.data.SeriesRecord;
import net.shardtsdb.data.StringRecord;
import net.shardtsdb.query.ShardQueryArgs;
import net.shardtsdb.utils.Config;

/**
 * An in-process engine over a handful of fake shards. Every shard is a list
 * of series and the three configured mappers are run against each of them.
 * <p>
 * Plans stay pending until {@link MockPlan#complete()} or
 * {@link MockPlan#fail(Exception)} is called unless an executor was set, in
 * which case they are completed from the executor's thread.
 * <p>
 * Like the real engine, the shard arguments attached to a definition are
 * closed once the definition was closed and every execution was dropped.
 */
public class MockExecutionEngine implements ExecutionEngine {

  /** The fake shards. */
  public final List<List<Series>> shards = Lists.newArrayList();

  /** Records appended to the output of every plan. */
  public final List<Record> extra_records = Lists.newArrayList();

  /** Every definition and plan handed out. */
  public final List<MockPlanDefinition> definitions =
      Collections.synchronizedList(Lists.<MockPlanDefinition>newArrayList());
  public final List<MockPlan> plans =
      Collections.synchronizedList(Lists.<MockPlan>newArrayList());

  /** Shared event log, usually the client's. */
  public List<String> events =
      Collections.synchronizedList(Lists.<String>newArrayList());

  /** Failure injection. */
  public RuntimeException create_exception;
  public RuntimeException flat_map_exception;
  public RuntimeException run_exception;

  /** When set, plans complete from this executor. */
  public ExecutorService executor;

  private final String reader;
  private final String mget_mapper;
  private final String range_mapper;
  private final String index_mapper;

  public ExecutionMode last_mode;

  public MockExecutionEngine(final Config config) {
    reader = config.getString(Config.READER_KEY);
    mget_mapper = config.getString(Config.MGET_MAPPER_KEY);
    range_mapper = config.getString(Config.RANGE_MAPPER_KEY);
    index_mapper = config.getString(Config.INDEX_MAPPER_KEY);
  }

  /**
   * Adds a shard with the given series.
   * @param series The series, may be empty.
   * @return The engine.
   */
  public MockExecutionEngine addShard(final Series... series) {
    shards.add(Lists.newArrayList(series));
    return this;
  }

  @Override
  public PlanDefinition createPlan(final String reader) {
    if (create_exception != null) {
      throw create_exception;
    }
    if (!this.reader.equals(reader)) {
      throw new PlanBuildException("No such reader: " + reader);
    }
    final MockPlanDefinition definition = new MockPlanDefinition();
    definitions.add(definition);
    return definition;
  }

  @Override
  public ExecutionPlan run(final PlanDefinition definition,
                           final ExecutionMode mode) {
    if (run_exception != null) {
      throw run_exception;
    }
    final MockPlanDefinition def = (MockPlanDefinition) definition;
    if (def.mapper == null || !def.collected) {
      throw new DispatchException("Plan is missing steps.");
    }
    last_mode = mode;
    final MockPlan plan = new MockPlan(def, map(def));
    plans.add(plan);
    if (executor != null) {
      executor.submit(new Runnable() {
        @Override
        public void run() {
          plan.complete();
        }
      });
    }
    return plan;
  }

  /** @return The last plan run. */
  public MockPlan lastPlan() {
    return plans.get(plans.size() - 1);
  }

  /** @return The last definition created. */
  public MockPlanDefinition lastDefinition() {
    return definitions.get(definitions.size() - 1);
  }

  private List<Record> map(final MockPlanDefinition definition) {
    final ShardQueryArgs args = definition.args;
    final List<Record> records = Lists.newArrayList();
    for (final List<Series> shard : shards) {
      for (final Series series : shard) {
        if (!args.predicates().matches(series.labels())) {
          continue;
        }
        if (definition.mapper.equals(mget_mapper)) {
          records.add(latest(series, args.withLabels()));
        } else if (definition.mapper.equals(range_mapper)) {
          records.add(new SeriesRecord(range(series, args)));
        } else if (definition.mapper.equals(index_mapper)) {
          records.add(new StringRecord(series.key()));
        }
      }
    }
    records.addAll(extra_records);
    return records;
  }

  private static Record latest(final Series series, final boolean with_labels) {
    final List<Record> labels = Lists.newArrayList();
    if (with_labels) {
      for (final Entry<String, String> label : series.labels().entrySet()) {
        labels.add(new ListRecord(Lists.newArrayList(
            new StringRecord(label.getKey()),
            new StringRecord(label.getValue()))));
      }
    }
    final Record sample;
    if (series.size() == 0) {
      sample = new ListRecord(Collections.<Record>emptyList());
    } else {
      sample = new ListRecord(Lists.<Record>newArrayList(
          new LongRecord(series.timestamp(series.size() - 1)),
          new DoubleRecord(series.value(series.size() - 1))));
    }
    return new ListRecord(Lists.<Record>newArrayList(
        new StringRecord(series.key()),
        new ListRecord(labels),
        sample));
  }

  private static Series range(final Series series, final ShardQueryArgs args) {
    final Series.Builder builder = Series.newBuilder()
        .setKey(series.key());
    if (args.withLabels()) {
      builder.setLabels(series.labels());
    }
    for (int i = 0; i < series.size(); i++) {
      if (series.timestamp(i) >= args.startTimestamp() &&
          series.timestamp(i) <= args.endTimestamp()) {
        builder.addSample(series.timestamp(i), series.value(i));
      }
    }
    return builder.build();
  }

  /** A definition that records its steps. */
  public class MockPlanDefinition implements PlanDefinition {
    public String mapper;
    public ShardQueryArgs args;
    public boolean collected;
    public boolean closed;
    public int executions;

    @Override
    public PlanDefinition flatMap(final String mapper,
                                  final ShardQueryArgs args) {
      if (flat_map_exception != null) {
        throw flat_map_exception;
      }
      if (!mapper.equals(mget_mapper) && !mapper.equals(range_mapper) &&
          !mapper.equals(index_mapper)) {
        throw new PlanBuildException("No such mapper: " + mapper);
      }
      this.mapper = mapper;
      this.args = args;
      return this;
    }

    @Override
    public PlanDefinition collect() {
      collected = true;
      return this;
    }

    @Override
    public synchronized void close() {
      if (closed) {
        throw new IllegalStateException("Definition was already closed.");
      }
      closed = true;
      maybeCloseArgs();
    }

    synchronized void started() {
      executions++;
    }

    synchronized void dropped() {
      executions--;
      maybeCloseArgs();
    }

    private void maybeCloseArgs() {
      if (closed && executions == 0 && args != null) {
        args.close();
      }
    }
  }

  /** A plan over precomputed records. */
  public class MockPlan implements ExecutionPlan {
    public final MockPlanDefinition definition;
    private final List<Record> records;
    private final Deferred<ExecutionPlan> deferred;
    public int drops;

    MockPlan(final MockPlanDefinition definition, final List<Record> records) {
      this.definition = definition;
      this.records = records;
      deferred = new Deferred<ExecutionPlan>();
      definition.started();
    }

    @Override
    public Deferred<ExecutionPlan> completion() {
      return deferred;
    }

    @Override
    public int recordCount() {
      return records.size();
    }

    @Override
    public Record record(final int index) {
      return records.get(index);
    }

    @Override
    public synchronized void drop() {
      events.add("drop");
      if (drops++ == 0) {
        definition.dropped();
      }
    }

    /** Calls the completion back with this plan. */
    public void complete() {
      deferred.callback(this);
    }

    /** Calls the completion back with an exception. */
    public void fail(final Exception e) {
      deferred.callback(e);
    }
  }
}
