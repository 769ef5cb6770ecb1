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
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.shardtsdb.query.QueryArgumentException;
import net.shardtsdb.query.QueryExecutionException;
import net.shardtsdb.query.RangeQueryArgs;
import net.shardtsdb.query.RangeQueryArgsParser;
import net.shardtsdb.query.ShardQueryArgs;
import net.shardtsdb.query.filter.PredicateList;
import net.shardtsdb.query.filter.PredicateParser;
import net.shardtsdb.rpc.BlockedClient;
import net.shardtsdb.rpc.ClientConnection;
import net.shardtsdb.utils.Config;

/**
 * Scatters multi series commands to every shard through an
 * {@link ExecutionEngine} and gathers the results without blocking the
 * calling thread.
 * <p>
 * For every command exactly one of two things happens: an error is replied
 * synchronously on the connection the command came in on and nothing is left
 * running, or the connection is blocked and later completed by a
 * {@link PassThroughCompletion} or {@link RangeMergeCompletion}. Every method
 * returns a deferred that is called back with null once the reply for the
 * command was written, whichever way it went.
 *
 * @since 3.0
 */
public class DistributedQueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      DistributedQueryExecutor.class);

  /** The engine plans are run on. */
  private final ExecutionEngine engine;

  /** The shard enumerating reader. */
  private final String reader;

  /** Mapper names. */
  private final String mget_mapper;
  private final String range_mapper;
  private final String index_mapper;

  /** The mode plans are run in. */
  private final ExecutionMode mode;

  /**
   * Default ctor.
   * @param engine A non-null engine.
   * @param config A non-null config to read the reader and mapper names from.
   */
  public DistributedQueryExecutor(final ExecutionEngine engine,
                                  final Config config) {
    if (engine == null) {
      throw new IllegalArgumentException("Engine cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.engine = engine;
    reader = config.getString(Config.READER_KEY);
    mget_mapper = config.getString(Config.MGET_MAPPER_KEY);
    range_mapper = config.getString(Config.RANGE_MAPPER_KEY);
    index_mapper = config.getString(Config.INDEX_MAPPER_KEY);
    try {
      mode = ExecutionMode.valueOf(config.getString(Config.EXECUTION_MODE_KEY)
          .toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid execution mode: "
          + config.getString(Config.EXECUTION_MODE_KEY), e);
    }
  }

  /**
   * Handles {@code MGET [WITHLABELS] FILTER predicate...}.
   * @param ctx The non-null connection the command came in on.
   * @param argv The command name followed by its arguments.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> mget(final ClientConnection ctx,
                               final List<String> argv) {
    final PredicateList predicates;
    final boolean with_labels;
    try {
      if (argv.size() < 3) {
        throw wrongArity(argv);
      }
      final int filter = indexOf(argv, RangeQueryArgsParser.FILTER);
      if (filter < 0 || filter == argv.size() - 1) {
        throw wrongArity(argv);
      }
      with_labels = indexOf(argv, RangeQueryArgsParser.WITHLABELS) > 0;
      predicates = PredicateParser.parse(argv.subList(filter + 1, argv.size()));
    } catch (QueryExecutionException e) {
      return replyError(ctx, e);
    }
    return dispatchPointLookup(ctx, predicates, with_labels);
  }

  /**
   * Handles {@code MRANGE} and {@code MREVRANGE}, see
   * {@link RangeQueryArgsParser}.
   * @param ctx The non-null connection the command came in on.
   * @param argv The command name followed by its arguments.
   * @param reverse Whether the command was the reversed variant.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> mrange(final ClientConnection ctx,
                                 final List<String> argv,
                                 final boolean reverse) {
    final RangeQueryArgs args;
    try {
      args = RangeQueryArgsParser.parse(argv, reverse);
    } catch (QueryExecutionException e) {
      return replyError(ctx, e);
    }
    return dispatchRangeQuery(ctx, args);
  }

  /**
   * Handles {@code QUERYINDEX predicate...}.
   * @param ctx The non-null connection the command came in on.
   * @param argv The command name followed by its arguments.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> queryIndex(final ClientConnection ctx,
                                     final List<String> argv) {
    final PredicateList predicates;
    try {
      if (argv.size() < 2) {
        throw wrongArity(argv);
      }
      predicates = PredicateParser.parse(argv.subList(1, argv.size()));
    } catch (QueryExecutionException e) {
      return replyError(ctx, e);
    }
    try {
      return dispatchIndexQuery(ctx, predicates);
    } finally {
      predicates.release();
    }
  }

  /**
   * Scatters a latest value lookup. The caller's reference on the predicates
   * moves into the plan, the caller must not release it.
   * @param ctx The non-null connection the command came in on.
   * @param predicates The non-null predicates.
   * @param with_labels Whether or not the labels are replied.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> dispatchPointLookup(final ClientConnection ctx,
                                              final PredicateList predicates,
                                              final boolean with_labels) {
    try {
      PredicateParser.validateMatchers(predicates);
    } catch (QueryExecutionException e) {
      predicates.release();
      return replyError(ctx, e);
    }
    final ShardQueryArgs shard_args =
        new ShardQueryArgs(predicates, 0, 0, with_labels);
    final ExecutionPlan plan;
    try {
      plan = startPlan(mget_mapper, shard_args);
    } catch (QueryExecutionException e) {
      return replyError(ctx, e);
    }
    final BlockedClient client = ctx.block();
    final PassThroughCompletion completion =
        new PassThroughCompletion(plan, client);
    return plan.completion().addCallbacks(completion, completion.errorCallback());
  }

  /**
   * Scatters a multi series range query. The arguments move into the
   * completion, which closes them. The plan takes its own reference on the
   * predicates so the caller's reference stays valid.
   * @param ctx The non-null connection the command came in on.
   * @param args The non-null, validated arguments.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> dispatchRangeQuery(final ClientConnection ctx,
                                             final RangeQueryArgs args) {
    final ExecutionPlan plan;
    try {
      final ShardQueryArgs shard_args = new ShardQueryArgs(
          args.predicates().retain(),
          args.startTimestamp(),
          args.endTimestamp(),
          args.withLabels() || !args.selectedLabels().isEmpty()
            || args.isGrouped());
      plan = startPlan(range_mapper, shard_args);
    } catch (QueryExecutionException e) {
      args.close();
      return replyError(ctx, e);
    }
    final BlockedClient client = ctx.block();
    final RangeMergeCompletion completion =
        new RangeMergeCompletion(plan, client, args);
    return plan.completion().addCallbacks(completion, completion.errorCallback());
  }

  /**
   * Scatters an index lookup. The plan takes its own reference on the
   * predicates, the caller keeps and releases its own.
   * @param ctx The non-null connection the command came in on.
   * @param predicates The non-null predicates.
   * @return A deferred called back once the reply was written.
   */
  public Deferred<Object> dispatchIndexQuery(final ClientConnection ctx,
                                             final PredicateList predicates) {
    final ExecutionPlan plan;
    try {
      PredicateParser.validateMatchers(predicates);
      plan = startPlan(index_mapper,
          new ShardQueryArgs(predicates.retain(), 0, 0, false));
    } catch (QueryExecutionException e) {
      return replyError(ctx, e);
    }
    final BlockedClient client = ctx.block();
    final PassThroughCompletion completion =
        new PassThroughCompletion(plan, client);
    return plan.completion().addCallbacks(completion, completion.errorCallback());
  }

  /**
   * Builds and runs the scatter-gather plan. The plan definition is released
   * on every path. The shard arguments belong to the engine once attached,
   * before that they are closed here on failure.
   * @param mapper The mapper to run on every shard.
   * @param shard_args The arguments, owned by this call.
   * @return The running plan.
   * @throws QueryExecutionException if the engine refused the plan.
   */
  private ExecutionPlan startPlan(final String mapper,
                                  final ShardQueryArgs shard_args) {
    final PlanDefinition definition;
    try {
      definition = engine.createPlan(reader);
    } catch (RuntimeException e) {
      shard_args.close();
      throw asQueryException(e, "create");
    }
    try {
      try {
        definition.flatMap(mapper, shard_args);
      } catch (RuntimeException e) {
        shard_args.close();
        throw asQueryException(e, "build");
      }
      try {
        definition.collect();
        final ExecutionPlan plan = engine.run(definition, mode);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Started plan " + plan + " with mapper " + mapper
              + " and " + shard_args);
        }
        return plan;
      } catch (RuntimeException e) {
        throw asQueryException(e, "run");
      }
    } finally {
      definition.close();
    }
  }

  private static QueryExecutionException asQueryException(
      final RuntimeException e, final String step) {
    if (e instanceof QueryExecutionException) {
      return (QueryExecutionException) e;
    }
    LOG.error("Unexpected exception from the engine at step: " + step, e);
    return new DispatchException(e.getMessage() == null ?
        "Failed to " + step + " the execution plan" : e.getMessage(), e);
  }

  private static Deferred<Object> replyError(final ClientConnection ctx,
                                             final QueryExecutionException e) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Rejecting command: " + e.getMessage());
    }
    ctx.replyWithError(e.getMessage());
    return Deferred.fromResult(null);
  }

  private static int indexOf(final List<String> argv, final String keyword) {
    for (int i = 1; i < argv.size(); i++) {
      if (argv.get(i).equalsIgnoreCase(keyword)) {
        return i;
      }
    }
    return -1;
  }

  private static QueryArgumentException wrongArity(final List<String> argv) {
    return new QueryArgumentException("ERR wrong number of arguments for '"
        + (argv.isEmpty() ? "" : argv.get(0)) + "' command");
  }
}
