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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Callback;

import net.shardtsdb.rpc.BlockedClient;
import net.shardtsdb.rpc.ReplyContext;

/**
 * Base for the callbacks run when a distributed plan finished. Holds the
 * blocked client and the plan handle and makes sure that, whatever happens,
 * the completion runs once and the cleanup runs in this order:
 * <ol>
 * <li>the reply is written completely</li>
 * <li>the client is unblocked</li>
 * <li>the subclass releases its private state</li>
 * <li>the plan is dropped</li>
 * <li>the thread safe context is closed</li>
 * </ol>
 * Register the instance as the callback and {@link #errorCallback()} as the
 * errback of {@link ExecutionPlan#completion()}.
 *
 * @since 3.0
 */
public abstract class AbstractCompletion implements Callback<Object, ExecutionPlan> {
  private static final Logger LOG = LoggerFactory.getLogger(
      AbstractCompletion.class);

  /** The running plan. */
  protected final ExecutionPlan plan;

  /** The client waiting for the reply. */
  protected final BlockedClient client;

  /** Flips on the first invocation. */
  private final AtomicBoolean completed;

  /**
   * Default ctor.
   * @param plan The non-null running plan.
   * @param client The non-null blocked client.
   */
  protected AbstractCompletion(final ExecutionPlan plan,
                               final BlockedClient client) {
    if (plan == null) {
      throw new IllegalArgumentException("Plan cannot be null.");
    }
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.plan = plan;
    this.client = client;
    completed = new AtomicBoolean();
  }

  @Override
  public Object call(final ExecutionPlan done) throws Exception {
    if (!completed.compareAndSet(false, true)) {
      LOG.warn("Ignoring a repeated completion for plan: " + plan);
      return null;
    }
    final ReplyContext context = client.threadSafeContext();
    try {
      try {
        prepare();
      } catch (Exception e) {
        LOG.error("Failed to merge the results of plan: " + plan, e);
        context.replyWithError("TSDB: failed to merge results: "
            + e.getMessage());
        return null;
      }
      try {
        write(context);
      } catch (Exception e) {
        // part of the reply may be out already, nothing left to tell the client
        LOG.error("Failed writing the reply of plan: " + plan, e);
      }
      return null;
    } finally {
      cleanup(context);
    }
  }

  /** @return The errback to pair with this callback. */
  public Callback<Object, Exception> errorCallback() {
    return new ErrorCB();
  }

  /** @return True once the completion ran. */
  public boolean isCompleted() {
    return completed.get();
  }

  /**
   * Reads the collected records and computes everything the reply needs.
   * Must not write to the client.
   * @throws Exception if the results could not be merged.
   */
  protected abstract void prepare() throws Exception;

  /**
   * Writes the reply computed by {@link #prepare()}.
   * @param context The thread safe reply context.
   */
  protected abstract void write(final ReplyContext context);

  /**
   * Releases the private state. Called once, after the client was
   * unblocked and before the plan is dropped.
   */
  protected abstract void release();

  private void cleanup(final ReplyContext context) {
    try {
      client.unblock();
    } catch (RuntimeException e) {
      LOG.error("Failed to unblock client for plan: " + plan, e);
    }
    try {
      release();
    } catch (RuntimeException e) {
      LOG.error("Failed to release the state of plan: " + plan, e);
    }
    try {
      plan.drop();
    } catch (RuntimeException e) {
      LOG.error("Failed to drop plan: " + plan, e);
    }
    context.close();
  }

  /** Handles an engine that failed the completion. */
  class ErrorCB implements Callback<Object, Exception> {
    @Override
    public Object call(final Exception ex) throws Exception {
      if (!completed.compareAndSet(false, true)) {
        LOG.warn("Ignoring a repeated failed completion for plan: " + plan, ex);
        return null;
      }
      LOG.error("Distributed plan failed: " + plan, ex);
      final ReplyContext context = client.threadSafeContext();
      try {
        context.replyWithError("TSDB: " + ex.getMessage());
        return null;
      } finally {
        cleanup(context);
      }
    }
  }
}
