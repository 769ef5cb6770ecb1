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

import com.stumbleupon.async.Deferred;

import net.shardtsdb.data.Record;

/**
 * A running execution of a {@link PlanDefinition}.
 * 
 * @since 3.0
 */
public interface ExecutionPlan {

  /**
   * The deferred is called back exactly once, on an engine thread, when every
   * shard delivered its records. It is never called back before the handle
   * was returned from {@link ExecutionEngine#run(PlanDefinition, ExecutionMode)}.
   * @return The completion deferred, resolving to this plan.
   */
  public Deferred<ExecutionPlan> completion();
  
  /** @return The number of collected records. Valid after completion. */
  public int recordCount();
  
  /**
   * @param index An index from 0 to {@link #recordCount()} exclusive.
   * @return The collected record. Records come in no particular order.
   */
  public Record record(final int index);
  
  /** Drops the execution and the collected records. */
  public void drop();
  
}
