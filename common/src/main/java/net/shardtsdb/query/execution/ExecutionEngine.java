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

/**
 * The distributed execution engine a query is scattered through. Shard
 * discovery, work distribution and record transport are the engine's
 * concern; the query layer only builds a plan definition and starts it.
 * 
 * @since 3.0
 */
public interface ExecutionEngine {

  /**
   * Creates a new plan definition whose first step enumerates the shards.
   * @param reader The name of the registered shard enumerating reader.
   * @return A non-null plan definition. The caller must close it.
   * @throws PlanBuildException if the reader is unknown or the engine is not
   * able to build plans.
   */
  public PlanDefinition createPlan(final String reader);
  
  /**
   * Starts an execution of the definition. The definition may be closed as
   * soon as this returns, the execution keeps what it needs.
   * @param definition A non-null definition.
   * @param mode The execution mode.
   * @return A non-null handle on the running execution.
   * @throws DispatchException if the execution could not be started.
   */
  public ExecutionPlan run(final PlanDefinition definition, 
                           final ExecutionMode mode);
  
}
