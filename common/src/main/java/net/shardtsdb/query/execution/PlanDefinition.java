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

import net.shardtsdb.query.ShardQueryArgs;

/**
 * The definition of a scatter-gather plan built from a reader step, a shard
 * local mapping step and a collection step.
 * <p>
 * Arguments handed to {@link #flatMap(String, ShardQueryArgs)} belong to the
 * engine from then on. It closes them once the definition is closed and every
 * execution started from it was dropped.
 * 
 * @since 3.0
 */
public interface PlanDefinition extends AutoCloseable {

  /**
   * Adds a mapping step executed on every shard.
   * @param mapper The name of the registered mapper.
   * @param args The non-null argument passed to the mapper on every shard.
   * @return This definition.
   * @throws PlanBuildException if the mapper is unknown.
   */
  public PlanDefinition flatMap(final String mapper, final ShardQueryArgs args);
  
  /**
   * Adds the step that gathers the records of every shard to the node that
   * runs the plan.
   * @return This definition.
   */
  public PlanDefinition collect();
  
  /** Releases the definition. Executions already started keep running. */
  @Override
  public void close();
  
}
