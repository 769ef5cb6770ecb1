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
 * How the engine runs a plan.
 * 
 * @since 3.0
 */
public enum ExecutionMode {
  /** Blocks the calling thread until every shard finished. */
  SYNC,
  
  /** Distributes to every shard and returns immediately. */
  ASYNC,
  
  /** Runs on the local shard only and returns immediately. */
  ASYNC_LOCAL
}
