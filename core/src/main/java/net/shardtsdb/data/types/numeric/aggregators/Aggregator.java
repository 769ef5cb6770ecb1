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
package net.shardtsdb.data.types.numeric.aggregators;

/**
 * A named aggregation function. Implementations are stateless factories for
 * {@link Accumulator}s.
 * 
 * @since 3.0
 */
public interface Aggregator {

  /** @return The lower case name used on the command line. */
  public String name();
  
  /** @return A new, empty accumulator. */
  public Accumulator newAccumulator();
  
}
