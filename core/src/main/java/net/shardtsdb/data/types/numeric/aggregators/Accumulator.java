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
 * Folds the values of one bucket into a single value. Values must be added in
 * ascending timestamp order. Instances are not thread safe and are reused
 * across buckets via {@link #reset()}.
 * 
 * @since 3.0
 */
public interface Accumulator {

  /**
   * Adds a value.
   * @param value The value, NaN values are ignored.
   */
  public void add(final double value);
  
  /** @return The number of values added since the last reset. */
  public int count();
  
  /**
   * @return The folded value.
   * @throws IllegalStateException if nothing was added.
   */
  public double value();
  
  /** Clears the state for the next bucket. */
  public void reset();
  
}
