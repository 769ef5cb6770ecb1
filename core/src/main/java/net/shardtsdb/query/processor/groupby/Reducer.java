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
package net.shardtsdb.query.processor.groupby;

import java.util.Locale;

import net.shardtsdb.data.types.numeric.aggregators.Accumulator;
import net.shardtsdb.data.types.numeric.aggregators.Aggregator;
import net.shardtsdb.data.types.numeric.aggregators.Aggregators;

/**
 * Functions that fold the values of every series in a group sharing a
 * timestamp into one value. All of them are independent of the order the
 * series are folded in.
 * 
 * @since 3.0
 */
public enum Reducer {
  SUM(Aggregators.SUM),
  MIN(Aggregators.MIN),
  MAX(Aggregators.MAX),
  AVG(Aggregators.AVG);
  
  /** The function applied per timestamp. */
  private final Aggregator aggregator;
  
  private Reducer(final Aggregator aggregator) {
    this.aggregator = aggregator;
  }
  
  /** @return A new accumulator for one timestamp. */
  public Accumulator newAccumulator() {
    return aggregator.newAccumulator();
  }
  
  /** @return The lower case name, as shown in the reduced series labels. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
  
  /**
   * Parses a reducer name.
   * @param name The name, case insensitive.
   * @return The reducer.
   * @throws IllegalArgumentException if the name is null or unknown.
   */
  public static Reducer fromString(final String name) {
    if (name == null) {
      throw new IllegalArgumentException("Reducer cannot be null.");
    }
    return Reducer.valueOf(name.toUpperCase(Locale.ROOT));
  }
}
