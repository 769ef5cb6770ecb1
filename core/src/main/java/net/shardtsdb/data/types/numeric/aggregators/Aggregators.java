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

import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * The bucket aggregation functions available to range queries.
 *
 * @since 3.0
 */
public final class Aggregators {

  /** Sums the values. */
  public static final Aggregator SUM = new Named("sum") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return sum;
        }
      };
    }
  };

  /** Arithmetic mean of the values. */
  public static final Aggregator AVG = new Named("avg") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return sum / count;
        }
      };
    }
  };

  /** Smallest value. */
  public static final Aggregator MIN = new Named("min") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return min;
        }
      };
    }
  };

  /** Largest value. */
  public static final Aggregator MAX = new Named("max") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return max;
        }
      };
    }
  };

  /** Difference between the largest and the smallest value. */
  public static final Aggregator RANGE = new Named("range") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return max - min;
        }
      };
    }
  };

  /** Number of values. */
  public static final Aggregator COUNT = new Named("count") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return count;
        }
      };
    }
  };

  /** Value with the lowest timestamp. */
  public static final Aggregator FIRST = new Named("first") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return first;
        }
      };
    }
  };

  /** Value with the highest timestamp. */
  public static final Aggregator LAST = new Named("last") {
    @Override
    public Accumulator newAccumulator() {
      return new BaseAccumulator() {
        @Override
        protected double compute() {
          return last;
        }
      };
    }
  };

  /** Lookup by name. */
  private static final Map<String, Aggregator> AGGREGATORS;
  static {
    final ImmutableMap.Builder<String, Aggregator> builder =
        ImmutableMap.builder();
    for (final Aggregator agg : new Aggregator[] {
        SUM, AVG, MIN, MAX, RANGE, COUNT, FIRST, LAST }) {
      builder.put(agg.name(), agg);
    }
    AGGREGATORS = builder.build();
  }

  private Aggregators() {
    // Statics only.
  }

  /**
   * Returns the aggregator with the given name.
   * @param name The name of the aggregator, case insensitive.
   * @return The aggregator.
   * @throws NoSuchElementException if no such aggregator exists.
   */
  public static Aggregator get(final String name) {
    final Aggregator agg = name == null ? null :
        AGGREGATORS.get(name.toLowerCase(Locale.ROOT));
    if (agg == null) {
      throw new NoSuchElementException("No such aggregator: " + name);
    }
    return agg;
  }

  /** @return The names of every aggregator. */
  public static Set<String> names() {
    return AGGREGATORS.keySet();
  }

  /** Carries the name. */
  abstract static class Named implements Aggregator {
    private final String name;

    Named(final String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Tracks everything the functions above need in one pass so that each
   * implementation only has to pick its result.
   */
  abstract static class BaseAccumulator implements Accumulator {
    protected int count;
    protected double sum;
    protected double min;
    protected double max;
    protected double first;
    protected double last;

    @Override
    public void add(final double value) {
      if (Double.isNaN(value)) {
        return;
      }
      if (count == 0) {
        min = value;
        max = value;
        first = value;
      } else {
        if (value < min) {
          min = value;
        }
        if (value > max) {
          max = value;
        }
      }
      last = value;
      sum += value;
      count++;
    }

    @Override
    public int count() {
      return count;
    }

    @Override
    public double value() {
      if (count == 0) {
        throw new IllegalStateException("No values were accumulated.");
      }
      return compute();
    }

    @Override
    public void reset() {
      count = 0;
      sum = 0;
      min = 0;
      max = 0;
      first = 0;
      last = 0;
    }

    /** @return The result over a non-empty bucket. */
    protected abstract double compute();
  }
}
