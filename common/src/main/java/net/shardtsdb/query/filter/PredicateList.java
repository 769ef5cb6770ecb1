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
package net.shardtsdb.query.filter;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An immutable, ordered list of {@link LabelPredicate}s shared between the
 * parsed command arguments and every plan argument built from them.
 * <p>
 * The list is reference counted. It is created with a count of one, owned by
 * whoever parsed it. Every holder that keeps the list beyond the scope of the
 * call that handed it over must {@link #retain()} it and {@link #release()}
 * it exactly once when done. The predicates are dropped when the last
 * reference is released and any further access throws.
 *
 * @since 3.0
 */
public class PredicateList implements Iterable<LabelPredicate> {
  private static final Logger LOG = LoggerFactory.getLogger(PredicateList.class);

  /** The number of live references. */
  private final AtomicInteger references;

  /** The predicates, null once the last reference was released. */
  private volatile List<LabelPredicate> predicates;

  /**
   * Default ctor. The caller owns the initial reference.
   * @param predicates A non-null list of predicates. May be empty.
   */
  public PredicateList(final List<LabelPredicate> predicates) {
    if (predicates == null) {
      throw new IllegalArgumentException("Predicates cannot be null.");
    }
    this.predicates = ImmutableList.copyOf(predicates);
    references = new AtomicInteger(1);
  }

  /**
   * Adds a reference.
   * @return This list for chaining.
   * @throws IllegalStateException if the list was already freed.
   */
  public PredicateList retain() {
    while (true) {
      final int current = references.get();
      if (current < 1) {
        throw new IllegalStateException("Predicate list was already released.");
      }
      if (references.compareAndSet(current, current + 1)) {
        return this;
      }
    }
  }

  /**
   * Drops a reference, freeing the predicates if it was the last one.
   * @return True if this call freed the predicates.
   * @throws IllegalStateException if every reference was already released.
   */
  public boolean release() {
    final int remaining = references.decrementAndGet();
    if (remaining < 0) {
      references.incrementAndGet();
      throw new IllegalStateException("Predicate list was released more "
          + "times than it was retained.");
    }
    if (remaining == 0) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Freeing predicate list: " + this);
      }
      predicates = null;
      return true;
    }
    return false;
  }

  /** @return The current reference count. */
  public int refCount() {
    return references.get();
  }

  /** @return True once the last reference has been released. */
  public boolean isReleased() {
    return references.get() < 1;
  }

  /** @return The number of predicates. */
  public int size() {
    return live().size();
  }

  /** @return The immutable list of predicates. */
  public List<LabelPredicate> predicates() {
    return live();
  }

  /**
   * Counts the predicates of the given types.
   * @param types The types to count.
   * @return The number of predicates matching any of the types.
   */
  public int count(final LabelPredicate.Type... types) {
    int count = 0;
    for (final LabelPredicate predicate : live()) {
      for (final LabelPredicate.Type type : types) {
        if (predicate.type() == type) {
          count++;
          break;
        }
      }
    }
    return count;
  }

  /**
   * Evaluates every predicate against the labels.
   * @param labels A non-null label map.
   * @return True if all predicates pass.
   */
  public boolean matches(final Map<String, String> labels) {
    for (final LabelPredicate predicate : live()) {
      if (!predicate.matches(labels)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Iterator<LabelPredicate> iterator() {
    return live().iterator();
  }

  @Override
  public String toString() {
    final List<LabelPredicate> local = predicates;
    return "PredicateList{refs=" + references.get() + ", predicates="
        + (local == null ? "<released>" : Joiner.on(' ').join(local)) + "}";
  }

  private List<LabelPredicate> live() {
    final List<LabelPredicate> local = predicates;
    if (local == null) {
      throw new IllegalStateException("Predicate list was already released.");
    }
    return local;
  }
}
