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

import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A single label matcher from a FILTER clause. Instances are immutable.
 * <p>
 * The textual forms are:
 * <ul>
 * <li>{@code label=value} - {@link Type#EQ}</li>
 * <li>{@code label!=value} - {@link Type#NEQ}</li>
 * <li>{@code label=(a,b)} - {@link Type#LIST_MATCH}</li>
 * <li>{@code label!=(a,b)} - {@link Type#LIST_NOTMATCH}</li>
 * <li>{@code label!=} - {@link Type#CONTAINS}, the label must be present</li>
 * <li>{@code label=} - {@link Type#NCONTAINS}, the label must be absent</li>
 * </ul>
 *
 * @since 3.0
 */
public class LabelPredicate {

  /** The matcher types. */
  public static enum Type {
    EQ,
    NEQ,
    CONTAINS,
    NCONTAINS,
    LIST_MATCH,
    LIST_NOTMATCH
  }

  /** The matcher type. */
  private final Type type;

  /** The label key. */
  private final String label;

  /** The values to compare against, empty for the (N)CONTAINS types. */
  private final List<String> values;

  /**
   * Default ctor.
   * @param type A non-null type.
   * @param label A non-null and non-empty label key.
   * @param values The values. Must have exactly one entry for EQ and NEQ, at
   * least one for the list types and none for the (N)CONTAINS types.
   * @throws IllegalArgumentException if the arguments are inconsistent.
   */
  public LabelPredicate(final Type type,
                        final String label,
                        final List<String> values) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Label cannot be null or empty.");
    }
    final List<String> vals = values == null ?
        ImmutableList.<String>of() : ImmutableList.copyOf(values);
    switch (type) {
    case EQ:
    case NEQ:
      if (vals.size() != 1) {
        throw new IllegalArgumentException("Type " + type
            + " requires exactly one value.");
      }
      break;
    case LIST_MATCH:
    case LIST_NOTMATCH:
      if (vals.isEmpty()) {
        throw new IllegalArgumentException("Type " + type
            + " requires at least one value.");
      }
      break;
    default:
      if (!vals.isEmpty()) {
        throw new IllegalArgumentException("Type " + type
            + " does not take values.");
      }
    }
    this.type = type;
    this.label = label;
    this.values = vals;
  }

  /** @return The matcher type. */
  public Type type() {
    return type;
  }

  /** @return The label key. */
  public String label() {
    return label;
  }

  /** @return The immutable list of values, may be empty. */
  public List<String> values() {
    return values;
  }

  /**
   * Evaluates this matcher against the labels of a series.
   * @param labels A non-null label map.
   * @return True if the series passes.
   */
  public boolean matches(final Map<String, String> labels) {
    final String value = labels.get(label);
    switch (type) {
    case EQ:
      return values.get(0).equals(value);
    case NEQ:
      return !values.get(0).equals(value);
    case CONTAINS:
      return value != null;
    case NCONTAINS:
      return value == null;
    case LIST_MATCH:
      return value != null && values.contains(value);
    case LIST_NOTMATCH:
      return value == null || !values.contains(value);
    default:
      throw new IllegalStateException("Unhandled type: " + type);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LabelPredicate other = (LabelPredicate) o;
    return type == other.type
        && label.equals(other.label)
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, label, values);
  }

  @Override
  public String toString() {
    switch (type) {
    case EQ:
      return label + "=" + values.get(0);
    case NEQ:
      return label + "!=" + values.get(0);
    case CONTAINS:
      return label + "!=";
    case NCONTAINS:
      return label + "=";
    case LIST_MATCH:
      return label + "=(" + Joiner.on(',').join(values) + ")";
    default:
      return label + "!=(" + Joiner.on(',').join(values) + ")";
    }
  }
}
