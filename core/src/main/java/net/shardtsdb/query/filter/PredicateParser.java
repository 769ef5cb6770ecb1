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

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import net.shardtsdb.query.QueryArgumentException;
import net.shardtsdb.query.QueryValidationException;

/**
 * Parses the predicate tokens of a FILTER clause into a {@link PredicateList}.
 * See {@link LabelPredicate} for the accepted forms.
 *
 * @since 3.0
 */
public final class PredicateParser {

  /** The error returned for any malformed predicate. */
  public static final String PARSE_ERROR = "TSDB: failed parsing labels";

  /** The error returned when no positive matcher is present. */
  public static final String NO_MATCHER_ERROR =
      "TSDB: please provide at least one matcher";

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults();

  private PredicateParser() {
    // Statics only.
  }

  /**
   * Parses the tokens.
   * @param tokens A non-null list of predicate tokens.
   * @return A new predicate list with one reference owned by the caller.
   * @throws QueryArgumentException if a token could not be parsed or there
   * were no tokens.
   */
  public static PredicateList parse(final List<String> tokens) {
    if (tokens == null || tokens.isEmpty()) {
      throw new QueryArgumentException(PARSE_ERROR);
    }
    final List<LabelPredicate> predicates =
        Lists.newArrayListWithCapacity(tokens.size());
    for (final String token : tokens) {
      predicates.add(parsePredicate(token));
    }
    return new PredicateList(predicates);
  }

  /**
   * Parses a single token.
   * @param token A predicate token.
   * @return The predicate.
   * @throws QueryArgumentException if the token could not be parsed.
   */
  public static LabelPredicate parsePredicate(final String token) {
    if (token == null) {
      throw new QueryArgumentException(PARSE_ERROR);
    }
    final boolean negated;
    final int idx;
    final int neq = token.indexOf("!=");
    if (neq >= 0) {
      negated = true;
      idx = neq;
    } else {
      negated = false;
      idx = token.indexOf('=');
    }
    if (idx <= 0) {
      throw new QueryArgumentException(PARSE_ERROR);
    }
    final String label = token.substring(0, idx);
    final String value = token.substring(idx + (negated ? 2 : 1));

    try {
      if (value.isEmpty()) {
        return new LabelPredicate(negated ? LabelPredicate.Type.CONTAINS
            : LabelPredicate.Type.NCONTAINS, label, null);
      }
      if (value.startsWith("(")) {
        if (!value.endsWith(")") || value.length() < 3) {
          throw new QueryArgumentException(PARSE_ERROR);
        }
        final List<String> values = Lists.newArrayList(
            LIST_SPLITTER.split(value.substring(1, value.length() - 1)));
        if (values.contains("")) {
          throw new QueryArgumentException(PARSE_ERROR);
        }
        return new LabelPredicate(negated ? LabelPredicate.Type.LIST_NOTMATCH
            : LabelPredicate.Type.LIST_MATCH, label, values);
      }
      return new LabelPredicate(negated ? LabelPredicate.Type.NEQ
          : LabelPredicate.Type.EQ, label, Lists.newArrayList(value));
    } catch (IllegalArgumentException e) {
      throw new QueryArgumentException(PARSE_ERROR, e);
    }
  }

  /**
   * Ensures the list has at least one equality or list matcher, otherwise a
   * query would have to scan every series of every shard.
   * @param predicates A non-null predicate list.
   * @throws QueryValidationException if there is no such matcher.
   */
  public static void validateMatchers(final PredicateList predicates) {
    if (predicates.count(LabelPredicate.Type.EQ,
                         LabelPredicate.Type.LIST_MATCH) == 0) {
      throw new QueryValidationException(NO_MATCHER_ERROR);
    }
  }
}
