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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.shardtsdb.query.filter.LabelPredicate.Type;

public class TestLabelPredicate {
  private static final Map<String, String> LABELS =
      ImmutableMap.of("host", "web01", "dc", "lga");

  @Test
  public void ctor() throws Exception {
    final LabelPredicate predicate = new LabelPredicate(Type.EQ, "host",
        Arrays.asList("web01"));
    assertEquals(Type.EQ, predicate.type());
    assertEquals("host", predicate.label());
    assertEquals(Arrays.asList("web01"), predicate.values());
    assertTrue(new LabelPredicate(Type.CONTAINS, "host", null)
        .values().isEmpty());

    try {
      new LabelPredicate(null, "host", Arrays.asList("web01"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelPredicate(Type.EQ, "", Arrays.asList("web01"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelPredicate(Type.EQ, "host", Arrays.asList("a", "b"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelPredicate(Type.NEQ, "host", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelPredicate(Type.LIST_MATCH, "host",
          Collections.<String>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new LabelPredicate(Type.NCONTAINS, "host", Arrays.asList("web01"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void matches() throws Exception {
    assertTrue(predicate(Type.EQ, "host", "web01").matches(LABELS));
    assertFalse(predicate(Type.EQ, "host", "web02").matches(LABELS));
    assertFalse(predicate(Type.EQ, "rack", "r1").matches(LABELS));

    assertFalse(predicate(Type.NEQ, "host", "web01").matches(LABELS));
    assertTrue(predicate(Type.NEQ, "host", "web02").matches(LABELS));
    assertTrue(predicate(Type.NEQ, "rack", "r1").matches(LABELS));

    assertTrue(predicate(Type.CONTAINS, "dc").matches(LABELS));
    assertFalse(predicate(Type.CONTAINS, "rack").matches(LABELS));
    assertFalse(predicate(Type.NCONTAINS, "dc").matches(LABELS));
    assertTrue(predicate(Type.NCONTAINS, "rack").matches(LABELS));

    assertTrue(predicate(Type.LIST_MATCH, "dc", "phx", "lga").matches(LABELS));
    assertFalse(predicate(Type.LIST_MATCH, "dc", "phx").matches(LABELS));
    assertFalse(predicate(Type.LIST_MATCH, "rack", "r1").matches(LABELS));
    assertFalse(predicate(Type.LIST_NOTMATCH, "dc", "phx", "lga")
        .matches(LABELS));
    assertTrue(predicate(Type.LIST_NOTMATCH, "dc", "phx").matches(LABELS));
    assertTrue(predicate(Type.LIST_NOTMATCH, "rack", "r1").matches(LABELS));
  }

  @Test
  public void equalsAndString() throws Exception {
    assertEquals(predicate(Type.EQ, "host", "web01"),
        predicate(Type.EQ, "host", "web01"));
    assertEquals(predicate(Type.EQ, "host", "web01").hashCode(),
        predicate(Type.EQ, "host", "web01").hashCode());
    assertNotEquals(predicate(Type.EQ, "host", "web01"),
        predicate(Type.NEQ, "host", "web01"));
    assertNotEquals(predicate(Type.LIST_MATCH, "dc", "a", "b"),
        predicate(Type.LIST_MATCH, "dc", "b", "a"));

    assertEquals("host=web01", predicate(Type.EQ, "host", "web01").toString());
    assertEquals("host!=web01", predicate(Type.NEQ, "host", "web01").toString());
    assertEquals("host!=", predicate(Type.CONTAINS, "host").toString());
    assertEquals("host=", predicate(Type.NCONTAINS, "host").toString());
    assertEquals("dc=(a,b)",
        predicate(Type.LIST_MATCH, "dc", "a", "b").toString());
    assertEquals("dc!=(a,b)",
        predicate(Type.LIST_NOTMATCH, "dc", "a", "b").toString());
  }

  private static LabelPredicate predicate(final Type type,
                                          final String label,
                                          final String... values) {
    return new LabelPredicate(type, label, Arrays.asList(values));
  }
}
