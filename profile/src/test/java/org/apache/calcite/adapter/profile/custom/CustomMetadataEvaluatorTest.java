/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.profile.custom;

import org.apache.calcite.adapter.profile.metadata.MetadataCapacityException;
import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.InMemoryColumnSource;
import org.apache.calcite.adapter.profile.source.ValueType;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CustomMetadataEvaluator}, {@link HasNullPredicate} and
 * {@link PredicateRegistry}.
 */
@Tag("unit")
public class CustomMetadataEvaluatorTest {
  private static final CustomMetadataConfig NULL_CHECK = new CustomMetadataConfig(
      ImmutableList.of(
          new CustomMetadataConfig.Item("null_check", "SELECT has_null FROM columns")));

  private static InMemoryColumnSource source() {
    return InMemoryColumnSource.builder("t.parquet")
        .rowGroup()
          .column("id", ColumnBuffer.ofInts(1, Integer.MIN_VALUE))
          .column("name", ColumnBuffer.ofStrings("a", "b"))
          .column("flag", ColumnBuffer.ofBooleans(true, false))
        .rowGroup()
          .column("id", ColumnBuffer.ofInts(3))
          .column("name", ColumnBuffer.ofStrings((String) null))
          .unreadableColumn("flag", ValueType.BOOLEAN)
        .build();
  }

  @Test void testHasNullMatrix() {
    CustomMetadataEvaluator evaluator =
        new CustomMetadataEvaluator(PredicateRegistry.defaults(), 1000);
    List<CustomMetadataItem> items = evaluator.evaluate(source(), NULL_CHECK);

    assertEquals(1, items.size());
    CustomMetadataItem item = items.get(0);
    assertEquals("null_check", item.getName());
    assertEquals(HasNullPredicate.ID, item.getPredicateId());
    assertEquals("{{1,0,0},{0,1,1}}", item.getResultMatrix().format());
  }

  @Test void testRaggedRowGroupsArePadded() {
    InMemoryColumnSource source = InMemoryColumnSource.builder("t.parquet")
        .rowGroup()
          .column("a", ColumnBuffer.ofInts(Integer.MIN_VALUE))
        .rowGroup()
          .column("a", ColumnBuffer.ofInts(1))
          .column("b", ColumnBuffer.ofDoubles(Double.NaN))
        .build();
    CustomMetadataItem item = new CustomMetadataEvaluator(PredicateRegistry.defaults(), 1000)
        .evaluate(source, NULL_CHECK).get(0);
    assertEquals("{{1,0},{0,1}}", item.getResultMatrix().format());
  }

  @Test void testUnknownPredicateGivesAllFalse() {
    CustomMetadataConfig config = new CustomMetadataConfig(
        ImmutableList.of(new CustomMetadataConfig.Item("mystery", "SELECT is_sorted")));
    CustomMetadataItem item = new CustomMetadataEvaluator(PredicateRegistry.defaults(), 1000)
        .evaluate(source(), config).get(0);

    assertNull(item.getPredicateId());
    assertEquals(2, item.getResultMatrix().getRowCount());
    assertEquals(3, item.getResultMatrix().getColumnCount());
    assertFalse(item.getResultMatrix().anySet());
  }

  @Test void testCapacityExceeded() {
    CustomMetadataEvaluator evaluator =
        new CustomMetadataEvaluator(PredicateRegistry.defaults(), 5);
    assertThrows(MetadataCapacityException.class,
        () -> evaluator.evaluate(source(), NULL_CHECK));
  }

  @Test void testEmptyConfig() {
    assertTrue(new CustomMetadataEvaluator(PredicateRegistry.defaults(), 0)
        .evaluate(source(), CustomMetadataConfig.empty()).isEmpty());
  }

  @Test void testHasNullPredicate() {
    HasNullPredicate predicate = new HasNullPredicate();
    assertTrue(predicate.test(null, ValueType.INT32));
    assertTrue(predicate.test(ColumnBuffer.empty(ValueType.INT32), ValueType.INT32));
    assertTrue(predicate.test(ColumnBuffer.ofLongs(1L, Long.MIN_VALUE), ValueType.INT64));
    assertTrue(predicate.test(ColumnBuffer.ofInt96(new byte[12]), ValueType.INT96));
    assertFalse(predicate.test(ColumnBuffer.ofBooleans(false), ValueType.BOOLEAN));
    assertFalse(predicate.test(ColumnBuffer.ofStrings("x"), ValueType.BYTE_ARRAY));
  }

  @Test void testRegistryResolvesIgnoringCase() {
    PredicateRegistry registry = PredicateRegistry.defaults();
    assertSame(registry.get(HasNullPredicate.ID),
        registry.resolve("select HAS_NULL from columns"));
    assertNull(registry.resolve("select nothing"));
    assertThrows(IllegalArgumentException.class,
        () -> PredicateRegistry.builder()
            .register(new HasNullPredicate())
            .register(new HasNullPredicate()));
  }
}
