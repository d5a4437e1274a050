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
package org.apache.calcite.adapter.profile.source;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ColumnBuffer}.
 */
@Tag("unit")
public class ColumnBufferTest {

  @Test void testIntegerSentinels() {
    ColumnBuffer ints = ColumnBuffer.ofInts(1, Integer.MIN_VALUE, 3, Integer.MIN_VALUE);
    assertTrue(ints.isNullAt(1));
    assertFalse(ints.isNullAt(0));
    assertEquals(2, ints.countNulls());

    ColumnBuffer longs = ColumnBuffer.ofLongs(Long.MIN_VALUE, 0L);
    assertEquals(1, longs.countNulls());
  }

  @Test void testFloatingSentinels() {
    assertEquals(1, ColumnBuffer.ofFloats(1f, Float.NaN).countNulls());
    assertEquals(2, ColumnBuffer.ofDoubles(Double.NaN, 2d, Double.NaN).countNulls());
  }

  @Test void testStringsStoreNullAsEmpty() {
    ColumnBuffer strings = ColumnBuffer.ofStrings("a", null, "");
    assertEquals(3, strings.getValueCount());
    assertEquals(0, strings.binaries()[1].length);
    assertEquals(2, strings.countNulls());
  }

  @Test void testFixedWidthNullIsAllZero() {
    ColumnBuffer fixed = ColumnBuffer.ofFixedLength(2,
        new byte[] {0, 0}, new byte[] {0, 1}, new byte[] {1, 0});
    assertTrue(fixed.isNullAt(0));
    assertFalse(fixed.isNullAt(1));
    assertEquals(1, fixed.countNulls());
  }

  @Test void testFixedWidthRejectsWrongLength() {
    assertThrows(IllegalArgumentException.class,
        () -> ColumnBuffer.ofFixedLength(4, new byte[] {1, 2}));
    assertThrows(IllegalArgumentException.class,
        () -> ColumnBuffer.ofInt96(new byte[8]));
  }

  @Test void testBooleansHaveNoNulls() {
    assertEquals(0, ColumnBuffer.ofBooleans(true, false).countNulls());
  }

  @Test void testTimestampsShareLongAccessor() {
    ColumnBuffer ts = ColumnBuffer.ofTimestamps(5L, Long.MIN_VALUE);
    assertEquals(ValueType.TIMESTAMP, ts.getValueType());
    assertArrayEquals(new long[] {5L, Long.MIN_VALUE}, ts.longs());
    assertEquals(1, ts.countNulls());
  }

  @Test void testEmptyBufferHasEmptyArrays() {
    ColumnBuffer empty = ColumnBuffer.empty(ValueType.DOUBLE);
    assertTrue(empty.isEmpty());
    assertEquals(0, empty.doubles().length);
    assertEquals(0, empty.countNulls());
  }

  @Test void testWrongAccessorThrows() {
    ColumnBuffer ints = ColumnBuffer.ofInts(1);
    assertThrows(IllegalStateException.class, ints::longs);
    assertThrows(IllegalStateException.class, ints::binaries);
  }
}
