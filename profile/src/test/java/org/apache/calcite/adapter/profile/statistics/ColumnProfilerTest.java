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
package org.apache.calcite.adapter.profile.statistics;

import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.ValueType;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ColumnProfiler}.
 */
@Tag("unit")
public class ColumnProfilerTest {
  private final ColumnProfiler profiler = new ColumnProfiler(ProfileLimits.defaults());

  @Test void testIntegersWithNullSentinel() throws ProfileException {
    NumericProfile profile = (NumericProfile) profiler.profile(
        ColumnBuffer.ofInts(1, Integer.MIN_VALUE, 3, 3));

    assertEquals(1d, profile.getMin(), 0d);
    assertEquals(3d, profile.getMax(), 0d);
    assertEquals(7d / 3, profile.getMean(), 1e-9);
    assertEquals(3d, profile.getModeValue(), 0d);
    assertEquals(2, profile.getModeCount());
    assertEquals(3, profile.getValueCount());
    assertEquals(1, profile.getNullCount());
  }

  @Test void testModeIsFirstValueToReachTopCount() throws ProfileException {
    NumericProfile profile = (NumericProfile) profiler.profile(
        ColumnBuffer.ofLongs(2L, 1L, 2L, 1L));
    assertEquals(2d, profile.getModeValue(), 0d);
    assertEquals(2, profile.getModeCount());
  }

  @Test void testDoublesSkipNaN() throws ProfileException {
    NumericProfile profile = (NumericProfile) profiler.profile(
        ColumnBuffer.ofDoubles(0.5d, Double.NaN, -1.5d));
    assertEquals(-1.5d, profile.getMin(), 0d);
    assertEquals(0.5d, profile.getMax(), 0d);
    assertEquals(-0.5d, profile.getMean(), 1e-9);
    assertEquals(2, profile.getValueCount());
    assertEquals(1, profile.getNullCount());
  }

  @Test void testAllNullNumbers() throws ProfileException {
    NumericProfile profile = (NumericProfile) profiler.profile(
        ColumnBuffer.ofFloats(Float.NaN, Float.NaN));
    assertFalse(profile.hasData());
    assertEquals(0d, profile.getMin(), 0d);
    assertEquals(2, profile.getNullCount());
  }

  @Test void testStrings() throws ProfileException {
    StringProfile profile = (StringProfile) profiler.profile(
        ColumnBuffer.ofStrings("INFO", "ERROR: disk", "INFO", null, ""));

    assertEquals(3, profile.getTotalCount());
    assertEquals(2, profile.getNullCount());
    assertEquals(4, profile.getMinLength());
    assertEquals(11, profile.getMaxLength());
    assertEquals(19, profile.getTotalLength());
    assertEquals(19d / 3, profile.getAverageLength(), 1e-9);
    assertEquals(
        ImmutableList.of(new FrequencyEntry("INFO", 2), new FrequencyEntry("ERROR: disk", 1)),
        profile.getTopFrequent());
    assertEquals(ImmutableList.of(new FrequencyEntry("ERROR: disk", 1)),
        profile.getTopSpecial());
  }

  @Test void testSpecialStringsIgnoreCase() {
    assertTrue(SpecialStrings.isSpecial("Connection FAILED"));
    assertTrue(SpecialStrings.isSpecial("a Critical issue"));
    assertFalse(SpecialStrings.isSpecial("all good"));
  }

  @Test void testFrequentListRespectsLimit() throws ProfileException {
    ColumnProfiler small = new ColumnProfiler(new ProfileLimits(1, 1, 1));
    StringProfile profile = (StringProfile) small.profile(
        ColumnBuffer.ofStrings("b", "a", "a", "c"));
    assertEquals(ImmutableList.of(new FrequencyEntry("a", 2)), profile.getTopFrequent());
  }

  @Test void testBooleansAreCategorical() throws ProfileException {
    ColumnProfile profile = profiler.profile(ColumnBuffer.ofBooleans(true, false, true));
    assertEquals(StatisticalFamily.CATEGORICAL, profile.getFamily());

    CategoricalProfile categories = (CategoricalProfile) profile;
    assertEquals(
        ImmutableList.of(new FrequencyEntry("true", 2), new FrequencyEntry("false", 1)),
        categories.getTopCategories());
    assertEquals(2, categories.getDistinctCategoryCount());
    assertEquals(3, categories.getTotalValueCount());
  }

  @Test void testFixedWidthKeysAreHex() throws ProfileException {
    CategoricalProfile profile = (CategoricalProfile) profiler.profile(
        ColumnBuffer.ofFixedLength(2, new byte[] {0x0a, 0x0b}, new byte[] {0x0a, 0x0b}));
    assertEquals(ImmutableList.of(new FrequencyEntry("0a0b", 2)), profile.getTopCategories());
  }

  @Test void testTimestampsInSeconds() throws ProfileException {
    TimestampProfile profile = (TimestampProfile) profiler.profile(
        ColumnBuffer.ofTimestamps(-1L, 1_500_000_000L, Long.MIN_VALUE));
    assertEquals(-1, profile.getMin());
    assertEquals(1, profile.getMax());
    assertEquals(2, profile.getValueCount());
    assertEquals(1, profile.getNullCount());
  }

  @Test void testEmptyBufferGivesZeroProfile() throws ProfileException {
    assertSame(NumericProfile.EMPTY,
        profiler.profile(ValueType.INT64, ColumnBuffer.empty(ValueType.UNKNOWN)));
    assertSame(StringProfile.EMPTY,
        profiler.profile(ColumnBuffer.empty(ValueType.BYTE_ARRAY)));
  }

  @Test void testUnsupportedType() {
    ProfileException e = assertThrows(ProfileException.class,
        () -> profiler.profile(ColumnBuffer.ofUnknown(new byte[] {1})));
    assertEquals(ProfileException.Reason.UNSUPPORTED_TYPE, e.getReason());
  }

  @Test void testDeclaredTypeMismatch() {
    ProfileException e = assertThrows(ProfileException.class,
        () -> profiler.profile(ValueType.INT64, ColumnBuffer.ofInts(1)));
    assertEquals(ProfileException.Reason.TYPE_MISMATCH, e.getReason());
  }
}
