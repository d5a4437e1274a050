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

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Computes the profile of one column of one row group from its decoded
 * values.
 *
 * <p>Profiling is a pure function of the buffer and the limits, so one
 * profiler may be shared by threads profiling different columns.
 *
 * <p>Nulls are recognized by the sentinel convention of
 * {@link ColumnBuffer}: they are counted in {@code null_count} where the
 * profile has one and otherwise ignored. An empty buffer yields a profile
 * whose statistics are all zero.
 */
public class ColumnProfiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnProfiler.class);

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final ProfileLimits limits;

  public ColumnProfiler(ProfileLimits limits) {
    this.limits = Preconditions.checkNotNull(limits, "limits");
  }

  public ProfileLimits getLimits() {
    return limits;
  }

  /**
   * Profiles a buffer using its own value type.
   *
   * @param buffer Decoded column values
   * @return The profile
   * @throws ProfileException if the buffer's type cannot be profiled
   */
  public ColumnProfile profile(ColumnBuffer buffer) throws ProfileException {
    return profile(buffer.getValueType(), buffer);
  }

  /**
   * Profiles a buffer against the column's declared value type.
   *
   * <p>An empty buffer is accepted whatever its own type and yields an
   * all-zero profile of the declared type's family.
   *
   * @param declaredType Value type declared for the column
   * @param buffer Decoded column values
   * @return The profile
   * @throws ProfileException if the declared type cannot be profiled, or a
   *     non-empty buffer does not hold values of the declared type
   */
  public ColumnProfile profile(ValueType declaredType, ColumnBuffer buffer)
      throws ProfileException {
    StatisticalFamily family = StatisticalFamily.of(declaredType);
    if (family == null) {
      throw new ProfileException(ProfileException.Reason.UNSUPPORTED_TYPE,
          "No statistical family for value type " + declaredType);
    }
    if (buffer.isEmpty()) {
      LOGGER.debug("Empty {} buffer, returning zero profile", declaredType);
      return ColumnProfile.empty(family);
    }
    if (buffer.getValueType() != declaredType) {
      throw new ProfileException(ProfileException.Reason.TYPE_MISMATCH,
          "Column declared as " + declaredType + " holds " + buffer.getValueType()
              + " values");
    }

    switch (family) {
    case TIMESTAMP:
      return profileTimestamps(buffer.longs());
    case NUMERIC:
      return profileNumbers(buffer);
    case STRING:
      return profileStrings(buffer.binaries());
    case CATEGORICAL:
      return profileCategories(buffer);
    default:
      throw new AssertionError(family);
    }
  }

  private static TimestampProfile profileTimestamps(long[] epochNanos) {
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    long values = 0;
    long nulls = 0;
    for (long v : epochNanos) {
      if (v == Long.MIN_VALUE) {
        nulls++;
        continue;
      }
      min = Math.min(min, v);
      max = Math.max(max, v);
      values++;
    }
    if (values == 0) {
      return new TimestampProfile(0, 0, 0, nulls);
    }
    return new TimestampProfile(Math.floorDiv(min, NANOS_PER_SECOND),
        Math.floorDiv(max, NANOS_PER_SECOND), values, nulls);
  }

  private static NumericProfile profileNumbers(ColumnBuffer buffer) {
    NumericAccumulator acc = new NumericAccumulator();
    switch (buffer.getValueType()) {
    case INT32:
      for (int v : buffer.ints()) {
        if (v == Integer.MIN_VALUE) {
          acc.addNull();
        } else {
          acc.add(v, (long) v);
        }
      }
      break;
    case INT64:
      for (long v : buffer.longs()) {
        if (v == Long.MIN_VALUE) {
          acc.addNull();
        } else {
          acc.add(v, v);
        }
      }
      break;
    case FLOAT:
      for (float v : buffer.floats()) {
        if (Float.isNaN(v)) {
          acc.addNull();
        } else {
          acc.add(v, (double) v);
        }
      }
      break;
    case DOUBLE:
      for (double v : buffer.doubles()) {
        if (Double.isNaN(v)) {
          acc.addNull();
        } else {
          acc.add(v, v);
        }
      }
      break;
    default:
      throw new AssertionError(buffer.getValueType());
    }
    return acc.toProfile();
  }

  private StringProfile profileStrings(byte[][] values) {
    TopKTracker frequent = new TopKTracker(limits.getFrequentStrings());
    TopKTracker special = new TopKTracker(limits.getSpecialStrings());
    long minLength = Long.MAX_VALUE;
    long maxLength = 0;
    long totalLength = 0;
    long count = 0;
    long nulls = 0;
    for (byte[] bytes : values) {
      if (bytes.length == 0) {
        nulls++;
        continue;
      }
      String value = new String(bytes, StandardCharsets.UTF_8);
      frequent.add(value);
      if (SpecialStrings.isSpecial(value)) {
        special.add(value);
      }
      minLength = Math.min(minLength, bytes.length);
      maxLength = Math.max(maxLength, bytes.length);
      totalLength += bytes.length;
      count++;
    }
    return new StringProfile(frequent.toList(), special.toList(),
        count == 0 ? 0 : minLength, maxLength, totalLength, count, nulls);
  }

  private CategoricalProfile profileCategories(ColumnBuffer buffer) {
    TopKTracker categories = new TopKTracker(limits.getCategories());
    if (buffer.getValueType() == ValueType.BOOLEAN) {
      for (boolean v : buffer.booleans()) {
        categories.add(CategoryKeys.of(v));
      }
    } else {
      for (byte[] v : buffer.binaries()) {
        categories.add(CategoryKeys.of(v));
      }
    }
    return new CategoricalProfile(categories.toList(), categories.distinctCount(),
        buffer.getValueCount());
  }

  /** Running numeric statistics; the mode is the first value to reach the top count. */
  private static class NumericAccumulator {
    private final Map<Object, Long> frequencies = new HashMap<>();
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private long values;
    private long nulls;
    private double modeValue;
    private long modeCount;

    void addNull() {
      nulls++;
    }

    /** Adds a value; {@code key} identifies it exactly for mode counting. */
    void add(double value, Object key) {
      min = Math.min(min, value);
      max = Math.max(max, value);
      sum += value;
      values++;
      long count = frequencies.merge(key, 1L, Long::sum);
      if (count > modeCount) {
        modeCount = count;
        modeValue = value;
      }
    }

    NumericProfile toProfile() {
      if (values == 0) {
        return new NumericProfile(0, 0, 0, 0, 0, 0, nulls);
      }
      return new NumericProfile(min, max, sum / values, modeValue, modeCount, values, nulls);
    }
  }
}
