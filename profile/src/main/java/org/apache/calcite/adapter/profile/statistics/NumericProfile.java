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

import java.util.Objects;

/**
 * Profile of an integer or floating-point column.
 *
 * <p>Aggregated profiles carry no mode: {@link #getModeValue()} and
 * {@link #getModeCount()} are zero above the column level.
 */
public final class NumericProfile extends ColumnProfile {
  static final NumericProfile EMPTY = new NumericProfile(0, 0, 0, 0, 0, 0, 0);

  private final double min;
  private final double max;
  private final double mean;
  private final double modeValue;
  private final long modeCount;
  private final long valueCount;
  private final long nullCount;

  public NumericProfile(double min, double max, double mean, double modeValue,
      long modeCount, long valueCount, long nullCount) {
    this.min = min;
    this.max = max;
    this.mean = mean;
    this.modeValue = modeValue;
    this.modeCount = modeCount;
    this.valueCount = valueCount;
    this.nullCount = nullCount;
  }

  @Override public StatisticalFamily getFamily() {
    return StatisticalFamily.NUMERIC;
  }

  @Override public boolean hasData() {
    return valueCount > 0;
  }

  @Override public <R> R accept(Visitor<R> visitor) {
    return visitor.visit(this);
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getMean() {
    return mean;
  }

  public double getModeValue() {
    return modeValue;
  }

  public long getModeCount() {
    return modeCount;
  }

  public long getValueCount() {
    return valueCount;
  }

  public long getNullCount() {
    return nullCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumericProfile)) {
      return false;
    }
    NumericProfile that = (NumericProfile) o;
    return Double.compare(min, that.min) == 0
        && Double.compare(max, that.max) == 0
        && Double.compare(mean, that.mean) == 0
        && Double.compare(modeValue, that.modeValue) == 0
        && modeCount == that.modeCount
        && valueCount == that.valueCount
        && nullCount == that.nullCount;
  }

  @Override public int hashCode() {
    return Objects.hash(min, max, mean, modeValue, modeCount, valueCount, nullCount);
  }

  @Override public String toString() {
    return "NumericProfile{min=" + min + ", max=" + max + ", mean=" + mean
        + ", mode=" + modeValue + "x" + modeCount
        + ", values=" + valueCount + ", nulls=" + nullCount + "}";
  }
}
