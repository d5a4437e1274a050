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
 * Profile of a time-valued column. Bounds are in epoch seconds.
 */
public final class TimestampProfile extends ColumnProfile {
  static final TimestampProfile EMPTY = new TimestampProfile(0, 0, 0, 0);

  private final long min;
  private final long max;
  private final long valueCount;
  private final long nullCount;

  public TimestampProfile(long min, long max, long valueCount, long nullCount) {
    this.min = min;
    this.max = max;
    this.valueCount = valueCount;
    this.nullCount = nullCount;
  }

  @Override public StatisticalFamily getFamily() {
    return StatisticalFamily.TIMESTAMP;
  }

  @Override public boolean hasData() {
    return valueCount > 0;
  }

  @Override public <R> R accept(Visitor<R> visitor) {
    return visitor.visit(this);
  }

  public long getMin() {
    return min;
  }

  public long getMax() {
    return max;
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
    if (!(o instanceof TimestampProfile)) {
      return false;
    }
    TimestampProfile that = (TimestampProfile) o;
    return min == that.min && max == that.max
        && valueCount == that.valueCount && nullCount == that.nullCount;
  }

  @Override public int hashCode() {
    return Objects.hash(min, max, valueCount, nullCount);
  }

  @Override public String toString() {
    return "TimestampProfile{min=" + min + ", max=" + max
        + ", values=" + valueCount + ", nulls=" + nullCount + "}";
  }
}
