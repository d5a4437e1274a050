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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Profile of a variable-length string column. Lengths are in bytes.
 */
public final class StringProfile extends ColumnProfile {
  static final StringProfile EMPTY =
      new StringProfile(ImmutableList.of(), ImmutableList.of(), 0, 0, 0, 0, 0);

  private final ImmutableList<FrequencyEntry> topFrequent;
  private final ImmutableList<FrequencyEntry> topSpecial;
  private final long minLength;
  private final long maxLength;
  private final long totalLength;
  private final long totalCount;
  private final long nullCount;

  public StringProfile(List<FrequencyEntry> topFrequent, List<FrequencyEntry> topSpecial,
      long minLength, long maxLength, long totalLength, long totalCount, long nullCount) {
    this.topFrequent = ImmutableList.copyOf(topFrequent);
    this.topSpecial = ImmutableList.copyOf(topSpecial);
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.totalLength = totalLength;
    this.totalCount = totalCount;
    this.nullCount = nullCount;
  }

  @Override public StatisticalFamily getFamily() {
    return StatisticalFamily.STRING;
  }

  @Override public boolean hasData() {
    return totalCount > 0;
  }

  @Override public <R> R accept(Visitor<R> visitor) {
    return visitor.visit(this);
  }

  /** Most frequent values, by descending count. */
  public ImmutableList<FrequencyEntry> getTopFrequent() {
    return topFrequent;
  }

  /** Most frequent values containing a {@link SpecialStrings} keyword. */
  public ImmutableList<FrequencyEntry> getTopSpecial() {
    return topSpecial;
  }

  public long getMinLength() {
    return minLength;
  }

  public long getMaxLength() {
    return maxLength;
  }

  public long getTotalLength() {
    return totalLength;
  }

  /** Number of non-null values. */
  public long getTotalCount() {
    return totalCount;
  }

  public long getNullCount() {
    return nullCount;
  }

  public double getAverageLength() {
    return totalCount == 0 ? 0d : (double) totalLength / totalCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StringProfile)) {
      return false;
    }
    StringProfile that = (StringProfile) o;
    return minLength == that.minLength && maxLength == that.maxLength
        && totalLength == that.totalLength && totalCount == that.totalCount
        && nullCount == that.nullCount
        && topFrequent.equals(that.topFrequent)
        && topSpecial.equals(that.topSpecial);
  }

  @Override public int hashCode() {
    return Objects.hash(topFrequent, topSpecial, minLength, maxLength, totalLength,
        totalCount, nullCount);
  }

  @Override public String toString() {
    return "StringProfile{top=" + topFrequent + ", special=" + topSpecial
        + ", len=[" + minLength + ", " + maxLength + "], values=" + totalCount
        + ", nulls=" + nullCount + "}";
  }
}
