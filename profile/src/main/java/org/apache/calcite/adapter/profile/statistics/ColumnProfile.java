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

/**
 * Bounded statistical summary of the values of one column, or of a set of
 * columns once aggregated.
 *
 * <p>There is exactly one subclass per {@link StatisticalFamily}; the set is
 * closed. Use {@link #accept(Visitor)} to dispatch on the variant.
 */
public abstract class ColumnProfile {

  ColumnProfile() {
  }

  /** Returns the family of this profile. */
  public abstract StatisticalFamily getFamily();

  /** Returns whether at least one non-null value contributed to this profile. */
  public abstract boolean hasData();

  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * Returns a well-formed profile of the given family with every statistic
   * at zero.
   */
  public static ColumnProfile empty(StatisticalFamily family) {
    switch (family) {
    case TIMESTAMP:
      return TimestampProfile.EMPTY;
    case NUMERIC:
      return NumericProfile.EMPTY;
    case STRING:
      return StringProfile.EMPTY;
    case CATEGORICAL:
      return CategoricalProfile.EMPTY;
    default:
      throw new AssertionError(family);
    }
  }

  /**
   * Visitor over the profile variants.
   *
   * @param <R> Return type
   */
  public interface Visitor<R> {
    R visit(TimestampProfile profile);

    R visit(NumericProfile profile);

    R visit(StringProfile profile);

    R visit(CategoricalProfile profile);
  }
}
