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
 * Profile of a column whose values are treated as opaque categories:
 * booleans and fixed-width binary values.
 */
public final class CategoricalProfile extends ColumnProfile {
  static final CategoricalProfile EMPTY = new CategoricalProfile(ImmutableList.of(), 0, 0);

  private final ImmutableList<FrequencyEntry> topCategories;
  private final long distinctCategoryCount;
  private final long totalValueCount;

  public CategoricalProfile(List<FrequencyEntry> topCategories, long distinctCategoryCount,
      long totalValueCount) {
    this.topCategories = ImmutableList.copyOf(topCategories);
    this.distinctCategoryCount = distinctCategoryCount;
    this.totalValueCount = totalValueCount;
  }

  @Override public StatisticalFamily getFamily() {
    return StatisticalFamily.CATEGORICAL;
  }

  @Override public boolean hasData() {
    return totalValueCount > 0;
  }

  @Override public <R> R accept(Visitor<R> visitor) {
    return visitor.visit(this);
  }

  public ImmutableList<FrequencyEntry> getTopCategories() {
    return topCategories;
  }

  /**
   * Number of distinct keys observed. Exact for a single column; a lower
   * bound once aggregated.
   */
  public long getDistinctCategoryCount() {
    return distinctCategoryCount;
  }

  public long getTotalValueCount() {
    return totalValueCount;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CategoricalProfile)) {
      return false;
    }
    CategoricalProfile that = (CategoricalProfile) o;
    return distinctCategoryCount == that.distinctCategoryCount
        && totalValueCount == that.totalValueCount
        && topCategories.equals(that.topCategories);
  }

  @Override public int hashCode() {
    return Objects.hash(topCategories, distinctCategoryCount, totalValueCount);
  }

  @Override public String toString() {
    return "CategoricalProfile{top=" + topCategories + ", distinct=" + distinctCategoryCount
        + ", values=" + totalValueCount + "}";
  }
}
