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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges child profiles of one family into a parent profile, using only
 * the children's bounded summaries.
 *
 * <p>The merge is approximate by construction:
 * <ul>
 *   <li>the parent mean is the unweighted mean of the child means;</li>
 *   <li>the parent carries no mode;</li>
 *   <li>top-K lists are merged by summing the counts each child reports,
 *   so a value that fell below every child's cut-off is missing from the
 *   parent even when its global count would qualify.</li>
 * </ul>
 *
 * <p>Null children (columns that could not be profiled) are skipped.
 */
public class ProfileAggregator {
  private final ProfileLimits limits;

  public ProfileAggregator(ProfileLimits limits) {
    this.limits = Preconditions.checkNotNull(limits, "limits");
  }

  /**
   * Aggregates the children of a node.
   *
   * @param family Family of the parent profile
   * @param children Child profiles, all of {@code family}; null elements are ignored
   * @return The parent profile; all-zero if no child contributes
   * @throws IllegalArgumentException if a child belongs to another family
   */
  public ColumnProfile aggregate(StatisticalFamily family,
      List<? extends @Nullable ColumnProfile> children) {
    List<ColumnProfile> present = new ArrayList<>(children.size());
    for (ColumnProfile child : children) {
      if (child == null) {
        continue;
      }
      Preconditions.checkArgument(child.getFamily() == family,
          "cannot aggregate %s profile into %s", child.getFamily(), family);
      present.add(child);
    }

    switch (family) {
    case TIMESTAMP:
      return aggregateTimestamps(present);
    case NUMERIC:
      return aggregateNumbers(present);
    case STRING:
      return aggregateStrings(present);
    case CATEGORICAL:
      return aggregateCategories(present);
    default:
      throw new AssertionError(family);
    }
  }

  private static TimestampProfile aggregateTimestamps(List<ColumnProfile> children) {
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    long values = 0;
    long nulls = 0;
    boolean hasData = false;
    for (ColumnProfile p : children) {
      TimestampProfile child = (TimestampProfile) p;
      values += child.getValueCount();
      nulls += child.getNullCount();
      if (child.hasData()) {
        hasData = true;
        min = Math.min(min, child.getMin());
        max = Math.max(max, child.getMax());
      }
    }
    return hasData
        ? new TimestampProfile(min, max, values, nulls)
        : new TimestampProfile(0, 0, values, nulls);
  }

  private static NumericProfile aggregateNumbers(List<ColumnProfile> children) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sumOfMeans = 0;
    int withData = 0;
    long values = 0;
    long nulls = 0;
    for (ColumnProfile p : children) {
      NumericProfile child = (NumericProfile) p;
      values += child.getValueCount();
      nulls += child.getNullCount();
      if (child.hasData()) {
        min = Math.min(min, child.getMin());
        max = Math.max(max, child.getMax());
        sumOfMeans += child.getMean();
        withData++;
      }
    }
    if (withData == 0) {
      return new NumericProfile(0, 0, 0, 0, 0, values, nulls);
    }
    return new NumericProfile(min, max, sumOfMeans / withData, 0, 0, values, nulls);
  }

  private StringProfile aggregateStrings(List<ColumnProfile> children) {
    TopKTracker frequent = new TopKTracker(limits.getFrequentStrings());
    TopKTracker special = new TopKTracker(limits.getSpecialStrings());
    long minLength = Long.MAX_VALUE;
    long maxLength = 0;
    long totalLength = 0;
    long totalCount = 0;
    long nulls = 0;
    boolean hasData = false;
    for (ColumnProfile p : children) {
      StringProfile child = (StringProfile) p;
      merge(frequent, child.getTopFrequent());
      merge(special, child.getTopSpecial());
      totalLength += child.getTotalLength();
      totalCount += child.getTotalCount();
      nulls += child.getNullCount();
      if (child.hasData()) {
        hasData = true;
        minLength = Math.min(minLength, child.getMinLength());
        maxLength = Math.max(maxLength, child.getMaxLength());
      }
    }
    return new StringProfile(frequent.toList(), special.toList(),
        hasData ? minLength : 0, maxLength, totalLength, totalCount, nulls);
  }

  private CategoricalProfile aggregateCategories(List<ColumnProfile> children) {
    TopKTracker categories = new TopKTracker(limits.getCategories());
    long distinct = 0;
    long values = 0;
    for (ColumnProfile p : children) {
      CategoricalProfile child = (CategoricalProfile) p;
      merge(categories, child.getTopCategories());
      distinct = Math.max(distinct, child.getDistinctCategoryCount());
      values += child.getTotalValueCount();
    }
    distinct = Math.max(distinct, categories.distinctCount());
    return new CategoricalProfile(categories.toList(), distinct, values);
  }

  private static void merge(TopKTracker tracker, List<FrequencyEntry> entries) {
    for (FrequencyEntry entry : entries) {
      tracker.add(entry.getValue(), entry.getCount());
    }
  }
}
