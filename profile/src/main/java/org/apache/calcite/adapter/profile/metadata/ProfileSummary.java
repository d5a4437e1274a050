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
package org.apache.calcite.adapter.profile.metadata;

import org.apache.calcite.adapter.profile.statistics.ColumnProfile;
import org.apache.calcite.adapter.profile.statistics.ProfileAggregator;
import org.apache.calcite.adapter.profile.statistics.StatisticalFamily;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated profiles of a tree node, at most one per statistical family.
 */
public final class ProfileSummary {
  private static final ProfileSummary EMPTY = new ProfileSummary(ImmutableMap.of());

  private final ImmutableMap<StatisticalFamily, ColumnProfile> profiles;

  private ProfileSummary(ImmutableMap<StatisticalFamily, ColumnProfile> profiles) {
    this.profiles = profiles;
  }

  public static ProfileSummary empty() {
    return EMPTY;
  }

  /**
   * Creates a summary from per-family profiles.
   *
   * @throws IllegalArgumentException if a profile is filed under another family
   */
  public static ProfileSummary of(Map<StatisticalFamily, ? extends ColumnProfile> profiles) {
    EnumMap<StatisticalFamily, ColumnProfile> sorted = new EnumMap<>(StatisticalFamily.class);
    for (Map.Entry<StatisticalFamily, ? extends ColumnProfile> e : profiles.entrySet()) {
      if (e.getValue().getFamily() != e.getKey()) {
        throw new IllegalArgumentException("Profile of family " + e.getValue().getFamily()
            + " filed under " + e.getKey());
      }
      sorted.put(e.getKey(), e.getValue());
    }
    return sorted.isEmpty() ? EMPTY : new ProfileSummary(Maps.immutableEnumMap(sorted));
  }

  /**
   * Aggregates child profiles family by family. Null children are skipped;
   * a family appears in the summary only if some child belongs to it.
   *
   * @param aggregator Aggregator to merge with
   * @param children Child profiles of mixed families
   * @return The summary
   */
  public static ProfileSummary aggregate(ProfileAggregator aggregator,
      List<? extends @Nullable ColumnProfile> children) {
    EnumMap<StatisticalFamily, List<ColumnProfile>> byFamily =
        new EnumMap<>(StatisticalFamily.class);
    for (ColumnProfile child : children) {
      if (child != null) {
        byFamily.computeIfAbsent(child.getFamily(), f -> new ArrayList<>()).add(child);
      }
    }
    EnumMap<StatisticalFamily, ColumnProfile> merged = new EnumMap<>(StatisticalFamily.class);
    for (Map.Entry<StatisticalFamily, List<ColumnProfile>> e : byFamily.entrySet()) {
      merged.put(e.getKey(), aggregator.aggregate(e.getKey(), e.getValue()));
    }
    return of(merged);
  }

  public @Nullable ColumnProfile get(StatisticalFamily family) {
    return profiles.get(family);
  }

  /** Returns the profiles in family order. */
  public ImmutableMap<StatisticalFamily, ColumnProfile> getProfiles() {
    return profiles;
  }

  public boolean isEmpty() {
    return profiles.isEmpty();
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof ProfileSummary && profiles.equals(((ProfileSummary) o).profiles);
  }

  @Override public int hashCode() {
    return profiles.hashCode();
  }

  @Override public String toString() {
    return profiles.toString();
  }
}
