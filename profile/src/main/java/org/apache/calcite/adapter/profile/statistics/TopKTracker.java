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
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts values and reports the most frequent ones, at most
 * {@code capacity} of them.
 *
 * <p>Counts are accumulated per distinct value in first-seen order. When the
 * list is produced, values are offered to a bounded list in that order: a
 * value enters a full list only by evicting the minimum-count entry, and only
 * if its own count is strictly greater. On equal counts the incumbent stays,
 * so the earliest-seen value wins. The result is sorted by descending count,
 * ties in first-seen order.
 *
 * <p>Not thread-safe.
 */
public class TopKTracker {
  private static final Comparator<FrequencyEntry> BY_COUNT_DESC =
      Comparator.comparingLong(FrequencyEntry::getCount).reversed();

  private final int capacity;
  private final Map<String, Long> counts = new LinkedHashMap<>();

  public TopKTracker(int capacity) {
    Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
  }

  public int getCapacity() {
    return capacity;
  }

  /** Records one occurrence of a value. */
  public void add(String value) {
    add(value, 1);
  }

  /** Records {@code count} occurrences of a value. */
  public void add(String value, long count) {
    Preconditions.checkNotNull(value, "value");
    counts.merge(value, count, Long::sum);
  }

  /** Returns the number of distinct values recorded. */
  public int distinctCount() {
    return counts.size();
  }

  /** Returns the top entries, sorted by descending count. */
  public ImmutableList<FrequencyEntry> toList() {
    List<FrequencyEntry> kept = new ArrayList<>(Math.min(capacity, counts.size()));
    // Parallel to kept: first-seen rank of each entry.
    List<Integer> ranks = new ArrayList<>(Math.min(capacity, counts.size()));
    int rank = 0;
    for (Map.Entry<String, Long> e : counts.entrySet()) {
      FrequencyEntry entry = new FrequencyEntry(e.getKey(), e.getValue());
      if (kept.size() < capacity) {
        kept.add(entry);
        ranks.add(rank);
      } else {
        int victim = minimumIndex(kept, ranks);
        if (entry.getCount() > kept.get(victim).getCount()) {
          kept.set(victim, entry);
          ranks.set(victim, rank);
        }
      }
      rank++;
    }

    // Restore first-seen order before the stable sort so ties keep it.
    List<Integer> order = new ArrayList<>(kept.size());
    for (int i = 0; i < kept.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingInt(ranks::get));
    List<FrequencyEntry> result = new ArrayList<>(kept.size());
    for (int i : order) {
      result.add(kept.get(i));
    }
    result.sort(BY_COUNT_DESC);
    return ImmutableList.copyOf(result);
  }

  /**
   * Returns the index of the entry to evict: the lowest count, and among
   * equal lowest counts the one seen last.
   */
  private static int minimumIndex(List<FrequencyEntry> kept, List<Integer> ranks) {
    int min = 0;
    for (int i = 1; i < kept.size(); i++) {
      long count = kept.get(i).getCount();
      long minCount = kept.get(min).getCount();
      if (count < minCount || (count == minCount && ranks.get(i) > ranks.get(min))) {
        min = i;
      }
    }
    return min;
  }
}
