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
package org.apache.calcite.adapter.profile.custom;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The custom predicates available to custom metadata items, by id.
 */
public final class PredicateRegistry {
  private static final PredicateRegistry DEFAULT =
      builder().register(new HasNullPredicate()).build();

  private final ImmutableMap<String, CustomPredicate> predicates;

  private PredicateRegistry(ImmutableMap<String, CustomPredicate> predicates) {
    this.predicates = predicates;
  }

  /** Returns the registry of built-in predicates. */
  public static PredicateRegistry defaults() {
    return DEFAULT;
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable CustomPredicate get(String id) {
    return predicates.get(id);
  }

  public ImmutableMap<String, CustomPredicate> getPredicates() {
    return predicates;
  }

  /**
   * Finds the predicate a query refers to: the first registered predicate
   * whose id occurs in the query text, ignoring case.
   *
   * @param query Query text of a custom metadata item
   * @return The predicate, or null if the query names none
   */
  public @Nullable CustomPredicate resolve(String query) {
    String lower = query.toLowerCase(Locale.ROOT);
    for (CustomPredicate predicate : predicates.values()) {
      if (lower.contains(predicate.getId().toLowerCase(Locale.ROOT))) {
        return predicate;
      }
    }
    return null;
  }

  /** Builder for PredicateRegistry. */
  public static class Builder {
    private final Map<String, CustomPredicate> predicates = new LinkedHashMap<>();

    public Builder register(CustomPredicate predicate) {
      Preconditions.checkArgument(!predicates.containsKey(predicate.getId()),
          "duplicate predicate id: %s", predicate.getId());
      predicates.put(predicate.getId(), predicate);
      return this;
    }

    public PredicateRegistry build() {
      return new PredicateRegistry(ImmutableMap.copyOf(predicates));
    }
  }
}
