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
package org.apache.calcite.adapter.profile.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flat, ordered set of string key/value pairs that a query filters.
 */
public final class QueryableRecord {
  private final ImmutableMap<String, String> values;

  private QueryableRecord(ImmutableMap<String, String> values) {
    this.values = values;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Creates a record from pairs in iteration order. */
  public static QueryableRecord of(Map<String, String> values) {
    return new QueryableRecord(ImmutableMap.copyOf(values));
  }

  /** Returns the value of a key, or null if the record has no such key. */
  public @Nullable String get(String key) {
    return values.get(key);
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  /** Returns the keys in insertion order. */
  public ImmutableList<String> keys() {
    return values.keySet().asList();
  }

  public ImmutableMap<String, String> asMap() {
    return values;
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof QueryableRecord && values.equals(((QueryableRecord) o).values);
  }

  @Override public int hashCode() {
    return values.hashCode();
  }

  @Override public String toString() {
    return values.toString();
  }

  /** Builder for QueryableRecord. A repeated key keeps its first position and last value. */
  public static class Builder {
    private final Map<String, String> values = new LinkedHashMap<>();

    public Builder put(String key, String value) {
      values.put(key, value);
      return this;
    }

    public Builder put(String key, long value) {
      return put(key, Long.toString(value));
    }

    public boolean containsKey(String key) {
      return values.containsKey(key);
    }

    public QueryableRecord build() {
      return new QueryableRecord(ImmutableMap.copyOf(values));
    }
  }
}
