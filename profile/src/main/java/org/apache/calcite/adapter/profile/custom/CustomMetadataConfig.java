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

import org.apache.calcite.adapter.profile.statistics.StatisticalFamily;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Custom metadata items to evaluate, read from a JSON file of the form
 *
 * <pre>{@code
 * {
 *   "custom_metadata": [
 *     {"name": "null_check", "query": "SELECT has_null FROM columns"}
 *   ]
 * }
 * }</pre>
 */
public final class CustomMetadataConfig {
  /** Most items one file may carry. */
  public static final int MAX_ITEMS = 20;

  /** Keys every queryable metadata record may carry on its own. */
  private static final ImmutableSet<String> RECORD_KEYS = ImmutableSet.of(
      "level", "file_path", "file_name", "file_size", "created_at", "row_group_count",
      "column_count", "total_row_count", "row_group", "row_count", "column",
      "column_index", "type", "family");

  /** Statistic names, bare on column records and family-prefixed elsewhere. */
  private static final ImmutableSet<String> STATISTIC_KEYS = ImmutableSet.of(
      "min", "max", "mean", "mode_value", "mode_count", "value_count", "null_count",
      "min_len", "max_len", "avg_len", "top_value", "top_count", "top_special",
      "top_special_count", "distinct_count");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<Item> items;

  public CustomMetadataConfig(List<Item> items) {
    if (items.size() > MAX_ITEMS) {
      throw new IllegalArgumentException("At most " + MAX_ITEMS
          + " custom metadata items are supported, got " + items.size());
    }
    Set<String> names = new HashSet<>();
    for (Item item : items) {
      if (isReservedName(item.getName())) {
        throw new IllegalArgumentException("Custom metadata item name '" + item.getName()
            + "' is a metadata record key");
      }
      if (!names.add(item.getName())) {
        throw new IllegalArgumentException("Duplicate custom metadata item name '"
            + item.getName() + "'");
      }
    }
    this.items = ImmutableList.copyOf(items);
  }

  public static CustomMetadataConfig empty() {
    return new CustomMetadataConfig(ImmutableList.of());
  }

  /**
   * Reads a configuration file.
   *
   * @param path JSON file
   * @return The configuration
   * @throws IOException if the file cannot be read or is not a valid configuration
   */
  public static CustomMetadataConfig load(Path path) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      return fromJson(MAPPER.readTree(is), path.toString());
    }
  }

  /**
   * Parses a configuration from JSON text.
   *
   * @param json JSON text
   * @return The configuration
   * @throws IOException if the text is not a valid configuration
   */
  public static CustomMetadataConfig parse(String json) throws IOException {
    return fromJson(MAPPER.readTree(json), "<inline>");
  }

  private static CustomMetadataConfig fromJson(JsonNode root, String origin)
      throws IOException {
    if (root == null || !root.isObject()) {
      throw new IOException("Custom metadata config " + origin + " is not a JSON object");
    }
    JsonNode array = root.get("custom_metadata");
    if (array == null || !array.isArray()) {
      throw new IOException("Custom metadata config " + origin
          + " has no 'custom_metadata' array");
    }
    if (array.size() > MAX_ITEMS) {
      throw new IOException("Custom metadata config " + origin + " lists " + array.size()
          + " items; at most " + MAX_ITEMS + " are supported");
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    for (JsonNode node : array) {
      JsonNode name = node.get("name");
      JsonNode query = node.get("query");
      if (name == null || !name.isTextual() || query == null || !query.isTextual()) {
        throw new IOException("Custom metadata item in " + origin
            + " needs textual 'name' and 'query': " + node);
      }
      items.add(new Item(name.asText(), query.asText()));
    }
    try {
      return new CustomMetadataConfig(items.build());
    } catch (IllegalArgumentException e) {
      throw new IOException("Custom metadata config " + origin + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns whether a name is taken by the metadata records that queries
   * run against, such as {@code level}, {@code min} or {@code numeric_mean}.
   */
  public static boolean isReservedName(String name) {
    if (RECORD_KEYS.contains(name) || STATISTIC_KEYS.contains(name)) {
      return true;
    }
    for (StatisticalFamily family : StatisticalFamily.values()) {
      String prefix = family.key() + "_";
      if (name.startsWith(prefix) && STATISTIC_KEYS.contains(name.substring(prefix.length()))) {
        return true;
      }
    }
    return false;
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  /** One configured item. */
  public static final class Item {
    private final String name;
    private final String query;

    public Item(String name, String query) {
      this.name = name;
      this.query = query;
    }

    public String getName() {
      return name;
    }

    public String getQuery() {
      return query;
    }

    @Override public String toString() {
      return name + ": " + query;
    }
  }
}
