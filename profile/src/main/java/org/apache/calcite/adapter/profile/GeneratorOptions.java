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
package org.apache.calcite.adapter.profile;

import org.apache.calcite.adapter.profile.statistics.ProfileLimits;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Options for {@link MetadataGenerator}.
 *
 * <p>Options can be read from a YAML or JSON map:
 *
 * <pre>{@code
 * generateBase: true
 * generateCustom: true
 * customMetadataConfig: /etc/profile/custom.json
 * frequentStrings: 10
 * specialStrings: 20
 * categories: 20
 * maxMatrixCells: 10000000
 * }</pre>
 */
public class GeneratorOptions {
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private static final boolean DEFAULT_GENERATE_BASE = true;
  private static final boolean DEFAULT_GENERATE_CUSTOM = false;
  private static final long DEFAULT_MAX_MATRIX_CELLS = 10_000_000L;

  private final boolean generateBase;
  private final boolean generateCustom;
  private final @Nullable String customMetadataConfig;
  private final int frequentStrings;
  private final int specialStrings;
  private final int categories;
  private final long maxMatrixCells;

  private GeneratorOptions(Builder builder) {
    this.generateBase = builder.generateBase != null
        ? builder.generateBase : DEFAULT_GENERATE_BASE;
    this.generateCustom = builder.generateCustom != null
        ? builder.generateCustom : DEFAULT_GENERATE_CUSTOM;
    this.customMetadataConfig = builder.customMetadataConfig;
    this.frequentStrings = builder.frequentStrings > 0
        ? builder.frequentStrings : ProfileLimits.DEFAULT_FREQUENT_STRINGS;
    this.specialStrings = builder.specialStrings > 0
        ? builder.specialStrings : ProfileLimits.DEFAULT_SPECIAL_STRINGS;
    this.categories = builder.categories > 0
        ? builder.categories : ProfileLimits.DEFAULT_CATEGORIES;
    this.maxMatrixCells = builder.maxMatrixCells > 0
        ? builder.maxMatrixCells : DEFAULT_MAX_MATRIX_CELLS;
  }

  /**
   * Returns whether column profiles and their aggregates are generated.
   * When false, the tree holds only row counts and custom metadata.
   */
  public boolean isGenerateBase() {
    return generateBase;
  }

  /** Returns whether custom metadata items are evaluated. */
  public boolean isGenerateCustom() {
    return generateCustom;
  }

  /** Returns the path of the custom metadata JSON file, if any. */
  public @Nullable String getCustomMetadataConfig() {
    return customMetadataConfig;
  }

  public int getFrequentStrings() {
    return frequentStrings;
  }

  public int getSpecialStrings() {
    return specialStrings;
  }

  public int getCategories() {
    return categories;
  }

  /** Returns the largest number of cells a custom metadata result matrix may have. */
  public long getMaxMatrixCells() {
    return maxMatrixCells;
  }

  public ProfileLimits toLimits() {
    return new ProfileLimits(frequentStrings, specialStrings, categories);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static GeneratorOptions defaults() {
    return builder().build();
  }

  /**
   * Creates options from a YAML/JSON map. Unknown keys and values of the
   * wrong type are ignored.
   *
   * @param map Configuration map
   * @return Options, defaults for anything not given
   */
  public static GeneratorOptions fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }

    Builder builder = builder();

    Object generateBase = map.get("generateBase");
    if (generateBase instanceof Boolean) {
      builder.generateBase((Boolean) generateBase);
    }

    Object generateCustom = map.get("generateCustom");
    if (generateCustom instanceof Boolean) {
      builder.generateCustom((Boolean) generateCustom);
    }

    Object config = map.get("customMetadataConfig");
    if (config instanceof String) {
      builder.customMetadataConfig((String) config);
    }

    Object frequent = map.get("frequentStrings");
    if (frequent instanceof Number) {
      builder.frequentStrings(((Number) frequent).intValue());
    }

    Object special = map.get("specialStrings");
    if (special instanceof Number) {
      builder.specialStrings(((Number) special).intValue());
    }

    Object categories = map.get("categories");
    if (categories instanceof Number) {
      builder.categories(((Number) categories).intValue());
    }

    Object maxCells = map.get("maxMatrixCells");
    if (maxCells instanceof Number) {
      builder.maxMatrixCells(((Number) maxCells).longValue());
    }

    return builder.build();
  }

  /**
   * Reads options from a YAML (or JSON) file.
   *
   * @param path Options file
   * @return Options
   * @throws IOException if the file cannot be read or parsed
   */
  public static GeneratorOptions load(Path path) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      Map<String, Object> map =
          YAML_MAPPER.readValue(is, new TypeReference<Map<String, Object>>() { });
      return fromMap(map);
    }
  }

  @Override public String toString() {
    return "GeneratorOptions{base=" + generateBase + ", custom=" + generateCustom
        + ", config=" + customMetadataConfig + ", " + toLimits()
        + ", maxMatrixCells=" + maxMatrixCells + "}";
  }

  /**
   * Builder for GeneratorOptions.
   */
  public static class Builder {
    private Boolean generateBase;
    private Boolean generateCustom;
    private String customMetadataConfig;
    private int frequentStrings;
    private int specialStrings;
    private int categories;
    private long maxMatrixCells;

    public Builder generateBase(boolean generateBase) {
      this.generateBase = generateBase;
      return this;
    }

    public Builder generateCustom(boolean generateCustom) {
      this.generateCustom = generateCustom;
      return this;
    }

    public Builder customMetadataConfig(String customMetadataConfig) {
      this.customMetadataConfig = customMetadataConfig;
      return this;
    }

    public Builder frequentStrings(int frequentStrings) {
      this.frequentStrings = frequentStrings;
      return this;
    }

    public Builder specialStrings(int specialStrings) {
      this.specialStrings = specialStrings;
      return this;
    }

    public Builder categories(int categories) {
      this.categories = categories;
      return this;
    }

    public Builder maxMatrixCells(long maxMatrixCells) {
      this.maxMatrixCells = maxMatrixCells;
      return this;
    }

    public GeneratorOptions build() {
      return new GeneratorOptions(this);
    }
  }
}
