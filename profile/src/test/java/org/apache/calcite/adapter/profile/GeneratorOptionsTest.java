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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link GeneratorOptions}.
 */
@Tag("unit")
public class GeneratorOptionsTest {

  @TempDir
  Path tempDir;

  @Test void testDefaults() {
    GeneratorOptions options = GeneratorOptions.defaults();
    assertTrue(options.isGenerateBase());
    assertFalse(options.isGenerateCustom());
    assertNull(options.getCustomMetadataConfig());
    assertEquals(ProfileLimits.DEFAULT_FREQUENT_STRINGS, options.getFrequentStrings());
    assertEquals(ProfileLimits.DEFAULT_SPECIAL_STRINGS, options.getSpecialStrings());
    assertEquals(ProfileLimits.DEFAULT_CATEGORIES, options.getCategories());
    assertEquals(10_000_000L, options.getMaxMatrixCells());
    assertEquals(GeneratorOptions.fromMap(null).toString(), options.toString());
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<>();
    map.put("generateBase", false);
    map.put("generateCustom", true);
    map.put("customMetadataConfig", "/tmp/custom.json");
    map.put("frequentStrings", 5);
    map.put("categories", 0);
    map.put("maxMatrixCells", 1000L);

    GeneratorOptions options = GeneratorOptions.fromMap(map);
    assertFalse(options.isGenerateBase());
    assertTrue(options.isGenerateCustom());
    assertEquals("/tmp/custom.json", options.getCustomMetadataConfig());
    assertEquals(5, options.toLimits().getFrequentStrings());
    assertEquals(ProfileLimits.DEFAULT_CATEGORIES, options.getCategories());
    assertEquals(1000L, options.getMaxMatrixCells());
  }

  @Test void testFromMapIgnoresWrongTypes() {
    Map<String, Object> map = new HashMap<>();
    map.put("generateBase", "no");
    map.put("frequentStrings", "many");
    GeneratorOptions options = GeneratorOptions.fromMap(map);
    assertTrue(options.isGenerateBase());
    assertEquals(ProfileLimits.DEFAULT_FREQUENT_STRINGS, options.getFrequentStrings());
  }

  @Test void testLoadYaml() throws IOException {
    Path file = tempDir.resolve("options.yaml");
    Files.write(file, ("generateCustom: true\n"
        + "customMetadataConfig: custom.json\n"
        + "specialStrings: 3\n").getBytes(StandardCharsets.UTF_8));

    GeneratorOptions options = GeneratorOptions.load(file);
    assertTrue(options.isGenerateCustom());
    assertEquals("custom.json", options.getCustomMetadataConfig());
    assertEquals(3, options.getSpecialStrings());
  }

  @Test void testGeneratorReadsCustomConfig() throws IOException {
    Path config = tempDir.resolve("custom.json");
    Files.write(config,
        "{\"custom_metadata\": [{\"name\": \"n\", \"query\": \"has_null\"}]}"
            .getBytes(StandardCharsets.UTF_8));
    GeneratorOptions options = GeneratorOptions.builder()
        .generateCustom(true).customMetadataConfig(config.toString()).build();
    assertEquals(options, new MetadataGenerator(options).getOptions());

    GeneratorOptions missing = GeneratorOptions.builder()
        .generateCustom(true).customMetadataConfig(tempDir.resolve("nope.json").toString())
        .build();
    assertThrows(IOException.class, () -> new MetadataGenerator(missing));
  }
}
