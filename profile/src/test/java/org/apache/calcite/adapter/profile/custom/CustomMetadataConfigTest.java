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

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CustomMetadataConfig}.
 */
@Tag("unit")
public class CustomMetadataConfigTest {

  @TempDir
  Path tempDir;

  @Test void testLoad() throws IOException {
    Path file = tempDir.resolve("custom.json");
    Files.write(file, ("{\"custom_metadata\": ["
        + "{\"name\": \"null_check\", \"query\": \"SELECT has_null FROM columns\"},"
        + "{\"name\": \"other\", \"query\": \"SELECT something\"}]}")
        .getBytes(StandardCharsets.UTF_8));

    CustomMetadataConfig config = CustomMetadataConfig.load(file);
    assertEquals(2, config.getItems().size());
    assertEquals("null_check", config.getItems().get(0).getName());
    assertEquals("SELECT has_null FROM columns", config.getItems().get(0).getQuery());
  }

  @Test void testEmptyList() throws IOException {
    assertTrue(CustomMetadataConfig.parse("{\"custom_metadata\": []}").isEmpty());
  }

  @Test void testTooManyItems() {
    StringBuilder json = new StringBuilder("{\"custom_metadata\": [");
    for (int i = 0; i <= CustomMetadataConfig.MAX_ITEMS; i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append("{\"name\": \"n").append(i).append("\", \"query\": \"has_null\"}");
    }
    json.append("]}");
    assertThrows(IOException.class, () -> CustomMetadataConfig.parse(json.toString()));
  }

  @Test void testDuplicateNames() {
    IOException e = assertThrows(IOException.class,
        () -> CustomMetadataConfig.parse("{\"custom_metadata\": ["
            + "{\"name\": \"nulls\", \"query\": \"has_null\"},"
            + "{\"name\": \"nulls\", \"query\": \"SELECT has_null\"}]}"));
    assertTrue(e.getMessage().contains("Duplicate"), e.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> new CustomMetadataConfig(
            ImmutableList.of(new CustomMetadataConfig.Item("a", "has_null"),
                new CustomMetadataConfig.Item("a", "has_null"))));
  }

  @Test void testRecordKeyNamesRejected() {
    IOException e = assertThrows(IOException.class,
        () -> CustomMetadataConfig.parse("{\"custom_metadata\": ["
            + "{\"name\": \"level\", \"query\": \"SELECT has_null\"}]}"));
    assertTrue(e.getMessage().contains("'level'"), e.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> new CustomMetadataConfig(
            ImmutableList.of(new CustomMetadataConfig.Item("numeric_mean", "has_null"))));
    assertTrue(CustomMetadataConfig.isReservedName("row_group"));
    assertTrue(CustomMetadataConfig.isReservedName("top_special"));
    assertTrue(CustomMetadataConfig.isReservedName("categorical_distinct_count"));
  }

  @Test void testInvalidDocuments() {
    assertThrows(IOException.class, () -> CustomMetadataConfig.parse("[]"));
    assertThrows(IOException.class, () -> CustomMetadataConfig.parse("{\"items\": []}"));
    assertThrows(IOException.class,
        () -> CustomMetadataConfig.parse("{\"custom_metadata\": [{\"name\": \"x\"}]}"));
    assertThrows(IOException.class, () -> CustomMetadataConfig.parse("{not json"));
  }

  @Test void testMissingFile() {
    assertThrows(IOException.class,
        () -> CustomMetadataConfig.load(tempDir.resolve("absent.json")));
  }
}
