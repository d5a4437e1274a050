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

import org.apache.calcite.adapter.profile.metadata.FileNode;
import org.apache.calcite.adapter.profile.metadata.MetadataSerializer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProfileTool}.
 */
@Tag("integration")
public class ProfileToolTest {

  @TempDir
  Path tempDir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    ProfileTool tool = new ProfileTool(
        new PrintStream(out, true), new PrintStream(err, true));
    return tool.run(args);
  }

  private String out() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test void testGenerateQueryListShow() throws IOException {
    Path parquet = ParquetFixtures.writeEvents(tempDir.resolve("events.parquet"));
    Path config = tempDir.resolve("custom.json");
    Files.write(config,
        "{\"custom_metadata\": [{\"name\": \"nulls\", \"query\": \"SELECT has_null\"}]}"
            .getBytes(StandardCharsets.UTF_8));
    Path output = tempDir.resolve("meta");

    assertEquals(0, run("generate", parquet.toString(), "--output", output.toString(),
        "--custom-metadata", config.toString()), err());
    Path meta = output.resolve("events.meta");
    assertTrue(Files.exists(meta));
    assertTrue(out().contains("Wrote metadata for"));

    FileNode tree = MetadataSerializer.load(meta);
    assertEquals(5, tree.getTotalRowCount());
    assertEquals("{{0,1,0,1,1}}", tree.getCustomMetadata("nulls").getResultMatrix().format());

    out.reset();
    assertEquals(0, run("query", output.toString(),
        "--sql", "SELECT * FROM metadata WHERE level = 'column' AND nulls = 1"), err());
    String result = out();
    assertTrue(result.contains("Matching files (1):"), result);
    assertTrue(result.contains("  - events:0:level"), result);
    assertTrue(result.contains("  - events:0:ts"), result);
    assertTrue(result.contains("Matching columns (3):"), result);

    out.reset();
    assertEquals(0, run("query", output.toString(),
        "--sql", "SELECT * FROM metadata WHERE level = 'nothing'"));
    assertTrue(out().contains("No matches found."));

    out.reset();
    assertEquals(0, run("list", output.toString()));
    assertTrue(out().contains("events.meta (1 row groups, 5 columns)"), out());

    out.reset();
    assertEquals(0, run("show", meta.toString()));
    assertTrue(out().contains("\"file_path\""));
  }

  @Test void testGenerateJson() throws IOException {
    Path parquet = ParquetFixtures.writeEvents(tempDir.resolve("events.parquet"));
    assertEquals(0, run("generate", parquet.toString(), "--output", tempDir.toString(),
        "--json"), err());
    FileNode tree = MetadataSerializer.load(tempDir.resolve("events.json"));
    assertTrue(tree.getCustomMetadata().isEmpty());
  }

  @Test void testUsageErrors() {
    assertEquals(1, run());
    assertEquals(1, run("frobnicate"));
    assertEquals(1, run("generate", "x.parquet"));
    assertEquals(1, run("query", tempDir.toString()));
    assertEquals(1, run("list", tempDir.toString(), "--bogus"));
    assertEquals(1, run("query", tempDir.toString(), "--sql"));
    assertTrue(err().contains("Unknown option: --bogus"));
  }

  @Test void testFailures() {
    assertEquals(1, run("query", tempDir.toString(), "--sql", "SELECT * FROM other"));
    assertTrue(err().contains("UNKNOWN_TABLE"), err());
    assertEquals(1, run("generate", tempDir.resolve("absent.parquet").toString(),
        "--output", tempDir.toString()));
    assertEquals(1, run("list", tempDir.resolve("absent").toString()));
    assertEquals(1, run("show", tempDir.resolve("absent.meta").toString()));
  }
}
