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

import org.apache.calcite.adapter.profile.GeneratorOptions;
import org.apache.calcite.adapter.profile.MetadataGenerator;
import org.apache.calcite.adapter.profile.custom.CustomMetadataConfig;
import org.apache.calcite.adapter.profile.custom.PredicateRegistry;
import org.apache.calcite.adapter.profile.metadata.MetadataSerializer;
import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.InMemoryColumnSource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MetadataDirectoryQuery}.
 */
@Tag("integration")
public class MetadataDirectoryQueryTest {

  @TempDir
  Path tempDir;

  private final MetadataGenerator generator = new MetadataGenerator(GeneratorOptions.defaults(),
      CustomMetadataConfig.empty(), PredicateRegistry.defaults());

  @BeforeEach void writeMetadata() throws IOException {
    MetadataSerializer.save(
        generator.generate(
            InMemoryColumnSource.builder("/data/a.parquet")
                .rowGroup()
                  .column("id", ColumnBuffer.ofInts(1, 2, 3))
                .rowGroup()
                  .column("id", ColumnBuffer.ofInts(4, 5))
                  .column("name", ColumnBuffer.ofStrings("x", "y"))
                .build()),
        tempDir.resolve("a.meta"));
    MetadataSerializer.save(
        generator.generate(
            InMemoryColumnSource.builder("/data/b.parquet")
                .rowGroup()
                  .column("id", ColumnBuffer.ofInts(1))
                .build()),
        tempDir.resolve("b.meta"));
    Files.write(tempDir.resolve("corrupt.meta"), "IPMD-broken".getBytes(StandardCharsets.UTF_8));
    Files.write(tempDir.resolve("notes.json"), "{}".getBytes(StandardCharsets.UTF_8));
  }

  @Test void testColumnMatches() throws Exception {
    MetadataQueryResult result = new MetadataDirectoryQuery().run(tempDir,
        "SELECT * FROM metadata WHERE level = 'column' AND column = 'id' AND max > 3");

    assertEquals(ImmutableList.of("a"), result.getMatchingFiles());
    assertEquals(ImmutableList.of("a:1"), result.getMatchingRowGroups());
    assertEquals(ImmutableList.of("a:1:id"), result.getMatchingColumns());
    assertEquals(ImmutableList.of("corrupt.meta"), result.getSkippedFiles());
    assertEquals(1, result.getResultsByFile().get("a").getRowCount());
  }

  @Test void testFileAndRowGroupMatches() throws Exception {
    MetadataQueryResult result = new MetadataDirectoryQuery().run(tempDir,
        "SELECT file_name FROM metadata WHERE numeric_max >= 1");

    assertEquals(ImmutableList.of("a", "b"), result.getMatchingFiles());
    assertEquals(ImmutableList.of("a:0", "a:1", "b:0"), result.getMatchingRowGroups());
    assertTrue(result.getMatchingColumns().isEmpty());
  }

  @Test void testNoMatches() throws Exception {
    MetadataQueryResult result = new MetadataDirectoryQuery().run(tempDir,
        "SELECT * FROM metadata WHERE level = 'nothing'");
    assertTrue(result.isEmpty());
    assertEquals(1, result.getSkippedFiles().size());
  }

  @Test void testFileWithBadIndexIsSkipped() throws Exception {
    CustomMetadataConfig config = new CustomMetadataConfig(
        ImmutableList.of(new CustomMetadataConfig.Item("nulls", "has_null")));
    ObjectNode root = MetadataSerializer.toJsonNode(
        new MetadataGenerator(GeneratorOptions.builder().generateCustom(true).build(), config,
            PredicateRegistry.defaults())
            .generate(
                InMemoryColumnSource.builder("/data/c.parquet")
                    .rowGroup()
                      .column("name", ColumnBuffer.ofStrings("x", null))
                    .build()));
    ((ObjectNode) root.at("/row_groups/0")).put("index", -1);
    byte[] payload = root.toString().getBytes(StandardCharsets.UTF_8);
    ByteBuffer envelope = ByteBuffer.allocate(12 + payload.length);
    envelope.put("IPMD".getBytes(StandardCharsets.US_ASCII)).putInt(1)
        .putInt(payload.length).put(payload);
    Files.write(tempDir.resolve("c.meta"), envelope.array());

    MetadataQueryResult result = new MetadataDirectoryQuery().run(tempDir,
        "SELECT * FROM metadata");

    assertEquals(ImmutableList.of("a", "b"), result.getMatchingFiles());
    assertEquals(ImmutableList.of("c.meta", "corrupt.meta"), result.getSkippedFiles());
  }

  @Test void testListMetadataFiles() throws IOException {
    assertEquals(
        ImmutableList.of(tempDir.resolve("a.meta"), tempDir.resolve("b.meta"),
            tempDir.resolve("corrupt.meta")),
        MetadataDirectoryQuery.listMetadataFiles(tempDir));
    assertEquals("a", MetadataDirectoryQuery.fileId(tempDir.resolve("a.meta")));
  }

  @Test void testQueryErrorsComeFirst() {
    QueryException e = assertThrows(QueryException.class,
        () -> new MetadataDirectoryQuery().run(tempDir.resolve("absent"), "SELECT * FROM x"));
    assertEquals(QueryException.Kind.UNKNOWN_TABLE, e.getKind());
  }

  @Test void testMissingDirectory() {
    assertThrows(NoSuchFileException.class,
        () -> new MetadataDirectoryQuery().run(tempDir.resolve("absent"),
            "SELECT * FROM metadata"));
  }

  @Test void testEmptyDirectory() throws Exception {
    Path empty = Files.createDirectory(tempDir.resolve("empty"));
    assertTrue(new MetadataDirectoryQuery().run(empty, "SELECT * FROM metadata").isEmpty());
  }
}
