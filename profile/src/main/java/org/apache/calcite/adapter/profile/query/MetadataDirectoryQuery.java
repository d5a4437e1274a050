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

import org.apache.calcite.adapter.profile.metadata.FileNode;
import org.apache.calcite.adapter.profile.metadata.MetadataSerializer;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a metadata query over every {@code .meta} file in a directory.
 *
 * <p>Files that fail to load are logged and skipped; they never fail the
 * query as a whole.
 */
public class MetadataDirectoryQuery {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataDirectoryQuery.class);

  private final MetadataQueryEngine engine;

  public MetadataDirectoryQuery() {
    this(new MetadataQueryEngine());
  }

  public MetadataDirectoryQuery(MetadataQueryEngine engine) {
    this.engine = Preconditions.checkNotNull(engine, "engine");
  }

  /**
   * Queries the metadata files of a directory.
   *
   * @param directory Directory holding {@code .meta} files
   * @param sql Query text
   * @return Matching files, row groups and columns
   * @throws QueryException if the query is malformed or names an unknown table
   * @throws IOException if the directory does not exist or cannot be listed
   */
  public MetadataQueryResult run(Path directory, String sql)
      throws QueryException, IOException {
    MetadataQuery query = QueryParser.parse(sql);
    MetadataQueryEngine.checkTable(query);
    if (!Files.isDirectory(directory)) {
      throw new NoSuchFileException(directory.toString(), null,
          "Metadata directory not found");
    }

    Set<String> files = new LinkedHashSet<>();
    Set<String> rowGroups = new LinkedHashSet<>();
    Set<String> columns = new LinkedHashSet<>();
    Map<String, QueryResult> results = new LinkedHashMap<>();
    List<String> skipped = new ArrayList<>();

    List<Path> metaFiles = listMetadataFiles(directory);
    if (metaFiles.isEmpty()) {
      LOGGER.warn("No metadata files found in {}", directory);
    }
    for (Path metaFile : metaFiles) {
      FileNode tree;
      try {
        tree = MetadataSerializer.load(metaFile);
      } catch (IOException e) {
        LOGGER.warn("Skipping unreadable metadata file {}: {}", metaFile, e.getMessage());
        skipped.add(metaFile.getFileName().toString());
        continue;
      }

      String fileId = fileId(metaFile);
      QueryResult result = engine.execute(query, MetadataRecords.of(tree));
      if (result.isEmpty()) {
        continue;
      }
      files.add(fileId);
      results.put(fileId, result);
      for (QueryableRecord match : result.getMatches()) {
        String rowGroup = match.get(MetadataRecords.ROW_GROUP);
        if (rowGroup == null || rowGroup.isEmpty()) {
          continue;
        }
        String rowGroupId = fileId + ":" + rowGroup;
        rowGroups.add(rowGroupId);
        String column = match.get(MetadataRecords.COLUMN);
        if (column != null && !column.isEmpty()) {
          columns.add(rowGroupId + ":" + column);
        }
      }
    }
    LOGGER.info("Query matched {} of {} metadata files in {}",
        files.size(), metaFiles.size(), directory);
    return new MetadataQueryResult(new ArrayList<>(files), new ArrayList<>(rowGroups),
        new ArrayList<>(columns), results, skipped);
  }

  /** Lists the {@code .meta} files of a directory, sorted by name. */
  public static List<Path> listMetadataFiles(Path directory) throws IOException {
    List<Path> paths = new ArrayList<>();
    try (DirectoryStream<Path> stream =
             Files.newDirectoryStream(directory, "*" + MetadataSerializer.META_EXTENSION)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          paths.add(path);
        }
      }
    }
    paths.sort(null);
    return paths;
  }

  /** Metadata file name without its extension. */
  static String fileId(Path metaFile) {
    String name = metaFile.getFileName().toString();
    return name.endsWith(MetadataSerializer.META_EXTENSION)
        ? name.substring(0, name.length() - MetadataSerializer.META_EXTENSION.length())
        : name;
  }
}
