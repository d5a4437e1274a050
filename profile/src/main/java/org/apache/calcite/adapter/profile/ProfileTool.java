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
import org.apache.calcite.adapter.profile.query.MetadataDirectoryQuery;
import org.apache.calcite.adapter.profile.query.MetadataQueryResult;
import org.apache.calcite.adapter.profile.query.QueryException;
import org.apache.calcite.adapter.profile.source.ParquetColumnSource;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 * generate &lt;file.parquet&gt; --output &lt;dir&gt; [--custom-metadata &lt;config.json&gt;]
 *          [--options &lt;options.yaml&gt;] [--json]
 * query &lt;dir&gt; --sql "&lt;query&gt;"
 * list &lt;dir&gt;
 * show &lt;file.meta&gt;
 * </pre>
 *
 * <p>Exits with status 0 on success and 1 on usage errors or failures.
 */
public class ProfileTool {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProfileTool.class);

  /** Flags that take a value; all others are switches. */
  private static final ImmutableMap<String, Boolean> FLAGS = ImmutableMap.of(
      "--output", true,
      "--custom-metadata", true,
      "--options", true,
      "--sql", true,
      "--json", false);

  private final PrintStream out;
  private final PrintStream err;

  ProfileTool(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new ProfileTool(System.out, System.err).run(args));
  }

  /**
   * Runs one command.
   *
   * @param args Command and its arguments
   * @return Exit status
   */
  int run(String[] args) {
    if (args.length == 0) {
      usage();
      return 1;
    }
    List<String> positional = new ArrayList<>();
    Map<String, String> flags = new HashMap<>();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--")) {
        Boolean takesValue = FLAGS.get(arg);
        if (takesValue == null) {
          err.println("Unknown option: " + arg);
          usage();
          return 1;
        }
        if (takesValue) {
          if (i + 1 >= args.length) {
            err.println("Missing value for " + arg);
            return 1;
          }
          flags.put(arg, args[++i]);
        } else {
          flags.put(arg, "true");
        }
      } else {
        positional.add(arg);
      }
    }

    try {
      switch (args[0]) {
      case "generate":
        return generate(positional, flags);
      case "query":
        return query(positional, flags);
      case "list":
        return list(positional);
      case "show":
        return show(positional);
      default:
        err.println("Unknown command: " + args[0]);
        usage();
        return 1;
      }
    } catch (QueryException e) {
      err.println("Query failed (" + e.getKind() + "): " + e.getMessage());
      return 1;
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Command '{}' failed", args[0], e);
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private int generate(List<String> positional, Map<String, String> flags) throws IOException {
    String output = flags.get("--output");
    if (positional.size() != 1 || output == null) {
      err.println("Usage: generate <file.parquet> --output <dir> "
          + "[--custom-metadata <config.json>] [--options <options.yaml>] [--json]");
      return 1;
    }
    Path input = Paths.get(positional.get(0));
    GeneratorOptions options = flags.containsKey("--options")
        ? GeneratorOptions.load(Paths.get(flags.get("--options")))
        : GeneratorOptions.defaults();
    if (flags.containsKey("--custom-metadata")) {
      options = GeneratorOptions.builder()
          .generateBase(options.isGenerateBase())
          .generateCustom(true)
          .customMetadataConfig(flags.get("--custom-metadata"))
          .frequentStrings(options.getFrequentStrings())
          .specialStrings(options.getSpecialStrings())
          .categories(options.getCategories())
          .maxMatrixCells(options.getMaxMatrixCells())
          .build();
    }

    MetadataGenerator generator = new MetadataGenerator(options);
    FileNode tree;
    try (ParquetColumnSource source = ParquetColumnSource.open(input)) {
      tree = generator.generate(source);
    }

    String baseName = input.getFileName().toString();
    int dot = baseName.lastIndexOf('.');
    if (dot > 0) {
      baseName = baseName.substring(0, dot);
    }
    String extension = flags.containsKey("--json") ? ".json" : MetadataSerializer.META_EXTENSION;
    Path target = Paths.get(output).resolve(baseName + extension);
    MetadataSerializer.save(tree, target);
    out.println("Wrote metadata for " + input + " to " + target);
    return 0;
  }

  private int query(List<String> positional, Map<String, String> flags)
      throws IOException, QueryException {
    String sql = flags.get("--sql");
    if (positional.size() != 1 || sql == null) {
      err.println("Usage: query <dir> --sql \"<query>\"");
      return 1;
    }
    MetadataQueryResult result =
        new MetadataDirectoryQuery().run(Paths.get(positional.get(0)), sql);
    out.println("Query results for: " + sql);
    if (result.isEmpty()) {
      out.println("No matches found.");
      return 0;
    }
    printSection("Matching files", result.getMatchingFiles());
    printSection("Matching row groups", result.getMatchingRowGroups());
    printSection("Matching columns", result.getMatchingColumns());
    return 0;
  }

  private int list(List<String> positional) throws IOException {
    if (positional.size() != 1) {
      err.println("Usage: list <dir>");
      return 1;
    }
    Path directory = Paths.get(positional.get(0));
    if (!Files.isDirectory(directory)) {
      err.println("Metadata directory not found: " + directory);
      return 1;
    }
    List<Path> files = MetadataDirectoryQuery.listMetadataFiles(directory);
    out.println("Metadata files in " + directory + ":");
    if (files.isEmpty()) {
      out.println("No metadata files found.");
      return 0;
    }
    for (Path file : files) {
      try {
        FileNode tree = MetadataSerializer.load(file);
        out.println("  - " + file.getFileName() + " (" + tree.getRowGroupCount()
            + " row groups, " + tree.getColumnCount() + " columns)");
      } catch (IOException e) {
        LOGGER.warn("Cannot load {}: {}", file, e.getMessage());
        out.println("  - " + file.getFileName() + " (unreadable)");
      }
    }
    return 0;
  }

  private int show(List<String> positional) throws IOException {
    if (positional.size() != 1) {
      err.println("Usage: show <file.meta>");
      return 1;
    }
    out.println(MetadataSerializer.toJson(MetadataSerializer.load(Paths.get(positional.get(0)))));
    return 0;
  }

  private void printSection(String title, List<String> items) {
    if (items.isEmpty()) {
      return;
    }
    out.println(title + " (" + items.size() + "):");
    for (String item : items) {
      out.println("  - " + item);
    }
  }

  private void usage() {
    err.println("Usage: ProfileTool <command> [options]");
    err.println("  generate <file.parquet> --output <dir> [--custom-metadata <config.json>]"
        + " [--options <options.yaml>] [--json]");
    err.println("  query <dir> --sql \"<query>\"");
    err.println("  list <dir>");
    err.println("  show <file.meta>");
  }
}
