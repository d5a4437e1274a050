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

import java.util.List;
import java.util.Map;

/**
 * Result of a query over a directory of metadata files.
 *
 * <p>Files are identified by the metadata file name without its
 * extension, row groups as {@code file:row_group} and columns as
 * {@code file:row_group:column}.
 */
public final class MetadataQueryResult {
  private final ImmutableList<String> matchingFiles;
  private final ImmutableList<String> matchingRowGroups;
  private final ImmutableList<String> matchingColumns;
  private final ImmutableMap<String, QueryResult> resultsByFile;
  private final ImmutableList<String> skippedFiles;

  MetadataQueryResult(List<String> matchingFiles, List<String> matchingRowGroups,
      List<String> matchingColumns, Map<String, QueryResult> resultsByFile,
      List<String> skippedFiles) {
    this.matchingFiles = ImmutableList.copyOf(matchingFiles);
    this.matchingRowGroups = ImmutableList.copyOf(matchingRowGroups);
    this.matchingColumns = ImmutableList.copyOf(matchingColumns);
    this.resultsByFile = ImmutableMap.copyOf(resultsByFile);
    this.skippedFiles = ImmutableList.copyOf(skippedFiles);
  }

  public ImmutableList<String> getMatchingFiles() {
    return matchingFiles;
  }

  public ImmutableList<String> getMatchingRowGroups() {
    return matchingRowGroups;
  }

  public ImmutableList<String> getMatchingColumns() {
    return matchingColumns;
  }

  /** Per-file query results, for files with at least one match. */
  public ImmutableMap<String, QueryResult> getResultsByFile() {
    return resultsByFile;
  }

  /** Metadata files that could not be loaded. */
  public ImmutableList<String> getSkippedFiles() {
    return skippedFiles;
  }

  public boolean isEmpty() {
    return matchingFiles.isEmpty();
  }

  @Override public String toString() {
    return "MetadataQueryResult{files=" + matchingFiles + ", rowGroups="
        + matchingRowGroups.size() + ", columns=" + matchingColumns.size() + "}";
  }
}
