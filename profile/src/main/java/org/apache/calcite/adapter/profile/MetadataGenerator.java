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

import org.apache.calcite.adapter.profile.custom.CustomMetadataConfig;
import org.apache.calcite.adapter.profile.custom.CustomMetadataEvaluator;
import org.apache.calcite.adapter.profile.custom.CustomMetadataItem;
import org.apache.calcite.adapter.profile.custom.PredicateRegistry;
import org.apache.calcite.adapter.profile.metadata.ColumnNode;
import org.apache.calcite.adapter.profile.metadata.FileNode;
import org.apache.calcite.adapter.profile.metadata.MetadataCapacityException;
import org.apache.calcite.adapter.profile.metadata.ProfileSummary;
import org.apache.calcite.adapter.profile.metadata.RowGroupNode;
import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.ColumnSource;
import org.apache.calcite.adapter.profile.source.ValueType;
import org.apache.calcite.adapter.profile.statistics.ColumnProfile;
import org.apache.calcite.adapter.profile.statistics.ColumnProfiler;
import org.apache.calcite.adapter.profile.statistics.ProfileAggregator;
import org.apache.calcite.adapter.profile.statistics.ProfileException;
import org.apache.calcite.adapter.profile.statistics.StatisticalFamily;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the metadata tree of one file.
 *
 * <p>Every column of every row group is profiled, then profiles are
 * aggregated bottom-up: columns into their row group, row groups into the
 * file, and each column index across row groups into a file-level column
 * profile. Custom metadata is evaluated last.
 *
 * <p>Failures degrade instead of aborting the file:
 * <ul>
 *   <li>an unreadable column gets an all-zero profile;</li>
 *   <li>a column of an unsupported type gets no profile;</li>
 *   <li>if custom metadata exceeds its capacity, the file gets none, and
 *   keeps its base metadata.</li>
 * </ul>
 *
 * <p>A generator may be reused for many files but is not thread-safe.
 */
public class MetadataGenerator {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataGenerator.class);

  private final GeneratorOptions options;
  private final CustomMetadataConfig customConfig;
  private final ColumnProfiler profiler;
  private final ProfileAggregator aggregator;
  private final CustomMetadataEvaluator evaluator;
  private ProgressListener progressListener = ProgressListener.NONE;

  /**
   * Creates a generator, reading the custom metadata configuration named by
   * the options if custom generation is enabled.
   *
   * @param options Generation options
   * @throws IOException if the custom metadata configuration cannot be read
   */
  public MetadataGenerator(GeneratorOptions options) throws IOException {
    this(options, loadCustomConfig(options), PredicateRegistry.defaults());
  }

  /**
   * Creates a generator with an explicit custom metadata configuration.
   *
   * @param options Generation options
   * @param customConfig Custom metadata items, used if custom generation is enabled
   * @param registry Predicates available to custom metadata items
   */
  public MetadataGenerator(GeneratorOptions options, CustomMetadataConfig customConfig,
      PredicateRegistry registry) {
    this.options = Preconditions.checkNotNull(options, "options");
    this.customConfig = Preconditions.checkNotNull(customConfig, "customConfig");
    this.profiler = new ColumnProfiler(options.toLimits());
    this.aggregator = new ProfileAggregator(options.toLimits());
    this.evaluator = new CustomMetadataEvaluator(registry, options.getMaxMatrixCells());
  }

  private static CustomMetadataConfig loadCustomConfig(GeneratorOptions options)
      throws IOException {
    String path = options.getCustomMetadataConfig();
    if (!options.isGenerateCustom() || path == null) {
      return CustomMetadataConfig.empty();
    }
    return CustomMetadataConfig.load(Paths.get(path));
  }

  public GeneratorOptions getOptions() {
    return options;
  }

  public MetadataGenerator setProgressListener(ProgressListener progressListener) {
    this.progressListener = Preconditions.checkNotNull(progressListener, "progressListener");
    return this;
  }

  /**
   * Generates the metadata tree of a file.
   *
   * @param source Decoded columns of the file
   * @return The tree
   */
  public FileNode generate(ColumnSource source) {
    long start = System.currentTimeMillis();
    int rowGroupCount = source.getRowGroupCount();
    LOGGER.info("Generating metadata for {} ({} row groups)",
        source.getFilePath(), rowGroupCount);

    List<RowGroupNode> rowGroups = new ArrayList<>(rowGroupCount);
    for (int rg = 0; rg < rowGroupCount; rg++) {
      rowGroups.add(
          options.isGenerateBase()
              ? generateRowGroup(source, rg)
              : new RowGroupNode(rg, source.getRowCount(rg), ImmutableList.of(),
                  ProfileSummary.empty()));
      progressListener.onProgress(ProgressListener.Stage.PROFILING, rg, rowGroupCount,
          percent(rg + 1, rowGroupCount, 80));
    }

    List<ColumnNode> fileColumns = options.isGenerateBase()
        ? aggregateColumns(rowGroups)
        : ImmutableList.of();
    List<ColumnProfile> rowGroupProfiles = new ArrayList<>();
    for (RowGroupNode rowGroup : rowGroups) {
      rowGroupProfiles.addAll(rowGroup.getSummary().getProfiles().values());
    }
    ProfileSummary fileSummary = ProfileSummary.aggregate(aggregator, rowGroupProfiles);
    progressListener.onProgress(ProgressListener.Stage.AGGREGATING, -1, rowGroupCount, 90);

    List<CustomMetadataItem> custom = ImmutableList.of();
    if (options.isGenerateCustom() && !customConfig.isEmpty()) {
      custom = evaluateCustom(source);
      progressListener.onProgress(ProgressListener.Stage.CUSTOM_METADATA, -1, rowGroupCount,
          99);
    }

    FileNode file = new FileNode(source.getFilePath(), source.getFileSize(),
        System.currentTimeMillis(), rowGroups, fileColumns, fileSummary, custom);
    progressListener.onProgress(ProgressListener.Stage.DONE, -1, rowGroupCount, 100);
    LOGGER.info("Generated metadata for {} in {} ms: {} row groups, {} columns, {} custom items",
        source.getFilePath(), System.currentTimeMillis() - start, rowGroupCount,
        file.getColumnCount(), custom.size());
    return file;
  }

  /**
   * Profiles one row group and aggregates its columns.
   *
   * @param source Decoded columns of the file
   * @param rowGroup Row group index
   * @return The row group node
   */
  public RowGroupNode generateRowGroup(ColumnSource source, int rowGroup) {
    Preconditions.checkElementIndex(rowGroup, source.getRowGroupCount(), "rowGroup");
    int columnCount = source.getColumnCount(rowGroup);
    List<ColumnNode> columns = new ArrayList<>(columnCount);
    List<ColumnProfile> profiles = new ArrayList<>(columnCount);
    for (int col = 0; col < columnCount; col++) {
      String name = source.getColumnName(rowGroup, col);
      ValueType type = source.getColumnType(rowGroup, col);
      ColumnProfile profile = profileColumn(source, rowGroup, col, name, type);
      columns.add(new ColumnNode(col, name, type, profile));
      profiles.add(profile);
    }
    ProfileSummary summary = ProfileSummary.aggregate(aggregator, profiles);
    LOGGER.debug("Profiled row group {} of {}: {} columns",
        rowGroup, source.getFilePath(), columnCount);
    return new RowGroupNode(rowGroup, source.getRowCount(rowGroup), columns, summary);
  }

  private @Nullable ColumnProfile profileColumn(ColumnSource source, int rowGroup, int column,
      String name, ValueType type) {
    StatisticalFamily family = StatisticalFamily.of(type);
    if (family == null) {
      LOGGER.warn("Column '{}' of {} has unsupported type {}; no profile generated",
          name, source.getFilePath(), type);
      return null;
    }
    ColumnBuffer buffer;
    try {
      buffer = source.readColumn(rowGroup, column);
    } catch (IOException e) {
      LOGGER.warn("Cannot read column '{}' of row group {} in {}: {}",
          name, rowGroup, source.getFilePath(), e.getMessage());
      return ColumnProfile.empty(family);
    }
    try {
      return profiler.profile(type, buffer);
    } catch (ProfileException e) {
      LOGGER.warn("Cannot profile column '{}' of row group {} in {}: {}",
          name, rowGroup, source.getFilePath(), e.getMessage());
      return e.getReason() == ProfileException.Reason.UNSUPPORTED_TYPE
          ? null
          : ColumnProfile.empty(family);
    }
  }

  /** Aggregates each column index across the row groups that have it. */
  private List<ColumnNode> aggregateColumns(List<RowGroupNode> rowGroups) {
    int columnCount = 0;
    for (RowGroupNode rowGroup : rowGroups) {
      columnCount = Math.max(columnCount, rowGroup.getColumns().size());
    }
    List<ColumnNode> columns = new ArrayList<>(columnCount);
    for (int col = 0; col < columnCount; col++) {
      ColumnNode first = null;
      List<ColumnProfile> profiles = new ArrayList<>();
      for (RowGroupNode rowGroup : rowGroups) {
        if (col >= rowGroup.getColumns().size()) {
          continue;
        }
        ColumnNode node = rowGroup.getColumns().get(col);
        if (first == null) {
          first = node;
        }
        ColumnProfile profile = node.getProfile();
        if (profile != null && node.getValueType() == first.getValueType()) {
          profiles.add(profile);
        }
      }
      if (first == null) {
        continue;
      }
      StatisticalFamily family = StatisticalFamily.of(first.getValueType());
      ColumnProfile aggregate = family == null || profiles.isEmpty()
          ? null
          : aggregator.aggregate(family, profiles);
      columns.add(new ColumnNode(col, first.getName(), first.getValueType(), aggregate));
    }
    return columns;
  }

  private List<CustomMetadataItem> evaluateCustom(ColumnSource source) {
    try {
      return evaluator.evaluate(source, customConfig);
    } catch (MetadataCapacityException e) {
      LOGGER.warn("Dropping custom metadata for {}: {}", source.getFilePath(), e.getMessage());
      return ImmutableList.of();
    }
  }

  private static double percent(int done, int total, double scale) {
    return total == 0 ? scale : scale * done / total;
  }
}
