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

import org.apache.calcite.adapter.profile.metadata.MetadataCapacityException;
import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.ColumnSource;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates custom metadata items over every (row group, column) cell of a
 * file.
 *
 * <p>All result matrices are sized before any cell is evaluated; if one
 * cannot be created the whole pass fails and no item is returned. Cells are
 * filled row group by row group, columns in index order, and each column is
 * read once for all items.
 */
public class CustomMetadataEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(CustomMetadataEvaluator.class);

  private final PredicateRegistry registry;
  private final long maxMatrixCells;

  public CustomMetadataEvaluator(PredicateRegistry registry, long maxMatrixCells) {
    this.registry = Preconditions.checkNotNull(registry, "registry");
    Preconditions.checkArgument(maxMatrixCells >= 0,
        "maxMatrixCells must not be negative: %s", maxMatrixCells);
    this.maxMatrixCells = maxMatrixCells;
  }

  /**
   * Evaluates the configured items against a file.
   *
   * @param source File to evaluate
   * @param config Items to evaluate
   * @return One item per configured item, in configuration order
   * @throws MetadataCapacityException if a result matrix exceeds the cell limit
   */
  public List<CustomMetadataItem> evaluate(ColumnSource source, CustomMetadataConfig config) {
    if (config.isEmpty()) {
      return ImmutableList.of();
    }
    int rowGroups = source.getRowGroupCount();
    int columns = 0;
    for (int rg = 0; rg < rowGroups; rg++) {
      columns = Math.max(columns, source.getColumnCount(rg));
    }

    List<CustomPredicate> predicates = new ArrayList<>();
    List<ResultMatrix> matrices = new ArrayList<>();
    for (CustomMetadataConfig.Item item : config.getItems()) {
      CustomPredicate predicate = registry.resolve(item.getQuery());
      if (predicate == null) {
        LOGGER.warn("Custom metadata item '{}' names no known predicate; results will be empty",
            item.getName());
      }
      predicates.add(predicate);
      matrices.add(ResultMatrix.create(rowGroups, columns, maxMatrixCells));
    }

    for (int rg = 0; rg < rowGroups; rg++) {
      int columnCount = source.getColumnCount(rg);
      for (int col = 0; col < columnCount; col++) {
        ColumnBuffer buffer = read(source, rg, col);
        for (int i = 0; i < predicates.size(); i++) {
          CustomPredicate predicate = predicates.get(i);
          if (predicate != null
              && predicate.test(buffer, source.getColumnType(rg, col))) {
            matrices.get(i).set(rg, col, true);
          }
        }
      }
    }

    ImmutableList.Builder<CustomMetadataItem> items = ImmutableList.builder();
    for (int i = 0; i < predicates.size(); i++) {
      CustomMetadataConfig.Item item = config.getItems().get(i);
      CustomPredicate predicate = predicates.get(i);
      items.add(
          new CustomMetadataItem(item.getName(),
              predicate == null ? null : predicate.getId(),
              item.getQuery(), matrices.get(i)));
    }
    LOGGER.debug("Evaluated {} custom metadata items over {}x{} cells of {}",
        predicates.size(), rowGroups, columns, source.getFilePath());
    return items.build();
  }

  private static @Nullable ColumnBuffer read(ColumnSource source, int rowGroup, int column) {
    try {
      return source.readColumn(rowGroup, column);
    } catch (IOException e) {
      LOGGER.debug("Column {} of row group {} in {} is unreadable: {}",
          column, rowGroup, source.getFilePath(), e.getMessage());
      return null;
    }
  }
}
