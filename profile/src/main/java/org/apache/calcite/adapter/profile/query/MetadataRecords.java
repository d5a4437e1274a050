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

import org.apache.calcite.adapter.profile.custom.CustomMetadataConfig;
import org.apache.calcite.adapter.profile.custom.CustomMetadataItem;
import org.apache.calcite.adapter.profile.custom.ResultMatrix;
import org.apache.calcite.adapter.profile.metadata.ColumnNode;
import org.apache.calcite.adapter.profile.metadata.FileNode;
import org.apache.calcite.adapter.profile.metadata.ProfileSummary;
import org.apache.calcite.adapter.profile.metadata.RowGroupNode;
import org.apache.calcite.adapter.profile.statistics.CategoricalProfile;
import org.apache.calcite.adapter.profile.statistics.ColumnProfile;
import org.apache.calcite.adapter.profile.statistics.FrequencyEntry;
import org.apache.calcite.adapter.profile.statistics.NumericProfile;
import org.apache.calcite.adapter.profile.statistics.StatisticalFamily;
import org.apache.calcite.adapter.profile.statistics.StringProfile;
import org.apache.calcite.adapter.profile.statistics.TimestampProfile;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a metadata tree into queryable records.
 *
 * <p>A tree yields one record with {@code level=file}, then for each row
 * group one record with {@code level=row_group} followed by one record per
 * column with {@code level=column}. Row group and column records carry
 * {@code row_group} (the index) and column records carry {@code column}
 * (the name). Custom metadata items appear as keys named after the item,
 * valued {@code 1} when the item is set for that scope. An item whose name
 * is a record key (see {@link CustomMetadataConfig#isReservedName}) is left
 * out.
 *
 * <p>Profile statistics appear under their own names on column records,
 * and prefixed by family (e.g. {@code numeric_min}) on file and row group
 * records.
 */
public final class MetadataRecords {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataRecords.class);

  public static final String LEVEL = "level";
  public static final String ROW_GROUP = "row_group";
  public static final String COLUMN = "column";

  private MetadataRecords() {
  }

  /** Returns all records of a tree, file record first. */
  public static List<QueryableRecord> of(FileNode file) {
    ImmutableList.Builder<QueryableRecord> records = ImmutableList.builder();
    records.add(fileRecord(file));
    for (RowGroupNode rowGroup : file.getRowGroups()) {
      records.add(rowGroupRecord(file, rowGroup));
      for (ColumnNode column : rowGroup.getColumns()) {
        records.add(columnRecord(file, rowGroup, column));
      }
    }
    return records.build();
  }

  public static QueryableRecord fileRecord(FileNode file) {
    QueryableRecord.Builder b = QueryableRecord.builder()
        .put(LEVEL, "file")
        .put("file_path", file.getFilePath())
        .put("file_name", file.getFileName())
        .put("file_size", file.getFileSize())
        .put("created_at", file.getCreatedAt())
        .put("row_group_count", file.getRowGroupCount())
        .put("column_count", file.getColumnCount())
        .put("total_row_count", file.getTotalRowCount());
    putSummary(b, file.getSummary());
    for (CustomMetadataItem item : file.getCustomMetadata()) {
      putCustom(b, item, item.getResultMatrix().anySet());
    }
    return b.build();
  }

  public static QueryableRecord rowGroupRecord(FileNode file, RowGroupNode rowGroup) {
    QueryableRecord.Builder b = QueryableRecord.builder()
        .put(LEVEL, "row_group")
        .put("file_name", file.getFileName())
        .put(ROW_GROUP, rowGroup.getIndex())
        .put("row_count", rowGroup.getRowCount())
        .put("column_count", rowGroup.getColumns().size());
    putSummary(b, rowGroup.getSummary());
    for (CustomMetadataItem item : file.getCustomMetadata()) {
      ResultMatrix matrix = item.getResultMatrix();
      putCustom(b, item,
          rowGroup.getIndex() < matrix.getRowCount()
              && matrix.anySetInRow(rowGroup.getIndex()));
    }
    return b.build();
  }

  public static QueryableRecord columnRecord(FileNode file, RowGroupNode rowGroup,
      ColumnNode column) {
    QueryableRecord.Builder b = QueryableRecord.builder()
        .put(LEVEL, "column")
        .put("file_name", file.getFileName())
        .put(ROW_GROUP, rowGroup.getIndex())
        .put(COLUMN, column.getName())
        .put("column_index", column.getIndex())
        .put("type", column.getValueType().name());
    ColumnProfile profile = column.getProfile();
    if (profile != null) {
      b.put("family", profile.getFamily().key());
      for (Map.Entry<String, String> e : fields(profile).entrySet()) {
        b.put(e.getKey(), e.getValue());
      }
    }
    for (CustomMetadataItem item : file.getCustomMetadata()) {
      ResultMatrix matrix = item.getResultMatrix();
      boolean inRange = rowGroup.getIndex() < matrix.getRowCount()
          && column.getIndex() < matrix.getColumnCount();
      putCustom(b, item,
          inRange && matrix.get(rowGroup.getIndex(), column.getIndex()));
    }
    return b.build();
  }

  private static void putCustom(QueryableRecord.Builder b, CustomMetadataItem item,
      boolean set) {
    if (CustomMetadataConfig.isReservedName(item.getName())
        || b.containsKey(item.getName())) {
      LOGGER.debug("Custom metadata item '{}' clashes with a record key; not added",
          item.getName());
      return;
    }
    b.put(item.getName(), flag(set));
  }

  private static void putSummary(QueryableRecord.Builder b, ProfileSummary summary) {
    for (Map.Entry<StatisticalFamily, ColumnProfile> e : summary.getProfiles().entrySet()) {
      String prefix = e.getKey().key() + "_";
      for (Map.Entry<String, String> field : fields(e.getValue()).entrySet()) {
        b.put(prefix + field.getKey(), field.getValue());
      }
    }
  }

  /** Returns the statistics of a profile as ordered string fields. */
  static Map<String, String> fields(ColumnProfile profile) {
    final Map<String, String> fields = new LinkedHashMap<>();
    profile.accept(new ColumnProfile.Visitor<Void>() {
      @Override public Void visit(TimestampProfile p) {
        fields.put("min", Long.toString(p.getMin()));
        fields.put("max", Long.toString(p.getMax()));
        fields.put("value_count", Long.toString(p.getValueCount()));
        fields.put("null_count", Long.toString(p.getNullCount()));
        return null;
      }

      @Override public Void visit(NumericProfile p) {
        fields.put("min", formatNumber(p.getMin()));
        fields.put("max", formatNumber(p.getMax()));
        fields.put("mean", formatNumber(p.getMean()));
        fields.put("mode_value", formatNumber(p.getModeValue()));
        fields.put("mode_count", Long.toString(p.getModeCount()));
        fields.put("value_count", Long.toString(p.getValueCount()));
        fields.put("null_count", Long.toString(p.getNullCount()));
        return null;
      }

      @Override public Void visit(StringProfile p) {
        fields.put("min_len", Long.toString(p.getMinLength()));
        fields.put("max_len", Long.toString(p.getMaxLength()));
        fields.put("avg_len", formatNumber(p.getAverageLength()));
        fields.put("value_count", Long.toString(p.getTotalCount()));
        fields.put("null_count", Long.toString(p.getNullCount()));
        putTop(fields, "top_value", "top_count", p.getTopFrequent());
        putTop(fields, "top_special", "top_special_count", p.getTopSpecial());
        return null;
      }

      @Override public Void visit(CategoricalProfile p) {
        fields.put("distinct_count", Long.toString(p.getDistinctCategoryCount()));
        fields.put("value_count", Long.toString(p.getTotalValueCount()));
        putTop(fields, "top_value", "top_count", p.getTopCategories());
        return null;
      }
    });
    return fields;
  }

  private static void putTop(Map<String, String> fields, String valueKey, String countKey,
      List<FrequencyEntry> entries) {
    if (entries.isEmpty()) {
      fields.put(valueKey, "");
      fields.put(countKey, "0");
    } else {
      fields.put(valueKey, entries.get(0).getValue());
      fields.put(countKey, Long.toString(entries.get(0).getCount()));
    }
  }

  /** Formats a number, without a fraction when it is integral. */
  static String formatNumber(double value) {
    if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static String flag(boolean value) {
    return value ? "1" : "0";
  }
}
