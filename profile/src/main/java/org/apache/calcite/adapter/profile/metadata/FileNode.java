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
package org.apache.calcite.adapter.profile.metadata;

import org.apache.calcite.adapter.profile.custom.CustomMetadataItem;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

/**
 * Root of the metadata tree of one file.
 *
 * <p>Besides its row groups and their aggregate, a file carries one
 * column node per column index with that column aggregated across row
 * groups, and any custom metadata items.
 */
public final class FileNode {
  private final String filePath;
  private final long fileSize;
  private final long createdAt;
  private final ImmutableList<RowGroupNode> rowGroups;
  private final ImmutableList<ColumnNode> columns;
  private final ProfileSummary summary;
  private final ImmutableList<CustomMetadataItem> customMetadata;

  /**
   * Creates a file node.
   *
   * @param filePath Path of the profiled file
   * @param fileSize Size of the profiled file in bytes, -1 if unknown
   * @param createdAt Generation time, epoch milliseconds
   * @param rowGroups Row groups in index order
   * @param columns File-level column profiles in column index order
   * @param summary File-level aggregate
   * @param customMetadata Custom metadata items
   */
  public FileNode(String filePath, long fileSize, long createdAt, List<RowGroupNode> rowGroups,
      List<ColumnNode> columns, ProfileSummary summary,
      List<CustomMetadataItem> customMetadata) {
    this.filePath = Preconditions.checkNotNull(filePath, "filePath");
    this.fileSize = fileSize;
    this.createdAt = createdAt;
    this.rowGroups = ImmutableList.copyOf(rowGroups);
    this.columns = ImmutableList.copyOf(columns);
    this.summary = Preconditions.checkNotNull(summary, "summary");
    this.customMetadata = ImmutableList.copyOf(customMetadata);
  }

  /** Returns a copy of this node with the given custom metadata. */
  public FileNode withCustomMetadata(List<CustomMetadataItem> items) {
    return new FileNode(filePath, fileSize, createdAt, rowGroups, columns, summary, items);
  }

  public String getFilePath() {
    return filePath;
  }

  /** Returns the last element of the file path. */
  public String getFileName() {
    Path name = Paths.get(filePath).getFileName();
    return name == null ? filePath : name.toString();
  }

  public long getFileSize() {
    return fileSize;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public ImmutableList<RowGroupNode> getRowGroups() {
    return rowGroups;
  }

  public int getRowGroupCount() {
    return rowGroups.size();
  }

  /** Returns the largest column count of any row group. */
  public int getColumnCount() {
    int count = columns.size();
    for (RowGroupNode rowGroup : rowGroups) {
      count = Math.max(count, rowGroup.getColumns().size());
    }
    return count;
  }

  public long getTotalRowCount() {
    long rows = 0;
    for (RowGroupNode rowGroup : rowGroups) {
      rows += rowGroup.getRowCount();
    }
    return rows;
  }

  public ImmutableList<ColumnNode> getColumns() {
    return columns;
  }

  public ProfileSummary getSummary() {
    return summary;
  }

  public ImmutableList<CustomMetadataItem> getCustomMetadata() {
    return customMetadata;
  }

  public @Nullable CustomMetadataItem getCustomMetadata(String name) {
    for (CustomMetadataItem item : customMetadata) {
      if (item.getName().equals(name)) {
        return item;
      }
    }
    return null;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileNode)) {
      return false;
    }
    FileNode that = (FileNode) o;
    return fileSize == that.fileSize && createdAt == that.createdAt
        && filePath.equals(that.filePath) && rowGroups.equals(that.rowGroups)
        && columns.equals(that.columns) && summary.equals(that.summary)
        && customMetadata.equals(that.customMetadata);
  }

  @Override public int hashCode() {
    return Objects.hash(filePath, fileSize, createdAt, rowGroups, columns, summary,
        customMetadata);
  }

  @Override public String toString() {
    return "FileNode{" + filePath + ", rowGroups=" + rowGroups.size()
        + ", custom=" + customMetadata.size() + "}";
  }
}
