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
package org.apache.calcite.adapter.profile.source;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Column source over buffers that are already decoded in memory.
 *
 * <p>Useful for callers that decode files themselves, and for tests.
 *
 * <pre>{@code
 * ColumnSource source = InMemoryColumnSource.builder("events.parquet")
 *     .rowGroup()
 *       .column("id", ColumnBuffer.ofInts(1, 2, 3))
 *       .column("level", ColumnBuffer.ofStrings("INFO", "ERROR", "INFO"))
 *     .rowGroup()
 *       .column("id", ColumnBuffer.ofInts(4, 5))
 *       .column("level", ColumnBuffer.ofStrings("WARN", "INFO"))
 *     .build();
 * }</pre>
 */
public class InMemoryColumnSource implements ColumnSource {
  private final String filePath;
  private final long fileSize;
  private final ImmutableList<ImmutableList<NamedColumn>> rowGroups;

  private InMemoryColumnSource(String filePath, long fileSize,
      ImmutableList<ImmutableList<NamedColumn>> rowGroups) {
    this.filePath = filePath;
    this.fileSize = fileSize;
    this.rowGroups = rowGroups;
  }

  public static Builder builder(String filePath) {
    return new Builder(filePath);
  }

  @Override public String getFilePath() {
    return filePath;
  }

  @Override public long getFileSize() {
    return fileSize;
  }

  @Override public int getRowGroupCount() {
    return rowGroups.size();
  }

  @Override public int getColumnCount(int rowGroup) {
    return rowGroup(rowGroup).size();
  }

  @Override public String getColumnName(int rowGroup, int column) {
    return column(rowGroup, column).name;
  }

  @Override public ValueType getColumnType(int rowGroup, int column) {
    return column(rowGroup, column).valueType;
  }

  @Override public long getRowCount(int rowGroup) {
    long rows = 0;
    for (NamedColumn column : rowGroup(rowGroup)) {
      if (column.buffer != null) {
        rows = Math.max(rows, column.buffer.getValueCount());
      }
    }
    return rows;
  }

  @Override public ColumnBuffer readColumn(int rowGroup, int column) throws IOException {
    NamedColumn named = column(rowGroup, column);
    if (named.buffer == null) {
      throw new IOException("Column '" + named.name + "' of row group " + rowGroup
          + " in " + filePath + " is unreadable");
    }
    return named.buffer;
  }

  private List<NamedColumn> rowGroup(int rowGroup) {
    Preconditions.checkElementIndex(rowGroup, rowGroups.size(), "rowGroup");
    return rowGroups.get(rowGroup);
  }

  private NamedColumn column(int rowGroup, int column) {
    List<NamedColumn> columns = rowGroup(rowGroup);
    Preconditions.checkElementIndex(column, columns.size(), "column");
    return columns.get(column);
  }

  /** A column buffer with its name; a null buffer marks unreadable data. */
  private static final class NamedColumn {
    final String name;
    final ValueType valueType;
    final ColumnBuffer buffer;

    NamedColumn(String name, ValueType valueType, ColumnBuffer buffer) {
      this.name = name;
      this.valueType = valueType;
      this.buffer = buffer;
    }
  }

  /**
   * Builder for InMemoryColumnSource. Columns are added to the row group
   * opened by the most recent {@link #rowGroup()} call.
   */
  public static class Builder {
    private final String filePath;
    private final List<List<NamedColumn>> rowGroups = new ArrayList<>();
    private long fileSize = -1;

    Builder(String filePath) {
      this.filePath = Preconditions.checkNotNull(filePath, "filePath");
    }

    public Builder fileSize(long fileSize) {
      this.fileSize = fileSize;
      return this;
    }

    public Builder rowGroup() {
      rowGroups.add(new ArrayList<>());
      return this;
    }

    public Builder column(String name, ColumnBuffer buffer) {
      Preconditions.checkNotNull(buffer, "buffer");
      current().add(new NamedColumn(name, buffer.getValueType(), buffer));
      return this;
    }

    /** Adds a column whose data cannot be read. */
    public Builder unreadableColumn(String name, ValueType valueType) {
      current().add(new NamedColumn(name, valueType, null));
      return this;
    }

    public InMemoryColumnSource build() {
      ImmutableList.Builder<ImmutableList<NamedColumn>> groups = ImmutableList.builder();
      for (List<NamedColumn> group : rowGroups) {
        groups.add(ImmutableList.copyOf(group));
      }
      return new InMemoryColumnSource(filePath, fileSize, groups.build());
    }

    private List<NamedColumn> current() {
      Preconditions.checkState(!rowGroups.isEmpty(), "call rowGroup() before adding columns");
      return rowGroups.get(rowGroups.size() - 1);
    }
  }
}
