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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * The columns of one row group and their aggregated summary.
 */
public final class RowGroupNode {
  private final int index;
  private final long rowCount;
  private final ImmutableList<ColumnNode> columns;
  private final ProfileSummary summary;

  public RowGroupNode(int index, long rowCount, List<ColumnNode> columns,
      ProfileSummary summary) {
    this.index = index;
    this.rowCount = rowCount;
    this.columns = ImmutableList.copyOf(columns);
    this.summary = Preconditions.checkNotNull(summary, "summary");
  }

  public int getIndex() {
    return index;
  }

  public long getRowCount() {
    return rowCount;
  }

  public ImmutableList<ColumnNode> getColumns() {
    return columns;
  }

  public ProfileSummary getSummary() {
    return summary;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowGroupNode)) {
      return false;
    }
    RowGroupNode that = (RowGroupNode) o;
    return index == that.index && rowCount == that.rowCount
        && columns.equals(that.columns) && summary.equals(that.summary);
  }

  @Override public int hashCode() {
    return Objects.hash(index, rowCount, columns, summary);
  }

  @Override public String toString() {
    return "RowGroupNode{" + index + ", rows=" + rowCount + ", columns=" + columns.size() + "}";
  }
}
