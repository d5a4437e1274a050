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

import java.util.List;

/**
 * Result of a metadata query: the matched records projected onto the
 * result columns, in input order.
 */
public final class QueryResult {
  private static final QueryResult EMPTY =
      new QueryResult(ImmutableList.of(), ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<String> columns;
  private final ImmutableList<QueryableRecord> rows;
  private final ImmutableList<QueryableRecord> matches;

  QueryResult(List<String> columns, List<QueryableRecord> rows, List<QueryableRecord> matches) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
    this.matches = ImmutableList.copyOf(matches);
  }

  static QueryResult empty() {
    return EMPTY;
  }

  /** Result column names. */
  public ImmutableList<String> getColumns() {
    return columns;
  }

  /** Matched records restricted to {@link #getColumns()}; missing values are empty strings. */
  public ImmutableList<QueryableRecord> getRows() {
    return rows;
  }

  /** Matched records with all their keys. */
  public ImmutableList<QueryableRecord> getMatches() {
    return matches;
  }

  public int getRowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override public String toString() {
    return "QueryResult{columns=" + columns + ", rows=" + rows.size() + "}";
  }
}
