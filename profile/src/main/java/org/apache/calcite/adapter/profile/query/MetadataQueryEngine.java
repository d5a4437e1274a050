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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs metadata queries against queryable records.
 *
 * <p>The only table is {@value #TABLE_NAME}. With {@code SELECT *} the
 * result columns are the keys of the first matching record. The engine
 * holds no state and may be shared between threads.
 */
public class MetadataQueryEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataQueryEngine.class);

  /** Name of the single queryable table. */
  public static final String TABLE_NAME = "metadata";

  /**
   * Parses and runs a query.
   *
   * @param sql Query text
   * @param records Records to filter
   * @return The matching records
   * @throws QueryException if the query is malformed or names an unknown table
   */
  public QueryResult execute(String sql, List<QueryableRecord> records) throws QueryException {
    return execute(QueryParser.parse(sql), records);
  }

  /**
   * Runs a query against the records of one metadata tree.
   *
   * @see MetadataRecords#of(FileNode)
   */
  public QueryResult execute(String sql, FileNode file) throws QueryException {
    return execute(QueryParser.parse(sql), MetadataRecords.of(file));
  }

  /**
   * Runs a parsed query.
   *
   * @throws QueryException of kind {@link QueryException.Kind#UNKNOWN_TABLE}
   *     if the query does not select from {@value #TABLE_NAME}
   */
  public QueryResult execute(MetadataQuery query, List<QueryableRecord> records)
      throws QueryException {
    checkTable(query);
    List<QueryableRecord> matches = new ArrayList<>();
    for (QueryableRecord record : records) {
      if (query.matches(record)) {
        matches.add(record);
      }
    }
    LOGGER.debug("{} matched {} of {} records", query, matches.size(), records.size());
    if (matches.isEmpty()) {
      return QueryResult.empty();
    }

    List<String> columns = query.isSelectAll()
        ? matches.get(0).keys()
        : query.getSelectColumns();
    ImmutableList.Builder<QueryableRecord> rows = ImmutableList.builder();
    for (QueryableRecord match : matches) {
      QueryableRecord.Builder row = QueryableRecord.builder();
      for (String column : columns) {
        String value = match.get(column);
        row.put(column, value == null ? "" : value);
      }
      rows.add(row.build());
    }
    return new QueryResult(columns, rows.build(), matches);
  }

  /** Fails unless the query selects from {@value #TABLE_NAME}. */
  static void checkTable(MetadataQuery query) throws QueryException {
    if (!TABLE_NAME.equalsIgnoreCase(query.getTable())) {
      throw new QueryException(QueryException.Kind.UNKNOWN_TABLE,
          "Unknown table '" + query.getTable() + "'; the only table is '" + TABLE_NAME + "'");
    }
  }
}
