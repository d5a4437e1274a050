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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A parsed {@code SELECT ... FROM ... [WHERE ...]} query.
 *
 * <p>The WHERE clause is a flat list of conditions, each tagged with a
 * {@link LogicalOperator}. It is evaluated as a strict left-to-right fold:
 * the first condition gives the initial result and every later condition
 * is ANDed or ORed into the running result. There is no operator
 * precedence, so {@code a OR b AND c} means {@code (a OR b) AND c}.
 */
public final class MetadataQuery {
  private final boolean selectAll;
  private final ImmutableList<String> selectColumns;
  private final String table;
  private final ImmutableList<Condition> conditions;

  public MetadataQuery(boolean selectAll, List<String> selectColumns, String table,
      List<Condition> conditions) {
    Preconditions.checkArgument(selectAll || !selectColumns.isEmpty(),
        "a query selects * or at least one column");
    this.selectAll = selectAll;
    this.selectColumns = ImmutableList.copyOf(selectColumns);
    this.table = Preconditions.checkNotNull(table, "table");
    this.conditions = ImmutableList.copyOf(conditions);
  }

  public boolean isSelectAll() {
    return selectAll;
  }

  /** Selected columns; empty for {@code SELECT *}. */
  public ImmutableList<String> getSelectColumns() {
    return selectColumns;
  }

  public String getTable() {
    return table;
  }

  public ImmutableList<Condition> getConditions() {
    return conditions;
  }

  /** Returns whether a record satisfies the WHERE clause; true if there is none. */
  public boolean matches(QueryableRecord record) {
    boolean result = true;
    for (int i = 0; i < conditions.size(); i++) {
      Condition condition = conditions.get(i);
      if (i == 0) {
        result = condition.evaluate(record);
      } else if (condition.getLogicalOperator() == LogicalOperator.AND) {
        result = result && condition.evaluate(record);
      } else {
        result = result || condition.evaluate(record);
      }
    }
    return result;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("SELECT ");
    sb.append(selectAll ? "*" : String.join(", ", selectColumns));
    sb.append(" FROM ").append(table);
    if (!conditions.isEmpty()) {
      sb.append(" WHERE");
      for (Condition condition : conditions) {
        sb.append(' ').append(condition);
      }
    }
    return sb.toString();
  }
}
