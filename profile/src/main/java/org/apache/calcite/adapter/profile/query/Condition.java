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

import java.util.Objects;

/**
 * One {@code column op value} condition of a WHERE clause, tagged with the
 * operator that joins it to the conditions before it.
 */
public final class Condition {
  private final String column;
  private final ComparisonOperator operator;
  private final String value;
  private final LogicalOperator logicalOperator;

  public Condition(String column, ComparisonOperator operator, String value,
      LogicalOperator logicalOperator) {
    this.column = Preconditions.checkNotNull(column, "column");
    this.operator = Preconditions.checkNotNull(operator, "operator");
    this.value = Preconditions.checkNotNull(value, "value");
    this.logicalOperator = Preconditions.checkNotNull(logicalOperator, "logicalOperator");
  }

  public String getColumn() {
    return column;
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public String getValue() {
    return value;
  }

  public LogicalOperator getLogicalOperator() {
    return logicalOperator;
  }

  /** Evaluates this condition alone; false if the record lacks the column. */
  public boolean evaluate(QueryableRecord record) {
    String stored = record.get(column);
    return stored != null && operator.test(stored, value);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Condition)) {
      return false;
    }
    Condition that = (Condition) o;
    return column.equals(that.column) && operator == that.operator
        && value.equals(that.value) && logicalOperator == that.logicalOperator;
  }

  @Override public int hashCode() {
    return Objects.hash(column, operator, value, logicalOperator);
  }

  @Override public String toString() {
    return (logicalOperator == LogicalOperator.NONE ? "" : logicalOperator + " ")
        + column + " " + operator.getSymbol() + " '" + value + "'";
  }
}
