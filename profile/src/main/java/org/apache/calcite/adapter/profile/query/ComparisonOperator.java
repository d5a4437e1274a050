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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparison operators of a WHERE condition.
 *
 * <p>{@code =} and {@code !=} compare strings exactly. Ordering operators
 * compare numerically when the stored value starts with a digit, or with
 * {@code -} followed by a digit; each side then contributes its leading
 * numeric prefix, or 0 if it has none. Otherwise they compare strings
 * lexicographically.
 */
public enum ComparisonOperator {
  EQUALS("="),
  NOT_EQUALS("!="),
  LESS_THAN("<"),
  LESS_THAN_OR_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_THAN_OR_EQUAL(">="),
  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE");

  private static final Pattern NUMBER_PREFIX =
      Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Applies this operator.
   *
   * @param stored Value held by the record
   * @param literal Value written in the query
   * @return Whether the condition holds
   */
  public boolean test(String stored, String literal) {
    switch (this) {
    case EQUALS:
      return stored.equals(literal);
    case NOT_EQUALS:
      return !stored.equals(literal);
    case LIKE:
      return LikePattern.matches(stored, literal);
    case NOT_LIKE:
      return !LikePattern.matches(stored, literal);
    default:
      break;
    }
    int c = isNumeric(stored)
        ? compareNumbers(leadingNumber(stored), leadingNumber(literal))
        : stored.compareTo(literal);
    switch (this) {
    case LESS_THAN:
      return c < 0;
    case LESS_THAN_OR_EQUAL:
      return c <= 0;
    case GREATER_THAN:
      return c > 0;
    case GREATER_THAN_OR_EQUAL:
      return c >= 0;
    default:
      throw new AssertionError(this);
    }
  }

  /** Compares with primitive operators, so {@code -0.0} equals {@code 0.0}. */
  private static int compareNumbers(double a, double b) {
    return a < b ? -1 : a > b ? 1 : 0;
  }

  static boolean isNumeric(String value) {
    if (value.isEmpty()) {
      return false;
    }
    char first = value.charAt(0);
    return Character.isDigit(first)
        || first == '-' && value.length() > 1 && Character.isDigit(value.charAt(1));
  }

  /** Parses the longest numeric prefix of a string; 0 if there is none. */
  static double leadingNumber(String value) {
    Matcher m = NUMBER_PREFIX.matcher(value);
    if (!m.find()) {
      return 0d;
    }
    return Double.parseDouble(m.group().trim());
  }
}
