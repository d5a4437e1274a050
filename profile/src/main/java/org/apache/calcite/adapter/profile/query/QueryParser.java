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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the metadata query language:
 *
 * <pre>
 * SELECT (* | col [, col]*) FROM table [WHERE cond [(AND | OR) cond]*]
 * cond := column op value
 * op   := = | != | &lt;&gt; | &lt; | &lt;= | &gt; | &gt;= | LIKE | NOT LIKE
 * </pre>
 *
 * <p>Keywords are case-insensitive and values may be single- or
 * double-quoted. The WHERE clause is split on {@code AND} first, then each
 * piece on {@code OR}, ignoring separators inside quotes or parentheses.
 * The first condition of each AND piece after the first is tagged
 * {@link LogicalOperator#AND}, the other conditions of a piece
 * {@link LogicalOperator#OR}.
 *
 * <p>Within a condition the operator is the one found earliest in the
 * text, outside quotes, preferring the longest operator at that position.
 * {@code LIKE} and {@code NOT LIKE} must stand as whole words.
 */
public final class QueryParser {
  private static final Pattern SELECT = Pattern.compile("^select\\s+",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern FROM = Pattern.compile("\\s+from\\s+",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern WHERE = Pattern.compile("\\s+where(\\s+|$)",
      Pattern.CASE_INSENSITIVE);

  /** Symbolic operators, longest first so that "<=" wins over "<". */
  private static final String[][] SYMBOLS = {
      {"<=", "LESS_THAN_OR_EQUAL"},
      {">=", "GREATER_THAN_OR_EQUAL"},
      {"<>", "NOT_EQUALS"},
      {"!=", "NOT_EQUALS"},
      {"<", "LESS_THAN"},
      {">", "GREATER_THAN"},
      {"=", "EQUALS"},
  };

  private QueryParser() {
  }

  /**
   * Parses a query.
   *
   * @param sql Query text
   * @return The parsed query
   * @throws QueryException of kind {@link QueryException.Kind#PARSE_ERROR}
   *     if the text is malformed
   */
  public static MetadataQuery parse(String sql) throws QueryException {
    if (sql == null || sql.trim().isEmpty()) {
      throw QueryException.parseError("Empty query");
    }
    String text = sql.trim();
    if (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).trim();
    }

    Matcher select = SELECT.matcher(text);
    if (!select.find()) {
      throw QueryException.parseError("Query must start with SELECT: " + sql);
    }
    Matcher from = FROM.matcher(text);
    if (!from.find(select.end() - 1)) {
      throw QueryException.parseError("Missing FROM clause: " + sql);
    }

    String selectPart = from.start() > select.end()
        ? text.substring(select.end(), from.start()).trim()
        : "";
    boolean selectAll = "*".equals(selectPart);
    List<String> columns = new ArrayList<>();
    if (!selectAll) {
      for (String column : selectPart.split(",", -1)) {
        String trimmed = column.trim();
        if (trimmed.isEmpty()) {
          throw QueryException.parseError("Empty column name in SELECT list: " + sql);
        }
        columns.add(trimmed);
      }
    }

    String rest = text.substring(from.end());
    Matcher where = WHERE.matcher(rest);
    String table;
    List<Condition> conditions = ImmutableList.of();
    if (where.find()) {
      table = rest.substring(0, where.start()).trim();
      String wherePart = rest.substring(where.end()).trim();
      if (wherePart.isEmpty()) {
        throw QueryException.parseError("Empty WHERE clause: " + sql);
      }
      conditions = parseWhere(wherePart);
    } else {
      table = rest.trim();
    }
    if (table.isEmpty()) {
      throw QueryException.parseError("Missing table name: " + sql);
    }
    return new MetadataQuery(selectAll, columns, table, conditions);
  }

  /** Parses a WHERE clause (without the keyword) into tagged conditions. */
  static List<Condition> parseWhere(String where) throws QueryException {
    ImmutableList.Builder<Condition> conditions = ImmutableList.builder();
    List<String> andGroups = split(where, " and ");
    for (int i = 0; i < andGroups.size(); i++) {
      LogicalOperator groupOperator = i == 0 ? LogicalOperator.NONE : LogicalOperator.AND;
      List<String> orTerms = split(andGroups.get(i), " or ");
      for (int j = 0; j < orTerms.size(); j++) {
        conditions.add(
            parseCondition(orTerms.get(j), j == 0 ? groupOperator : LogicalOperator.OR));
      }
    }
    return conditions.build();
  }

  /**
   * Splits text on a separator, ignoring case, skipping occurrences inside
   * quotes or parentheses.
   */
  static List<String> split(String text, String separator) throws QueryException {
    List<String> parts = new ArrayList<>();
    String lower = text.toLowerCase(Locale.ROOT);
    char quote = 0;
    int depth = 0;
    int start = 0;
    int pos = 0;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        pos++;
      } else if (c == '\'' || c == '"') {
        quote = c;
        pos++;
      } else if (c == '(') {
        depth++;
        pos++;
      } else if (c == ')') {
        depth--;
        pos++;
      } else if (depth <= 0 && lower.startsWith(separator, pos)) {
        parts.add(text.substring(start, pos).trim());
        pos += separator.length();
        start = pos;
      } else {
        pos++;
      }
    }
    if (quote != 0) {
      throw QueryException.parseError("Unterminated quoted value in: " + text);
    }
    parts.add(text.substring(start).trim());
    return parts;
  }

  static Condition parseCondition(String text, LogicalOperator logicalOperator)
      throws QueryException {
    OperatorMatch match = findOperator(text);
    if (match == null) {
      throw QueryException.parseError("No comparison operator found in condition: " + text);
    }
    String column = text.substring(0, match.start).trim();
    if (column.isEmpty()) {
      throw QueryException.parseError("Missing column name in condition: " + text);
    }
    String value = unquote(text.substring(match.end).trim(), text);
    return new Condition(column, match.operator, value, logicalOperator);
  }

  private static String unquote(String value, String condition) throws QueryException {
    if (value.isEmpty()) {
      return value;
    }
    char first = value.charAt(0);
    if (first == '\'' || first == '"') {
      if (value.length() < 2 || value.charAt(value.length() - 1) != first) {
        throw QueryException.parseError("Unterminated quoted value in condition: " + condition);
      }
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  /** Finds the earliest operator outside quotes, longest first at each position. */
  static @Nullable OperatorMatch findOperator(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    char quote = 0;
    for (int pos = 0; pos < text.length(); pos++) {
      char c = text.charAt(pos);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '\'' || c == '"') {
        quote = c;
        continue;
      }
      int notLike = wordAt(lower, pos, "not");
      if (notLike > 0) {
        int likeStart = skipSpaces(lower, notLike);
        if (likeStart > notLike && wordAt(lower, likeStart, "like") > 0) {
          return new OperatorMatch(ComparisonOperator.NOT_LIKE, pos, likeStart + 4);
        }
      }
      if (wordAt(lower, pos, "like") > 0) {
        return new OperatorMatch(ComparisonOperator.LIKE, pos, pos + 4);
      }
      for (String[] symbol : SYMBOLS) {
        if (text.startsWith(symbol[0], pos)) {
          return new OperatorMatch(ComparisonOperator.valueOf(symbol[1]), pos,
              pos + symbol[0].length());
        }
      }
    }
    return null;
  }

  /** Returns the end of {@code word} if it stands as a whole word at {@code pos}, else -1. */
  private static int wordAt(String lower, int pos, String word) {
    if (!lower.startsWith(word, pos)) {
      return -1;
    }
    int end = pos + word.length();
    boolean boundaryBefore = pos == 0 || !isWordChar(lower.charAt(pos - 1));
    boolean boundaryAfter = end == lower.length() || !isWordChar(lower.charAt(end));
    return boundaryBefore && boundaryAfter ? end : -1;
  }

  private static int skipSpaces(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** Operator found in a condition, with its extent. */
  static final class OperatorMatch {
    final ComparisonOperator operator;
    final int start;
    final int end;

    OperatorMatch(ComparisonOperator operator, int start, int end) {
      this.operator = operator;
      this.start = start;
      this.end = end;
    }
  }
}
