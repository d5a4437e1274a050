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
package org.apache.calcite.adapter.profile.custom;

import org.apache.calcite.adapter.profile.metadata.MetadataCapacityException;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Boolean results of a custom predicate, one row per row group and one
 * column per column index.
 *
 * <p>Dimensions are fixed at creation. Cells past the last column of a
 * row group with fewer columns stay false.
 *
 * <p>The text form nests braces: {@code {{1,1,0},{0,0,1}}} is two row
 * groups of three columns. An empty matrix is {@code {}}.
 */
public final class ResultMatrix {
  private final int rowCount;
  private final int columnCount;
  private final BitSet cells;

  private ResultMatrix(int rowCount, int columnCount) {
    this.rowCount = rowCount;
    this.columnCount = columnCount;
    this.cells = new BitSet(rowCount * columnCount);
  }

  /**
   * Creates an all-false matrix. A matrix with no rows has no columns
   * either.
   *
   * @param rowCount Number of row groups
   * @param columnCount Largest column count over the row groups
   * @param maxCells Upper bound on {@code rowCount * columnCount}
   * @throws MetadataCapacityException if the matrix would exceed {@code maxCells}
   */
  public static ResultMatrix create(int rowCount, int columnCount, long maxCells) {
    Preconditions.checkArgument(rowCount >= 0, "rowCount must not be negative: %s", rowCount);
    Preconditions.checkArgument(columnCount >= 0,
        "columnCount must not be negative: %s", columnCount);
    long cells = (long) rowCount * columnCount;
    if (cells > maxCells || cells > Integer.MAX_VALUE) {
      throw new MetadataCapacityException("Result matrix of " + rowCount + "x" + columnCount
          + " cells exceeds the limit of " + maxCells);
    }
    // No rows means no cells; keeps the text form reversible.
    return new ResultMatrix(rowCount, rowCount == 0 ? 0 : columnCount);
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columnCount;
  }

  public boolean get(int row, int column) {
    return cells.get(index(row, column));
  }

  void set(int row, int column, boolean value) {
    cells.set(index(row, column), value);
  }

  /** Returns whether any cell is true. */
  public boolean anySet() {
    return !cells.isEmpty();
  }

  /** Returns whether any cell of a row is true. */
  public boolean anySetInRow(int row) {
    Preconditions.checkElementIndex(row, rowCount, "row");
    int from = row * columnCount;
    int next = cells.nextSetBit(from);
    return next >= 0 && next < from + columnCount;
  }

  private int index(int row, int column) {
    Preconditions.checkElementIndex(row, rowCount, "row");
    Preconditions.checkElementIndex(column, columnCount, "column");
    return row * columnCount + column;
  }

  /** Returns the brace text form. */
  public String format() {
    StringBuilder sb = new StringBuilder(2 + rowCount * (2 + 2 * columnCount));
    sb.append('{');
    for (int r = 0; r < rowCount; r++) {
      if (r > 0) {
        sb.append(',');
      }
      sb.append('{');
      for (int c = 0; c < columnCount; c++) {
        if (c > 0) {
          sb.append(',');
        }
        sb.append(get(r, c) ? '1' : '0');
      }
      sb.append('}');
    }
    return sb.append('}').toString();
  }

  /**
   * Parses the brace text form. Rows shorter than the longest row are
   * padded with false.
   *
   * @param text Matrix text, e.g. {@code {{1,0},{0,1}}}
   * @return The matrix
   * @throws IllegalArgumentException if the text is malformed
   */
  public static ResultMatrix parse(String text) {
    String s = text.trim();
    if (s.length() < 2 || s.charAt(0) != '{' || s.charAt(s.length() - 1) != '}') {
      throw new IllegalArgumentException("Result matrix must be wrapped in braces: " + text);
    }
    String body = s.substring(1, s.length() - 1).trim();
    List<boolean[]> rows = new ArrayList<>();
    int pos = 0;
    while (pos < body.length()) {
      if (body.charAt(pos) != '{') {
        throw new IllegalArgumentException("Expected '{' at offset " + (pos + 1) + ": " + text);
      }
      int end = body.indexOf('}', pos);
      if (end < 0) {
        throw new IllegalArgumentException("Unterminated row in result matrix: " + text);
      }
      rows.add(parseRow(body.substring(pos + 1, end), text));
      pos = end + 1;
      if (pos < body.length()) {
        if (body.charAt(pos) != ',') {
          throw new IllegalArgumentException("Expected ',' between rows: " + text);
        }
        pos++;
        if (pos == body.length()) {
          throw new IllegalArgumentException("Trailing ',' in result matrix: " + text);
        }
      }
    }

    int columns = 0;
    for (boolean[] row : rows) {
      columns = Math.max(columns, row.length);
    }
    ResultMatrix matrix = new ResultMatrix(rows.size(), columns);
    for (int r = 0; r < rows.size(); r++) {
      boolean[] row = rows.get(r);
      for (int c = 0; c < row.length; c++) {
        if (row[c]) {
          matrix.set(r, c, true);
        }
      }
    }
    return matrix;
  }

  private static boolean[] parseRow(String row, String text) {
    if (row.trim().isEmpty()) {
      return new boolean[0];
    }
    String[] parts = row.split(",", -1);
    boolean[] values = new boolean[parts.length];
    for (int i = 0; i < parts.length; i++) {
      String cell = parts[i].trim();
      if ("1".equals(cell)) {
        values[i] = true;
      } else if (!"0".equals(cell)) {
        throw new IllegalArgumentException("Invalid cell '" + cell + "' in result matrix: "
            + text);
      }
    }
    return values;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResultMatrix)) {
      return false;
    }
    ResultMatrix that = (ResultMatrix) o;
    return rowCount == that.rowCount && columnCount == that.columnCount
        && cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return 31 * (31 * rowCount + columnCount) + cells.hashCode();
  }

  @Override public String toString() {
    return format();
  }
}
