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

import java.io.IOException;

/**
 * Random access to the decoded columns of one columnar file, addressed by
 * row group index and column index.
 *
 * <p>The metadata generator only ever reads through this interface; it
 * never interprets file formats itself. Implementations need not be
 * thread-safe.
 */
public interface ColumnSource {

  /**
   * Returns the path or identifier of the file this source reads.
   */
  String getFilePath();

  /**
   * Returns the size of the file in bytes, or -1 if unknown.
   */
  long getFileSize();

  /**
   * Returns the number of row groups in the file.
   */
  int getRowGroupCount();

  /**
   * Returns the number of columns in the given row group.
   *
   * @param rowGroup Row group index
   * @return Column count, zero if the row group holds no columns
   */
  int getColumnCount(int rowGroup);

  /**
   * Returns the name of a column.
   *
   * @param rowGroup Row group index
   * @param column Column index within the row group
   * @return Column name
   */
  String getColumnName(int rowGroup, int column);

  /**
   * Returns the declared value type of a column without reading its values.
   *
   * @param rowGroup Row group index
   * @param column Column index within the row group
   * @return Declared value type
   */
  ValueType getColumnType(int rowGroup, int column);

  /**
   * Returns the number of rows in a row group.
   *
   * @param rowGroup Row group index
   * @return Row count
   */
  long getRowCount(int rowGroup);

  /**
   * Reads and decodes all values of one column of one row group.
   *
   * @param rowGroup Row group index
   * @param column Column index within the row group
   * @return Column values with nulls encoded as type sentinels
   * @throws IOException If the column data is absent or cannot be decoded
   */
  ColumnBuffer readColumn(int rowGroup, int column) throws IOException;
}
