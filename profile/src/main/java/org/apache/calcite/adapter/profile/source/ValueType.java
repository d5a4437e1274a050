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

/**
 * Declared value type of a column buffer handed to the profiler.
 *
 * <p>The set mirrors the Parquet physical types, plus {@link #TIMESTAMP} for
 * 96-bit values that carry time semantics (decoded to epoch nanoseconds by
 * the source) and {@link #UNKNOWN} for anything the source could not map.
 */
public enum ValueType {
  BOOLEAN,
  INT32,
  INT64,
  INT96,
  FLOAT,
  DOUBLE,
  BYTE_ARRAY,
  FIXED_LEN_BYTE_ARRAY,
  TIMESTAMP,
  UNKNOWN;

  /**
   * Returns whether values of this type are held as fixed-width byte arrays
   * whose null convention is "all bytes zero".
   */
  public boolean isFixedWidthBinary() {
    return this == FIXED_LEN_BYTE_ARRAY || this == INT96;
  }
}
