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
package org.apache.calcite.adapter.profile.statistics;

import org.apache.calcite.adapter.profile.source.ValueType;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The four kinds of column profile. A column's declared value type selects
 * exactly one family.
 *
 * <p>Booleans are profiled as categories ("true"/"false"), never as numbers.
 */
public enum StatisticalFamily {
  TIMESTAMP("timestamp"),
  NUMERIC("numeric"),
  STRING("string"),
  CATEGORICAL("categorical");

  private final String key;

  StatisticalFamily(String key) {
    this.key = key;
  }

  /** Lower-case name used in persisted metadata and query records. */
  public String key() {
    return key;
  }

  /**
   * Returns the family for a declared value type, or null if the type cannot
   * be profiled.
   */
  public static @Nullable StatisticalFamily of(ValueType valueType) {
    switch (valueType) {
    case BOOLEAN:
    case FIXED_LEN_BYTE_ARRAY:
    case INT96:
      return CATEGORICAL;
    case INT32:
    case INT64:
    case FLOAT:
    case DOUBLE:
      return NUMERIC;
    case BYTE_ARRAY:
      return STRING;
    case TIMESTAMP:
      return TIMESTAMP;
    default:
      return null;
    }
  }

  /**
   * Looks up a family by its persisted key.
   *
   * @throws IllegalArgumentException if the key names no family
   */
  public static StatisticalFamily fromKey(String key) {
    for (StatisticalFamily family : values()) {
      if (family.key.equalsIgnoreCase(key)) {
        return family;
      }
    }
    throw new IllegalArgumentException("Unknown statistical family: " + key);
  }
}
