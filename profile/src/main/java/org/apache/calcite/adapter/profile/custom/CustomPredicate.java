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

import org.apache.calcite.adapter.profile.source.ColumnBuffer;
import org.apache.calcite.adapter.profile.source.ValueType;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A named boolean test evaluated once per (row group, column) cell.
 */
public interface CustomPredicate {

  /** Identifier matched against the query text of a custom metadata item. */
  String getId();

  /**
   * Evaluates the predicate for one cell.
   *
   * @param buffer Decoded column values, or null if the column could not be read
   * @param declaredType Declared value type of the column
   * @return Cell result
   */
  boolean test(@Nullable ColumnBuffer buffer, ValueType declaredType);
}
