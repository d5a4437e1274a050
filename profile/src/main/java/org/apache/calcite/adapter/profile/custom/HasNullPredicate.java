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
 * True when a cell holds at least one null, or its data cannot be read.
 *
 * <p>Nulls follow the sentinel convention of {@link ColumnBuffer}, including
 * all-zero values of fixed-width binary columns. Boolean columns have no
 * null representation and only match when empty.
 */
public class HasNullPredicate implements CustomPredicate {
  public static final String ID = "has_null";

  @Override public String getId() {
    return ID;
  }

  @Override public boolean test(@Nullable ColumnBuffer buffer, ValueType declaredType) {
    if (buffer == null || buffer.isEmpty()) {
      return true;
    }
    for (int i = 0; i < buffer.getValueCount(); i++) {
      if (buffer.isNullAt(i)) {
        return true;
      }
    }
    return false;
  }
}
