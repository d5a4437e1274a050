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
package org.apache.calcite.adapter.profile.metadata;

import org.apache.calcite.adapter.profile.source.ValueType;
import org.apache.calcite.adapter.profile.statistics.ColumnProfile;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Leaf of the metadata tree: the profile of one column, either within one
 * row group or aggregated across the whole file.
 *
 * <p>The profile is null when the column's type cannot be profiled.
 */
public final class ColumnNode {
  private final int index;
  private final String name;
  private final ValueType valueType;
  private final @Nullable ColumnProfile profile;

  public ColumnNode(int index, String name, ValueType valueType,
      @Nullable ColumnProfile profile) {
    this.index = index;
    this.name = Preconditions.checkNotNull(name, "name");
    this.valueType = Preconditions.checkNotNull(valueType, "valueType");
    this.profile = profile;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public ValueType getValueType() {
    return valueType;
  }

  public @Nullable ColumnProfile getProfile() {
    return profile;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnNode)) {
      return false;
    }
    ColumnNode that = (ColumnNode) o;
    return index == that.index && name.equals(that.name)
        && valueType == that.valueType && Objects.equals(profile, that.profile);
  }

  @Override public int hashCode() {
    return Objects.hash(index, name, valueType, profile);
  }

  @Override public String toString() {
    return "ColumnNode{" + index + ":" + name + " " + valueType + ", " + profile + "}";
  }
}
