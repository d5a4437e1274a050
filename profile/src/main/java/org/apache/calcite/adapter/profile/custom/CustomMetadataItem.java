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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A named custom predicate result attached to a file's metadata.
 */
public final class CustomMetadataItem {
  private final String name;
  private final @Nullable String predicateId;
  private final String query;
  private final ResultMatrix resultMatrix;

  /**
   * Creates an item.
   *
   * @param name Item name, as configured
   * @param predicateId Id of the predicate the query resolved to, or null if none
   * @param query Configured query text
   * @param resultMatrix Per-cell results
   */
  public CustomMetadataItem(String name, @Nullable String predicateId, String query,
      ResultMatrix resultMatrix) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.predicateId = predicateId;
    this.query = Preconditions.checkNotNull(query, "query");
    this.resultMatrix = Preconditions.checkNotNull(resultMatrix, "resultMatrix");
  }

  public String getName() {
    return name;
  }

  public @Nullable String getPredicateId() {
    return predicateId;
  }

  public String getQuery() {
    return query;
  }

  public ResultMatrix getResultMatrix() {
    return resultMatrix;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CustomMetadataItem)) {
      return false;
    }
    CustomMetadataItem that = (CustomMetadataItem) o;
    return name.equals(that.name) && Objects.equals(predicateId, that.predicateId)
        && query.equals(that.query) && resultMatrix.equals(that.resultMatrix);
  }

  @Override public int hashCode() {
    return Objects.hash(name, predicateId, query, resultMatrix);
  }

  @Override public String toString() {
    return "CustomMetadataItem{name=" + name + ", predicate=" + predicateId
        + ", matrix=" + resultMatrix + "}";
  }
}
