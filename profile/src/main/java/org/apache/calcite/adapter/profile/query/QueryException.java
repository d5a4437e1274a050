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

/**
 * Thrown when a metadata query cannot be parsed or refers to an unknown
 * table. A query that raises this exception has not been executed.
 */
public class QueryException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Kind of query failure. */
  public enum Kind {
    PARSE_ERROR,
    UNKNOWN_TABLE
  }

  private final Kind kind;

  public QueryException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  static QueryException parseError(String message) {
    return new QueryException(Kind.PARSE_ERROR, message);
  }
}
