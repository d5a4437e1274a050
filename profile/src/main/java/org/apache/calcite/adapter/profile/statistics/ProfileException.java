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

/**
 * Thrown when a column cannot be profiled.
 */
public class ProfileException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why profiling failed. */
  public enum Reason {
    /** The declared value type maps to no statistical family. */
    UNSUPPORTED_TYPE,
    /** The buffer's value type differs from the column's declared type. */
    TYPE_MISMATCH
  }

  private final Reason reason;

  public ProfileException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
