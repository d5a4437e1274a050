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
 * SQL LIKE matching: {@code %} matches any run of characters, including
 * none, and {@code _} matches exactly one character. There is no escape
 * character; matching is case-sensitive.
 */
public final class LikePattern {
  private LikePattern() {
  }

  /**
   * Returns whether a value matches a pattern.
   *
   * <p>Greedy scan that backtracks to the most recent {@code %} on mismatch.
   */
  public static boolean matches(String value, String pattern) {
    int v = 0;
    int p = 0;
    int starP = -1;
    int starV = -1;
    while (v < value.length()) {
      if (p < pattern.length() && pattern.charAt(p) == '%') {
        starP = ++p;
        starV = v;
      } else if (p < pattern.length()
          && (pattern.charAt(p) == '_' || pattern.charAt(p) == value.charAt(v))) {
        p++;
        v++;
      } else if (starP >= 0) {
        p = starP;
        v = ++starV;
      } else {
        return false;
      }
    }
    while (p < pattern.length() && pattern.charAt(p) == '%') {
      p++;
    }
    return p == pattern.length();
  }
}
