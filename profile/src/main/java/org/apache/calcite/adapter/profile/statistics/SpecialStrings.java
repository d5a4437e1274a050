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

import com.google.common.collect.ImmutableList;

import java.util.Locale;

/**
 * Recognizes "special" string values: those that look like error or
 * diagnostic text.
 */
public final class SpecialStrings {
  /** Keywords matched as case-insensitive substrings. */
  public static final ImmutableList<String> KEYWORDS =
      ImmutableList.of("error", "exception", "fail", "bug", "crash",
          "invalid", "fatal", "critical", "warning", "issue");

  private SpecialStrings() {
  }

  /** Returns whether a value contains any keyword, ignoring case. */
  public static boolean isSpecial(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    for (String keyword : KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
