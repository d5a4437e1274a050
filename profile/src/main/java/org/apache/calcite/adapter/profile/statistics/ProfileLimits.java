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

import com.google.common.base.Preconditions;

/**
 * Capacities of the bounded lists kept in profiles.
 */
public final class ProfileLimits {
  public static final int DEFAULT_FREQUENT_STRINGS = 10;
  public static final int DEFAULT_SPECIAL_STRINGS = 20;
  public static final int DEFAULT_CATEGORIES = 20;

  private static final ProfileLimits DEFAULTS =
      new ProfileLimits(DEFAULT_FREQUENT_STRINGS, DEFAULT_SPECIAL_STRINGS, DEFAULT_CATEGORIES);

  private final int frequentStrings;
  private final int specialStrings;
  private final int categories;

  /**
   * Creates limits.
   *
   * @param frequentStrings Size of the most-frequent string list
   * @param specialStrings Size of the special string list
   * @param categories Size of the category list
   */
  public ProfileLimits(int frequentStrings, int specialStrings, int categories) {
    Preconditions.checkArgument(frequentStrings > 0,
        "frequentStrings must be positive: %s", frequentStrings);
    Preconditions.checkArgument(specialStrings > 0,
        "specialStrings must be positive: %s", specialStrings);
    Preconditions.checkArgument(categories > 0,
        "categories must be positive: %s", categories);
    this.frequentStrings = frequentStrings;
    this.specialStrings = specialStrings;
    this.categories = categories;
  }

  public static ProfileLimits defaults() {
    return DEFAULTS;
  }

  public int getFrequentStrings() {
    return frequentStrings;
  }

  public int getSpecialStrings() {
    return specialStrings;
  }

  public int getCategories() {
    return categories;
  }

  @Override public String toString() {
    return "ProfileLimits{frequent=" + frequentStrings + ", special=" + specialStrings
        + ", categories=" + categories + "}";
  }
}
