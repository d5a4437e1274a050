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

import java.util.Objects;

/**
 * A value and the number of times it was seen.
 */
public final class FrequencyEntry {
  private final String value;
  private final long count;

  public FrequencyEntry(String value, long count) {
    this.value = Preconditions.checkNotNull(value, "value");
    Preconditions.checkArgument(count >= 0, "count must not be negative: %s", count);
    this.count = count;
  }

  public String getValue() {
    return value;
  }

  public long getCount() {
    return count;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FrequencyEntry)) {
      return false;
    }
    FrequencyEntry that = (FrequencyEntry) o;
    return count == that.count && value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(value, count);
  }

  @Override public String toString() {
    return value + "=" + count;
  }
}
