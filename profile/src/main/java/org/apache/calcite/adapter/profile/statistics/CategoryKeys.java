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

import com.google.common.io.BaseEncoding;

/**
 * Canonical string keys for categorical values.
 */
public final class CategoryKeys {
  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private CategoryKeys() {
  }

  public static String of(boolean value) {
    return value ? "true" : "false";
  }

  /** Fixed-width lower-case hex, two characters per byte. */
  public static String of(byte[] value) {
    return HEX.encode(value);
  }
}
