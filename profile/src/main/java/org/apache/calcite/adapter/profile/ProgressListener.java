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
package org.apache.calcite.adapter.profile;

/**
 * Receives progress notifications from {@link MetadataGenerator}.
 */
public interface ProgressListener {
  /** Listener that ignores all notifications. */
  ProgressListener NONE = (stage, rowGroup, rowGroupCount, percent) -> { };

  /** Phase of metadata generation. */
  enum Stage {
    PROFILING,
    AGGREGATING,
    CUSTOM_METADATA,
    DONE
  }

  /**
   * Called after each step.
   *
   * @param stage Current phase
   * @param rowGroup Index of the row group just finished, or -1 if not applicable
   * @param rowGroupCount Number of row groups in the file
   * @param percent Overall completion, 0 to 100
   */
  void onProgress(Stage stage, int rowGroup, int rowGroupCount, double percent);
}
