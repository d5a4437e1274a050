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
package org.apache.calcite.adapter.profile.source;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link InMemoryColumnSource}.
 */
@Tag("unit")
public class InMemoryColumnSourceTest {

  @Test void testRowGroupsAndColumns() throws IOException {
    ColumnBuffer ids = ColumnBuffer.ofInts(1, 2, 3);
    InMemoryColumnSource source = InMemoryColumnSource.builder("t.parquet")
        .fileSize(1234)
        .rowGroup()
          .column("id", ids)
          .column("name", ColumnBuffer.ofStrings("a", "b"))
        .rowGroup()
          .column("id", ColumnBuffer.ofInts(4))
        .build();

    assertEquals("t.parquet", source.getFilePath());
    assertEquals(1234, source.getFileSize());
    assertEquals(2, source.getRowGroupCount());
    assertEquals(2, source.getColumnCount(0));
    assertEquals(1, source.getColumnCount(1));
    assertEquals("name", source.getColumnName(0, 1));
    assertEquals(ValueType.BYTE_ARRAY, source.getColumnType(0, 1));
    assertEquals(3, source.getRowCount(0));
    assertSame(ids, source.readColumn(0, 0));
  }

  @Test void testUnreadableColumnThrows() {
    InMemoryColumnSource source = InMemoryColumnSource.builder("t.parquet")
        .rowGroup()
          .unreadableColumn("broken", ValueType.INT64)
        .build();

    assertEquals(ValueType.INT64, source.getColumnType(0, 0));
    assertEquals(0, source.getRowCount(0));
    assertThrows(IOException.class, () -> source.readColumn(0, 0));
  }

  @Test void testIndexOutOfRange() {
    InMemoryColumnSource source = InMemoryColumnSource.builder("t.parquet").build();
    assertEquals(0, source.getRowGroupCount());
    assertEquals(-1, source.getFileSize());
    assertThrows(IndexOutOfBoundsException.class, () -> source.getColumnCount(0));
  }

  @Test void testColumnBeforeRowGroupFails() {
    assertThrows(IllegalStateException.class,
        () -> InMemoryColumnSource.builder("t.parquet").column("x", ColumnBuffer.ofInts(1)));
  }
}
