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

import org.apache.calcite.adapter.profile.ParquetFixtures;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ParquetColumnSource} against files written with
 * parquet-hadoop.
 */
@Tag("integration")
public class ParquetColumnSourceTest {

  @TempDir
  Path tempDir;

  @Test void testSchemaMapping() throws IOException {
    Path file = ParquetFixtures.writeEvents(tempDir.resolve("events.parquet"));
    try (ParquetColumnSource source = ParquetColumnSource.open(file)) {
      assertEquals(1, source.getRowGroupCount());
      assertEquals(5, source.getColumnCount(0));
      assertEquals(5, source.getRowCount(0));
      assertEquals(Files.size(file), source.getFileSize());
      assertEquals("id", source.getColumnName(0, 0));
      assertEquals(ValueType.INT32, source.getColumnType(0, 0));
      assertEquals(ValueType.BYTE_ARRAY, source.getColumnType(0, 1));
      assertEquals(ValueType.BOOLEAN, source.getColumnType(0, 2));
      assertEquals(ValueType.DOUBLE, source.getColumnType(0, 3));
      assertEquals(ValueType.TIMESTAMP, source.getColumnType(0, 4));
    }
  }

  @Test void testNullsBecomeSentinels() throws IOException {
    Path file = ParquetFixtures.writeEvents(tempDir.resolve("events.parquet"));
    try (ParquetColumnSource source = ParquetColumnSource.open(file)) {
      assertArrayEquals(new int[] {1, 2, 3, 4, 5}, source.readColumn(0, 0).ints());

      ColumnBuffer level = source.readColumn(0, 1);
      assertEquals(5, level.getValueCount());
      assertEquals("ERROR: disk full",
          new String(level.binaries()[1], StandardCharsets.UTF_8));
      assertEquals(0, level.binaries()[3].length);

      // The null boolean is dropped.
      assertArrayEquals(new boolean[] {true, false, true, true},
          source.readColumn(0, 2).booleans());

      ColumnBuffer score = source.readColumn(0, 3);
      assertTrue(Double.isNaN(score.doubles()[1]));
      assertEquals(4.5d, score.doubles()[4], 0d);

      long[] ts = source.readColumn(0, 4).longs();
      assertEquals(1_000_000_000L, ts[0]);
      assertEquals(Long.MIN_VALUE, ts[2]);
    }
  }

  @Test void testOutOfRangeColumn() throws IOException {
    Path file = ParquetFixtures.writeEvents(tempDir.resolve("events.parquet"));
    try (ParquetColumnSource source = ParquetColumnSource.open(file)) {
      assertThrows(IndexOutOfBoundsException.class, () -> source.readColumn(0, 9));
      assertThrows(IndexOutOfBoundsException.class, () -> source.readColumn(1, 0));
    }
  }

  @Test void testNotAParquetFile() throws IOException {
    Path file = tempDir.resolve("bogus.parquet");
    Files.write(file, "not parquet at all".getBytes(StandardCharsets.UTF_8));
    assertThrows(IOException.class, () -> ParquetColumnSource.open(file));
  }

  @Test void testInt96Decoding() {
    byte[] bytes = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN)
        .putLong(1_000_000_000L)
        .putInt(2_440_589)
        .array();
    assertEquals(86_400_000_000_000L + 1_000_000_000L,
        ParquetColumnSource.int96ToEpochNanos(bytes));
  }
}
