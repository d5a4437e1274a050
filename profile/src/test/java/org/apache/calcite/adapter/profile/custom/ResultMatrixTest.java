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
package org.apache.calcite.adapter.profile.custom;

import org.apache.calcite.adapter.profile.metadata.MetadataCapacityException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ResultMatrix}.
 */
@Tag("unit")
public class ResultMatrixTest {

  @Test void testFormat() {
    ResultMatrix matrix = ResultMatrix.create(2, 3, 100);
    matrix.set(0, 0, true);
    matrix.set(0, 1, true);
    matrix.set(1, 2, true);

    assertEquals("{{1,1,0},{0,0,1}}", matrix.format());
    assertTrue(matrix.anySet());
    assertTrue(matrix.anySetInRow(1));
  }

  @Test void testEmptyMatrix() {
    ResultMatrix matrix = ResultMatrix.create(0, 0, 0);
    assertEquals("{}", matrix.format());
    assertFalse(matrix.anySet());
    assertEquals(matrix, ResultMatrix.parse("{}"));
  }

  @Test void testNoRowsMeansNoColumns() {
    ResultMatrix matrix = ResultMatrix.create(0, 3, 100);
    assertEquals(0, matrix.getColumnCount());
    assertEquals("{}", matrix.format());
    assertEquals(matrix, ResultMatrix.parse(matrix.format()));
  }

  @Test void testParse() {
    ResultMatrix matrix = ResultMatrix.parse("{{1,1,0},{0,0,1}}");
    assertEquals(2, matrix.getRowCount());
    assertEquals(3, matrix.getColumnCount());
    assertTrue(matrix.get(0, 1));
    assertFalse(matrix.get(1, 0));
    assertTrue(matrix.get(1, 2));
    assertEquals("{{1,1,0},{0,0,1}}", matrix.format());
  }

  @Test void testParseToleratesWhitespace() {
    assertEquals(ResultMatrix.parse("{{0,1},{1,0}}"),
        ResultMatrix.parse(" { {0, 1} , {1,0} } "));
  }

  @Test void testParsePadsShortRows() {
    ResultMatrix matrix = ResultMatrix.parse("{{1},{0,0,1}}");
    assertEquals(3, matrix.getColumnCount());
    assertEquals("{{1,0,0},{0,0,1}}", matrix.format());
    assertFalse(matrix.get(0, 2));
  }

  @Test void testParseRejectsMalformedText() {
    assertThrows(IllegalArgumentException.class, () -> ResultMatrix.parse("{{1,0}"));
    assertThrows(IllegalArgumentException.class, () -> ResultMatrix.parse("{{1,2}}"));
    assertThrows(IllegalArgumentException.class, () -> ResultMatrix.parse("{{1}{0}}"));
    assertThrows(IllegalArgumentException.class, () -> ResultMatrix.parse("{{1},}"));
    assertThrows(IllegalArgumentException.class, () -> ResultMatrix.parse("1,0"));
  }

  @Test void testCapacity() {
    assertThrows(MetadataCapacityException.class, () -> ResultMatrix.create(1000, 1000, 999_999));
    ResultMatrix atLimit = ResultMatrix.create(1000, 1000, 1_000_000);
    assertEquals(1000, atLimit.getColumnCount());
    assertFalse(atLimit.anySet());
  }

  @Test void testOutOfRange() {
    ResultMatrix matrix = ResultMatrix.create(1, 1, 1);
    assertThrows(IndexOutOfBoundsException.class, () -> matrix.get(0, 1));
    assertThrows(IndexOutOfBoundsException.class, () -> matrix.anySetInRow(1));
  }
}
