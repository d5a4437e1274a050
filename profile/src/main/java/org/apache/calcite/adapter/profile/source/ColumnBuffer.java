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

import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;

/**
 * Decoded values of one column of one row group.
 *
 * <p>Buffers carry no null bitmap. Nulls are encoded in-band with the
 * sentinel convention of the source format:
 * <ul>
 *   <li>{@code INT32}, {@code INT64}, {@code TIMESTAMP}: the minimum value of the type</li>
 *   <li>{@code FLOAT}, {@code DOUBLE}: NaN</li>
 *   <li>{@code BYTE_ARRAY}: a zero-length value</li>
 *   <li>{@code FIXED_LEN_BYTE_ARRAY}, {@code INT96}: a value whose bytes are all zero</li>
 *   <li>{@code BOOLEAN}: no null representation</li>
 * </ul>
 *
 * <p>Instances are immutable by contract; the factories do not copy the
 * arrays they are given, so callers must not modify them afterwards.
 */
public final class ColumnBuffer {
  private final ValueType valueType;
  private final Object values;
  private final int valueCount;

  private ColumnBuffer(ValueType valueType, Object values, int valueCount) {
    this.valueType = Preconditions.checkNotNull(valueType, "valueType");
    this.values = values;
    this.valueCount = valueCount;
  }

  public static ColumnBuffer ofBooleans(boolean... values) {
    return new ColumnBuffer(ValueType.BOOLEAN, values, values.length);
  }

  public static ColumnBuffer ofInts(int... values) {
    return new ColumnBuffer(ValueType.INT32, values, values.length);
  }

  public static ColumnBuffer ofLongs(long... values) {
    return new ColumnBuffer(ValueType.INT64, values, values.length);
  }

  public static ColumnBuffer ofFloats(float... values) {
    return new ColumnBuffer(ValueType.FLOAT, values, values.length);
  }

  public static ColumnBuffer ofDoubles(double... values) {
    return new ColumnBuffer(ValueType.DOUBLE, values, values.length);
  }

  /** Creates a {@code BYTE_ARRAY} buffer holding raw (UTF-8) values. */
  public static ColumnBuffer ofBinary(byte[]... values) {
    return new ColumnBuffer(ValueType.BYTE_ARRAY, values, values.length);
  }

  /**
   * Creates a {@code BYTE_ARRAY} buffer from strings. A {@code null} element
   * is stored as the zero-length null sentinel.
   */
  public static ColumnBuffer ofStrings(String... values) {
    byte[][] encoded = new byte[values.length][];
    for (int i = 0; i < values.length; i++) {
      encoded[i] = values[i] == null
          ? new byte[0]
          : values[i].getBytes(StandardCharsets.UTF_8);
    }
    return new ColumnBuffer(ValueType.BYTE_ARRAY, encoded, encoded.length);
  }

  /** Creates a {@code FIXED_LEN_BYTE_ARRAY} buffer; every value must be {@code width} bytes. */
  public static ColumnBuffer ofFixedLength(int width, byte[]... values) {
    Preconditions.checkArgument(width > 0, "width must be positive: %s", width);
    for (byte[] value : values) {
      Preconditions.checkArgument(value.length == width,
          "expected %s bytes per value, got %s", width, value.length);
    }
    return new ColumnBuffer(ValueType.FIXED_LEN_BYTE_ARRAY, values, values.length);
  }

  /** Creates an {@code INT96} buffer of raw 12-byte values without time semantics. */
  public static ColumnBuffer ofInt96(byte[]... values) {
    for (byte[] value : values) {
      Preconditions.checkArgument(value.length == 12,
          "INT96 values are 12 bytes, got %s", value.length);
    }
    return new ColumnBuffer(ValueType.INT96, values, values.length);
  }

  /** Creates a {@code TIMESTAMP} buffer of epoch nanoseconds. */
  public static ColumnBuffer ofTimestamps(long... epochNanos) {
    return new ColumnBuffer(ValueType.TIMESTAMP, epochNanos, epochNanos.length);
  }

  /** Creates an empty buffer of the given type. */
  public static ColumnBuffer empty(ValueType valueType) {
    return new ColumnBuffer(valueType, null, 0);
  }

  /**
   * Creates a buffer of a type the source could not map. The raw bytes are
   * kept for diagnostics only; no profile can be computed from them.
   */
  public static ColumnBuffer ofUnknown(byte[]... values) {
    return new ColumnBuffer(ValueType.UNKNOWN, values, values.length);
  }

  public ValueType getValueType() {
    return valueType;
  }

  public int getValueCount() {
    return valueCount;
  }

  public boolean isEmpty() {
    return valueCount == 0;
  }

  public boolean[] booleans() {
    return (boolean[]) typed(ValueType.BOOLEAN);
  }

  public int[] ints() {
    return (int[]) typed(ValueType.INT32);
  }

  public long[] longs() {
    if (valueType == ValueType.TIMESTAMP) {
      return (long[]) typed(ValueType.TIMESTAMP);
    }
    return (long[]) typed(ValueType.INT64);
  }

  public float[] floats() {
    return (float[]) typed(ValueType.FLOAT);
  }

  public double[] doubles() {
    return (double[]) typed(ValueType.DOUBLE);
  }

  /**
   * Returns the values of a {@code BYTE_ARRAY}, {@code FIXED_LEN_BYTE_ARRAY},
   * {@code INT96} or {@code UNKNOWN} buffer.
   */
  public byte[][] binaries() {
    if (valueType != ValueType.BYTE_ARRAY && !valueType.isFixedWidthBinary()
        && valueType != ValueType.UNKNOWN) {
      throw new IllegalStateException("Buffer of type " + valueType + " holds no binary values");
    }
    return values == null ? new byte[0][] : (byte[][]) values;
  }

  /**
   * Returns whether the value at {@code index} matches the null sentinel of
   * this buffer's type.
   */
  public boolean isNullAt(int index) {
    Preconditions.checkElementIndex(index, valueCount);
    switch (valueType) {
    case INT32:
      return ints()[index] == Integer.MIN_VALUE;
    case INT64:
    case TIMESTAMP:
      return longs()[index] == Long.MIN_VALUE;
    case FLOAT:
      return Float.isNaN(floats()[index]);
    case DOUBLE:
      return Double.isNaN(doubles()[index]);
    case BYTE_ARRAY:
      return binaries()[index].length == 0;
    case FIXED_LEN_BYTE_ARRAY:
    case INT96:
      return isAllZero(binaries()[index]);
    default:
      return false;
    }
  }

  /** Returns the number of values matching the null sentinel. */
  public int countNulls() {
    int nulls = 0;
    for (int i = 0; i < valueCount; i++) {
      if (isNullAt(i)) {
        nulls++;
      }
    }
    return nulls;
  }

  private Object typed(ValueType expected) {
    if (valueType != expected) {
      throw new IllegalStateException("Buffer of type " + valueType
          + " accessed as " + expected);
    }
    if (values == null) {
      return emptyArray(expected);
    }
    return values;
  }

  private static Object emptyArray(ValueType type) {
    switch (type) {
    case BOOLEAN:
      return new boolean[0];
    case INT32:
      return new int[0];
    case INT64:
    case TIMESTAMP:
      return new long[0];
    case FLOAT:
      return new float[0];
    case DOUBLE:
      return new double[0];
    default:
      return new byte[0][];
    }
  }

  static boolean isAllZero(byte[] value) {
    for (byte b : value) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "ColumnBuffer{type=" + valueType + ", values=" + valueCount + "}";
  }
}
