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

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ColumnReader;
import org.apache.parquet.column.impl.ColumnReadStoreImpl;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Column source backed by a Parquet file, read with parquet-hadoop.
 *
 * <p>Row groups are decoded whole, one at a time, and the most recently
 * decoded row group is cached, so callers should read row-group-major.
 * Parquet nulls (definition level below the column maximum) are translated
 * to the sentinel convention of {@link ColumnBuffer}. Null booleans have no
 * sentinel and are left out of the buffer.
 *
 * <p>{@code INT96} columns and {@code INT64} columns annotated as
 * timestamps are exposed as {@link ValueType#TIMESTAMP} in epoch
 * nanoseconds.
 */
public class ParquetColumnSource implements ColumnSource, Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetColumnSource.class);

  private static final long JULIAN_EPOCH_DAY = 2_440_588L;
  private static final long NANOS_PER_DAY = 86_400_000_000_000L;

  private final String filePath;
  private final long fileSize;
  private final ParquetFileReader reader;
  private final MessageType schema;
  private final List<ColumnDescriptor> columns;
  private final List<BlockMetaData> blocks;
  private final String createdBy;

  private int cachedRowGroup = -1;
  private ColumnBuffer[] cachedBuffers;

  private ParquetColumnSource(String filePath, long fileSize, ParquetFileReader reader) {
    this.filePath = filePath;
    this.fileSize = fileSize;
    this.reader = reader;
    ParquetMetadata footer = reader.getFooter();
    this.schema = footer.getFileMetaData().getSchema();
    this.columns = schema.getColumns();
    this.blocks = footer.getBlocks();
    this.createdBy = footer.getFileMetaData().getCreatedBy();
  }

  /**
   * Opens a Parquet file on the local file system.
   *
   * @param file The Parquet file
   * @return An open source; close it when done
   * @throws IOException If the file cannot be opened or its footer is corrupt
   */
  public static ParquetColumnSource open(java.nio.file.Path file) throws IOException {
    return open(file.toAbsolutePath().toString(), new Configuration());
  }

  /**
   * Opens a Parquet file through the Hadoop file system layer.
   *
   * @param path Hadoop path of the file
   * @param conf Hadoop configuration
   * @return An open source; close it when done
   * @throws IOException If the file cannot be opened or its footer is corrupt
   */
  public static ParquetColumnSource open(String path, Configuration conf) throws IOException {
    HadoopInputFile inputFile = HadoopInputFile.fromPath(new Path(path), conf);
    ParquetFileReader reader = ParquetFileReader.open(inputFile);
    ParquetColumnSource source = new ParquetColumnSource(path, inputFile.getLength(), reader);
    LOGGER.debug("Opened {} with {} row groups and {} columns",
        path, source.blocks.size(), source.columns.size());
    return source;
  }

  @Override public String getFilePath() {
    return filePath;
  }

  @Override public long getFileSize() {
    return fileSize;
  }

  @Override public int getRowGroupCount() {
    return blocks.size();
  }

  @Override public int getColumnCount(int rowGroup) {
    Preconditions.checkElementIndex(rowGroup, blocks.size(), "rowGroup");
    return columns.size();
  }

  @Override public String getColumnName(int rowGroup, int column) {
    return String.join(".", descriptor(rowGroup, column).getPath());
  }

  @Override public ValueType getColumnType(int rowGroup, int column) {
    return mapType(descriptor(rowGroup, column).getPrimitiveType());
  }

  @Override public long getRowCount(int rowGroup) {
    Preconditions.checkElementIndex(rowGroup, blocks.size(), "rowGroup");
    return blocks.get(rowGroup).getRowCount();
  }

  @Override public ColumnBuffer readColumn(int rowGroup, int column) throws IOException {
    descriptor(rowGroup, column);
    if (rowGroup != cachedRowGroup) {
      cachedBuffers = decodeRowGroup(rowGroup);
      cachedRowGroup = rowGroup;
    }
    return cachedBuffers[column];
  }

  @Override public void close() throws IOException {
    cachedBuffers = null;
    reader.close();
  }

  private ColumnDescriptor descriptor(int rowGroup, int column) {
    Preconditions.checkElementIndex(rowGroup, blocks.size(), "rowGroup");
    Preconditions.checkElementIndex(column, columns.size(), "column");
    return columns.get(column);
  }

  private ColumnBuffer[] decodeRowGroup(int rowGroup) throws IOException {
    PageReadStore pages = reader.readRowGroup(rowGroup);
    if (pages == null) {
      throw new IOException("Row group " + rowGroup + " of " + filePath + " has no pages");
    }
    ColumnReadStoreImpl store = new ColumnReadStoreImpl(pages,
        new GroupRecordConverter(schema).getRootConverter(), schema, createdBy);

    ColumnBuffer[] buffers = new ColumnBuffer[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      ColumnDescriptor descriptor = columns.get(i);
      buffers[i] = decodeColumn(descriptor, store.getColumnReader(descriptor));
    }
    LOGGER.debug("Decoded row group {} of {} ({} rows)",
        rowGroup, filePath, pages.getRowCount());
    return buffers;
  }

  private ColumnBuffer decodeColumn(ColumnDescriptor descriptor, ColumnReader columnReader)
      throws IOException {
    long total = columnReader.getTotalValueCount();
    if (total > Integer.MAX_VALUE) {
      throw new IOException("Column " + Arrays.toString(descriptor.getPath())
          + " holds too many values to decode: " + total);
    }
    int count = (int) total;
    int maxDefinition = descriptor.getMaxDefinitionLevel();
    PrimitiveType type = descriptor.getPrimitiveType();

    switch (type.getPrimitiveTypeName()) {
    case BOOLEAN: {
      boolean[] values = new boolean[count];
      int n = 0;
      for (int i = 0; i < count; i++) {
        if (columnReader.getCurrentDefinitionLevel() == maxDefinition) {
          values[n++] = columnReader.getBoolean();
        }
        columnReader.consume();
      }
      return ColumnBuffer.ofBooleans(n == count ? values : Arrays.copyOf(values, n));
    }
    case INT32: {
      int[] values = new int[count];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getInteger() : Integer.MIN_VALUE;
        columnReader.consume();
      }
      return ColumnBuffer.ofInts(values);
    }
    case INT64: {
      long multiplier = timestampMultiplier(type);
      long scale = multiplier > 0 ? multiplier : 1L;
      long[] values = new long[count];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getLong() * scale : Long.MIN_VALUE;
        columnReader.consume();
      }
      return multiplier > 0 ? ColumnBuffer.ofTimestamps(values) : ColumnBuffer.ofLongs(values);
    }
    case INT96: {
      long[] values = new long[count];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? int96ToEpochNanos(columnReader.getBinary().getBytes()) : Long.MIN_VALUE;
        columnReader.consume();
      }
      return ColumnBuffer.ofTimestamps(values);
    }
    case FLOAT: {
      float[] values = new float[count];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getFloat() : Float.NaN;
        columnReader.consume();
      }
      return ColumnBuffer.ofFloats(values);
    }
    case DOUBLE: {
      double[] values = new double[count];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getDouble() : Double.NaN;
        columnReader.consume();
      }
      return ColumnBuffer.ofDoubles(values);
    }
    case BINARY: {
      byte[][] values = new byte[count][];
      for (int i = 0; i < count; i++) {
        values[i] = columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getBinary().getBytes() : new byte[0];
        columnReader.consume();
      }
      return ColumnBuffer.ofBinary(values);
    }
    case FIXED_LEN_BYTE_ARRAY: {
      int width = type.getTypeLength();
      List<byte[]> values = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        values.add(columnReader.getCurrentDefinitionLevel() == maxDefinition
            ? columnReader.getBinary().getBytes() : new byte[width]);
        columnReader.consume();
      }
      return ColumnBuffer.ofFixedLength(width, values.toArray(new byte[0][]));
    }
    default:
      LOGGER.warn("Unsupported Parquet type {} for column {} in {}",
          type.getPrimitiveTypeName(), Arrays.toString(descriptor.getPath()), filePath);
      return ColumnBuffer.empty(ValueType.UNKNOWN);
    }
  }

  /**
   * Maps a Parquet primitive type to the value type exposed by this source.
   */
  static ValueType mapType(PrimitiveType type) {
    switch (type.getPrimitiveTypeName()) {
    case BOOLEAN:
      return ValueType.BOOLEAN;
    case INT32:
      return ValueType.INT32;
    case INT64:
      return timestampMultiplier(type) > 0 ? ValueType.TIMESTAMP : ValueType.INT64;
    case INT96:
      return ValueType.TIMESTAMP;
    case FLOAT:
      return ValueType.FLOAT;
    case DOUBLE:
      return ValueType.DOUBLE;
    case BINARY:
      return ValueType.BYTE_ARRAY;
    case FIXED_LEN_BYTE_ARRAY:
      return ValueType.FIXED_LEN_BYTE_ARRAY;
    default:
      return ValueType.UNKNOWN;
    }
  }

  /**
   * Returns the factor that converts an annotated INT64 timestamp to
   * nanoseconds, or 0 if the column is not a timestamp.
   */
  private static long timestampMultiplier(PrimitiveType type) {
    LogicalTypeAnnotation annotation = type.getLogicalTypeAnnotation();
    if (!(annotation instanceof LogicalTypeAnnotation.TimestampLogicalTypeAnnotation)) {
      return 0;
    }
    switch (((LogicalTypeAnnotation.TimestampLogicalTypeAnnotation) annotation).getUnit()) {
    case MILLIS:
      return 1_000_000L;
    case MICROS:
      return 1_000L;
    default:
      return 1L;
    }
  }

  /**
   * Decodes a Parquet INT96 timestamp: eight little-endian bytes of
   * nanoseconds within the day followed by a four-byte Julian day.
   */
  static long int96ToEpochNanos(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    long nanosOfDay = buffer.getLong();
    long julianDay = buffer.getInt();
    return (julianDay - JULIAN_EPOCH_DAY) * NANOS_PER_DAY + nanosOfDay;
  }
}
