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
package org.apache.calcite.adapter.profile.metadata;

import org.apache.calcite.adapter.profile.custom.CustomMetadataItem;
import org.apache.calcite.adapter.profile.custom.ResultMatrix;
import org.apache.calcite.adapter.profile.source.ValueType;
import org.apache.calcite.adapter.profile.statistics.CategoricalProfile;
import org.apache.calcite.adapter.profile.statistics.ColumnProfile;
import org.apache.calcite.adapter.profile.statistics.FrequencyEntry;
import org.apache.calcite.adapter.profile.statistics.NumericProfile;
import org.apache.calcite.adapter.profile.statistics.StatisticalFamily;
import org.apache.calcite.adapter.profile.statistics.StringProfile;
import org.apache.calcite.adapter.profile.statistics.TimestampProfile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes metadata trees.
 *
 * <p>The tree is stored as JSON. The binary form wraps the JSON payload in
 * an envelope: the four ASCII bytes {@code IPMD}, a big-endian int format
 * version, a big-endian int payload length, then the UTF-8 payload. Files
 * ending in {@code .meta} use the binary form, all others plain JSON.
 *
 * <p>Loading is all-or-nothing: any structural problem raises
 * {@link MetadataFormatException}.
 */
public final class MetadataSerializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataSerializer.class);

  /** Extension of binary metadata files. */
  public static final String META_EXTENSION = ".meta";

  static final byte[] MAGIC = {'I', 'P', 'M', 'D'};
  static final int FORMAT_VERSION = 1;
  private static final int HEADER_LENGTH = MAGIC.length + 8;

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
      .build();

  private MetadataSerializer() {
  }

  /** Converts a tree to its JSON object form. */
  public static ObjectNode toJsonNode(FileNode file) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("format_version", FORMAT_VERSION);
    root.put("file_path", file.getFilePath());
    root.put("file_size", file.getFileSize());
    root.put("created_at", file.getCreatedAt());
    root.put("row_group_count", file.getRowGroupCount());
    root.put("column_count", file.getColumnCount());
    root.put("total_row_count", file.getTotalRowCount());
    root.set("summary", writeSummary(file.getSummary()));
    root.set("columns", writeColumns(file.getColumns()));

    ArrayNode rowGroups = root.putArray("row_groups");
    for (RowGroupNode rowGroup : file.getRowGroups()) {
      ObjectNode node = rowGroups.addObject();
      node.put("index", rowGroup.getIndex());
      node.put("row_count", rowGroup.getRowCount());
      node.set("summary", writeSummary(rowGroup.getSummary()));
      node.set("columns", writeColumns(rowGroup.getColumns()));
    }

    ArrayNode custom = root.putArray("custom_metadata");
    for (CustomMetadataItem item : file.getCustomMetadata()) {
      ObjectNode node = custom.addObject();
      node.put("name", item.getName());
      if (item.getPredicateId() != null) {
        node.put("predicate", item.getPredicateId());
      }
      node.put("query", item.getQuery());
      node.put("result_matrix", item.getResultMatrix().format());
    }
    return root;
  }

  /** Serializes a tree to pretty-printed JSON. */
  public static String toJson(FileNode file) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(file));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize metadata of " + file.getFilePath(), e);
    }
  }

  /**
   * Parses a tree from JSON.
   *
   * @throws MetadataFormatException if the text is not a valid metadata tree
   */
  public static FileNode fromJson(String json) throws MetadataFormatException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new MetadataFormatException("Metadata is not valid JSON: " + e.getOriginalMessage(),
          e);
    }
    return readFile(root);
  }

  /** Serializes a tree to the binary envelope form. */
  public static byte[] toBytes(FileNode file) {
    byte[] payload;
    try {
      payload = MAPPER.writeValueAsBytes(toJsonNode(file));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize metadata of " + file.getFilePath(), e);
    }
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
    buffer.put(MAGIC).putInt(FORMAT_VERSION).putInt(payload.length).put(payload);
    return buffer.array();
  }

  /**
   * Parses a tree from the binary envelope form.
   *
   * @throws MetadataFormatException if the bytes are not a valid envelope
   *     holding a valid tree
   */
  public static FileNode fromBytes(byte[] bytes) throws MetadataFormatException {
    if (bytes.length < HEADER_LENGTH) {
      throw new MetadataFormatException("Metadata is truncated: " + bytes.length
          + " bytes is shorter than the header");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    byte[] magic = new byte[MAGIC.length];
    buffer.get(magic);
    if (!Arrays.equals(magic, MAGIC)) {
      throw new MetadataFormatException("Not a metadata file: bad magic bytes");
    }
    int version = buffer.getInt();
    if (version != FORMAT_VERSION) {
      throw new MetadataFormatException("Unsupported metadata format version " + version);
    }
    int length = buffer.getInt();
    if (length < 0 || length != buffer.remaining()) {
      throw new MetadataFormatException("Metadata payload length " + length
          + " does not match the " + buffer.remaining() + " bytes present");
    }
    return fromJson(new String(bytes, HEADER_LENGTH, length, StandardCharsets.UTF_8));
  }

  /**
   * Writes a tree to a file, in binary form if the name ends in
   * {@code .meta}, otherwise as JSON.
   */
  public static void save(FileNode file, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (isBinary(path)) {
      Files.write(path, toBytes(file));
    } else {
      Files.write(path, toJson(file).getBytes(StandardCharsets.UTF_8));
    }
    LOGGER.debug("Saved metadata of {} to {}", file.getFilePath(), path);
  }

  /**
   * Reads a tree from a file written by {@link #save}.
   *
   * @throws MetadataFormatException if the file content is corrupt
   * @throws IOException if the file cannot be read
   */
  public static FileNode load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    try {
      return isBinary(path)
          ? fromBytes(bytes)
          : fromJson(new String(bytes, StandardCharsets.UTF_8));
    } catch (MetadataFormatException e) {
      throw new MetadataFormatException(path + ": " + e.getMessage(), e);
    }
  }

  static boolean isBinary(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(META_EXTENSION);
  }

  // Writing

  private static ArrayNode writeColumns(List<ColumnNode> columns) {
    ArrayNode array = MAPPER.createArrayNode();
    for (ColumnNode column : columns) {
      ObjectNode node = array.addObject();
      node.put("index", column.getIndex());
      node.put("name", column.getName());
      node.put("type", column.getValueType().name());
      ColumnProfile profile = column.getProfile();
      if (profile == null) {
        node.putNull("profile");
      } else {
        node.set("profile", writeProfile(profile));
      }
    }
    return array;
  }

  private static ObjectNode writeSummary(ProfileSummary summary) {
    ObjectNode node = MAPPER.createObjectNode();
    for (Map.Entry<StatisticalFamily, ColumnProfile> e : summary.getProfiles().entrySet()) {
      node.set(e.getKey().key(), writeProfile(e.getValue()));
    }
    return node;
  }

  /** Writes a profile; the "family" field selects the variant on reading. */
  static ObjectNode writeProfile(ColumnProfile profile) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("family", profile.getFamily().key());
    profile.accept(new ColumnProfile.Visitor<Void>() {
      @Override public Void visit(TimestampProfile p) {
        node.put("min", p.getMin());
        node.put("max", p.getMax());
        node.put("value_count", p.getValueCount());
        node.put("null_count", p.getNullCount());
        return null;
      }

      @Override public Void visit(NumericProfile p) {
        node.put("min", p.getMin());
        node.put("max", p.getMax());
        node.put("mean", p.getMean());
        node.put("mode_value", p.getModeValue());
        node.put("mode_count", p.getModeCount());
        node.put("value_count", p.getValueCount());
        node.put("null_count", p.getNullCount());
        return null;
      }

      @Override public Void visit(StringProfile p) {
        node.set("top_k_frequent", writeEntries(p.getTopFrequent()));
        node.set("top_k_special", writeEntries(p.getTopSpecial()));
        node.put("min_len", p.getMinLength());
        node.put("max_len", p.getMaxLength());
        node.put("total_len", p.getTotalLength());
        node.put("avg_len", p.getAverageLength());
        node.put("total_count", p.getTotalCount());
        node.put("null_count", p.getNullCount());
        return null;
      }

      @Override public Void visit(CategoricalProfile p) {
        node.set("top_k_categories", writeEntries(p.getTopCategories()));
        node.put("distinct_category_count", p.getDistinctCategoryCount());
        node.put("total_value_count", p.getTotalValueCount());
        return null;
      }
    });
    return node;
  }

  private static ArrayNode writeEntries(List<FrequencyEntry> entries) {
    ArrayNode array = MAPPER.createArrayNode();
    for (FrequencyEntry entry : entries) {
      array.addObject().put("value", entry.getValue()).put("count", entry.getCount());
    }
    return array;
  }

  // Reading

  private static FileNode readFile(JsonNode root) throws MetadataFormatException {
    if (root == null || !root.isObject()) {
      throw new MetadataFormatException("Metadata root is not a JSON object");
    }
    int version = required(root, "format_version").asInt();
    if (version != FORMAT_VERSION) {
      throw new MetadataFormatException("Unsupported metadata format version " + version);
    }

    ImmutableList.Builder<RowGroupNode> rowGroups = ImmutableList.builder();
    int position = 0;
    for (JsonNode node : array(root, "row_groups")) {
      rowGroups.add(
          new RowGroupNode(index(node, position++, "Row group"),
              required(node, "row_count").asLong(),
              readColumns(array(node, "columns")),
              readSummary(required(node, "summary"))));
    }

    ImmutableList.Builder<CustomMetadataItem> custom = ImmutableList.builder();
    for (JsonNode node : array(root, "custom_metadata")) {
      JsonNode predicate = node.get("predicate");
      ResultMatrix matrix;
      try {
        matrix = ResultMatrix.parse(text(node, "result_matrix"));
      } catch (IllegalArgumentException e) {
        throw new MetadataFormatException(e.getMessage(), e);
      }
      custom.add(
          new CustomMetadataItem(text(node, "name"),
              predicate == null || predicate.isNull() ? null : predicate.asText(),
              text(node, "query"), matrix));
    }

    return new FileNode(text(root, "file_path"),
        required(root, "file_size").asLong(),
        required(root, "created_at").asLong(),
        rowGroups.build(),
        readColumns(array(root, "columns")),
        readSummary(required(root, "summary")),
        custom.build());
  }

  private static List<ColumnNode> readColumns(JsonNode array) throws MetadataFormatException {
    ImmutableList.Builder<ColumnNode> columns = ImmutableList.builder();
    int position = 0;
    for (JsonNode node : array) {
      ValueType type;
      try {
        type = ValueType.valueOf(text(node, "type"));
      } catch (IllegalArgumentException e) {
        throw new MetadataFormatException("Unknown value type: " + node.get("type"), e);
      }
      JsonNode profile = node.get("profile");
      columns.add(
          new ColumnNode(index(node, position++, "Column"), text(node, "name"), type,
              profile == null || profile.isNull() ? null : readProfile(profile)));
    }
    return columns.build();
  }

  /** Reads a node's {@code index}, which must equal its position in its array. */
  private static int index(JsonNode node, int position, String what)
      throws MetadataFormatException {
    JsonNode index = required(node, "index");
    if (!index.canConvertToInt() || index.asInt() != position) {
      throw new MetadataFormatException(what + " at position " + position
          + " has index " + index);
    }
    return position;
  }

  private static ProfileSummary readSummary(JsonNode node) throws MetadataFormatException {
    if (!node.isObject()) {
      throw new MetadataFormatException("Summary is not a JSON object: " + node);
    }
    Map<StatisticalFamily, ColumnProfile> profiles = new EnumMap<>(StatisticalFamily.class);
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      ColumnProfile profile = readProfile(field.getValue());
      if (!profile.getFamily().key().equals(field.getKey())) {
        throw new MetadataFormatException("Summary entry '" + field.getKey()
            + "' holds a " + profile.getFamily().key() + " profile");
      }
      profiles.put(profile.getFamily(), profile);
    }
    return ProfileSummary.of(profiles);
  }

  static ColumnProfile readProfile(JsonNode node) throws MetadataFormatException {
    StatisticalFamily family;
    try {
      family = StatisticalFamily.fromKey(text(node, "family"));
    } catch (IllegalArgumentException e) {
      throw new MetadataFormatException(e.getMessage(), e);
    }
    switch (family) {
    case TIMESTAMP:
      return new TimestampProfile(required(node, "min").asLong(),
          required(node, "max").asLong(),
          required(node, "value_count").asLong(),
          required(node, "null_count").asLong());
    case NUMERIC:
      return new NumericProfile(required(node, "min").asDouble(),
          required(node, "max").asDouble(),
          required(node, "mean").asDouble(),
          required(node, "mode_value").asDouble(),
          required(node, "mode_count").asLong(),
          required(node, "value_count").asLong(),
          required(node, "null_count").asLong());
    case STRING:
      return new StringProfile(readEntries(array(node, "top_k_frequent")),
          readEntries(array(node, "top_k_special")),
          required(node, "min_len").asLong(),
          required(node, "max_len").asLong(),
          required(node, "total_len").asLong(),
          required(node, "total_count").asLong(),
          required(node, "null_count").asLong());
    case CATEGORICAL:
      return new CategoricalProfile(readEntries(array(node, "top_k_categories")),
          required(node, "distinct_category_count").asLong(),
          required(node, "total_value_count").asLong());
    default:
      throw new AssertionError(family);
    }
  }

  private static List<FrequencyEntry> readEntries(JsonNode array)
      throws MetadataFormatException {
    ImmutableList.Builder<FrequencyEntry> entries = ImmutableList.builder();
    for (JsonNode node : array) {
      long count = required(node, "count").asLong();
      if (count < 0) {
        throw new MetadataFormatException("Negative count in frequency entry: " + node);
      }
      entries.add(new FrequencyEntry(text(node, "value"), count));
    }
    return entries.build();
  }

  private static JsonNode required(JsonNode node, String field) throws MetadataFormatException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new MetadataFormatException("Missing field '" + field + "' in " + abbreviate(node));
    }
    return value;
  }

  private static String text(JsonNode node, String field) throws MetadataFormatException {
    JsonNode value = required(node, field);
    if (!value.isTextual()) {
      throw new MetadataFormatException("Field '" + field + "' is not a string in "
          + abbreviate(node));
    }
    return value.asText();
  }

  private static JsonNode array(JsonNode node, String field) throws MetadataFormatException {
    JsonNode value = required(node, field);
    if (!value.isArray()) {
      throw new MetadataFormatException("Field '" + field + "' is not an array in "
          + abbreviate(node));
    }
    return value;
  }

  private static String abbreviate(JsonNode node) {
    String s = node.toString();
    return s.length() <= 80 ? s : s.substring(0, 77) + "...";
  }
}
