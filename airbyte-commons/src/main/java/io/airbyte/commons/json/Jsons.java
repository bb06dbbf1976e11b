/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.commons.json;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.commons.jackson.MoreMappers;
import java.io.IOException;
import java.util.Optional;

/**
 * Shared code for operating on JSON in java.
 */
@SuppressWarnings({"PMD.AvoidReassigningParameters", "PMD.AvoidCatchingThrowable"})
public class Jsons {

  private static final StreamReadConstraints STREAM_READ_CONSTRAINTS = StreamReadConstraints
      .builder()
      .maxStringLength(Integer.MAX_VALUE)
      .build();

  // Object Mapper is thread-safe
  private static final ObjectMapper OBJECT_MAPPER = MoreMappers.initMapper();

  static {
    OBJECT_MAPPER.getFactory().setStreamReadConstraints(STREAM_READ_CONSTRAINTS);
  }

  /**
   * Serialize an object to a JSON string.
   *
   * @param object to serialize
   * @param <T> type of object
   * @return object as JSON string
   */
  public static <T> String serialize(final T object) {
    try {
      return OBJECT_MAPPER.writeValueAsString(object);
    } catch (final JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Deserialize a JSON string to a {@link JsonNode}.
   *
   * @param jsonString to deserialize
   * @return JSON as JsonNode
   */
  public static JsonNode deserialize(final String jsonString) {
    try {
      return OBJECT_MAPPER.readTree(jsonString);
    } catch (final IOException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Deserialize a JSON string to a {@link JsonNode}. If not possible, return empty optional.
   *
   * @param jsonString to deserialize
   * @return JSON as JsonNode wrapped in an Optional. If deserialization fails, returns an empty
   *         optional.
   */
  public static Optional<JsonNode> tryDeserialize(final String jsonString) {
    try {
      return Optional.ofNullable(OBJECT_MAPPER.readTree(jsonString));
    } catch (final Throwable e) {
      return Optional.empty();
    }
  }

  /**
   * Create an empty Jackson object node.
   *
   * @return an empty Jackson object node
   */
  public static ObjectNode objectNode() {
    return OBJECT_MAPPER.createObjectNode();
  }

  /**
   * Create an empty Jackson array node.
   *
   * @return an empty Jackson array node
   */
  public static ArrayNode arrayNode() {
    return OBJECT_MAPPER.createArrayNode();
  }

  /**
   * Get the {@link JsonNode} at a location in a {@link JsonNode} object. Empty optional if there is
   * no json to navigate or no value at the specified location.
   *
   * @param json object to navigate, may be null
   * @param pointer location of the value
   * @return value at the location wrapped in an optional. if no value there, empty optional.
   */
  public static Optional<JsonNode> getOptional(final JsonNode json, final JsonPointer pointer) {
    if (json == null) {
      return Optional.empty();
    }
    final JsonNode value = json.at(pointer);
    return value.isMissingNode() ? Optional.empty() : Optional.of(value);
  }

}
