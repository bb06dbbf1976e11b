/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.commons.json;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared code for interacting with JSON schemas.
 */
public class JsonSchemas {

  public static final String JSON_SCHEMA_TYPE_KEY = "type";
  public static final String JSON_SCHEMA_PROPERTIES_KEY = "properties";
  public static final String JSON_SCHEMA_ITEMS_KEY = "items";
  public static final String JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY = "additionalProperties";
  public static final String JSON_SCHEMA_REQUIRED_KEY = "required";
  public static final String JSON_SCHEMA_CONST_KEY = "const";
  public static final String JSON_SCHEMA_ENUM_KEY = "enum";
  public static final String JSON_SCHEMA_REF_KEY = "$ref";

  public static final String ONE_OF_TYPE = "oneOf";
  public static final String ANY_OF_TYPE = "anyOf";
  public static final String ALL_OF_TYPE = "allOf";

  public static final String OBJECT_TYPE = "object";
  public static final String ARRAY_TYPE = "array";
  public static final String STRING_TYPE = "string";
  public static final String NUMBER_TYPE = "number";
  public static final String INTEGER_TYPE = "integer";
  public static final String BOOLEAN_TYPE = "boolean";
  public static final String NULL_TYPE = "null";

  public static final Set<String> PRIMITIVE_AND_CONTAINER_TYPES =
      Set.of(OBJECT_TYPE, ARRAY_TYPE, STRING_TYPE, NUMBER_TYPE, INTEGER_TYPE, BOOLEAN_TYPE, NULL_TYPE);

  public static final List<String> COMPOSITE_KEYWORDS = List.of(ONE_OF_TYPE, ANY_OF_TYPE, ALL_OF_TYPE);

  /**
   * Whether a schema node carries the {@code airbyte_secret: true} annotation.
   *
   * @param schema schema node
   * @return true if the node is marked secret
   */
  public static boolean isSecret(final JsonNode schema) {
    return schema != null && schema.path(AirbyteSecretConstants.AIRBYTE_SECRET_FIELD).asBoolean(false);
  }

  /**
   * Get the types declared by a schema node. The {@code type} keyword may be a single string or an
   * array of strings.
   *
   * @param schema schema node
   * @return declared types, empty if the node does not declare a type
   * @throws IllegalArgumentException if the type keyword is neither a string nor an array of
   *         strings
   */
  public static List<String> getTypes(final JsonNode schema) {
    final JsonNode typeNode = schema.get(JSON_SCHEMA_TYPE_KEY);
    final List<String> types = new ArrayList<>();
    if (typeNode == null) {
      return types;
    }
    if (typeNode.isTextual()) {
      types.add(typeNode.asText());
    } else if (typeNode.isArray()) {
      for (final JsonNode element : typeNode) {
        if (!element.isTextual()) {
          throw new IllegalArgumentException("Type array contains a non string element: " + element);
        }
        types.add(element.asText());
      }
    } else {
      throw new IllegalArgumentException("Type must be a string or an array of strings, found: " + typeNode);
    }
    return types;
  }

  /**
   * Resolve a local {@code $ref} (a JSON pointer fragment such as {@code #/definitions/foo}) against
   * the root schema.
   *
   * @param root root schema holding the definitions
   * @param ref value of the $ref keyword
   * @return referenced schema node, empty if the reference is not local or points nowhere
   */
  public static Optional<JsonNode> resolveLocalRef(final JsonNode root, final String ref) {
    if (ref == null || !ref.startsWith("#")) {
      return Optional.empty();
    }
    try {
      final JsonNode target = root.at(JsonPointer.compile(ref.substring(1)));
      return target.isMissingNode() ? Optional.empty() : Optional.of(target);
    } catch (final IllegalArgumentException e) {
      return Optional.empty();
    }
  }

}
