/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import static io.airbyte.commons.json.JsonSchemas.ALL_OF_TYPE;
import static io.airbyte.commons.json.JsonSchemas.ANY_OF_TYPE;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_CONST_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ENUM_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ITEMS_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_REQUIRED_KEY;
import static io.airbyte.commons.json.JsonSchemas.ONE_OF_TYPE;

import com.fasterxml.jackson.databind.JsonNode;
import io.airbyte.commons.json.JsonSchemas;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

/**
 * Decides whether a configuration subtree structurally matches a schema branch. Only the keywords
 * that tell branches apart are checked: type, const, enum, required, additionalProperties and the
 * nested properties, items and composition. Value constraints such as patterns or bounds are
 * ignored.
 * <p>
 * A schema node marked secret matches any value, so that a branch is selected identically for a raw
 * configuration and for its obfuscated form.
 */
final class SchemaBranchMatcher {

  private SchemaBranchMatcher() {}

  static boolean matches(final JsonNode root, final JsonNode value, final JsonNode rawSchema, final String path) {
    final JsonNode schema = SchemaAnnotationScanner.resolveRefs(root, rawSchema, path);
    if (schema.isBoolean()) {
      return schema.asBoolean();
    }
    if (!schema.isObject() || JsonSchemas.isSecret(schema)) {
      return true;
    }

    if (schema.has(JSON_SCHEMA_CONST_KEY) && !schema.get(JSON_SCHEMA_CONST_KEY).equals(value)) {
      return false;
    }
    if (schema.has(JSON_SCHEMA_ENUM_KEY) && !contains(schema.get(JSON_SCHEMA_ENUM_KEY), value)) {
      return false;
    }

    final List<String> types = JsonSchemas.getTypes(schema);
    if (!types.isEmpty() && types.stream().noneMatch(type -> isOfType(value, type))) {
      return false;
    }

    if (value.isObject() && !matchesObject(root, value, schema, path)) {
      return false;
    }

    final JsonNode items = schema.get(JSON_SCHEMA_ITEMS_KEY);
    if (value.isArray() && items != null && items.isObject()) {
      for (final JsonNode element : value) {
        if (!matches(root, element, items, path + "[*]")) {
          return false;
        }
      }
    }

    return matchesComposition(root, value, schema, path);
  }

  private static boolean matchesObject(final JsonNode root, final JsonNode value, final JsonNode schema, final String path) {
    final JsonNode required = schema.get(JSON_SCHEMA_REQUIRED_KEY);
    if (required != null && required.isArray()) {
      for (final JsonNode name : required) {
        if (!value.has(name.asText())) {
          return false;
        }
      }
    }

    final JsonNode properties = schema.path(JSON_SCHEMA_PROPERTIES_KEY);
    final JsonNode additionalProperties = schema.get(JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY);
    final Iterator<Entry<String, JsonNode>> fields = value.fields();
    while (fields.hasNext()) {
      final Entry<String, JsonNode> field = fields.next();
      final String childPath = SchemaAnnotationScanner.appendKey(path, field.getKey());
      if (properties.has(field.getKey())) {
        if (!matches(root, field.getValue(), properties.get(field.getKey()), childPath)) {
          return false;
        }
      } else if (additionalProperties != null) {
        if (additionalProperties.isBoolean() && !additionalProperties.asBoolean()) {
          return false;
        }
        if (additionalProperties.isObject() && !matches(root, field.getValue(), additionalProperties, childPath)) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean matchesComposition(final JsonNode root, final JsonNode value, final JsonNode schema, final String path) {
    final JsonNode allOf = schema.get(ALL_OF_TYPE);
    if (allOf != null) {
      for (final JsonNode branch : allOf) {
        if (!matches(root, value, branch, path)) {
          return false;
        }
      }
    }
    for (final String keyword : List.of(ONE_OF_TYPE, ANY_OF_TYPE)) {
      final JsonNode branches = schema.get(keyword);
      if (branches != null && branches.size() > 0 && !anyMatches(root, value, branches, path)) {
        return false;
      }
    }
    return true;
  }

  private static boolean anyMatches(final JsonNode root, final JsonNode value, final JsonNode branches, final String path) {
    for (final JsonNode branch : branches) {
      if (matches(root, value, branch, path)) {
        return true;
      }
    }
    return false;
  }

  private static boolean contains(final JsonNode candidates, final JsonNode value) {
    for (final JsonNode candidate : candidates) {
      if (candidate.equals(value)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isOfType(final JsonNode value, final String type) {
    return switch (type) {
      case JsonSchemas.OBJECT_TYPE -> value.isObject();
      case JsonSchemas.ARRAY_TYPE -> value.isArray();
      case JsonSchemas.STRING_TYPE -> value.isTextual();
      case JsonSchemas.INTEGER_TYPE -> value.isIntegralNumber() || (value.isNumber() && value.canConvertToExactIntegral());
      case JsonSchemas.NUMBER_TYPE -> value.isNumber();
      case JsonSchemas.BOOLEAN_TYPE -> value.isBoolean();
      case JsonSchemas.NULL_TYPE -> value.isNull();
      default -> false;
    };
  }

}
