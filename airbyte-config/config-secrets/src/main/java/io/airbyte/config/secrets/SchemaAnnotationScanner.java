/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import static io.airbyte.commons.json.JsonSchemas.COMPOSITE_KEYWORDS;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ITEMS_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_REF_KEY;

import com.fasterxml.jackson.databind.JsonNode;
import io.airbyte.commons.json.JsonSchemas;
import io.airbyte.config.secrets.errors.SchemaException;
import jakarta.inject.Singleton;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds the properties of a connector schema that are annotated with {@code airbyte_secret: true}.
 * <p>
 * Paths are JSONPath strings rooted at {@code $}: {@code .key} for properties, {@code [*]} for array
 * items and {@code .*} for additional properties. Every branch of {@code oneOf}, {@code anyOf} and
 * {@code allOf} is scanned and the results are unioned, since a configuration may match any of them.
 */
@Singleton
public class SchemaAnnotationScanner {

  private static final Pattern SIMPLE_KEY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  /**
   * Scan a schema for secret properties.
   *
   * @param schema connector schema
   * @return JSONPaths of every secret property
   * @throws SchemaException if the schema is malformed
   */
  public Set<String> scan(final JsonNode schema) {
    if (schema == null || !schema.isObject()) {
      throw new SchemaException("Connector schema must be a JSON object");
    }
    final Set<String> paths = new LinkedHashSet<>();
    scan(schema, schema, "$", paths, new ArrayDeque<>());
    return Collections.unmodifiableSet(paths);
  }

  /**
   * Scan a sub-schema whose {@code $ref}s resolve against {@code root}. Paths are relative to the
   * sub-schema.
   *
   * @param root root schema holding the definitions
   * @param node sub-schema to scan
   * @return JSONPaths of every secret property under the sub-schema
   */
  Set<String> scan(final JsonNode root, final JsonNode node) {
    final Set<String> paths = new LinkedHashSet<>();
    scan(root, node, "$", paths, new ArrayDeque<>());
    return paths;
  }

  /**
   * Whether the schema declares at least one secret property.
   *
   * @param schema connector schema
   * @return true if {@link #scan(JsonNode)} is not empty
   */
  public boolean hasSecrets(final JsonNode schema) {
    return !scan(schema).isEmpty();
  }

  /**
   * Follow a chain of {@code $ref} until a concrete schema node is reached.
   *
   * @param root root schema holding the definitions
   * @param node node that may be a reference
   * @param path location, for error messages
   * @return the concrete node
   * @throws SchemaException if a reference cannot be resolved or the chain loops
   */
  static JsonNode resolveRefs(final JsonNode root, final JsonNode node, final String path) {
    JsonNode current = node;
    final Set<String> chain = new HashSet<>();
    while (current.isObject() && current.has(JSON_SCHEMA_REF_KEY)) {
      final String ref = current.get(JSON_SCHEMA_REF_KEY).asText();
      if (!chain.add(ref)) {
        throw new SchemaException(String.format("Cyclic $ref %s at %s", ref, path));
      }
      current = JsonSchemas.resolveLocalRef(root, ref)
          .orElseThrow(() -> new SchemaException(String.format("Unresolvable $ref %s at %s", ref, path)));
    }
    return current;
  }

  static String appendKey(final String path, final String key) {
    if (SIMPLE_KEY.matcher(key).matches()) {
      return path + "." + key;
    }
    return path + "['" + key.replace("'", "\\'") + "']";
  }

  private void scan(final JsonNode root, final JsonNode rawNode, final String path, final Set<String> paths, final Deque<String> expandedRefs) {
    final String ref = rawNode.isObject() && rawNode.has(JSON_SCHEMA_REF_KEY) ? rawNode.get(JSON_SCHEMA_REF_KEY).asText() : null;
    if (ref != null && expandedRefs.contains(ref)) {
      // recursive definition, already scanned higher up
      return;
    }
    final JsonNode node = resolveRefs(root, rawNode, path);
    if (node.isBoolean()) {
      return;
    }
    if (!node.isObject()) {
      throw new SchemaException(String.format("Schema node at %s must be an object, found %s", path, node.getNodeType()));
    }
    validateTypes(node, path);

    if (JsonSchemas.isSecret(node)) {
      paths.add(path);
      return;
    }

    if (ref != null) {
      expandedRefs.push(ref);
    }
    try {
      scanChildren(root, node, path, paths, expandedRefs);
    } finally {
      if (ref != null) {
        expandedRefs.pop();
      }
    }
  }

  private void scanChildren(final JsonNode root, final JsonNode node, final String path, final Set<String> paths, final Deque<String> expandedRefs) {
    final JsonNode properties = node.get(JSON_SCHEMA_PROPERTIES_KEY);
    if (properties != null) {
      if (!properties.isObject()) {
        throw new SchemaException(String.format("'properties' at %s must be an object", path));
      }
      final Iterator<Entry<String, JsonNode>> fields = properties.fields();
      while (fields.hasNext()) {
        final Entry<String, JsonNode> field = fields.next();
        scan(root, field.getValue(), appendKey(path, field.getKey()), paths, expandedRefs);
      }
    }

    final JsonNode additionalProperties = node.get(JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY);
    if (additionalProperties != null && additionalProperties.isObject()) {
      scan(root, additionalProperties, path + ".*", paths, expandedRefs);
    }

    final JsonNode items = node.get(JSON_SCHEMA_ITEMS_KEY);
    if (items != null) {
      if (items.isObject()) {
        scan(root, items, path + "[*]", paths, expandedRefs);
      } else if (items.isArray()) {
        for (int i = 0; i < items.size(); i++) {
          scan(root, items.get(i), path + "[" + i + "]", paths, expandedRefs);
        }
      } else if (!items.isBoolean()) {
        throw new SchemaException(String.format("'items' at %s must be an object or an array", path));
      }
    }

    for (final String keyword : COMPOSITE_KEYWORDS) {
      final JsonNode branches = node.get(keyword);
      if (branches == null) {
        continue;
      }
      if (!branches.isArray()) {
        throw new SchemaException(String.format("'%s' at %s must be an array", keyword, path));
      }
      for (final JsonNode branch : branches) {
        scan(root, branch, path, paths, expandedRefs);
      }
    }
  }

  private static void validateTypes(final JsonNode node, final String path) {
    final List<String> types;
    try {
      types = JsonSchemas.getTypes(node);
    } catch (final IllegalArgumentException e) {
      throw new SchemaException(String.format("Invalid type at %s: %s", path, e.getMessage()));
    }
    for (final String type : types) {
      if (!JsonSchemas.PRIMITIVE_AND_CONTAINER_TYPES.contains(type)) {
        throw new SchemaException(String.format("Unknown type '%s' at %s", type, path));
      }
    }
  }

}
