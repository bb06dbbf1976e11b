/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import static io.airbyte.commons.json.JsonSchemas.ALL_OF_TYPE;
import static io.airbyte.commons.json.JsonSchemas.ANY_OF_TYPE;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_ITEMS_KEY;
import static io.airbyte.commons.json.JsonSchemas.JSON_SCHEMA_PROPERTIES_KEY;
import static io.airbyte.commons.json.JsonSchemas.ONE_OF_TYPE;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.airbyte.commons.json.JsonSchemas;
import io.airbyte.commons.json.Jsons;
import io.airbyte.config.secrets.errors.TraversalException;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

/**
 * Walks a configuration together with its schema and hands every value found at a secret location
 * to a {@link SecretLeafVisitor}. The result is a new tree: objects keep their key order, arrays
 * their element order, and everything outside secret locations is copied unchanged. The input is
 * never mutated.
 * <p>
 * {@code allOf} branches all apply. For {@code oneOf} and {@code anyOf} the first branch that
 * structurally matches the subtree (see {@link SchemaBranchMatcher}) is used, so a field is only
 * treated as secret when the branch the configuration actually follows says so.
 */
@Singleton
public class SecretTreeWalker {

  private final SchemaAnnotationScanner schemaAnnotationScanner;

  public SecretTreeWalker(final SchemaAnnotationScanner schemaAnnotationScanner) {
    this.schemaAnnotationScanner = schemaAnnotationScanner;
  }

  /**
   * Transform the secret leaves of a configuration.
   *
   * @param document configuration
   * @param schema connector schema of the configuration
   * @param visitor produces the replacement of each secret leaf
   * @return transformed copy of the configuration
   * @throws io.airbyte.config.secrets.errors.SchemaException if the schema is malformed
   * @throws TraversalException if the configuration does not follow the schema where it matters
   */
  public JsonNode walk(final JsonNode document, final JsonNode schema, final SecretLeafVisitor visitor) {
    if (!schemaAnnotationScanner.hasSecrets(schema)) {
      return document.deepCopy();
    }
    return walkNode(schema, document, List.of(schema), JsonPointer.empty(), visitor);
  }

  private JsonNode walkNode(final JsonNode root,
                            final JsonNode value,
                            final List<JsonNode> schemas,
                            final JsonPointer path,
                            final SecretLeafVisitor visitor) {
    final List<JsonNode> applicable = new ArrayList<>();
    for (final JsonNode schema : schemas) {
      collectApplicableSchemas(root, value, schema, path, applicable);
    }

    final JsonNode secretSchema = applicable.stream().filter(JsonSchemas::isSecret).findFirst().orElse(null);
    if (secretSchema != null) {
      if (value.isNull()) {
        return value;
      }
      return visitor.visit(path, value, secretSchema);
    }

    checkContainerType(root, value, applicable, path);

    if (value.isObject()) {
      return walkObject(root, value, applicable, path, visitor);
    }
    if (value.isArray()) {
      return walkArray(root, value, applicable, path, visitor);
    }
    return value.deepCopy();
  }

  private JsonNode walkObject(final JsonNode root,
                              final JsonNode value,
                              final List<JsonNode> applicable,
                              final JsonPointer path,
                              final SecretLeafVisitor visitor) {
    final ObjectNode output = Jsons.objectNode();
    final Iterator<Entry<String, JsonNode>> fields = value.fields();
    while (fields.hasNext()) {
      final Entry<String, JsonNode> field = fields.next();
      final List<JsonNode> fieldSchemas = new ArrayList<>();
      for (final JsonNode schema : applicable) {
        final JsonNode propertySchema = schema.path(JSON_SCHEMA_PROPERTIES_KEY).get(field.getKey());
        if (propertySchema != null) {
          fieldSchemas.add(propertySchema);
        }
      }
      if (fieldSchemas.isEmpty()) {
        for (final JsonNode schema : applicable) {
          final JsonNode additionalProperties = schema.get(JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY);
          if (additionalProperties != null && additionalProperties.isObject()) {
            fieldSchemas.add(additionalProperties);
          }
        }
      }

      if (fieldSchemas.isEmpty()) {
        output.set(field.getKey(), field.getValue().deepCopy());
      } else {
        output.set(field.getKey(), walkNode(root, field.getValue(), fieldSchemas, path.appendProperty(field.getKey()), visitor));
      }
    }
    return output;
  }

  private JsonNode walkArray(final JsonNode root,
                             final JsonNode value,
                             final List<JsonNode> applicable,
                             final JsonPointer path,
                             final SecretLeafVisitor visitor) {
    final ArrayNode output = Jsons.arrayNode();
    for (int i = 0; i < value.size(); i++) {
      final List<JsonNode> elementSchemas = new ArrayList<>();
      for (final JsonNode schema : applicable) {
        final JsonNode items = schema.get(JSON_SCHEMA_ITEMS_KEY);
        if (items == null) {
          continue;
        }
        if (items.isObject()) {
          elementSchemas.add(items);
        } else if (items.isArray() && i < items.size()) {
          elementSchemas.add(items.get(i));
        }
      }

      if (elementSchemas.isEmpty()) {
        output.add(value.get(i).deepCopy());
      } else {
        output.add(walkNode(root, value.get(i), elementSchemas, path.appendIndex(i), visitor));
      }
    }
    return output;
  }

  /**
   * Resolve references and composition into the flat list of schema nodes that govern a value.
   */
  private void collectApplicableSchemas(final JsonNode root,
                                        final JsonNode value,
                                        final JsonNode rawSchema,
                                        final JsonPointer path,
                                        final List<JsonNode> applicable) {
    final JsonNode schema = SchemaAnnotationScanner.resolveRefs(root, rawSchema, describe(path));
    if (!schema.isObject()) {
      return;
    }
    applicable.add(schema);

    final JsonNode allOf = schema.get(ALL_OF_TYPE);
    if (allOf != null) {
      for (final JsonNode branch : allOf) {
        collectApplicableSchemas(root, value, branch, path, applicable);
      }
    }

    for (final String keyword : List.of(ONE_OF_TYPE, ANY_OF_TYPE)) {
      final JsonNode branches = schema.get(keyword);
      if (branches == null || branches.isEmpty()) {
        continue;
      }
      final JsonNode selected = selectBranch(root, value, branches, path);
      if (selected != null) {
        collectApplicableSchemas(root, value, selected, path, applicable);
      } else if (anyBranchHasSecrets(root, branches)) {
        throw new TraversalException(describe(path), String.format("value matches none of the %s branches", keyword));
      }
    }
  }

  private static JsonNode selectBranch(final JsonNode root, final JsonNode value, final JsonNode branches, final JsonPointer path) {
    for (final JsonNode branch : branches) {
      if (SchemaBranchMatcher.matches(root, value, branch, describe(path))) {
        return branch;
      }
    }
    return null;
  }

  private boolean anyBranchHasSecrets(final JsonNode root, final JsonNode branches) {
    for (final JsonNode branch : branches) {
      if (!schemaAnnotationScanner.scan(root, branch).isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Fail when secrets are declared below this node but the value cannot hold them, since there is
   * then no way to tell which part of the value is secret.
   */
  private void checkContainerType(final JsonNode root, final JsonNode value, final List<JsonNode> applicable, final JsonPointer path) {
    if (value.isNull()) {
      return;
    }
    boolean secretsInProperties = false;
    boolean secretsInItems = false;
    for (final JsonNode schema : applicable) {
      secretsInProperties |= hasSecrets(root, schema.get(JSON_SCHEMA_PROPERTIES_KEY), true)
          || hasSecrets(root, schema.get(JSON_SCHEMA_ADDITIONAL_PROPERTIES_KEY), false);
      secretsInItems |= hasSecrets(root, schema.get(JSON_SCHEMA_ITEMS_KEY), false);
    }

    if (value.isObject() && secretsInItems && !secretsInProperties) {
      throw new TraversalException(describe(path), "expected an array but found an object");
    }
    if (value.isArray() && secretsInProperties && !secretsInItems) {
      throw new TraversalException(describe(path), "expected an object but found an array");
    }
    if (value.isValueNode() && (secretsInProperties || secretsInItems)) {
      throw new TraversalException(describe(path), String.format("expected a container but found %s", value.getNodeType()));
    }
  }

  private boolean hasSecrets(final JsonNode root, final JsonNode node, final boolean isPropertyMap) {
    if (node == null) {
      return false;
    }
    if (isPropertyMap) {
      for (final JsonNode property : node) {
        if (!schemaAnnotationScanner.scan(root, property).isEmpty()) {
          return true;
        }
      }
      return false;
    }
    if (node.isArray()) {
      for (final JsonNode element : node) {
        if (!schemaAnnotationScanner.scan(root, element).isEmpty()) {
          return true;
        }
      }
      return false;
    }
    return node.isObject() && !schemaAnnotationScanner.scan(root, node).isEmpty();
  }

  private static String describe(final JsonPointer path) {
    final String pointer = path.toString();
    return pointer.isEmpty() ? "/" : pointer;
  }

}
