/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.airbyte.commons.json.Jsons;
import io.airbyte.config.secrets.errors.TraversalException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecretTreeWalkerTest {

  private static final JsonNode REPLACEMENT = TextNode.valueOf("replaced");

  private static final JsonNode NESTED_SCHEMA = Jsons.deserialize("""
                                                                  {
                                                                    "type": "object",
                                                                    "properties": {
                                                                      "email": { "type": "string" },
                                                                      "api_token": { "type": "string", "airbyte_secret": true },
                                                                      "tunnel": {
                                                                        "type": "object",
                                                                        "properties": {
                                                                          "keys": {
                                                                            "type": "array",
                                                                            "items": { "type": "string", "airbyte_secret": true }
                                                                          }
                                                                        }
                                                                      },
                                                                      "headers": {
                                                                        "type": "object",
                                                                        "additionalProperties": { "type": "string", "airbyte_secret": true }
                                                                      }
                                                                    }
                                                                  }""");

  private static final JsonNode CREDENTIALS_SCHEMA = Jsons.deserialize("""
                                                                       {
                                                                         "type": "object",
                                                                         "properties": {
                                                                           "credentials": {
                                                                             "type": "object",
                                                                             "oneOf": [
                                                                               {
                                                                                 "required": ["auth_type"],
                                                                                 "properties": {
                                                                                   "auth_type": { "const": "api_key" },
                                                                                   "api_key": { "type": "string", "airbyte_secret": true }
                                                                                 }
                                                                               },
                                                                               {
                                                                                 "required": ["auth_type"],
                                                                                 "properties": {
                                                                                   "auth_type": { "const": "basic" },
                                                                                   "username": { "type": "string" },
                                                                                   "api_key": { "type": "string" }
                                                                                 }
                                                                               }
                                                                             ]
                                                                           }
                                                                         }
                                                                       }""");

  private SecretTreeWalker walker;
  private List<String> visitedPaths;

  @BeforeEach
  void setup() {
    walker = new SecretTreeWalker(new SchemaAnnotationScanner());
    visitedPaths = new ArrayList<>();
  }

  private JsonNode replaceSecrets(final JsonNode document, final JsonNode schema) {
    return walker.walk(document, schema, (path, value, leafSchema) -> {
      visitedPaths.add(path.toString());
      return REPLACEMENT;
    });
  }

  @Test
  void testReplacesOnlySecretLeaves() {
    final JsonNode document = Jsons.deserialize("""
                                                {
                                                  "email": "a@b.com",
                                                  "api_token": "fake-token",
                                                  "unknown": { "api_token": "not a secret here" }
                                                }""");
    final JsonNode original = document.deepCopy();

    final JsonNode result = replaceSecrets(document, NESTED_SCHEMA);

    assertEquals(Jsons.deserialize("""
                                   {
                                     "email": "a@b.com",
                                     "api_token": "replaced",
                                     "unknown": { "api_token": "not a secret here" }
                                   }"""), result);
    assertEquals(List.of("email", "api_token", "unknown"), List.copyOf(iterableToList(result.fieldNames())));
    assertEquals(original, document);
  }

  @Test
  void testVisitsConcreteLocationsInDocumentOrder() {
    final JsonNode document = Jsons.deserialize("""
                                                {
                                                  "headers": { "Authorization": "Bearer x", "X-Key": "y" },
                                                  "tunnel": { "keys": ["k1", "k2"] },
                                                  "api_token": "t"
                                                }""");

    final JsonNode result = replaceSecrets(document, NESTED_SCHEMA);

    assertEquals(List.of("/headers/Authorization", "/headers/X-Key", "/tunnel/keys/0", "/tunnel/keys/1", "/api_token"), visitedPaths);
    assertEquals(Jsons.deserialize("[\"replaced\", \"replaced\"]"), result.at("/tunnel/keys"));
  }

  @Test
  void testNullSecretIsCopied() {
    final JsonNode document = Jsons.deserialize("{\"email\": \"a@b.com\", \"api_token\": null}");

    assertEquals(document, replaceSecrets(document, NESTED_SCHEMA));
    assertTrue(visitedPaths.isEmpty());
  }

  @Test
  void testSchemaWithoutSecretsCopiesDocument() {
    final JsonNode schema = Jsons.deserialize("{\"type\": \"object\", \"properties\": {\"email\": {\"type\": \"string\"}}}");
    final JsonNode document = Jsons.deserialize("{\"email\": \"a@b.com\", \"other\": [1, 2]}");

    assertEquals(document, replaceSecrets(document, schema));
    assertTrue(visitedPaths.isEmpty());
  }

  @Test
  void testSelectsTheMatchingBranch() {
    final JsonNode apiKeyDocument = Jsons.deserialize("{\"credentials\": {\"auth_type\": \"api_key\", \"api_key\": \"abc\"}}");
    final JsonNode basicDocument = Jsons.deserialize("{\"credentials\": {\"auth_type\": \"basic\", \"username\": \"u\", \"api_key\": \"abc\"}}");

    assertEquals("replaced", replaceSecrets(apiKeyDocument, CREDENTIALS_SCHEMA).at("/credentials/api_key").asText());
    assertEquals(basicDocument, replaceSecrets(basicDocument, CREDENTIALS_SCHEMA));
    assertEquals(List.of("/credentials/api_key"), visitedPaths);
  }

  @Test
  void testSelectsTheSameBranchAfterObfuscation() {
    final JsonNode obfuscated = Jsons.deserialize("""
                                                  {
                                                    "credentials": {
                                                      "auth_type": "api_key",
                                                      "api_key": { "_secret": "airbyte_workspace_4f1c7d3e-2b7a-4c8e-9a51-0d6e3b2f9c11_secret_9a0b1c2d-3e4f-4a5b-8c6d-7e8f9a0b1c2d_v1" }
                                                    }
                                                  }""");

    replaceSecrets(obfuscated, CREDENTIALS_SCHEMA);

    assertEquals(List.of("/credentials/api_key"), visitedPaths);
  }

  @Test
  void testNoMatchingBranchWithSecretsFails() {
    final JsonNode document = Jsons.deserialize("{\"credentials\": {\"auth_type\": \"oauth\", \"api_key\": \"abc\"}}");

    final TraversalException exception = assertThrows(TraversalException.class, () -> replaceSecrets(document, CREDENTIALS_SCHEMA));
    assertTrue(exception.getMessage().contains("/credentials"));
    assertFalse(exception.getMessage().contains("abc"));
  }

  @Test
  void testNoMatchingBranchWithoutSecretsIsCopied() {
    final JsonNode schema = Jsons.deserialize("""
                                              {
                                                "type": "object",
                                                "properties": {
                                                  "password": { "type": "string", "airbyte_secret": true },
                                                  "mode": {
                                                    "anyOf": [
                                                      { "type": "string", "enum": ["fast", "slow"] },
                                                      { "type": "integer" }
                                                    ]
                                                  }
                                                }
                                              }""");
    final JsonNode document = Jsons.deserialize("{\"mode\": true, \"password\": \"p\"}");

    assertEquals(Jsons.deserialize("{\"mode\": true, \"password\": \"replaced\"}"), replaceSecrets(document, schema));
  }

  @Test
  void testAllOfAndRefsApply() {
    final JsonNode schema = Jsons.deserialize("""
                                              {
                                                "definitions": {
                                                  "auth": {
                                                    "type": "object",
                                                    "properties": { "password": { "type": "string", "airbyte_secret": true } }
                                                  }
                                                },
                                                "allOf": [
                                                  { "$ref": "#/definitions/auth" },
                                                  { "properties": { "username": { "type": "string" } } }
                                                ]
                                              }""");
    final JsonNode document = Jsons.deserialize("{\"username\": \"u\", \"password\": \"p\"}");

    assertEquals(Jsons.deserialize("{\"username\": \"u\", \"password\": \"replaced\"}"), replaceSecrets(document, schema));
  }

  @Test
  void testTupleItems() {
    final JsonNode schema = Jsons.deserialize("""
                                              {
                                                "type": "object",
                                                "properties": {
                                                  "pair": {
                                                    "type": "array",
                                                    "items": [ { "type": "string" }, { "type": "string", "airbyte_secret": true } ]
                                                  }
                                                }
                                              }""");
    final JsonNode document = Jsons.deserialize("{\"pair\": [\"user\", \"pass\", \"extra\"]}");

    assertEquals(Jsons.deserialize("{\"pair\": [\"user\", \"replaced\", \"extra\"]}"), replaceSecrets(document, schema));
  }

  @Test
  void testNonStringSecretsAreVisited() {
    final JsonNode schema = Jsons.deserialize("""
                                              {
                                                "type": "object",
                                                "properties": {
                                                  "pin": { "type": "integer", "airbyte_secret": true },
                                                  "service_account": { "type": "object", "airbyte_secret": true }
                                                }
                                              }""");
    final JsonNode document = Jsons.deserialize("{\"pin\": 1234, \"service_account\": {\"private_key\": \"k\"}}");

    assertEquals(Jsons.deserialize("{\"pin\": \"replaced\", \"service_account\": \"replaced\"}"), replaceSecrets(document, schema));
  }

  @Test
  void testContainerMismatchFails() {
    assertThrows(TraversalException.class, () -> replaceSecrets(Jsons.deserialize("{\"tunnel\": \"not an object\"}"), NESTED_SCHEMA));
    assertThrows(TraversalException.class, () -> replaceSecrets(Jsons.deserialize("{\"tunnel\": [\"k\"]}"), NESTED_SCHEMA));
    assertThrows(TraversalException.class, () -> replaceSecrets(Jsons.deserialize("{\"tunnel\": {\"keys\": {\"a\": \"k\"}}}"), NESTED_SCHEMA));
  }

  private static <T> List<T> iterableToList(final Iterator<T> iterator) {
    final List<T> list = new ArrayList<>();
    iterator.forEachRemaining(list::add);
    return list;
  }

}
