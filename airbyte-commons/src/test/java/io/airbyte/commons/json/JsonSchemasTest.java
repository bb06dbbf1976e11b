/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.commons.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonSchemasTest {

  private static final JsonNode ROOT = Jsons.deserialize("""
                                                         {
                                                           "type": "object",
                                                           "definitions": {
                                                             "password": { "type": "string", "airbyte_secret": true }
                                                           }
                                                         }""");

  @Test
  void testIsSecret() {
    assertTrue(JsonSchemas.isSecret(Jsons.deserialize("{\"type\": \"string\", \"airbyte_secret\": true}")));
    assertFalse(JsonSchemas.isSecret(Jsons.deserialize("{\"type\": \"string\", \"airbyte_secret\": false}")));
    assertFalse(JsonSchemas.isSecret(Jsons.deserialize("{\"type\": \"string\"}")));
    assertFalse(JsonSchemas.isSecret(null));
  }

  @Test
  void testGetTypes() {
    assertEquals(List.of("string"), JsonSchemas.getTypes(Jsons.deserialize("{\"type\": \"string\"}")));
    assertEquals(List.of("string", "null"), JsonSchemas.getTypes(Jsons.deserialize("{\"type\": [\"string\", \"null\"]}")));
    assertEquals(List.of(), JsonSchemas.getTypes(Jsons.deserialize("{\"description\": \"anything\"}")));
  }

  @Test
  void testGetTypesRejectsInvalidType() {
    assertThrows(IllegalArgumentException.class, () -> JsonSchemas.getTypes(Jsons.deserialize("{\"type\": 12}")));
    assertThrows(IllegalArgumentException.class, () -> JsonSchemas.getTypes(Jsons.deserialize("{\"type\": [\"string\", 1]}")));
  }

  @Test
  void testResolveLocalRef() {
    assertEquals(ROOT.at("/definitions/password"), JsonSchemas.resolveLocalRef(ROOT, "#/definitions/password").orElseThrow());
    assertEquals(ROOT, JsonSchemas.resolveLocalRef(ROOT, "#").orElseThrow());
    assertEquals(Optional.empty(), JsonSchemas.resolveLocalRef(ROOT, "#/definitions/missing"));
    assertEquals(Optional.empty(), JsonSchemas.resolveLocalRef(ROOT, "https://example.com/schema.json"));
    assertEquals(Optional.empty(), JsonSchemas.resolveLocalRef(ROOT, "#definitions"));
  }

}
