/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Called by {@link SecretTreeWalker} for every non-null value found at a secret location.
 */
@FunctionalInterface
public interface SecretLeafVisitor {

  /**
   * Produce the value that replaces a secret leaf.
   *
   * @param path concrete location of the leaf in the configuration
   * @param value current value, never null
   * @param leafSchema schema node carrying the secret annotation
   * @return replacement value, never null
   */
  JsonNode visit(JsonPointer path, JsonNode value, JsonNode leafSchema);

}
