/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import jakarta.inject.Singleton;

/**
 * Prepares configurations to be shown to users.
 */
@Singleton
public class SecretsMasker {

  private final SecretTreeWalker treeWalker;

  public SecretsMasker(final SecretTreeWalker treeWalker) {
    this.treeWalker = treeWalker;
  }

  /**
   * Replace every secret value with {@link AirbyteSecretConstants#SECRETS_MASK}. Works on raw,
   * obfuscated and hydrated configurations alike. Absent optional secrets stay null.
   *
   * @param config configuration to mask
   * @param schema connector schema of the configuration
   * @return masked copy
   */
  public JsonNode mask(final JsonNode config, final JsonNode schema) {
    return treeWalker.walk(config, schema, (path, value, leafSchema) -> TextNode.valueOf(AirbyteSecretConstants.SECRETS_MASK));
  }

}
