/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * Writing a payload to the secret store failed. The enclosing obfuscation is aborted.
 */
public class SecretStoreWriteException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = -854172026935317458L;

  public SecretStoreWriteException(final String coordinate, final Throwable cause) {
    super(String.format("Failed to write secret at coordinate %s", coordinate), cause);
  }

}
