/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * The connector schema is malformed or uses a construct that cannot be scanned for secrets.
 */
public class SchemaException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = 6418772930148862187L;

  public SchemaException(final String message) {
    super(message);
  }

}
