/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * Base class of every failure raised while obfuscating or hydrating a configuration. Messages name
 * paths, coordinates and reference names but never secret values.
 */
public abstract class SecretProcessingException extends RuntimeException {

  @Serial
  private static final long serialVersionUID = -1795129738471013205L;

  protected SecretProcessingException(final String message) {
    super(message);
  }

  protected SecretProcessingException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
