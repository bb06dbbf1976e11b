/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * The configuration does not conform to its schema at a point where the schema is needed to decide
 * whether a value is secret.
 */
public class TraversalException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = -3570466283417729409L;

  public TraversalException(final String path, final String reason) {
    super(String.format("Cannot traverse configuration at %s: %s", path, reason));
  }

}
