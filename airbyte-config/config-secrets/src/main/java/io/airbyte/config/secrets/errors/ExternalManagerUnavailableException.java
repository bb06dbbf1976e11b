/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * A secret backend could not be reached or did not answer in time.
 */
public class ExternalManagerUnavailableException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = 4728061130925591770L;

  public ExternalManagerUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
