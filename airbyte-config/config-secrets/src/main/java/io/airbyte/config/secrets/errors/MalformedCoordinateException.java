/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * A persisted coordinate string does not follow the coordinate grammar. Outside of data corruption
 * this should never happen.
 */
public class MalformedCoordinateException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = 2094839281106453112L;

  public MalformedCoordinateException(final String coordinate) {
    super(String.format("Malformed secret coordinate: %s", coordinate));
  }

}
