/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;

/**
 * A coordinate or an external reference does not resolve to a secret.
 */
public class SecretNotFoundException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = -6613209185623497245L;

  public SecretNotFoundException(final String message) {
    super(message);
  }

  /**
   * Build the error for a name that the configured external secret manager does not know about.
   *
   * @param managerName name of the configured secret manager
   * @param secretName missing secret name
   * @return error naming both
   */
  public static SecretNotFoundException forExternalReference(final String managerName, final String secretName) {
    return new SecretNotFoundException(String.format("Secret '%s' was not found in secret manager '%s'", secretName, managerName));
  }

  /**
   * Build the error for a coordinate missing from the secret store.
   *
   * @param coordinate full coordinate
   * @return error naming the coordinate
   */
  public static SecretNotFoundException forCoordinate(final String coordinate) {
    return new SecretNotFoundException(String.format("That secret was not found in the store! Coordinate: %s", coordinate));
  }

}
