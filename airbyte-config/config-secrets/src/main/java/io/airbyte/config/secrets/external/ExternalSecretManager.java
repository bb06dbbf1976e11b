/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.external;

/**
 * Read-only view of a secret manager administered outside the platform. Users reference its entries
 * by name with {@code ${NAME}} or {@code secret_coordinate::NAME}.
 */
public interface ExternalSecretManager {

  /**
   * Name used in user-facing errors.
   */
  String getName();

  boolean exists(String name);

  /**
   * Read a secret by name.
   *
   * @param name exact, case-sensitive name
   * @return secret value
   * @throws io.airbyte.config.secrets.errors.SecretNotFoundException if there is no such secret
   */
  String read(String name);

}
