/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

/**
 * A pointer that stands in a configuration in place of a secret value: either a
 * {@link SecretCoordinate} managed by the platform or an {@link ExternalSecretReference} managed by
 * the user.
 */
public interface SecretReference {

  /**
   * String form of the reference as it is written in a persisted configuration.
   *
   * @return persisted form
   */
  String toPersistedString();

}
