/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.commons.constants;

import java.util.UUID;

/**
 * Collection of constants related to Airbyte secrets defined in connector configurations.
 */
public final class AirbyteSecretConstants {

  /**
   * The name of a configuration property field that has been identified as a secret.
   */
  public static final String AIRBYTE_SECRET_FIELD = "airbyte_secret";

  /**
   * Key of the single-field object that replaces a secret value in a persisted configuration.
   */
  public static final String COORDINATE_FIELD = "_secret";

  /**
   * Fixed scope prefix of every coordinate minted by the platform.
   */
  public static final String COORDINATE_PREFIX = "airbyte_workspace";

  /**
   * Prefix of an explicit reference to a secret held by an external secret manager.
   */
  public static final String SECRET_REFERENCE_PREFIX = "secret_coordinate::";

  /**
   * Owner of coordinates minted outside of any workspace. Such coordinates expire.
   */
  public static final UUID EPHEMERAL_OWNER_ID = new UUID(0L, 0L);

  /**
   * Mask value that is displayed in place of a value associated with an airbyte secret.
   */
  public static final String SECRETS_MASK = "**********";

  private AirbyteSecretConstants() {
    // Private constructor to prevent instantiation
  }

}
