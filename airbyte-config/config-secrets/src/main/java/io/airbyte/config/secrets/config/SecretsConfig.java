/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.config;

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Process-wide secrets settings, fixed at startup.
 *
 * @param persistence configured secret store backend
 * @param externalManager configured external secret manager backend
 * @param ephemeralTtl how long a coordinate without an owning workspace is kept
 * @param externalManagerTimeout bound on every external secret manager call
 */
public record SecretsConfig(String persistence,
                            String externalManager,
                            Duration ephemeralTtl,
                            Duration externalManagerTimeout) {

  public static final Duration DEFAULT_EPHEMERAL_TTL = Duration.ofHours(2);
  public static final Duration DEFAULT_EXTERNAL_MANAGER_TIMEOUT = Duration.ofSeconds(10);

  public SecretsConfig {
    Preconditions.checkArgument(ephemeralTtl != null && !ephemeralTtl.isNegative() && !ephemeralTtl.isZero(),
        "ephemeral ttl must be positive");
    Preconditions.checkArgument(externalManagerTimeout != null && !externalManagerTimeout.isNegative() && !externalManagerTimeout.isZero(),
        "external manager timeout must be positive");
  }

  public static SecretsConfig defaults() {
    return new SecretsConfig("in_memory", "env", DEFAULT_EPHEMERAL_TTL, DEFAULT_EXTERNAL_MANAGER_TIMEOUT);
  }

}
