/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.config;

import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;

/**
 * Micronaut bean factory for the secrets settings.
 */
@Factory
public class SecretsBeanFactory {

  @Singleton
  public SecretsConfig secretsConfig(@Value("${airbyte.secret.persistence:in_memory}") final String persistence,
                                     @Value("${airbyte.secret.external-manager:env}") final String externalManager,
                                     @Value("${airbyte.secret.ephemeral-ttl:2h}") final Duration ephemeralTtl,
                                     @Value("${airbyte.secret.external-manager-timeout:10s}") final Duration externalManagerTimeout) {
    return new SecretsConfig(persistence, externalManager, ephemeralTtl, externalManagerTimeout);
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

}
