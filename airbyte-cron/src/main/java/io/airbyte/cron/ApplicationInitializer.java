/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.cron;

import io.airbyte.config.secrets.config.SecretsConfig;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Report which secret backends the sweep runs against.
 */
@Singleton
@Slf4j
public class ApplicationInitializer implements ApplicationEventListener<StartupEvent> {

  private final SecretsConfig secretsConfig;

  public ApplicationInitializer(final SecretsConfig secretsConfig) {
    this.secretsConfig = secretsConfig;
  }

  @Override
  public void onApplicationEvent(final StartupEvent event) {
    log.info("Secret persistence: {}, external secret manager: {}, ephemeral secrets expire after {}",
        secretsConfig.persistence(), secretsConfig.externalManager(), secretsConfig.ephemeralTtl());
  }

}
