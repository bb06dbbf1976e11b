/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.cron.jobs;

import io.airbyte.config.secrets.EphemeralSecretRegistry;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Delete secrets minted outside of a workspace once they expire, and superseded secret versions whose
 * deletion failed earlier.
 */
@Singleton
@Slf4j
public class EphemeralSecretsCleaner {

  private final EphemeralSecretRegistry ephemeralSecretRegistry;

  public EphemeralSecretsCleaner(final EphemeralSecretRegistry ephemeralSecretRegistry) {
    log.info("Creating ephemeral secrets cleaner");
    this.ephemeralSecretRegistry = ephemeralSecretRegistry;
  }

  @Scheduled(fixedRate = "${airbyte.secret.sweep-interval:10m}")
  public void deleteExpiredSecrets() {
    log.info("Sweeping expired secrets ({} deletions pending in this process)", ephemeralSecretRegistry.getPendingDeletionCount());
    final int deleted = ephemeralSecretRegistry.sweep();
    log.info("Deleted {} secrets", deleted);
  }

}
