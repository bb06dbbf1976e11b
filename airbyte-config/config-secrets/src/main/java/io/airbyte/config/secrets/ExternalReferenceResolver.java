/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.airbyte.config.secrets.config.SecretsConfig;
import io.airbyte.config.secrets.errors.ExternalManagerUnavailableException;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.airbyte.config.secrets.errors.SecretProcessingException;
import io.airbyte.config.secrets.external.ExternalSecretManager;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up external references in the configured external secret manager. Nothing is cached: every
 * call goes to the manager, which stays the source of truth.
 * <p>
 * Calls run on a small pool of daemon threads so that a hanging manager can be abandoned after the
 * configured timeout.
 */
@Singleton
public class ExternalReferenceResolver {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final int MAX_CONCURRENT_LOOKUPS = 8;

  private final ExternalSecretManager secretManager;
  private final Duration timeout;
  private final ExecutorService executor;

  public ExternalReferenceResolver(@Named("externalSecretManager") final ExternalSecretManager secretManager,
                                   final SecretsConfig secretsConfig) {
    this.secretManager = secretManager;
    this.timeout = secretsConfig.externalManagerTimeout();
    this.executor = Executors.newFixedThreadPool(MAX_CONCURRENT_LOOKUPS, new ThreadFactoryBuilder()
        .setNameFormat("external-secret-lookup-%d")
        .setDaemon(true)
        .build());
  }

  /**
   * Check that a reference names an existing secret.
   *
   * @param reference reference to check
   * @throws SecretNotFoundException if the manager has no such secret
   * @throws ExternalManagerUnavailableException if the manager cannot be reached in time
   */
  public void validate(final ExternalSecretReference reference) {
    final boolean exists = call(reference, () -> secretManager.exists(reference.name()));
    if (!exists) {
      throw SecretNotFoundException.forExternalReference(secretManager.getName(), reference.name());
    }
  }

  /**
   * Read the current value of a referenced secret.
   *
   * @param reference reference to resolve
   * @return secret value
   * @throws SecretNotFoundException if the manager has no such secret
   * @throws ExternalManagerUnavailableException if the manager cannot be reached in time
   */
  public String resolve(final ExternalSecretReference reference) {
    return call(reference, () -> secretManager.read(reference.name()));
  }

  @PreDestroy
  public void close() {
    executor.shutdownNow();
  }

  private <T> T call(final ExternalSecretReference reference, final Callable<T> lookup) {
    final Future<T> future;
    try {
      future = executor.submit(lookup);
    } catch (final RejectedExecutionException e) {
      throw new ExternalManagerUnavailableException(
          String.format("Lookups in secret manager '%s' are shut down", secretManager.getName()), e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      future.cancel(true);
      log.warn("Lookup of {} in {} timed out after {}", reference.name(), secretManager.getName(), timeout);
      throw new ExternalManagerUnavailableException(
          String.format("Secret manager '%s' did not answer within %s", secretManager.getName(), timeout), e);
    } catch (final InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExternalManagerUnavailableException(
          String.format("Interrupted while waiting for secret manager '%s'", secretManager.getName()), e);
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof SecretProcessingException processingException) {
        throw processingException;
      }
      throw new ExternalManagerUnavailableException(
          String.format("Secret manager '%s' failed to look up '%s'", secretManager.getName(), reference.name()), e.getCause());
    }
  }

}
