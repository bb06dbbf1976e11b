/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.external;

import com.google.common.annotations.VisibleForTesting;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves external references against the environment variables of the process.
 */
@Singleton
@Requires(property = "airbyte.secret.external-manager", value = "env", defaultValue = "env")
@Named("externalSecretManager")
public class EnvironmentSecretManager implements ExternalSecretManager {

  private final Function<String, String> lookup;

  @Inject
  public EnvironmentSecretManager() {
    this(System::getenv);
  }

  @VisibleForTesting
  public EnvironmentSecretManager(final Map<String, String> environment) {
    this(environment::get);
  }

  private EnvironmentSecretManager(final Function<String, String> lookup) {
    this.lookup = lookup;
  }

  @Override
  public String getName() {
    return "environment";
  }

  @Override
  public boolean exists(final String name) {
    return lookup.apply(name) != null;
  }

  @Override
  public String read(final String name) {
    final String value = lookup.apply(name);
    if (value == null) {
      throw SecretNotFoundException.forExternalReference(getName(), name);
    }
    return value;
  }

}
