/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.external;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.security.keyvault.secrets.SecretClient;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.airbyte.config.secrets.persistence.AzureKeyVaultSecretStore;
import io.airbyte.config.secrets.persistence.AzureKeyVaultSecretStore.AzureKeyVaultClientBuilder;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Resolves external references against an Azure Key Vault that users administer themselves. Only
 * lookups are performed. Names of secrets the platform manages are never resolved, so a reference
 * cannot reach another workspace's secret even when both live in the same vault.
 */
@Singleton
@Requires(property = "airbyte.secret.external-manager", pattern = "(?i)^azure_key_vault$")
@Named("externalSecretManager")
public class AzureKeyVaultSecretManager implements ExternalSecretManager {

  private final String keyVaultUrl;
  private final SecretClient client;

  public AzureKeyVaultSecretManager(@Value("${airbyte.secret.external.azure.key-vault-url}") final String keyVaultUrl,
                                    final AzureKeyVaultClientBuilder clientBuilder) {
    this.keyVaultUrl = keyVaultUrl;
    this.client = clientBuilder.build(keyVaultUrl);
  }

  @Override
  public String getName() {
    return "azure key vault " + keyVaultUrl;
  }

  @Override
  public boolean exists(final String name) {
    if (AzureKeyVaultSecretStore.isManagedSecretName(name)) {
      return false;
    }
    try {
      client.getSecret(name);
      return true;
    } catch (final ResourceNotFoundException e) {
      return false;
    }
  }

  @Override
  public String read(final String name) {
    if (AzureKeyVaultSecretStore.isManagedSecretName(name)) {
      throw SecretNotFoundException.forExternalReference(getName(), name);
    }
    try {
      return client.getSecret(name).getValue();
    } catch (final ResourceNotFoundException e) {
      throw SecretNotFoundException.forExternalReference(getName(), name);
    }
  }

}
