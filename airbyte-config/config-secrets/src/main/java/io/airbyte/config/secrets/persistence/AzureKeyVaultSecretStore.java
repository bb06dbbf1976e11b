/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.persistence;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.identity.ManagedIdentityCredentialBuilder;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import com.azure.security.keyvault.secrets.models.SecretProperties;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import io.airbyte.config.secrets.SecretCoordinate;
import io.airbyte.config.secrets.errors.ExternalManagerUnavailableException;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.airbyte.config.secrets.errors.SecretStoreWriteException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.lang.invoke.MethodHandles;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
https://learn.microsoft.com/en-us/java/api/overview/azure/security-keyvault-secrets-readme?view=azure-java-stable
https://learn.microsoft.com/en-us/java/api/overview/azure/identity-readme?view=azure-java-stable#defaultazurecredential
 */
@Singleton
@Requires(property = "airbyte.secret.persistence", pattern = "(?i)^azure_key_vault$")
@Named("secretStore")
public class AzureKeyVaultSecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private static final String UUID_REGEX = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";
  private static final Pattern SECRET_NAME_PATTERN = Pattern.compile(
      "^" + AirbyteSecretConstants.COORDINATE_PREFIX.replace('_', '-')
          + "-(" + UUID_REGEX + ")-secret-(" + UUID_REGEX + ")-v([1-9][0-9]{0,17})$");

  private static final int FORBIDDEN = 403;

  private final String keyVaultUrl;
  private final SecretClient client;

  public AzureKeyVaultSecretStore(@Value("${airbyte.secret.store.azure.key-vault-url}") final String keyVaultUrl,
                                  final AzureKeyVaultClientBuilder clientBuilder) {
    this.keyVaultUrl = keyVaultUrl;
    this.client = clientBuilder.build(keyVaultUrl);
  }

  /**
   * Key Vault names only allow alphanumerics and dashes.
   */
  static String toSecretName(final SecretCoordinate coordinate) {
    return coordinate.getFullCoordinate().replace('_', '-');
  }

  static Optional<SecretCoordinate> fromSecretName(final String name) {
    final Matcher matcher = SECRET_NAME_PATTERN.matcher(name);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(new SecretCoordinate(
        UUID.fromString(matcher.group(1)),
        UUID.fromString(matcher.group(2)),
        Long.parseLong(matcher.group(3))));
  }

  /**
   * Whether a name, in either the coordinate or the Key Vault spelling, is one the platform manages.
   */
  public static boolean isManagedSecretName(final String name) {
    return fromSecretName(name.replace('_', '-')).isPresent();
  }

  @Override
  public String read(final SecretCoordinate coordinate) {
    try {
      return client.getSecret(toSecretName(coordinate)).getValue();
    } catch (final ResourceNotFoundException e) {
      throw SecretNotFoundException.forCoordinate(coordinate.getFullCoordinate());
    } catch (final HttpResponseException e) {
      if (isDisabledOrExpired(e)) {
        throw new SecretNotFoundException(
            String.format("That secret is disabled or expired in the store! Coordinate: %s", coordinate.getFullCoordinate()));
      }
      throw unavailable("read", coordinate, e);
    } catch (final RuntimeException e) {
      throw unavailable("read", coordinate, e);
    }
  }

  @Override
  public void write(final SecretCoordinate coordinate, final String payload) {
    writeWithExpiry(coordinate, payload, null);
  }

  @Override
  public void writeWithExpiry(final SecretCoordinate coordinate, final String payload, final Instant expiry) {
    final KeyVaultSecret secret = new KeyVaultSecret(toSecretName(coordinate), payload);
    if (expiry != null) {
      secret.getProperties().setExpiresOn(expiry.atOffset(ZoneOffset.UTC));
    }
    try {
      client.setSecret(secret);
    } catch (final RuntimeException e) {
      throw new SecretStoreWriteException(coordinate.getFullCoordinate(), e);
    }
  }

  /**
   * A deleted secret stays recoverable and keeps its name reserved until purged, which
   * {@link #isOccupied(SecretCoordinate)} reports.
   */
  @Override
  public void delete(final SecretCoordinate coordinate) {
    try {
      final var poller = client.beginDeleteSecret(toSecretName(coordinate));
      poller.waitForCompletion();
    } catch (final ResourceNotFoundException e) {
      log.debug("Secret {} was already deleted", coordinate.getFullCoordinate());
    } catch (final RuntimeException e) {
      throw unavailable("delete", coordinate, e);
    }
  }

  @Override
  public void setExpiry(final SecretCoordinate coordinate, final Instant expiry) {
    try {
      final SecretProperties properties = client.getSecret(toSecretName(coordinate)).getProperties();
      properties.setExpiresOn(expiry.atOffset(ZoneOffset.UTC));
      client.updateSecretProperties(properties);
    } catch (final ResourceNotFoundException e) {
      throw SecretNotFoundException.forCoordinate(coordinate.getFullCoordinate());
    } catch (final RuntimeException e) {
      throw unavailable("expire", coordinate, e);
    }
  }

  @Override
  public List<SecretCoordinate> listExpired(final Instant now) {
    final List<SecretCoordinate> expired = new ArrayList<>();
    try {
      for (final SecretProperties properties : client.listPropertiesOfSecrets()) {
        final OffsetDateTime expiresOn = properties.getExpiresOn();
        if (expiresOn == null || now.isBefore(expiresOn.toInstant())) {
          continue;
        }
        fromSecretName(properties.getName()).ifPresent(expired::add);
      }
    } catch (final RuntimeException e) {
      throw new ExternalManagerUnavailableException(
          String.format("Failed to list expired secrets in secret store '%s'", keyVaultUrl), e);
    }
    return expired;
  }

  @Override
  public boolean isOccupied(final SecretCoordinate coordinate) {
    final String name = toSecretName(coordinate);
    try {
      client.getSecret(name);
      return true;
    } catch (final ResourceNotFoundException e) {
      log.debug("Secret {} is not stored, checking deleted secrets", coordinate.getFullCoordinate());
    } catch (final HttpResponseException e) {
      if (isDisabledOrExpired(e)) {
        return true;
      }
      throw unavailable("check", coordinate, e);
    } catch (final RuntimeException e) {
      throw unavailable("check", coordinate, e);
    }

    try {
      client.getDeletedSecret(name);
      return true;
    } catch (final ResourceNotFoundException e) {
      return false;
    } catch (final RuntimeException e) {
      throw unavailable("check", coordinate, e);
    }
  }

  /**
   * Key Vault answers 403 to reads of a secret that is disabled or past its expiry.
   */
  private static boolean isDisabledOrExpired(final HttpResponseException e) {
    if (e.getResponse() == null || e.getResponse().getStatusCode() != FORBIDDEN || e.getMessage() == null) {
      return false;
    }
    final String message = e.getMessage().toLowerCase(Locale.ROOT);
    return message.contains("disabled") || message.contains("expired");
  }

  private ExternalManagerUnavailableException unavailable(final String action,
                                                          final SecretCoordinate coordinate,
                                                          final RuntimeException cause) {
    return new ExternalManagerUnavailableException(
        String.format("Secret store '%s' failed to %s secret %s", keyVaultUrl, action, coordinate.getFullCoordinate()), cause);
  }

  public interface AzureKeyVaultClientBuilder {

    SecretClient build(String keyVaultUrl);

  }

  @Singleton
  public static class ClientBuilder implements AzureKeyVaultClientBuilder {

    @Override
    public SecretClient build(final String keyVaultUrl) {
      return new SecretClientBuilder()
          .vaultUrl(keyVaultUrl)
          .credential(new ManagedIdentityCredentialBuilder().build())
          .buildClient();
    }

  }

}
