/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.persistence;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.core.http.HttpResponse;
import com.azure.core.http.rest.PagedIterable;
import com.azure.core.util.polling.SyncPoller;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.models.DeletedSecret;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import com.azure.security.keyvault.secrets.models.SecretProperties;
import io.airbyte.config.secrets.SecretCoordinate;
import io.airbyte.config.secrets.errors.ExternalManagerUnavailableException;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.airbyte.config.secrets.errors.SecretStoreWriteException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AzureKeyVaultSecretStoreTest {

  private static final String KEY_VAULT_URL = "https://example-kv.vault.azure.net/";
  private static final SecretCoordinate COORDINATE = new SecretCoordinate(
      UUID.fromString("4f1c7d3e-2b7a-4c8e-9a51-0d6e3b2f9c11"),
      UUID.fromString("9a0b1c2d-3e4f-4a5b-8c6d-7e8f9a0b1c2d"),
      2);
  private static final String SECRET_NAME =
      "airbyte-workspace-4f1c7d3e-2b7a-4c8e-9a51-0d6e3b2f9c11-secret-9a0b1c2d-3e4f-4a5b-8c6d-7e8f9a0b1c2d-v2";

  private SecretClient client;
  private AzureKeyVaultSecretStore store;

  @BeforeEach
  void setup() {
    client = mock(SecretClient.class);
    store = new AzureKeyVaultSecretStore(KEY_VAULT_URL, keyVaultUrl -> client);
  }

  @Test
  void testSecretName() {
    assertEquals(SECRET_NAME, AzureKeyVaultSecretStore.toSecretName(COORDINATE));
  }

  @Test
  void testRead() {
    when(client.getSecret(SECRET_NAME)).thenReturn(new KeyVaultSecret(SECRET_NAME, "my secret !"));

    assertEquals("my secret !", store.read(COORDINATE));
  }

  @Test
  void testReadMissing() {
    when(client.getSecret(SECRET_NAME)).thenThrow(new ResourceNotFoundException("not found", null));

    final SecretNotFoundException exception = assertThrows(SecretNotFoundException.class, () -> store.read(COORDINATE));
    assertEquals("That secret was not found in the store! Coordinate: " + COORDINATE.getFullCoordinate(), exception.getMessage());
  }

  @Test
  void testWrite() {
    store.write(COORDINATE, "my secret !");

    final ArgumentCaptor<KeyVaultSecret> captor = ArgumentCaptor.forClass(KeyVaultSecret.class);
    verify(client).setSecret(captor.capture());
    assertEquals(SECRET_NAME, captor.getValue().getName());
    assertEquals("my secret !", captor.getValue().getValue());
    assertNull(captor.getValue().getProperties().getExpiresOn());
  }

  @Test
  void testWriteWithExpiry() {
    final Instant expiry = Instant.parse("2025-01-15T12:00:00Z");

    store.writeWithExpiry(COORDINATE, "check-token", expiry);

    final ArgumentCaptor<KeyVaultSecret> captor = ArgumentCaptor.forClass(KeyVaultSecret.class);
    verify(client).setSecret(captor.capture());
    assertEquals(expiry.atOffset(ZoneOffset.UTC), captor.getValue().getProperties().getExpiresOn());
  }

  @Test
  @SuppressWarnings("unchecked")
  void testDelete() {
    final SyncPoller<DeletedSecret, Void> poller = mock(SyncPoller.class);
    when(client.beginDeleteSecret(SECRET_NAME)).thenReturn(poller);

    store.delete(COORDINATE);

    verify(poller).waitForCompletion();
  }

  @Test
  void testDeleteMissingIsNotAnError() {
    when(client.beginDeleteSecret(SECRET_NAME)).thenThrow(new ResourceNotFoundException("not found", null));

    assertDoesNotThrow(() -> store.delete(COORDINATE));
  }

  @Test
  void testReadDisabledSecretIsNotFound() {
    final HttpResponseException disabled = httpError(403, "Operation get is not allowed on a disabled secret.");
    when(client.getSecret(SECRET_NAME)).thenThrow(disabled);

    assertThrows(SecretNotFoundException.class, () -> store.read(COORDINATE));
  }

  @Test
  void testReadBackendFailuresAreUnavailable() {
    final HttpResponseException throttled = httpError(429, "Too many requests");
    final HttpResponseException unauthorized = httpError(403, "Caller is not authorized to perform action on resource.");

    doThrow(throttled).when(client).getSecret(SECRET_NAME);
    assertThrows(ExternalManagerUnavailableException.class, () -> store.read(COORDINATE));

    doThrow(unauthorized).when(client).getSecret(SECRET_NAME);
    assertThrows(ExternalManagerUnavailableException.class, () -> store.read(COORDINATE));

    doThrow(new IllegalStateException("connection reset")).when(client).getSecret(SECRET_NAME);
    final ExternalManagerUnavailableException exception =
        assertThrows(ExternalManagerUnavailableException.class, () -> store.read(COORDINATE));
    assertTrue(exception.getMessage().contains(KEY_VAULT_URL));
  }

  @Test
  void testWriteFailureIsAStoreWriteError() {
    final HttpResponseException conflict = httpError(409, "Conflict");
    when(client.setSecret(any(KeyVaultSecret.class))).thenThrow(conflict);

    assertThrows(SecretStoreWriteException.class, () -> store.write(COORDINATE, "my secret !"));
  }

  @Test
  void testDeleteFailureIsUnavailable() {
    final HttpResponseException down = httpError(503, "Service unavailable");
    when(client.beginDeleteSecret(SECRET_NAME)).thenThrow(down);

    assertThrows(ExternalManagerUnavailableException.class, () -> store.delete(COORDINATE));
  }

  @Test
  void testSetExpiry() {
    final Instant expiry = Instant.parse("2025-01-15T10:00:00Z");
    when(client.getSecret(SECRET_NAME)).thenReturn(new KeyVaultSecret(SECRET_NAME, "old"));

    store.setExpiry(COORDINATE, expiry);

    final ArgumentCaptor<SecretProperties> captor = ArgumentCaptor.forClass(SecretProperties.class);
    verify(client).updateSecretProperties(captor.capture());
    assertEquals(expiry.atOffset(ZoneOffset.UTC), captor.getValue().getExpiresOn());
  }

  @Test
  @SuppressWarnings("unchecked")
  void testListExpired() {
    final Instant now = Instant.parse("2025-01-15T12:00:00Z");
    final List<SecretProperties> listed = List.of(
        properties(SECRET_NAME, now.minusSeconds(60).atOffset(ZoneOffset.UTC)),
        properties(SECRET_NAME.replace("-v2", "-v3"), now.plusSeconds(60).atOffset(ZoneOffset.UTC)),
        properties(SECRET_NAME.replace("-v2", "-v4"), null),
        properties("users-own-secret", now.minusSeconds(60).atOffset(ZoneOffset.UTC)));
    final PagedIterable<SecretProperties> secrets = mock(PagedIterable.class);
    when(secrets.iterator()).thenReturn(listed.iterator());
    when(client.listPropertiesOfSecrets()).thenReturn(secrets);

    assertEquals(List.of(COORDINATE), store.listExpired(now));
  }

  @Test
  void testIsOccupied() {
    when(client.getSecret(SECRET_NAME)).thenReturn(new KeyVaultSecret(SECRET_NAME, "value"));

    assertTrue(store.isOccupied(COORDINATE));
  }

  @Test
  void testDeletedSecretStillOccupiesItsName() {
    when(client.getSecret(SECRET_NAME)).thenThrow(new ResourceNotFoundException("not found", null));
    final DeletedSecret deleted = mock(DeletedSecret.class);
    when(client.getDeletedSecret(SECRET_NAME)).thenReturn(deleted);

    assertTrue(store.isOccupied(COORDINATE));
  }

  @Test
  void testDisabledSecretOccupiesItsName() {
    final HttpResponseException disabled = httpError(403, "Operation get is not allowed on a disabled secret.");
    when(client.getSecret(SECRET_NAME)).thenThrow(disabled);

    assertTrue(store.isOccupied(COORDINATE));
  }

  @Test
  void testUnusedName() {
    when(client.getSecret(SECRET_NAME)).thenThrow(new ResourceNotFoundException("not found", null));
    when(client.getDeletedSecret(SECRET_NAME)).thenThrow(new ResourceNotFoundException("not found", null));

    assertFalse(store.isOccupied(COORDINATE));
  }

  @Test
  void testSecretNameRoundTrip() {
    assertEquals(Optional.of(COORDINATE), AzureKeyVaultSecretStore.fromSecretName(SECRET_NAME));
    assertEquals(Optional.empty(), AzureKeyVaultSecretStore.fromSecretName("db-password"));
    assertTrue(AzureKeyVaultSecretStore.isManagedSecretName(COORDINATE.getFullCoordinate()));
    assertFalse(AzureKeyVaultSecretStore.isManagedSecretName("db_password"));
  }

  private static HttpResponseException httpError(final int status, final String message) {
    final HttpResponse response = mock(HttpResponse.class);
    when(response.getStatusCode()).thenReturn(status);
    return new HttpResponseException(message, response);
  }

  private static SecretProperties properties(final String name, final OffsetDateTime expiresOn) {
    final SecretProperties properties = mock(SecretProperties.class);
    when(properties.getName()).thenReturn(name);
    when(properties.getExpiresOn()).thenReturn(expiresOn);
    return properties;
  }

}
