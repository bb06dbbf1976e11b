/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.persistence;

import io.airbyte.config.secrets.SecretCoordinate;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local store. Used by default and in tests. Expiry is recorded but not enforced on reads:
 * expired entries are listed by {@link #listExpired(Instant)} and removed by the sweep like on any
 * other store.
 */
@Singleton
@Requires(property = "airbyte.secret.persistence", value = "in_memory", defaultValue = "in_memory")
@Named("secretStore")
public class InMemorySecretStore implements SecretStore {

  private final Map<SecretCoordinate, String> payloads = new ConcurrentHashMap<>();
  private final Map<SecretCoordinate, Instant> expiries = new ConcurrentHashMap<>();

  @Override
  public void write(final SecretCoordinate coordinate, final String payload) {
    payloads.put(coordinate, payload);
    expiries.remove(coordinate);
  }

  @Override
  public void writeWithExpiry(final SecretCoordinate coordinate, final String payload, final Instant expiry) {
    payloads.put(coordinate, payload);
    if (expiry != null) {
      expiries.put(coordinate, expiry);
    } else {
      expiries.remove(coordinate);
    }
  }

  @Override
  public String read(final SecretCoordinate coordinate) {
    final String payload = payloads.get(coordinate);
    if (payload == null) {
      throw SecretNotFoundException.forCoordinate(coordinate.getFullCoordinate());
    }
    return payload;
  }

  @Override
  public void delete(final SecretCoordinate coordinate) {
    payloads.remove(coordinate);
    expiries.remove(coordinate);
  }

  @Override
  public void setExpiry(final SecretCoordinate coordinate, final Instant expiry) {
    if (!payloads.containsKey(coordinate)) {
      throw SecretNotFoundException.forCoordinate(coordinate.getFullCoordinate());
    }
    expiries.put(coordinate, expiry);
  }

  @Override
  public List<SecretCoordinate> listExpired(final Instant now) {
    return expiries.entrySet().stream()
        .filter(entry -> !now.isBefore(entry.getValue()))
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  /**
   * A deleted entry leaves nothing behind, so only stored payloads occupy a coordinate.
   */
  @Override
  public boolean isOccupied(final SecretCoordinate coordinate) {
    return payloads.containsKey(coordinate);
  }

  public boolean contains(final SecretCoordinate coordinate) {
    return payloads.containsKey(coordinate);
  }

  public int size() {
    return payloads.size();
  }

}
