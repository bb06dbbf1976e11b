/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.persistence;

import io.airbyte.config.secrets.SecretCoordinate;
import java.time.Instant;
import java.util.List;

/**
 * Durable key/value store holding secret payloads by coordinate. Every version of a secret is its
 * own entry.
 */
public interface SecretStore {

  /**
   * Store a payload, replacing any payload already stored at the coordinate.
   *
   * @param coordinate where to store
   * @param payload secret value
   */
  void write(SecretCoordinate coordinate, String payload);

  /**
   * Store a payload that the store may discard after {@code expiry}.
   *
   * @param coordinate where to store
   * @param payload secret value
   * @param expiry instant after which the payload is no longer needed, null for none
   */
  void writeWithExpiry(SecretCoordinate coordinate, String payload, Instant expiry);

  /**
   * Read a payload.
   *
   * @param coordinate coordinate to read
   * @return stored payload
   * @throws io.airbyte.config.secrets.errors.SecretNotFoundException if nothing is stored there
   */
  String read(SecretCoordinate coordinate);

  /**
   * Delete a payload. Deleting a coordinate that holds nothing is not an error.
   *
   * @param coordinate coordinate to delete
   */
  void delete(SecretCoordinate coordinate);

  /**
   * Change the expiry of a stored payload. Used to hand a coordinate over to whichever process sweeps
   * the store next.
   *
   * @param coordinate stored coordinate
   * @param expiry instant after which the payload is no longer needed
   */
  void setExpiry(SecretCoordinate coordinate, Instant expiry);

  /**
   * List every stored coordinate whose expiry is at or before {@code now}, whatever its owner.
   *
   * @param now current time
   * @return expired coordinates
   */
  List<SecretCoordinate> listExpired(Instant now);

  /**
   * Whether a coordinate was written before and must not be written again: it still holds a payload
   * (expired or not), or the backend keeps its name reserved after deletion.
   *
   * @param coordinate coordinate to check
   * @return true if the coordinate cannot be used for a new payload
   */
  boolean isOccupied(SecretCoordinate coordinate);

}
