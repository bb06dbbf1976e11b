/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.google.common.base.Preconditions;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import java.util.UUID;

/**
 * Identifies one version of a secret payload held by the secret store. The owner and base id never
 * change across versions, only the version does.
 *
 * @param ownerId workspace the secret belongs to, or the ephemeral owner
 * @param baseId random id minted when the secret was first written
 * @param version positive version, starting at 1
 */
public record SecretCoordinate(UUID ownerId, UUID baseId, long version) implements SecretReference {

  public SecretCoordinate {
    Preconditions.checkNotNull(ownerId, "ownerId");
    Preconditions.checkNotNull(baseId, "baseId");
    Preconditions.checkArgument(version >= 1, "version must be positive, got %s", version);
  }

  /**
   * Coordinate without its version, shared by every version of the same secret.
   *
   * @return coordinate base
   */
  public String getCoordinateBase() {
    return String.format("%s_%s_secret_%s", AirbyteSecretConstants.COORDINATE_PREFIX, ownerId, baseId);
  }

  public String getFullCoordinate() {
    return getCoordinateBase() + "_v" + version;
  }

  /**
   * Ephemeral coordinates are minted outside of a workspace and expire.
   *
   * @return true if owned by the ephemeral owner
   */
  public boolean isEphemeral() {
    return AirbyteSecretConstants.EPHEMERAL_OWNER_ID.equals(ownerId);
  }

  @Override
  public String toPersistedString() {
    return getFullCoordinate();
  }

  @Override
  public String toString() {
    return getFullCoordinate();
  }

}
