/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.google.common.annotations.VisibleForTesting;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import io.airbyte.config.secrets.errors.MalformedCoordinateException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mints coordinates and converts them to and from their string form
 * {@code airbyte_workspace_<owner>_secret_<base>_v<version>}. {@code parse(format(c))} returns
 * {@code c} for every coordinate.
 */
@Singleton
public class SecretCoordinateCodec {

  private static final String UUID_REGEX = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

  private static final Pattern COORDINATE_PATTERN = Pattern.compile(
      "^" + Pattern.quote(AirbyteSecretConstants.COORDINATE_PREFIX)
          + "_(" + UUID_REGEX + ")_secret_(" + UUID_REGEX + ")_v([1-9][0-9]*)$");

  private final Supplier<UUID> uuidSupplier;

  @Inject
  public SecretCoordinateCodec() {
    this(UUID::randomUUID);
  }

  @VisibleForTesting
  public SecretCoordinateCodec(final Supplier<UUID> uuidSupplier) {
    this.uuidSupplier = uuidSupplier;
  }

  /**
   * Mint the first version of a brand-new secret.
   *
   * @param ownerId owning workspace, or {@link AirbyteSecretConstants#EPHEMERAL_OWNER_ID}
   * @return coordinate at version 1 with a fresh base id
   */
  public SecretCoordinate mint(final UUID ownerId) {
    return new SecretCoordinate(ownerId, uuidSupplier.get(), 1);
  }

  public String format(final SecretCoordinate coordinate) {
    return coordinate.getFullCoordinate();
  }

  /**
   * Parse the string form of a coordinate.
   *
   * @param fullCoordinate coordinate string
   * @return parsed coordinate
   * @throws MalformedCoordinateException if the string does not follow the coordinate grammar
   */
  public SecretCoordinate parse(final String fullCoordinate) {
    if (fullCoordinate == null) {
      throw new MalformedCoordinateException("null");
    }
    final Matcher matcher = COORDINATE_PATTERN.matcher(fullCoordinate);
    if (!matcher.matches()) {
      throw new MalformedCoordinateException(fullCoordinate);
    }
    try {
      return new SecretCoordinate(
          UUID.fromString(matcher.group(1)),
          UUID.fromString(matcher.group(2)),
          Long.parseLong(matcher.group(3)));
    } catch (final IllegalArgumentException e) {
      // version overflow
      throw new MalformedCoordinateException(fullCoordinate);
    }
  }

  public SecretCoordinate nextVersion(final SecretCoordinate coordinate) {
    return new SecretCoordinate(coordinate.ownerId(), coordinate.baseId(), coordinate.version() + 1);
  }

}
