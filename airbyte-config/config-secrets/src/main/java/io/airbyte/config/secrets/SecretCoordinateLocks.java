/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.google.common.util.concurrent.Striped;
import jakarta.inject.Singleton;
import java.util.concurrent.locks.Lock;

/**
 * Locks shared by every version of one secret, keyed by its base id.
 */
@Singleton
public class SecretCoordinateLocks {

  private static final int STRIPES = 64;

  private final Striped<Lock> locks = Striped.lock(STRIPES);

  public Lock forCoordinate(final SecretCoordinate coordinate) {
    return locks.get(coordinate.baseId());
  }

}
