/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import io.airbyte.config.secrets.persistence.SecretStore;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes coordinates that must eventually disappear from the secret store: secrets minted without an
 * owning workspace once their expiry passed, and coordinates whose deletion failed earlier.
 * {@link #sweep()} is run periodically, from any process sharing the store.
 * <p>
 * The store is the source of truth: expiries are written along with the payload, and a coordinate
 * whose deletion failed is marked as expired right away. Coordinates that could not even be marked are
 * also retried from an in-process queue. A coordinate is never deleted while another operation of this
 * process holds the lock of its secret.
 */
@Singleton
public class EphemeralSecretRegistry {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final SecretStore secretStore;
  private final SecretCoordinateLocks locks;
  private final Clock clock;

  private final Queue<SecretCoordinate> pendingDeletions = new ConcurrentLinkedQueue<>();

  public EphemeralSecretRegistry(@Named("secretStore") final SecretStore secretStore,
                                 final SecretCoordinateLocks locks,
                                 final Clock clock) {
    this.secretStore = secretStore;
    this.locks = locks;
    this.clock = clock;
  }

  /**
   * Retry the deletion of a coordinate on the next sweep.
   */
  public void queueDeletion(final SecretCoordinate coordinate) {
    pendingDeletions.add(coordinate);
    try {
      secretStore.setExpiry(coordinate, clock.instant());
    } catch (final RuntimeException e) {
      log.warn("Failed to mark secret {} as expired, only this process will retry its deletion", coordinate, e);
    }
  }

  /**
   * Forget a queued deletion because the coordinate holds a live payload again.
   */
  public void cancelDeletion(final SecretCoordinate coordinate) {
    pendingDeletions.remove(coordinate);
  }

  public int getPendingDeletionCount() {
    return pendingDeletions.size();
  }

  public int sweep() {
    return sweep(clock.instant());
  }

  /**
   * Delete every coordinate of the store expired at {@code now} and retry queued deletions. Failures
   * are logged and left for the next sweep.
   *
   * @param now current time
   * @return number of coordinates deleted
   */
  public int sweep(final Instant now) {
    final Set<SecretCoordinate> due = new LinkedHashSet<>();
    try {
      due.addAll(secretStore.listExpired(now));
    } catch (final RuntimeException e) {
      log.warn("Failed to list expired secrets, retrying on next sweep", e);
    }
    final int pending = pendingDeletions.size();
    for (int i = 0; i < pending; i++) {
      final SecretCoordinate coordinate = pendingDeletions.poll();
      if (coordinate == null) {
        break;
      }
      due.add(coordinate);
    }

    int deleted = 0;
    for (final SecretCoordinate coordinate : due) {
      if (deleteIfUnlocked(coordinate)) {
        deleted++;
      } else {
        pendingDeletions.add(coordinate);
      }
    }

    if (deleted > 0) {
      log.info("Swept {} expired or superseded secret coordinates", deleted);
    }
    return deleted;
  }

  private boolean deleteIfUnlocked(final SecretCoordinate coordinate) {
    final Lock lock = locks.forCoordinate(coordinate);
    if (!lock.tryLock()) {
      log.debug("Secret {} is in use, retrying on next sweep", coordinate);
      return false;
    }
    try {
      secretStore.delete(coordinate);
      return true;
    } catch (final RuntimeException e) {
      log.warn("Failed to delete secret {}, retrying on next sweep", coordinate, e);
      return false;
    } finally {
      lock.unlock();
    }
  }

}
