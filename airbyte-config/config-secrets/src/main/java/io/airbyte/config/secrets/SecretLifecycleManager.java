/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Preconditions;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import io.airbyte.commons.json.JsonSchemas;
import io.airbyte.commons.json.Jsons;
import io.airbyte.config.secrets.config.SecretsConfig;
import io.airbyte.config.secrets.errors.SecretNotFoundException;
import io.airbyte.config.secrets.errors.SecretOwnershipException;
import io.airbyte.config.secrets.errors.SecretProcessingException;
import io.airbyte.config.secrets.errors.SecretStoreWriteException;
import io.airbyte.config.secrets.persistence.SecretStore;
import jakarta.annotation.Nullable;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.lang.invoke.MethodHandles;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves secrets in and out of configurations.
 * <p>
 * Obfuscation replaces every secret value of a configuration with a reference before it is
 * persisted: plain values are written to the {@link SecretStore} under a coordinate, external
 * references are validated and kept as references. Hydration does the reverse right before a
 * configuration is used. This class is the only writer of the secret store.
 * <p>
 * Obfuscating a configuration is all-or-nothing. If any secret cannot be handled, everything written
 * by the call is deleted again and the previous coordinates are left untouched.
 */
@Singleton
public class SecretLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final SecretTreeWalker treeWalker;
  private final SecretReferenceParser referenceParser;
  private final SecretCoordinateCodec coordinateCodec;
  private final SecretStore secretStore;
  private final ExternalReferenceResolver externalReferenceResolver;
  private final EphemeralSecretRegistry ephemeralSecretRegistry;
  private final SecretCoordinateLocks locks;
  private final SecretsConfig secretsConfig;
  private final Clock clock;

  public SecretLifecycleManager(final SecretTreeWalker treeWalker,
                                final SecretReferenceParser referenceParser,
                                final SecretCoordinateCodec coordinateCodec,
                                @Named("secretStore") final SecretStore secretStore,
                                final ExternalReferenceResolver externalReferenceResolver,
                                final EphemeralSecretRegistry ephemeralSecretRegistry,
                                final SecretCoordinateLocks locks,
                                final SecretsConfig secretsConfig,
                                final Clock clock) {
    this.treeWalker = treeWalker;
    this.referenceParser = referenceParser;
    this.coordinateCodec = coordinateCodec;
    this.secretStore = secretStore;
    this.externalReferenceResolver = externalReferenceResolver;
    this.ephemeralSecretRegistry = ephemeralSecretRegistry;
    this.locks = locks;
    this.secretsConfig = secretsConfig;
    this.clock = clock;
  }

  /**
   * Obfuscate a new configuration.
   *
   * @param config configuration holding plain secrets or references
   * @param schema connector schema of the configuration
   * @param ownerId owning workspace, or {@link AirbyteSecretConstants#EPHEMERAL_OWNER_ID}
   * @return configuration safe to persist
   */
  public JsonNode obfuscate(final JsonNode config, final JsonNode schema, final UUID ownerId) {
    return obfuscate(config, schema, ownerId, null);
  }

  /**
   * Obfuscate an updated configuration. A secret left unchanged since {@code previousConfig} keeps its
   * coordinate, a changed one gets the next version of it, and coordinates the result no longer
   * references are deleted once the whole configuration went through.
   *
   * @param config configuration holding plain secrets, masks or references
   * @param schema connector schema of the configuration
   * @param ownerId owning workspace, or {@link AirbyteSecretConstants#EPHEMERAL_OWNER_ID}
   * @param previousConfig currently persisted obfuscated configuration, null on creation
   * @return configuration safe to persist
   */
  public JsonNode obfuscate(final JsonNode config,
                            final JsonNode schema,
                            final UUID ownerId,
                            @Nullable final JsonNode previousConfig) {
    Preconditions.checkNotNull(ownerId, "ownerId");
    final Set<SecretCoordinate> previousCoordinates = previousConfig == null ? Set.of() : collectCoordinates(previousConfig, schema);
    final ObfuscationContext context = new ObfuscationContext(ownerId, previousConfig);

    final JsonNode obfuscated;
    try {
      obfuscated = treeWalker.walk(config, schema, (path, value, leafSchema) -> obfuscateLeaf(context, path, value));
    } catch (final RuntimeException e) {
      rollback(context);
      throw e;
    }

    for (final SecretCoordinate previous : previousCoordinates) {
      if (previous.ownerId().equals(ownerId) && !context.referenced.contains(previous)) {
        deleteSuperseded(previous);
      }
    }
    return obfuscated;
  }

  /**
   * Replace every reference of a configuration with the secret it points to. The result must stay in
   * memory: never persist or log it.
   *
   * @param config obfuscated configuration
   * @param schema connector schema of the configuration
   * @return configuration holding the actual secrets
   * @throws SecretNotFoundException if a referenced secret does not exist
   */
  public JsonNode hydrate(final JsonNode config, final JsonNode schema) {
    return treeWalker.walk(config, schema, (path, value, leafSchema) -> hydrateLeaf(value, leafSchema));
  }

  /**
   * List the coordinates a configuration refers to, in document order.
   *
   * @param config obfuscated configuration
   * @param schema connector schema of the configuration
   * @return referenced coordinates
   */
  public Set<SecretCoordinate> collectCoordinates(final JsonNode config, final JsonNode schema) {
    final Set<SecretCoordinate> coordinates = new LinkedHashSet<>();
    treeWalker.walk(config, schema, (path, value, leafSchema) -> {
      referenceParser.parse(value)
          .filter(SecretCoordinate.class::isInstance)
          .map(SecretCoordinate.class::cast)
          .ifPresent(coordinates::add);
      return value;
    });
    return Collections.unmodifiableSet(coordinates);
  }

  /**
   * Delete the secrets of a configuration that is being removed.
   *
   * @param config obfuscated configuration
   * @param schema connector schema of the configuration
   * @return number of coordinates deleted
   */
  public int deleteFromConfig(final JsonNode config, final JsonNode schema) {
    return deleteAll(collectCoordinates(config, schema));
  }

  /**
   * Delete each coordinate and every lower version of it. Failures are logged and do not stop the
   * remaining deletions.
   *
   * @param coordinates coordinates to delete
   * @return number of coordinates deleted
   */
  public int deleteAll(final Collection<SecretCoordinate> coordinates) {
    int deleted = 0;
    for (final SecretCoordinate coordinate : coordinates) {
      for (long version = coordinate.version(); version >= 1; version--) {
        final SecretCoordinate target = new SecretCoordinate(coordinate.ownerId(), coordinate.baseId(), version);
        final Lock lock = locks.forCoordinate(target);
        lock.lock();
        try {
          secretStore.delete(target);
          deleted++;
        } catch (final RuntimeException e) {
          log.warn("Failed to delete secret {}", target, e);
        } finally {
          lock.unlock();
        }
      }
    }
    return deleted;
  }

  private JsonNode obfuscateLeaf(final ObfuscationContext context, final JsonPointer path, final JsonNode submitted) {
    final Optional<JsonNode> previousValue = context.previousValueAt(path);

    JsonNode value = submitted;
    if (isMask(submitted)) {
      // the user did not touch this secret
      value = previousValue
          .filter(previous -> !previous.isNull())
          .orElseThrow(() -> new SecretNotFoundException(String.format("No existing secret to keep at %s", path)));
    }

    final Optional<SecretReference> reference = referenceParser.parse(value);
    if (reference.isPresent() && reference.get() instanceof SecretCoordinate coordinate) {
      if (!coordinate.ownerId().equals(context.ownerId) && !previousValue.map(value::equals).orElse(false)) {
        throw new SecretOwnershipException(path.toString(), context.ownerId);
      }
      if (coordinate.isEphemeral() && coordinate.ownerId().equals(context.ownerId)) {
        return SecretReferenceParser.toPersistedNode(renewEphemeral(context, coordinate));
      }
      context.referenced.add(coordinate);
      return SecretReferenceParser.toPersistedNode(coordinate);
    }
    if (reference.isPresent()) {
      final ExternalSecretReference externalReference = (ExternalSecretReference) reference.get();
      externalReferenceResolver.validate(externalReference);
      return SecretReferenceParser.toPersistedNode(externalReference);
    }

    final String payload = value.isTextual() ? value.asText() : Jsons.serialize(value);
    final Optional<SecretCoordinate> previousCoordinate = previousValue
        .filter(SecretReferenceParser::isCoordinateWrapper)
        .flatMap(referenceParser::parse)
        .map(SecretCoordinate.class::cast)
        .filter(previous -> previous.ownerId().equals(context.ownerId));

    if (previousCoordinate.isEmpty()) {
      final SecretCoordinate minted = coordinateCodec.mint(context.ownerId);
      write(context, minted, payload);
      return SecretReferenceParser.toPersistedNode(minted);
    }

    final SecretCoordinate previous = previousCoordinate.get();
    final Lock lock = locks.forCoordinate(previous);
    lock.lock();
    try {
      // an ephemeral secret is always rewritten so that the new config gets a full expiry
      if (!previous.isEphemeral() && readExisting(previous).map(payload::equals).orElse(false)) {
        context.referenced.add(previous);
        return SecretReferenceParser.toPersistedNode(previous);
      }
      final SecretCoordinate next = nextFreeVersion(previous);
      write(context, next, payload);
      log.info("Advanced secret {} to version {}", previous.getCoordinateBase(), next.version());
      return SecretReferenceParser.toPersistedNode(next);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copy an ephemeral secret to its next version with a fresh expiry. The old version is superseded.
   */
  private SecretCoordinate renewEphemeral(final ObfuscationContext context, final SecretCoordinate coordinate) {
    final Lock lock = locks.forCoordinate(coordinate);
    lock.lock();
    try {
      final SecretCoordinate next = nextFreeVersion(coordinate);
      write(context, next, secretStore.read(coordinate));
      return next;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Versions written by a failed or concurrent call may still be stored, queued for deletion, or
   * reserved by the backend, so they are skipped.
   */
  private SecretCoordinate nextFreeVersion(final SecretCoordinate previous) {
    SecretCoordinate next = coordinateCodec.nextVersion(previous);
    while (secretStore.isOccupied(next)) {
      log.info("Version {} of secret {} was written before, skipping it", next.version(), next.getCoordinateBase());
      next = coordinateCodec.nextVersion(next);
    }
    return next;
  }

  private JsonNode hydrateLeaf(final JsonNode value, final JsonNode leafSchema) {
    final Optional<SecretReference> reference = referenceParser.parse(value);
    if (reference.isEmpty()) {
      // never obfuscated
      return value.deepCopy();
    }
    if (reference.get() instanceof SecretCoordinate coordinate) {
      final Lock lock = locks.forCoordinate(coordinate);
      lock.lock();
      try {
        return toHydratedNode(secretStore.read(coordinate), leafSchema);
      } finally {
        lock.unlock();
      }
    }
    return toHydratedNode(externalReferenceResolver.resolve((ExternalSecretReference) reference.get()), leafSchema);
  }

  /**
   * Payloads are strings. A secret declared with a non-string type was stored as JSON and is parsed
   * back.
   */
  private static JsonNode toHydratedNode(final String payload, final JsonNode leafSchema) {
    final List<String> types = JsonSchemas.getTypes(leafSchema);
    if (types.isEmpty() || types.contains(JsonSchemas.STRING_TYPE)) {
      return TextNode.valueOf(payload);
    }
    return Jsons.tryDeserialize(payload).orElseGet(() -> TextNode.valueOf(payload));
  }

  private static boolean isMask(final JsonNode value) {
    return value.isTextual() && AirbyteSecretConstants.SECRETS_MASK.equals(value.asText());
  }

  private Optional<String> readExisting(final SecretCoordinate coordinate) {
    try {
      return Optional.of(secretStore.read(coordinate));
    } catch (final SecretNotFoundException e) {
      log.warn("Previous secret {} is missing from the store, writing a new version", coordinate);
      return Optional.empty();
    }
  }

  private void write(final ObfuscationContext context, final SecretCoordinate coordinate, final String payload) {
    context.written.add(coordinate);
    context.referenced.add(coordinate);
    ephemeralSecretRegistry.cancelDeletion(coordinate);
    try {
      if (coordinate.isEphemeral()) {
        final Instant expiresAt = clock.instant().plus(secretsConfig.ephemeralTtl());
        secretStore.writeWithExpiry(coordinate, payload, expiresAt);
      } else {
        secretStore.write(coordinate, payload);
      }
    } catch (final SecretProcessingException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new SecretStoreWriteException(coordinate.getFullCoordinate(), e);
    }
  }

  private void rollback(final ObfuscationContext context) {
    for (final SecretCoordinate coordinate : context.written) {
      try {
        secretStore.delete(coordinate);
      } catch (final RuntimeException e) {
        log.warn("Failed to roll back secret {}, queued for deletion", coordinate, e);
        ephemeralSecretRegistry.queueDeletion(coordinate);
      }
    }
    if (!context.written.isEmpty()) {
      log.info("Rolled back {} secrets written by a failed obfuscation", context.written.size());
    }
  }

  private void deleteSuperseded(final SecretCoordinate coordinate) {
    final Lock lock = locks.forCoordinate(coordinate);
    lock.lock();
    try {
      secretStore.delete(coordinate);
      log.debug("Deleted superseded secret {}", coordinate);
    } catch (final RuntimeException e) {
      log.warn("Failed to delete superseded secret {}, queued for deletion", coordinate, e);
      ephemeralSecretRegistry.queueDeletion(coordinate);
    } finally {
      lock.unlock();
    }
  }

  /**
   * State of a single obfuscation call.
   */
  private static final class ObfuscationContext {

    private final UUID ownerId;
    @Nullable
    private final JsonNode previousConfig;
    private final List<SecretCoordinate> written = new ArrayList<>();
    private final Set<SecretCoordinate> referenced = new HashSet<>();

    private ObfuscationContext(final UUID ownerId, @Nullable final JsonNode previousConfig) {
      this.ownerId = ownerId;
      this.previousConfig = previousConfig;
    }

    private Optional<JsonNode> previousValueAt(final JsonPointer path) {
      return Jsons.getOptional(previousConfig, path);
    }

  }

}
