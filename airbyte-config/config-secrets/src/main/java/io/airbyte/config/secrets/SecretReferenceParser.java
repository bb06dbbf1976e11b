/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.airbyte.commons.constants.AirbyteSecretConstants;
import io.airbyte.commons.json.Jsons;
import io.airbyte.config.secrets.ExternalSecretReference.Syntax;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes references embedded in a configuration value.
 * <p>
 * A coordinate wrapper {@code {"_secret": "<coordinate>"}} parses to a {@link SecretCoordinate}.
 * The strings {@code ${NAME}} and {@code secret_coordinate::NAME} both parse to the same
 * {@link ExternalSecretReference}. Anything else is not a reference. A literal value that happens to
 * match one of the reference syntaxes is always read as a reference.
 */
@Singleton
public class SecretReferenceParser {

  private static final Pattern BRACKET_PATTERN = Pattern.compile("^\\$\\{([^}]+)}$");

  private final SecretCoordinateCodec coordinateCodec;

  public SecretReferenceParser(final SecretCoordinateCodec coordinateCodec) {
    this.coordinateCodec = coordinateCodec;
  }

  /**
   * Parse a configuration value.
   *
   * @param value value found at a secret location, may be null
   * @return the reference it holds, empty if it is plain data
   * @throws io.airbyte.config.secrets.errors.MalformedCoordinateException if the value is a
   *         coordinate wrapper holding an invalid coordinate
   */
  public Optional<SecretReference> parse(final JsonNode value) {
    if (value == null) {
      return Optional.empty();
    }
    if (isCoordinateWrapper(value)) {
      return Optional.of(coordinateCodec.parse(value.get(AirbyteSecretConstants.COORDINATE_FIELD).asText()));
    }
    if (value.isTextual()) {
      return parseExternal(value.asText()).map(SecretReference.class::cast);
    }
    return Optional.empty();
  }

  /**
   * Parse either external reference syntax.
   *
   * @param value string value
   * @return reference, empty if the string uses neither syntax
   */
  public Optional<ExternalSecretReference> parseExternal(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    final Matcher bracket = BRACKET_PATTERN.matcher(value);
    if (bracket.matches()) {
      return Optional.of(new ExternalSecretReference(bracket.group(1), Syntax.BRACKET));
    }
    if (value.startsWith(AirbyteSecretConstants.SECRET_REFERENCE_PREFIX)
        && value.length() > AirbyteSecretConstants.SECRET_REFERENCE_PREFIX.length()) {
      return Optional.of(new ExternalSecretReference(value.substring(AirbyteSecretConstants.SECRET_REFERENCE_PREFIX.length()), Syntax.PREFIX));
    }
    return Optional.empty();
  }

  /**
   * A coordinate wrapper is an object with exactly one string field named {@code _secret}.
   *
   * @param value node to check
   * @return true if the node is a coordinate wrapper
   */
  public static boolean isCoordinateWrapper(final JsonNode value) {
    return value != null
        && value.isObject()
        && value.size() == 1
        && value.path(AirbyteSecretConstants.COORDINATE_FIELD).isTextual();
  }

  /**
   * Render a reference the way it is written into a persisted configuration.
   *
   * @param reference reference to render
   * @return coordinate wrapper for a coordinate, canonical string for an external reference
   */
  public static JsonNode toPersistedNode(final SecretReference reference) {
    if (reference instanceof SecretCoordinate coordinate) {
      final ObjectNode wrapper = Jsons.objectNode();
      wrapper.put(AirbyteSecretConstants.COORDINATE_FIELD, coordinate.getFullCoordinate());
      return wrapper;
    }
    return TextNode.valueOf(reference.toPersistedString());
  }

}
