/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets;

import com.google.common.base.Preconditions;
import io.airbyte.commons.constants.AirbyteSecretConstants;

/**
 * Reference to a secret that lives in an external secret manager. The platform never stores the
 * value behind it and always resolves it live.
 *
 * @param name exact, case-sensitive name known to the external secret manager
 * @param syntax syntax the reference was written with
 */
public record ExternalSecretReference(String name, Syntax syntax) implements SecretReference {

  /**
   * The two equivalent ways of writing a reference.
   */
  public enum Syntax {
    /** {@code ${NAME}}. */
    BRACKET,
    /** {@code secret_coordinate::NAME}. */
    PREFIX
  }

  public ExternalSecretReference {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "reference name must not be empty");
    Preconditions.checkNotNull(syntax, "syntax");
  }

  /**
   * References are equal when their names are, whatever syntax they were written with.
   */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ExternalSecretReference other)) {
      return false;
    }
    return name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  /**
   * References are always persisted in the prefix syntax, which can express any name.
   */
  @Override
  public String toPersistedString() {
    return AirbyteSecretConstants.SECRET_REFERENCE_PREFIX + name;
  }

}
