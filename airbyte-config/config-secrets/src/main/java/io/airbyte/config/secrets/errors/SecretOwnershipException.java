/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.config.secrets.errors;

import java.io.Serial;
import java.util.UUID;

/**
 * A configuration references a coordinate owned by another workspace.
 */
public class SecretOwnershipException extends SecretProcessingException {

  @Serial
  private static final long serialVersionUID = 7263514096117835230L;

  public SecretOwnershipException(final String path, final UUID ownerId) {
    super(String.format("Secret at %s is not owned by %s", path, ownerId));
  }

}
