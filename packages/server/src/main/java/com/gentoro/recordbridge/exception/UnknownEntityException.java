package com.gentoro.recordbridge.exception;

import java.util.Map;

/** The requested entity key is not registered. */
public class UnknownEntityException extends RecordBridgeException {
  private final String entityKey;

  public UnknownEntityException(String entityKey, Iterable<String> knownKeys) {
    super(
        RecordBridgeErrorCode.UNKNOWN_ENTITY,
        "Unknown entity: '%s'. Valid entities: %s"
            .formatted(entityKey, String.join(", ", knownKeys)),
        Map.of("entity", String.valueOf(entityKey)));
    this.entityKey = entityKey;
  }

  public String getEntityKey() {
    return entityKey;
  }
}
