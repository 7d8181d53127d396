package com.gentoro.recordbridge.exception;

import java.util.Map;

/** An entity definition is malformed; raised while the registry is built, never at dispatch. */
public class InvalidRegistryEntryException extends RecordBridgeException {
  public InvalidRegistryEntryException(String entityKey, String message) {
    super(
        RecordBridgeErrorCode.INVALID_REGISTRY_ENTRY,
        "Invalid registry entry '%s': %s".formatted(entityKey, message),
        Map.of("entity", String.valueOf(entityKey)));
  }
}
