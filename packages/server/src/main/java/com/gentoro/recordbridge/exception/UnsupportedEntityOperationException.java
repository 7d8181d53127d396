package com.gentoro.recordbridge.exception;

import java.util.Map;

/** The entity exists but does not allow the requested operation. */
public class UnsupportedEntityOperationException extends RecordBridgeException {
  public UnsupportedEntityOperationException(String entityKey, String operation) {
    super(
        RecordBridgeErrorCode.UNSUPPORTED_OPERATION,
        "Operation '%s' is not supported for entity '%s'".formatted(operation, entityKey),
        Map.of("entity", entityKey, "operation", operation));
  }
}
