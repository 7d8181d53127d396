package com.gentoro.recordbridge.exception;

import java.util.Map;

/** Input validation failure or illegal argument, detected before any network call. */
public class ValidationException extends RecordBridgeException {
  public ValidationException(String message) {
    super(RecordBridgeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(RecordBridgeErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Map<String, ?> context, Throwable cause) {
    super(RecordBridgeErrorCode.INVALID_ARGUMENT, message, context, cause);
  }
}
