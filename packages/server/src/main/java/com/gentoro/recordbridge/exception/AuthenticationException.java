package com.gentoro.recordbridge.exception;

import java.util.Map;

/** Login or refresh failed, or the backend kept rejecting a freshly issued token. */
public class AuthenticationException extends RecordBridgeException {
  public AuthenticationException(String message) {
    super(RecordBridgeErrorCode.UNAUTHENTICATED, message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.UNAUTHENTICATED, message, cause);
  }

  public AuthenticationException(String message, Map<String, ?> context) {
    super(RecordBridgeErrorCode.UNAUTHENTICATED, message, context);
  }

  public AuthenticationException(String message, Map<String, ?> context, Throwable cause) {
    super(RecordBridgeErrorCode.UNAUTHENTICATED, message, context, cause);
  }
}
