package com.gentoro.recordbridge.exception;

import java.util.Map;

/** Network-level failure or a non-2xx backend status unrelated to authorization. */
public class TransportException extends RecordBridgeException {
  public TransportException(String message) {
    super(RecordBridgeErrorCode.TRANSPORT_ERROR, message);
  }

  public TransportException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.TRANSPORT_ERROR, message, cause);
  }

  public TransportException(String message, Map<String, ?> context) {
    super(RecordBridgeErrorCode.TRANSPORT_ERROR, message, context);
  }

  public TransportException(String message, Map<String, ?> context, Throwable cause) {
    super(RecordBridgeErrorCode.TRANSPORT_ERROR, message, context, cause);
  }
}
