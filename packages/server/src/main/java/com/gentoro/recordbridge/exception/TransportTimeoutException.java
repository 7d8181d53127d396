package com.gentoro.recordbridge.exception;

import java.util.Map;

/** An outbound call exceeded its configured timeout. Never retried automatically. */
public class TransportTimeoutException extends RecordBridgeException {
  public TransportTimeoutException(String message) {
    super(RecordBridgeErrorCode.TRANSPORT_TIMEOUT, message);
  }

  public TransportTimeoutException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.TRANSPORT_TIMEOUT, message, cause);
  }

  public TransportTimeoutException(String message, Map<String, ?> context) {
    super(RecordBridgeErrorCode.TRANSPORT_TIMEOUT, message, context);
  }

  public TransportTimeoutException(String message, Map<String, ?> context, Throwable cause) {
    super(RecordBridgeErrorCode.TRANSPORT_TIMEOUT, message, context, cause);
  }
}
