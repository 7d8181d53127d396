package com.gentoro.recordbridge.exception;

import java.util.Map;

/** The backend answered 2xx but flagged the operation as failed in the payload. */
public class BackendOperationException extends RecordBridgeException {
  public BackendOperationException(String message) {
    super(RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE, message);
  }

  public BackendOperationException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE, message, cause);
  }

  public BackendOperationException(String message, Map<String, ?> context) {
    super(RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE, message, context);
  }

  public BackendOperationException(String message, Map<String, ?> context, Throwable cause) {
    super(RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE, message, context, cause);
  }
}
