package com.gentoro.recordbridge.exception;

/** JSON or YAML (de)serialization failure. */
public class SerializationException extends RecordBridgeException {
  public SerializationException(String message) {
    super(RecordBridgeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
