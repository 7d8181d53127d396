package com.gentoro.recordbridge.exception;

/** Configuration missing or invalid. */
public class ConfigException extends RecordBridgeException {
  public ConfigException(String message) {
    super(RecordBridgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(RecordBridgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
