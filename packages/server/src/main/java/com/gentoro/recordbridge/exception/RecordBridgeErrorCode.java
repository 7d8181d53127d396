package com.gentoro.recordbridge.exception;

/**
 * Canonical error codes for RecordBridge. Codes are stable and suitable for tool-calling clients
 * and logs; a client decides whether to retry, ask for different input or give up based on the
 * code alone.
 */
public enum RecordBridgeErrorCode {
  // Pre-flight, never sent over the wire
  UNKNOWN_ENTITY,
  UNSUPPORTED_OPERATION,
  INVALID_ARGUMENT,
  INVALID_REGISTRY_ENTRY,

  // Session and transport
  UNAUTHENTICATED,
  TRANSPORT_TIMEOUT,
  TRANSPORT_ERROR,

  // Backend accepted the call but rejected the operation
  BACKEND_OPERATION_FAILURE,

  // Ambient
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  UNKNOWN,
}
