package com.gentoro.recordbridge.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or tool responses. If the
   * throwable is a {@link RecordBridgeException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof RecordBridgeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext().isEmpty() ? null : ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        RecordBridgeErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /** {@code t} itself when it already belongs to the hierarchy, otherwise {@code wrap(t)}. */
  public static RecordBridgeException asRecordBridgeException(
      Throwable t, Function<Throwable, RecordBridgeException> wrap) {
    return t instanceof RecordBridgeException ex ? ex : wrap.apply(t);
  }
}
