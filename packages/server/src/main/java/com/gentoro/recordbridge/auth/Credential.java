package com.gentoro.recordbridge.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token plus its absolute expiry. Replaced wholesale on refresh, never mutated.
 *
 * @param refreshToken may be null when the backend does not issue one
 */
public record Credential(String accessToken, String refreshToken, Instant expiresAt) {

  public Credential {
    Objects.requireNonNull(accessToken, "accessToken");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  /** True while {@code now} is before {@code expiresAt - safetyMargin}. */
  public boolean isUsableAt(Instant now, Duration safetyMargin) {
    return now.isBefore(expiresAt.minus(safetyMargin));
  }

  @Override
  public String toString() {
    return "Credential{expiresAt=" + expiresAt + "}";
  }
}
