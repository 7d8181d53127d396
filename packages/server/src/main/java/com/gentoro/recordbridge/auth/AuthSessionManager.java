package com.gentoro.recordbridge.auth;

import com.gentoro.recordbridge.exception.AuthenticationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Owns the cached {@link Credential} and hands out bearer tokens that stay valid for at least the
 * safety margin.
 *
 * <p>The manager is passive: it only acts when a caller asks for a credential. Transitions:
 *
 * <ul>
 *   <li>{@code UNAUTHENTICATED -> AUTHENTICATED}: first request performs a login.
 *   <li>{@code AUTHENTICATED -> AUTHENTICATED}: a request past {@code expiry - safetyMargin}
 *       refreshes first; a failed refresh falls through to one fresh login.
 *   <li>{@code AUTHENTICATED -> EXPIRED -> AUTHENTICATED}: the backend rejected a token we
 *       believed valid; {@link #reauthenticate(Credential)} drops it and forces a new login.
 * </ul>
 *
 * <p>All exchanges run under a single monitor, so concurrent callers observe at most one login or
 * refresh in flight. A caller that waited on the monitor re-checks the cache first and reuses the
 * credential the previous holder obtained.
 */
public class AuthSessionManager {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(AuthSessionManager.class);

  private final Authenticator authenticator;
  private final Clock clock;
  private final Duration safetyMargin;
  private final Object exchangeLock = new Object();

  private volatile Credential current;
  private volatile SessionState state = SessionState.UNAUTHENTICATED;

  public AuthSessionManager(Authenticator authenticator, Duration safetyMargin) {
    this(authenticator, safetyMargin, Clock.systemUTC());
  }

  public AuthSessionManager(Authenticator authenticator, Duration safetyMargin, Clock clock) {
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.safetyMargin = Objects.requireNonNull(safetyMargin, "safetyMargin");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Return a credential valid for at least the safety margin, logging in or refreshing first. */
  public Credential credential() {
    Credential cached = current;
    if (cached != null && cached.isUsableAt(clock.instant(), safetyMargin)) {
      return cached;
    }
    synchronized (exchangeLock) {
      cached = current;
      Instant now = clock.instant();
      if (cached != null && cached.isUsableAt(now, safetyMargin)) {
        return cached;
      }
      if (cached == null) {
        return install(login("initial login"));
      }
      log.debug("Credential expires at {}, refreshing ahead of expiry", cached.expiresAt());
      try {
        return install(authenticator.refresh(cached));
      } catch (RuntimeException e) {
        log.warn("Credential refresh failed, falling back to a fresh login: {}", e.getMessage());
        return install(login("refresh fallback"));
      }
    }
  }

  /**
   * Called after the backend rejected {@code rejected} with an authorization failure. Drops the
   * cached credential and forces one new login, unless another caller already replaced it, in
   * which case the replacement is returned.
   */
  public Credential reauthenticate(Credential rejected) {
    synchronized (exchangeLock) {
      Credential cached = current;
      if (cached != null
          && cached != rejected
          && cached.isUsableAt(clock.instant(), safetyMargin)) {
        return cached;
      }
      current = null;
      state = SessionState.EXPIRED;
      log.warn("Backend rejected the current token, re-authenticating");
      return install(login("forced re-login"));
    }
  }

  /** Best-effort server-side logout; the cached credential is dropped regardless. */
  public void logout() {
    synchronized (exchangeLock) {
      Credential cached = current;
      current = null;
      state = SessionState.UNAUTHENTICATED;
      if (cached == null) {
        return;
      }
      try {
        authenticator.logout(cached);
        log.info("Logged out");
      } catch (RuntimeException e) {
        log.warn("Logout failed: {}", e.getMessage());
      }
    }
  }

  public SessionState state() {
    return state;
  }

  private Credential login(String reason) {
    try {
      return authenticator.login();
    } catch (AuthenticationException e) {
      state = SessionState.UNAUTHENTICATED;
      log.error("Authentication failed ({}): {}", reason, e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      state = SessionState.UNAUTHENTICATED;
      log.error("Authentication failed ({})", reason, e);
      throw new AuthenticationException("Authentication failed: " + e.getMessage(), e);
    }
  }

  private Credential install(Credential credential) {
    current = credential;
    state = SessionState.AUTHENTICATED;
    log.info("Authenticated, token valid until {}", credential.expiresAt());
    return credential;
  }
}
