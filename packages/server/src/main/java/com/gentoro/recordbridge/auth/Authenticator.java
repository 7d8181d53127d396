package com.gentoro.recordbridge.auth;

/**
 * The credential exchanges the session manager drives. Implementations perform network I/O and
 * are only ever called under the session manager's lock, one exchange at a time.
 */
public interface Authenticator {

  /**
   * Exchange the configured username/password/knowledge base for a fresh credential.
   *
   * @throws com.gentoro.recordbridge.exception.AuthenticationException on rejected credentials
   *     or an unreachable login endpoint
   */
  Credential login();

  /** Obtain a replacement for a credential that is about to expire. */
  Credential refresh(Credential current);

  /** Invalidate the credential server-side. Best effort. */
  void logout(Credential current);
}
