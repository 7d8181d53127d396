package com.gentoro.recordbridge.auth;

public enum SessionState {
  UNAUTHENTICATED,
  AUTHENTICATED,
  EXPIRED
}
