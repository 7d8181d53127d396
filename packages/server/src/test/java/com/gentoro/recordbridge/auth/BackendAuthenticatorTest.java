package com.gentoro.recordbridge.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.exception.AuthenticationException;
import com.gentoro.recordbridge.support.FakeBackend;
import com.gentoro.recordbridge.support.TestStack;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BackendAuthenticatorTest {

  private final TestStack stack = new TestStack();
  private final BackendAuthenticator authenticator =
      new BackendAuthenticator(stack.httpClient, stack.settings, stack.clock);

  @AfterEach
  void tearDown() {
    stack.close();
  }

  @Test
  void loginSendsTheCredentialSeedAndComputesExpiryInMinutes() {
    stack.backend.expiresInMinutes(20);

    Credential credential = authenticator.login();

    assertEquals(FakeBackend.token(1), credential.accessToken());
    assertEquals("r", credential.refreshToken());
    assertEquals(stack.clock.instant().plus(Duration.ofMinutes(20)), credential.expiresAt());

    FakeBackend.Recorded login = stack.backend.logins().get(0);
    assertEquals("POST", login.method());
    assertEquals("/api/login", login.path());
    JsonNode body = login.json();
    assertEquals("svc", body.path("login").asText());
    assertEquals("secret", body.path("password").asText());
    assertEquals("Demo", body.path("KB").asText());
    assertEquals("en", body.path("lang").asText());
  }

  @Test
  void missingExpiryFallsBackToTheDefaultValidity() {
    stack.backend.loginReply(
        FakeBackend.Reply.ok("{\"success\":true,\"result\":{\"access_token\":\"abc\"}}"));

    Credential credential = authenticator.login();

    assertEquals("abc", credential.accessToken());
    assertNull(credential.refreshToken());
    assertEquals(
        stack.clock.instant().plus(stack.settings.defaultTokenValidity()), credential.expiresAt());
  }

  @Test
  void embeddedFailureIsAnAuthenticationError() {
    stack.backend.loginReply(
        FakeBackend.Reply.ok("{\"success\":false,\"message\":\"Invalid KB\"}"));

    AuthenticationException ex =
        assertThrows(AuthenticationException.class, authenticator::login);
    assertTrue(ex.getMessage().contains("Invalid KB"));
    assertEquals("Invalid KB", ex.getContext().get("backendMessage"));
  }

  @Test
  void nonOkStatusIsAnAuthenticationError() {
    stack.backend.loginReply(FakeBackend.Reply.status(403, "{\"message\":\"denied\"}"));

    AuthenticationException ex =
        assertThrows(AuthenticationException.class, authenticator::login);
    assertEquals(403, ex.getContext().get("status"));
    assertEquals("svc", ex.getContext().get("username"));
  }

  @Test
  void responseWithoutTokenIsRejected() {
    stack.backend.loginReply(FakeBackend.Reply.ok("{\"success\":true,\"result\":{}}"));

    assertThrows(AuthenticationException.class, authenticator::login);
  }

  @Test
  void logoutPostsWithTheBearerToken() {
    Credential credential = authenticator.login();
    authenticator.logout(credential);
    assertEquals(1, stack.backend.logoutCount());
  }
}
