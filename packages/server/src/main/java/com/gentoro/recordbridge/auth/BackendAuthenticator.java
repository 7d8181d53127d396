package com.gentoro.recordbridge.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.BackendSettings;
import com.gentoro.recordbridge.exception.AuthenticationException;
import com.gentoro.recordbridge.exception.SerializationException;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Login and logout exchanges against the backend's {@code /login} and {@code /logout}
 * endpoints. The backend has no dedicated refresh endpoint, so a refresh is a new login with the
 * same credential seed.
 */
public class BackendAuthenticator implements Authenticator {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(BackendAuthenticator.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final BackendSettings settings;
  private final Clock clock;

  public BackendAuthenticator(OkHttpClient httpClient, BackendSettings settings) {
    this(httpClient, settings, Clock.systemUTC());
  }

  public BackendAuthenticator(OkHttpClient httpClient, BackendSettings settings, Clock clock) {
    this.httpClient = httpClient;
    this.settings = settings;
    this.clock = clock;
  }

  @Override
  public Credential login() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("password", settings.password());
    payload.put("KB", settings.knowledgeBase());
    payload.put("login", settings.username());
    payload.put("lang", settings.language());

    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("username", settings.username());
    ctx.put("kb", settings.knowledgeBase());

    log.info("Authenticating as {} against {}", settings.username(), settings.knowledgeBase());
    Request request =
        new Request.Builder()
            .url(settings.baseUrl() + "/login")
            .header("Accept", "application/json")
            .post(RequestBody.create(JacksonUtility.toJson(payload), JSON))
            .build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (response.code() != 200) {
        ctx.put("status", response.code());
        throw new AuthenticationException(
            "Authentication failed: %d - %s".formatted(response.code(), text), ctx);
      }
      JsonNode data = JacksonUtility.toJsonNode(text);
      if (!data.path("success").asBoolean(false)) {
        String message = data.path("message").asText("Unknown error");
        ctx.put("backendMessage", message);
        throw new AuthenticationException("Authentication failed: " + message, ctx);
      }
      return toCredential(data.path("result"), ctx);
    } catch (SerializationException e) {
      throw new AuthenticationException("Authentication response is not valid JSON", ctx, e);
    } catch (IOException e) {
      throw new AuthenticationException(
          "Authentication endpoint unreachable: " + e.getMessage(), ctx, e);
    }
  }

  @Override
  public Credential refresh(Credential current) {
    log.debug("Refreshing credential via a new login exchange");
    return login();
  }

  @Override
  public void logout(Credential credential) {
    Request request =
        new Request.Builder()
            .url(settings.baseUrl() + "/logout")
            .header("Accept", "application/json")
            .header("Authorization", "Bearer " + credential.accessToken())
            .post(RequestBody.create(new byte[0], JSON))
            .build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new AuthenticationException(
            "Logout failed with status " + response.code(), Map.of("status", response.code()));
      }
    } catch (IOException e) {
      throw new AuthenticationException("Logout failed: " + e.getMessage(), e);
    }
  }

  private Credential toCredential(JsonNode result, Map<String, Object> ctx) {
    String accessToken = result.path("access_token").asText(null);
    if (accessToken == null || accessToken.isBlank()) {
      throw new AuthenticationException("Authentication response carries no access token", ctx);
    }
    String refreshToken = result.path("refresh_token").asText(null);
    Duration validity =
        result.hasNonNull("expires_in")
            ? Duration.ofMinutes(result.get("expires_in").asLong())
            : settings.defaultTokenValidity();
    return new Credential(accessToken, refreshToken, clock.instant().plus(validity));
  }
}
