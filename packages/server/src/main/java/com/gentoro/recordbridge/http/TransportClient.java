package com.gentoro.recordbridge.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.recordbridge.auth.AuthSessionManager;
import com.gentoro.recordbridge.auth.Credential;
import com.gentoro.recordbridge.exception.AuthenticationException;
import com.gentoro.recordbridge.exception.SerializationException;
import com.gentoro.recordbridge.exception.TransportException;
import com.gentoro.recordbridge.exception.TransportTimeoutException;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Executes {@link ApiRequest}s against the backend with a bearer credential from {@link
 * AuthSessionManager}.
 *
 * <p>An authorization failure (401) is retried exactly once, with a credential obtained through
 * a forced re-login. A second 401 surfaces as {@link AuthenticationException}. Nothing else is
 * retried: timeouts map to {@link TransportTimeoutException}, other I/O failures and non-2xx
 * statuses to {@link TransportException}.
 */
public class TransportClient {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(TransportClient.class);

  static final int UNAUTHORIZED = 401;
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

  private final OkHttpClient httpClient;
  private final HttpUrl baseUrl;
  private final AuthSessionManager sessionManager;

  public TransportClient(OkHttpClient httpClient, String baseUrl, AuthSessionManager sessionManager) {
    this.httpClient = httpClient;
    this.baseUrl = HttpUrl.get(baseUrl);
    this.sessionManager = sessionManager;
  }

  public BackendResponse execute(ApiRequest request) {
    Credential credential = sessionManager.credential();
    Exchange first = send(request, credential);
    if (first.status != UNAUTHORIZED) {
      return complete(request, first);
    }

    log.warn(
        "Received 401 for {} {}, re-authenticating and retrying once", request.method(), request.path());
    Credential renewed = sessionManager.reauthenticate(credential);
    Exchange retry = send(request, renewed);
    if (retry.status == UNAUTHORIZED) {
      Map<String, Object> ctx = errorContext(request, retry);
      log.error("Authorization still rejected after re-authentication: {}", ctx);
      throw new AuthenticationException(
          "Backend rejected the request after re-authentication: " + retry.bodyText, ctx);
    }
    return complete(request, retry);
  }

  /** Resolve a path relative to the configured base URL. */
  public HttpUrl resolve(String path, Map<String, String> query) {
    HttpUrl.Builder url = baseUrl.newBuilder();
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        url.addPathSegment(segment);
      }
    }
    query.forEach(url::addQueryParameter);
    return url.build();
  }

  private Exchange send(ApiRequest request, Credential credential) {
    Request httpRequest =
        new Request.Builder()
            .url(resolve(request.path(), request.query()))
            .header("Authorization", "Bearer " + credential.accessToken())
            .header("Accept", "application/json")
            .method(request.method().name(), requestBody(request))
            .build();

    Call call = clientFor(request).newCall(httpRequest);
    try (Response response = call.execute()) {
      ResponseBody body = response.body();
      return new Exchange(response.code(), body == null ? "" : body.string());
    } catch (InterruptedIOException e) {
      Map<String, Object> ctx = new LinkedHashMap<>(request.context());
      ctx.put("path", request.path());
      log.error("{} {} timed out: {}", request.method(), request.path(), ctx);
      throw new TransportTimeoutException(
          "Request timed out: %s %s".formatted(request.method(), request.path()), ctx, e);
    } catch (IOException e) {
      Map<String, Object> ctx = new LinkedHashMap<>(request.context());
      ctx.put("path", request.path());
      log.error("{} {} failed: {}", request.method(), request.path(), e.getMessage());
      throw new TransportException(
          "HTTP client error for %s %s: %s".formatted(request.method(), request.path(), e.getMessage()),
          ctx,
          e);
    }
  }

  private OkHttpClient clientFor(ApiRequest request) {
    if (request.timeout() == null) {
      return httpClient;
    }
    return httpClient.newBuilder().callTimeout(request.timeout()).build();
  }

  private RequestBody requestBody(ApiRequest request) {
    if (!request.method().hasBody()) {
      return null;
    }
    if (request.upload() != null) {
      ApiRequest.FileUpload upload = request.upload();
      return new MultipartBody.Builder()
          .setType(MultipartBody.FORM)
          .addFormDataPart(
              "file", upload.fileName(), RequestBody.create(upload.content(), OCTET_STREAM))
          .build();
    }
    Object body = request.body() == null ? Map.of() : request.body();
    try {
      return RequestBody.create(JacksonUtility.getJsonMapper().writeValueAsBytes(body), JSON);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize request body for " + request.path(), e);
    }
  }

  private BackendResponse complete(ApiRequest request, Exchange exchange) {
    if (exchange.status < 200 || exchange.status >= 300) {
      Map<String, Object> ctx = errorContext(request, exchange);
      log.error("API request failed: {}", ctx);
      throw new TransportException(
          "API request failed: %d - %s".formatted(exchange.status, exchange.bodyText), ctx);
    }
    return new BackendResponse(exchange.status, parse(exchange.bodyText));
  }

  /** Non-JSON 2xx payloads (e.g. retrieved file content) are wrapped as {"result": text}. */
  private static JsonNode parse(String text) {
    try {
      return JacksonUtility.toJsonNode(text);
    } catch (SerializationException e) {
      ObjectNode wrapped = JacksonUtility.getJsonMapper().createObjectNode();
      wrapped.put("result", text);
      return wrapped;
    }
  }

  private static Map<String, Object> errorContext(ApiRequest request, Exchange exchange) {
    Map<String, Object> ctx = new LinkedHashMap<>(request.context());
    ctx.put("path", request.path());
    ctx.put("status", exchange.status);
    if (!exchange.bodyText.isBlank()) {
      ctx.put("backendMessage", exchange.bodyText);
    }
    return ctx;
  }

  private record Exchange(int status, String bodyText) {}
}
