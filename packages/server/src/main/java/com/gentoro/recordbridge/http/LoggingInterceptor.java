package com.gentoro.recordbridge.http;

import com.gentoro.recordbridge.logging.LoggingService;
import java.io.IOException;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements okhttp3.Interceptor {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    log.debug(
        "➡️ Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
        request.method(),
        request.url(),
        redact(request.headers()),
        bodyToString(request));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}\n",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(64 * 1024);
      log.trace("Response body:\n{}\n", LoggingService.maskSecrets(responseBody.string()));
    }

    return response;
  }

  static Headers redact(Headers headers) {
    String authorization = headers.get("Authorization");
    if (authorization == null) {
      return headers;
    }
    return headers
        .newBuilder()
        .set("Authorization", LoggingService.maskAuthorization(authorization))
        .build();
  }

  private static String bodyToString(Request request) {
    RequestBody body = request.body();
    if (body == null) return "";
    MediaType type = body.contentType();
    if (type != null && !"json".equalsIgnoreCase(type.subtype())) {
      return "(" + type + " body omitted)";
    }
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return LoggingService.maskSecrets(buffer.readUtf8());
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
