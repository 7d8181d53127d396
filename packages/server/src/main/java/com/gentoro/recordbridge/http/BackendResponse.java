package com.gentoro.recordbridge.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.exception.BackendOperationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A transport-successful (2xx) backend reply. The payload may still carry an embedded failure
 * flag ({@code "success": false}); {@link #requireSuccess(Map)} turns that into the same error
 * channel as transport failures.
 */
public record BackendResponse(int status, JsonNode body) {

  public boolean isFailure() {
    if (body == null || !body.isObject()) return false;
    JsonNode success = body.get("success");
    return success != null && !success.isNull() && !success.asBoolean(true);
  }

  /** Backend message plus every {@code errors[].message}, joined with "; ". */
  public String failureMessage() {
    String message = body.path("message").asText("");
    List<String> details = new ArrayList<>();
    for (JsonNode error : body.path("errors")) {
      details.add(error.isObject() ? error.path("message").asText(error.toString()) : error.asText());
    }
    if (message.isBlank()) {
      message = "Unknown error";
    }
    return details.isEmpty() ? message : message + " - " + String.join("; ", details);
  }

  /** The {@code result} element when present, otherwise the whole body. */
  public JsonNode result() {
    if (body != null && body.isObject() && body.has("result")) {
      return body.get("result");
    }
    return body;
  }

  public BackendResponse requireSuccess(Map<String, Object> context) {
    if (isFailure()) {
      Map<String, Object> ctx = new LinkedHashMap<>(context);
      ctx.put("status", status);
      ctx.put("backendMessage", failureMessage());
      String operation = String.valueOf(context.getOrDefault("operation", "operation"));
      throw new BackendOperationException(
          "Backend rejected %s: %s".formatted(operation, failureMessage()), ctx);
    }
    return this;
  }
}
