package com.gentoro.recordbridge.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved backend call: method, path relative to the base URL, query parameters and
 * either a JSON body or a file upload.
 *
 * @param body object serialized as JSON; ignored when {@code upload} is set
 * @param upload multipart file content, or null
 * @param timeout per-call override of the configured call timeout, or null
 * @param context entity/operation/record details attached to any error raised for this call
 */
public record ApiRequest(
    HttpMethod method,
    String path,
    Map<String, String> query,
    Object body,
    FileUpload upload,
    Duration timeout,
    Map<String, Object> context) {

  public ApiRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static ApiRequest of(HttpMethod method, String path) {
    return new ApiRequest(method, path, null, null, null, null, null);
  }

  public ApiRequest withQuery(Map<String, String> query) {
    return new ApiRequest(method, path, query, body, upload, timeout, context);
  }

  public ApiRequest withBody(Object body) {
    return new ApiRequest(method, path, query, body, upload, timeout, context);
  }

  public ApiRequest withUpload(FileUpload upload) {
    return new ApiRequest(method, path, query, body, upload, timeout, context);
  }

  public ApiRequest withTimeout(Duration timeout) {
    return new ApiRequest(method, path, query, body, upload, timeout, context);
  }

  public ApiRequest withContext(Map<String, Object> context) {
    return new ApiRequest(method, path, query, body, upload, timeout, context);
  }

  /** Raw file bytes sent as the single {@code file} part of a multipart request. */
  public record FileUpload(String fileName, byte[] content) {
    public FileUpload {
      Objects.requireNonNull(fileName, "fileName");
      Objects.requireNonNull(content, "content");
    }

    @Override
    public String toString() {
      return "FileUpload{fileName=" + fileName + ", bytes=" + content.length + "}";
    }
  }
}
