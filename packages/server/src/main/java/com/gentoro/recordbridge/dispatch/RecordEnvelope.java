package com.gentoro.recordbridge.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.http.BackendResponse;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized result of a single-record operation: identifier, field map, and the backend's
 * logical success flag, which is independent of the HTTP status.
 *
 * @param id record identifier, or null when the backend did not report one
 */
public record RecordEnvelope(Long id, Map<String, Object> fields, boolean success) {

  public RecordEnvelope {
    fields =
        fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static RecordEnvelope ofFields(Map<String, Object> fields) {
    return new RecordEnvelope(idOf(fields.get("id")), fields, true);
  }

  /**
   * Extract the record from a backend reply: the {@code result} element, else the body itself,
   * taking the first element of a list. A bare numeric result (create) is the new record's id.
   */
  public static RecordEnvelope from(BackendResponse response) {
    boolean success = !response.isFailure();
    JsonNode body = response.body();
    JsonNode record = body != null && body.isObject() && body.has("result") ? body.get("result") : body;
    if (record != null && record.isArray()) {
      record = record.size() > 0 ? record.get(0) : null;
    }
    if (record == null || record.isNull() || record.isMissingNode()) {
      return new RecordEnvelope(null, Map.of(), success);
    }
    if (record.isIntegralNumber()) {
      return new RecordEnvelope(record.asLong(), Map.of(), success);
    }
    if (record.isObject()) {
      Map<String, Object> fields = JacksonUtility.toMap(record);
      return new RecordEnvelope(idOf(fields.get("id")), fields, success);
    }
    Map<String, Object> wrapped = new LinkedHashMap<>();
    wrapped.put("result", JacksonUtility.toPlain(record));
    return new RecordEnvelope(idOf(record.asText()), wrapped, success);
  }

  /** Keep only the requested fields, in requested order. */
  public RecordEnvelope project(List<String> names) {
    if (names == null || names.isEmpty()) {
      return this;
    }
    Map<String, Object> out = new LinkedHashMap<>();
    for (String name : names) {
      if (fields.containsKey(name)) {
        out.put(name, fields.get(name));
      }
    }
    return new RecordEnvelope(id, out, success);
  }

  static Long idOf(Object value) {
    if (value instanceof Number n) {
      return n.longValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
