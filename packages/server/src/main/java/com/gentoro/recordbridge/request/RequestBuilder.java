package com.gentoro.recordbridge.request;

import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.http.ApiRequest;
import com.gentoro.recordbridge.registry.EntityDescriptor;
import com.gentoro.recordbridge.registry.OperationKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Translates an abstract (entity, operation, arguments) triple into a concrete {@link
 * ApiRequest}: path, method, query parameters and body.
 *
 * <p>Field maps sent to the backend go through {@link #encodeFields}: null values are dropped,
 * linked fields are sent as {@code :value}, and a linked field holding an empty string is dropped
 * since the backend rejects it.
 */
public class RequestBuilder {
  public static final String LINK_PREFIX = ":";

  /** {@code field~='value'}, the only match query the upsert endpoint accepts. */
  private static final Pattern UPSERT_QUERY = Pattern.compile("^\\s*\\w+\\s*~=\\s*'.*'\\s*$");

  private final Duration callTimeout;

  public RequestBuilder() {
    this(null);
  }

  /** @param callTimeout per-call timeout override, or null to use the client default */
  public RequestBuilder(Duration callTimeout) {
    this.callTimeout = callTimeout;
  }

  /** Build any single-record operation. Search goes through {@link #buildSearch}. */
  public ApiRequest build(EntityDescriptor entity, OperationKind operation, Map<String, ?> args) {
    Arguments a = new Arguments(args);
    Long recordId = operation.targetsRecord() ? a.requireRecordId() : null;
    Map<String, String> query = new LinkedHashMap<>();
    Object body = null;
    ApiRequest.FileUpload upload = null;

    switch (operation) {
      case SEARCH -> {
        return buildSearch(entity, a.optionalString(Arguments.QUERY), a.optionalStringList(Arguments.FIELDS));
      }
      case GET -> {
        List<String> fields = a.optionalStringList(Arguments.FIELDS);
        if (fields != null) {
          query.put("fields", String.join(",", fields));
        }
      }
      case CREATE, UPDATE -> body = encodeFields(entity, a.dataMap());
      case DELETE ->
          query.put("deleteRule", DeleteRule.parse(a.optionalString(Arguments.DELETE_RULE)).name());
      case UPSERT -> {
        query.put("query", requireUpsertQuery(a.optionalString(Arguments.QUERY)));
        body = encodeFields(entity, a.dataMap());
      }
      case ATTACH_FILE -> {
        String fileName = a.requireString(Arguments.FILE_NAME);
        query.put("field", a.requireString(Arguments.FIELD));
        query.put("fileName", fileName);
        upload = new ApiRequest.FileUpload(fileName, a.requireFileContent());
      }
      case RETRIEVE_ATTACHMENT, REMOVE_ATTACHMENT -> {
        query.put("field", a.requireString(Arguments.FIELD));
        int position = a.optionalInt(Arguments.FILE_POSITION, 0);
        if (position < 0) {
          throw new ValidationException("Argument 'file_position' must not be negative");
        }
        query.put("filePosition", Integer.toString(position));
      }
      case GET_ATTACHMENT_INFO -> query.put("field", a.requireString(Arguments.FIELD));
      case ACTION_BUTTON -> query.put("name", a.requireString(Arguments.BUTTON_NAME));
      case EVALUATE_FORMAT -> body = Map.of("formula", a.requireString(Arguments.FORMULA));
      default -> throw new ValidationException("Unhandled operation " + operation);
    }

    return ApiRequest.of(operation.method(), operation.path(entity.resourcePath(), recordId))
        .withQuery(query)
        .withBody(body)
        .withUpload(upload)
        .withTimeout(callTimeout)
        .withContext(context(entity, operation, recordId));
  }

  /**
   * One backend search call. The backend honors only the {@code query} element; {@code search}
   * must be present and empty.
   */
  public ApiRequest buildSearch(EntityDescriptor entity, String query, List<String> fields) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("search", "");
    body.put("field", fields == null || fields.isEmpty() ? entity.defaultFields() : fields);
    body.put("query", query == null ? "" : query);

    Map<String, Object> ctx = context(entity, OperationKind.SEARCH, null);
    ctx.put("query", body.get("query"));
    return ApiRequest.of(
            OperationKind.SEARCH.method(), OperationKind.SEARCH.path(entity.resourcePath(), null))
        .withBody(body)
        .withTimeout(callTimeout)
        .withContext(ctx);
  }

  /** Apply the wire encoding for a create/update/upsert field map. Insertion order is kept. */
  public static Map<String, Object> encodeFields(EntityDescriptor entity, Map<String, ?> data) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (data == null) return out;
    data.forEach(
        (name, value) -> {
          if (value == null) return;
          if (!entity.isLinked(name)) {
            out.put(name, value);
            return;
          }
          Object encoded = encodeLinked(value);
          if (encoded != null) {
            out.put(name, encoded);
          }
        });
    return out;
  }

  /** Null when the value is empty and must be left out of the body. */
  static Object encodeLinked(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Collection<?> values) {
      List<Object> out = new ArrayList<>();
      for (Object v : values) {
        Object encoded = encodeLinked(v);
        if (encoded != null) out.add(encoded);
      }
      return out.isEmpty() ? null : out;
    }
    if (value instanceof Map<?, ?>) {
      return value;
    }
    String text = String.valueOf(value).trim();
    if (text.isEmpty()) {
      return null;
    }
    return text.startsWith(LINK_PREFIX) ? text : LINK_PREFIX + text;
  }

  static String requireUpsertQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new ValidationException(
          "Upsert requires a match query argument 'query' of the form field~='value'");
    }
    if (!UPSERT_QUERY.matcher(query).matches()) {
      throw new ValidationException(
          "Upsert match query must have the form field~='value': " + query);
    }
    return query.trim();
  }

  private static Map<String, Object> context(
      EntityDescriptor entity, OperationKind operation, Long recordId) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("entity", entity.key());
    ctx.put("operation", operation.operationName());
    if (recordId != null) {
      ctx.put("recordId", recordId);
    }
    return ctx;
  }
}
