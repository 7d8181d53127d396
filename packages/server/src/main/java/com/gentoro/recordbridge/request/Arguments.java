package com.gentoro.recordbridge.request;

import com.gentoro.recordbridge.exception.ValidationException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed, validating view over the loosely typed argument map a tool call carries. Every getter
 * fails with {@link ValidationException} on a missing required value or a value of the wrong
 * shape, so bad input never reaches the network.
 */
public final class Arguments {
  public static final String RECORD_ID = "record_id";
  public static final String DATA = "data";
  public static final String FIELDS = "fields";
  public static final String QUERY = "query";
  public static final String LIMIT = "limit";
  public static final String DELETE_RULE = "delete_rule";
  public static final String FIELD = "field";
  public static final String FILE_NAME = "file_name";
  public static final String FILE_CONTENT_BASE64 = "file_content_base64";
  public static final String FILE_CONTENT = "file_content";
  public static final String FILE_POSITION = "file_position";
  public static final String BUTTON_NAME = "button_name";
  public static final String FORMULA = "formula";

  private final Map<String, Object> values;

  public Arguments(Map<String, ?> values) {
    this.values = values == null ? Map.of() : new LinkedHashMap<>(values);
  }

  public boolean has(String name) {
    Object v = values.get(name);
    return v != null && !(v instanceof String s && s.isBlank());
  }

  public long requireRecordId() {
    Long id = optionalLong(RECORD_ID);
    if (id == null) {
      throw new ValidationException("Missing required argument '" + RECORD_ID + "'");
    }
    return id;
  }

  public String requireString(String name) {
    String value = optionalString(name);
    if (value == null || value.isBlank()) {
      throw new ValidationException("Missing required argument '" + name + "'");
    }
    return value;
  }

  public String optionalString(String name) {
    Object v = values.get(name);
    if (v == null) return null;
    if (v instanceof String s) return s;
    if (v instanceof Number || v instanceof Boolean) return v.toString();
    throw new ValidationException("Argument '%s' must be a string".formatted(name));
  }

  public Long optionalLong(String name) {
    Object v = values.get(name);
    if (v == null) return null;
    if (v instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        throw new ValidationException("Argument '%s' must be an integer: %s".formatted(name, v));
      }
      return n.longValue();
    }
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("Argument '%s' must be an integer: %s".formatted(name, s));
      }
    }
    if (v instanceof String) return null;
    throw new ValidationException("Argument '%s' must be an integer".formatted(name));
  }

  public int optionalInt(String name, int defaultValue) {
    Long v = optionalLong(name);
    if (v == null) return defaultValue;
    if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
      throw new ValidationException("Argument '%s' is out of range: %d".formatted(name, v));
    }
    return v.intValue();
  }

  /** Accepts a JSON array of names or a comma-separated string; null when absent or empty. */
  public List<String> optionalStringList(String name) {
    Object v = values.get(name);
    List<String> out = new ArrayList<>();
    if (v == null) return null;
    if (v instanceof Collection<?> c) {
      for (Object o : c) {
        if (o != null && !o.toString().isBlank()) out.add(o.toString().trim());
      }
    } else if (v instanceof String s) {
      for (String part : s.split(",")) {
        if (!part.isBlank()) out.add(part.trim());
      }
    } else {
      throw new ValidationException("Argument '%s' must be a list of field names".formatted(name));
    }
    return out.isEmpty() ? null : out;
  }

  public Map<String, Object> dataMap() {
    Object v = values.get(DATA);
    if (v == null) return new LinkedHashMap<>();
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      m.forEach((k, val) -> out.put(String.valueOf(k), val));
      return out;
    }
    throw new ValidationException("Argument '" + DATA + "' must be an object of field values");
  }

  /** File bytes from {@code file_content_base64}, or raw {@code file_content}. */
  public byte[] requireFileContent() {
    Object raw = values.get(FILE_CONTENT);
    if (raw instanceof byte[] bytes) {
      return bytes;
    }
    String encoded = optionalString(FILE_CONTENT_BASE64);
    if (encoded == null || encoded.isBlank()) {
      throw new ValidationException(
          "Missing required argument '%s' (or '%s')".formatted(FILE_CONTENT_BASE64, FILE_CONTENT));
    }
    try {
      return Base64.getMimeDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Argument '" + FILE_CONTENT_BASE64 + "' is not valid base64", e);
    }
  }
}
