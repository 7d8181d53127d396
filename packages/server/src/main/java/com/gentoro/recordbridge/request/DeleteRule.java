package com.gentoro.recordbridge.request;

import com.gentoro.recordbridge.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;

/** How the backend handles records that depend on the one being deleted. */
public enum DeleteRule {
  ERROR_IF_DEPENDANTS,
  APPLY_DELETE_WHERE_POSSIBLE,
  DELETE_WHERE_POSSIBLE_OTHERWISE_UNLINK,
  UNLINK_WHERE_POSSIBLE_OTHERWISE_DELETE;

  public static final DeleteRule DEFAULT = UNLINK_WHERE_POSSIBLE_OTHERWISE_DELETE;

  /** Null or blank resolves to {@link #DEFAULT}; anything unrecognized is a caller error. */
  public static DeleteRule parse(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Invalid delete_rule '%s'. Expected one of %s"
              .formatted(value, Arrays.toString(values())));
    }
  }
}
