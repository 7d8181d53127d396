package com.gentoro.recordbridge.search;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a query string is structured (sent verbatim) or free text (fanned out as one
 * partial-match sub-query per search field). The decision depends on the query string alone.
 */
public final class QueryClassifier {

  /** {@code field = v}, {@code field ~= 'v'}, {@code field != v}, {@code field >= v}... */
  private static final Pattern COMPARISON =
      Pattern.compile("\\b\\w+\\s*(?:!~=|~=|!=|<>|<=|>=|=|<|>)");

  /** Boolean and SQL keywords, in any case. */
  private static final List<Pattern> KEYWORDS =
      List.of(
          keyword("AND"),
          keyword("OR"),
          keyword("NOT"),
          keyword("LIKE"),
          keyword("IN"),
          keyword("BETWEEN"),
          keyword("IS\\s+NULL"));

  private QueryClassifier() {}

  private static Pattern keyword(String word) {
    return Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE);
  }

  public static boolean isStructured(String query) {
    if (query == null || query.isBlank()) {
      return false;
    }
    if (COMPARISON.matcher(query).find()) {
      return true;
    }
    for (Pattern keyword : KEYWORDS) {
      if (keyword.matcher(query).find()) {
        return true;
      }
    }
    return false;
  }

  /** Escape a literal for use inside a single-quoted query value. */
  public static String sanitize(String value) {
    return value.replace("'", "''").replace("--", "").replace(";", "");
  }

  /** {@code field~='text'} with the text escaped. */
  public static String partialMatch(String field, String text) {
    return field + "~='" + sanitize(text.trim()) + "'";
  }

  /** {@code field='text'} with the text escaped. */
  public static String exactMatch(String field, String text) {
    return field + "='" + sanitize(text.trim()) + "'";
  }
}
