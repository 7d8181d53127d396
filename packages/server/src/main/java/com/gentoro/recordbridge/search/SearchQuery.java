package com.gentoro.recordbridge.search;

import java.util.List;

/**
 * A raw query string plus optional projection and limit.
 *
 * @param fields explicit projection, or null for the entity's default fields
 * @param limit requested maximum, or null for the configured default
 */
public record SearchQuery(String text, List<String> fields, Integer limit) {

  public SearchQuery {
    text = text == null ? "" : text;
    fields = fields == null || fields.isEmpty() ? null : List.copyOf(fields);
  }

  public static SearchQuery of(String text) {
    return new SearchQuery(text, null, null);
  }

  public boolean isStructured() {
    return QueryClassifier.isStructured(text);
  }

  public boolean hasProjection() {
    return fields != null;
  }
}
