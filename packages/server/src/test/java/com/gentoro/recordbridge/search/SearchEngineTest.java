package com.gentoro.recordbridge.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.recordbridge.exception.TransportException;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.registry.EntityDescriptor;
import com.gentoro.recordbridge.support.FakeBackend;
import com.gentoro.recordbridge.support.FakeBackend.Reply;
import com.gentoro.recordbridge.support.TestStack;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SearchEngineTest {

  private static final String BY_TITLE = "contract_title1~='Acme'";
  private static final String BY_COMPANY = "company_name~='Acme'";

  private final TestStack stack = new TestStack();
  private final FakeBackend backend = stack.backend;
  private final SearchEngine engine = stack.searchEngine;
  private final EntityDescriptor contract = stack.registry.lookup("contract");

  @AfterEach
  void tearDown() {
    stack.close();
  }

  private static String rows(String... rows) {
    return "{\"success\":true,\"result\":[" + String.join(",", rows) + "]}";
  }

  private static String row(int id, String title) {
    return "{\"id\":%d,\"contract_title1\":\"%s\",\"contract_amount\":%d}".formatted(id, title, id * 100);
  }

  private static List<Object> ids(List<Map<String, Object>> records) {
    return records.stream().map(r -> r.get("id")).toList();
  }

  @Test
  void freeTextFansOutOnePartialMatchPerSearchField() {
    backend.route(
        request -> {
          String query = request.json().path("query").asText();
          return query.equals(BY_COMPANY) ? Reply.ok(rows(row(7, "Master"))) : Reply.ok(rows());
        });

    List<Map<String, Object>> result = engine.search(contract, SearchQuery.of("Acme"));

    assertEquals(List.of(7), ids(result));
    List<String> sent =
        backend.requests().stream().map(r -> r.json().path("query").asText()).sorted().toList();
    assertEquals(List.of(BY_COMPANY, BY_TITLE), sent);
    for (FakeBackend.Recorded request : backend.requests()) {
      assertEquals("/api/contract/search", request.path());
      assertEquals("", request.json().path("search").asText());
    }
  }

  @Test
  void recordsMatchingSeveralFieldsAppearOnceInFirstSeenOrder() {
    backend.route(
        request ->
            request.json().path("query").asText().equals(BY_TITLE)
                ? Reply.ok(rows(row(3, "Acme MSA"), row(7, "Acme NDA")))
                : Reply.ok(rows(row(7, "Acme NDA"), row(9, "Other"))));

    List<Map<String, Object>> result = engine.search(contract, SearchQuery.of("Acme"));

    assertEquals(List.of(3, 7, 9), ids(result));
  }

  @Test
  void mergeOrderFollowsFieldOrderNotCompletionOrder() {
    backend.route(
        request -> {
          if (request.json().path("query").asText().equals(BY_TITLE)) {
            // first field answers last
            Thread.sleep(200);
            return Reply.ok(rows(row(1, "Acme")));
          }
          return Reply.ok(rows(row(2, "Acme")));
        });

    List<Map<String, Object>> result =
        engine.search(contract, new SearchQuery("Acme", null, 1));

    assertEquals(List.of(1), ids(result));
  }

  @Test
  void structuredQueryIsSentVerbatimOnce() {
    backend.route(request -> Reply.ok(rows(row(5, "X"))));

    engine.search(contract, SearchQuery.of("contract_amount > 100"));

    assertEquals(1, backend.requests().size());
    assertEquals("contract_amount > 100", backend.requests().get(0).json().path("query").asText());
  }

  @Test
  void blankQueryIsASinglePassThroughSearch() {
    backend.route(request -> Reply.ok(rows(row(5, "X"))));

    engine.search(contract, SearchQuery.of("  "));

    assertEquals(1, backend.requests().size());
    assertEquals("", backend.requests().get(0).json().path("query").asText());
  }

  @Test
  void failingSubQueryFailsTheWholeSearch() {
    backend.route(
        request ->
            request.json().path("query").asText().equals(BY_COMPANY)
                ? Reply.status(500, "{\"message\":\"down\"}")
                : Reply.ok(rows(row(1, "Acme"))));

    TransportException ex =
        assertThrows(
            TransportException.class, () -> engine.search(contract, SearchQuery.of("Acme")));
    assertEquals(500, ex.getContext().get("status"));
    assertEquals("contract", ex.getContext().get("entity"));
  }

  @Test
  void projectionIsAppliedAfterTheMergeAndIdIsAlwaysRequested() {
    backend.route(
        request ->
            Reply.ok(
                request.json().path("query").asText().equals(BY_TITLE)
                    ? rows(row(1, "Acme"))
                    : rows(row(1, "Acme"), row(2, "Acme 2"))));

    List<Map<String, Object>> result =
        engine.search(contract, new SearchQuery("Acme", List.of("contract_title1"), null));

    assertEquals(
        List.of(Map.of("contract_title1", "Acme"), Map.of("contract_title1", "Acme 2")), result);
    for (FakeBackend.Recorded request : backend.requests()) {
      assertEquals(
          List.of("id", "contract_title1"),
          List.of(
              request.json().path("field").get(0).asText(),
              request.json().path("field").get(1).asText()));
    }
  }

  @Test
  void limitMustBePositiveAndIsClampedToTheMaximum() {
    assertThrows(ValidationException.class, () -> engine.resolveLimit(0));
    assertThrows(ValidationException.class, () -> engine.resolveLimit(-5));
    assertEquals(stack.settings.defaultSearchLimit(), engine.resolveLimit(null));
    assertEquals(stack.settings.maxSearchLimit(), engine.resolveLimit(100_000));
    assertEquals(3, engine.resolveLimit(3));
  }

  @Test
  void invalidLimitNeverReachesTheNetwork() {
    assertThrows(
        ValidationException.class,
        () -> engine.search(contract, new SearchQuery("Acme", null, 0)));
    assertTrue(backend.requests().isEmpty());
    assertEquals(0, backend.loginCount());
  }

  @Test
  void mergeKeepsRecordsWithoutIds() {
    List<Map<String, Object>> merged =
        SearchEngine.merge(
            List.of(
                List.of(Map.of("id", 1), Map.of("name", "a")),
                List.of(Map.of("id", 1L), Map.of("name", "a"))));
    assertEquals(3, merged.size());
  }

  @Test
  void planUsesTheEntitySearchFieldsInOrder() {
    assertEquals(List.of(BY_TITLE, BY_COMPANY), engine.plan(contract, SearchQuery.of("Acme")));
  }
}
