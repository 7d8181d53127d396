package com.gentoro.recordbridge.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.exception.RecordBridgeException;
import com.gentoro.recordbridge.exception.TransportException;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.http.ApiRequest;
import com.gentoro.recordbridge.http.TransportClient;
import com.gentoro.recordbridge.registry.EntityDescriptor;
import com.gentoro.recordbridge.request.RequestBuilder;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes searches, fanning free-text queries out into one partial-match sub-query per search
 * field because the backend cannot OR a partial match across fields.
 *
 * <p>Sub-queries run concurrently on a bounded pool. Their results are buffered by sub-query
 * index and merged on the calling thread in declared field order, so the output order never
 * depends on completion order. Records are deduplicated by {@code id}, first seen wins; projection
 * and limit are applied only after the merge. The first failing sub-query fails the whole search
 * and cancels the rest.
 */
public class SearchEngine implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(SearchEngine.class);

  private static final String ID = "id";

  private final TransportClient transport;
  private final RequestBuilder requestBuilder;
  private final int defaultLimit;
  private final int maxLimit;
  private final ExecutorService executor;

  public SearchEngine(
      TransportClient transport,
      RequestBuilder requestBuilder,
      int defaultLimit,
      int maxLimit,
      int parallelism) {
    this.transport = transport;
    this.requestBuilder = requestBuilder;
    this.defaultLimit = defaultLimit;
    this.maxLimit = maxLimit;
    AtomicInteger counter = new AtomicInteger();
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            parallelism,
            parallelism,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "search-fanout-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    pool.allowCoreThreadTimeOut(true);
    this.executor = pool;
  }

  public List<Map<String, Object>> search(EntityDescriptor entity, SearchQuery query) {
    int limit = resolveLimit(query.limit());
    List<String> subQueries = plan(entity, query);
    List<String> wireFields = wireFields(entity, query);
    log.debug(
        "Searching {} with {} sub-quer{}: {}",
        entity.key(),
        subQueries.size(),
        subQueries.size() == 1 ? "y" : "ies",
        subQueries);

    List<List<Map<String, Object>>> results = execute(entity, subQueries, wireFields);
    List<Map<String, Object>> merged = merge(results);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> record : merged) {
      if (out.size() >= limit) break;
      out.add(query.hasProjection() ? project(record, query.fields()) : record);
    }
    log.debug("Search on {} merged {} unique records, returning {}", entity.key(), merged.size(), out.size());
    return out;
  }

  /** Sub-query strings for a query, in the order their results are merged. */
  List<String> plan(EntityDescriptor entity, SearchQuery query) {
    String text = query.text();
    if (query.isStructured() || text.isBlank() || entity.searchFields().isEmpty()) {
      return List.of(text.trim());
    }
    List<String> out = new ArrayList<>();
    for (String field : entity.searchFields()) {
      out.add(QueryClassifier.partialMatch(field, text));
    }
    return out;
  }

  int resolveLimit(Integer requested) {
    if (requested == null) {
      return defaultLimit;
    }
    if (requested < 1) {
      throw new ValidationException("limit must be at least 1, got " + requested);
    }
    return Math.min(requested, maxLimit);
  }

  /** The backend needs {@code id} in its projection for deduplication to work. */
  private static List<String> wireFields(EntityDescriptor entity, SearchQuery query) {
    List<String> base = query.hasProjection() ? query.fields() : entity.defaultFields();
    if (base.isEmpty() || base.contains(ID)) {
      return base;
    }
    List<String> withId = new ArrayList<>(base.size() + 1);
    withId.add(ID);
    withId.addAll(base);
    return withId;
  }

  private List<List<Map<String, Object>>> execute(
      EntityDescriptor entity, List<String> subQueries, List<String> fields) {
    if (subQueries.size() == 1) {
      return List.of(runOne(entity, subQueries.get(0), fields));
    }

    CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
    List<Future<Integer>> futures = new ArrayList<>();
    List<List<Map<String, Object>>> buffer = new ArrayList<>();
    for (int i = 0; i < subQueries.size(); i++) {
      buffer.add(null);
    }
    for (int i = 0; i < subQueries.size(); i++) {
      final int index = i;
      futures.add(
          completion.submit(
              () -> {
                List<Map<String, Object>> rows = runOne(entity, subQueries.get(index), fields);
                synchronized (buffer) {
                  buffer.set(index, rows);
                }
                return index;
              }));
    }

    try {
      for (int done = 0; done < futures.size(); done++) {
        completion.take().get();
      }
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.error("Search sub-query on {} failed, aborting search: {}", entity.key(), cause.getMessage());
      if (cause instanceof RecordBridgeException rbe) {
        throw rbe;
      }
      throw new TransportException(
          "Search sub-query failed: " + cause.getMessage(),
          Map.of("entity", entity.key(), "operation", "search"),
          cause);
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new TransportException(
          "Search interrupted", Map.of("entity", entity.key(), "operation", "search"), e);
    }

    synchronized (buffer) {
      return new ArrayList<>(buffer);
    }
  }

  private List<Map<String, Object>> runOne(
      EntityDescriptor entity, String subQuery, List<String> fields) {
    ApiRequest request = requestBuilder.buildSearch(entity, subQuery, fields);
    JsonNode result = transport.execute(request).requireSuccess(request.context()).result();
    List<Map<String, Object>> rows = new ArrayList<>();
    if (result == null) {
      return rows;
    }
    if (result.isArray()) {
      for (JsonNode row : result) {
        if (row.isObject()) rows.add(JacksonUtility.toMap(row));
      }
    } else if (result.isObject() && result.size() > 0) {
      rows.add(JacksonUtility.toMap(result));
    }
    return rows;
  }

  /** Concatenate in sub-query order, keeping the first occurrence of each id. */
  static List<Map<String, Object>> merge(List<List<Map<String, Object>>> results) {
    Set<String> seen = new HashSet<>();
    List<Map<String, Object>> merged = new ArrayList<>();
    for (List<Map<String, Object>> rows : results) {
      for (Map<String, Object> row : rows) {
        Object id = row.get(ID);
        if (id != null && !seen.add(String.valueOf(id))) {
          continue;
        }
        merged.add(row);
      }
    }
    return merged;
  }

  static Map<String, Object> project(Map<String, Object> record, List<String> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String field : fields) {
      if (record.containsKey(field)) {
        out.put(field, record.get(field));
      }
    }
    return out;
  }

  private static void cancelAll(List<Future<Integer>> futures) {
    for (Future<Integer> f : futures) {
      f.cancel(true);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
