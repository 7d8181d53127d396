package com.gentoro.recordbridge.dispatch;

import com.gentoro.recordbridge.exception.BackendOperationException;
import com.gentoro.recordbridge.exception.UnsupportedEntityOperationException;
import com.gentoro.recordbridge.http.ApiRequest;
import com.gentoro.recordbridge.http.BackendResponse;
import com.gentoro.recordbridge.http.TransportClient;
import com.gentoro.recordbridge.registry.EntityDescriptor;
import com.gentoro.recordbridge.registry.EntityRegistry;
import com.gentoro.recordbridge.registry.OperationKind;
import com.gentoro.recordbridge.request.Arguments;
import com.gentoro.recordbridge.request.RequestBuilder;
import com.gentoro.recordbridge.search.SearchEngine;
import com.gentoro.recordbridge.search.SearchQuery;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for every (entity, operation) request.
 *
 * <p>Resolution order: registry lookup, capability check, then either the search engine or the
 * request builder plus transport. Both pre-flight checks fail before any network call. A 2xx reply
 * carrying {@code "success": false} is raised as {@link BackendOperationException}, so callers
 * handle a single error channel.
 */
public class OperationDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(OperationDispatcher.class);

  private final EntityRegistry registry;
  private final RequestBuilder requestBuilder;
  private final TransportClient transport;
  private final SearchEngine searchEngine;

  public OperationDispatcher(
      EntityRegistry registry,
      RequestBuilder requestBuilder,
      TransportClient transport,
      SearchEngine searchEngine) {
    this.registry = registry;
    this.requestBuilder = requestBuilder;
    this.transport = transport;
    this.searchEngine = searchEngine;
  }

  public EntityRegistry registry() {
    return registry;
  }

  /** Same as {@link #execute(String, OperationKind, Map)} with the operation given by name. */
  public OperationResult execute(String entityKey, String operation, Map<String, ?> args) {
    return execute(entityKey, OperationKind.fromName(operation), args);
  }

  public OperationResult execute(String entityKey, OperationKind operation, Map<String, ?> args) {
    EntityDescriptor entity = registry.lookup(entityKey);
    if (!entity.supports(operation)) {
      throw new UnsupportedEntityOperationException(entityKey, operation.operationName());
    }
    Map<String, ?> arguments = args == null ? Map.of() : args;
    log.debug("Executing {} on {}", operation.operationName(), entityKey);

    OperationResult result =
        operation == OperationKind.SEARCH
            ? search(entity, arguments)
            : single(entity, operation, arguments);
    log.info(
        "{} on {} succeeded{}",
        operation.operationName(),
        entityKey,
        result.isList() ? " with " + result.records().size() + " records" : "");
    return result;
  }

  private OperationResult search(EntityDescriptor entity, Map<String, ?> args) {
    Arguments a = new Arguments(args);
    Long limit = a.optionalLong(Arguments.LIMIT);
    SearchQuery query =
        new SearchQuery(
            a.optionalString(Arguments.QUERY),
            a.optionalStringList(Arguments.FIELDS),
            limit == null ? null : (int) Math.max(0, Math.min(Integer.MAX_VALUE, limit)));
    List<RecordEnvelope> records = new ArrayList<>();
    for (Map<String, Object> row : searchEngine.search(entity, query)) {
      records.add(RecordEnvelope.ofFields(row));
    }
    return OperationResult.ofRecords(entity.key(), OperationKind.SEARCH, records);
  }

  private OperationResult single(
      EntityDescriptor entity, OperationKind operation, Map<String, ?> args) {
    ApiRequest request = requestBuilder.build(entity, operation, args);
    BackendResponse response = transport.execute(request).requireSuccess(request.context());
    Long recordId = (Long) request.context().get("recordId");

    switch (operation) {
      case GET, CREATE, UPDATE, UPSERT -> {
        RecordEnvelope envelope = RecordEnvelope.from(response);
        if (operation == OperationKind.GET) {
          envelope = envelope.project(new Arguments(args).optionalStringList(Arguments.FIELDS));
        }
        return OperationResult.ofRecord(entity.key(), operation, recordId, envelope);
      }
      default -> {
        return OperationResult.ofPayload(
            entity.key(), operation, recordId, JacksonUtility.toPlain(response.result()));
      }
    }
  }
}
