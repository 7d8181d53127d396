package com.gentoro.recordbridge.dispatch;

import com.gentoro.recordbridge.registry.OperationKind;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What {@link OperationDispatcher#execute} returns: one record, a list of records (search), or
 * an operation-specific payload (delete, attachment and action operations).
 */
public final class OperationResult {
  private final String entity;
  private final OperationKind operation;
  private final Long recordId;
  private final List<RecordEnvelope> records;
  private final Object payload;
  private final boolean list;

  private OperationResult(
      String entity,
      OperationKind operation,
      Long recordId,
      List<RecordEnvelope> records,
      Object payload,
      boolean list) {
    this.entity = entity;
    this.operation = operation;
    this.recordId = recordId;
    this.records = List.copyOf(records);
    this.payload = payload;
    this.list = list;
  }

  public static OperationResult ofRecords(
      String entity, OperationKind operation, List<RecordEnvelope> records) {
    return new OperationResult(entity, operation, null, records, null, true);
  }

  public static OperationResult ofRecord(
      String entity, OperationKind operation, Long recordId, RecordEnvelope record) {
    Long id = record.id() != null ? record.id() : recordId;
    return new OperationResult(entity, operation, id, List.of(record), null, false);
  }

  public static OperationResult ofPayload(
      String entity, OperationKind operation, Long recordId, Object payload) {
    return new OperationResult(entity, operation, recordId, List.of(), payload, false);
  }

  public String entity() {
    return entity;
  }

  public OperationKind operation() {
    return operation;
  }

  public Long recordId() {
    return recordId;
  }

  public boolean isList() {
    return list;
  }

  public List<RecordEnvelope> records() {
    return records;
  }

  /** The single record, or null for list and payload results. */
  public RecordEnvelope record() {
    return list || records.isEmpty() ? null : records.get(0);
  }

  /** Plain data: list of field maps, a field map, or the raw payload. */
  public Object data() {
    if (list) {
      List<Map<String, Object>> out = new ArrayList<>(records.size());
      for (RecordEnvelope r : records) out.add(r.fields());
      return out;
    }
    if (!records.isEmpty()) {
      RecordEnvelope r = records.get(0);
      if (r.fields().isEmpty() && r.id() != null) {
        return Map.of("id", r.id());
      }
      return r.fields();
    }
    return payload;
  }

  /** {@code {success, operation, entity, record_id?, count?, data}} */
  public Map<String, Object> toResponse() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("success", true);
    out.put("operation", operation.action());
    out.put("entity", entity);
    if (recordId != null) out.put("record_id", recordId);
    if (list) out.put("count", records.size());
    out.put("data", data());
    return out;
  }

  public String toJson() {
    return JacksonUtility.toJson(toResponse());
  }

  @Override
  public String toString() {
    return "OperationResult{entity=%s, operation=%s, recordId=%s, records=%d}"
        .formatted(entity, operation, recordId, records.size());
  }
}
