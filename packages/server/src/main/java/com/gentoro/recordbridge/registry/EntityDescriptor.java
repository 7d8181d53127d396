package com.gentoro.recordbridge.registry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one resource kind exposed by the backend.
 *
 * <p>Entity differences (which fields are required, which are linked, which operations are
 * allowed) live here as data, so a single generic dispatcher serves every entity.
 *
 * @param key unique registry key, e.g. {@code contract}
 * @param plural plural key used in tool names, e.g. {@code contracts}
 * @param resourcePath backend path, e.g. {@code /contract}
 * @param searchFields free-text search fields, in fan-out order
 * @param requiredFields fields required on create
 * @param linkedFields fields holding a relation; wire-encoded as {@code :value}
 * @param defaultFields default projection for search
 * @param fields key field metadata, in declaration order
 * @param operations supported operations
 */
public record EntityDescriptor(
    String key,
    String plural,
    String resourcePath,
    String displayName,
    String displayNamePlural,
    List<String> searchFields,
    Set<String> requiredFields,
    Set<String> linkedFields,
    List<String> defaultFields,
    Map<String, FieldSpec> fields,
    Set<OperationKind> operations) {

  public EntityDescriptor {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(resourcePath, "resourcePath");
    plural = plural == null ? key + "s" : plural;
    displayName = displayName == null ? key : displayName;
    displayNamePlural = displayNamePlural == null ? plural : displayNamePlural;
    searchFields = searchFields == null ? List.of() : List.copyOf(searchFields);
    requiredFields = orderedCopy(requiredFields);
    linkedFields = orderedCopy(linkedFields);
    defaultFields = defaultFields == null ? List.of() : List.copyOf(defaultFields);
    fields =
        fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    operations =
        operations == null || operations.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.allOf(OperationKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(operations));
  }

  public boolean supports(OperationKind operation) {
    return operations.contains(operation);
  }

  public boolean isLinked(String fieldName) {
    return linkedFields.contains(fieldName);
  }

  private static Set<String> orderedCopy(Set<String> input) {
    if (input == null || input.isEmpty()) return Set.of();
    return Collections.unmodifiableSet(new LinkedHashSet<>(input));
  }
}
