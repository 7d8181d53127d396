package com.gentoro.recordbridge.registry;

/** Schema hint for one key field of an entity: JSON type plus a short description. */
public record FieldSpec(String name, String type, String description) {}
