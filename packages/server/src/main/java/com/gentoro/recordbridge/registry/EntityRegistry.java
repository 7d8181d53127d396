package com.gentoro.recordbridge.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.recordbridge.exception.ConfigException;
import com.gentoro.recordbridge.exception.InvalidRegistryEntryException;
import com.gentoro.recordbridge.exception.RecordBridgeException;
import com.gentoro.recordbridge.exception.UnknownEntityException;
import com.gentoro.recordbridge.utility.JacksonUtility;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static mapping from entity key to {@link EntityDescriptor}.
 *
 * <p>Built once at startup and read-only afterwards, so it is shared across threads without
 * synchronization. Every entry is validated on construction; a malformed entry fails the whole
 * registry with {@link InvalidRegistryEntryException} rather than surfacing at dispatch time.
 */
public final class EntityRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(EntityRegistry.class);

  private final Map<String, EntityDescriptor> entities;

  public EntityRegistry(Collection<EntityDescriptor> descriptors) {
    Map<String, EntityDescriptor> byKey = new LinkedHashMap<>();
    for (EntityDescriptor descriptor : descriptors) {
      validate(descriptor);
      if (byKey.putIfAbsent(descriptor.key(), descriptor) != null) {
        throw new InvalidRegistryEntryException(descriptor.key(), "duplicate entity key");
      }
    }
    this.entities = Collections.unmodifiableMap(byKey);
  }

  /**
   * Load the registry from a YAML document. Location formats: {@code classpath:entities.yaml} or
   * a filesystem path.
   */
  public static EntityRegistry load(String location) {
    String loc = location == null || location.isBlank() ? "classpath:entities.yaml" : location;
    try (InputStream in = open(loc)) {
      JsonNode root = JacksonUtility.getYamlMapper().readTree(in);
      List<EntityDefinition> definitions =
          JacksonUtility.getYamlMapper()
              .convertValue(root.path("entities"), new TypeReference<List<EntityDefinition>>() {});
      EntityRegistry registry = fromDefinitions(definitions == null ? List.of() : definitions);
      log.info("Loaded {} entities from {}: {}", registry.entities.size(), loc, registry.keys());
      return registry;
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigException("Failed to read entity registry from " + loc, e);
    }
  }

  public static EntityRegistry fromDefinitions(List<EntityDefinition> definitions) {
    List<EntityDescriptor> descriptors = new ArrayList<>();
    for (EntityDefinition def : definitions) {
      if (def.getKey() == null || def.getKey().isBlank()) {
        throw new InvalidRegistryEntryException(def.getKey(), "entity key is blank");
      }
      if (def.getPath() == null || def.getPath().isBlank()) {
        throw new InvalidRegistryEntryException(def.getKey(), "resource path is blank");
      }
      try {
        descriptors.add(def.toDescriptor());
      } catch (RecordBridgeException e) {
        throw new InvalidRegistryEntryException(def.getKey(), e.getMessage());
      }
    }
    return new EntityRegistry(descriptors);
  }

  public EntityDescriptor lookup(String entityKey) {
    EntityDescriptor descriptor = entityKey == null ? null : entities.get(entityKey);
    if (descriptor == null) {
      throw new UnknownEntityException(entityKey, entities.keySet());
    }
    return descriptor;
  }

  public boolean supports(String entityKey, OperationKind operation) {
    return lookup(entityKey).supports(operation);
  }

  /** Entity keys in declaration order. */
  public List<String> keys() {
    return List.copyOf(entities.keySet());
  }

  public Collection<EntityDescriptor> all() {
    return entities.values();
  }

  private static void validate(EntityDescriptor d) {
    if (d.key().isBlank()) {
      throw new InvalidRegistryEntryException(d.key(), "entity key is blank");
    }
    if (!d.resourcePath().startsWith("/")) {
      throw new InvalidRegistryEntryException(
          d.key(), "resource path must start with '/': " + d.resourcePath());
    }
    checkKnown(d, "required", d.requiredFields());
    checkKnown(d, "linked", d.linkedFields());
    checkKnown(d, "search", d.searchFields());
  }

  private static void checkKnown(EntityDescriptor d, String role, Collection<String> names) {
    for (String name : names) {
      if (!d.fields().containsKey(name)) {
        throw new InvalidRegistryEntryException(
            d.key(), "%s field '%s' is not declared in fields".formatted(role, name));
      }
    }
  }

  private static InputStream open(String loc) throws IOException {
    if (loc.startsWith("classpath:")) {
      String resource = loc.substring("classpath:".length());
      InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Registry resource not found on classpath: " + resource);
      }
      return in;
    }
    return new FileInputStream(new File(loc));
  }
}
