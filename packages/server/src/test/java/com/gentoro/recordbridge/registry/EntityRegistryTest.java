package com.gentoro.recordbridge.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.recordbridge.exception.ConfigException;
import com.gentoro.recordbridge.exception.InvalidRegistryEntryException;
import com.gentoro.recordbridge.exception.RecordBridgeErrorCode;
import com.gentoro.recordbridge.exception.UnknownEntityException;
import com.gentoro.recordbridge.exception.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntityRegistryTest {

  private static EntityDefinition definition(String key, String path) {
    EntityDefinition def = new EntityDefinition();
    def.setKey(key);
    def.setPath(path);
    Map<String, EntityDefinition.FieldDefinition> fields = new LinkedHashMap<>();
    fields.put("name", new EntityDefinition.FieldDefinition());
    def.setFields(fields);
    return def;
  }

  @Test
  void bundledRegistryDeclaresAllEntitiesInOrder() {
    EntityRegistry registry = EntityRegistry.load("classpath:entities.yaml");

    assertEquals(
        List.of("contract", "company", "attachment", "contact", "employee", "customer", "contract_type"),
        registry.keys());

    EntityDescriptor contract = registry.lookup("contract");
    assertEquals("/contract", contract.resourcePath());
    assertEquals("contracts", contract.plural());
    assertEquals(List.of("contract_title1", "company_name"), contract.searchFields());
    assertTrue(contract.isLinked("company_name"));
    assertFalse(contract.isLinked("contract_title1"));
    assertTrue(contract.requiredFields().contains("record_type"));
    assertEquals(OperationKind.values().length, contract.operations().size());

    assertEquals("/contacts.employees", registry.lookup("employee").resourcePath());
  }

  @Test
  void contractTypeOnlySupportsItsDeclaredOperations() {
    EntityRegistry registry = EntityRegistry.load("classpath:entities.yaml");

    assertTrue(registry.supports("contract_type", OperationKind.UPSERT));
    assertTrue(registry.supports("contract_type", OperationKind.EVALUATE_FORMAT));
    assertFalse(registry.supports("contract_type", OperationKind.ATTACH_FILE));
    assertFalse(registry.supports("contract_type", OperationKind.GET_ATTACHMENT_INFO));
  }

  @Test
  void unknownEntityListsTheKnownKeys() {
    EntityRegistry registry = EntityRegistry.load("classpath:entities.yaml");

    UnknownEntityException ex =
        assertThrows(UnknownEntityException.class, () -> registry.lookup("invoice"));
    assertEquals(RecordBridgeErrorCode.UNKNOWN_ENTITY, ex.getCode());
    assertThrows(UnknownEntityException.class, () -> registry.supports(null, OperationKind.GET));
  }

  @Test
  void requiredFieldMustBeDeclared() {
    EntityDefinition def = definition("widget", "/widget");
    def.setRequiredFields(List.of("name", "colour"));

    InvalidRegistryEntryException ex =
        assertThrows(
            InvalidRegistryEntryException.class,
            () -> EntityRegistry.fromDefinitions(List.of(def)));
    assertTrue(ex.getMessage().contains("colour"));
  }

  @Test
  void linkedFieldMustBeDeclared() {
    EntityDefinition def = definition("widget", "/widget");
    def.setLinkedFields(List.of("owner"));

    assertThrows(
        InvalidRegistryEntryException.class, () -> EntityRegistry.fromDefinitions(List.of(def)));
  }

  @Test
  void duplicateKeysAreRejected() {
    assertThrows(
        InvalidRegistryEntryException.class,
        () ->
            EntityRegistry.fromDefinitions(
                List.of(definition("widget", "/widget"), definition("widget", "/widget2"))));
  }

  @Test
  void resourcePathMustBeAbsolute() {
    assertThrows(
        InvalidRegistryEntryException.class,
        () -> EntityRegistry.fromDefinitions(List.of(definition("widget", "widget"))));
  }

  @Test
  void unknownOperationNameIsAnInvalidEntry() {
    EntityDefinition def = definition("widget", "/widget");
    def.setOperations(List.of("get", "archive"));

    InvalidRegistryEntryException ex =
        assertThrows(
            InvalidRegistryEntryException.class,
            () -> EntityRegistry.fromDefinitions(List.of(def)));
    assertEquals(RecordBridgeErrorCode.INVALID_REGISTRY_ENTRY, ex.getCode());
  }

  @Test
  void omittedOperationsMeanAll() {
    EntityRegistry registry =
        EntityRegistry.fromDefinitions(List.of(definition("widget", "/widget")));
    for (OperationKind kind : OperationKind.values()) {
      assertTrue(registry.supports("widget", kind), kind.name());
    }
  }

  @Test
  void loadsFromTheFilesystem(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("entities.yaml");
    Files.writeString(
        file,
        """
        entities:
          - key: widget
            path: /widget
            searchFields: [name]
            operations: [search, get]
            fields:
              name: {type: string, description: "Widget name"}
        """);

    EntityRegistry registry = EntityRegistry.load(file.toString());

    EntityDescriptor widget = registry.lookup("widget");
    assertEquals("widgets", widget.plural());
    assertEquals("Widget name", widget.fields().get("name").description());
    assertFalse(widget.supports(OperationKind.DELETE));
  }

  @Test
  void missingRegistryFileIsAConfigurationError(@TempDir Path dir) {
    assertThrows(
        ConfigException.class, () -> EntityRegistry.load(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void operationKindResolvesEveryNameForm() {
    assertEquals(OperationKind.ATTACH_FILE, OperationKind.fromName("attachFile"));
    assertEquals(OperationKind.ATTACH_FILE, OperationKind.fromName("attach_file"));
    assertEquals(OperationKind.ATTACH_FILE, OperationKind.fromName("ATTACH_FILE"));
    assertThrows(ValidationException.class, () -> OperationKind.fromName("archive"));
  }

  @Test
  void operationPathsFollowTheFixedShapes() {
    assertEquals("/contract/search", OperationKind.SEARCH.path("/contract", null));
    assertEquals("/contract/42", OperationKind.GET.path("/contract", 42L));
    assertEquals("/contract/upsert", OperationKind.UPSERT.path("/contract", null));
    assertEquals("/contract/attach/5", OperationKind.ATTACH_FILE.path("/contract", 5L));
    assertEquals(
        "/contract/retrieveAttach/5", OperationKind.RETRIEVE_ATTACHMENT.path("/contract", 5L));
  }
}
