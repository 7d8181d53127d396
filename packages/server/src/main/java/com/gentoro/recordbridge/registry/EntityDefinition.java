package com.gentoro.recordbridge.registry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** YAML binding for one entry of the registry file. Converted to {@link EntityDescriptor}. */
public class EntityDefinition {
  private String key;
  private String plural;
  private String path;
  private String displayName;
  private String displayNamePlural;
  private List<String> searchFields = new ArrayList<>();
  private List<String> requiredFields = new ArrayList<>();
  private List<String> linkedFields = new ArrayList<>();
  private List<String> defaultFields = new ArrayList<>();
  private Map<String, FieldDefinition> fields = new LinkedHashMap<>();
  private List<String> operations = new ArrayList<>();

  public static class FieldDefinition {
    private String type = "string";
    private String description = "";

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }
  }

  public EntityDescriptor toDescriptor() {
    Map<String, FieldSpec> specs = new LinkedHashMap<>();
    if (fields != null) {
      fields.forEach(
          (name, def) ->
              specs.put(
                  name,
                  def == null
                      ? new FieldSpec(name, "string", "")
                      : new FieldSpec(name, def.getType(), def.getDescription())));
    }
    Set<OperationKind> ops = EnumSet.noneOf(OperationKind.class);
    if (operations != null) {
      for (String op : operations) {
        ops.add(OperationKind.fromName(op));
      }
    }
    return new EntityDescriptor(
        key,
        plural,
        path,
        displayName,
        displayNamePlural,
        searchFields,
        requiredFields == null ? null : new LinkedHashSet<>(requiredFields),
        linkedFields == null ? null : new LinkedHashSet<>(linkedFields),
        defaultFields,
        specs,
        ops);
  }

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public String getPlural() {
    return plural;
  }

  public void setPlural(String plural) {
    this.plural = plural;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayNamePlural() {
    return displayNamePlural;
  }

  public void setDisplayNamePlural(String displayNamePlural) {
    this.displayNamePlural = displayNamePlural;
  }

  public List<String> getSearchFields() {
    return searchFields;
  }

  public void setSearchFields(List<String> searchFields) {
    this.searchFields = searchFields;
  }

  public List<String> getRequiredFields() {
    return requiredFields;
  }

  public void setRequiredFields(List<String> requiredFields) {
    this.requiredFields = requiredFields;
  }

  public List<String> getLinkedFields() {
    return linkedFields;
  }

  public void setLinkedFields(List<String> linkedFields) {
    this.linkedFields = linkedFields;
  }

  public List<String> getDefaultFields() {
    return defaultFields;
  }

  public void setDefaultFields(List<String> defaultFields) {
    this.defaultFields = defaultFields;
  }

  public Map<String, FieldDefinition> getFields() {
    return fields;
  }

  public void setFields(Map<String, FieldDefinition> fields) {
    this.fields = fields;
  }

  public List<String> getOperations() {
    return operations;
  }

  public void setOperations(List<String> operations) {
    this.operations = operations;
  }
}
