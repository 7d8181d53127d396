package com.gentoro.recordbridge.registry;

import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.http.HttpMethod;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The twelve operations an entity can support. Each kind has a fixed HTTP method and path shape
 * that does not depend on the entity: {@code {resourcePath}{suffix}} optionally followed by
 * {@code /{id}}.
 */
public enum OperationKind {
  SEARCH("search", "search", HttpMethod.POST, "/search", false),
  GET("get", "get", HttpMethod.GET, "", true),
  CREATE("create", "create", HttpMethod.POST, "", false),
  UPDATE("update", "update", HttpMethod.PUT, "", true),
  DELETE("delete", "delete", HttpMethod.DELETE, "", true),
  UPSERT("upsert", "upsert", HttpMethod.POST, "/upsert", false),
  ATTACH_FILE("attachFile", "attach_file", HttpMethod.POST, "/attach", true),
  RETRIEVE_ATTACHMENT(
      "retrieveAttachment", "retrieve_attachment", HttpMethod.POST, "/retrieveAttach", true),
  REMOVE_ATTACHMENT(
      "removeAttachment", "remove_attachment", HttpMethod.POST, "/removeAttach", true),
  GET_ATTACHMENT_INFO(
      "getAttachmentInfo", "get_attachment_info", HttpMethod.POST, "/attachInfo", true),
  ACTION_BUTTON("actionButton", "action_button", HttpMethod.POST, "/actionButton", true),
  EVALUATE_FORMAT("evaluateFormat", "evaluate_format", HttpMethod.POST, "/evaluateFormat", true);

  private final String operationName;
  private final String action;
  private final HttpMethod method;
  private final String pathSuffix;
  private final boolean targetsRecord;

  OperationKind(
      String operationName,
      String action,
      HttpMethod method,
      String pathSuffix,
      boolean targetsRecord) {
    this.operationName = operationName;
    this.action = action;
    this.method = method;
    this.pathSuffix = pathSuffix;
    this.targetsRecord = targetsRecord;
  }

  /** camelCase name, as used in the registry file. */
  public String operationName() {
    return operationName;
  }

  /** snake_case name, as used in tool names. */
  public String action() {
    return action;
  }

  public HttpMethod method() {
    return method;
  }

  public String pathSuffix() {
    return pathSuffix;
  }

  /** Whether the path ends with the target record id. */
  public boolean targetsRecord() {
    return targetsRecord;
  }

  public String path(String resourcePath, Long recordId) {
    String base = resourcePath + pathSuffix;
    return targetsRecord ? base + "/" + recordId : base;
  }

  /** Resolve from either the camelCase name, the snake_case action or the enum constant name. */
  public static OperationKind fromName(String name) {
    if (name != null) {
      String n = name.trim();
      for (OperationKind kind : values()) {
        if (kind.operationName.equalsIgnoreCase(n)
            || kind.action.equalsIgnoreCase(n)
            || kind.name().equalsIgnoreCase(n)) {
          return kind;
        }
      }
    }
    throw new ValidationException(
        "Unknown operation '%s'. Valid operations: %s"
            .formatted(
                name,
                Arrays.stream(values())
                    .map(OperationKind::operationName)
                    .collect(Collectors.joining(", "))));
  }
}
