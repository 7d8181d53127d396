package com.gentoro.recordbridge.mcp;

import com.gentoro.recordbridge.dispatch.OperationDispatcher;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.registry.EntityDescriptor;
import com.gentoro.recordbridge.registry.EntityRegistry;
import com.gentoro.recordbridge.registry.FieldSpec;
import com.gentoro.recordbridge.registry.OperationKind;
import com.gentoro.recordbridge.request.Arguments;
import com.gentoro.recordbridge.request.DeleteRule;
import com.gentoro.recordbridge.workflow.WorkflowService;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tools generated from the entity registry, one per (entity, supported operation), plus the
 * workflow tools. Entity tools are named {@code {prefix}_{action}_{entity}}; search uses the
 * plural, e.g. {@code agiloft_search_contracts}.
 */
public class ToolCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(ToolCatalog.class);

  private final String prefix;
  private final int defaultLimit;
  private final int maxLimit;
  private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

  public ToolCatalog(
      EntityRegistry registry,
      OperationDispatcher dispatcher,
      WorkflowService workflows,
      String prefix,
      int defaultLimit,
      int maxLimit) {
    this.prefix = prefix;
    this.defaultLimit = defaultLimit;
    this.maxLimit = maxLimit;
    for (EntityDescriptor entity : registry.all()) {
      for (OperationKind operation : OperationKind.values()) {
        if (entity.supports(operation)) {
          add(entityTool(entity, operation, dispatcher));
        }
      }
    }
    if (workflows != null) {
      workflowTools(workflows).forEach(this::add);
    }
    log.info("Tool catalog holds {} tools", tools.size());
  }

  public List<ToolDefinition> tools() {
    return List.copyOf(tools.values());
  }

  public ToolDefinition find(String name) {
    ToolDefinition tool = tools.get(name);
    if (tool == null) {
      throw new ValidationException("Unknown tool: " + name, Map.of("tool", String.valueOf(name)));
    }
    return tool;
  }

  public Object call(String name, Map<String, Object> arguments) {
    return find(name).handler().call(arguments == null ? Map.of() : arguments);
  }

  public String toolName(EntityDescriptor entity, OperationKind operation) {
    String target = operation == OperationKind.SEARCH ? entity.plural() : entity.key();
    return prefix + "_" + operation.action() + "_" + target;
  }

  private void add(ToolDefinition tool) {
    if (tools.putIfAbsent(tool.name(), tool) != null) {
      throw new ValidationException("Duplicate tool name: " + tool.name());
    }
  }

  private ToolDefinition entityTool(
      EntityDescriptor entity, OperationKind operation, OperationDispatcher dispatcher) {
    String one = entity.displayName().toLowerCase(Locale.ROOT);
    String many = entity.displayNamePlural().toLowerCase(Locale.ROOT);
    Schema schema = new Schema();
    String description;

    switch (operation) {
      case SEARCH -> {
        String searchable =
            entity.searchFields().isEmpty() ? "key fields" : String.join(", ", entity.searchFields());
        description =
            "Search for %s. Use structured queries like 'status=Active AND field>value' or plain text matched against %s."
                .formatted(many, searchable);
        schema.string(
            Arguments.QUERY,
            "Structured query (e.g. 'status=Active') or text to search in " + searchable,
            true);
        schema.fields("Fields to return. Defaults to: " + String.join(", ", entity.defaultFields()));
        schema.put(
            Arguments.LIMIT,
            prop(
                "integer",
                "Maximum results to return (default %d)".formatted(defaultLimit),
                "default", defaultLimit,
                "minimum", 1,
                "maximum", maxLimit),
            false);
      }
      case GET -> {
        description = "Retrieve a specific %s by ID.".formatted(one);
        schema.recordId(one);
        schema.fields("Specific fields to return. If omitted, returns all fields.");
      }
      case CREATE -> {
        description =
            "Create a new %s. Required fields: %s. Any valid field can be included."
                .formatted(
                    one,
                    entity.requiredFields().isEmpty()
                        ? "none"
                        : String.join(", ", entity.requiredFields()));
        schema.put(Arguments.DATA, dataSchema(entity, entity.displayName() + " data."), true);
      }
      case UPDATE -> {
        description = "Update an existing %s. Only include fields that change.".formatted(one);
        schema.recordId(one);
        schema.put(Arguments.DATA, dataSchema(entity, "Fields to update."), true);
      }
      case DELETE -> {
        description =
            "Delete a %s. This is irreversible. delete_rule controls how dependent records are handled."
                .formatted(one);
        schema.recordId(one);
        schema.put(
            Arguments.DELETE_RULE,
            prop(
                "string",
                "How to handle dependent records",
                "enum", Arrays.stream(DeleteRule.values()).map(Enum::name).toList(),
                "default", DeleteRule.DEFAULT.name()),
            false);
      }
      case UPSERT -> {
        description =
            "Insert or update a %s. If a record matches the query it is updated, otherwise created. Query format: field~='value'."
                .formatted(one);
        schema.string(Arguments.QUERY, "Match query: field~='value'", true);
        schema.put(Arguments.DATA, dataSchema(entity, entity.displayName() + " data."), true);
      }
      case ATTACH_FILE -> {
        description = "Upload a file into a file field of a %s record.".formatted(one);
        schema.recordId(one);
        schema.string(Arguments.FIELD, "File field name, e.g. attached_file", true);
        schema.string(Arguments.FILE_NAME, "Name of the uploaded file", true);
        schema.string(Arguments.FILE_CONTENT_BASE64, "Base64-encoded file content", true);
      }
      case RETRIEVE_ATTACHMENT, REMOVE_ATTACHMENT -> {
        description =
            (operation == OperationKind.RETRIEVE_ATTACHMENT
                    ? "Download a file from a %s record. "
                    : "Remove a file from a %s record. ")
                    .formatted(one)
                + "Use get_attachment_info first to find the file position.";
        schema.recordId(one);
        schema.string(Arguments.FIELD, "File field name", true);
        schema.put(
            Arguments.FILE_POSITION,
            prop("integer", "Position of the file in the field (0-based)", "default", 0, "minimum", 0),
            false);
      }
      case GET_ATTACHMENT_INFO -> {
        description =
            "Get names, sizes and positions of the files in a file field of a %s record."
                .formatted(one);
        schema.recordId(one);
        schema.string(Arguments.FIELD, "File field name", true);
      }
      case ACTION_BUTTON -> {
        description = "Trigger an action button on a %s record.".formatted(one);
        schema.recordId(one);
        schema.string(Arguments.BUTTON_NAME, "Name of the action button", true);
      }
      case EVALUATE_FORMAT -> {
        description = "Evaluate a formula in the context of a %s record.".formatted(one);
        schema.recordId(one);
        schema.string(Arguments.FORMULA, "Formula to evaluate", true);
      }
      default -> throw new IllegalStateException("Unhandled operation " + operation);
    }

    String entityKey = entity.key();
    return new ToolDefinition(
        toolName(entity, operation),
        description,
        schema.build(),
        args -> dispatcher.execute(entityKey, operation, args).toResponse());
  }

  private List<ToolDefinition> workflowTools(WorkflowService workflows) {
    List<ToolDefinition> out = new ArrayList<>();

    Schema preflight = new Schema();
    preflight.string("contract_type", "Contract type name; omit to list active types", false);
    preflight.string("company_name", "Company the contract is with", false);
    out.add(
        new ToolDefinition(
            prefix + "_preflight_create_contract",
            "Check that a contract type and company are valid before creating a contract. Creates nothing.",
            preflight.build(),
            args -> {
              Arguments a = new Arguments(args);
              return workflows
                  .preflightCreateContract(
                      a.optionalString("contract_type"), a.optionalString("company_name"))
                  .toResponse();
            }));

    Schema withCompany = new Schema();
    withCompany.string("company_name", "Exact company name", true);
    withCompany.put("contract_data", objectProp("Contract fields"), true);
    withCompany.put(
        "create_company_if_missing",
        prop("boolean", "Create the company when it does not exist", "default", false),
        false);
    withCompany.put("company_data", objectProp("Company fields used when creating it"), false);
    out.add(
        new ToolDefinition(
            prefix + "_create_contract_with_company",
            "Create a contract linked to a company, finding or creating the company first.",
            withCompany.build(),
            args -> {
              Arguments a = new Arguments(args);
              return workflows
                  .createContractWithCompany(
                      a.requireString("company_name"),
                      objectArg(args, "contract_data"),
                      booleanArg(args, "create_company_if_missing"),
                      objectArg(args, "company_data"))
                  .toResponse();
            }));

    Schema onboard = new Schema();
    onboard.put("company_data", objectProp("Company fields; company_name is required"), true);
    onboard.put("contact_data", objectProp("Optional primary contact fields"), false);
    onboard.put(
        "skip_if_exists",
        prop("boolean", "Use the existing company instead of failing", "default", false),
        false);
    out.add(
        new ToolDefinition(
            prefix + "_onboard_company_with_contact",
            "Create a company and optionally a primary contact linked to it.",
            onboard.build(),
            args ->
                workflows
                    .onboardCompanyWithContact(
                        objectArg(args, "company_data"),
                        objectArg(args, "contact_data"),
                        booleanArg(args, "skip_if_exists"))
                    .toResponse()));

    Schema summary = new Schema();
    summary.put("contract_id", prop("integer", "Contract ID", "minimum", 1), true);
    out.add(
        new ToolDefinition(
            prefix + "_get_contract_summary",
            "Contract details with company, attachments and health checks.",
            summary.build(),
            args -> {
              Long id = new Arguments(args).optionalLong("contract_id");
              if (id == null) {
                throw new ValidationException("Missing required argument 'contract_id'");
              }
              return workflows.getContractSummary(id).toResponse();
            }));

    Schema expiring = new Schema();
    expiring.put(
        "days_from_now",
        prop("integer", "Look-ahead window in days", "default", 90, "minimum", 0),
        false);
    expiring.put(
        "include_expired",
        prop("boolean", "Also return contracts that already ended", "default", false),
        false);
    expiring.string("status_filter", "Only contracts in this workflow state", false);
    out.add(
        new ToolDefinition(
            prefix + "_find_expiring_contracts",
            "Find contracts ending soon, grouped by urgency.",
            expiring.build(),
            args -> {
              Arguments a = new Arguments(args);
              return workflows
                  .findExpiringContracts(
                      a.optionalInt("days_from_now", 90),
                      booleanArg(args, "include_expired"),
                      a.optionalString("status_filter"))
                  .toResponse();
            }));

    Schema attach = new Schema();
    attach.put("contract_id", prop("integer", "Contract ID", "minimum", 1), true);
    attach.string(Arguments.FILE_NAME, "Name of the uploaded file", true);
    attach.string(Arguments.FILE_CONTENT_BASE64, "Base64-encoded file content", true);
    attach.string("attachment_title", "Attachment title; defaults to the file name", false);
    out.add(
        new ToolDefinition(
            prefix + "_attach_file_to_contract",
            "Attach a file to a contract through a linked attachment record.",
            attach.build(),
            args -> {
              Arguments a = new Arguments(args);
              Long id = a.optionalLong("contract_id");
              if (id == null) {
                throw new ValidationException("Missing required argument 'contract_id'");
              }
              return workflows
                  .attachFileToContract(
                      id,
                      a.requireString(Arguments.FILE_NAME),
                      a.requireFileContent(),
                      a.optionalString("attachment_title"))
                  .toResponse();
            }));
    return out;
  }

  private static Map<String, Object> dataSchema(EntityDescriptor entity, String description) {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (FieldSpec field : entity.fields().values()) {
      String desc =
          entity.isLinked(field.name())
              ? field.description() + " (sent as a relation; the ':' prefix is added automatically)"
              : field.description();
      properties.put(field.name(), prop(field.type(), desc));
    }
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("description", description);
    schema.put("properties", properties);
    schema.put("additionalProperties", true);
    return schema;
  }

  private static Map<String, Object> objectProp(String description) {
    Map<String, Object> schema = prop("object", description);
    schema.put("additionalProperties", true);
    return schema;
  }

  private static Map<String, Object> prop(String type, String description, Object... extra) {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", type);
    schema.put("description", description);
    for (int i = 0; i + 1 < extra.length; i += 2) {
      schema.put((String) extra[i], extra[i + 1]);
    }
    return schema;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> objectArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (value == null) return null;
    if (value instanceof Map<?, ?>) return (Map<String, Object>) value;
    throw new ValidationException("Argument '%s' must be an object".formatted(name));
  }

  private static boolean booleanArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) return Boolean.parseBoolean(s.trim());
    return false;
  }

  /** Accumulates JSON-schema properties and the required list. */
  private static final class Schema {
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();

    void put(String name, Map<String, Object> property, boolean isRequired) {
      properties.put(name, property);
      if (isRequired) required.add(name);
    }

    void string(String name, String description, boolean isRequired) {
      put(name, prop("string", description), isRequired);
    }

    void recordId(String entityName) {
      put(
          Arguments.RECORD_ID,
          prop("integer", "The ID of the " + entityName + " record", "minimum", 1),
          true);
    }

    void fields(String description) {
      Map<String, Object> p = prop("array", description);
      p.put("items", Map.of("type", "string"));
      put(Arguments.FIELDS, p, false);
    }

    McpSchema.JsonSchema build() {
      return new McpSchema.JsonSchema(
          "object",
          properties,
          required,
          false,
          Collections.emptyMap(),
          Collections.emptyMap());
    }
  }
}
