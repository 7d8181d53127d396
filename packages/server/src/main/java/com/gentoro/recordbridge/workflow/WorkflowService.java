package com.gentoro.recordbridge.workflow;

import com.gentoro.recordbridge.dispatch.OperationDispatcher;
import com.gentoro.recordbridge.dispatch.OperationResult;
import com.gentoro.recordbridge.exception.RecordBridgeErrorCode;
import com.gentoro.recordbridge.exception.RecordBridgeException;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.exception.WorkflowException;
import com.gentoro.recordbridge.registry.OperationKind;
import com.gentoro.recordbridge.request.Arguments;
import com.gentoro.recordbridge.search.QueryClassifier;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Business workflows that chain several dispatcher calls. They add no transport or encoding logic
 * of their own: linked-field prefixes, empty-value stripping and error mapping all happen in the
 * dispatcher.
 *
 * <p>Business preconditions that fail (company missing, company already exists) raise {@link
 * ValidationException}. A failing step raises {@link WorkflowException} carrying what the earlier
 * steps produced.
 */
public class WorkflowService {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(WorkflowService.class);

  static final List<String> CONTRACT_TYPE_FIELDS =
      List.of(
          "id",
          "contract_type",
          "party_type",
          "description",
          "default_contract_term_in_months",
          "default_autorenewal_term_in_months");
  static final List<String> COMPANY_FIELDS =
      List.of("id", "company_name", "type_of_company", "status");
  static final List<String> SUMMARY_FIELDS =
      List.of(
          "id", "record_type", "contract_title1", "company_name", "contract_type",
          "contract_amount", "contract_start_date", "contract_end_date",
          "contract_term_in_months", "wfstate", "internal_contract_owner", "date_signed",
          "confidential", "auto_renewal_term_in_months", "evaluation_frequency",
          "contract_description", "cost_center");
  static final List<String> EXPIRING_FIELDS =
      List.of(
          "id", "contract_title1", "company_name", "contract_type", "contract_end_date",
          "contract_amount", "wfstate", "auto_renewal_term_in_months",
          "internal_contract_owner");
  static final int EXPIRING_LIMIT = 200;

  private final OperationDispatcher dispatcher;
  private final Clock clock;
  private final String toolPrefix;

  public WorkflowService(OperationDispatcher dispatcher, Clock clock, String toolPrefix) {
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.toolPrefix = toolPrefix;
  }

  /** Validate contract type and company before a contract is created. Creates nothing. */
  public WorkflowResult preflightCreateContract(String contractType, String companyName) {
    WorkflowResult result = new WorkflowResult("preflight_create_contract");
    try {
      if (isBlank(contractType)) {
        result.put("available_contract_types", activeContractTypes(CONTRACT_TYPE_FIELDS));
        result.put("ready_to_create", false);
        result.nextStep(
            "Select a contract type from the list and call this tool again with the"
                + " contract_type parameter.");
        return result;
      }

      List<Map<String, Object>> types =
          search(
              "contract_type",
              QueryClassifier.exactMatch("contract_type", contractType) + " AND status=Active",
              withField(CONTRACT_TYPE_FIELDS, "available_for_record_types"),
              null);
      if (types.isEmpty()) {
        result.warn("Contract type '%s' not found or not active.".formatted(contractType));
        result.put("ready_to_create", false);
        result.put(
            "available_contract_types",
            activeContractTypes(List.of("id", "contract_type", "party_type")));
        result.nextStep("Choose from the available active contract types.");
        return result;
      }
      Map<String, Object> typeInfo = types.get(0);
      result.put("contract_type", typeInfo);

      boolean companyFound = false;
      if (!isBlank(companyName)) {
        List<Map<String, Object>> companies =
            search(
                "company",
                QueryClassifier.partialMatch("company_name", companyName),
                COMPANY_FIELDS,
                null);
        if (companies.isEmpty()) {
          result.warn(
              "Company '%s' not found. Create it first or check the name.".formatted(companyName));
          result.nextStep(
              "Use %s or %s to create the company first."
                  .formatted(tool("create_company"), tool("onboard_company_with_contact")));
        } else {
          companyFound = true;
          Map<String, Object> company = companies.get(0);
          result.put("company", company);
          String partyType = text(typeInfo.get("party_type"));
          String companyType = text(company.get("type_of_company"));
          if (!partyType.isEmpty() && !companyType.isEmpty() && !partyType.equals(companyType)) {
            result.warn(
                ("Type mismatch: contract type expects party_type='%s' but company is"
                        + " type_of_company='%s'. This may cause issues.")
                    .formatted(partyType, companyType));
          }
          String status = text(company.get("status"));
          if (!"Active".equals(status)) {
            result.warn("Company '%s' status is '%s', not Active.".formatted(companyName, status));
          }
        }
      } else {
        result.nextStep("Provide a company_name to validate company compatibility.");
      }

      Map<String, Object> required = new LinkedHashMap<>();
      required.put("record_type", "Contract, Child Contract, or Amendment");
      required.put("auto_renewal_term_in_months", "integer");
      required.put("confidential", "string");
      required.put("evaluation_frequency", "integer");
      required.put("contract_type", contractType);
      if (companyFound) {
        required.put("company_name", companyName);
      }
      result.put("required_fields", required);

      boolean ready = result.warnings().isEmpty();
      result.put("ready_to_create", ready);
      if (ready) {
        result.nextStep(
            "All validations passed. Use %s with the required fields to create the contract."
                .formatted(tool("create_contract")));
      }
      return result;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  /** Resolve (or create) the company by exact name, then create a contract linked to it. */
  public WorkflowResult createContractWithCompany(
      String companyName,
      Map<String, Object> contractData,
      boolean createCompanyIfMissing,
      Map<String, Object> companyData) {
    if (isBlank(companyName)) {
      throw new ValidationException("Missing required argument 'company_name'");
    }
    WorkflowResult result = new WorkflowResult("create_contract_with_company");
    try {
      List<Map<String, Object>> companies =
          search(
              "company",
              QueryClassifier.exactMatch("company_name", companyName),
              COMPANY_FIELDS,
              null);
      if (!companies.isEmpty()) {
        result.put("company", companies.get(0));
        result.put("company_action", "found_existing");
      } else if (createCompanyIfMissing) {
        Map<String, Object> create = copy(companyData);
        create.put("company_name", companyName);
        result.put("company", create("company", create).data());
        result.put("company_action", "created_new");
      } else {
        throw new ValidationException(
            ("Company '%s' not found. Set create_company_if_missing=true and provide"
                    + " company_data to create it, or create it separately first.")
                .formatted(companyName),
            Map.of("workflow", result.operation()));
      }

      Map<String, Object> contract = copy(contractData);
      contract.put("company_name", companyName);
      result.put("contract", create("contract", contract).data());
      result.nextStep(
          "Contract created. Upload a document with %s or review it with %s."
              .formatted(tool("attach_file_to_contract"), tool("get_contract_summary")));
      return result;
    } catch (ValidationException e) {
      throw e;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  /** Create a company unless it exists, then optionally a contact linked to it. */
  public WorkflowResult onboardCompanyWithContact(
      Map<String, Object> companyData, Map<String, Object> contactData, boolean skipIfExists) {
    Map<String, Object> company = copy(companyData);
    String companyName = text(company.get("company_name"));
    if (companyName.isBlank()) {
      throw new ValidationException("company_data.company_name is required.");
    }
    WorkflowResult result = new WorkflowResult("onboard_company_with_contact");
    try {
      List<Map<String, Object>> existing =
          search(
              "company",
              QueryClassifier.exactMatch("company_name", companyName),
              COMPANY_FIELDS,
              null);
      if (!existing.isEmpty()) {
        Map<String, Object> found = existing.get(0);
        if (!skipIfExists) {
          throw new WorkflowException(
              result.operation(),
              RecordBridgeErrorCode.INVALID_ARGUMENT,
              ("Company '%s' already exists (ID: %s). Set skip_if_exists=true to use the"
                      + " existing company, or use %s to modify it.")
                  .formatted(companyName, found.get("id"), tool("update_company")),
              Map.of("existing_company", found));
        }
        result.put("company", found);
        result.put("company_action", "already_exists");
        result.warn(
            "Company '%s' already exists (ID: %s). Skipped creation."
                .formatted(companyName, found.get("id")));
      } else {
        result.put("company", create("company", company).data());
        result.put("company_action", "created");
      }

      if (contactData != null && !contactData.isEmpty()) {
        Map<String, Object> contact = copy(contactData);
        contact.put("company_name", companyName);
        result.put("contact", create("contact", contact).data());
        result.put("contact_action", "created");
      } else {
        result.nextStep(
            "No contact was created. Use %s to add a contact linked to this company."
                .formatted(tool("create_contact")));
      }
      result.nextStep(
          "Company onboarded. Create a contract with %s or %s."
              .formatted(tool("create_contract"), tool("create_contract_with_company")));
      return result;
    } catch (WorkflowException e) {
      throw e;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  /** Contract details plus company, attachments and a list of health issues. */
  public WorkflowResult getContractSummary(long contractId) {
    WorkflowResult result = new WorkflowResult("get_contract_summary");
    try {
      Map<String, Object> contract =
          dispatcher
              .execute(
                  "contract",
                  OperationKind.GET,
                  Map.of(Arguments.RECORD_ID, contractId, Arguments.FIELDS, SUMMARY_FIELDS))
              .record()
              .fields();
      result.put("contract", contract);

      String companyName = stripLinkPrefix(text(contract.get("company_name")));
      if (!companyName.isEmpty()) {
        try {
          List<Map<String, Object>> companies =
              search(
                  "company",
                  QueryClassifier.exactMatch("company_name", companyName),
                  withField(COMPANY_FIELDS, "industry", "main_city", "country"),
                  null);
          if (!companies.isEmpty()) {
            result.put("company", companies.get(0));
          }
        } catch (RecordBridgeException e) {
          result.warn("Could not fetch company details: " + e.getMessage());
        }
      }

      try {
        result.put(
            "attachments",
            dispatcher
                .execute(
                    "contract",
                    OperationKind.GET_ATTACHMENT_INFO,
                    Map.of(Arguments.RECORD_ID, contractId, Arguments.FIELD, "attached_file"))
                .data());
      } catch (RecordBridgeException e) {
        log.debug("No attachment info for contract {}: {}", contractId, e.getMessage());
        result.put("attachments", Map.of("count", 0, "note", "No attachments or field not available"));
      }

      List<String> issues = new ArrayList<>();
      LocalDate endDate = parseDate(contract.get("contract_end_date"));
      if (endDate != null) {
        long days = ChronoUnit.DAYS.between(LocalDate.now(clock), endDate);
        result.put("days_remaining", days);
        if (days < 0) {
          issues.add("Contract EXPIRED %d days ago".formatted(-days));
        } else if (days <= 30) {
          issues.add("Contract expires in %d days - URGENT".formatted(days));
        } else if (days <= 90) {
          issues.add("Contract expires in %d days - review soon".formatted(days));
        }
      }
      if (isEmptyValue(contract.get("contract_amount"))) issues.add("Missing contract amount");
      if (isEmptyValue(contract.get("internal_contract_owner"))) {
        issues.add("No contract owner assigned");
      }
      if (isEmptyValue(contract.get("date_signed"))) issues.add("Contract not yet signed");
      String status = text(contract.get("wfstate"));
      if (List.of("Draft", "Cancelled", "Expired").contains(status)) {
        issues.add("Contract status is '%s'".formatted(status));
      }
      if (!issues.isEmpty()) {
        result.put("health_issues", issues);
      }
      result.nextStep(
          "Update fields with %s, upload a document with %s, or trigger an action with %s."
              .formatted(
                  tool("update_contract"),
                  tool("attach_file_to_contract"),
                  tool("action_button_contract")));
      return result;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  /**
   * Contracts ending within {@code daysFromNow}, bucketed as EXPIRED, URGENT (up to 30 days),
   * UPCOMING (up to 60) and PLANNING.
   */
  public WorkflowResult findExpiringContracts(
      int daysFromNow, boolean includeExpired, String statusFilter) {
    if (daysFromNow < 0) {
      throw new ValidationException("days_from_now must not be negative");
    }
    WorkflowResult result = new WorkflowResult("find_expiring_contracts");
    LocalDate today = LocalDate.now(clock);
    LocalDate until = today.plusDays(daysFromNow);
    StringBuilder query = new StringBuilder();
    if (includeExpired) {
      query.append("contract_end_date<='").append(until).append("'");
    } else {
      query
          .append("contract_end_date>='")
          .append(today)
          .append("' AND contract_end_date<='")
          .append(until)
          .append("'");
    }
    if (!isBlank(statusFilter)) {
      query.append(" AND ").append(QueryClassifier.exactMatch("wfstate", statusFilter));
    }

    try {
      List<Map<String, Object>> contracts =
          search("contract", query.toString(), EXPIRING_FIELDS, EXPIRING_LIMIT);
      List<Map<String, Object>> expired = new ArrayList<>();
      List<Map<String, Object>> urgent = new ArrayList<>();
      List<Map<String, Object>> upcoming = new ArrayList<>();
      List<Map<String, Object>> planning = new ArrayList<>();
      for (Map<String, Object> found : contracts) {
        Object rawEnd = found.get("contract_end_date");
        if (isEmptyValue(rawEnd)) {
          continue;
        }
        LocalDate end = parseDate(rawEnd);
        if (end == null) {
          result.warn(
              "Contract %s: could not parse end_date '%s'".formatted(found.get("id"), rawEnd));
          continue;
        }
        Map<String, Object> contract = new LinkedHashMap<>(found);
        long days = ChronoUnit.DAYS.between(today, end);
        contract.put("days_remaining", days);
        if (days < 0) {
          contract.put("urgency", "EXPIRED");
          expired.add(contract);
        } else if (days <= 30) {
          contract.put("urgency", "URGENT");
          urgent.add(contract);
        } else if (days <= 60) {
          contract.put("urgency", "UPCOMING");
          upcoming.add(contract);
        } else {
          contract.put("urgency", "PLANNING");
          planning.add(contract);
        }
      }

      Map<String, Object> summary = new LinkedHashMap<>();
      summary.put("total_found", contracts.size());
      summary.put("urgent_count", urgent.size());
      summary.put("upcoming_count", upcoming.size());
      summary.put("planning_count", planning.size());
      summary.put("expired_count", expired.size());
      summary.put("search_range_days", daysFromNow);
      result.put("summary", summary);
      result.put("urgent", urgent);
      result.put("upcoming", upcoming);
      result.put("planning", planning);
      if (includeExpired) {
        result.put("expired", expired);
      }

      if (!urgent.isEmpty()) {
        result.nextStep(
            "%d URGENT contract(s) expiring within 30 days. Review them with %s."
                .formatted(urgent.size(), tool("get_contract_summary")));
      }
      if (!upcoming.isEmpty()) {
        result.nextStep(
            "%d contract(s) expiring in 31-60 days. Schedule renewal discussions."
                .formatted(upcoming.size()));
      }
      if (contracts.isEmpty()) {
        result.nextStep(
            "No contracts expiring within %d days. Try increasing days_from_now."
                .formatted(daysFromNow));
      }
      return result;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  /**
   * Contracts carry no file field of their own: create an attachment record linked to the
   * contract by title, upload the file into it, then read back its file info.
   */
  public WorkflowResult attachFileToContract(
      long contractId, String fileName, byte[] content, String attachmentTitle) {
    if (isBlank(fileName)) {
      throw new ValidationException("Missing required argument 'file_name'");
    }
    if (content == null || content.length == 0) {
      throw new ValidationException("File is empty (0 bytes).");
    }
    WorkflowResult result = new WorkflowResult("attach_file_to_contract");
    try {
      Map<String, Object> contract =
          dispatcher
              .execute(
                  "contract",
                  OperationKind.GET,
                  Map.of(
                      Arguments.RECORD_ID,
                      contractId,
                      Arguments.FIELDS,
                      List.of("id", "contract_title1")))
              .record()
              .fields();
      result.put("contract", contract);
      String title = text(contract.get("contract_title1"));
      if (title.isBlank()) {
        throw new WorkflowException(
            result.operation(),
            RecordBridgeErrorCode.INVALID_ARGUMENT,
            "Contract %d has no title (contract_title1). Cannot link attachment."
                .formatted(contractId),
            result.data());
      }

      Map<String, Object> attachment = new LinkedHashMap<>();
      attachment.put("title", isBlank(attachmentTitle) ? fileName : attachmentTitle);
      attachment.put("status", "Active");
      attachment.put("expiration_date", "2099-12-31");
      attachment.put("contract_title", title);
      OperationResult created = create("attachment", attachment);
      result.put("attachment_record", created.data());
      Long attachmentId = created.recordId();
      if (attachmentId == null) {
        throw new WorkflowException(
            result.operation(),
            RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE,
            "Created attachment record but could not determine its ID.",
            result.data());
      }
      result.put("attachment_id", attachmentId);
      log.info(
          "Uploading {} bytes as '{}' to attachment {} of contract {}",
          content.length,
          fileName,
          attachmentId,
          contractId);

      Map<String, Object> upload = new LinkedHashMap<>();
      upload.put(Arguments.RECORD_ID, attachmentId);
      upload.put(Arguments.FIELD, "attached_file");
      upload.put(Arguments.FILE_NAME, fileName);
      upload.put(Arguments.FILE_CONTENT, content);
      result.put(
          "upload_result",
          dispatcher.execute("attachment", OperationKind.ATTACH_FILE, upload).data());
      result.put(
          "file_info",
          dispatcher
              .execute(
                  "attachment",
                  OperationKind.GET_ATTACHMENT_INFO,
                  Map.of(Arguments.RECORD_ID, attachmentId, Arguments.FIELD, "attached_file"))
              .data());
      result.nextStep(
          "File '%s' attached to contract %d via attachment record %d. Download it with %s."
              .formatted(fileName, contractId, attachmentId, tool("retrieve_attachment_attachment")));
      return result;
    } catch (WorkflowException e) {
      throw e;
    } catch (RecordBridgeException e) {
      throw new WorkflowException(result.operation(), e, result.data());
    }
  }

  private List<Map<String, Object>> activeContractTypes(List<String> fields) {
    return search("contract_type", "status=Active", fields, null);
  }

  @SuppressWarnings("unchecked")
  private List<Map<String, Object>> search(
      String entity, String query, List<String> fields, Integer limit) {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put(Arguments.QUERY, query);
    args.put(Arguments.FIELDS, fields);
    if (limit != null) {
      args.put(Arguments.LIMIT, limit);
    }
    return (List<Map<String, Object>>) dispatcher.execute(entity, OperationKind.SEARCH, args).data();
  }

  private OperationResult create(String entity, Map<String, Object> data) {
    return dispatcher.execute(entity, OperationKind.CREATE, Map.of(Arguments.DATA, data));
  }

  private String tool(String action) {
    return toolPrefix + "_" + action;
  }

  private static List<String> withField(List<String> base, String... extra) {
    List<String> out = new ArrayList<>(base);
    out.addAll(List.of(extra));
    return out;
  }

  private static Map<String, Object> copy(Map<String, Object> data) {
    return data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
  }

  private static LocalDate parseDate(Object value) {
    String s = text(value);
    if (s.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(s.substring(0, 10));
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String stripLinkPrefix(String value) {
    return value.startsWith(":") ? value.substring(1).trim() : value;
  }

  private static boolean isEmptyValue(Object value) {
    return value == null || text(value).isBlank();
  }

  private static String text(Object value) {
    if (value == null) return "";
    if (value instanceof List<?> list) {
      return list.isEmpty() ? "" : String.valueOf(list.get(0));
    }
    return String.valueOf(value).trim();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
