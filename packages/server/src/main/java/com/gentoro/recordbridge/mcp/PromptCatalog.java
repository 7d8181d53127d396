package com.gentoro.recordbridge.mcp;

import com.gentoro.recordbridge.exception.ValidationException;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guided conversations for the common contract chores. Each prompt renders to a single user
 * message that walks the agent through the tools of the {@link ToolCatalog} sharing the same
 * prefix.
 */
public class PromptCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(PromptCatalog.class);

  static final int DEFAULT_DAYS_AHEAD = 90;

  private final String prefix;
  private final Map<String, PromptDefinition> prompts = new LinkedHashMap<>();

  public PromptCatalog(String prefix) {
    this.prefix = prefix;
    add(
        new PromptDefinition(
            "create-contract",
            "Step-by-step guided contract creation. Validates contract type, company"
                + " compatibility and required fields before creating.",
            List.of(
                optional("contract_type", "Contract type to use; available types are listed if omitted"),
                optional("company_name", "Company the contract is with; asked for if omitted")),
            this::createContract));
    add(
        new PromptDefinition(
            "contract-review",
            "Load a contract, summarize it, check attachments, flag health issues and offer"
                + " follow-up actions.",
            List.of(optional("contract_id", "Contract ID to review; asked for or searched if omitted")),
            this::contractReview));
    add(
        new PromptDefinition(
            "company-onboarding",
            "Onboard a company: check it does not exist yet, create it and optionally a primary"
                + " contact.",
            List.of(optional("company_name", "Company name to onboard; asked for if omitted")),
            this::companyOnboarding));
    add(
        new PromptDefinition(
            "contract-search-and-report",
            "Search contracts by any criteria and report the results with summary statistics.",
            List.of(optional("search_criteria", "What to look for; asked for if omitted")),
            this::contractSearchReport));
    add(
        new PromptDefinition(
            "contract-renewal-check",
            "Find contracts expiring within N days and suggest renewal actions by urgency.",
            List.of(
                new McpSchema.PromptArgument(
                    "days_ahead", "Number of days ahead to check for expiring contracts", true)),
            this::contractRenewalCheck));
    log.info("Prompt catalog holds {} prompts", prompts.size());
  }

  public List<PromptDefinition> prompts() {
    return List.copyOf(prompts.values());
  }

  public PromptDefinition find(String name) {
    PromptDefinition prompt = prompts.get(name);
    if (prompt == null) {
      throw new ValidationException(
          "Unknown prompt '%s'. Valid prompts: %s".formatted(name, String.join(", ", prompts.keySet())),
          Map.of("prompt", String.valueOf(name)));
    }
    return prompt;
  }

  public McpSchema.GetPromptResult render(String name, Map<String, ?> arguments) {
    PromptDefinition prompt = find(name);
    Map<String, String> values = new LinkedHashMap<>();
    if (arguments != null) {
      arguments.forEach(
          (k, v) -> {
            if (v != null && !String.valueOf(v).isBlank()) {
              values.put(k, String.valueOf(v).trim());
            }
          });
    }
    return prompt.renderer().render(values);
  }

  private void add(PromptDefinition prompt) {
    prompts.put(prompt.name(), prompt);
  }

  private String tool(String suffix) {
    return prefix + "_" + suffix;
  }

  private McpSchema.GetPromptResult createContract(Map<String, String> args) {
    List<String> steps = new ArrayList<>();
    steps.add("I want to create a new contract. Please guide me through the process step by step.");

    String contractType = args.get("contract_type");
    if (contractType != null) {
      steps.add("\nI'd like to use contract type: " + contractType);
    } else {
      steps.add(
          "\nFirst, list the available contract types using %s with query \"status=Active\" and let me choose one."
              .formatted(tool("search_contract_types")));
    }

    String company = args.get("company_name");
    if (company != null) {
      steps.add(
          ("\nThe company is: %s. Verify it exists using %s and check that its type_of_company"
                  + " is compatible with the contract type's party_type.")
              .formatted(company, tool("search_companies")));
    } else {
      steps.add(
          ("\nAfter I pick a contract type, ask me for the company name, look it up with %s and"
                  + " check type compatibility with the contract type's party_type.")
              .formatted(tool("search_companies")));
    }

    steps.add(
        """

        Once type and company are confirmed, collect the required fields:
        - record_type (Contract, Child Contract, or Amendment)
        - contract_title1
        - auto_renewal_term_in_months
        - confidential
        - evaluation_frequency
        and any optional fields I want to provide (dates, amount, owner).""");

    steps.add(
        """

        Linked fields (contract_type, company_name, internal_contract_owner) hold references to \
        other records. Pass the plain name, e.g. "Acme Corp"; the ':' reference prefix is added \
        for you.""");

    steps.add(
        "\nWith all fields gathered, validate them with %s, then create the contract with %s."
            .formatted(tool("preflight_create_contract"), tool("create_contract")));

    steps.add(
        ("\nAfterwards, ask whether I want to attach files. Use %s with the file name and its"
                + " base64 content; it creates an attachment record linked to the contract. Do"
                + " not use %s, which targets the contract table directly.")
            .formatted(tool("attach_file_to_contract"), tool("attach_file_contract")));

    return result("Step-by-step contract creation workflow", steps);
  }

  private McpSchema.GetPromptResult contractReview(Map<String, String> args) {
    List<String> steps = new ArrayList<>();
    steps.add("I want to review a contract in detail.");

    String contractId = args.get("contract_id");
    if (contractId != null) {
      steps.add(
          "\nStart with %s for contract ID %s; it returns the details, the company, attachments and health issues."
              .formatted(tool("get_contract_summary"), contractId));
    } else {
      steps.add(
          "\nAsk me for a contract ID or search criteria. For criteria, use %s and let me pick one."
              .formatted(tool("search_contracts")));
    }

    steps.add(
        """

        Present a summary with:
        - Title, type, status (wfstate)
        - Company name
        - Amount and dates (start, end, signed)
        - Owner
        - Term and auto-renewal details""");

    steps.add(
        "\nReport the attached files; %s on the 'attached_file' field gives the details."
            .formatted(tool("get_attachment_info_contract")));

    steps.add(
        """

        Flag potential issues:
        - End date in the past or within 30 days
        - Missing amount, dates or owner
        - Status Draft or Cancelled""");

    steps.add(
        ("\nFinally, offer follow-ups: update fields with %s, attach a file with %s, download"
                + " an attachment with %s, trigger an action button with %s, or open the company"
                + " record.")
            .formatted(
                tool("update_contract"),
                tool("attach_file_to_contract"),
                tool("retrieve_attachment_attachment"),
                tool("action_button_contract")));

    return result("Contract review and health check", steps);
  }

  private McpSchema.GetPromptResult companyOnboarding(Map<String, String> args) {
    List<String> steps = new ArrayList<>();
    steps.add("I want to onboard a new company.");

    String company = args.get("company_name");
    if (company != null) {
      steps.add(
          ("\nFirst check whether \"%s\" already exists using %s. If it does, show me the record"
                  + " and ask whether to update it or continue.")
              .formatted(company, tool("search_companies")));
    } else {
      steps.add(
          "\nAsk me for the company name, then check with %s whether it already exists."
              .formatted(tool("search_companies")));
    }

    steps.add(
        """

        If it is new, collect:
        - company_name (required)
        - type_of_company (required, e.g. Customer, Vendor, Partner)
        - status (required, e.g. Active)
        - optional: industry, country, main_city, account_rep""");

    steps.add(
        ("\nCreate the company with %s, or use %s to create it together with a primary contact"
                + " in one step.")
            .formatted(tool("create_company"), tool("onboard_company_with_contact")));

    steps.add(
        ("\nIf I want a primary contact afterwards, collect first_name, last_name, email and"
                + " title and create it with %s, linked through company_name.")
            .formatted(tool("create_contact")));

    return result("Company onboarding workflow with optional contact creation", steps);
  }

  private McpSchema.GetPromptResult contractSearchReport(Map<String, String> args) {
    List<String> steps = new ArrayList<>();
    steps.add("I want to search for contracts and get a summary report.");

    String criteria = args.get("search_criteria");
    if (criteria != null) {
      steps.add(
          ("\nSearch criteria: %s\nUse %s with a matching structured query: company_name~='value'"
                  + " for a company, wfstate='value' for a status.")
              .formatted(criteria, tool("search_contracts")));
    } else {
      steps.add(
          """

          Ask me what I'm looking for. Contracts can be searched by:
          - Company name
          - Status (wfstate)
          - Contract type
          - End date ranges (contract_end_date)
          - Amount ranges
          - Any combination joined with AND/OR""");
    }

    steps.add(
        """

        Present the results as a report with:
        - The number of matching contracts
        - For each: ID, title, company, type, status, amount, end date
        - Totals: summed amount, count by status, count by type""");

    steps.add(
        """

        Then offer to review a specific contract, narrow or broaden the search, or list the \
        records in full.""");

    return result("Contract search with summary reporting", steps);
  }

  private McpSchema.GetPromptResult contractRenewalCheck(Map<String, String> args) {
    int days = daysAhead(args.get("days_ahead"));
    List<String> steps = new ArrayList<>();
    steps.add("I want to check for contracts expiring within the next %d days.".formatted(days));

    steps.add(
        "\nUse %s with days_from_now=%d to find contracts approaching their end date."
            .formatted(tool("find_expiring_contracts"), days));

    steps.add(
        """

        Present the results by urgency:
        - URGENT: expiring within 30 days
        - UPCOMING: expiring within 31-60 days
        - PLANNING: expiring later""");

    steps.add(
        """

        For each contract show title, company, end date, days remaining, status (wfstate), \
        auto-renewal term and amount.""");

    steps.add(
        """

        Suggest actions per bucket:
        - URGENT: review and decide on renewal now
        - UPCOMING: schedule renewal discussions
        - PLANNING: add to the renewal pipeline""");

    steps.add("\nOffer to review any specific contract in full.");

    return result("Contract renewal check, next %d days".formatted(days), steps);
  }

  private static int daysAhead(String value) {
    if (value == null) {
      return DEFAULT_DAYS_AHEAD;
    }
    try {
      int days = Integer.parseInt(value);
      if (days < 0) {
        throw new ValidationException("Argument 'days_ahead' must not be negative: " + value);
      }
      return days;
    } catch (NumberFormatException e) {
      throw new ValidationException("Argument 'days_ahead' must be a whole number: " + value, e);
    }
  }

  private static McpSchema.PromptArgument optional(String name, String description) {
    return new McpSchema.PromptArgument(name, description, false);
  }

  private static McpSchema.GetPromptResult result(String description, List<String> steps) {
    return new McpSchema.GetPromptResult(
        description,
        List.of(
            new McpSchema.PromptMessage(
                McpSchema.Role.USER, new McpSchema.TextContent(String.join("\n", steps)))));
  }
}
