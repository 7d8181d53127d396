package com.gentoro.recordbridge.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.recordbridge.dispatch.OperationDispatcher;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.registry.EntityRegistry;
import com.gentoro.recordbridge.workflow.WorkflowService;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PromptCatalogTest {

  private static final EntityRegistry REGISTRY = EntityRegistry.load("classpath:entities.yaml");
  private static final Pattern TOOL_REFERENCE = Pattern.compile("\\bagiloft_[a-z_]+");

  @Mock private OperationDispatcher dispatcher;
  @Mock private WorkflowService workflows;

  private final PromptCatalog prompts = new PromptCatalog("agiloft");

  private static String text(McpSchema.GetPromptResult result) {
    assertEquals(1, result.messages().size());
    McpSchema.PromptMessage message = result.messages().get(0);
    assertEquals(McpSchema.Role.USER, message.role());
    return ((McpSchema.TextContent) message.content()).text();
  }

  @Test
  void listsTheFivePromptsInOrder() {
    assertEquals(
        List.of(
            "create-contract",
            "contract-review",
            "company-onboarding",
            "contract-search-and-report",
            "contract-renewal-check"),
        prompts.prompts().stream().map(PromptDefinition::name).toList());

    McpSchema.Prompt renewal = prompts.find("contract-renewal-check").toPrompt();
    assertEquals(1, renewal.arguments().size());
    assertTrue(renewal.arguments().get(0).required());
    assertFalse(prompts.find("create-contract").toPrompt().arguments().get(0).required());
  }

  @Test
  void everyReferencedToolExists() {
    ToolCatalog tools = new ToolCatalog(REGISTRY, dispatcher, workflows, "agiloft", 50, 500);
    Set<String> names = tools.tools().stream().map(ToolDefinition::name).collect(Collectors.toSet());

    for (PromptDefinition prompt : prompts.prompts()) {
      for (Map<String, String> args : List.of(Map.<String, String>of(), everyArgument(prompt))) {
        Matcher m = TOOL_REFERENCE.matcher(text(prompts.render(prompt.name(), args)));
        while (m.find()) {
          assertTrue(names.contains(m.group()), prompt.name() + " names missing tool " + m.group());
        }
      }
    }
  }

  private static Map<String, String> everyArgument(PromptDefinition prompt) {
    Map<String, String> args = new HashMap<>();
    prompt.arguments().forEach(a -> args.put(a.name(), "7"));
    return args;
  }

  @Test
  void createContractAdaptsToTheGivenArguments() {
    String open = text(prompts.render("create-contract", Map.of()));
    assertTrue(open.contains("agiloft_search_contract_types"));
    assertTrue(open.contains("ask me for the company name"));

    String given =
        text(
            prompts.render(
                "create-contract",
                Map.of("contract_type", "Services Agreement", "company_name", "Acme Corp")));
    assertTrue(given.contains("contract type: Services Agreement"));
    assertTrue(given.contains("The company is: Acme Corp."));
    assertFalse(given.contains("agiloft_search_contract_types"));
    assertTrue(given.contains("agiloft_preflight_create_contract"));
  }

  @Test
  void renewalCheckUsesTheRequestedWindow() {
    McpSchema.GetPromptResult result =
        prompts.render("contract-renewal-check", Map.of("days_ahead", 45));
    assertEquals("Contract renewal check, next 45 days", result.description());
    assertTrue(text(result).contains("days_from_now=45"));

    Map<String, Object> blank = new HashMap<>();
    blank.put("days_ahead", " ");
    assertTrue(text(prompts.render("contract-renewal-check", blank)).contains("days_from_now=90"));

    assertThrows(
        ValidationException.class,
        () -> prompts.render("contract-renewal-check", Map.of("days_ahead", "soon")));
  }

  @Test
  void prefixFollowsTheToolPrefix() {
    String review = text(new PromptCatalog("crm").render("contract-review", Map.of("contract_id", "12")));
    assertTrue(review.contains("crm_get_contract_summary for contract ID 12"));
    assertFalse(review.contains("agiloft_"));
  }

  @Test
  void unknownPromptIsRejected() {
    ValidationException error =
        assertThrows(ValidationException.class, () -> prompts.render("contract-audit", null));
    assertTrue(error.getMessage().contains("create-contract"));
  }
}
