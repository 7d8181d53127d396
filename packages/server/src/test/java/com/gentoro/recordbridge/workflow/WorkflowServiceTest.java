package com.gentoro.recordbridge.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.recordbridge.exception.RecordBridgeErrorCode;
import com.gentoro.recordbridge.exception.ValidationException;
import com.gentoro.recordbridge.exception.WorkflowException;
import com.gentoro.recordbridge.support.FakeBackend;
import com.gentoro.recordbridge.support.FakeBackend.Reply;
import com.gentoro.recordbridge.support.TestStack;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WorkflowServiceTest {

  private static final String EMPTY = "{\"success\":true,\"result\":[]}";

  private final TestStack stack = new TestStack();
  private final FakeBackend backend = stack.backend;
  private final WorkflowService workflows =
      new WorkflowService(stack.dispatcher, stack.clock, "agiloft");

  @AfterEach
  void tearDown() {
    stack.close();
  }

  private static String contract(int id, String endDate) {
    return "{\"id\":%d,\"contract_title1\":\"C%d\",\"contract_end_date\":\"%s\"}"
        .formatted(id, id, endDate);
  }

  private FakeBackend.Recorded lastTo(String path) {
    List<FakeBackend.Recorded> matching =
        backend.requests().stream().filter(r -> r.path().equals(path)).toList();
    assertFalse(matching.isEmpty(), "no request to " + path);
    return matching.get(matching.size() - 1);
  }

  @Test
  @SuppressWarnings("unchecked")
  void expiringContractsAreBucketedByDaysRemaining() {
    // today is 2026-03-01
    backend.route(
        request ->
            Reply.ok(
                "{\"success\":true,\"result\":["
                    + String.join(
                        ",",
                        contract(1, "2026-03-15"),
                        contract(2, "2026-04-20"),
                        contract(3, "2026-05-20"),
                        contract(4, ""),
                        contract(5, "not-a-date"))
                    + "]}"));

    WorkflowResult result = workflows.findExpiringContracts(90, false, "Active");

    String query = lastTo("/api/contract/search").json().path("query").asText();
    assertEquals(
        "contract_end_date>='2026-03-01' AND contract_end_date<='2026-05-30' AND wfstate='Active'",
        query);

    Map<String, Object> summary = (Map<String, Object>) result.data().get("summary");
    assertEquals(5, summary.get("total_found"));
    assertEquals(1, summary.get("urgent_count"));
    assertEquals(1, summary.get("upcoming_count"));
    assertEquals(1, summary.get("planning_count"));

    List<Map<String, Object>> urgent = (List<Map<String, Object>>) result.data().get("urgent");
    assertEquals(14L, urgent.get(0).get("days_remaining"));
    assertEquals("URGENT", urgent.get(0).get("urgency"));
    assertFalse(result.data().containsKey("expired"));
    assertEquals(1, result.warnings().size());
    assertTrue(result.warnings().get(0).contains("not-a-date"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void expiredContractsAreOnlyReturnedWhenAskedFor() {
    backend.route(request -> Reply.ok("{\"success\":true,\"result\":[" + contract(9, "2026-02-20") + "]}"));

    WorkflowResult result = workflows.findExpiringContracts(30, true, null);

    assertEquals(
        "contract_end_date<='2026-03-31'",
        lastTo("/api/contract/search").json().path("query").asText());
    List<Map<String, Object>> expired = (List<Map<String, Object>>) result.data().get("expired");
    assertEquals(-9L, expired.get(0).get("days_remaining"));
  }

  @Test
  void missingCompanyWithoutCreateFlagIsAValidationError() {
    backend.route(request -> Reply.ok(EMPTY));

    assertThrows(
        ValidationException.class,
        () ->
            workflows.createContractWithCompany(
                "Acme", Map.of("record_type", "Contract"), false, null));
    assertTrue(backend.requests().stream().noneMatch(r -> r.path().equals("/api/contract")));
  }

  @Test
  void createsCompanyThenLinkedContract() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/company/search" -> Reply.ok(EMPTY);
              case "/api/company" -> Reply.ok("{\"success\":true,\"result\":55}");
              case "/api/contract" -> Reply.ok("{\"success\":true,\"result\":77}");
              default -> Reply.status(404, "{}");
            });

    WorkflowResult result =
        workflows.createContractWithCompany(
            "Acme",
            Map.of("record_type", "Contract", "contract_title1", "MSA"),
            true,
            Map.of("type_of_company", "Customer", "status", "Active"));

    assertEquals("created_new", result.data().get("company_action"));
    assertEquals(Map.of("id", 77L), result.data().get("contract"));
    assertEquals("Acme", lastTo("/api/company").json().path("company_name").asText());
    assertEquals(":Acme", lastTo("/api/contract").json().path("company_name").asText());
    assertEquals(
        "company_name='Acme'", lastTo("/api/company/search").json().path("query").asText());
  }

  @Test
  void failingContractStepKeepsTheCompanyAsPartialData() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/company/search" ->
                  Reply.ok("{\"success\":true,\"result\":[{\"id\":3,\"company_name\":\"Acme\"}]}");
              default -> Reply.ok("{\"success\":false,\"message\":\"record_type is required\"}");
            });

    WorkflowException ex =
        assertThrows(
            WorkflowException.class,
            () -> workflows.createContractWithCompany("Acme", Map.of(), false, null));

    assertEquals(RecordBridgeErrorCode.BACKEND_OPERATION_FAILURE, ex.getCode());
    assertEquals("create_contract_with_company", ex.getContext().get("workflow"));
    assertTrue(ex.getContext().get("partial_data") instanceof Map<?, ?>);
  }

  @Test
  void onboardingAnExistingCompanyFailsUnlessSkipped() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/company/search" ->
                  Reply.ok("{\"success\":true,\"result\":[{\"id\":3,\"company_name\":\"Acme\"}]}");
              case "/api/contacts" -> Reply.ok("{\"success\":true,\"result\":88}");
              default -> Reply.status(404, "{}");
            });

    WorkflowException ex =
        assertThrows(
            WorkflowException.class,
            () -> workflows.onboardCompanyWithContact(Map.of("company_name", "Acme"), null, false));
    assertEquals(RecordBridgeErrorCode.INVALID_ARGUMENT, ex.getCode());

    WorkflowResult result =
        workflows.onboardCompanyWithContact(
            Map.of("company_name", "Acme"), Map.of("full_name", "Jane Roe"), true);

    assertEquals("already_exists", result.data().get("company_action"));
    assertEquals("created", result.data().get("contact_action"));
    assertEquals(":Acme", lastTo("/api/contacts").json().path("company_name").asText());
    assertEquals(1, result.warnings().size());
  }

  @Test
  void onboardingRequiresACompanyName() {
    assertThrows(
        ValidationException.class,
        () -> workflows.onboardCompanyWithContact(Map.of("industry", "Retail"), null, false));
    assertTrue(backend.requests().isEmpty());
  }

  @Test
  void attachesFileThroughAnAttachmentRecord() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/contract/5" ->
                  Reply.ok("{\"success\":true,\"result\":{\"id\":5,\"contract_title1\":\"MSA\"}}");
              case "/api/attachment" -> Reply.ok("{\"success\":true,\"result\":900}");
              case "/api/attachment/attach/900" -> Reply.ok("{\"success\":true,\"result\":\"ok\"}");
              case "/api/attachment/attachInfo/900" ->
                  Reply.ok("{\"success\":true,\"result\":[{\"name\":\"a.pdf\",\"size\":3}]}");
              default -> Reply.status(404, "{}");
            });

    WorkflowResult result =
        workflows.attachFileToContract(
            5, "a.pdf", "pdf".getBytes(StandardCharsets.UTF_8), null);

    assertEquals(900L, result.data().get("attachment_id"));
    FakeBackend.Recorded attachment = lastTo("/api/attachment");
    assertEquals(":MSA", attachment.json().path("contract_title").asText());
    assertEquals("a.pdf", attachment.json().path("title").asText());
    assertEquals("Active", attachment.json().path("status").asText());
    FakeBackend.Recorded upload = lastTo("/api/attachment/attach/900");
    assertEquals("attached_file", upload.query("field"));
    assertTrue(upload.body().contains("pdf"));
    assertEquals(List.of(Map.of("name", "a.pdf", "size", 3)), result.data().get("file_info"));
  }

  @Test
  void emptyFileIsRejectedBeforeAnyCall() {
    assertThrows(
        ValidationException.class,
        () -> workflows.attachFileToContract(5, "a.pdf", new byte[0], null));
    assertTrue(backend.requests().isEmpty());
  }

  @Test
  @SuppressWarnings("unchecked")
  void contractSummaryReportsHealthIssues() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/contract/5" ->
                  Reply.ok(
                      "{\"success\":true,\"result\":{\"id\":5,\"contract_title1\":\"MSA\",\"company_name\":\"Acme\",\"contract_end_date\":\"2026-03-21\",\"wfstate\":\"Draft\",\"contract_amount\":1000}}");
              case "/api/company/search" ->
                  Reply.ok("{\"success\":true,\"result\":[{\"id\":3,\"company_name\":\"Acme\"}]}");
              default -> Reply.status(500, "{}");
            });

    WorkflowResult result = workflows.getContractSummary(5);

    assertEquals(20L, result.data().get("days_remaining"));
    List<String> issues = (List<String>) result.data().get("health_issues");
    assertTrue(issues.contains("Contract expires in 20 days - URGENT"));
    assertTrue(issues.contains("No contract owner assigned"));
    assertTrue(issues.contains("Contract not yet signed"));
    assertTrue(issues.contains("Contract status is 'Draft'"));
    assertFalse(issues.contains("Missing contract amount"));
    assertEquals(Map.of("count", 0, "note", "No attachments or field not available"), result.data().get("attachments"));
    assertNotNull(result.data().get("company"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void preflightWithoutTypeListsActiveContractTypes() {
    backend.route(
        request ->
            Reply.ok(
                "{\"success\":true,\"result\":[{\"id\":1,\"contract_type\":\"NDA\"},{\"id\":2,\"contract_type\":\"MSA\"}]}"));

    WorkflowResult result = workflows.preflightCreateContract(null, null);

    assertEquals(false, result.data().get("ready_to_create"));
    assertEquals(2, ((List<Object>) result.data().get("available_contract_types")).size());
    assertEquals("status=Active", lastTo("/api/contract_type/search").json().path("query").asText());
    assertFalse(result.nextSteps().isEmpty());
  }

  @Test
  void preflightIsReadyWhenTypeAndCompanyMatch() {
    backend.route(
        request ->
            switch (request.path()) {
              case "/api/contract_type/search" ->
                  Reply.ok(
                      "{\"success\":true,\"result\":[{\"id\":1,\"contract_type\":\"NDA\",\"party_type\":\"Customer\"}]}");
              case "/api/company/search" ->
                  Reply.ok(
                      "{\"success\":true,\"result\":[{\"id\":3,\"company_name\":\"Acme\",\"type_of_company\":\"Customer\",\"status\":\"Active\"}]}");
              default -> Reply.status(404, "{}");
            });

    WorkflowResult result = workflows.preflightCreateContract("NDA", "Acme");

    assertEquals(true, result.data().get("ready_to_create"));
    assertTrue(result.warnings().isEmpty());
    assertEquals(
        "contract_type='NDA' AND status=Active",
        lastTo("/api/contract_type/search").json().path("query").asText());
  }
}
