package com.gentoro.recordbridge.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.recordbridge.RecordBridge;
import com.gentoro.recordbridge.exception.ErrorDetails;
import com.gentoro.recordbridge.exception.ExceptionUtil;
import com.gentoro.recordbridge.exception.RecordBridgeException;
import com.gentoro.recordbridge.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes the {@link ToolCatalog} and {@link PromptCatalog} over the MCP Streamable HTTP
 * transport, mounted on the shared Jetty server.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) server name reported to clients; default:
 *       "recordbridge"
 *   <li><b>http.mcp.server.version</b> (string) server version reported to clients; default:
 *       "1.0.0"
 * </ul>
 *
 * <p>Tool failures never escape as protocol errors: every exception becomes an {@code isError}
 * result whose text is the JSON {@link ErrorDetails}, so the calling agent can tell input errors
 * from backend failures.
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.recordbridge.logging.LoggingService.getLogger(McpServer.class);

  private final RecordBridge recordBridge;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(RecordBridge recordBridge) {
    this.recordBridge = recordBridge;
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void register() {
    String endpoint =
        normalizeEndpoint(recordBridge.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete =
        recordBridge.configuration().getBoolean("http.mcp.disallow-delete", false);
    String serverName =
        recordBridge.configuration().getString("http.mcp.server.name", "recordbridge");
    String serverVersion =
        recordBridge.configuration().getString("http.mcp.server.version", "1.0.0");

    // protocol frames must stay single-line, so not the indenting application mapper
    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
    ToolCatalog catalog = recordBridge.toolCatalog();
    for (ToolDefinition tool : catalog.tools()) {
      specifications.add(
          McpServerFeatures.SyncToolSpecification.builder()
              .tool(tool.toTool())
              .callHandler((exchange, request) -> invoke(catalog, tool.name(), request.arguments()))
              .build());
    }

    List<McpServerFeatures.SyncPromptSpecification> prompts = new ArrayList<>();
    PromptCatalog promptCatalog = recordBridge.promptCatalog();
    for (PromptDefinition prompt : promptCatalog.prompts()) {
      prompts.add(
          new McpServerFeatures.SyncPromptSpecification(
              prompt.toPrompt(),
              (exchange, request) -> promptCatalog.render(prompt.name(), request.arguments())));
    }

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(
                McpSchema.ServerCapabilities.builder().tools(true).prompts(false).logging().build())
            .tools(specifications)
            .prompts(prompts)
            .build();

    recordBridge
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{} with {} tools and {} prompts",
        recordBridge.httpServer().getPort(),
        endpoint,
        specifications.size(),
        prompts.size());
  }

  static McpSchema.CallToolResult invoke(
      ToolCatalog catalog, String toolName, Map<String, Object> arguments) {
    try {
      Object response = catalog.call(toolName, arguments);
      return McpSchema.CallToolResult.builder()
          .addTextContent(JacksonUtility.toJson(response))
          .isError(false)
          .build();
    } catch (RecordBridgeException e) {
      log.warn("Tool {} failed: {}", toolName, e.toString());
      return error(e);
    } catch (Exception e) {
      log.error("Tool {} failed unexpectedly", toolName, e);
      return error(e);
    }
  }

  private static McpSchema.CallToolResult error(Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    return McpSchema.CallToolResult.builder()
        .addTextContent(JacksonUtility.toJson(Map.of("success", false, "error", details)))
        .isError(true)
        .build();
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
    servletTransport = null;
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
