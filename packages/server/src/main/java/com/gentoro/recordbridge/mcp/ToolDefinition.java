package com.gentoro.recordbridge.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.Map;

/** One callable tool: its advertised shape and the code that serves it. */
public record ToolDefinition(
    String name, String description, McpSchema.JsonSchema inputSchema, Handler handler) {

  @FunctionalInterface
  public interface Handler {
    /** Returns the JSON-serializable response object. */
    Object call(Map<String, Object> arguments);
  }

  public McpSchema.Tool toTool() {
    return McpSchema.Tool.builder().name(name).description(description).inputSchema(inputSchema).build();
  }
}
