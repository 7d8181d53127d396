package com.gentoro.recordbridge.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;

/** A guided conversation template: its advertised arguments and the text it renders to. */
public record PromptDefinition(
    String name, String description, List<McpSchema.PromptArgument> arguments, Renderer renderer) {

  @FunctionalInterface
  public interface Renderer {
    /** Arguments are the caller's raw values; absent keys mean "not given". */
    McpSchema.GetPromptResult render(Map<String, String> arguments);
  }

  public McpSchema.Prompt toPrompt() {
    return new McpSchema.Prompt(name, description, arguments);
  }
}
