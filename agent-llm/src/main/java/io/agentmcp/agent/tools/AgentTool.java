package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;

/** A capability the agent can invoke while working on a prompt. */
public interface AgentTool {

  /** Name the model uses to call the tool. */
  String name();

  /** One-paragraph description including the accepted arguments. */
  String description();

  /**
   * Runs the tool.
   *
   * @param args arguments object from the tool call
   * @return text result shown to the model
   * @throws ToolException if the call is invalid or fails
   * @throws InterruptedException if interrupted while running
   */
  String execute(JsonNode args) throws ToolException, InterruptedException;

  /** Reads a required string argument. */
  static String requiredText(JsonNode args, String field) throws ToolException {
    JsonNode node = args == null ? null : args.get(field);
    if (node == null || node.isNull() || !node.isTextual()) {
      throw new ToolException("Missing required string argument '" + field + "'");
    }
    return node.asText();
  }

  /** Reads an optional string argument. */
  static String optionalText(JsonNode args, String field, String defaultValue) {
    JsonNode node = args == null ? null : args.get(field);
    return node != null && node.isTextual() ? node.asText() : defaultValue;
  }

  /** Reads an optional integer argument. */
  static int optionalInt(JsonNode args, String field, int defaultValue) {
    JsonNode node = args == null ? null : args.get(field);
    return node != null && node.canConvertToInt() ? node.asInt() : defaultValue;
  }
}
