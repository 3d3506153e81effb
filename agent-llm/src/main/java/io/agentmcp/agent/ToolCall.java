package io.agentmcp.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmcp.agent.tools.ToolException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A tool invocation requested by the model: a fenced {@code tool} block holding {@code {"tool":
 * name, "args": {...}}}.
 *
 * @param tool tool name
 * @param args argument object, never null
 */
public record ToolCall(String tool, JsonNode args) {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern BLOCK = Pattern.compile("```tool\\s*\\n(.*?)```", Pattern.DOTALL);

  /**
   * Extracts the first tool call from a model reply.
   *
   * @param reply model reply text
   * @return the call, or empty if the reply holds no tool block
   * @throws ToolException if a tool block is present but malformed
   */
  public static Optional<ToolCall> parse(String reply) throws ToolException {
    if (reply == null) {
      return Optional.empty();
    }
    Matcher m = BLOCK.matcher(reply);
    if (!m.find()) {
      return Optional.empty();
    }

    JsonNode node;
    try {
      node = MAPPER.readTree(m.group(1));
    } catch (JsonProcessingException e) {
      throw new ToolException("Tool call is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new ToolException("Tool call must be a JSON object");
    }
    JsonNode name = node.get("tool");
    if (name == null || !name.isTextual() || name.asText().isBlank()) {
      throw new ToolException("Tool call is missing the 'tool' name");
    }
    JsonNode args = node.get("args");
    return Optional.of(
        new ToolCall(
            name.asText(), args != null && args.isObject() ? args : MAPPER.createObjectNode()));
  }
}
