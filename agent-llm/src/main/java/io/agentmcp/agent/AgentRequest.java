package io.agentmcp.agent;

import io.agentmcp.llm.ThinkingLevel;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start one agent.
 *
 * @param provider provider name
 * @param model model id
 * @param thinkingLevel requested reasoning depth
 * @param cwd working directory for tools
 * @param tools enabled tool names
 */
public record AgentRequest(
    String provider, String model, ThinkingLevel thinkingLevel, Path cwd, List<String> tools) {

  public AgentRequest {
    tools = List.copyOf(tools);
  }
}
