package io.agentmcp.mcp;

import io.modelcontextprotocol.spec.McpSchema.LoggingLevel;
import java.util.Map;

/** Destination for agent progress notifications. */
@FunctionalInterface
public interface EventSink {

  /**
   * Sends one notification. Implementations must not throw for delivery problems.
   *
   * @param level notification level
   * @param data structured payload
   */
  void send(LoggingLevel level, Map<String, Object> data);
}
