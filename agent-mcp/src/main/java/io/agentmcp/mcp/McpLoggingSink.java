package io.agentmcp.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.LoggingLevel;
import io.modelcontextprotocol.spec.McpSchema.LoggingMessageNotification;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends agent events to connected clients as MCP logging notifications.
 *
 * <p>The MCP server is built after the tools that use this sink, so it is attached later. Events
 * sent before that are dropped.
 */
final class McpLoggingSink implements EventSink {

  private static final Logger LOG = LoggerFactory.getLogger(McpLoggingSink.class);
  static final String LOGGER_NAME = "agent-mcp";

  private final ObjectMapper mapper;
  private final AtomicReference<McpSyncServer> server = new AtomicReference<>();

  McpLoggingSink(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  void attach(McpSyncServer mcpServer) {
    server.set(mcpServer);
  }

  @Override
  @SuppressWarnings("deprecation")
  public void send(LoggingLevel level, Map<String, Object> data) {
    McpSyncServer target = server.get();
    if (target == null) {
      LOG.debug("No MCP server attached, dropping {} event", data.get("type"));
      return;
    }

    String json;
    try {
      json = mapper.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      LOG.warn("Failed to serialize {} event: {}", data.get("type"), e.getMessage(), e);
      return;
    }

    try {
      target.loggingNotification(
          LoggingMessageNotification.builder().level(level).logger(LOGGER_NAME).data(json).build());
    } catch (RuntimeException e) {
      // client disconnects surface here
      LOG.debug("Dropped {} notification: {}", data.get("type"), e.getMessage());
    }
  }
}
