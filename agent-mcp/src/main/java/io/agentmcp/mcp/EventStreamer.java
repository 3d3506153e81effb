package io.agentmcp.mcp;

import io.agentmcp.session.AgentEvent;
import io.agentmcp.session.Subscription;
import io.agentmcp.session.WorkHandle;
import io.modelcontextprotocol.spec.McpSchema.LoggingLevel;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards a session's agent events to an {@link EventSink}, tagged with the session's thread id.
 * Subscribe before the first prompt so no events are missed.
 */
public final class EventStreamer {

  private static final Logger LOG = LoggerFactory.getLogger(EventStreamer.class);

  private EventStreamer() {}

  /**
   * Starts forwarding events from {@code handle} to {@code sink}.
   *
   * @return subscription that stops the forwarding
   */
  public static Subscription subscribe(EventSink sink, WorkHandle handle, String threadId) {
    return handle.subscribe(event -> forward(sink, threadId, event));
  }

  static void forward(EventSink sink, String threadId, AgentEvent event) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("type", event.type());
    data.put("threadId", threadId);

    LoggingLevel level;
    if (event instanceof AgentEvent.AgentStarted || event instanceof AgentEvent.AgentEnded) {
      level = LoggingLevel.INFO;
    } else if (event instanceof AgentEvent.ToolStarted started) {
      level = LoggingLevel.DEBUG;
      data.put("tool", started.toolName());
    } else if (event instanceof AgentEvent.ToolEnded ended) {
      level = LoggingLevel.DEBUG;
      data.put("tool", ended.toolName());
      data.put("isError", ended.isError());
    } else if (event instanceof AgentEvent.CompactionStarted compaction) {
      level = LoggingLevel.INFO;
      data.put("reason", compaction.reason());
    } else if (event instanceof AgentEvent.RetryStarted retry) {
      level = LoggingLevel.WARNING;
      data.put("attempt", retry.attempt());
      data.put("maxAttempts", retry.maxAttempts());
      data.put("error", retry.errorMessage());
    } else {
      return;
    }

    try {
      sink.send(level, data);
    } catch (RuntimeException e) {
      LOG.warn("Event sink failed for {} on thread {}: {}", event.type(), threadId, e.getMessage());
    }
  }
}
