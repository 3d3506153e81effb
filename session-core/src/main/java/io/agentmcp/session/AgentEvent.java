package io.agentmcp.session;

/**
 * Lifecycle events emitted by a {@link WorkHandle} while it processes a prompt.
 *
 * <p>Each event is a small immutable record; {@link #type()} is the stable wire name used when
 * events are forwarded to clients.
 */
public interface AgentEvent {

  /** Stable event name. */
  String type();

  /** A unit of work began. */
  record AgentStarted() implements AgentEvent {
    @Override
    public String type() {
      return "agent_start";
    }
  }

  /** A unit of work ended, successfully or not. */
  record AgentEnded() implements AgentEvent {
    @Override
    public String type() {
      return "agent_end";
    }
  }

  /**
   * A tool step began.
   *
   * @param toolName name of the tool being executed
   */
  record ToolStarted(String toolName) implements AgentEvent {
    @Override
    public String type() {
      return "tool_start";
    }
  }

  /**
   * A tool step ended.
   *
   * @param toolName name of the tool that ran
   * @param isError whether the tool reported a failure
   */
  record ToolEnded(String toolName, boolean isError) implements AgentEvent {
    @Override
    public String type() {
      return "tool_end";
    }
  }

  /**
   * Conversation history is being compacted.
   *
   * @param reason why compaction was triggered (for example {@code threshold})
   */
  record CompactionStarted(String reason) implements AgentEvent {
    @Override
    public String type() {
      return "auto_compaction";
    }
  }

  /**
   * A failed provider call is being retried.
   *
   * @param attempt retry attempt number, starting at 1
   * @param maxAttempts retry limit
   * @param errorMessage message of the failure that caused the retry
   */
  record RetryStarted(int attempt, int maxAttempts, String errorMessage) implements AgentEvent {
    @Override
    public String type() {
      return "auto_retry";
    }
  }
}
