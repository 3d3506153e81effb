package io.agentmcp.llm;

import io.agentmcp.llm.LLMProvider.Message;
import io.agentmcp.llm.LLMProvider.Role;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Conversation history of one agent session: user prompts, assistant replies and tool results, in
 * order. Thread-safe for concurrent access.
 */
public class ConversationHistory {

  private final Deque<Message> history = new ArrayDeque<>();
  private final int compactionThreshold;
  private final int keepAfterCompaction;

  /**
   * @param compactionThreshold message count above which {@link #needsCompaction()} is true
   * @param keepAfterCompaction number of most recent messages kept by {@link #compact()}
   */
  public ConversationHistory(int compactionThreshold, int keepAfterCompaction) {
    if (keepAfterCompaction < 1 || keepAfterCompaction > compactionThreshold) {
      throw new IllegalArgumentException(
          "keepAfterCompaction must be between 1 and " + compactionThreshold);
    }
    this.compactionThreshold = compactionThreshold;
    this.keepAfterCompaction = keepAfterCompaction;
  }

  /** Creates a history compacting above 80 messages down to the latest 40. */
  public ConversationHistory() {
    this(80, 40);
  }

  public synchronized void add(Role role, String content) {
    history.addLast(new Message(role, content));
  }

  /** Returns the conversation as LLM messages, oldest first. */
  public synchronized List<Message> toMessages() {
    return new ArrayList<>(history);
  }

  public synchronized int size() {
    return history.size();
  }

  public synchronized boolean needsCompaction() {
    return history.size() > compactionThreshold;
  }

  /**
   * Drops the oldest messages, keeping the most recent ones. The kept history always starts with a
   * user message.
   *
   * @return number of messages dropped
   */
  public synchronized int compact() {
    int before = history.size();
    while (history.size() > keepAfterCompaction) {
      history.removeFirst();
    }
    while (!history.isEmpty() && history.peekFirst().role() != Role.USER) {
      history.removeFirst();
    }
    return before - history.size();
  }

  /** Clears all messages from the history. */
  public synchronized void clear() {
    history.clear();
  }
}
