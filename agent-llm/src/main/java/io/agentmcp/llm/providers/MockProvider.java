package io.agentmcp.llm.providers;

import io.agentmcp.llm.LLMConfig;
import io.agentmcp.llm.LLMException;
import io.agentmcp.llm.LLMProvider;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mock LLM provider for testing. Replays a script of replies in order, then echoes the latest user
 * message. No network calls are made.
 */
public class MockProvider extends LLMProvider {

  private final Deque<String> script;
  private volatile boolean closed;

  /**
   * Creates a mock provider that only echoes.
   *
   * @param config provider configuration
   */
  public MockProvider(LLMConfig config) {
    this(config, List.of());
  }

  /**
   * Creates a mock provider with scripted replies.
   *
   * @param config provider configuration
   * @param replies replies returned by successive calls
   */
  public MockProvider(LLMConfig config, List<String> replies) {
    super(config);
    this.script = new ArrayDeque<>(replies);
  }

  @Override
  public synchronized LLMResponse complete(LLMRequest request) throws LLMException {
    if (closed) {
      throw new LLMException(LLMException.ErrorType.PROVIDER_UNAVAILABLE, "Provider is closed");
    }

    String reply = script.pollFirst();
    if (reply == null) {
      String lastUser = "";
      for (Message msg : request.messages()) {
        if (msg.role() == Role.USER) {
          lastUser = msg.content();
        }
      }
      reply = "Mock response to: " + lastUser;
    }

    int tokens = reply.length() / 4; // Rough approximation
    return new LLMResponse(reply, getModelName(), tokens, 0);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
