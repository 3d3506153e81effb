package io.agentmcp.llm;

import java.util.List;
import java.util.Map;

/**
 * Abstract base class for LLM providers. Implementations connect to local or cloud LLMs to generate
 * responses.
 */
public abstract class LLMProvider implements AutoCloseable {

  /** Configuration for this provider. */
  protected final LLMConfig config;

  /**
   * Creates a new LLM provider with the given configuration.
   *
   * @param config provider configuration
   */
  protected LLMProvider(LLMConfig config) {
    this.config = config;
  }

  /**
   * Sends a completion request to the LLM and returns the response.
   *
   * @param request the request to send
   * @return the LLM response
   * @throws LLMException if the request fails
   */
  public abstract LLMResponse complete(LLMRequest request) throws LLMException;

  /**
   * Gets the name of the model being used.
   *
   * @return model name
   */
  public String getModelName() {
    return config.model();
  }

  public LLMConfig getConfig() {
    return config;
  }

  /** Default implementation: no cleanup needed. */
  @Override
  public void close() throws Exception {
    // Default: no resources to clean up
  }

  /** Role of a message in a conversation. */
  public enum Role {
    /** Message from the user, including tool results fed back to the model. */
    USER,
    /** Message from the assistant (LLM). */
    ASSISTANT,
    /** System instruction or context. */
    SYSTEM
  }

  /**
   * A message in a conversation.
   *
   * @param role the role of the message sender
   * @param content the message content
   */
  public record Message(Role role, String content) {}

  /**
   * Request to send to an LLM.
   *
   * @param systemPrompt optional system prompt providing context and instructions
   * @param messages conversation history
   * @param options provider-specific options
   */
  public record LLMRequest(
      String systemPrompt, List<Message> messages, Map<String, Object> options) {

    /**
     * Creates a simple request with just a user message.
     *
     * @param userMessage the user's message
     * @return request with default options
     */
    public static LLMRequest of(String userMessage) {
      return new LLMRequest(null, List.of(new Message(Role.USER, userMessage)), Map.of());
    }

    /**
     * Creates a request with a system prompt and prior messages.
     *
     * @param systemPrompt system prompt
     * @param messages conversation so far
     * @return request with default options
     */
    public static LLMRequest of(String systemPrompt, List<Message> messages) {
      return new LLMRequest(systemPrompt, List.copyOf(messages), Map.of());
    }
  }

  /**
   * Response from an LLM.
   *
   * @param content the generated text
   * @param model the model that generated the response
   * @param tokensUsed number of tokens used (input + output)
   * @param durationMs time taken to generate the response in milliseconds
   */
  public record LLMResponse(String content, String model, int tokensUsed, long durationMs) {}
}
