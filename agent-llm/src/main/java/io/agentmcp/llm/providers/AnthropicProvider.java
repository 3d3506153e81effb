package io.agentmcp.llm.providers;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import io.agentmcp.llm.LLMConfig;
import java.time.Duration;

/** LLM provider for Anthropic models (Claude) using LangChain4j. */
public class AnthropicProvider extends ChatModelProvider {

  /**
   * Creates an Anthropic provider with the given configuration.
   *
   * @param config provider configuration; {@code apiKey} must be set
   */
  public AnthropicProvider(LLMConfig config) {
    super(
        config,
        AnthropicChatModel.builder()
            .baseUrl(config.endpoint())
            .apiKey(config.apiKey())
            .modelName(config.model())
            .temperature(config.temperature())
            .maxTokens(config.maxTokens())
            .timeout(Duration.ofSeconds(config.timeoutSeconds()))
            .maxRetries(0)
            .build());
  }

  @Override
  protected String displayName() {
    return "Anthropic";
  }
}
