package io.agentmcp.llm.providers;

import dev.langchain4j.model.openai.OpenAiChatModel;
import io.agentmcp.llm.LLMConfig;
import java.time.Duration;

/**
 * LLM provider for OpenAI models using LangChain4j. Also serves OpenAI-compatible APIs (Groq,
 * Cerebras, xAI, OpenRouter, Mistral) through {@link LLMConfig#endpoint()}.
 */
public class OpenAIProvider extends ChatModelProvider {

  /**
   * Creates an OpenAI provider with the given configuration.
   *
   * @param config provider configuration; {@code apiKey} must be set
   */
  public OpenAIProvider(LLMConfig config) {
    super(
        config,
        OpenAiChatModel.builder()
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
    return "openai".equals(config.providerName()) ? "OpenAI" : config.providerName();
  }
}
