package io.agentmcp.llm;

import io.agentmcp.llm.providers.AnthropicProvider;
import io.agentmcp.llm.providers.MockProvider;
import io.agentmcp.llm.providers.OllamaProvider;
import io.agentmcp.llm.providers.OpenAIProvider;

/** Factory for creating LLM provider instances based on configuration. */
public final class LLMProviderFactory {

  private LLMProviderFactory() {
    // Utility class
  }

  /**
   * Creates an LLM provider instance from configuration.
   *
   * @param config provider configuration
   * @return appropriate provider implementation
   */
  public static LLMProvider create(LLMConfig config) {
    return switch (config.provider()) {
      case ANTHROPIC -> new AnthropicProvider(config);
      case OPENAI -> new OpenAIProvider(config);
      case OLLAMA -> new OllamaProvider(config);
      case MOCK -> new MockProvider(config);
    };
  }
}
