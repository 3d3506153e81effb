package io.agentmcp.llm.providers;

import dev.langchain4j.model.ollama.OllamaChatModel;
import io.agentmcp.llm.LLMConfig;
import java.time.Duration;

/** LLM provider for local models served by Ollama. No API key, no data leaves the machine. */
public class OllamaProvider extends ChatModelProvider {

  /**
   * Creates an Ollama provider with the given configuration.
   *
   * @param config provider configuration
   */
  public OllamaProvider(LLMConfig config) {
    super(
        config,
        OllamaChatModel.builder()
            .baseUrl(config.endpoint())
            .modelName(config.model())
            .temperature(config.temperature())
            .numPredict(config.maxTokens())
            .timeout(Duration.ofSeconds(config.timeoutSeconds()))
            .maxRetries(0)
            .build());
  }

  @Override
  protected String displayName() {
    return "Ollama";
  }
}
