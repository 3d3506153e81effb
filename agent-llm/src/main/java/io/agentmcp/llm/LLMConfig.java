package io.agentmcp.llm;

/**
 * Connection settings for one LLM provider instance.
 *
 * @param provider which provider implementation to use
 * @param providerName provider name as requested by the caller (e.g. {@code groq})
 * @param endpoint base URL of the provider API, or null for providers without one
 * @param model model identifier
 * @param apiKey API key, or null for providers that need none
 * @param timeoutSeconds request timeout
 * @param maxTokens reply token budget
 * @param temperature sampling temperature
 */
public record LLMConfig(
    ProviderType provider,
    String providerName,
    String endpoint,
    String model,
    String apiKey,
    int timeoutSeconds,
    int maxTokens,
    double temperature) {

  /** Type of LLM provider implementation. */
  public enum ProviderType {
    /** Anthropic (Claude) API. */
    ANTHROPIC,
    /** OpenAI API and OpenAI-compatible endpoints. */
    OPENAI,
    /** Local LLM via Ollama. */
    OLLAMA,
    /** Mock provider for testing (no network calls). */
    MOCK
  }

  public static final int DEFAULT_TIMEOUT_SECONDS = 300;
  public static final double DEFAULT_TEMPERATURE = 0.2;

  /** Configuration for the mock provider. */
  public static LLMConfig mock() {
    return new LLMConfig(
        ProviderType.MOCK, "mock", null, "mock-model", null, 5, 1024, DEFAULT_TEMPERATURE);
  }

  /** Returns a copy with a different reply token budget. */
  public LLMConfig withMaxTokens(int tokens) {
    return new LLMConfig(
        provider, providerName, endpoint, model, apiKey, timeoutSeconds, tokens, temperature);
  }

  @Override
  public String toString() {
    // apiKey deliberately left out
    return "LLMConfig[" + providerName + "/" + model + ", endpoint=" + endpoint + "]";
  }
}
