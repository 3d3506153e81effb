package io.agentmcp.llm;

import io.agentmcp.llm.LLMConfig.ProviderType;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a provider name and model id into an {@link LLMConfig}: picks the implementation and
 * endpoint, finds the API key and applies the thinking level.
 *
 * <p>API keys come from the provider's own environment variable (for example {@code
 * ANTHROPIC_API_KEY}); a shared fallback key is used only when that variable is unset.
 */
public final class ModelResolver {

  private static final Logger LOG = LoggerFactory.getLogger(ModelResolver.class);

  /** Providers this server can talk to. */
  public enum KnownProvider {
    ANTHROPIC(
        "anthropic", ProviderType.ANTHROPIC, "https://api.anthropic.com/v1/", "ANTHROPIC_API_KEY"),
    OPENAI("openai", ProviderType.OPENAI, "https://api.openai.com/v1", "OPENAI_API_KEY"),
    GROQ("groq", ProviderType.OPENAI, "https://api.groq.com/openai/v1", "GROQ_API_KEY"),
    CEREBRAS("cerebras", ProviderType.OPENAI, "https://api.cerebras.ai/v1", "CEREBRAS_API_KEY"),
    XAI("xai", ProviderType.OPENAI, "https://api.x.ai/v1", "XAI_API_KEY"),
    OPENROUTER(
        "openrouter", ProviderType.OPENAI, "https://openrouter.ai/api/v1", "OPENROUTER_API_KEY"),
    MISTRAL("mistral", ProviderType.OPENAI, "https://api.mistral.ai/v1", "MISTRAL_API_KEY"),
    OLLAMA("ollama", ProviderType.OLLAMA, "http://localhost:11434", null),
    MOCK("mock", ProviderType.MOCK, null, null);

    private final String id;
    private final ProviderType type;
    private final String defaultEndpoint;
    private final String apiKeyVariable;

    KnownProvider(String id, ProviderType type, String defaultEndpoint, String apiKeyVariable) {
      this.id = id;
      this.type = type;
      this.defaultEndpoint = defaultEndpoint;
      this.apiKeyVariable = apiKeyVariable;
    }

    public String id() {
      return id;
    }

    /** Environment variable holding this provider's API key, or null if it needs none. */
    public String apiKeyVariable() {
      return apiKeyVariable;
    }

    public static Optional<KnownProvider> byId(String id) {
      if (id == null) {
        return Optional.empty();
      }
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      return Arrays.stream(values()).filter(p -> p.id.equals(normalized)).findFirst();
    }
  }

  /**
   * A resolved model.
   *
   * @param config provider configuration
   * @param fallbackMessage warning to show the caller when the request could not be honored
   *     exactly
   */
  public record ResolvedModel(LLMConfig config, Optional<String> fallbackMessage) {}

  private final Map<String, String> environment;
  private final String fallbackApiKey;

  /**
   * @param environment environment variables to read API keys from
   * @param fallbackApiKey key used when the provider's own variable is unset; may be null
   */
  public ModelResolver(Map<String, String> environment, String fallbackApiKey) {
    this.environment = Map.copyOf(environment);
    this.fallbackApiKey = fallbackApiKey;
  }

  /**
   * Resolves a provider and model.
   *
   * @param provider provider name, e.g. {@code anthropic}
   * @param modelId model identifier
   * @param thinkingLevel requested thinking level
   * @return resolved configuration plus an optional fallback warning
   * @throws ModelResolutionException if the provider is unknown, the model id is empty, or no API
   *     key is available
   */
  public ResolvedModel resolve(String provider, String modelId, ThinkingLevel thinkingLevel)
      throws ModelResolutionException {
    KnownProvider known =
        KnownProvider.byId(provider)
            .orElseThrow(
                () ->
                    new ModelResolutionException(
                        "Unknown provider: "
                            + provider
                            + ". Known providers: "
                            + knownProviderIds()));

    if (modelId == null || modelId.isBlank()) {
      throw new ModelResolutionException(
          "Model not found: " + known.id + "/" + modelId + ". Check provider and model ID.");
    }

    String apiKey = null;
    if (known.apiKeyVariable != null) {
      apiKey = environment.get(known.apiKeyVariable);
      if (apiKey == null || apiKey.isBlank()) {
        apiKey = fallbackApiKey;
      }
      if (apiKey == null || apiKey.isBlank()) {
        throw new ModelResolutionException(
            "No API key for provider "
                + known.id
                + ". Set "
                + known.apiKeyVariable
                + " or AGENT_MCP_API_KEY.");
      }
    }

    String endpoint = known.defaultEndpoint;
    String endpointOverride = environment.get("AGENT_MCP_" + known.name() + "_BASE_URL");
    if (endpointOverride != null && !endpointOverride.isBlank()) {
      endpoint = endpointOverride;
    }

    Optional<String> fallback = Optional.empty();
    ThinkingLevel effective = thinkingLevel;
    if (known.type == ProviderType.OLLAMA && thinkingLevel != ThinkingLevel.OFF) {
      effective = ThinkingLevel.OFF;
      fallback =
          Optional.of(
              "Provider ollama does not support thinking level '"
                  + thinkingLevel.id()
                  + "'; running with thinking off.");
    }

    LLMConfig config =
        new LLMConfig(
            known.type,
            known.id,
            endpoint,
            modelId.trim(),
            apiKey,
            LLMConfig.DEFAULT_TIMEOUT_SECONDS,
            effective.tokenBudget(),
            LLMConfig.DEFAULT_TEMPERATURE);
    LOG.debug("Resolved {} (thinking={})", config, effective.id());
    return new ResolvedModel(config, fallback);
  }

  public static String knownProviderIds() {
    return Arrays.stream(KnownProvider.values())
        .map(KnownProvider::id)
        .collect(Collectors.joining(", "));
  }
}
