package io.agentmcp.mcp.config;

import io.agentmcp.agent.tools.ToolSet;
import io.agentmcp.llm.ModelResolver.KnownProvider;
import io.agentmcp.llm.ThinkingLevel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server settings read from {@code AGENT_MCP_*} environment variables.
 *
 * @param provider default LLM provider
 * @param model default model id
 * @param thinkingLevel default thinking level
 * @param cwd default working directory for agents
 * @param tools tools enabled for every agent
 * @param maxSessions maximum stored sessions
 * @param idleTimeout session idle timeout; zero disables expiry
 * @param apiKey shared API key used when a provider's own key variable is unset, or null
 */
public record ServerConfig(
    String provider,
    String model,
    ThinkingLevel thinkingLevel,
    Path cwd,
    List<String> tools,
    int maxSessions,
    Duration idleTimeout,
    String apiKey) {

  private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

  static final String DEFAULT_PROVIDER = "anthropic";
  static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
  static final String DEFAULT_TOOLS = "read,bash,edit,write";

  public ServerConfig {
    tools = List.copyOf(tools);
  }

  /** Reads the configuration from the process environment. */
  public static ServerConfig fromEnvironment() {
    return fromEnvironment(System.getenv(), Path.of(System.getProperty("user.dir")));
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @param env environment variables
   * @param processCwd working directory used when {@code AGENT_MCP_CWD} is unset
   * @throws IllegalArgumentException if a variable holds an invalid value
   */
  public static ServerConfig fromEnvironment(Map<String, String> env, Path processCwd) {
    String provider = env.getOrDefault("AGENT_MCP_PROVIDER", DEFAULT_PROVIDER);
    String model = env.getOrDefault("AGENT_MCP_MODEL", DEFAULT_MODEL);

    String thinkingRaw = env.getOrDefault("AGENT_MCP_THINKING", "medium");
    ThinkingLevel thinkingLevel;
    try {
      thinkingLevel = ThinkingLevel.parse(thinkingRaw);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid AGENT_MCP_THINKING: \""
              + thinkingRaw
              + "\". Must be one of: "
              + ThinkingLevel.validIds(),
          e);
    }

    String cwdRaw = env.get("AGENT_MCP_CWD");
    Path cwd = cwdRaw != null ? Path.of(cwdRaw) : processCwd;
    if (!Files.isDirectory(cwd)) {
      throw new IllegalArgumentException(
          "Invalid AGENT_MCP_CWD: \"" + cwd + "\" does not exist or is not a directory.");
    }

    List<String> tools = parseCommaSeparated(env.getOrDefault("AGENT_MCP_TOOLS", DEFAULT_TOOLS));
    List<String> unknown =
        tools.stream().filter(t -> !ToolSet.VALID_TOOLS.contains(t)).collect(Collectors.toList());
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException(
          "Invalid AGENT_MCP_TOOLS: unknown tool(s) \""
              + String.join("\", \"", unknown)
              + "\". Valid tools: "
              + String.join(", ", ToolSet.VALID_TOOLS.stream().sorted().toList()));
    }

    int maxSessions = parseInt(env, "AGENT_MCP_MAX_SESSIONS", 20, 1, "a positive integer");
    int idleSeconds =
        parseInt(env, "AGENT_MCP_SESSION_IDLE_TIMEOUT", 3600, 0, "a non-negative integer");

    String apiKey = env.get("AGENT_MCP_API_KEY");
    if (apiKey != null && apiKey.isBlank()) {
      apiKey = null;
    }
    if (apiKey != null
        && KnownProvider.byId(provider).map(KnownProvider::apiKeyVariable).isEmpty()) {
      LOG.warn(
          "AGENT_MCP_API_KEY set but provider \"{}\" takes no known API key variable. "
              + "The key will not be used for it; set the provider's own variable instead.",
          provider);
    }

    return new ServerConfig(
        provider,
        model,
        thinkingLevel,
        cwd.toAbsolutePath().normalize(),
        tools,
        maxSessions,
        Duration.ofSeconds(idleSeconds),
        apiKey);
  }

  @Override
  public String toString() {
    // apiKey deliberately left out
    return "ServerConfig[provider="
        + provider
        + ", model="
        + model
        + ", thinking="
        + thinkingLevel.id()
        + ", cwd="
        + cwd
        + ", tools="
        + tools
        + ", maxSessions="
        + maxSessions
        + ", idleTimeout="
        + idleTimeout
        + "]";
  }

  private static List<String> parseCommaSeparated(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
  }

  private static int parseInt(
      Map<String, String> env, String name, int defaultValue, int min, String expected) {
    String raw = env.get(name);
    if (raw == null) {
      return defaultValue;
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid " + name + ": \"" + raw + "\". Must be " + expected + ".", e);
    }
    if (value < min) {
      throw new IllegalArgumentException(
          "Invalid " + name + ": \"" + raw + "\". Must be " + expected + ".");
    }
    return value;
  }
}
