package io.agentmcp.mcp.config;

import static org.junit.jupiter.api.Assertions.*;

import io.agentmcp.llm.ThinkingLevel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServerConfigTest {

  @TempDir Path processCwd;

  private ServerConfig load(Map<String, String> env) {
    return ServerConfig.fromEnvironment(env, processCwd);
  }

  private IllegalArgumentException invalid(String name, String value) {
    Map<String, String> env = new HashMap<>();
    env.put(name, value);
    return assertThrows(IllegalArgumentException.class, () -> load(env));
  }

  @Test
  void defaults() {
    ServerConfig config = load(Map.of());

    assertEquals("anthropic", config.provider());
    assertEquals("claude-sonnet-4-20250514", config.model());
    assertEquals(ThinkingLevel.MEDIUM, config.thinkingLevel());
    assertEquals(processCwd.toAbsolutePath().normalize(), config.cwd());
    assertEquals(List.of("read", "bash", "edit", "write"), config.tools());
    assertEquals(20, config.maxSessions());
    assertEquals(Duration.ofHours(1), config.idleTimeout());
    assertNull(config.apiKey());
  }

  @Test
  void readsOverrides() throws Exception {
    Path work = Files.createDirectory(processCwd.resolve("work"));
    ServerConfig config =
        load(
            Map.of(
                "AGENT_MCP_PROVIDER", "openai",
                "AGENT_MCP_MODEL", "gpt-4o",
                "AGENT_MCP_THINKING", "off",
                "AGENT_MCP_CWD", work.toString(),
                "AGENT_MCP_TOOLS", " read , grep,,ls ",
                "AGENT_MCP_MAX_SESSIONS", "3",
                "AGENT_MCP_SESSION_IDLE_TIMEOUT", "0",
                "AGENT_MCP_API_KEY", "sk-test"));

    assertEquals("openai", config.provider());
    assertEquals("gpt-4o", config.model());
    assertEquals(ThinkingLevel.OFF, config.thinkingLevel());
    assertEquals(work.toAbsolutePath().normalize(), config.cwd());
    assertEquals(List.of("read", "grep", "ls"), config.tools());
    assertEquals(3, config.maxSessions());
    assertTrue(config.idleTimeout().isZero());
    assertEquals("sk-test", config.apiKey());
    assertFalse(config.toString().contains("sk-test"));
  }

  @Test
  void rejectsUnknownThinkingLevel() {
    assertTrue(
        invalid("AGENT_MCP_THINKING", "turbo")
            .getMessage()
            .startsWith("Invalid AGENT_MCP_THINKING: \"turbo\". Must be one of: off, minimal"));
  }

  @Test
  void rejectsMissingCwd() {
    String missing = processCwd.resolve("missing").toString();

    assertEquals(
        "Invalid AGENT_MCP_CWD: \"" + missing + "\" does not exist or is not a directory.",
        invalid("AGENT_MCP_CWD", missing).getMessage());
  }

  @Test
  void rejectsUnknownTools() {
    String message = invalid("AGENT_MCP_TOOLS", "read,telnet,ftp").getMessage();

    assertTrue(message.startsWith("Invalid AGENT_MCP_TOOLS: unknown tool(s) \"telnet\", \"ftp\""));
    assertTrue(message.endsWith("Valid tools: bash, edit, find, grep, ls, read, write"));
  }

  @Test
  void rejectsBadMaxSessions() {
    assertEquals(
        "Invalid AGENT_MCP_MAX_SESSIONS: \"0\". Must be a positive integer.",
        invalid("AGENT_MCP_MAX_SESSIONS", "0").getMessage());
    assertEquals(
        "Invalid AGENT_MCP_MAX_SESSIONS: \"many\". Must be a positive integer.",
        invalid("AGENT_MCP_MAX_SESSIONS", "many").getMessage());
  }

  @Test
  void rejectsNegativeIdleTimeout() {
    assertEquals(
        "Invalid AGENT_MCP_SESSION_IDLE_TIMEOUT: \"-1\". Must be a non-negative integer.",
        invalid("AGENT_MCP_SESSION_IDLE_TIMEOUT", "-1").getMessage());
  }

  @Test
  void blankApiKeyIsIgnored() {
    assertNull(load(Map.of("AGENT_MCP_API_KEY", "  ")).apiKey());
  }

  @Test
  void apiKeyForKeylessProviderIsKept() {
    ServerConfig config =
        load(Map.of("AGENT_MCP_PROVIDER", "ollama", "AGENT_MCP_API_KEY", "unused"));

    assertEquals("unused", config.apiKey());
  }
}
