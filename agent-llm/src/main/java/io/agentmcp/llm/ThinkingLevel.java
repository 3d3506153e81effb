package io.agentmcp.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** How much reasoning the agent may spend per reply, expressed as a reply token budget. */
public enum ThinkingLevel {
  OFF(2048),
  MINIMAL(4096),
  LOW(8192),
  MEDIUM(16384),
  HIGH(32000),
  XHIGH(64000);

  private final int tokenBudget;

  ThinkingLevel(int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public int tokenBudget() {
    return tokenBudget;
  }

  /** Lower-case name as used in configuration and tool arguments. */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a level by its lower-case name.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ThinkingLevel parse(String value) {
    for (ThinkingLevel level : values()) {
      if (level.id().equals(value)) {
        return level;
      }
    }
    throw new IllegalArgumentException(
        "Unknown thinking level \"" + value + "\". Must be one of: " + validIds());
  }

  /** Comma-separated list of valid names. */
  public static String validIds() {
    return Arrays.stream(values()).map(ThinkingLevel::id).collect(Collectors.joining(", "));
  }
}
