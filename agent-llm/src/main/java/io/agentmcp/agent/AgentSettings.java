package io.agentmcp.agent;

import java.time.Duration;

/**
 * Limits applied to every agent run.
 *
 * @param maxSteps maximum model calls per prompt
 * @param maxRetries retries for a retryable provider failure
 * @param retryBaseDelay back-off before the first retry; doubles for each further retry
 */
public record AgentSettings(int maxSteps, int maxRetries, Duration retryBaseDelay) {

  public static AgentSettings defaults() {
    return new AgentSettings(24, 3, Duration.ofSeconds(2));
  }
}
