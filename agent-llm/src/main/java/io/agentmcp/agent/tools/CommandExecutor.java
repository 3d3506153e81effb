package io.agentmcp.agent.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs shell commands for the {@code bash} tool. The local implementation runs them directly; a
 * sandboxing implementation can be plugged in instead.
 */
public interface CommandExecutor {

  /**
   * Result of one command.
   *
   * @param exitCode process exit code, or -1 if it was killed
   * @param output combined stdout and stderr, possibly truncated
   * @param timedOut whether the command was killed for exceeding its timeout
   * @param truncated whether output was cut at the capture limit
   */
  record CommandResult(int exitCode, String output, boolean timedOut, boolean truncated) {}

  /**
   * Runs {@code command} in {@code cwd}.
   *
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if interrupted while waiting for the command
   */
  CommandResult exec(String command, Path cwd, Duration timeout)
      throws IOException, InterruptedException;
}
