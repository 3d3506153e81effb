package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;

/** Runs a shell command in the working directory. */
public final class BashTool implements AgentTool {

  static final int DEFAULT_TIMEOUT_SECONDS = 120;
  static final int MAX_TIMEOUT_SECONDS = 600;

  private final Workspace workspace;
  private final CommandExecutor executor;

  public BashTool(Workspace workspace, CommandExecutor executor) {
    this.workspace = workspace;
    this.executor = executor;
  }

  @Override
  public String name() {
    return "bash";
  }

  @Override
  public String description() {
    return "Run a bash command in the working directory; returns combined output and exit code. "
        + "Args: command (string), timeout (int seconds, optional, default "
        + DEFAULT_TIMEOUT_SECONDS
        + ").";
  }

  @Override
  public String execute(JsonNode args) throws ToolException, InterruptedException {
    String command = AgentTool.requiredText(args, "command");
    int timeout = AgentTool.optionalInt(args, "timeout", DEFAULT_TIMEOUT_SECONDS);
    timeout = Math.max(1, Math.min(MAX_TIMEOUT_SECONDS, timeout));

    CommandExecutor.CommandResult result;
    try {
      result = executor.exec(command, workspace.root(), Duration.ofSeconds(timeout));
    } catch (IOException e) {
      throw new ToolException("Failed to run command: " + e.getMessage(), e);
    }

    StringBuilder sb = new StringBuilder(result.output());
    if (result.truncated()) {
      sb.append("\n[output truncated]");
    }
    if (result.timedOut()) {
      throw new ToolException(sb + "\nCommand timed out after " + timeout + "s");
    }
    if (result.exitCode() != 0) {
      throw new ToolException(sb + "\nCommand exited with code " + result.exitCode());
    }
    return sb.length() == 0 ? "(no output)" : sb.toString();
  }
}
