package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Creates or overwrites a file. */
public final class WriteTool implements AgentTool {

  private final Workspace workspace;

  public WriteTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "write";
  }

  @Override
  public String description() {
    return "Create or overwrite a file, creating parent directories. "
        + "Args: path (string), content (string).";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    Path file = workspace.resolve(AgentTool.requiredText(args, "path"));
    String content = AgentTool.requiredText(args, "content");
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ToolException(
          "Failed to write " + workspace.relativize(file) + ": " + e.getMessage(), e);
    }
    return "Wrote " + content.length() + " characters to " + workspace.relativize(file);
  }
}
