package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Reads a text file, optionally a window of its lines. */
public final class ReadTool implements AgentTool {

  static final int MAX_LINES = 2000;

  private final Workspace workspace;

  public ReadTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "read";
  }

  @Override
  public String description() {
    return "Read a text file. Args: path (string), offset (int, 1-based first line, optional), "
        + "limit (int, max lines, optional, default "
        + MAX_LINES
        + ").";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    Path file = workspace.existingFile(AgentTool.requiredText(args, "path"));
    int offset = Math.max(1, AgentTool.optionalInt(args, "offset", 1));
    int limit = Math.min(MAX_LINES, Math.max(1, AgentTool.optionalInt(args, "limit", MAX_LINES)));

    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ToolException(
          "Failed to read " + workspace.relativize(file) + ": " + e.getMessage(), e);
    }

    if (offset > lines.size() && !lines.isEmpty()) {
      throw new ToolException(
          "Offset " + offset + " is past the end of the file (" + lines.size() + " lines)");
    }

    int from = offset - 1;
    int to = Math.min(lines.size(), from + limit);
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      sb.append(lines.get(i)).append('\n');
    }
    if (to < lines.size()) {
      sb.append("[... ")
          .append(lines.size() - to)
          .append(" more lines; continue with offset=")
          .append(to + 1)
          .append("]\n");
    }
    return sb.toString();
  }
}
