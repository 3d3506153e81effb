package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Lists a directory. */
public final class LsTool implements AgentTool {

  static final int MAX_ENTRIES = 500;

  private final Workspace workspace;

  public LsTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "ls";
  }

  @Override
  public String description() {
    return "List directory entries; directories end with '/'. "
        + "Args: path (string, optional, default '.').";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    Path dir = workspace.resolve(AgentTool.optionalText(args, "path", "."));
    if (!Files.isDirectory(dir)) {
      throw new ToolException("Not a directory: " + workspace.relativize(dir));
    }

    List<String> entries = new ArrayList<>();
    try (Stream<Path> children = Files.list(dir)) {
      children
          .sorted()
          .forEach(p -> entries.add(p.getFileName() + (Files.isDirectory(p) ? "/" : "")));
    } catch (IOException e) {
      throw new ToolException(
          "Failed to list " + workspace.relativize(dir) + ": " + e.getMessage(), e);
    }

    if (entries.isEmpty()) {
      return "(empty directory)";
    }
    if (entries.size() > MAX_ENTRIES) {
      int more = entries.size() - MAX_ENTRIES;
      return String.join("\n", entries.subList(0, MAX_ENTRIES)) + "\n[... " + more + " more]";
    }
    return String.join("\n", entries);
  }
}
