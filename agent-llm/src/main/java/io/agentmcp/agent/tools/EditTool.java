package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Replaces one exact, unique occurrence of text in a file. */
public final class EditTool implements AgentTool {

  private final Workspace workspace;

  public EditTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "edit";
  }

  @Override
  public String description() {
    return "Replace text in a file. oldText must occur exactly once. "
        + "Args: path (string), oldText (string), newText (string).";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    Path file = workspace.existingFile(AgentTool.requiredText(args, "path"));
    String oldText = AgentTool.requiredText(args, "oldText");
    String newText = AgentTool.requiredText(args, "newText");
    if (oldText.isEmpty()) {
      throw new ToolException("oldText must not be empty");
    }

    String rel = workspace.relativize(file);
    try {
      String content = Files.readString(file, StandardCharsets.UTF_8);
      int first = content.indexOf(oldText);
      if (first < 0) {
        throw new ToolException("oldText not found in " + rel);
      }
      if (content.indexOf(oldText, first + 1) >= 0) {
        throw new ToolException("oldText occurs more than once in " + rel + "; add context");
      }
      String updated =
          content.substring(0, first) + newText + content.substring(first + oldText.length());
      Files.writeString(file, updated, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ToolException("Failed to edit " + rel + ": " + e.getMessage(), e);
    }
    return "Edited " + rel;
  }
}
