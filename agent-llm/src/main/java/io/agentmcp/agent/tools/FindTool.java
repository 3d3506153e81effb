package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Finds files whose path matches a glob. */
public final class FindTool implements AgentTool {

  static final int MAX_RESULTS = 200;

  private final Workspace workspace;

  public FindTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "find";
  }

  @Override
  public String description() {
    return "Find files by glob relative to path, e.g. '**/*.java'. "
        + "Args: pattern (string), path (string, optional, default '.').";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    String pattern = AgentTool.requiredText(args, "pattern");
    Path base = workspace.resolve(AgentTool.optionalText(args, "path", "."));
    if (!Files.isDirectory(base)) {
      throw new ToolException("Not a directory: " + workspace.relativize(base));
    }

    PathMatcher matcher;
    try {
      matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    } catch (IllegalArgumentException e) {
      throw new ToolException("Invalid glob '" + pattern + "': " + e.getMessage(), e);
    }

    List<String> matches;
    try (Stream<Path> files = Files.walk(base)) {
      matches =
          files
              .filter(Files::isRegularFile)
              .filter(p -> matcher.matches(base.relativize(p)) || matcher.matches(p.getFileName()))
              .map(workspace::relativize)
              .sorted()
              .limit(MAX_RESULTS + 1L)
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new ToolException(
          "Failed to search " + workspace.relativize(base) + ": " + e.getMessage(), e);
    }

    if (matches.isEmpty()) {
      return "No files found matching " + pattern;
    }
    if (matches.size() > MAX_RESULTS) {
      return String.join("\n", matches.subList(0, MAX_RESULTS))
          + "\n[results truncated at "
          + MAX_RESULTS
          + "]";
    }
    return String.join("\n", matches);
  }
}
