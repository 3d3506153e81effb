package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Searches file contents for a regular expression. */
public final class GrepTool implements AgentTool {

  static final int MAX_MATCHES = 100;
  private static final int MAX_LINE_LENGTH = 300;

  private final Workspace workspace;

  public GrepTool(Workspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public String name() {
    return "grep";
  }

  @Override
  public String description() {
    return "Search file contents with a Java regular expression. Output lines are file:line: text. "
        + "Args: pattern (string), path (string, optional, default '.'), "
        + "glob (string, optional file filter such as '*.java').";
  }

  @Override
  public String execute(JsonNode args) throws ToolException {
    String regex = AgentTool.requiredText(args, "pattern");
    Path base = workspace.resolve(AgentTool.optionalText(args, "path", "."));
    String glob = AgentTool.optionalText(args, "glob", null);

    Pattern pattern;
    try {
      pattern = Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new ToolException("Invalid pattern: " + e.getDescription(), e);
    }
    PathMatcher filter = glob == null ? null : globMatcher(glob);

    List<Path> files;
    try (Stream<Path> walk = Files.isDirectory(base) ? Files.walk(base) : Stream.of(base)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> filter == null || filter.matches(p.getFileName()))
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      throw new ToolException(
          "Failed to search " + workspace.relativize(base) + ": " + e.getMessage(), e);
    }

    List<String> matches = new ArrayList<>();
    for (Path file : files) {
      List<String> lines;
      try {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      } catch (MalformedInputException e) {
        continue; // binary file
      } catch (IOException e) {
        throw new ToolException(
            "Failed to read " + workspace.relativize(file) + ": " + e.getMessage(), e);
      }
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i);
        if (pattern.matcher(line).find()) {
          if (line.length() > MAX_LINE_LENGTH) {
            line = line.substring(0, MAX_LINE_LENGTH) + "...";
          }
          matches.add(workspace.relativize(file) + ":" + (i + 1) + ": " + line);
          if (matches.size() >= MAX_MATCHES) {
            return String.join("\n", matches) + "\n[matches truncated at " + MAX_MATCHES + "]";
          }
        }
      }
    }
    return matches.isEmpty() ? "No matches for " + regex : String.join("\n", matches);
  }

  private static PathMatcher globMatcher(String glob) throws ToolException {
    try {
      return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    } catch (IllegalArgumentException e) {
      throw new ToolException("Invalid glob '" + glob + "': " + e.getMessage(), e);
    }
  }
}
