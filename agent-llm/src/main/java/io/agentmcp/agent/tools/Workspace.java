package io.agentmcp.agent.tools;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/** The working directory tools operate in. Paths outside it are refused. */
public final class Workspace {

  private final Path root;

  public Workspace(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  /**
   * Resolves a path given by the model against the working directory.
   *
   * @throws ToolException if the path is malformed or escapes the working directory
   */
  public Path resolve(String path) throws ToolException {
    Path resolved;
    try {
      resolved = root.resolve(path).normalize();
    } catch (InvalidPathException e) {
      throw new ToolException("Invalid path '" + path + "': " + e.getReason(), e);
    }
    if (!resolved.startsWith(root)) {
      throw new ToolException("Path is outside the working directory: " + path);
    }
    return resolved;
  }

  /** Resolves a path and checks that it is an existing regular file. */
  public Path existingFile(String path) throws ToolException {
    Path file = resolve(path);
    if (!Files.isRegularFile(file)) {
      throw new ToolException("File not found: " + path);
    }
    return file;
  }

  /** Path relative to the working directory, with forward slashes. */
  public String relativize(Path path) {
    String rel = root.relativize(path).toString().replace('\\', '/');
    return rel.isEmpty() ? "." : rel;
  }
}
