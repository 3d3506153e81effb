package io.agentmcp.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** The tools enabled for one agent, keyed by name. */
public final class ToolSet {

  /** Every tool name that can be enabled. */
  public static final Set<String> VALID_TOOLS =
      Set.of("read", "bash", "edit", "write", "grep", "find", "ls");

  private final Map<String, AgentTool> tools = new LinkedHashMap<>();

  private ToolSet(List<AgentTool> tools) {
    for (AgentTool tool : tools) {
      this.tools.put(tool.name(), tool);
    }
  }

  /**
   * Builds the named tools for a working directory.
   *
   * @param names tool names, each one of {@link #VALID_TOOLS}
   * @param cwd working directory the tools are confined to
   * @param executor executor used by {@code bash}
   * @throws IllegalArgumentException if a name is unknown
   */
  public static ToolSet create(Collection<String> names, Path cwd, CommandExecutor executor) {
    Workspace workspace = new Workspace(cwd);
    List<AgentTool> created = new ArrayList<>();
    for (String name : names) {
      created.add(
          switch (name) {
            case "read" -> new ReadTool(workspace);
            case "bash" -> new BashTool(workspace, executor);
            case "edit" -> new EditTool(workspace);
            case "write" -> new WriteTool(workspace);
            case "grep" -> new GrepTool(workspace);
            case "find" -> new FindTool(workspace);
            case "ls" -> new LsTool(workspace);
            default -> throw new IllegalArgumentException("Unknown tool: " + name);
          });
    }
    return new ToolSet(created);
  }

  public boolean isEmpty() {
    return tools.isEmpty();
  }

  public Set<String> names() {
    return tools.keySet();
  }

  /** Tool descriptions, one per line, for the system prompt. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    for (AgentTool tool : tools.values()) {
      sb.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
    }
    return sb.toString();
  }

  /**
   * Runs a tool by name.
   *
   * @throws ToolException if the tool is not enabled or fails
   */
  public String execute(String name, JsonNode args) throws ToolException, InterruptedException {
    AgentTool tool = tools.get(name);
    if (tool == null) {
      throw new ToolException("Tool not available: " + name + ". Available: " + names());
    }
    return tool.execute(args);
  }
}
