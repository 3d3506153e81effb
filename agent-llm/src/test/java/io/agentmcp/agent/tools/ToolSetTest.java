package io.agentmcp.agent.tools;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolSetTest {

  @TempDir Path root;

  @Test
  void createsRequestedToolsInOrder() {
    ToolSet tools = ToolSet.create(List.of("read", "bash"), root, mock(CommandExecutor.class));

    assertEquals(List.of("read", "bash"), List.copyOf(tools.names()));
    assertTrue(tools.describe().startsWith("- read: "));
    assertTrue(tools.describe().contains("- bash: "));
  }

  @Test
  void emptyToolSet() {
    ToolSet tools = ToolSet.create(List.of(), root, mock(CommandExecutor.class));

    assertTrue(tools.isEmpty());
    assertEquals("", tools.describe());
  }

  @Test
  void rejectsUnknownToolName() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ToolSet.create(List.of("read", "telnet"), root, mock(CommandExecutor.class)));
    assertEquals("Unknown tool: telnet", e.getMessage());
  }

  @Test
  void everyValidToolCanBeCreated() {
    ToolSet tools = ToolSet.create(ToolSet.VALID_TOOLS, root, mock(CommandExecutor.class));

    assertEquals(Set.copyOf(ToolSet.VALID_TOOLS), Set.copyOf(tools.names()));
  }

  @Test
  void executingDisabledToolFails() {
    ToolSet tools = ToolSet.create(List.of("ls"), root, mock(CommandExecutor.class));

    ToolException e =
        assertThrows(
            ToolException.class,
            () -> tools.execute("write", new ObjectMapper().createObjectNode()));
    assertTrue(e.getMessage().startsWith("Tool not available: write"));
  }
}
