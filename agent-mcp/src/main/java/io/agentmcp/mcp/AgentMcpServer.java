package io.agentmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmcp.agent.AgentFactory;
import io.agentmcp.agent.AgentRequest;
import io.agentmcp.agent.CreatedAgent;
import io.agentmcp.agent.tools.LocalCommandExecutor;
import io.agentmcp.llm.ModelResolutionException;
import io.agentmcp.llm.ModelResolver;
import io.agentmcp.llm.ThinkingLevel;
import io.agentmcp.mcp.config.ServerConfig;
import io.agentmcp.session.CapacityExhaustedException;
import io.agentmcp.session.SessionNotFoundException;
import io.agentmcp.session.SessionRecord;
import io.agentmcp.session.SessionRegistry;
import io.agentmcp.session.Subscription;
import io.agentmcp.session.WorkException;
import io.agentmcp.session.WorkHandle;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import jakarta.servlet.Servlet;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP server running LLM coding agents.
 *
 * <p>Each {@code agent} call starts a conversation with a fresh agent and stores it under a thread
 * id; follow-up prompts reach the same agent through {@code agent-reply}. Prompts against one
 * thread run one at a time, in arrival order. Agent progress is streamed to the client as MCP
 * logging notifications.
 *
 * <p>Available tools:
 *
 * <ul>
 *   <li>{@code agent} - Start a new agent session and run a first prompt
 *   <li>{@code agent-reply} - Continue a session by thread id
 *   <li>{@code agent-close} - Close one session or all of them
 * </ul>
 */
public final class AgentMcpServer {

  private static final Logger LOG = LoggerFactory.getLogger(AgentMcpServer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String SERVER_NAME = "agent-mcp";
  static final String SERVER_VERSION = "0.1.0";
  static final String NOT_STORED_WARNING =
      "session not stored - max sessions reached, no follow-up possible";
  static final String NO_TEXT_RESPONSE = "Agent completed but produced no text response.";

  private final ServerConfig config;
  private final SessionRegistry sessionRegistry;
  private final AgentFactory agentFactory;
  private final EventSink eventSink;
  private final Clock clock;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean();

  private volatile McpSyncServer mcpServer;
  private volatile Server jettyServer;

  public AgentMcpServer(ServerConfig config) {
    this(
        config,
        new SessionRegistry(config.maxSessions(), config.idleTimeout()),
        new AgentFactory(
            new ModelResolver(System.getenv(), config.apiKey()), new LocalCommandExecutor()),
        new McpLoggingSink(MAPPER),
        Clock.systemUTC());
  }

  AgentMcpServer(
      ServerConfig config,
      SessionRegistry sessionRegistry,
      AgentFactory agentFactory,
      EventSink eventSink,
      Clock clock) {
    this.config = config;
    this.sessionRegistry = sessionRegistry;
    this.agentFactory = agentFactory;
    this.eventSink = eventSink;
    this.clock = clock;
  }

  public static void main(String[] args) {
    ServerConfig config;
    try {
      config = ServerConfig.fromEnvironment();
    } catch (IllegalArgumentException e) {
      LOG.error("{}", e.getMessage());
      System.exit(1);
      return;
    }
    LOG.info("Configuration: {}", config);

    var server = new AgentMcpServer(config);

    // Check for --stdio flag
    boolean useStdio = false;
    for (String arg : args) {
      if ("--stdio".equals(arg)) {
        useStdio = true;
        break;
      }
    }

    if (useStdio) {
      server.runStdio();
    } else {
      server.runSse();
    }
  }

  /** Run server with stdio transport. */
  public void runStdio() {
    LOG.info("Starting Agent MCP Server with stdio transport");

    try {
      // The transport starts reading stdin once the server is built
      mcpServer = buildMcpServer(new StdioServerTransportProvider(MAPPER));
      LOG.info("Agent MCP Server ready (stdio mode)");

      Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "agent-mcp-shutdown"));

      // Runs until stdin closes or the process is terminated
      new CountDownLatch(1).await();

    } catch (InterruptedException e) {
      LOG.info("Server interrupted, shutting down");
      Thread.currentThread().interrupt();
      shutdown();
    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /** Run server with HTTP/SSE transport. */
  public void runSse() {
    int port = Integer.getInteger("mcp.port", 3000);
    LOG.info("Starting Agent MCP Server on port {}", port);

    try {
      var transportProvider =
          HttpServletSseServerTransportProvider.builder()
              .objectMapper(MAPPER)
              .messageEndpoint("/mcp/message")
              .build();
      mcpServer = buildMcpServer(transportProvider);

      Server jetty = new Server(port);
      ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
      context.setContextPath("/");
      jetty.setHandler(context);
      context.addServlet(new ServletHolder((Servlet) transportProvider), "/mcp/*");
      jettyServer = jetty;

      Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "agent-mcp-shutdown"));

      jetty.start();
      LOG.info("Agent MCP Server started at http://localhost:{}/mcp", port);
      LOG.info("SSE endpoint: http://localhost:{}/mcp/sse", port);
      LOG.info("Message endpoint: http://localhost:{}/mcp/message", port);
      jetty.join();

    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /**
   * Disposes every session, then closes the MCP server and stops Jetty. Each step runs even if an
   * earlier one fails. Only the first call does anything.
   */
  void shutdown() {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return;
    }
    LOG.info("Shutting down...");

    try {
      sessionRegistry.drainAll();
    } catch (RuntimeException e) {
      LOG.warn("Shutdown: draining sessions failed: {}", e.getMessage(), e);
    }

    McpSyncServer server = mcpServer;
    if (server != null) {
      try {
        server.close();
      } catch (RuntimeException e) {
        LOG.warn("Shutdown: closing MCP server failed: {}", e.getMessage(), e);
      }
    }

    Server jetty = jettyServer;
    if (jetty != null) {
      try {
        jetty.stop();
      } catch (Exception e) {
        LOG.warn("Error stopping Jetty: {}", e.getMessage());
      }
    }
  }

  private McpSyncServer buildMcpServer(McpServerTransportProvider transportProvider) {
    McpSyncServer server =
        McpServer.sync(transportProvider)
            .serverInfo(SERVER_NAME, SERVER_VERSION)
            .capabilities(ServerCapabilities.builder().tools(true).logging().build())
            .tools(createToolSpecifications())
            .build();
    if (eventSink instanceof McpLoggingSink loggingSink) {
      loggingSink.attach(server);
    }
    return server;
  }

  List<McpServerFeatures.SyncToolSpecification> createToolSpecifications() {
    return List.of(createAgentTool(), createAgentReplyTool(), createAgentCloseTool());
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // agent
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createAgentTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "prompt": {
              "type": "string",
              "description": "The task or question for the coding agent"
            },
            "provider": {
              "type": "string",
              "description": "LLM provider override (e.g., anthropic, openai, ollama)"
            },
            "model": {
              "type": "string",
              "description": "Model ID override (e.g., claude-sonnet-4-20250514)"
            },
            "thinkingLevel": {
              "type": "string",
              "enum": ["off", "minimal", "low", "medium", "high", "xhigh"],
              "description": "Thinking/reasoning level"
            },
            "cwd": {
              "type": "string",
              "description": "Working directory override"
            }
          },
          "required": ["prompt"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "agent",
            "Start a new coding agent session. "
                + "Returns a threadId for follow-up prompts with agent-reply.",
            schema),
        (exchange, args) -> handleAgent(args));
  }

  private CallToolResult handleAgent(Map<String, Object> args) {
    String prompt = stringArg(args, "prompt");
    if (prompt == null || prompt.isBlank()) {
      return errorResult("Prompt is required");
    }

    String provider = orDefault(stringArg(args, "provider"), config.provider());
    String model = orDefault(stringArg(args, "model"), config.model());

    ThinkingLevel thinkingLevel = config.thinkingLevel();
    String thinkingRaw = stringArg(args, "thinkingLevel");
    if (thinkingRaw != null) {
      try {
        thinkingLevel = ThinkingLevel.parse(thinkingRaw);
      } catch (IllegalArgumentException e) {
        return errorResult(e.getMessage());
      }
    }

    Path cwd = config.cwd();
    String cwdRaw = stringArg(args, "cwd");
    if (cwdRaw != null) {
      Path requested = toDirectory(cwdRaw);
      if (requested == null) {
        return errorResult(
            "Invalid cwd: \"" + cwdRaw + "\" does not exist or is not a directory.");
      }
      cwd = requested;
    }

    try {
      CreatedAgent created;
      try {
        created =
            agentFactory.create(
                new AgentRequest(provider, model, thinkingLevel, cwd, config.tools()));
      } catch (ModelResolutionException e) {
        return errorResult(e.getMessage());
      }

      WorkHandle agent = created.agent();
      String threadId = UUID.randomUUID().toString();

      // Subscribe before prompting so the first events reach the client
      Subscription subscription = EventStreamer.subscribe(eventSink, agent, threadId);
      SessionRecord record = new SessionRecord(threadId, agent, subscription, clock.millis());

      String responseText;
      try {
        agent.submit(prompt);
        responseText = agent.lastOutputText().orElse(null);
      } catch (WorkException | RuntimeException e) {
        record.dispose();
        LOG.warn("Agent {} failed on first prompt: {}", threadId, e.getMessage());
        return errorResult("Agent error: " + e.getMessage());
      } catch (InterruptedException e) {
        record.dispose();
        Thread.currentThread().interrupt();
        return errorResult("Agent error: interrupted");
      }

      record.touch(clock.millis());
      try {
        sessionRegistry.put(threadId, record);
        LOG.info("Stored session {} ({}/{})", threadId, provider, model);
      } catch (CapacityExhaustedException e) {
        // Keep the answer even though the session cannot be continued
        record.dispose();
        LOG.warn("Session {} not stored: {}", threadId, e.getMessage());
        if (hasText(responseText)) {
          Map<String, Object> result = new LinkedHashMap<>();
          result.put("success", true);
          result.put("stored", false);
          result.put(
              "warning",
              created
                  .fallbackMessage()
                  .map(fallback -> NOT_STORED_WARNING + "; " + fallback)
                  .orElse(NOT_STORED_WARNING));
          result.put("response", responseText);
          return successResult(result);
        }
      }

      if (!hasText(responseText)) {
        return errorResult(NO_TEXT_RESPONSE);
      }

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("success", true);
      result.put("threadId", threadId);
      created.fallbackMessage().ifPresent(warning -> result.put("warning", warning));
      result.put("response", responseText);
      return successResult(result);

    } catch (Exception e) {
      LOG.error("Agent call failed: {}", e.getMessage(), e);
      return errorResult("Agent error: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // agent-reply
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createAgentReplyTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "threadId": {
              "type": "string",
              "description": "The threadId returned by the agent tool"
            },
            "prompt": {
              "type": "string",
              "description": "The follow-up message"
            }
          },
          "required": ["threadId", "prompt"]
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "agent-reply",
            "Continue an existing coding agent session by threadId. "
                + "Prompts to the same thread run one at a time, in order.",
            schema),
        (exchange, args) -> handleAgentReply(args));
  }

  private CallToolResult handleAgentReply(Map<String, Object> args) {
    String threadId = stringArg(args, "threadId");
    String prompt = stringArg(args, "prompt");
    if (threadId == null || threadId.isBlank()) {
      return errorResult("threadId is required");
    }
    if (prompt == null || prompt.isBlank()) {
      return errorResult("Prompt is required");
    }

    try {
      String responseText =
          sessionRegistry.withSession(
              threadId,
              handle -> {
                handle.submit(prompt);
                return handle.lastOutputText().orElse(null);
              });

      if (!hasText(responseText)) {
        return errorResult(NO_TEXT_RESPONSE);
      }

      Map<String, Object> result = new LinkedHashMap<>();
      result.put("success", true);
      result.put("threadId", threadId);
      result.put("response", responseText);
      return successResult(result);

    } catch (SessionNotFoundException e) {
      return errorResult(e.getMessage());
    } catch (WorkException e) {
      LOG.warn("Agent {} failed: {}", threadId, e.getMessage());
      return errorResult("Agent error: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return errorResult("Agent error: interrupted");
    } catch (Exception e) {
      LOG.error("Agent reply failed: {}", e.getMessage(), e);
      return errorResult("Agent error: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // agent-close
  // ─────────────────────────────────────────────────────────────────────────────

  private McpServerFeatures.SyncToolSpecification createAgentCloseTool() {
    String schema =
        """
        {
          "type": "object",
          "properties": {
            "threadId": {
              "type": "string",
              "description": "Thread ID of the session to close"
            },
            "closeAll": {
              "type": "boolean",
              "description": "Close all open sessions"
            }
          }
        }
        """;

    return new McpServerFeatures.SyncToolSpecification(
        new Tool(
            "agent-close",
            "Closes an agent session, aborting any running prompt and releasing its resources. "
                + "Provide threadId for one session or closeAll=true for all sessions.",
            schema),
        (exchange, args) -> handleAgentClose(args));
  }

  private CallToolResult handleAgentClose(Map<String, Object> args) {
    String threadId = stringArg(args, "threadId");
    boolean closeAll = args.get("closeAll") instanceof Boolean b && b;

    try {
      if (closeAll) {
        int count = sessionRegistry.removeAll();
        LOG.info("Closed all {} sessions", count);
        return successResult(
            Map.of(
                "success",
                true,
                "message",
                "Closed " + count + " session(s)",
                "remainingSessions",
                sessionRegistry.size()));
      }

      if (threadId == null || threadId.isBlank()) {
        return errorResult("threadId is required unless closeAll is true");
      }

      if (!sessionRegistry.remove(threadId)) {
        return errorResult(SessionNotFoundException.PREFIX + threadId);
      }
      return successResult(
          Map.of(
              "success",
              true,
              "message",
              "Session " + threadId + " closed successfully",
              "remainingSessions",
              sessionRegistry.size()));

    } catch (Exception e) {
      LOG.error("Failed to close session: {}", e.getMessage(), e);
      return errorResult("Failed to close session: " + e.getMessage());
    }
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // Helpers
  // ─────────────────────────────────────────────────────────────────────────────

  private static String stringArg(Map<String, Object> args, String name) {
    return args.get(name) instanceof String s ? s : null;
  }

  private static String orDefault(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static boolean hasText(String text) {
    return text != null && !text.isBlank();
  }

  private static Path toDirectory(String raw) {
    try {
      Path path = Path.of(raw);
      return Files.isDirectory(path) ? path.toAbsolutePath().normalize() : null;
    } catch (InvalidPathException e) {
      return null;
    }
  }

  private CallToolResult successResult(Map<String, Object> data) {
    try {
      String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(data);
      return new CallToolResult(List.of(new TextContent(json)), false);
    } catch (Exception e) {
      return new CallToolResult(List.of(new TextContent(data.toString())), false);
    }
  }

  private CallToolResult errorResult(String message) {
    Map<String, Object> error = Map.of("error", message, "success", false);
    try {
      String json = MAPPER.writeValueAsString(error);
      return new CallToolResult(List.of(new TextContent(json)), true);
    } catch (Exception e) {
      return new CallToolResult(List.of(new TextContent(message)), true);
    }
  }
}
