package io.agentmcp.agent;

import io.agentmcp.agent.tools.ToolException;
import io.agentmcp.agent.tools.ToolSet;
import io.agentmcp.llm.ConversationHistory;
import io.agentmcp.llm.LLMException;
import io.agentmcp.llm.LLMProvider;
import io.agentmcp.llm.LLMProvider.LLMRequest;
import io.agentmcp.llm.LLMProvider.LLMResponse;
import io.agentmcp.llm.LLMProvider.Role;
import io.agentmcp.session.AgentEvent;
import io.agentmcp.session.AgentEventListener;
import io.agentmcp.session.Subscription;
import io.agentmcp.session.WorkException;
import io.agentmcp.session.WorkHandle;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A coding agent that keeps a conversation with an LLM and can call tools in its working
 * directory.
 *
 * <p>Each {@link #submit(String)} appends the prompt to the conversation and loops: the model
 * either asks for a tool (a fenced {@code tool} block) or gives its final answer. Tool results are
 * fed back as user messages. Retryable provider failures are retried with exponential back-off.
 */
public final class ConversationAgent implements WorkHandle {

  private static final Logger LOG = LoggerFactory.getLogger(ConversationAgent.class);

  private final LLMProvider provider;
  private final ToolSet tools;
  private final Path cwd;
  private final AgentSettings settings;
  private final ConversationHistory history;
  private final String systemPrompt;

  private final List<AgentEventListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean busy = new AtomicBoolean();
  private final Object abortSignal = new Object();
  private volatile boolean abortRequested;
  private volatile boolean disposed;
  private volatile CompletableFuture<Void> idle = CompletableFuture.completedFuture(null);
  private volatile String lastOutput;

  public ConversationAgent(
      LLMProvider provider,
      ToolSet tools,
      Path cwd,
      AgentSettings settings,
      ConversationHistory history) {
    this.provider = provider;
    this.tools = tools;
    this.cwd = cwd;
    this.settings = settings;
    this.history = history;
    this.systemPrompt = buildSystemPrompt();
  }

  @Override
  public boolean isBusy() {
    return busy.get();
  }

  @Override
  public String submit(String input) throws WorkException, InterruptedException {
    CompletableFuture<Void> done = new CompletableFuture<>();
    // busy, idle and the abort flag change together so a concurrent cancel or release is not lost
    synchronized (abortSignal) {
      if (disposed) {
        throw new WorkException("Agent has been disposed");
      }
      if (!busy.compareAndSet(false, true)) {
        throw new WorkException("Agent is already processing a prompt");
      }
      idle = done;
      abortRequested = false;
    }
    emit(new AgentEvent.AgentStarted());
    try {
      String answer = run(input);
      lastOutput = answer;
      return answer;
    } finally {
      emit(new AgentEvent.AgentEnded());
      busy.set(false);
      done.complete(null);
    }
  }

  @Override
  public Optional<String> lastOutputText() {
    return Optional.ofNullable(lastOutput);
  }

  @Override
  public CompletableFuture<Void> cancel() {
    synchronized (abortSignal) {
      if (!busy.get()) {
        return CompletableFuture.completedFuture(null);
      }
      LOG.debug("Abort requested for agent using {}", provider.getModelName());
      abortRequested = true;
      abortSignal.notifyAll();
      return idle;
    }
  }

  @Override
  public void release() {
    synchronized (abortSignal) {
      if (disposed) {
        return;
      }
      disposed = true;
      abortRequested = true;
      abortSignal.notifyAll();
    }
    listeners.clear();
    history.clear();
    try {
      provider.close();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close provider: " + e.getMessage(), e);
    }
  }

  @Override
  public Subscription subscribe(AgentEventListener listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public boolean isDisposed() {
    return disposed;
  }

  ConversationHistory history() {
    return history;
  }

  private String run(String input) throws WorkException, InterruptedException {
    history.add(Role.USER, input);

    for (int step = 0; step < settings.maxSteps(); step++) {
      checkAborted();
      compactIfNeeded();

      LLMResponse response =
          completeWithRetry(LLMRequest.of(systemPrompt, history.toMessages()));
      String reply = response.content() == null ? "" : response.content();
      history.add(Role.ASSISTANT, reply);

      Optional<ToolCall> call;
      try {
        call = ToolCall.parse(reply);
      } catch (ToolException e) {
        history.add(Role.USER, "Tool call rejected: " + e.getMessage());
        continue;
      }
      if (call.isEmpty()) {
        return reply.isBlank() ? null : reply.strip();
      }

      checkAborted();
      history.add(Role.USER, runTool(call.get()));
    }

    throw new WorkException(
        "Agent stopped after " + settings.maxSteps() + " steps without a final answer");
  }

  private String runTool(ToolCall call) throws InterruptedException {
    emit(new AgentEvent.ToolStarted(call.tool()));
    boolean isError = false;
    String result;
    try {
      result = tools.execute(call.tool(), call.args());
    } catch (ToolException e) {
      isError = true;
      result = e.getMessage();
    } catch (RuntimeException e) {
      LOG.warn("Tool {} failed unexpectedly: {}", call.tool(), e.toString(), e);
      isError = true;
      result = e.getClass().getSimpleName() + ": " + e.getMessage();
    }
    emit(new AgentEvent.ToolEnded(call.tool(), isError));
    return (isError ? "Tool " + call.tool() + " failed:\n" : "Tool " + call.tool() + " result:\n")
        + result;
  }

  private LLMResponse completeWithRetry(LLMRequest request)
      throws WorkException, InterruptedException {
    for (int attempt = 0; ; attempt++) {
      try {
        return provider.complete(request);
      } catch (LLMException e) {
        if (!e.isRetryable() || attempt >= settings.maxRetries()) {
          throw new WorkException(e.getMessage(), e);
        }
        LOG.info(
            "Retrying {} after {} (attempt {}/{})",
            provider.getModelName(),
            e.getType(),
            attempt + 1,
            settings.maxRetries());
        emit(new AgentEvent.RetryStarted(attempt + 1, settings.maxRetries(), e.getMessage()));
        pause(settings.retryBaseDelay().toMillis() << attempt);
      }
    }
  }

  private void compactIfNeeded() {
    if (history.needsCompaction()) {
      emit(new AgentEvent.CompactionStarted("threshold"));
      int dropped = history.compact();
      LOG.debug("Compacted conversation, dropped {} messages", dropped);
    }
  }

  /** Sleeps for the back-off period, waking early if the run is aborted. */
  private void pause(long millis) throws WorkException, InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    synchronized (abortSignal) {
      while (!abortRequested) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          break;
        }
        TimeUnit.NANOSECONDS.timedWait(abortSignal, remaining);
      }
    }
    checkAborted();
  }

  private void checkAborted() throws WorkException {
    if (abortRequested) {
      throw new WorkException("Agent run was aborted");
    }
  }

  private void emit(AgentEvent event) {
    for (AgentEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        LOG.warn("Event listener failed on {}: {}", event.type(), e.getMessage(), e);
      }
    }
  }

  private String buildSystemPrompt() {
    StringBuilder sb = new StringBuilder();
    sb.append("You are a coding agent working in the directory ")
        .append(cwd)
        .append(".\n");
    if (tools.isEmpty()) {
      sb.append("You have no tools. Answer from your own knowledge.\n");
    } else {
      sb.append("You can use these tools:\n")
          .append(tools.describe())
          .append("\nTo call a tool, reply with exactly one fenced block and nothing after it:\n")
          .append("```tool\n")
          .append("{\"tool\": \"<name>\", \"args\": {...}}\n")
          .append("```\n")
          .append("The tool result is sent back to you. Call one tool per reply.\n");
    }
    sb.append("When the task is done, reply with your final answer as plain text, ")
        .append("without a tool block.");
    return sb.toString();
  }
}
