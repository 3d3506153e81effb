package io.agentmcp.session;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The long-lived unit of work behind a session.
 *
 * <p>Implementations accept prompts one at a time. The registry never assumes {@link #cancel()} or
 * {@link #release()} are safe to call: both may throw, and {@code cancel()} may fail
 * asynchronously.
 */
public interface WorkHandle {

  /**
   * Whether a submission is currently in flight. Busy handles are never evicted to make room for a
   * new session.
   */
  boolean isBusy();

  /**
   * Runs one unit of work.
   *
   * @param input prompt text
   * @return the terminal text result, or {@code null} if the work produced none
   * @throws WorkException if the work fails
   * @throws InterruptedException if the calling thread is interrupted
   */
  String submit(String input) throws WorkException, InterruptedException;

  /** Text produced by the most recent successful submission. */
  Optional<String> lastOutputText();

  /**
   * Requests that in-flight work stop. Best effort.
   *
   * @return future completing once the in-flight work has ended
   */
  CompletableFuture<Void> cancel();

  /** Frees all resources held by this handle. */
  void release();

  /**
   * Registers a lifecycle event listener.
   *
   * @param listener receiver of events
   * @return subscription cancelling the registration
   */
  Subscription subscribe(AgentEventListener listener);
}
