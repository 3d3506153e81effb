package io.agentmcp.session;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Runs work against one session strictly one at a time, in arrival order.
 *
 * <p>Callers form a chain of tickets. Each caller swaps its own unresolved ticket in as the tail,
 * waits for the ticket it replaced, runs, and resolves its ticket on every exit path. After the
 * wait the caller re-checks that the session is still live, since it may have been removed in the
 * meantime.
 */
public final class AccessSerializer {

  /** Work run while holding the session. */
  @FunctionalInterface
  public interface Work<T> {
    T run() throws WorkException, InterruptedException;
  }

  private final AtomicReference<CompletableFuture<Void>> tail =
      new AtomicReference<>(CompletableFuture.completedFuture(null));

  /**
   * Waits for all earlier callers, then runs {@code work}.
   *
   * @param sessionId id used in the not-found error
   * @param stillLive checked after the wait; if false the work is skipped
   * @param work the unit of work
   * @return the work's result
   * @throws SessionNotFoundException if the session was removed while waiting
   * @throws WorkException if the work fails
   * @throws InterruptedException if interrupted while waiting or working
   */
  public <T> T runExclusive(String sessionId, BooleanSupplier stillLive, Work<T> work)
      throws SessionNotFoundException, WorkException, InterruptedException {
    CompletableFuture<Void> next = new CompletableFuture<>();
    CompletableFuture<Void> mustWaitFor = tail.getAndSet(next);

    try {
      mustWaitFor.get();
    } catch (InterruptedException e) {
      // Our successor may only start once our predecessor is done.
      mustWaitFor.whenComplete((ignored, error) -> next.complete(null));
      throw e;
    } catch (ExecutionException e) {
      // Tickets are only ever completed normally.
      next.complete(null);
      throw new IllegalStateException("Session ticket failed for " + sessionId, e);
    }

    try {
      if (!stillLive.getAsBoolean()) {
        throw SessionNotFoundException.evictedWhileWaiting(sessionId);
      }
      return work.run();
    } finally {
      next.complete(null);
    }
  }

  /** Whether someone currently holds or waits for this session. */
  public boolean isHeld() {
    return !tail.get().isDone();
  }
}
