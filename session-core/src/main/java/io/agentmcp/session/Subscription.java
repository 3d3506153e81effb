package io.agentmcp.session;

/**
 * Handle returned by {@link WorkHandle#subscribe(AgentEventListener)}. Cancelling may throw;
 * callers that clean up must guard the call.
 */
@FunctionalInterface
public interface Subscription {

  void unsubscribe();

  /** A subscription with nothing to cancel. */
  static Subscription none() {
    return () -> {};
  }
}
