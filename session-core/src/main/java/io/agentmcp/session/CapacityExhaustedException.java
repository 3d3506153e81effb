package io.agentmcp.session;

/**
 * Thrown by {@link SessionRegistry#put} when the registry is full and every stored session is busy.
 * The rejected record is not stored; the caller still owns it and must dispose it.
 */
public class CapacityExhaustedException extends Exception {

  public static final String PREFIX = "Maximum sessions";

  private final int maxSessions;

  public CapacityExhaustedException(int maxSessions) {
    super(PREFIX + " (" + maxSessions + ") reached and all are active. Try again later.");
    this.maxSessions = maxSessions;
  }

  public int getMaxSessions() {
    return maxSessions;
  }
}
