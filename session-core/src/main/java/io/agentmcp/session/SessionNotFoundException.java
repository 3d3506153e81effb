package io.agentmcp.session;

/**
 * Thrown when a session id does not refer to a live session: it was never created, has expired,
 * or was evicted.
 *
 * <p>Messages always start with {@value #PREFIX} so clients can recognise the condition.
 */
public class SessionNotFoundException extends Exception {

  public static final String PREFIX = "Session not found: ";

  private final String sessionId;

  private SessionNotFoundException(String sessionId, String detail) {
    super(PREFIX + sessionId + ". " + detail);
    this.sessionId = sessionId;
  }

  /** The session is unknown to the registry. */
  public static SessionNotFoundException missing(String sessionId) {
    return new SessionNotFoundException(
        sessionId, "It may have expired or been cleaned up. Start a new session.");
  }

  /** The session was removed while the caller waited for its turn. */
  public static SessionNotFoundException evictedWhileWaiting(String sessionId) {
    return new SessionNotFoundException(
        sessionId, "It was evicted while waiting. Start a new session.");
  }

  public String getSessionId() {
    return sessionId;
  }
}
