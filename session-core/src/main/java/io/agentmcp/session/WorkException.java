package io.agentmcp.session;

/** Thrown when a {@link WorkHandle} fails to complete a unit of work. */
public class WorkException extends Exception {

  public WorkException(String message) {
    super(message);
  }

  public WorkException(String message, Throwable cause) {
    super(message, cause);
  }
}
