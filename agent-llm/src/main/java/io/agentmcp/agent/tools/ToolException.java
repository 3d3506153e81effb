package io.agentmcp.agent.tools;

/** Thrown when a tool cannot carry out a call. The message is fed back to the model. */
public class ToolException extends Exception {

  public ToolException(String message) {
    super(message);
  }

  public ToolException(String message, Throwable cause) {
    super(message, cause);
  }
}
