package io.agentmcp.llm;

/** Thrown when a provider/model pair cannot be turned into a usable provider. */
public class ModelResolutionException extends Exception {

  public ModelResolutionException(String message) {
    super(message);
  }

  public ModelResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
