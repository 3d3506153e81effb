package io.agentmcp.llm;

/**
 * A failed model call, tagged with a category. The agent loop retries only the transient
 * categories ({@link #isRetryable()}); everything else ends the run.
 */
public class LLMException extends Exception {

  public enum ErrorType {
    /** LLM provider is not available or unreachable. */
    PROVIDER_UNAVAILABLE,
    /** Request timed out waiting for LLM response. */
    TIMEOUT,
    /** Request was rate limited by the provider. */
    RATE_LIMITED,
    /** Authentication failed (invalid API key, etc.). */
    AUTH_FAILED,
    /** The provider does not know the requested model. */
    MODEL_NOT_FOUND,
    /** The provider rejected the request as malformed. */
    INVALID_REQUEST,
    /** Network error occurred during communication. */
    NETWORK_ERROR
  }

  private final ErrorType type;
  private final boolean retryable;

  public LLMException(ErrorType type, String message) {
    super(message);
    this.type = type;
    this.retryable = determineRetryable(type);
  }

  public LLMException(ErrorType type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
    this.retryable = determineRetryable(type);
  }

  private static boolean determineRetryable(ErrorType type) {
    return switch (type) {
      case TIMEOUT, NETWORK_ERROR, RATE_LIMITED -> true;
      case PROVIDER_UNAVAILABLE, AUTH_FAILED, MODEL_NOT_FOUND, INVALID_REQUEST -> false;
    };
  }

  public ErrorType getType() {
    return type;
  }

  /** True for timeouts, network failures and rate limiting. */
  public boolean isRetryable() {
    return retryable;
  }
}
