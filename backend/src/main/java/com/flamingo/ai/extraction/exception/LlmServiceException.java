package com.flamingo.ai.extraction.exception;

import dev.langchain4j.exception.RateLimitException;

/**
 * Exception thrown when a model call fails outside of a per-agent boundary, e.g. during discovery.
 * Per-agent extraction failures are absorbed into the record instead.
 */
public class LlmServiceException extends RuntimeException {

  private static final String UNAVAILABLE_MESSAGE =
      "AI service is temporarily unavailable. Please try again later.";
  private static final String RATE_LIMITED_MESSAGE =
      "Service is temporarily busy. Please try again in a moment.";

  private final boolean rateLimited;

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  /**
   * Wraps the failure of a model call. The exception is marked rate limited when the provider
   * rejected the call with a rate limit anywhere in the cause chain.
   *
   * @param context what was being attempted, e.g. "Discovery agent failed"
   * @param cause the failure
   */
  public static LlmServiceException fromModelFailure(String context, Throwable cause) {
    return new LlmServiceException(
        context + ": " + cause.getMessage(), cause, isRateLimit(cause));
  }

  private static boolean isRateLimit(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof RateLimitException) {
        return true;
      }
    }
    return false;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return rateLimited ? RATE_LIMITED_MESSAGE : UNAVAILABLE_MESSAGE;
  }
}
