package com.github.spud.refill.domain.error;

/**
 * Error classes surfaced to callers. Messages are generic and retry-safe, never patient data.
 */
public enum ErrorKind {
  INVALID_TRANSITION("This request cannot be handled at the current step."),
  STALE_SESSION("The conversation changed in the meantime. Please retry."),
  NOT_FOUND("The requested record was not found."),
  INTERNAL("Something went wrong on our side. Please retry shortly.");

  private final String userMessage;

  ErrorKind(String userMessage) {
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
