package com.github.spud.refill.domain.error;

import lombok.Getter;

/**
 * Base of the failures that are surfaced to callers
 */
@Getter
public abstract class RefillWorkflowException extends RuntimeException {

  private final ErrorKind kind;

  protected RefillWorkflowException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected RefillWorkflowException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
