package com.github.spud.refill.domain.error;

/**
 * Session store or audit log could not complete a write; the turn failed and is safe to retry
 */
public class StoreUnavailableException extends RefillWorkflowException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
