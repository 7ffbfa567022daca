package com.github.spud.refill.domain.error;

/**
 * Concurrent or late mutation detected; retry from a fresh load
 */
public class StaleSessionException extends RefillWorkflowException {

  public StaleSessionException(String message) {
    super(ErrorKind.STALE_SESSION, message);
  }
}
