package com.github.spud.refill.domain.error;

public class SessionNotFoundException extends RefillWorkflowException {

  public SessionNotFoundException(String sessionId) {
    super(ErrorKind.NOT_FOUND, "Session not found: " + sessionId);
  }
}
