package com.github.spud.refill.domain.error;

public class EscalationNotFoundException extends RefillWorkflowException {

  public EscalationNotFoundException(String escalationId) {
    super(ErrorKind.NOT_FOUND, "Escalation not found: " + escalationId);
  }
}
