package com.github.spud.refill.domain.error;

import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.WorkflowState;

/**
 * The intent is not accepted in the session's current state. Nothing was mutated.
 */
public class InvalidTransitionException extends RefillWorkflowException {

  public InvalidTransitionException(WorkflowState state, Intent intent) {
    super(ErrorKind.INVALID_TRANSITION,
      "Intent " + (intent == null ? "null" : intent.getWireName()) + " not accepted in state "
        + state);
  }

  public InvalidTransitionException(String message) {
    super(ErrorKind.INVALID_TRANSITION, message);
  }
}
