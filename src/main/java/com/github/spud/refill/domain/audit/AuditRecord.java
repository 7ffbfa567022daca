package com.github.spud.refill.domain.audit;

import com.github.spud.refill.domain.state.WorkflowState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable record of one state transition
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AuditRecord {

  String sessionId;

  WorkflowState fromState;

  WorkflowState toState;

  /**
   * Intent wire name for nominal transitions, reason code for forced ones
   */
  String trigger;

  /**
   * Component or evaluator that decided the transition
   */
  String actor;

  Instant timestamp;

  int turnSequence;

  String idempotencyToken;
}
