package com.github.spud.refill.domain.escalation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EscalationRepository {

  /**
   * @return false when a case with the same id already exists
   */
  boolean insertIfAbsent(EscalationCase escalationCase);

  Optional<EscalationCase> findById(String escalationId);

  /**
   * Cases in the given status, oldest first
   */
  List<EscalationCase> findByStatus(EscalationStatus status);

  /**
   * Move a case from {@code expected} to {@code next}. ACKNOWLEDGED records the actor and time as
   * the acknowledgment, RESOLVED records the time as the resolution.
   *
   * @return false when the case was not in {@code expected}
   */
  boolean updateStatus(String escalationId, EscalationStatus expected, EscalationStatus next,
    String actor, Instant at);
}
