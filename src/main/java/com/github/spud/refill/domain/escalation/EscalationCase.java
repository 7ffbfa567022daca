package com.github.spud.refill.domain.escalation;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A request handed to a human reviewer. Outlives the workflow session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EscalationCase {

  private String escalationId;

  private String sessionId;

  private String reasonCode;

  private ContextPackage contextPackage;

  private TargetRole targetRole;

  private EscalationStatus status;

  private Instant createdAt;

  private Instant acknowledgedAt;

  private String acknowledgedBy;

  private Instant resolvedAt;
}
