package com.github.spud.refill.domain.escalation;

/**
 * Reviewer role an escalation is routed to
 */
public enum TargetRole {
  PHYSICIAN,
  PHYSICIAN_ASSISTANT,
  PHARMACIST
}
