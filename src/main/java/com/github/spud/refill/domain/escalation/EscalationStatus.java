package com.github.spud.refill.domain.escalation;

public enum EscalationStatus {
  PENDING,
  ACKNOWLEDGED,
  RESOLVED
}
