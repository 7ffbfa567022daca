package com.github.spud.refill.domain.evaluator;

public enum VerdictOutcome {
  PASS,
  FAIL,
  REQUIRES_ESCALATION,
  UNAVAILABLE
}
