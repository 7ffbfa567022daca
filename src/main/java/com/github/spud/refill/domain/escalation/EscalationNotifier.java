package com.github.spud.refill.domain.escalation;

/**
 * Outbound reviewer channel
 */
public interface EscalationNotifier {

  void notify(EscalationCase escalationCase);
}
