package com.github.spud.refill.domain.session;

import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.state.Directive;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import lombok.Getter;

/**
 * Side effects collected while a turn's directives are applied: transitions to audit, the prompt
 * to return and an escalation to open. Nothing here is written until the session is committed.
 */
@Getter
public class TurnLedger {

  private final List<Directive> transitions = new ArrayList<>();

  private String prompt;

  private List<DrugCandidate> candidates;

  private String escalationReason;

  private String orderId;

  private boolean cancelled;

  void recordTransition(Directive audit) {
    transitions.add(audit);
  }

  void prompt(String prompt, List<DrugCandidate> candidates) {
    this.prompt = prompt;
    this.candidates = candidates == null || candidates.isEmpty() ? null : candidates;
  }

  void requestEscalation(String reasonCode) {
    this.escalationReason = reasonCode;
  }

  void complete(String orderId) {
    this.orderId = orderId;
  }

  void cancel() {
    this.cancelled = true;
  }

  public boolean escalationRequested() {
    return escalationReason != null;
  }

  /**
   * One audit record per recorded transition, tokens assigned by step index
   */
  public List<AuditRecord> auditRecords(String sessionId, int turnSequence, Instant at,
    IntFunction<String> tokens) {
    List<AuditRecord> records = new ArrayList<>();
    for (int i = 0; i < transitions.size(); i++) {
      Directive audit = transitions.get(i);
      records.add(AuditRecord.builder()
        .sessionId(sessionId)
        .fromState(audit.getFromState())
        .toState(audit.getToState())
        .trigger(audit.getTrigger())
        .actor(audit.getActor())
        .timestamp(at)
        .turnSequence(turnSequence)
        .idempotencyToken(tokens.apply(i))
        .build());
    }
    return records;
  }
}
