package com.github.spud.refill.domain.escalation;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.audit.AppendResult;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.error.EscalationNotFoundException;
import com.github.spud.refill.domain.error.InvalidTransitionException;
import com.github.spud.refill.domain.error.StaleSessionException;
import com.github.spud.refill.domain.error.StoreUnavailableException;
import com.github.spud.refill.domain.session.DirectiveApplier;
import com.github.spud.refill.domain.session.SessionLockManager;
import com.github.spud.refill.domain.session.SessionStore;
import com.github.spud.refill.domain.session.TransitionEvent;
import com.github.spud.refill.domain.session.TurnLedger;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.TransitionEngine;
import com.github.spud.refill.domain.state.TransitionResult;
import com.github.spud.refill.domain.state.WorkflowState;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Opens escalation cases and drives the hand-off to completion. Acknowledgment is the only path
 * from ESCALATE_HANDOFF to ESCALATION_COMPLETE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationCoordinator {

  private final EscalationRepository repository;
  private final EscalationNotifier notifier;
  private final SessionStore sessionStore;
  private final AuditLog auditLog;
  private final TransitionEngine engine;
  private final DirectiveApplier applier;
  private final SessionLockManager lockManager;
  private final WorkflowProperties properties;
  private final Clock clock;

  /**
   * Store and announce the case for a session that was just committed in ESCALATE_HANDOFF.
   * Idempotent by {@link WorkflowSession#getEscalationId()}.
   */
  public EscalationCase open(WorkflowSession session) {
    String escalationId = session.getEscalationId();
    String reasonCode = session.getEscalationReason();
    EscalationCase escalationCase = EscalationCase.builder()
      .escalationId(escalationId)
      .sessionId(session.getSessionId())
      .reasonCode(reasonCode)
      .contextPackage(ContextPackageAssembler.assemble(session))
      .targetRole(EscalationRoutingTable.route(reasonCode))
      .status(EscalationStatus.PENDING)
      .createdAt(clock.instant())
      .build();

    if (!repository.insertIfAbsent(escalationCase)) {
      log.debug("Escalation already open: escalationId={}", escalationId);
      return repository.findById(escalationId).orElse(escalationCase);
    }
    log.info("Escalation opened: escalationId={}, sessionId={}, reason={}, role={}",
      escalationId, session.getSessionId(), reasonCode, escalationCase.getTargetRole());
    notifier.notify(escalationCase);
    return escalationCase;
  }

  /**
   * Reviewer picked the case up. Completes the session's hand-off when the session is still
   * live; repeated calls return the case unchanged.
   */
  public EscalationCase acknowledge(String escalationId, String actor) {
    EscalationCase escalationCase = find(escalationId);
    if (escalationCase.getStatus() != EscalationStatus.PENDING) {
      log.debug("Escalation {} already {}", escalationId, escalationCase.getStatus());
      return escalationCase;
    }

    return lockManager.withLock(escalationCase.getSessionId(), () -> {
      Instant now = clock.instant();
      try {
        completeHandoff(escalationCase, now);
        if (!repository.updateStatus(escalationId, EscalationStatus.PENDING,
          EscalationStatus.ACKNOWLEDGED, actor, now)) {
          log.debug("Escalation {} acknowledged concurrently", escalationId);
        } else {
          log.info("Escalation acknowledged: escalationId={}", escalationId);
        }
      } catch (DataAccessException e) {
        log.error("Failed to record acknowledgment: escalationId={}", escalationId, e);
        throw new StoreUnavailableException("Acknowledgment not recorded", e);
      }
      return find(escalationId);
    });
  }

  /**
   * Close an acknowledged case
   */
  public EscalationCase resolve(String escalationId, String actor) {
    EscalationCase escalationCase = find(escalationId);
    switch (escalationCase.getStatus()) {
      case RESOLVED:
        return escalationCase;
      case PENDING:
        throw new InvalidTransitionException(
          "Escalation " + escalationId + " must be acknowledged before it is resolved");
      default:
        try {
          if (repository.updateStatus(escalationId, EscalationStatus.ACKNOWLEDGED,
            EscalationStatus.RESOLVED, actor, clock.instant())) {
            log.info("Escalation resolved: escalationId={}", escalationId);
          }
        } catch (DataAccessException e) {
          log.error("Failed to record resolution: escalationId={}", escalationId, e);
          throw new StoreUnavailableException("Resolution not recorded", e);
        }
        return find(escalationId);
    }
  }

  public EscalationCase find(String escalationId) {
    return repository.findById(escalationId)
      .orElseThrow(() -> new EscalationNotFoundException(escalationId));
  }

  public List<EscalationCase> listPending() {
    return repository.findByStatus(EscalationStatus.PENDING);
  }

  private void completeHandoff(EscalationCase escalationCase, Instant now) {
    String sessionId = escalationCase.getSessionId();
    Optional<WorkflowSession> stored = sessionStore.get(sessionId);
    if (stored.isEmpty()) {
      log.warn("Session expired before acknowledgment: sessionId={}, escalationId={}",
        sessionId, escalationCase.getEscalationId());
      return;
    }
    WorkflowSession session = stored.get();
    String token = AuditLog.acknowledgeToken(sessionId, escalationCase.getEscalationId());
    boolean sameHandoff = escalationCase.getEscalationId().equals(session.getEscalationId());
    if (sameHandoff && session.getCurrentState() == WorkflowState.ESCALATION_COMPLETE) {
      // committed by an earlier attempt whose audit append failed
      log.info("Hand-off already committed, re-appending its audit record: sessionId={}",
        sessionId);
      appendHandoffAudit(List.of(handoffRecord(session, token)), token);
      return;
    }
    if (session.getCurrentState() != WorkflowState.ESCALATE_HANDOFF || !sameHandoff) {
      log.warn("Session not waiting for this hand-off: sessionId={}, state={}",
        sessionId, session.getCurrentState());
      return;
    }

    WorkflowSession working = session.copy();
    TransitionResult result = engine.advance(working, TransitionEvent.system(
      Intent.HANDOFF_ACKNOWLEDGED, 1.0, session.getLastTurnSequence()));
    TurnLedger ledger = new TurnLedger();
    applier.apply(working, result, ledger);
    working.setUpdatedAt(now);
    working.setTtlDeadline(now.plus(properties.getSessionTtl()));
    working.setVersion(session.getVersion() + 1);

    if (!sessionStore.compareAndPut(working, session.getVersion(), properties.getSessionTtl())) {
      log.warn("Version conflict on acknowledgment: sessionId={}, expectedVersion={}",
        sessionId, session.getVersion());
      throw new StaleSessionException("Session changed during acknowledgment: " + sessionId);
    }

    appendHandoffAudit(ledger.auditRecords(sessionId, session.getLastTurnSequence(), now,
      step -> token), token);
    log.info("Hand-off complete: sessionId={}, {} -> {}", sessionId, result.getFromState(),
      result.getNextState());
  }

  private void appendHandoffAudit(List<AuditRecord> records, String token) {
    for (AuditRecord record : records) {
      if (auditLog.append(record, token) == AppendResult.DUPLICATE_TOKEN) {
        log.warn("Duplicate audit token ignored: {}", token);
      }
    }
  }

  private static AuditRecord handoffRecord(WorkflowSession session, String token) {
    return AuditRecord.builder()
      .sessionId(session.getSessionId())
      .fromState(WorkflowState.ESCALATE_HANDOFF)
      .toState(WorkflowState.ESCALATION_COMPLETE)
      .trigger(Intent.HANDOFF_ACKNOWLEDGED.getWireName())
      .actor(TransitionEngine.COORDINATOR_ACTOR)
      .timestamp(session.getUpdatedAt())
      .turnSequence(session.getLastTurnSequence())
      .idempotencyToken(token)
      .build();
  }
}
