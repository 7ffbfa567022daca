package com.github.spud.refill.domain.session;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.audit.AppendResult;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.error.InvalidTransitionException;
import com.github.spud.refill.domain.error.SessionNotFoundException;
import com.github.spud.refill.domain.error.StaleSessionException;
import com.github.spud.refill.domain.error.StoreUnavailableException;
import com.github.spud.refill.domain.escalation.EscalationCoordinator;
import com.github.spud.refill.domain.evaluator.EvaluationBatch;
import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorGateway;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.state.Directive;
import com.github.spud.refill.domain.state.DirectiveType;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.TransitionEngine;
import com.github.spud.refill.domain.state.TransitionResult;
import com.github.spud.refill.domain.state.WorkflowState;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs one conversational turn end to end under the session's lock
 * <ol>
 *   <li>load the session, or start one in COLLECT_REQUEST</li>
 *   <li>answer a replayed turn from the recorded response</li>
 *   <li>advance, gathering evaluator verdicts on demand, through automatic states</li>
 *   <li>compare-and-put the session with a refreshed TTL</li>
 *   <li>append the turn's audit records, then open the escalation case if one was requested</li>
 * </ol>
 * A cancelled request is audited and its session deleted instead of committed.
 * If the session write fails nothing is audited and the turn is reported as failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionController {

  /**
   * Evaluator rounds within one engine step: drug resolution, then identity
   */
  private static final int MAX_EVALUATION_ROUNDS = 3;

  private final SessionStore sessionStore;
  private final AuditLog auditLog;
  private final TransitionEngine engine;
  private final DirectiveApplier applier;
  private final EvaluatorGateway gateway;
  private final EscalationCoordinator coordinator;
  private final SessionLockManager lockManager;
  private final WorkflowProperties properties;
  private final Clock clock;

  public TurnResponse handleTurn(TurnRequest request) {
    if (!StringUtils.hasText(request.getSessionId())) {
      throw new IllegalArgumentException("sessionId is required");
    }
    if (request.getIntent() == null || request.getIntent().isSystem()) {
      throw new InvalidTransitionException(
        "Intent not accepted from a conversational turn: " + request.getIntent());
    }
    return lockManager.withLock(request.getSessionId(), () -> processTurn(request));
  }

  /**
   * Current session, without evaluating anything
   */
  public WorkflowSession findSession(String sessionId) {
    return load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  public List<AuditRecord> auditTrail(String sessionId) {
    List<AuditRecord> records = auditLog.findBySession(sessionId);
    if (records.isEmpty() && load(sessionId).isEmpty()) {
      throw new SessionNotFoundException(sessionId);
    }
    return records;
  }

  private TurnResponse processTurn(TurnRequest request) {
    String sessionId = request.getSessionId();
    int turnSequence = request.getTurnSequence();
    Instant now = clock.instant();

    WorkflowSession session = load(sessionId)
      .orElseGet(() -> WorkflowSession.start(sessionId, now));

    if (session.getLastResponse() != null) {
      if (turnSequence == session.getLastTurnSequence()) {
        return replay(session);
      }
      if (turnSequence < session.getLastTurnSequence()) {
        log.warn("Out-of-order turn: sessionId={}, turnSequence={}, lastTurnSequence={}",
          sessionId, turnSequence, session.getLastTurnSequence());
        throw new StaleSessionException("Turn " + turnSequence + " is older than the last "
          + "committed turn of session " + sessionId);
      }
    }

    TransitionEvent event = TransitionEvent.fromTurn(request);
    if (request.getIntent() == Intent.STATUS_INQUIRY) {
      TransitionResult inquiry = engine.advance(session, event);
      if (!inquiry.isStateChange()) {
        return status(session, inquiry);
      }
    }

    WorkflowSession working = session.copy();
    TurnLedger ledger = new TurnLedger();
    runCascade(working, event, ledger);
    if (ledger.isCancelled()) {
      return cancel(working, ledger, turnSequence, now);
    }

    if (ledger.escalationRequested()) {
      working.setEscalationId(UUID.randomUUID().toString());
      working.setEscalationReason(ledger.getEscalationReason());
    }
    recordHistory(working, request);

    TurnResponse response = TurnResponse.builder()
      .sessionId(sessionId)
      .nextState(working.getCurrentState())
      .userPrompt(ledger.getPrompt())
      .escalationId(ledger.escalationRequested() ? working.getEscalationId() : null)
      .orderId(ledger.getOrderId())
      .candidates(ledger.getCandidates())
      .build();
    List<AuditRecord> audit = ledger.auditRecords(sessionId, turnSequence, now,
      step -> AuditLog.turnToken(sessionId, turnSequence, step));

    working.setLastTurnSequence(turnSequence);
    working.setLastResponse(response);
    working.setLastTurnAudit(audit);
    working.setUpdatedAt(now);
    working.setTtlDeadline(now.plus(properties.getSessionTtl()));
    working.setVersion(session.getVersion() + 1);

    commit(working, session.getVersion());
    appendAudit(audit);
    if (ledger.escalationRequested()) {
      openEscalation(working);
    }

    log.info("Turn committed: sessionId={}, turnSequence={}, {} -> {}, escalation={}",
      sessionId, turnSequence, session.getCurrentState(), working.getCurrentState(),
      ledger.getEscalationReason());
    return response;
  }

  private void runCascade(WorkflowSession working, TransitionEvent turnEvent, TurnLedger ledger) {
    TransitionEvent event = turnEvent;
    for (int step = 0; step < properties.getMaxCascadeSteps(); step++) {
      TransitionResult result = evaluate(working, event);
      applier.apply(working, result, ledger);
      result.breakerReason().ifPresent(reason ->
        log.info("Circuit breaker fired: sessionId={}, state={}, reason={}",
          working.getSessionId(), result.getFromState(), reason));

      WorkflowState next = result.getNextState();
      if (!result.isStateChange() || !WorkflowState.isAutomatic(next)) {
        return;
      }
      Intent intent = next == WorkflowState.PA_APPROVAL_NEEDED
        ? Intent.ROUTING_RESOLVED : Intent.CONTINUE;
      event = TransitionEvent.system(intent, turnEvent.getConfidence(),
        turnEvent.getTurnSequence());
    }
    log.warn("Cascade budget exhausted: sessionId={}, state={}", working.getSessionId(),
      working.getCurrentState());
  }

  /**
   * Advance, fetching the verdicts the engine asks for until it can decide
   */
  private TransitionResult evaluate(WorkflowSession working, TransitionEvent initial) {
    TransitionEvent event = initial;
    TransitionResult result = engine.advance(working, event);
    int rounds = 0;
    while (result.has(DirectiveType.INVOKE_EVALUATOR)) {
      if (rounds++ >= MAX_EVALUATION_ROUNDS) {
        throw new IllegalStateException("Evaluator rounds exhausted in " + result.getFromState());
      }
      Set<EvaluatorType> types = EnumSet.noneOf(EvaluatorType.class);
      for (Directive directive : result.directivesOf(DirectiveType.INVOKE_EVALUATOR)) {
        types.add(directive.getEvaluator());
      }
      EvaluationBatch batch = gateway.invoke(types, evaluationRequest(working, event));
      event = event.withEvaluation(batch);
      result = engine.advance(working, event);
    }
    return result;
  }

  private EvaluationRequest evaluationRequest(WorkflowSession working, TransitionEvent event) {
    Map<String, String> entities = new TreeMap<>(working.getCollectedEntities());
    entities.putAll(event.getExtractedEntities());
    String drugName = entities.get(RefillSlots.DRUG_NAME);
    String drugCode = working.getResolvedDrug() != null && drugName != null
      && working.getResolvedDrug().getName().equalsIgnoreCase(drugName)
      ? working.getResolvedDrug().getCode() : null;

    return EvaluationRequest.builder()
      .sessionId(working.getSessionId())
      .patientRef(entities.get(RefillSlots.PATIENT_ID))
      .drugName(drugName)
      .drugCode(drugCode)
      .dose(entities.get(RefillSlots.DOSE))
      .quantity(entities.get(RefillSlots.QUANTITY))
      .frequency(entities.get(RefillSlots.FREQUENCY))
      .build();
  }

  private void recordHistory(WorkflowSession working, TurnRequest request) {
    List<Double> history = working.getConfidenceHistory();
    history.add(request.getConfidence() == null ? 0.0 : request.getConfidence());
    while (history.size() > properties.getConfidenceHistorySize()) {
      history.remove(0);
    }

    if (StringUtils.hasText(request.getRawUtterance())) {
      String utterance = request.getRawUtterance().trim();
      if (utterance.length() > properties.getExcerptMaxChars()) {
        utterance = utterance.substring(0, properties.getExcerptMaxChars());
      }
      List<String> excerpt = working.getConversationExcerpt();
      excerpt.add(utterance);
      while (excerpt.size() > properties.getExcerptSize()) {
        excerpt.remove(0);
      }
    }
  }

  private TurnResponse replay(WorkflowSession session) {
    log.info("Replayed turn: sessionId={}, turnSequence={}", session.getSessionId(),
      session.getLastTurnSequence());
    appendAudit(session.getLastTurnAudit());
    TurnResponse response = session.getLastResponse();
    if (response.getEscalationId() != null) {
      openEscalation(session);
    }
    return response;
  }

  private TurnResponse cancel(WorkflowSession working, TurnLedger ledger, int turnSequence,
    Instant now) {
    String sessionId = working.getSessionId();
    appendAudit(ledger.auditRecords(sessionId, turnSequence, now,
      step -> AuditLog.turnToken(sessionId, turnSequence, step)));
    try {
      sessionStore.delete(sessionId);
    } catch (DataAccessException e) {
      log.error("Failed to discard cancelled session: sessionId={}", sessionId, e);
      throw new StoreUnavailableException("Session store unavailable", e);
    }
    log.info("Request cancelled: sessionId={}, turnSequence={}, state={}", sessionId,
      turnSequence, working.getCurrentState());
    return TurnResponse.builder()
      .sessionId(sessionId)
      .nextState(working.getCurrentState())
      .userPrompt(ledger.getPrompt())
      .cancelled(Boolean.TRUE)
      .build();
  }

  private TurnResponse status(WorkflowSession session, TransitionResult result) {
    String prompt = result.directivesOf(DirectiveType.EMIT_PROMPT).stream()
      .map(Directive::getPrompt)
      .findFirst()
      .orElse(null);
    return TurnResponse.builder()
      .sessionId(session.getSessionId())
      .nextState(session.getCurrentState())
      .userPrompt(prompt)
      .escalationId(session.getCurrentState() == WorkflowState.ESCALATE_HANDOFF
        ? session.getEscalationId() : null)
      .orderId(session.getOrderId())
      .build();
  }

  private Optional<WorkflowSession> load(String sessionId) {
    try {
      return sessionStore.get(sessionId);
    } catch (DataAccessException e) {
      log.error("Failed to load session: sessionId={}", sessionId, e);
      throw new StoreUnavailableException("Session store unavailable", e);
    }
  }

  private void commit(WorkflowSession working, long expectedVersion) {
    boolean written;
    try {
      written = sessionStore.compareAndPut(working, expectedVersion, properties.getSessionTtl());
    } catch (DataAccessException e) {
      log.error("Failed to persist session: sessionId={}", working.getSessionId(), e);
      throw new StoreUnavailableException("Session store unavailable", e);
    }
    if (!written) {
      log.warn("Version conflict: sessionId={}, expectedVersion={}", working.getSessionId(),
        expectedVersion);
      throw new StaleSessionException("Session " + working.getSessionId()
        + " was modified concurrently");
    }
  }

  private void appendAudit(List<AuditRecord> records) {
    for (AuditRecord record : records) {
      AppendResult result;
      try {
        result = auditLog.append(record, record.getIdempotencyToken());
      } catch (DataAccessException e) {
        log.error("Failed to append audit record: token={}", record.getIdempotencyToken(), e);
        throw new StoreUnavailableException("Audit log unavailable", e);
      }
      if (result == AppendResult.DUPLICATE_TOKEN) {
        log.warn("Duplicate audit token ignored: {}", record.getIdempotencyToken());
      }
    }
  }

  private void openEscalation(WorkflowSession session) {
    try {
      coordinator.open(session);
    } catch (DataAccessException e) {
      log.error("Failed to open escalation: escalationId={}", session.getEscalationId(), e);
      throw new StoreUnavailableException("Escalation store unavailable", e);
    }
  }
}
