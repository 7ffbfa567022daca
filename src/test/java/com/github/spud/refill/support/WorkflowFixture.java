package com.github.spud.refill.support;

import com.github.spud.refill.application.config.ResilienceConfig;
import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.escalation.EscalationCoordinator;
import com.github.spud.refill.domain.escalation.EscalationNotifier;
import com.github.spud.refill.domain.escalation.EscalationRepository;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorGateway;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.policy.CollectionAssessor;
import com.github.spud.refill.domain.policy.DefaultCircuitBreakerPolicy;
import com.github.spud.refill.domain.policy.DisambiguationPolicy;
import com.github.spud.refill.domain.session.DirectiveApplier;
import com.github.spud.refill.domain.session.SessionController;
import com.github.spud.refill.domain.session.SessionLockManager;
import com.github.spud.refill.domain.session.SessionStore;
import com.github.spud.refill.domain.session.TurnRequest;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.TransitionEngine;
import com.github.spud.refill.infrastructure.persistence.memory.InMemoryAuditLog;
import com.github.spud.refill.infrastructure.persistence.memory.InMemoryEscalationRepository;
import com.github.spud.refill.infrastructure.persistence.memory.InMemorySessionStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Full turn pipeline over in-memory stores, stub evaluators and a controllable clock
 */
public class WorkflowFixture {

  public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

  public final WorkflowProperties properties = new WorkflowProperties();
  public final MutableClock clock = new MutableClock(START);
  public final Map<EvaluatorType, StubEvaluator> evaluators = new EnumMap<>(EvaluatorType.class);
  public final List<DrugCandidate> resolverCandidates = new CopyOnWriteArrayList<>();
  public final AtomicInteger resolverCalls = new AtomicInteger();
  public final List<String> notified = new CopyOnWriteArrayList<>();

  public final SessionStore sessionStore;
  public final AuditLog auditLog;
  public final EscalationRepository escalationRepository = new InMemoryEscalationRepository();
  public final TransitionEngine engine;
  public final EscalationCoordinator coordinator;
  public final SessionController controller;

  public WorkflowFixture() {
    this(null);
  }

  /**
   * @param sessionStore store to use, or null for the in-memory one
   */
  public WorkflowFixture(SessionStore sessionStore) {
    this(sessionStore, null);
  }

  /**
   * @param auditLog audit log to use, or null for the in-memory one
   */
  public WorkflowFixture(SessionStore sessionStore, AuditLog auditLog) {
    for (EvaluatorType type : EvaluatorType.values()) {
      if (type != EvaluatorType.DISAMBIGUATION) {
        evaluators.put(type, new StubEvaluator(type));
      }
    }
    resolverCandidates.add(candidate("Lisinopril", "RX29046", 0.98));

    this.sessionStore = sessionStore != null ? sessionStore : new InMemorySessionStore(clock);
    this.auditLog = auditLog != null ? auditLog : new InMemoryAuditLog();
    DisambiguationPolicy disambiguationPolicy = new DisambiguationPolicy(properties);
    engine = new TransitionEngine(new DefaultCircuitBreakerPolicy(properties),
      new CollectionAssessor(disambiguationPolicy, properties), properties);
    DirectiveApplier applier = new DirectiveApplier(properties);
    EvaluatorGateway gateway = new EvaluatorGateway(new ArrayList<>(evaluators.values()),
      freeText -> {
        resolverCalls.incrementAndGet();
        return List.copyOf(resolverCandidates);
      },
      ResilienceConfig.evaluatorRegistry(properties.getAvailability()), properties);
    SessionLockManager lockManager = new SessionLockManager(properties);
    EscalationNotifier notifier = escalationCase -> notified.add(escalationCase.getEscalationId());

    coordinator = new EscalationCoordinator(escalationRepository, notifier, this.sessionStore,
      this.auditLog, engine, applier, lockManager, properties, clock);
    controller = new SessionController(this.sessionStore, this.auditLog, engine, applier, gateway,
      coordinator, lockManager, properties, clock);
  }

  public StubEvaluator evaluator(EvaluatorType type) {
    return evaluators.get(type);
  }

  public int evaluatorCalls() {
    return evaluators.values().stream().mapToInt(StubEvaluator::calls).sum()
      + resolverCalls.get();
  }

  public static DrugCandidate candidate(String name, String code, double similarity) {
    return DrugCandidate.builder().name(name).code(code).similarity(similarity).build();
  }

  public static Map<String, String> completeRequest() {
    return Map.of(
      "patient_id", "1234567",
      "drug_name", "Lisinopril",
      "dose", "10mg",
      "quantity", "30");
  }

  public static TurnRequest turn(String sessionId, int sequence, double confidence,
    Map<String, String> entities) {
    return turn(sessionId, sequence, Intent.REQUEST_REFILL, confidence, entities);
  }

  public static TurnRequest turn(String sessionId, int sequence, Intent intent,
    double confidence, Map<String, String> entities) {
    return TurnRequest.builder()
      .sessionId(sessionId)
      .rawUtterance("refill please")
      .intent(intent)
      .confidence(confidence)
      .extractedEntities(entities)
      .turnSequence(sequence)
      .build();
  }
}
