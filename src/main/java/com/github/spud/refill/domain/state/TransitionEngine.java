package com.github.spud.refill.domain.state;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.error.InvalidTransitionException;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.policy.BreakerContext;
import com.github.spud.refill.domain.policy.CircuitBreakerPolicy;
import com.github.spud.refill.domain.policy.CollectionAssessment;
import com.github.spud.refill.domain.policy.CollectionAssessor;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.domain.session.RefillSlots;
import com.github.spud.refill.domain.session.TransitionEvent;
import com.github.spud.refill.domain.session.WorkflowSession;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 状态转换引擎 - 基于 {@link TransitionTable} 的纯函数
 * <p>
 * 只读取会话，所有变更以 {@link Directive} 的形式交给调用方执行。
 * 除 ESCALATE_HANDOFF 与终态外，熔断策略最先执行，早于意图校验。
 * 缺少评估结果时返回 INVOKE_EVALUATOR 指令且不改变状态，调用方取回结果后再次推进。
 */
@Component
@RequiredArgsConstructor
public class TransitionEngine {

  public static final String ENGINE_ACTOR = "transition-engine";
  public static final String BREAKER_ACTOR = "circuit-breaker-policy";
  public static final String COORDINATOR_ACTOR = "escalation-coordinator";

  private final CircuitBreakerPolicy breakerPolicy;
  private final CollectionAssessor assessor;
  private final WorkflowProperties properties;

  public TransitionResult advance(WorkflowSession session, TransitionEvent event) {
    WorkflowState state = session.getCurrentState();
    Intent intent = event.getIntent();
    if (intent == null) {
      throw new InvalidTransitionException(state, null);
    }
    boolean accepted = TransitionTable.accepts(state, intent);

    CollectionAssessment assessment =
      state == WorkflowState.COLLECT_REQUEST && accepted && !intent.isInformational()
        ? assessor.assess(session, event) : null;
    BreakerContext context = BreakerContext.builder()
      .state(state)
      .session(session)
      .event(event)
      .assessment(assessment)
      .clarifySlot(projectedClarifySlot(state, event, assessment))
      .build();

    // 熔断优先于常规映射（状态查询与取消同样适用）
    Optional<String> breaker = breakerPolicy.evaluate(context);
    if (breaker.isPresent()) {
      return tripBreaker(state, assessment, breaker.get());
    }

    if (!accepted) {
      throw new InvalidTransitionException(state, intent);
    }
    if (intent == Intent.STATUS_INQUIRY) {
      return result(state, state, List.of(Directive.prompt(Prompts.status(state))), null);
    }
    if (intent == Intent.CANCEL_REQUEST) {
      return result(state, state, List.of(
        Directive.audit(state, state, intent.getWireName(), ENGINE_ACTOR),
        Directive.cancel(),
        Directive.prompt(Prompts.cancelled())), null);
    }

    switch (state) {
      case COLLECT_REQUEST:
        return collect(event, assessment);
      case SAFETY_CHECK:
        return safetyCheck(session, event);
      case BACKEND_CHECK:
        return backendCheck(event);
      case PA_APPROVAL_NEEDED:
        return escalate(state, ReasonCodes.PRIOR_AUTHORIZATION_REQUIRED, intent.getWireName(),
          ENGINE_ACTOR, new ArrayList<>());
      case ESCALATE_HANDOFF:
        return result(state, WorkflowState.ESCALATION_COMPLETE, List.of(
          Directive.audit(state, WorkflowState.ESCALATION_COMPLETE, intent.getWireName(),
            COORDINATOR_ACTOR),
          Directive.prompt(Prompts.handoffAcknowledged())), null);
      default:
        throw new InvalidTransitionException(state, intent);
    }
  }

  private TransitionResult collect(TransitionEvent event, CollectionAssessment assessment) {
    WorkflowState state = WorkflowState.COLLECT_REQUEST;
    List<Directive> directives = new ArrayList<>();
    addCollectionUpdates(directives, assessment);

    if (!assessment.getRequiredEvaluators().isEmpty()) {
      assessment.getRequiredEvaluators().forEach(t -> directives.add(Directive.invoke(t)));
      return result(state, state, directives, null);
    }
    String slot = assessment.getClarifySlot();
    if (slot != null) {
      List<DrugCandidate> candidates = RefillSlots.DRUG_NAME.equals(slot)
        ? assessment.getPresentedCandidates() : List.of();
      String prompt = candidates.isEmpty() ? Prompts.clarify(slot) : Prompts.chooseDrug(candidates);
      directives.add(Directive.incrementRetry(slot));
      directives.add(Directive.clarify(slot, prompt, candidates));
      return result(state, state, directives, null);
    }
    if (assessment.isReady()) {
      directives.add(Directive.audit(state, WorkflowState.SAFETY_CHECK,
        event.getIntent().getWireName(), ENGINE_ACTOR));
      directives.add(Directive.prompt(Prompts.checkingSafety()));
      return result(state, WorkflowState.SAFETY_CHECK, directives, null);
    }
    return escalate(state, assessment.getBlockedReason(), assessment.getBlockedReason(),
      ENGINE_ACTOR, directives);
  }

  private TransitionResult safetyCheck(WorkflowSession session, TransitionEvent event) {
    WorkflowState state = WorkflowState.SAFETY_CHECK;
    List<Directive> directives = new ArrayList<>();
    double confidence = event.effectiveConfidence();

    if (confidence < properties.getClarifyConfidence()) {
      directives.add(Directive.incrementRetry(RefillSlots.INTENT));
      directives.add(Directive.clarify(RefillSlots.INTENT, Prompts.clarify(RefillSlots.INTENT),
        List.of()));
      return result(state, state, directives, null);
    }
    if (session.retryCount(RefillSlots.INTENT) > 0) {
      directives.add(Directive.resetRetry(RefillSlots.INTENT));
    }

    List<EvaluatorType> missing = new ArrayList<>();
    for (EvaluatorType type : EvaluatorType.SAFETY_CHECKS) {
      if (!event.hasVerdict(type)) {
        missing.add(type);
      }
    }
    if (!missing.isEmpty()) {
      missing.forEach(t -> directives.add(Directive.invoke(t)));
      return result(state, state, directives, null);
    }

    for (EvaluatorType type : EvaluatorType.SAFETY_CHECKS) {
      EvaluatorVerdict verdict = event.getVerdicts().get(type);
      if (!verdict.isPass()) {
        return escalate(state, verdict.getReasonCode(), verdict.getReasonCode(),
          type.getActorName(), directives);
      }
    }
    directives.add(Directive.audit(state, WorkflowState.BACKEND_CHECK,
      event.getIntent().getWireName(), ENGINE_ACTOR));
    directives.add(Directive.prompt(Prompts.checkingAvailability()));
    return result(state, WorkflowState.BACKEND_CHECK, directives, null);
  }

  private TransitionResult backendCheck(TransitionEvent event) {
    WorkflowState state = WorkflowState.BACKEND_CHECK;
    List<Directive> directives = new ArrayList<>();
    Optional<EvaluatorVerdict> inventory = event.verdict(EvaluatorType.INVENTORY);
    if (inventory.isEmpty()) {
      directives.add(Directive.invoke(EvaluatorType.INVENTORY));
      return result(state, state, directives, null);
    }

    EvaluatorVerdict verdict = inventory.get();
    String actor = EvaluatorType.INVENTORY.getActorName();
    if (verdict.isPass()) {
      directives.add(Directive.audit(state, WorkflowState.DISPENSED,
        event.getIntent().getWireName(), actor));
      directives.add(Directive.complete(verdict.getDetail().get("order_id")));
      directives.add(Directive.prompt(Prompts.dispensed()));
      return result(state, WorkflowState.DISPENSED, directives, null);
    }
    if (ReasonCodes.PRIOR_AUTHORIZATION_REQUIRED.equals(verdict.getReasonCode())) {
      directives.add(Directive.audit(state, WorkflowState.PA_APPROVAL_NEEDED,
        verdict.getReasonCode(), actor));
      directives.add(Directive.prompt(Prompts.priorAuthorization()));
      return result(state, WorkflowState.PA_APPROVAL_NEEDED, directives, null);
    }
    return escalate(state, verdict.getReasonCode(), verdict.getReasonCode(), actor, directives);
  }

  private TransitionResult tripBreaker(WorkflowState state, CollectionAssessment assessment,
    String reason) {
    List<Directive> directives = new ArrayList<>();
    if (assessment != null) {
      assessment.getPersistedEntities().forEach((slot, value) ->
        directives.add(Directive.persist(slot, value)));
    }
    directives.add(Directive.audit(state, WorkflowState.ESCALATE_HANDOFF, reason, BREAKER_ACTOR));
    directives.add(Directive.escalate(reason));
    directives.add(Directive.prompt(Prompts.handoff()));
    return result(state, WorkflowState.ESCALATE_HANDOFF, directives, reason);
  }

  private TransitionResult escalate(WorkflowState state, String reason, String trigger,
    String actor, List<Directive> directives) {
    directives.add(Directive.audit(state, WorkflowState.ESCALATE_HANDOFF, trigger, actor));
    directives.add(Directive.escalate(reason));
    directives.add(Directive.prompt(Prompts.handoff()));
    return result(state, WorkflowState.ESCALATE_HANDOFF, directives, null);
  }

  private static void addCollectionUpdates(List<Directive> directives,
    CollectionAssessment assessment) {
    assessment.getPersistedEntities().forEach((slot, value) ->
      directives.add(Directive.persist(slot, value)));
    if (assessment.getResolution() != null) {
      directives.add(Directive.resolveDrug(assessment.getResolution()));
    }
    if (assessment.isIdentityConfirmedNow()) {
      directives.add(Directive.confirmIdentity());
    }
    assessment.getResetSlots().forEach(slot -> directives.add(Directive.resetRetry(slot)));
  }

  private String projectedClarifySlot(WorkflowState state, TransitionEvent event,
    CollectionAssessment assessment) {
    if (assessment != null) {
      return assessment.getClarifySlot();
    }
    if (event.getIntent().isInformational()) {
      return null;
    }
    if (state == WorkflowState.SAFETY_CHECK
      && event.effectiveConfidence() < properties.getClarifyConfidence()) {
      return RefillSlots.INTENT;
    }
    return null;
  }

  private static TransitionResult result(WorkflowState from, WorkflowState to,
    List<Directive> directives, String breakerReason) {
    if (from != to && !TransitionTable.isDefined(from, to)) {
      throw new IllegalStateException("Undefined transition " + from + " -> " + to);
    }
    return TransitionResult.builder()
      .fromState(from)
      .nextState(to)
      .directives(List.copyOf(directives))
      .breakerReason(breakerReason)
      .build();
  }
}
