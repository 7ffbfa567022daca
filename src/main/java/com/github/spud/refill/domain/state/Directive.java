package com.github.spud.refill.domain.state;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * {@link TransitionEngine#advance} 产出的单条指令，只填充与 {@link DirectiveType} 相关的字段
 */
@Value
@Builder
public class Directive {

  DirectiveType type;

  /**
   * 槽位名（PERSIST_ENTITY, CLARIFY, INCREMENT_RETRY, RESET_RETRY）
   */
  String slot;

  /**
   * 槽位值（PERSIST_ENTITY）或订单号（COMPLETE）
   */
  String value;

  EvaluatorType evaluator;

  String reasonCode;

  String prompt;

  List<DrugCandidate> candidates;

  WorkflowState fromState;

  WorkflowState toState;

  String trigger;

  String actor;

  public static Directive audit(WorkflowState from, WorkflowState to, String trigger,
    String actor) {
    return Directive.builder()
      .type(DirectiveType.EMIT_AUDIT)
      .fromState(from)
      .toState(to)
      .trigger(trigger)
      .actor(actor)
      .build();
  }

  public static Directive invoke(EvaluatorType evaluator) {
    return Directive.builder().type(DirectiveType.INVOKE_EVALUATOR).evaluator(evaluator).build();
  }

  public static Directive escalate(String reasonCode) {
    return Directive.builder().type(DirectiveType.REQUEST_ESCALATION).reasonCode(reasonCode)
      .build();
  }

  public static Directive prompt(String prompt) {
    return Directive.builder().type(DirectiveType.EMIT_PROMPT).prompt(prompt).build();
  }

  public static Directive clarify(String slot, String prompt, List<DrugCandidate> candidates) {
    return Directive.builder()
      .type(DirectiveType.CLARIFY)
      .slot(slot)
      .prompt(prompt)
      .candidates(candidates == null ? List.of() : List.copyOf(candidates))
      .build();
  }

  public static Directive persist(String slot, String value) {
    return Directive.builder().type(DirectiveType.PERSIST_ENTITY).slot(slot).value(value).build();
  }

  public static Directive incrementRetry(String slot) {
    return Directive.builder().type(DirectiveType.INCREMENT_RETRY).slot(slot).build();
  }

  public static Directive resetRetry(String slot) {
    return Directive.builder().type(DirectiveType.RESET_RETRY).slot(slot).build();
  }

  public static Directive confirmIdentity() {
    return Directive.builder().type(DirectiveType.CONFIRM_IDENTITY).build();
  }

  public static Directive resolveDrug(DrugCandidate candidate) {
    return Directive.builder()
      .type(DirectiveType.RESOLVE_DRUG)
      .value(candidate.getName())
      .candidates(List.of(candidate))
      .build();
  }

  public static Directive complete(String orderId) {
    return Directive.builder().type(DirectiveType.COMPLETE).value(orderId).build();
  }

  public static Directive cancel() {
    return Directive.builder().type(DirectiveType.CANCEL).build();
  }
}
