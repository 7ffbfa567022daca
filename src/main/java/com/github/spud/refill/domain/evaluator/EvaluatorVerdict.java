package com.github.spud.refill.domain.evaluator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单次评估的结构化结果，除 PASS 外必须带原因码
 */
@Value
@Builder
@Jacksonized
public class EvaluatorVerdict {

  EvaluatorType evaluator;

  VerdictOutcome outcome;

  String reasonCode;

  /**
   * 附加信息，如 {@code severity=major}、{@code schedule=II}
   */
  @Builder.Default
  Map<String, String> detail = Map.of();

  public static EvaluatorVerdict pass(EvaluatorType evaluator) {
    return EvaluatorVerdict.builder().evaluator(evaluator).outcome(VerdictOutcome.PASS).build();
  }

  public static EvaluatorVerdict pass(EvaluatorType evaluator, Map<String, String> detail) {
    return EvaluatorVerdict.builder()
      .evaluator(evaluator)
      .outcome(VerdictOutcome.PASS)
      .detail(Map.copyOf(detail))
      .build();
  }

  public static EvaluatorVerdict fail(EvaluatorType evaluator, String reasonCode) {
    return of(evaluator, VerdictOutcome.FAIL, reasonCode, Map.of());
  }

  public static EvaluatorVerdict escalate(EvaluatorType evaluator, String reasonCode) {
    return of(evaluator, VerdictOutcome.REQUIRES_ESCALATION, reasonCode, Map.of());
  }

  public static EvaluatorVerdict unavailable(EvaluatorType evaluator, String reasonCode) {
    return of(evaluator, VerdictOutcome.UNAVAILABLE, reasonCode, Map.of());
  }

  public static EvaluatorVerdict of(EvaluatorType evaluator, VerdictOutcome outcome,
    String reasonCode, Map<String, String> detail) {
    return EvaluatorVerdict.builder()
      .evaluator(evaluator)
      .outcome(outcome)
      .reasonCode(reasonCode)
      .detail(Map.copyOf(detail))
      .build();
  }

  @JsonIgnore
  public boolean isPass() {
    return outcome == VerdictOutcome.PASS;
  }

  @JsonIgnore
  public boolean isBlocking() {
    return outcome == VerdictOutcome.FAIL || outcome == VerdictOutcome.REQUIRES_ESCALATION;
  }

  @JsonIgnore
  public boolean isUnavailable() {
    return outcome == VerdictOutcome.UNAVAILABLE;
  }
}
