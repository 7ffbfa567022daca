package com.github.spud.refill.domain.evaluator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * 一次并发评估的汇总结果
 */
@Value
@Builder
public class EvaluationBatch {

  Map<EvaluatorType, EvaluatorVerdict> verdicts;

  /**
   * 消歧结果；未调用或无应答时为 null
   */
  List<DrugCandidate> drugCandidates;

  public static EvaluationBatch empty() {
    return EvaluationBatch.builder()
      .verdicts(Collections.emptyMap())
      .build();
  }

  static EvaluationBatch of(List<EvaluatorResponse> responses) {
    Map<EvaluatorType, EvaluatorVerdict> verdicts = new EnumMap<>(EvaluatorType.class);
    List<DrugCandidate> candidates = null;
    for (EvaluatorResponse response : responses) {
      verdicts.put(response.getVerdict().getEvaluator(), response.getVerdict());
      if (response.getCandidates() != null) {
        candidates = response.getCandidates();
      }
    }
    return EvaluationBatch.builder()
      .verdicts(Collections.unmodifiableMap(verdicts))
      .drugCandidates(candidates)
      .build();
  }

  @Value
  static class EvaluatorResponse {

    EvaluatorVerdict verdict;

    List<DrugCandidate> candidates;
  }
}
