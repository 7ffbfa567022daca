package com.github.spud.refill.domain.session;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluationBatch;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.state.Intent;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Input of one engine step: the classified turn plus whatever evaluator verdicts were gathered
 */
@Value
@Builder(toBuilder = true)
public class TransitionEvent {

  Intent intent;

  Double confidence;

  @Builder.Default
  Map<String, String> extractedEntities = Map.of();

  @Builder.Default
  Map<EvaluatorType, EvaluatorVerdict> verdicts = Map.of();

  /**
   * Resolver output, null when the resolver has not been consulted in this step
   */
  List<DrugCandidate> drugCandidates;

  int turnSequence;

  public static TransitionEvent fromTurn(TurnRequest request) {
    return TransitionEvent.builder()
      .intent(request.getIntent())
      .confidence(request.getConfidence())
      .extractedEntities(RefillSlots.normalize(request.getExtractedEntities()))
      .turnSequence(request.getTurnSequence())
      .build();
  }

  /**
   * Controller-issued event used to advance through automatic states
   */
  public static TransitionEvent system(Intent intent, Double confidence, int turnSequence) {
    return TransitionEvent.builder()
      .intent(intent)
      .confidence(confidence)
      .turnSequence(turnSequence)
      .build();
  }

  public double effectiveConfidence() {
    return confidence == null ? 0.0 : confidence;
  }

  public Optional<EvaluatorVerdict> verdict(EvaluatorType type) {
    return Optional.ofNullable(verdicts.get(type));
  }

  public boolean hasVerdict(EvaluatorType type) {
    return verdicts.containsKey(type);
  }

  public TransitionEvent withEvaluation(EvaluationBatch batch) {
    Map<EvaluatorType, EvaluatorVerdict> merged = new EnumMap<>(EvaluatorType.class);
    merged.putAll(verdicts);
    merged.putAll(batch.getVerdicts());
    return toBuilder()
      .verdicts(Collections.unmodifiableMap(merged))
      .drugCandidates(batch.getDrugCandidates() != null ? batch.getDrugCandidates()
        : drugCandidates)
      .build();
  }
}
