package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.evaluator.VerdictOutcome;
import com.github.spud.refill.domain.policy.ReasonCodes;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Schedule II to IV substances need a physician co-signature
 */
@Component
@RequiredArgsConstructor
public class ReferenceControlledSubstanceClassifier implements SafetyEvaluator {

  private static final Set<String> CO_SIGNATURE_SCHEDULES = Set.of("II", "III", "IV");

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.CONTROLLED_SUBSTANCE;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    return referenceData.findDrug(request.getDrugName())
      .map(ReferenceDataProperties.Drug::getDeaSchedule)
      .filter(CO_SIGNATURE_SCHEDULES::contains)
      .map(schedule -> EvaluatorVerdict.of(type(), VerdictOutcome.REQUIRES_ESCALATION,
        ReasonCodes.CONTROLLED_SUBSTANCE, Map.of("schedule", schedule)))
      .orElseGet(() -> EvaluatorVerdict.pass(type()));
  }
}
