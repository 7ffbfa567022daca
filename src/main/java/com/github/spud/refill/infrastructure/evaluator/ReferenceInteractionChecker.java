package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.evaluator.VerdictOutcome;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Interaction;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks the requested drug against the patient's active medications. Major interactions fail,
 * moderate ones require review.
 */
@Component
@RequiredArgsConstructor
public class ReferenceInteractionChecker implements SafetyEvaluator {

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.DRUG_INTERACTION;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    List<String> activeMedications = referenceData.findPatient(request.getPatientRef())
      .map(ReferenceDataProperties.Patient::getActiveMedications)
      .orElse(List.of());
    if (activeMedications.isEmpty()) {
      return EvaluatorVerdict.pass(type());
    }

    List<Interaction> found = referenceData.getInteractions().stream()
      .filter(i -> activeMedications.stream()
        .anyMatch(med -> i.involves(med, request.getDrugName())))
      .collect(Collectors.toList());

    if (found.stream().anyMatch(i -> "major".equalsIgnoreCase(i.getSeverity()))) {
      return EvaluatorVerdict.of(type(), VerdictOutcome.FAIL, ReasonCodes.MAJOR_DRUG_INTERACTION,
        Map.of("severity", "major"));
    }
    if (found.stream().anyMatch(i -> "moderate".equalsIgnoreCase(i.getSeverity()))) {
      return EvaluatorVerdict.of(type(), VerdictOutcome.REQUIRES_ESCALATION,
        ReasonCodes.MODERATE_DRUG_INTERACTION, Map.of("severity", "moderate"));
    }
    return EvaluatorVerdict.pass(type());
  }
}
