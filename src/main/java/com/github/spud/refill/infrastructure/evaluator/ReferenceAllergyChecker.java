package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Drug;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Direct ingredient matches fail; drug class cross-sensitivities require review
 */
@Component
@RequiredArgsConstructor
public class ReferenceAllergyChecker implements SafetyEvaluator {

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.ALLERGY;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    List<String> allergies = referenceData.findPatient(request.getPatientRef())
      .map(ReferenceDataProperties.Patient::getAllergies)
      .orElse(List.of());
    Optional<Drug> drug = referenceData.findDrug(request.getDrugName());
    if (allergies.isEmpty() || drug.isEmpty()) {
      return EvaluatorVerdict.pass(type());
    }

    for (String allergy : allergies) {
      boolean direct = drug.get().getActiveIngredients().stream()
        .anyMatch(ingredient -> ingredient.equalsIgnoreCase(allergy));
      if (direct) {
        return EvaluatorVerdict.fail(type(), ReasonCodes.ALLERGY_MATCH);
      }
    }

    String drugClass = drug.get().getDrugClass();
    boolean crossSensitive = drugClass != null && referenceData.getCrossSensitivities().stream()
      .anyMatch(cs -> cs.getDrugClass().equalsIgnoreCase(drugClass)
        && allergies.stream().anyMatch(a -> a.equalsIgnoreCase(cs.getAllergen())));
    return crossSensitive
      ? EvaluatorVerdict.escalate(type(), ReasonCodes.ALLERGY_CROSS_SENSITIVITY)
      : EvaluatorVerdict.pass(type());
  }
}
