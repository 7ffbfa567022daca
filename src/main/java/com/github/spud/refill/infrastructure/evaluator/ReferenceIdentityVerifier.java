package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.policy.ReasonCodes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Identity passes when the MRN belongs to a known patient record
 */
@Component
@RequiredArgsConstructor
public class ReferenceIdentityVerifier implements SafetyEvaluator {

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.IDENTITY;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    return referenceData.findPatient(request.getPatientRef()).isPresent()
      ? EvaluatorVerdict.pass(type())
      : EvaluatorVerdict.fail(type(), ReasonCodes.IDENTITY_VERIFICATION_FAILED);
  }
}
