package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Drug;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Compares the requested dose with the formulary range. Liquid volumes are not range checked.
 */
@Component
@RequiredArgsConstructor
public class ReferenceDosageChecker implements SafetyEvaluator {

  private static final Pattern DOSE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(mg|mcg|g|mL)$");

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.DOSAGE;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    Matcher matcher = request.getDose() == null ? null : DOSE.matcher(request.getDose().trim());
    if (matcher == null || !matcher.matches()) {
      return EvaluatorVerdict.fail(type(), ReasonCodes.INVALID_DOSE);
    }
    String unit = matcher.group(2);
    Optional<Drug> drug = referenceData.findDrug(request.getDrugName());
    if ("mL".equals(unit) || drug.isEmpty()) {
      return EvaluatorVerdict.pass(type());
    }

    double milligrams = toMilligrams(Double.parseDouble(matcher.group(1)), unit);
    if (milligrams < drug.get().getMinDoseMg() || milligrams > drug.get().getMaxDoseMg()) {
      return EvaluatorVerdict.escalate(type(), ReasonCodes.DOSE_OUT_OF_RANGE);
    }
    return EvaluatorVerdict.pass(type());
  }

  static double toMilligrams(double value, String unit) {
    switch (unit) {
      case "mcg":
        return value / 1000.0;
      case "g":
        return value * 1000.0;
      default:
        return value;
    }
  }
}
