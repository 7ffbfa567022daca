package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.SafetyEvaluator;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Drug;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Formulary, prior authorization and stock check. A PASS carries the dispensation order id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceInventoryBackend implements SafetyEvaluator {

  private final ReferenceDataProperties referenceData;

  @Override
  public EvaluatorType type() {
    return EvaluatorType.INVENTORY;
  }

  @Override
  public EvaluatorVerdict evaluate(EvaluationRequest request) {
    Optional<Drug> drug = referenceData.findDrug(request.getDrugName());
    if (drug.isEmpty()) {
      return EvaluatorVerdict.fail(type(), ReasonCodes.NOT_ON_FORMULARY);
    }
    if (drug.get().isPriorAuthorization()) {
      return EvaluatorVerdict.escalate(type(), ReasonCodes.PRIOR_AUTHORIZATION_REQUIRED);
    }
    int quantity = parseQuantity(request.getQuantity());
    if (drug.get().getStock() < quantity) {
      return EvaluatorVerdict.fail(type(), ReasonCodes.OUT_OF_STOCK);
    }

    String orderId = "RX-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    log.info("Dispensation order created: sessionId={}, orderId={}", request.getSessionId(),
      orderId);
    return EvaluatorVerdict.pass(type(), Map.of("order_id", orderId));
  }

  private static int parseQuantity(String quantity) {
    try {
      return quantity == null ? 1 : Integer.parseInt(quantity.trim());
    } catch (NumberFormatException e) {
      return Integer.MAX_VALUE;
    }
  }
}
