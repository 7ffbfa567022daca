package com.github.spud.refill.domain.escalation;

import com.github.spud.refill.domain.policy.ReasonCodes;
import java.util.Map;

/**
 * Static reason code to reviewer role routing. Unknown reasons go to a physician.
 */
public final class EscalationRoutingTable {

  private static final Map<String, TargetRole> ROUTES = Map.ofEntries(
    Map.entry(ReasonCodes.CONTROLLED_SUBSTANCE, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.MAJOR_DRUG_INTERACTION, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.MODERATE_DRUG_INTERACTION, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.ALLERGY_MATCH, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.ALLERGY_CROSS_SENSITIVITY, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.DOSE_OUT_OF_RANGE, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.INVALID_DOSE, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.PRIOR_AUTHORIZATION_REQUIRED, TargetRole.PHYSICIAN),
    Map.entry(ReasonCodes.OUT_OF_STOCK, TargetRole.PHARMACIST),
    Map.entry(ReasonCodes.NOT_ON_FORMULARY, TargetRole.PHARMACIST),
    Map.entry(ReasonCodes.LOW_CONFIDENCE, TargetRole.PHYSICIAN_ASSISTANT),
    Map.entry(ReasonCodes.IDENTITY_VERIFICATION_FAILED, TargetRole.PHYSICIAN_ASSISTANT),
    Map.entry(ReasonCodes.DRUG_NOT_RESOLVED, TargetRole.PHYSICIAN_ASSISTANT),
    Map.entry(ReasonCodes.BACKEND_UNAVAILABLE, TargetRole.PHYSICIAN_ASSISTANT),
    Map.entry(ReasonCodes.MAX_RETRIES_EXCEEDED, TargetRole.PHYSICIAN_ASSISTANT)
  );

  private EscalationRoutingTable() {
  }

  public static TargetRole route(String reasonCode) {
    return reasonCode == null ? TargetRole.PHYSICIAN
      : ROUTES.getOrDefault(reasonCode, TargetRole.PHYSICIAN);
  }
}
