package com.github.spud.refill.domain.escalation;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Minimized hand-off context. Only allow-listed fields are ever copied in.
 */
@Value
@Builder
@Jacksonized
public class ContextPackage {

  /**
   * MRN, as verified (or as stated when verification did not complete)
   */
  String patientRef;

  boolean identityVerified;

  /**
   * Requested medication: drug name, dose, quantity, frequency
   */
  Map<String, String> medication;

  String drugCode;

  List<String> conversationExcerpt;
}
