package com.github.spud.refill.domain.escalation;

import com.github.spud.refill.domain.session.RefillSlots;
import com.github.spud.refill.domain.session.WorkflowSession;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the context package from an explicit allow-list of session fields
 */
public final class ContextPackageAssembler {

  static final List<String> MEDICATION_FIELDS = List.of(
    RefillSlots.DRUG_NAME, RefillSlots.DOSE, RefillSlots.QUANTITY, RefillSlots.FREQUENCY);

  private ContextPackageAssembler() {
  }

  public static ContextPackage assemble(WorkflowSession session) {
    Map<String, String> entities = session.getCollectedEntities();
    Map<String, String> medication = new LinkedHashMap<>();
    for (String field : MEDICATION_FIELDS) {
      String value = entities.get(field);
      if (value != null) {
        medication.put(field, value);
      }
    }
    String patientRef = session.isIdentityVerified() ? session.getPatientRef()
      : entities.get(RefillSlots.PATIENT_ID);

    return ContextPackage.builder()
      .patientRef(patientRef)
      .identityVerified(session.isIdentityVerified())
      .medication(medication)
      .drugCode(session.getResolvedDrug() == null ? null : session.getResolvedDrug().getCode())
      .conversationExcerpt(List.copyOf(session.getConversationExcerpt()))
      .build();
  }
}
