package com.github.spud.refill.infrastructure.evaluator;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluationRequest;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.VerdictOutcome;
import com.github.spud.refill.domain.policy.ReasonCodes;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.CrossSensitivity;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Drug;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Interaction;
import com.github.spud.refill.infrastructure.evaluator.ReferenceDataProperties.Patient;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReferenceEvaluatorsTest {

  private ReferenceDataProperties referenceData;

  @BeforeEach
  void setUp() {
    referenceData = new ReferenceDataProperties();

    Patient patient = new Patient();
    patient.setAllergies(List.of("penicillin"));
    patient.setActiveMedications(List.of("Warfarin"));
    referenceData.getPatients().put("1234567", patient);

    referenceData.getFormulary().add(drug("Lisinopril", "RX29046", "ACE inhibitor",
      "lisinopril", null, 2.5, 40, 500, false));
    referenceData.getFormulary().add(drug("Oxycodone", "RX7804", "opioid analgesic",
      "oxycodone", "II", 5, 30, 100, false));
    referenceData.getFormulary().add(drug("Amoxicillin", "RX723", "penicillin",
      "penicillin", null, 250, 1000, 200, false));
    referenceData.getFormulary().add(drug("Cephalexin", "RX2231", "cephalosporin",
      "cephalexin", null, 250, 1000, 150, false));
    referenceData.getFormulary().add(drug("Aspirin", "RX1191", "NSAID",
      "acetylsalicylic acid", null, 75, 325, 1000, false));
    referenceData.getFormulary().add(drug("Ibuprofen", "RX5640", "NSAID",
      "ibuprofen", null, 200, 800, 800, false));
    referenceData.getFormulary().add(drug("Metformin", "RX6809", "biguanide",
      "metformin", null, 500, 2000, 0, false));
    referenceData.getFormulary().add(drug("Adalimumab", "RX327361", "TNF inhibitor",
      "adalimumab", null, 40, 80, 20, true));

    referenceData.getInteractions().add(interaction("Warfarin", "Aspirin", "major"));
    referenceData.getInteractions().add(interaction("Ibuprofen", "Warfarin", "moderate"));
    CrossSensitivity crossSensitivity = new CrossSensitivity();
    crossSensitivity.setAllergen("penicillin");
    crossSensitivity.setDrugClass("cephalosporin");
    referenceData.getCrossSensitivities().add(crossSensitivity);
  }

  @Test
  void identityRequiresKnownPatient() {
    ReferenceIdentityVerifier verifier = new ReferenceIdentityVerifier(referenceData);

    assertThat(verifier.evaluate(request("Lisinopril", "10mg", "30")).isPass()).isTrue();
    assertThat(verifier.evaluate(EvaluationRequest.builder().patientRef("9999999").build())
      .getReasonCode()).isEqualTo(ReasonCodes.IDENTITY_VERIFICATION_FAILED);
  }

  @Test
  void interactionSeverityDecidesOutcome() {
    ReferenceInteractionChecker checker = new ReferenceInteractionChecker(referenceData);

    EvaluatorVerdict major = checker.evaluate(request("Aspirin", "81mg", "30"));
    assertThat(major.getOutcome()).isEqualTo(VerdictOutcome.FAIL);
    assertThat(major.getReasonCode()).isEqualTo(ReasonCodes.MAJOR_DRUG_INTERACTION);
    assertThat(major.getDetail()).containsEntry("severity", "major");

    EvaluatorVerdict moderate = checker.evaluate(request("ibuprofen", "200mg", "30"));
    assertThat(moderate.getOutcome()).isEqualTo(VerdictOutcome.REQUIRES_ESCALATION);
    assertThat(moderate.getReasonCode()).isEqualTo(ReasonCodes.MODERATE_DRUG_INTERACTION);

    assertThat(checker.evaluate(request("Lisinopril", "10mg", "30")).isPass()).isTrue();
  }

  @Test
  void allergyDistinguishesDirectMatchFromCrossSensitivity() {
    ReferenceAllergyChecker checker = new ReferenceAllergyChecker(referenceData);

    assertThat(checker.evaluate(request("Amoxicillin", "500mg", "21")).getReasonCode())
      .isEqualTo(ReasonCodes.ALLERGY_MATCH);
    EvaluatorVerdict cross = checker.evaluate(request("Cephalexin", "500mg", "21"));
    assertThat(cross.getOutcome()).isEqualTo(VerdictOutcome.REQUIRES_ESCALATION);
    assertThat(cross.getReasonCode()).isEqualTo(ReasonCodes.ALLERGY_CROSS_SENSITIVITY);
    assertThat(checker.evaluate(request("Lisinopril", "10mg", "30")).isPass()).isTrue();
  }

  @Test
  void scheduleTwoNeedsCoSignature() {
    ReferenceControlledSubstanceClassifier classifier =
      new ReferenceControlledSubstanceClassifier(referenceData);

    EvaluatorVerdict verdict = classifier.evaluate(request("Oxycodone", "10mg", "20"));
    assertThat(verdict.getReasonCode()).isEqualTo(ReasonCodes.CONTROLLED_SUBSTANCE);
    assertThat(verdict.getDetail()).containsEntry("schedule", "II");
    assertThat(classifier.evaluate(request("Lisinopril", "10mg", "30")).isPass()).isTrue();
  }

  @Test
  void dosageIsCheckedAgainstFormularyRange() {
    ReferenceDosageChecker checker = new ReferenceDosageChecker(referenceData);

    assertThat(checker.evaluate(request("Lisinopril", "10mg", "30")).isPass()).isTrue();
    assertThat(checker.evaluate(request("Lisinopril", "80mg", "30")).getReasonCode())
      .isEqualTo(ReasonCodes.DOSE_OUT_OF_RANGE);
    assertThat(checker.evaluate(request("Lisinopril", "0.01g", "30")).isPass()).isTrue();
    assertThat(checker.evaluate(request("Lisinopril", "5 mL", "30")).isPass()).isTrue();
    assertThat(checker.evaluate(request("Lisinopril", "lots", "30")).getReasonCode())
      .isEqualTo(ReasonCodes.INVALID_DOSE);
    assertThat(ReferenceDosageChecker.toMilligrams(500, "mcg")).isEqualTo(0.5);
  }

  @Test
  void inventoryRoutesFormularyAuthorizationAndStock() {
    ReferenceInventoryBackend backend = new ReferenceInventoryBackend(referenceData);

    EvaluatorVerdict dispensed = backend.evaluate(request("Lisinopril", "10mg", "30"));
    assertThat(dispensed.isPass()).isTrue();
    assertThat(dispensed.getDetail().get("order_id")).startsWith("RX-");

    assertThat(backend.evaluate(request("Unobtainium", "10mg", "30")).getReasonCode())
      .isEqualTo(ReasonCodes.NOT_ON_FORMULARY);
    assertThat(backend.evaluate(request("Adalimumab", "40mg", "2")).getReasonCode())
      .isEqualTo(ReasonCodes.PRIOR_AUTHORIZATION_REQUIRED);
    assertThat(backend.evaluate(request("Metformin", "500mg", "60")).getReasonCode())
      .isEqualTo(ReasonCodes.OUT_OF_STOCK);
  }

  @Test
  void resolverRanksFormularyBySimilarity() {
    FormularyDisambiguationResolver resolver = new FormularyDisambiguationResolver(referenceData);

    List<DrugCandidate> candidates = resolver.resolve("Lysnopril");

    assertThat(candidates).hasSizeLessThanOrEqualTo(5);
    assertThat(candidates.get(0).getName()).isEqualTo("Lisinopril");
    assertThat(candidates.get(0).getSimilarity()).isBetween(0.75, 0.99);
    assertThat(resolver.resolve("lisinopril").get(0).getSimilarity()).isEqualTo(1.0);
    assertThat(resolver.resolve(" ")).isEmpty();
  }

  private static EvaluationRequest request(String drug, String dose, String quantity) {
    return EvaluationRequest.builder()
      .sessionId("reference-test")
      .patientRef("1234567")
      .drugName(drug)
      .dose(dose)
      .quantity(quantity)
      .build();
  }

  private static Drug drug(String name, String code, String drugClass, String ingredient,
    String schedule, double minMg, double maxMg, int stock, boolean priorAuthorization) {
    Drug drug = new Drug();
    drug.setName(name);
    drug.setCode(code);
    drug.setDrugClass(drugClass);
    drug.setActiveIngredients(List.of(ingredient));
    drug.setDeaSchedule(schedule);
    drug.setMinDoseMg(minMg);
    drug.setMaxDoseMg(maxMg);
    drug.setStock(stock);
    drug.setPriorAuthorization(priorAuthorization);
    return drug;
  }

  private static Interaction interaction(String drugA, String drugB, String severity) {
    Interaction interaction = new Interaction();
    interaction.setDrugA(drugA);
    interaction.setDrugB(drugB);
    interaction.setSeverity(severity);
    return interaction;
  }
}
