package com.github.spud.refill.domain.policy;

import static com.github.spud.refill.support.WorkflowFixture.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.session.RefillSlots;
import com.github.spud.refill.domain.session.TransitionEvent;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.support.WorkflowFixture;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CollectionAssessorTest {

  private CollectionAssessor assessor;
  private WorkflowSession session;

  @BeforeEach
  void setUp() {
    WorkflowProperties properties = new WorkflowProperties();
    assessor = new CollectionAssessor(new DisambiguationPolicy(properties), properties);
    session = WorkflowSession.start("assessor-test", WorkflowFixture.START);
  }

  @Test
  void shouldAskForFirstMissingSlotInOrder() {
    CollectionAssessment assessment = assessor.assess(session, event(0.95,
      Map.of(RefillSlots.DOSE, "10mg")));

    assertThat(assessment.getClarifySlot()).isEqualTo(RefillSlots.PATIENT_ID);
    assertThat(assessment.getPersistedEntities()).containsEntry(RefillSlots.DOSE, "10mg");
    assertThat(assessment.getRequiredEvaluators()).isEmpty();
  }

  @Test
  void shouldRequestResolverForUnresolvedDrug() {
    CollectionAssessment assessment = assessor.assess(session, event(0.95,
      WorkflowFixture.completeRequest()));

    assertThat(assessment.getRequiredEvaluators()).containsExactly(EvaluatorType.DISAMBIGUATION);
    assertThat(assessment.isReady()).isFalse();
  }

  @Test
  void shouldRequestIdentityOnlyOnceSlotsAreComplete() {
    TransitionEvent event = withResolver(event(0.95, WorkflowFixture.completeRequest()),
      List.of(candidate("Lisinopril", "RX29046", 0.99)));

    CollectionAssessment assessment = assessor.assess(session, event);

    assertThat(assessment.getResolution().getCode()).isEqualTo("RX29046");
    assertThat(assessment.getRequiredEvaluators()).containsExactly(EvaluatorType.IDENTITY);
  }

  @Test
  void shouldBeReadyOnceIdentityPasses() {
    TransitionEvent event = withResolver(event(0.95, WorkflowFixture.completeRequest()),
      List.of(candidate("Lisinopril", "RX29046", 0.99)));
    Map<EvaluatorType, EvaluatorVerdict> verdicts = new EnumMap<>(event.getVerdicts());
    verdicts.put(EvaluatorType.IDENTITY, EvaluatorVerdict.pass(EvaluatorType.IDENTITY));

    CollectionAssessment assessment = assessor.assess(session,
      event.toBuilder().verdicts(verdicts).build());

    assertThat(assessment.isReady()).isTrue();
    assertThat(assessment.isIdentityConfirmedNow()).isTrue();
  }

  @Test
  void shouldDeriveEscalationWhenDrugCannotBeResolved() {
    TransitionEvent event = withResolver(event(0.95, WorkflowFixture.completeRequest()),
      List.of(candidate("Losartan", "RX52175", 0.41)));

    CollectionAssessment assessment = assessor.assess(session, event);

    assertThat(assessment.getDisambiguationVerdict().getReasonCode())
      .isEqualTo(ReasonCodes.DRUG_NOT_RESOLVED);
    assertThat(assessment.getBlockedReason()).isEqualTo(ReasonCodes.DRUG_NOT_RESOLVED);
  }

  @Test
  void shouldPresentCandidatesAgainOnInvalidSelection() {
    List<DrugCandidate> pending = List.of(candidate("Lisinopril", "RX29046", 0.92),
      candidate("Losartan", "RX52175", 0.80));
    session.setPendingCandidates(new ArrayList<>(pending));
    session.getCollectedEntities().put(RefillSlots.DRUG_NAME, "Lysnopril");

    CollectionAssessment assessment = assessor.assess(session, event(0.95,
      Map.of(RefillSlots.SELECTION, "7")));

    assertThat(assessment.getClarifySlot()).isEqualTo(RefillSlots.DRUG_NAME);
    assertThat(assessment.getPresentedCandidates()).isEqualTo(pending);
    assertThat(assessment.getPersistedEntities()).doesNotContainKey(RefillSlots.SELECTION);
  }

  @Test
  void shouldResolveSelectionByName() {
    session.setPendingCandidates(new ArrayList<>(List.of(
      candidate("Lisinopril", "RX29046", 0.92), candidate("Losartan", "RX52175", 0.80))));
    session.getRetryCounts().put(RefillSlots.DRUG_NAME, 1);

    CollectionAssessment assessment = assessor.assess(session, event(0.95,
      Map.of(RefillSlots.SELECTION, "losartan")));

    assertThat(assessment.getResolution().getName()).isEqualTo("Losartan");
    assertThat(assessment.getResetSlots()).contains(RefillSlots.DRUG_NAME);
  }

  @Test
  void shouldTrustVerifiedIdentityOnlyForSamePatient() {
    session.setIdentityVerified(true);
    session.setPatientRef("1234567");
    session.setResolvedDrug(candidate("Lisinopril", "RX29046", 0.99));
    session.getCollectedEntities().putAll(WorkflowFixture.completeRequest());

    assertThat(assessor.assess(session, event(0.95, Map.of())).isReady()).isTrue();

    CollectionAssessment changed = assessor.assess(session, event(0.95,
      Map.of(RefillSlots.PATIENT_ID, "7654321")));
    assertThat(changed.getRequiredEvaluators()).containsExactly(EvaluatorType.IDENTITY);
  }

  @Test
  void shouldClarifyIntentInBandBeforeAnythingElse() {
    CollectionAssessment assessment = assessor.assess(session, event(0.75,
      WorkflowFixture.completeRequest()));

    assertThat(assessment.isIntentClarification()).isTrue();
    assertThat(assessment.getClarifySlot()).isEqualTo(RefillSlots.INTENT);
    assertThat(assessment.getRequiredEvaluators()).isEmpty();
  }

  @Test
  void shouldResetRetriesOfSlotsNowValid() {
    session.getRetryCounts().put(RefillSlots.QUANTITY, 2);
    session.getRetryCounts().put(RefillSlots.INTENT, 1);

    CollectionAssessment assessment = assessor.assess(session, event(0.95,
      Map.of(RefillSlots.QUANTITY, "30")));

    assertThat(assessment.getResetSlots())
      .containsExactlyInAnyOrder(RefillSlots.QUANTITY, RefillSlots.INTENT);
  }

  @Test
  void shouldClarifyInvalidSlot() {
    Map<String, String> entities = new HashMap<>(WorkflowFixture.completeRequest());
    entities.put(RefillSlots.QUANTITY, "0");
    TransitionEvent event = withResolver(event(0.95, entities),
      List.of(candidate("Lisinopril", "RX29046", 0.99)));

    assertThat(assessor.assess(session, event).getClarifySlot())
      .isEqualTo(RefillSlots.QUANTITY);
  }

  private static TransitionEvent event(double confidence, Map<String, String> entities) {
    return TransitionEvent.builder()
      .intent(Intent.REQUEST_REFILL)
      .confidence(confidence)
      .extractedEntities(entities)
      .turnSequence(1)
      .build();
  }

  private static TransitionEvent withResolver(TransitionEvent event,
    List<DrugCandidate> candidates) {
    return event.toBuilder()
      .verdicts(Map.of(EvaluatorType.DISAMBIGUATION,
        EvaluatorVerdict.pass(EvaluatorType.DISAMBIGUATION)))
      .drugCandidates(candidates)
      .build();
  }
}
