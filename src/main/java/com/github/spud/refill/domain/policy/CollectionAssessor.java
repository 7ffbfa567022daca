package com.github.spud.refill.domain.policy;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.session.RefillSlots;
import com.github.spud.refill.domain.session.TransitionEvent;
import com.github.spud.refill.domain.session.WorkflowSession;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * COLLECT_REQUEST 的槽位收集、药品消歧与身份核验（纯函数）
 * <p>
 * 检查顺序（首个命中生效）：意图置信区间、待消歧、药品选择、缺失槽位、非法槽位、身份核验、就绪
 */
@Component
@RequiredArgsConstructor
public class CollectionAssessor {

  private final DisambiguationPolicy disambiguationPolicy;
  private final WorkflowProperties properties;

  public CollectionAssessment assess(WorkflowSession session, TransitionEvent event) {
    Map<String, String> eventEntities = new TreeMap<>(event.getExtractedEntities());
    String selection = eventEntities.remove(RefillSlots.SELECTION);

    Map<String, String> merged = new TreeMap<>(session.getCollectedEntities());
    merged.putAll(eventEntities);

    double confidence = event.effectiveConfidence();
    boolean intentBand = confidence >= properties.getEscalationConfidence()
      && confidence < properties.getClarifyConfidence();

    Set<String> resets = new TreeSet<>();
    eventEntities.forEach((slot, value) -> {
      if (!RefillSlots.DRUG_NAME.equals(slot) && RefillSlots.isValid(slot, value)
        && session.retryCount(slot) > 0) {
        resets.add(slot);
      }
    });
    if (confidence >= properties.getClarifyConfidence()
      && session.retryCount(RefillSlots.INTENT) > 0) {
      resets.add(RefillSlots.INTENT);
    }

    // 药品
    DrugCandidate resolution = null;
    List<DrugCandidate> presented = List.of();
    EvaluatorVerdict disambiguationVerdict = null;
    boolean needsResolver = false;

    String drug = merged.get(RefillSlots.DRUG_NAME);
    String eventDrug = eventEntities.get(RefillSlots.DRUG_NAME);
    List<DrugCandidate> pending = session.getPendingCandidates();
    boolean newDrug = eventDrug != null && findByName(pending, eventDrug).isEmpty();

    if (!pending.isEmpty() && !newDrug) {
      Optional<DrugCandidate> chosen = select(pending, selection, eventDrug);
      if (chosen.isPresent()) {
        resolution = chosen.get();
      } else {
        presented = List.copyOf(pending);
      }
    } else if (RefillSlots.isValid(RefillSlots.DRUG_NAME, drug)
      && !matchesResolved(session.getResolvedDrug(), drug)) {
      Optional<EvaluatorVerdict> verdict = event.verdict(EvaluatorType.DISAMBIGUATION);
      if (verdict.isEmpty()) {
        needsResolver = true;
      } else if (verdict.get().isPass()) {
        DisambiguationPolicy.Outcome outcome =
          disambiguationPolicy.classify(event.getDrugCandidates());
        switch (outcome.getKind()) {
          case AUTO_CONFIRMED:
            resolution = outcome.top();
            break;
          case NEEDS_SELECTION:
            presented = outcome.getCandidates();
            break;
          default:
            disambiguationVerdict = EvaluatorVerdict.escalate(EvaluatorType.DISAMBIGUATION,
              ReasonCodes.DRUG_NOT_RESOLVED);
        }
      }
    }

    if (resolution != null) {
      merged.put(RefillSlots.DRUG_NAME, resolution.getName());
      if (session.retryCount(RefillSlots.DRUG_NAME) > 0) {
        resets.add(RefillSlots.DRUG_NAME);
      }
    }
    boolean drugResolved = resolution != null
      || matchesResolved(session.getResolvedDrug(), merged.get(RefillSlots.DRUG_NAME));

    // 身份
    String patientId = merged.get(RefillSlots.PATIENT_ID);
    boolean patientValid = RefillSlots.isValid(RefillSlots.PATIENT_ID, patientId);
    Optional<EvaluatorVerdict> identity = event.verdict(EvaluatorType.IDENTITY);
    boolean confirmedNow = patientValid && identity.map(EvaluatorVerdict::isPass).orElse(false);
    boolean confirmed = confirmedNow || (patientValid && session.isIdentityVerified()
      && patientId.equals(session.getPatientRef()));

    CollectionAssessment.CollectionAssessmentBuilder builder = CollectionAssessment.builder()
      .mergedEntities(Collections.unmodifiableMap(merged))
      .persistedEntities(Collections.unmodifiableMap(eventEntities))
      .intentClarification(intentBand)
      .resolution(resolution)
      .presentedCandidates(presented)
      .identityConfirmedNow(confirmedNow)
      .requiredEvaluators(EnumSet.noneOf(EvaluatorType.class))
      .disambiguationVerdict(disambiguationVerdict)
      .resetSlots(Collections.unmodifiableSet(resets));

    if (intentBand) {
      return builder.clarifySlot(RefillSlots.INTENT).build();
    }
    if (needsResolver) {
      return builder.requiredEvaluators(EnumSet.of(EvaluatorType.DISAMBIGUATION)).build();
    }
    if (!presented.isEmpty()) {
      return builder.clarifySlot(RefillSlots.DRUG_NAME).build();
    }
    Optional<String> missing = RefillSlots.firstMissing(merged);
    if (missing.isPresent()) {
      return builder.clarifySlot(missing.get()).build();
    }
    Optional<String> invalid = RefillSlots.firstInvalid(merged);
    if (invalid.isPresent()) {
      return builder.clarifySlot(invalid.get()).build();
    }
    if (!drugResolved) {
      String reason = disambiguationVerdict != null ? disambiguationVerdict.getReasonCode()
        : event.verdict(EvaluatorType.DISAMBIGUATION).map(EvaluatorVerdict::getReasonCode)
          .orElse(ReasonCodes.DRUG_NOT_RESOLVED);
      return builder.blockedReason(reason).build();
    }
    if (!confirmed) {
      if (identity.isEmpty()) {
        return builder.requiredEvaluators(EnumSet.of(EvaluatorType.IDENTITY)).build();
      }
      String reason = identity.get().getReasonCode();
      return builder.blockedReason(StringUtils.hasText(reason) ? reason
        : ReasonCodes.IDENTITY_VERIFICATION_FAILED).build();
    }
    return builder.ready(true).build();
  }

  private static Optional<DrugCandidate> select(List<DrugCandidate> pending, String selection,
    String drugName) {
    if (StringUtils.hasText(selection)) {
      String choice = selection.trim();
      try {
        int index = Integer.parseInt(choice);
        if (index >= 1 && index <= pending.size()) {
          return Optional.of(pending.get(index - 1));
        }
        return Optional.empty();
      } catch (NumberFormatException e) {
        return findByName(pending, choice);
      }
    }
    return drugName == null ? Optional.empty() : findByName(pending, drugName);
  }

  private static Optional<DrugCandidate> findByName(List<DrugCandidate> candidates, String name) {
    return candidates.stream()
      .filter(c -> c.getName().equalsIgnoreCase(name.trim()))
      .findFirst();
  }

  private static boolean matchesResolved(DrugCandidate resolved, String drug) {
    return resolved != null && drug != null && resolved.getName().equalsIgnoreCase(drug.trim());
  }
}
