package com.github.spud.refill.domain.policy;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * 药品消歧策略：高于 0.95 自动确认，0.75 ~ 0.95 让用户选择，低于 0.75 升级
 */
@Component
@RequiredArgsConstructor
public class DisambiguationPolicy {

  public enum Kind {
    AUTO_CONFIRMED,
    NEEDS_SELECTION,
    UNRESOLVED
  }

  @Value
  public static class Outcome {

    Kind kind;

    /**
     * 已确认的药品（AUTO_CONFIRMED）或排序后的候选（NEEDS_SELECTION）
     */
    List<DrugCandidate> candidates;

    public DrugCandidate top() {
      return candidates.isEmpty() ? null : candidates.get(0);
    }
  }

  private final WorkflowProperties properties;

  public Outcome classify(List<DrugCandidate> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return new Outcome(Kind.UNRESOLVED, List.of());
    }
    List<DrugCandidate> ranked = candidates.stream()
      .sorted(Comparator.comparingDouble(DrugCandidate::getSimilarity).reversed())
      .collect(Collectors.toList());
    double top = ranked.get(0).getSimilarity();

    if (top > properties.getAutoConfirmSimilarity()) {
      return new Outcome(Kind.AUTO_CONFIRMED, List.of(ranked.get(0)));
    }
    if (top >= properties.getMinSimilarity()) {
      int limit = Math.min(properties.getCandidatesPresented(), ranked.size());
      return new Outcome(Kind.NEEDS_SELECTION, List.copyOf(ranked.subList(0, limit)));
    }
    return new Outcome(Kind.UNRESOLVED, List.of());
  }
}
