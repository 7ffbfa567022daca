package com.github.spud.refill.infrastructure.evaluator;

import com.github.spud.refill.domain.evaluator.DisambiguationResolver;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Ranks formulary drug names by Jaro-Winkler similarity to the free text
 */
@Component
@RequiredArgsConstructor
public class FormularyDisambiguationResolver implements DisambiguationResolver {

  private static final int MAX_CANDIDATES = 5;

  private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

  private final ReferenceDataProperties referenceData;

  @Override
  public List<DrugCandidate> resolve(String freeText) {
    if (!StringUtils.hasText(freeText)) {
      return List.of();
    }
    String query = freeText.trim().toLowerCase(Locale.ROOT);
    return referenceData.getFormulary().stream()
      .map(drug -> DrugCandidate.builder()
        .name(drug.getName())
        .code(drug.getCode())
        .similarity(similarity.apply(query, drug.getName().toLowerCase(Locale.ROOT)))
        .build())
      .sorted(Comparator.comparingDouble(DrugCandidate::getSimilarity).reversed())
      .limit(MAX_CANDIDATES)
      .collect(Collectors.toList());
  }
}
