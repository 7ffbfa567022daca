package com.github.spud.refill.domain.evaluator;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 消歧检索返回的单个候选
 */
@Value
@Builder
@Jacksonized
public class DrugCandidate {

  String name;

  String code;

  double similarity;
}
