package com.github.spud.refill.domain.evaluator;

import java.util.EnumSet;
import java.util.Set;

/**
 * 流程使用的评估器类型
 */
public enum EvaluatorType {
  IDENTITY("identity-verifier"),
  DISAMBIGUATION("disambiguation-resolver"),
  DRUG_INTERACTION("drug-interaction-checker"),
  ALLERGY("allergy-checker"),
  CONTROLLED_SUBSTANCE("controlled-substance-classifier"),
  DOSAGE("dosage-checker"),
  INVENTORY("inventory-backend");

  /**
   * SAFETY_CHECK 中并发调用的评估器
   */
  public static final Set<EvaluatorType> SAFETY_CHECKS =
    EnumSet.of(DRUG_INTERACTION, ALLERGY, CONTROLLED_SUBSTANCE, DOSAGE);

  private final String actorName;

  EvaluatorType(String actorName) {
    this.actorName = actorName;
  }

  /**
   * 该评估器结果决定转换时记入审计的 actor 名
   */
  public String getActorName() {
    return actorName;
  }

  /**
   * 该评估器的 FAIL / REQUIRES_ESCALATION 是否必然触发熔断（库存结果走常规转换表）
   */
  public boolean isSafetyCheck() {
    return this != INVENTORY;
  }
}
