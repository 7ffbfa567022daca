package com.github.spud.refill.domain.policy;

/**
 * 写入审计记录与升级工单的原因码
 */
public final class ReasonCodes {

  // 熔断原因（按优先级）
  public static final String LOW_CONFIDENCE = "LOW_CONFIDENCE";
  public static final String IDENTITY_VERIFICATION_FAILED = "IDENTITY_VERIFICATION_FAILED";
  public static final String MAJOR_DRUG_INTERACTION = "MAJOR_DRUG_INTERACTION";
  public static final String ALLERGY_MATCH = "ALLERGY_MATCH";
  public static final String CONTROLLED_SUBSTANCE = "CONTROLLED_SUBSTANCE";
  public static final String BACKEND_UNAVAILABLE = "BACKEND_UNAVAILABLE";
  public static final String MAX_RETRIES_EXCEEDED = "MAX_RETRIES_EXCEEDED";

  // 评估结果原因
  public static final String MODERATE_DRUG_INTERACTION = "MODERATE_DRUG_INTERACTION";
  public static final String ALLERGY_CROSS_SENSITIVITY = "ALLERGY_CROSS_SENSITIVITY";
  public static final String DOSE_OUT_OF_RANGE = "DOSE_OUT_OF_RANGE";
  public static final String INVALID_DOSE = "INVALID_DOSE";
  public static final String DRUG_NOT_RESOLVED = "DRUG_NOT_RESOLVED";
  public static final String NOT_ON_FORMULARY = "NOT_ON_FORMULARY";
  public static final String OUT_OF_STOCK = "OUT_OF_STOCK";
  public static final String PRIOR_AUTHORIZATION_REQUIRED = "PRIOR_AUTHORIZATION_REQUIRED";

  // 可用性原因（UNAVAILABLE 结果）
  public static final String EVALUATOR_TIMEOUT = "EVALUATOR_TIMEOUT";
  public static final String EVALUATOR_ERROR = "EVALUATOR_ERROR";
  public static final String EVALUATOR_CIRCUIT_OPEN = "EVALUATOR_CIRCUIT_OPEN";
  public static final String EVALUATOR_NOT_CONFIGURED = "EVALUATOR_NOT_CONFIGURED";
  public static final String MISSING_REASON_CODE = "MISSING_REASON_CODE";

  private ReasonCodes() {
  }
}
