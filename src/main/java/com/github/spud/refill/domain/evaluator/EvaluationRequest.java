package com.github.spud.refill.domain.evaluator;

import lombok.Builder;
import lombok.Value;

/**
 * 评估器可读取的会话字段快照，每次调用重新构建，评估器不接触会话本身
 */
@Value
@Builder
public class EvaluationRequest {

  String sessionId;

  String patientRef;

  String drugName;

  String drugCode;

  String dose;

  String quantity;

  String frequency;
}
