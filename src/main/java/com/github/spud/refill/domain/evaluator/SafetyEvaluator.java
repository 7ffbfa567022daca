package com.github.spud.refill.domain.evaluator;

/**
 * 评估器统一接口（身份、安全、后端检查）
 * <p>
 * 实现可以阻塞，{@link EvaluatorGateway} 为每次调用设置超时
 */
public interface SafetyEvaluator {

  EvaluatorType type();

  /**
   * @throws EvaluatorUnavailableException 后端无法应答时
   */
  EvaluatorVerdict evaluate(EvaluationRequest request);
}
