package com.github.spud.refill.domain.evaluator;

/**
 * 评估器后端故障时抛出，由网关转换为 UNAVAILABLE 结果，不会传递给调用方
 */
public class EvaluatorUnavailableException extends RuntimeException {

  public EvaluatorUnavailableException(String message) {
    super(message);
  }

  public EvaluatorUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
