package com.github.spud.refill.domain.policy;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.evaluator.VerdictOutcome;
import com.github.spud.refill.domain.state.WorkflowState;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * 默认熔断策略实现，按优先级：
 * <ol>
 *   <li>受置信度约束的状态下置信度低于升级阈值</li>
 *   <li>身份核验失败</li>
 *   <li>严重药物相互作用</li>
 *   <li>直接过敏匹配</li>
 *   <li>管制药品</li>
 *   <li>任一评估器不可用</li>
 *   <li>追问次数耗尽</li>
 *   <li>其他阻断性安全结果（沿用其原因码）</li>
 * </ol>
 * ESCALATE_HANDOFF 与终态下不检查
 */
@Component
public class DefaultCircuitBreakerPolicy implements CircuitBreakerPolicy {

  private final List<BreakerRule> rules;

  public DefaultCircuitBreakerPolicy(WorkflowProperties properties) {
    this.rules = List.of(
      lowConfidence(properties.getEscalationConfidence()),
      blockingVerdict(EvaluatorType.IDENTITY, ReasonCodes.IDENTITY_VERIFICATION_FAILED, false),
      blockingVerdict(EvaluatorType.DRUG_INTERACTION, ReasonCodes.MAJOR_DRUG_INTERACTION, true),
      blockingVerdict(EvaluatorType.ALLERGY, ReasonCodes.ALLERGY_MATCH, true),
      blockingVerdict(EvaluatorType.CONTROLLED_SUBSTANCE, ReasonCodes.CONTROLLED_SUBSTANCE, true),
      DefaultCircuitBreakerPolicy::anyUnavailable,
      retriesExhausted(properties.getMaxRetries()),
      DefaultCircuitBreakerPolicy::otherBlockingVerdict
    );
  }

  @Override
  public Optional<String> evaluate(BreakerContext context) {
    WorkflowState state = context.getState();
    if (WorkflowState.isFinal(state) || state == WorkflowState.ESCALATE_HANDOFF) {
      return Optional.empty();
    }
    for (BreakerRule rule : rules) {
      Optional<String> reason = rule.apply(context);
      if (reason.isPresent()) {
        return reason;
      }
    }
    return Optional.empty();
  }

  static BreakerRule lowConfidence(double threshold) {
    return context -> WorkflowState.gatesOnConfidence(context.getState())
      && context.getEvent().effectiveConfidence() < threshold
      ? Optional.of(ReasonCodes.LOW_CONFIDENCE)
      : Optional.empty();
  }

  /**
   * {@code type} 返回 FAIL 时触发；设置 {@code matchReason} 时，任何带 {@code reasonCode}
   * 的阻断结果也会触发
   */
  static BreakerRule blockingVerdict(EvaluatorType type, String reasonCode, boolean matchReason) {
    Predicate<EvaluatorVerdict> fires = matchReason
      ? v -> v.isBlocking() && reasonCode.equals(v.getReasonCode())
      : v -> v.getOutcome() == VerdictOutcome.FAIL;
    return context -> context.verdict(type).filter(fires).map(v -> reasonCode);
  }

  static Optional<String> anyUnavailable(BreakerContext context) {
    return context.allVerdicts().stream()
      .anyMatch(EvaluatorVerdict::isUnavailable)
      ? Optional.of(ReasonCodes.BACKEND_UNAVAILABLE)
      : Optional.empty();
  }

  static BreakerRule retriesExhausted(int maxRetries) {
    return context -> {
      String slot = context.getClarifySlot();
      if (slot == null) {
        return Optional.empty();
      }
      return context.getSession().retryCount(slot) + 1 > maxRetries
        ? Optional.of(ReasonCodes.MAX_RETRIES_EXCEEDED)
        : Optional.empty();
    };
  }

  static Optional<String> otherBlockingVerdict(BreakerContext context) {
    return context.allVerdicts().stream()
      .filter(v -> v.getEvaluator() != null && v.getEvaluator().isSafetyCheck())
      .filter(EvaluatorVerdict::isBlocking)
      .map(EvaluatorVerdict::getReasonCode)
      .findFirst();
  }
}
