package com.github.spud.refill.domain.policy;

import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import com.github.spud.refill.domain.session.TransitionEvent;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.WorkflowState;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * 熔断规则的输入上下文，转换引擎每一步构建一次
 */
@Value
@Builder
public class BreakerContext {

  WorkflowState state;

  WorkflowSession session;

  TransitionEvent event;

  /**
   * 仅在 COLLECT_REQUEST 中存在
   */
  CollectionAssessment assessment;

  /**
   * 本步将要追问的槽位，没有则为 null
   */
  String clarifySlot;

  public Optional<EvaluatorVerdict> verdict(EvaluatorType type) {
    return event.verdict(type);
  }

  /**
   * 按评估器顺序排列的结果，末尾附上推导出的消歧结果
   */
  public List<EvaluatorVerdict> allVerdicts() {
    List<EvaluatorVerdict> verdicts = new ArrayList<>();
    for (EvaluatorType type : EvaluatorType.values()) {
      event.verdict(type).ifPresent(verdicts::add);
    }
    if (assessment != null && assessment.getDisambiguationVerdict() != null) {
      verdicts.add(assessment.getDisambiguationVerdict());
    }
    return verdicts;
  }
}
