package com.github.spud.refill.domain.state;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * 单次 {@link TransitionEngine#advance} 的结果
 */
@Value
@Builder
public class TransitionResult {

  WorkflowState fromState;

  WorkflowState nextState;

  /**
   * 有序指令，控制器按此顺序执行
   */
  List<Directive> directives;

  /**
   * 触发本次结果的熔断原因码（如有）
   */
  String breakerReason;

  public Optional<String> breakerReason() {
    return Optional.ofNullable(breakerReason);
  }

  public boolean isStateChange() {
    return fromState != nextState;
  }

  public List<Directive> directivesOf(DirectiveType type) {
    return directives.stream()
      .filter(d -> d.getType() == type)
      .collect(Collectors.toList());
  }

  public boolean has(DirectiveType type) {
    return directives.stream().anyMatch(d -> d.getType() == type);
  }
}
