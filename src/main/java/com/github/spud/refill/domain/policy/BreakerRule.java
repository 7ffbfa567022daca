package com.github.spud.refill.domain.policy;

import java.util.Optional;

/**
 * 单条熔断规则
 */
@FunctionalInterface
public interface BreakerRule {

  /**
   * @return 规则触发时的熔断原因码
   */
  Optional<String> apply(BreakerContext context);
}
