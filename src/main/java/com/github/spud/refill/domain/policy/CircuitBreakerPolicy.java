package com.github.spud.refill.domain.policy;

import java.util.Optional;

/**
 * 熔断策略接口 - 判断当前步骤是否必须转人工
 */
public interface CircuitBreakerPolicy {

  /**
   * 按顺序检查规则，首个触发的规则生效
   *
   * @return 熔断原因码；为空则按常规路径继续
   */
  Optional<String> evaluate(BreakerContext context);
}
