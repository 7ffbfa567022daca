package com.github.spud.refill.application.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

  /**
   * Availability breakers for evaluator calls, one instance per evaluator type
   */
  @Bean
  public CircuitBreakerRegistry evaluatorCircuitBreakerRegistry(WorkflowProperties properties) {
    return evaluatorRegistry(properties.getAvailability());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  public static CircuitBreakerRegistry evaluatorRegistry(WorkflowProperties.Availability settings) {
    CircuitBreakerConfig config = CircuitBreakerConfig.custom()
      .slidingWindowType(SlidingWindowType.COUNT_BASED)
      .slidingWindowSize(settings.getSlidingWindowSize())
      .minimumNumberOfCalls(settings.getSlidingWindowSize())
      .failureRateThreshold(settings.getFailureRateThreshold())
      .waitDurationInOpenState(settings.getWaitDurationInOpenState())
      .build();
    return CircuitBreakerRegistry.of(config);
  }
}
