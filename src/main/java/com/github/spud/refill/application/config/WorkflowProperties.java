package com.github.spud.refill.application.config;

import com.github.spud.refill.domain.evaluator.EvaluatorType;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds, budgets and timeouts of the refill workflow
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "refill.workflow")
public class WorkflowProperties {

  /**
   * Below this confidence the LOW_CONFIDENCE breaker fires
   */
  private double escalationConfidence = 0.70;

  /**
   * Below this confidence (and above the escalation threshold) the user is re-prompted
   */
  private double clarifyConfidence = 0.85;

  /**
   * Disambiguation similarity above which the top candidate is confirmed without asking
   */
  private double autoConfirmSimilarity = 0.95;

  /**
   * Disambiguation similarity below which the drug is considered unresolved
   */
  private double minSimilarity = 0.75;

  /**
   * Number of candidates presented for a selection sub-turn
   */
  private int candidatesPresented = 3;

  /**
   * Clarification attempts allowed per slot before MAX_RETRIES_EXCEEDED fires
   */
  private int maxRetries = 3;

  /**
   * Inactivity TTL of a workflow session, refreshed on every write
   */
  private Duration sessionTtl = Duration.ofMinutes(5);

  /**
   * Upper bound of automatic transitions chained inside one turn
   */
  private int maxCascadeSteps = 8;

  private int confidenceHistorySize = 10;

  /**
   * Number of recent utterances kept for the escalation context package
   */
  private int excerptSize = 3;

  private int excerptMaxChars = 200;

  private Duration evaluatorTimeout = Duration.ofSeconds(2);

  private Duration backendTimeout = Duration.ofSeconds(3);

  /**
   * How long a turn waits for another in-flight turn of the same session
   */
  private Duration lockTimeout = Duration.ofSeconds(10);

  private Availability availability = new Availability();

  public Duration timeoutFor(EvaluatorType type) {
    return type == EvaluatorType.INVENTORY ? backendTimeout : evaluatorTimeout;
  }

  /**
   * Per-evaluator availability circuit breaker
   */
  @Getter
  @Setter
  public static class Availability {

    private int slidingWindowSize = 5;

    private float failureRateThreshold = 100.0f;

    private Duration waitDurationInOpenState = Duration.ofSeconds(30);
  }
}
