package com.github.spud.refill.domain.evaluator;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.evaluator.EvaluationBatch.EvaluatorResponse;
import com.github.spud.refill.domain.policy.ReasonCodes;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 评估器网关 - 并发调用评估器，每次调用带超时和可用性熔断
 * <p>
 * 每个评估器恰好产出一个结果：异常、超时、熔断打开统一转为 UNAVAILABLE，不向上抛出
 */
@Slf4j
@Component
public class EvaluatorGateway {

  private final Map<EvaluatorType, SafetyEvaluator> evaluators;
  private final DisambiguationResolver resolver;
  private final CircuitBreakerRegistry breakerRegistry;
  private final WorkflowProperties properties;

  public EvaluatorGateway(List<SafetyEvaluator> evaluators, DisambiguationResolver resolver,
    CircuitBreakerRegistry breakerRegistry, WorkflowProperties properties) {
    this.evaluators = new EnumMap<>(EvaluatorType.class);
    for (SafetyEvaluator evaluator : evaluators) {
      this.evaluators.put(evaluator.type(), evaluator);
    }
    this.resolver = resolver;
    this.breakerRegistry = breakerRegistry;
    this.properties = properties;
  }

  /**
   * 并发调用所需评估器，全部返回后汇总
   */
  public EvaluationBatch invoke(Set<EvaluatorType> types, EvaluationRequest request) {
    if (types.isEmpty()) {
      return EvaluationBatch.empty();
    }
    log.debug("Invoking evaluators {} for sessionId={}", types, request.getSessionId());

    List<Mono<EvaluatorResponse>> calls = types.stream()
      .sorted()
      .map(type -> call(type, request))
      .collect(Collectors.toList());

    return Flux.merge(calls)
      .collectList()
      .map(EvaluationBatch::of)
      .block();
  }

  /**
   * 各评估器当前的熔断状态（用于健康检查）
   */
  public Map<EvaluatorType, CircuitBreaker.State> availability() {
    Map<EvaluatorType, CircuitBreaker.State> states = new EnumMap<>(EvaluatorType.class);
    for (EvaluatorType type : EvaluatorType.values()) {
      states.put(type, breaker(type).getState());
    }
    return states;
  }

  private Mono<EvaluatorResponse> call(EvaluatorType type, EvaluationRequest request) {
    return Mono.fromCallable(() -> execute(type, request))
      .subscribeOn(Schedulers.boundedElastic())
      .timeout(properties.timeoutFor(type))
      .transformDeferred(CircuitBreakerOperator.of(breaker(type)))
      .onErrorResume(e -> {
        String reason = unavailableReason(e);
        log.warn("Evaluator {} unavailable for sessionId={}: {}", type, request.getSessionId(),
          reason);
        return Mono.just(new EvaluatorResponse(EvaluatorVerdict.unavailable(type, reason), null));
      });
  }

  private EvaluatorResponse execute(EvaluatorType type, EvaluationRequest request) {
    if (type == EvaluatorType.DISAMBIGUATION) {
      List<DrugCandidate> candidates = resolver.resolve(request.getDrugName());
      return new EvaluatorResponse(EvaluatorVerdict.pass(type),
        candidates == null ? List.of() : List.copyOf(candidates));
    }

    SafetyEvaluator evaluator = evaluators.get(type);
    if (evaluator == null) {
      return new EvaluatorResponse(
        EvaluatorVerdict.unavailable(type, ReasonCodes.EVALUATOR_NOT_CONFIGURED), null);
    }

    EvaluatorVerdict verdict = evaluator.evaluate(request);
    if (verdict == null || verdict.getOutcome() == null) {
      throw new EvaluatorUnavailableException("Evaluator " + type + " returned no verdict");
    }
    if (!verdict.isPass() && !StringUtils.hasText(verdict.getReasonCode())) {
      log.warn("Evaluator {} returned {} without a reason code", type, verdict.getOutcome());
      return new EvaluatorResponse(
        EvaluatorVerdict.unavailable(type, ReasonCodes.MISSING_REASON_CODE), null);
    }
    if (verdict.getEvaluator() != type) {
      verdict = EvaluatorVerdict.of(type, verdict.getOutcome(), verdict.getReasonCode(),
        verdict.getDetail());
    }
    return new EvaluatorResponse(verdict, null);
  }

  private CircuitBreaker breaker(EvaluatorType type) {
    return breakerRegistry.circuitBreaker(type.getActorName());
  }

  private static String unavailableReason(Throwable e) {
    if (e instanceof TimeoutException) {
      return ReasonCodes.EVALUATOR_TIMEOUT;
    }
    if (e instanceof CallNotPermittedException) {
      return ReasonCodes.EVALUATOR_CIRCUIT_OPEN;
    }
    return ReasonCodes.EVALUATOR_ERROR;
  }
}
