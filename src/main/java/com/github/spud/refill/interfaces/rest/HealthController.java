package com.github.spud.refill.interfaces.rest;

import com.github.spud.refill.domain.evaluator.EvaluatorGateway;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness plus the availability breaker state of every evaluator
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final EvaluatorGateway gateway;

  @GetMapping("/health")
  public Mono<ResponseEntity<Map<String, Object>>> health() {
    return Mono.fromCallable(() -> {
      Map<String, String> evaluators = new LinkedHashMap<>();
      boolean degraded = false;
      for (Map.Entry<EvaluatorType, CircuitBreaker.State> entry :
        gateway.availability().entrySet()) {
        evaluators.put(entry.getKey().getActorName(), entry.getValue().name());
        degraded |= entry.getValue() == CircuitBreaker.State.OPEN;
      }
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", degraded ? "DEGRADED" : "UP");
      body.put("evaluators", evaluators);
      return ResponseEntity.ok(body);
    });
  }
}
