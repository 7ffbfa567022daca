package com.github.spud.refill.interfaces.rest;

import com.github.spud.refill.domain.escalation.EscalationCase;
import com.github.spud.refill.domain.escalation.EscalationCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reviewer channel Api
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/escalations")
@RequiredArgsConstructor
public class EscalationController {

  private final EscalationCoordinator coordinator;

  @GetMapping("/pending")
  public Mono<ResponseEntity<List<EscalationCase>>> listPending() {
    return Mono.fromCallable(() -> ResponseEntity.ok(coordinator.listPending()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{escalationId}")
  public Mono<ResponseEntity<EscalationCase>> getEscalation(@PathVariable String escalationId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(coordinator.find(escalationId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 审核人确认接手，完成交接
   */
  @PostMapping("/{escalationId}/acknowledge")
  public Mono<ResponseEntity<EscalationCase>> acknowledge(
    @PathVariable String escalationId,
    @Valid @RequestBody ReviewerActionDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Acknowledging escalationId={}", escalationId);
        return ResponseEntity.ok(coordinator.acknowledge(escalationId, request.getActor()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{escalationId}/resolve")
  public Mono<ResponseEntity<EscalationCase>> resolve(
    @PathVariable String escalationId,
    @Valid @RequestBody ReviewerActionDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Resolving escalationId={}", escalationId);
        return ResponseEntity.ok(coordinator.resolve(escalationId, request.getActor()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @Data
  public static class ReviewerActionDto {

    @NotBlank
    private String actor;
  }
}
