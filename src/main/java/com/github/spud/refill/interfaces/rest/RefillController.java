package com.github.spud.refill.interfaces.rest;

import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.error.ErrorKind;
import com.github.spud.refill.domain.error.RefillWorkflowException;
import com.github.spud.refill.domain.session.SessionController;
import com.github.spud.refill.domain.session.TurnRequest;
import com.github.spud.refill.domain.session.TurnResponse;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.WorkflowState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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
 * Refill conversation Api
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/refill")
@RequiredArgsConstructor
public class RefillController {

  private final SessionController sessionController;

  /**
   * 处理一轮已分类的对话
   */
  @PostMapping("/turns")
  public Mono<ResponseEntity<TurnResponse>> submitTurn(
    @Valid @RequestBody TurnRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Turn received: sessionId={}, turnSequence={}, intent={}",
          request.getSessionId(), request.getTurnSequence(), request.getIntent());
        return ResponseEntity.ok(sessionController.handleTurn(request.toTurnRequest()));
      })
      .subscribeOn(Schedulers.boundedElastic())
      .onErrorResume(RefillWorkflowException.class, e -> {
        log.warn("Turn failed: sessionId={}, kind={}", request.getSessionId(), e.getKind());
        return Mono.just(ResponseEntity.status(GlobalExceptionHandler.statusOf(e))
          .body(TurnResponse.failed(request.getSessionId(), e.getKind())));
      })
      .onErrorResume(e -> !(e instanceof IllegalArgumentException), e -> {
        log.error("Turn failed: sessionId={}", request.getSessionId(), e);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(TurnResponse.failed(request.getSessionId(), ErrorKind.INTERNAL)));
      });
  }

  /**
   * 查询会话当前状态（不含患者数据）
   */
  @GetMapping("/sessions/{sessionId}")
  public Mono<ResponseEntity<SessionSummary>> getSession(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(
        SessionSummary.of(sessionController.findSession(sessionId))))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/sessions/{sessionId}/audit")
  public Mono<ResponseEntity<List<AuditRecord>>> getAuditTrail(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionController.auditTrail(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  // ===== DTOs =====

  @Data
  public static class TurnRequestDto {

    @NotBlank
    private String sessionId;

    private String rawUtterance;

    @NotNull
    private Intent intent;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private Map<String, String> extractedEntities = new HashMap<>();

    @Min(1)
    private int turnSequence;

    TurnRequest toTurnRequest() {
      return TurnRequest.builder()
        .sessionId(sessionId)
        .rawUtterance(rawUtterance)
        .intent(intent)
        .confidence(confidence)
        .extractedEntities(extractedEntities == null ? Map.of() : extractedEntities)
        .turnSequence(turnSequence)
        .build();
    }
  }

  @Value
  @Builder
  public static class SessionSummary {

    String sessionId;

    WorkflowState state;

    boolean identityVerified;

    List<String> collectedSlots;

    Map<String, Integer> retryCounts;

    String escalationId;

    String orderId;

    int lastTurnSequence;

    Instant updatedAt;

    Instant ttlDeadline;

    static SessionSummary of(WorkflowSession session) {
      return SessionSummary.builder()
        .sessionId(session.getSessionId())
        .state(session.getCurrentState())
        .identityVerified(session.isIdentityVerified())
        .collectedSlots(session.getCollectedEntities().keySet().stream().sorted()
          .collect(Collectors.toList()))
        .retryCounts(Map.copyOf(session.getRetryCounts()))
        .escalationId(session.getEscalationId())
        .orderId(session.getOrderId())
        .lastTurnSequence(session.getLastTurnSequence())
        .updatedAt(session.getUpdatedAt())
        .ttlDeadline(session.getTtlDeadline())
        .build();
    }
  }
}
