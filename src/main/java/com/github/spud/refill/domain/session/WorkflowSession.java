package com.github.spud.refill.domain.session;

import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.state.WorkflowState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-conversation workflow state. Mutated once per turn by the session controller and written
 * back with compare-and-put on {@link #version}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowSession {

  private String sessionId;

  private WorkflowState currentState;

  /**
   * MRN; only trusted once {@link #identityVerified} is set
   */
  private String patientRef;

  private boolean identityVerified;

  @Builder.Default
  private Map<String, String> collectedEntities = new HashMap<>();

  /**
   * Clarification attempts per slot, never above the configured maximum
   */
  @Builder.Default
  private Map<String, Integer> retryCounts = new HashMap<>();

  /**
   * Most recent turn confidences, oldest first
   */
  @Builder.Default
  private List<Double> confidenceHistory = new ArrayList<>();

  /**
   * Drug candidates awaiting a selection
   */
  @Builder.Default
  private List<DrugCandidate> pendingCandidates = new ArrayList<>();

  private DrugCandidate resolvedDrug;

  private String escalationId;

  private String escalationReason;

  private String orderId;

  /**
   * Recent raw utterances, truncated, for the escalation context package
   */
  @Builder.Default
  private List<String> conversationExcerpt = new ArrayList<>();

  private int lastTurnSequence;

  private TurnResponse lastResponse;

  @Builder.Default
  private List<AuditRecord> lastTurnAudit = new ArrayList<>();

  private long version;

  private Instant createdAt;

  private Instant updatedAt;

  private Instant ttlDeadline;

  public static WorkflowSession start(String sessionId, Instant now) {
    return WorkflowSession.builder()
      .sessionId(sessionId)
      .currentState(WorkflowState.COLLECT_REQUEST)
      .version(0)
      .createdAt(now)
      .updatedAt(now)
      .build();
  }

  public int retryCount(String slot) {
    return retryCounts.getOrDefault(slot, 0);
  }

  /**
   * Working copy whose collections can be mutated without touching this instance
   */
  public WorkflowSession copy() {
    return toBuilder()
      .collectedEntities(new HashMap<>(collectedEntities))
      .retryCounts(new HashMap<>(retryCounts))
      .confidenceHistory(new ArrayList<>(confidenceHistory))
      .pendingCandidates(new ArrayList<>(pendingCandidates))
      .conversationExcerpt(new ArrayList<>(conversationExcerpt))
      .lastTurnAudit(new ArrayList<>(lastTurnAudit))
      .build();
  }
}
