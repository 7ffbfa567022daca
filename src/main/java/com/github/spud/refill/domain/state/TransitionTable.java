package com.github.spud.refill.domain.state;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 静态状态转换表
 * <pre>
 *   COLLECT_REQUEST    --(RequestRefill|Clarification)--> COLLECT_REQUEST | SAFETY_CHECK | ESCALATE_HANDOFF
 *   SAFETY_CHECK       --(Continue|RequestRefill|Clarification)--> SAFETY_CHECK | BACKEND_CHECK | ESCALATE_HANDOFF
 *   BACKEND_CHECK      --(Continue|RequestRefill|Clarification)--> BACKEND_CHECK | DISPENSED | PA_APPROVAL_NEEDED | ESCALATE_HANDOFF
 *   PA_APPROVAL_NEEDED --(RoutingResolved|Continue)--> ESCALATE_HANDOFF
 *   ESCALATE_HANDOFF   --(HandoffAcknowledged)--> ESCALATION_COMPLETE
 * </pre>
 * StatusInquiry 在任意状态下都接受且不改变状态。
 * CancelRequest 仅在 COLLECT_REQUEST / SAFETY_CHECK / BACKEND_CHECK 接受：不改变状态，会话随即丢弃。
 */
public final class TransitionTable {

  private static final Map<WorkflowState, Set<Intent>> ACCEPTED_INTENTS =
    new EnumMap<>(WorkflowState.class);

  private static final Map<WorkflowState, Set<WorkflowState>> EDGES =
    new EnumMap<>(WorkflowState.class);

  static {
    ACCEPTED_INTENTS.put(WorkflowState.COLLECT_REQUEST,
      EnumSet.of(Intent.REQUEST_REFILL, Intent.CLARIFICATION, Intent.CANCEL_REQUEST));
    ACCEPTED_INTENTS.put(WorkflowState.SAFETY_CHECK, EnumSet.of(
      Intent.CONTINUE, Intent.REQUEST_REFILL, Intent.CLARIFICATION, Intent.CANCEL_REQUEST));
    ACCEPTED_INTENTS.put(WorkflowState.BACKEND_CHECK, EnumSet.of(
      Intent.CONTINUE, Intent.REQUEST_REFILL, Intent.CLARIFICATION, Intent.CANCEL_REQUEST));
    ACCEPTED_INTENTS.put(WorkflowState.PA_APPROVAL_NEEDED,
      EnumSet.of(Intent.ROUTING_RESOLVED, Intent.CONTINUE));
    ACCEPTED_INTENTS.put(WorkflowState.ESCALATE_HANDOFF,
      EnumSet.of(Intent.HANDOFF_ACKNOWLEDGED));
    ACCEPTED_INTENTS.put(WorkflowState.DISPENSED, EnumSet.noneOf(Intent.class));
    ACCEPTED_INTENTS.put(WorkflowState.ESCALATION_COMPLETE, EnumSet.noneOf(Intent.class));

    EDGES.put(WorkflowState.COLLECT_REQUEST, EnumSet.of(
      WorkflowState.COLLECT_REQUEST, WorkflowState.SAFETY_CHECK, WorkflowState.ESCALATE_HANDOFF));
    EDGES.put(WorkflowState.SAFETY_CHECK, EnumSet.of(
      WorkflowState.SAFETY_CHECK, WorkflowState.BACKEND_CHECK, WorkflowState.ESCALATE_HANDOFF));
    EDGES.put(WorkflowState.BACKEND_CHECK, EnumSet.of(
      WorkflowState.BACKEND_CHECK, WorkflowState.DISPENSED, WorkflowState.PA_APPROVAL_NEEDED,
      WorkflowState.ESCALATE_HANDOFF));
    EDGES.put(WorkflowState.PA_APPROVAL_NEEDED, EnumSet.of(WorkflowState.ESCALATE_HANDOFF));
    EDGES.put(WorkflowState.ESCALATE_HANDOFF, EnumSet.of(WorkflowState.ESCALATION_COMPLETE));
    EDGES.put(WorkflowState.DISPENSED, EnumSet.noneOf(WorkflowState.class));
    EDGES.put(WorkflowState.ESCALATION_COMPLETE, EnumSet.noneOf(WorkflowState.class));
  }

  private TransitionTable() {
  }

  public static boolean accepts(WorkflowState state, Intent intent) {
    if (intent == Intent.STATUS_INQUIRY) {
      return true;
    }
    return ACCEPTED_INTENTS.get(state).contains(intent);
  }

  public static Set<Intent> acceptedIntents(WorkflowState state) {
    return Collections.unmodifiableSet(ACCEPTED_INTENTS.get(state));
  }

  public static boolean isDefined(WorkflowState from, WorkflowState to) {
    return EDGES.get(from).contains(to);
  }

  public static Set<WorkflowState> successors(WorkflowState from) {
    return Collections.unmodifiableSet(EDGES.get(from));
  }
}
