package com.github.spud.refill.domain.session;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.state.Directive;
import com.github.spud.refill.domain.state.TransitionResult;
import java.util.ArrayList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link TransitionResult} to a working copy of the session
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectiveApplier {

  private final WorkflowProperties properties;

  public void apply(WorkflowSession session, TransitionResult result, TurnLedger ledger) {
    for (Directive directive : result.getDirectives()) {
      switch (directive.getType()) {
        case PERSIST_ENTITY:
          session.getCollectedEntities().put(directive.getSlot(), directive.getValue());
          break;
        case RESOLVE_DRUG:
          session.setResolvedDrug(directive.getCandidates().get(0));
          session.getCollectedEntities().put(RefillSlots.DRUG_NAME, directive.getValue());
          session.setPendingCandidates(new ArrayList<>());
          break;
        case CONFIRM_IDENTITY:
          session.setIdentityVerified(true);
          session.setPatientRef(session.getCollectedEntities().get(RefillSlots.PATIENT_ID));
          break;
        case RESET_RETRY:
          session.getRetryCounts().remove(directive.getSlot());
          break;
        case INCREMENT_RETRY:
          int next = Math.min(session.retryCount(directive.getSlot()) + 1,
            properties.getMaxRetries());
          session.getRetryCounts().put(directive.getSlot(), next);
          break;
        case CLARIFY:
          if (RefillSlots.DRUG_NAME.equals(directive.getSlot())
            && !directive.getCandidates().isEmpty()) {
            session.setPendingCandidates(new ArrayList<>(directive.getCandidates()));
          }
          ledger.prompt(directive.getPrompt(), directive.getCandidates());
          break;
        case EMIT_PROMPT:
          ledger.prompt(directive.getPrompt(), null);
          break;
        case EMIT_AUDIT:
          ledger.recordTransition(directive);
          break;
        case REQUEST_ESCALATION:
          ledger.requestEscalation(directive.getReasonCode());
          break;
        case COMPLETE:
          session.setOrderId(directive.getValue());
          ledger.complete(directive.getValue());
          break;
        case CANCEL:
          ledger.cancel();
          break;
        default:
          log.debug("Directive {} is handled by the caller", directive.getType());
      }
    }
    session.setCurrentState(result.getNextState());
  }
}
