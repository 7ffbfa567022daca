package com.github.spud.refill.infrastructure.notification;

import com.github.spud.refill.domain.escalation.EscalationCase;
import com.github.spud.refill.domain.escalation.EscalationNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reviewer channel that only writes to the log. The context package is not logged.
 */
@Slf4j
@Component
public class LoggingEscalationNotifier implements EscalationNotifier {

  @Override
  public void notify(EscalationCase escalationCase) {
    log.info("Reviewer notified: escalationId={}, reason={}, role={}",
      escalationCase.getEscalationId(), escalationCase.getReasonCode(),
      escalationCase.getTargetRole());
  }
}
