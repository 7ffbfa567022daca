package com.github.spud.refill.infrastructure.persistence;

import com.github.spud.refill.domain.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes sessions past their TTL. Escalation cases are not touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpirySweeper {

  private final SessionStore sessionStore;

  @Scheduled(fixedDelayString = "${refill.workflow.sweep-interval-ms:60000}")
  public void sweep() {
    try {
      int purged = sessionStore.purgeExpired();
      if (purged > 0) {
        log.info("Purged {} expired sessions", purged);
      }
    } catch (DataAccessException e) {
      log.error("Session sweep failed", e);
    }
  }
}
