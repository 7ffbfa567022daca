package com.github.spud.refill.domain.session;

import java.time.Duration;
import java.util.Optional;

/**
 * Session persistence. Expired sessions are reported as absent.
 */
public interface SessionStore {

  Optional<WorkflowSession> get(String sessionId);

  void put(WorkflowSession session, Duration ttl);

  /**
   * Write {@code session} only if the stored version equals {@code expectedVersion}. A session
   * that does not exist (or has expired) matches an expected version of 0.
   *
   * @return false on a version mismatch
   */
  boolean compareAndPut(WorkflowSession session, long expectedVersion, Duration ttl);

  void delete(String sessionId);

  /**
   * @return number of sessions removed
   */
  int purgeExpired();
}
