package com.github.spud.refill.domain.audit;

import java.util.List;

/**
 * Append-only transition log, keyed by idempotency token
 */
public interface AuditLog {

  AppendResult append(AuditRecord record, String idempotencyToken);

  /**
   * Records of a session in append order
   */
  List<AuditRecord> findBySession(String sessionId);

  static String turnToken(String sessionId, int turnSequence, int step) {
    return sessionId + ":" + turnSequence + ":" + step;
  }

  static String acknowledgeToken(String sessionId, String escalationId) {
    return sessionId + ":ack:" + escalationId;
  }
}
