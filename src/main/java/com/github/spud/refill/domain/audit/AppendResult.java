package com.github.spud.refill.domain.audit;

public enum AppendResult {
  ACK,
  /**
   * The idempotency token was already used; nothing was appended
   */
  DUPLICATE_TOKEN
}
