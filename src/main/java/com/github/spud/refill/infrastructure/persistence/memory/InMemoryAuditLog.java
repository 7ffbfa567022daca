package com.github.spud.refill.infrastructure.persistence.memory;

import com.github.spud.refill.domain.audit.AppendResult;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.audit.AuditRecord;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "memory",
  matchIfMissing = true)
public class InMemoryAuditLog implements AuditLog {

  private final ConcurrentMap<String, AuditRecord> byToken = new ConcurrentHashMap<>();

  private final List<AuditRecord> records = new CopyOnWriteArrayList<>();

  @Override
  public AppendResult append(AuditRecord record, String idempotencyToken) {
    AuditRecord stored = record.getIdempotencyToken() == null || !record.getIdempotencyToken()
      .equals(idempotencyToken) ? record.toBuilder().idempotencyToken(idempotencyToken).build()
      : record;
    if (byToken.putIfAbsent(idempotencyToken, stored) != null) {
      return AppendResult.DUPLICATE_TOKEN;
    }
    records.add(stored);
    return AppendResult.ACK;
  }

  @Override
  public List<AuditRecord> findBySession(String sessionId) {
    return records.stream()
      .filter(r -> r.getSessionId().equals(sessionId))
      .collect(Collectors.toList());
  }
}
