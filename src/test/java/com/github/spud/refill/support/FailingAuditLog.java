package com.github.spud.refill.support;

import com.github.spud.refill.domain.audit.AppendResult;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.infrastructure.persistence.memory.InMemoryAuditLog;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * In-memory audit log whose next appends can be made to fail
 */
public class FailingAuditLog implements AuditLog {

  private final AuditLog delegate = new InMemoryAuditLog();
  private final AtomicInteger failuresLeft = new AtomicInteger();

  public void failNext(int appends) {
    failuresLeft.set(appends);
  }

  @Override
  public AppendResult append(AuditRecord record, String idempotencyToken) {
    if (failuresLeft.getAndUpdate(n -> Math.max(n - 1, 0)) > 0) {
      throw new DataAccessResourceFailureException("audit log offline");
    }
    return delegate.append(record, idempotencyToken);
  }

  @Override
  public List<AuditRecord> findBySession(String sessionId) {
    return delegate.findBySession(sessionId);
  }
}
