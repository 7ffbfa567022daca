package com.github.spud.refill.infrastructure.persistence.memory;

import com.github.spud.refill.domain.session.SessionStore;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.util.JsonUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local session store. Sessions are kept serialized so that a reload never shares
 * mutable state with the writer; expired entries are dropped on access and by the sweeper.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "memory",
  matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  private final Clock clock;

  @Override
  public Optional<WorkflowSession> get(String sessionId) {
    Entry entry = entries.get(sessionId);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(sessionId, entry);
      log.debug("Session expired: sessionId={}", sessionId);
      return Optional.empty();
    }
    return Optional.of(JsonUtils.fromJson(entry.payload, WorkflowSession.class));
  }

  @Override
  public void put(WorkflowSession session, Duration ttl) {
    entries.put(session.getSessionId(), entry(session, ttl));
  }

  @Override
  public boolean compareAndPut(WorkflowSession session, long expectedVersion, Duration ttl) {
    Instant now = clock.instant();
    boolean[] written = {false};
    entries.compute(session.getSessionId(), (id, current) -> {
      long storedVersion = current == null || current.isExpired(now) ? 0 : current.version;
      if (storedVersion != expectedVersion) {
        return current;
      }
      written[0] = true;
      return entry(session, ttl);
    });
    return written[0];
  }

  @Override
  public void delete(String sessionId) {
    entries.remove(sessionId);
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return Math.max(0, before - entries.size());
  }

  private Entry entry(WorkflowSession session, Duration ttl) {
    return new Entry(JsonUtils.toJson(session), session.getVersion(), clock.instant().plus(ttl));
  }

  private static final class Entry {

    private final String payload;
    private final long version;
    private final Instant expiresAt;

    private Entry(String payload, long version, Instant expiresAt) {
      this.payload = payload;
      this.version = version;
      this.expiresAt = expiresAt;
    }

    private boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
