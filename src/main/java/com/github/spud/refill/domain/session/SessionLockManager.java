package com.github.spud.refill.domain.session;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.error.StaleSessionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single writer per session inside this process. Lock entries are reference counted and dropped
 * once no turn holds or waits for them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionLockManager {

  private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();

  private final WorkflowProperties properties;

  public <T> T withLock(String sessionId, Supplier<T> critical) {
    LockEntry entry = locks.compute(sessionId, (id, existing) -> {
      LockEntry e = existing == null ? new LockEntry() : existing;
      e.holders++;
      return e;
    });

    boolean acquired = false;
    try {
      acquired = entry.lock.tryLock(properties.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!acquired) {
        log.warn("Timed out waiting for session lock: sessionId={}", sessionId);
        throw new StaleSessionException("Session busy: " + sessionId);
      }
      return critical.get();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new StaleSessionException("Interrupted while waiting for session " + sessionId);
    } finally {
      if (acquired) {
        entry.lock.unlock();
      }
      locks.computeIfPresent(sessionId, (id, e) -> --e.holders == 0 ? null : e);
    }
  }

  int activeLocks() {
    return locks.size();
  }

  private static final class LockEntry {

    private final ReentrantLock lock = new ReentrantLock();

    private int holders;
  }
}
