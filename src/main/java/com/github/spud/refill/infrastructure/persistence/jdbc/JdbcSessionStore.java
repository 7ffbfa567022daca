package com.github.spud.refill.infrastructure.persistence.jdbc;

import com.github.spud.refill.domain.session.SessionStore;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.util.JsonUtils;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Repository for workflow_session table. The session is stored as a JSON payload next to the
 * columns used for optimistic locking and expiry.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "jdbc")
public class JdbcSessionStore implements SessionStore {

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public Optional<WorkflowSession> get(String sessionId) {
    String sql = "SELECT payload FROM workflow_session WHERE session_id = ? AND expires_at > ?";
    List<String> payloads = jdbcTemplate.queryForList(sql, String.class, sessionId, now());
    return payloads.isEmpty() ? Optional.empty()
      : Optional.of(JsonUtils.fromJson(payloads.get(0), WorkflowSession.class));
  }

  @Override
  public void put(WorkflowSession session, Duration ttl) {
    String sql =
      "UPDATE workflow_session " +
        "SET version = ?, workflow_state = ?, payload = ?, expires_at = ?, updated_at = ? " +
        "WHERE session_id = ?";
    int updated = jdbcTemplate.update(sql, session.getVersion(),
      session.getCurrentState().name(), JsonUtils.toJson(session), expiry(ttl), now(),
      session.getSessionId());
    if (updated == 0) {
      insert(session, ttl);
    }
  }

  /**
   * Try to write with optimistic locking on version
   */
  @Override
  public boolean compareAndPut(WorkflowSession session, long expectedVersion, Duration ttl) {
    if (expectedVersion == 0) {
      jdbcTemplate.update(
        "DELETE FROM workflow_session WHERE session_id = ? AND expires_at <= ?",
        session.getSessionId(), now());
      try {
        insert(session, ttl);
        return true;
      } catch (DuplicateKeyException e) {
        log.warn("Version conflict: sessionId={} already exists", session.getSessionId());
        return false;
      }
    }

    String sql =
      "UPDATE workflow_session " +
        "SET version = ?, workflow_state = ?, payload = ?, expires_at = ?, updated_at = ? " +
        "WHERE session_id = ? AND version = ? AND expires_at > ?";
    Timestamp now = now();
    int updated = jdbcTemplate.update(sql, session.getVersion(),
      session.getCurrentState().name(), JsonUtils.toJson(session), expiry(ttl), now,
      session.getSessionId(), expectedVersion, now);
    boolean success = updated > 0;

    if (!success) {
      log.warn("Version conflict: sessionId={}, expectedVersion={}",
        session.getSessionId(), expectedVersion);
    }
    return success;
  }

  @Override
  public void delete(String sessionId) {
    jdbcTemplate.update("DELETE FROM workflow_session WHERE session_id = ?", sessionId);
  }

  @Override
  public int purgeExpired() {
    return jdbcTemplate.update("DELETE FROM workflow_session WHERE expires_at <= ?", now());
  }

  private void insert(WorkflowSession session, Duration ttl) {
    String sql =
      "INSERT INTO workflow_session " +
        "(session_id, version, workflow_state, payload, expires_at, updated_at) " +
        "VALUES (?, ?, ?, ?, ?, ?)";
    jdbcTemplate.update(sql, session.getSessionId(), session.getVersion(),
      session.getCurrentState().name(), JsonUtils.toJson(session), expiry(ttl), now());
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  private Timestamp expiry(Duration ttl) {
    Instant deadline = clock.instant().plus(ttl);
    return Timestamp.from(deadline);
  }
}
