package com.github.spud.refill.infrastructure.persistence.jdbc;

import com.github.spud.refill.domain.escalation.ContextPackage;
import com.github.spud.refill.domain.escalation.EscalationCase;
import com.github.spud.refill.domain.escalation.EscalationRepository;
import com.github.spud.refill.domain.escalation.EscalationStatus;
import com.github.spud.refill.domain.escalation.TargetRole;
import com.github.spud.refill.util.JsonUtils;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Repository for escalation_case table. Cases are independent of session expiry.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "jdbc")
public class JdbcEscalationRepository implements EscalationRepository {

  private final JdbcTemplate jdbcTemplate;

  private static final RowMapper<EscalationCase> ROW_MAPPER = (rs, rowNum) -> EscalationCase.builder()
    .escalationId(rs.getString("escalation_id"))
    .sessionId(rs.getString("session_id"))
    .reasonCode(rs.getString("reason_code"))
    .targetRole(TargetRole.valueOf(rs.getString("target_role")))
    .status(EscalationStatus.valueOf(rs.getString("status")))
    .contextPackage(JsonUtils.fromJson(rs.getString("context_package"), ContextPackage.class))
    .createdAt(rs.getTimestamp("created_at").toInstant())
    .acknowledgedAt(toInstant(rs.getTimestamp("acknowledged_at")))
    .acknowledgedBy(rs.getString("acknowledged_by"))
    .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
    .build();

  @Override
  public boolean insertIfAbsent(EscalationCase escalationCase) {
    String sql =
      "INSERT INTO escalation_case " +
        "(escalation_id, session_id, reason_code, target_role, status, context_package, " +
        "created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
    try {
      jdbcTemplate.update(sql,
        escalationCase.getEscalationId(),
        escalationCase.getSessionId(),
        escalationCase.getReasonCode(),
        escalationCase.getTargetRole().name(),
        escalationCase.getStatus().name(),
        JsonUtils.toJson(escalationCase.getContextPackage()),
        Timestamp.from(escalationCase.getCreatedAt())
      );
      return true;
    } catch (DuplicateKeyException e) {
      return false;
    }
  }

  @Override
  public Optional<EscalationCase> findById(String escalationId) {
    String sql = "SELECT * FROM escalation_case WHERE escalation_id = ?";
    List<EscalationCase> results = jdbcTemplate.query(sql, ROW_MAPPER, escalationId);
    return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
  }

  @Override
  public List<EscalationCase> findByStatus(EscalationStatus status) {
    String sql = "SELECT * FROM escalation_case WHERE status = ? ORDER BY created_at";
    return jdbcTemplate.query(sql, ROW_MAPPER, status.name());
  }

  @Override
  public boolean updateStatus(String escalationId, EscalationStatus expected,
    EscalationStatus next, String actor, Instant at) {
    int updated;
    if (next == EscalationStatus.ACKNOWLEDGED) {
      updated = jdbcTemplate.update(
        "UPDATE escalation_case SET status = ?, acknowledged_at = ?, acknowledged_by = ? " +
          "WHERE escalation_id = ? AND status = ?",
        next.name(), Timestamp.from(at), actor, escalationId, expected.name());
    } else if (next == EscalationStatus.RESOLVED) {
      updated = jdbcTemplate.update(
        "UPDATE escalation_case SET status = ?, resolved_at = ? " +
          "WHERE escalation_id = ? AND status = ?",
        next.name(), Timestamp.from(at), escalationId, expected.name());
    } else {
      updated = jdbcTemplate.update(
        "UPDATE escalation_case SET status = ? WHERE escalation_id = ? AND status = ?",
        next.name(), escalationId, expected.name());
    }
    if (updated == 0) {
      log.debug("Status not changed: escalationId={}, expected={}", escalationId, expected);
    }
    return updated > 0;
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
