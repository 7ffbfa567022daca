package com.github.spud.refill.infrastructure.persistence.jdbc;

import com.github.spud.refill.domain.audit.AppendResult;
import com.github.spud.refill.domain.audit.AuditLog;
import com.github.spud.refill.domain.audit.AuditRecord;
import com.github.spud.refill.domain.state.WorkflowState;
import java.sql.Timestamp;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Repository for audit_record table. Rows are only ever inserted; the unique token column
 * rejects replays.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "jdbc")
public class JdbcAuditLog implements AuditLog {

  private final JdbcTemplate jdbcTemplate;

  private static final RowMapper<AuditRecord> ROW_MAPPER = (rs, rowNum) -> AuditRecord.builder()
    .sessionId(rs.getString("session_id"))
    .fromState(WorkflowState.valueOf(rs.getString("from_state")))
    .toState(WorkflowState.valueOf(rs.getString("to_state")))
    .trigger(rs.getString("trigger_name"))
    .actor(rs.getString("actor"))
    .timestamp(rs.getTimestamp("created_at").toInstant())
    .turnSequence(rs.getInt("turn_sequence"))
    .idempotencyToken(rs.getString("idempotency_token"))
    .build();

  @Override
  public AppendResult append(AuditRecord record, String idempotencyToken) {
    String sql =
      "INSERT INTO audit_record " +
        "(idempotency_token, session_id, from_state, to_state, trigger_name, actor, " +
        "turn_sequence, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    try {
      jdbcTemplate.update(sql,
        idempotencyToken,
        record.getSessionId(),
        record.getFromState().name(),
        record.getToState().name(),
        record.getTrigger(),
        record.getActor(),
        record.getTurnSequence(),
        Timestamp.from(record.getTimestamp())
      );
      return AppendResult.ACK;
    } catch (DuplicateKeyException e) {
      return AppendResult.DUPLICATE_TOKEN;
    }
  }

  @Override
  public List<AuditRecord> findBySession(String sessionId) {
    String sql = "SELECT * FROM audit_record WHERE session_id = ? ORDER BY seq";
    return jdbcTemplate.query(sql, ROW_MAPPER, sessionId);
  }
}
