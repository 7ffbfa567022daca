package com.github.spud.refill.infrastructure.persistence.memory;

import com.github.spud.refill.domain.escalation.EscalationCase;
import com.github.spud.refill.domain.escalation.EscalationRepository;
import com.github.spud.refill.domain.escalation.EscalationStatus;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "refill.store", name = "type", havingValue = "memory",
  matchIfMissing = true)
public class InMemoryEscalationRepository implements EscalationRepository {

  private final ConcurrentMap<String, EscalationCase> cases = new ConcurrentHashMap<>();

  @Override
  public boolean insertIfAbsent(EscalationCase escalationCase) {
    return cases.putIfAbsent(escalationCase.getEscalationId(), escalationCase.toBuilder().build())
      == null;
  }

  @Override
  public Optional<EscalationCase> findById(String escalationId) {
    return Optional.ofNullable(cases.get(escalationId)).map(c -> c.toBuilder().build());
  }

  @Override
  public List<EscalationCase> findByStatus(EscalationStatus status) {
    return cases.values().stream()
      .filter(c -> c.getStatus() == status)
      .sorted(Comparator.comparing(EscalationCase::getCreatedAt))
      .map(c -> c.toBuilder().build())
      .collect(Collectors.toList());
  }

  @Override
  public boolean updateStatus(String escalationId, EscalationStatus expected,
    EscalationStatus next, String actor, Instant at) {
    boolean[] updated = {false};
    cases.computeIfPresent(escalationId, (id, current) -> {
      if (current.getStatus() != expected) {
        return current;
      }
      updated[0] = true;
      EscalationCase.EscalationCaseBuilder builder = current.toBuilder().status(next);
      if (next == EscalationStatus.ACKNOWLEDGED) {
        builder.acknowledgedAt(at).acknowledgedBy(actor);
      } else if (next == EscalationStatus.RESOLVED) {
        builder.resolvedAt(at);
      }
      return builder.build();
    });
    return updated[0];
  }
}
