package com.github.spud.refill.infrastructure.persistence.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.WorkflowState;
import com.github.spud.refill.support.MutableClock;
import com.github.spud.refill.support.WorkflowFixture;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private static final Duration TTL = Duration.ofMinutes(5);

  private MutableClock clock;
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(WorkflowFixture.START);
    store = new InMemorySessionStore(clock);
  }

  @Test
  void shouldReturnDetachedCopy() {
    WorkflowSession session = session(1);
    session.getCollectedEntities().put("drug_name", "Lisinopril");
    session.setResolvedDrug(DrugCandidate.builder().name("Lisinopril").code("RX29046")
      .similarity(0.98).build());
    store.put(session, TTL);

    WorkflowSession loaded = store.get("s-1").orElseThrow();
    loaded.getCollectedEntities().put("dose", "10mg");

    assertThat(loaded.getResolvedDrug().getCode()).isEqualTo("RX29046");
    assertThat(store.get("s-1").orElseThrow().getCollectedEntities())
      .containsOnlyKeys("drug_name");
  }

  @Test
  void shouldWriteOnlyOnExpectedVersion() {
    assertThat(store.compareAndPut(session(1), 0, TTL)).isTrue();
    assertThat(store.compareAndPut(session(2), 0, TTL)).isFalse();
    assertThat(store.compareAndPut(session(2), 1, TTL)).isTrue();
    assertThat(store.get("s-1").orElseThrow().getVersion()).isEqualTo(2);
  }

  @Test
  void shouldExpireAfterTtl() {
    store.put(session(1), TTL);
    clock.advance(TTL);

    assertThat(store.get("s-1")).isEmpty();
    assertThat(store.compareAndPut(session(1), 0, TTL)).isTrue();
  }

  @Test
  void shouldPurgeOnlyExpiredSessions() {
    store.put(session(1), TTL);
    clock.advance(Duration.ofMinutes(3));
    WorkflowSession other = session(1);
    other.setSessionId("s-2");
    store.put(other, TTL);
    clock.advance(Duration.ofMinutes(3));

    assertThat(store.purgeExpired()).isEqualTo(1);
    assertThat(store.get("s-2")).isPresent();
  }

  private static WorkflowSession session(long version) {
    WorkflowSession session = WorkflowSession.start("s-1", WorkflowFixture.START);
    session.setCurrentState(WorkflowState.COLLECT_REQUEST);
    session.setVersion(version);
    return session;
  }
}
