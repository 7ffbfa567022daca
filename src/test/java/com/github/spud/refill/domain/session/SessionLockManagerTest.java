package com.github.spud.refill.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.refill.application.config.WorkflowProperties;
import com.github.spud.refill.domain.error.StaleSessionException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionLockManagerTest {

  private WorkflowProperties properties;
  private SessionLockManager lockManager;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    properties = new WorkflowProperties();
    lockManager = new SessionLockManager(properties);
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldSerializeTurnsOfOneSession() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    Runnable turn = () -> lockManager.withLock("s-1", () -> {
      maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
      sleep(20);
      inside.decrementAndGet();
      return null;
    });

    Future<?> first = executor.submit(turn);
    Future<?> second = executor.submit(turn);
    Future<?> third = executor.submit(turn);
    first.get(5, TimeUnit.SECONDS);
    second.get(5, TimeUnit.SECONDS);
    third.get(5, TimeUnit.SECONDS);

    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(lockManager.activeLocks()).isZero();
  }

  @Test
  void shouldGiveUpAfterLockTimeout() throws Exception {
    properties.setLockTimeout(Duration.ofMillis(50));
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder = executor.submit(() -> lockManager.withLock("s-1", () -> {
      held.countDown();
      await(release);
      return null;
    }));
    held.await(5, TimeUnit.SECONDS);

    assertThatThrownBy(() -> lockManager.withLock("s-1", () -> "late"))
      .isInstanceOf(StaleSessionException.class);
    assertThat(lockManager.withLock("s-2", () -> "other session")).isEqualTo("other session");

    release.countDown();
    holder.get(5, TimeUnit.SECONDS);
    assertThat(lockManager.activeLocks()).isZero();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
