package com.acme.intake.processor.queue;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class KeySetGateTest {

  private final KeySetGate gate = new KeySetGate();

  @Test
  void disjointKeySetsAreAdmittedTogether() throws InterruptedException {
    gate.acquire(Set.of("A", "B"));
    gate.acquire(Set.of("C"));

    assertThat(gate.heldKeys()).isEqualTo(3);
  }

  @Test
  void overlappingKeySetWaitsForRelease() throws Exception {
    gate.acquire(Set.of("A", "B"));
    AtomicBoolean admitted = new AtomicBoolean();
    CountDownLatch done = new CountDownLatch(1);

    Thread waiter = new Thread(() -> {
      try {
        gate.acquire(Set.of("B", "C"));
        admitted.set(true);
        done.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();

    assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
    assertThat(admitted).isFalse();

    gate.release(Set.of("A", "B"));

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(admitted).isTrue();
    waiter.join();
  }

  @Test
  void releaseFreesAllKeys() throws InterruptedException {
    gate.acquire(List.of("A", "B"));
    gate.release(List.of("A", "B"));

    assertThat(gate.heldKeys()).isZero();
  }

  @Test
  void waitingAcquireIsInterruptible() throws Exception {
    gate.acquire(Set.of("A"));
    AtomicBoolean interrupted = new AtomicBoolean();
    Thread waiter = new Thread(() -> {
      try {
        gate.acquire(Set.of("A"));
      } catch (InterruptedException e) {
        interrupted.set(true);
      }
    });
    waiter.start();
    waiter.interrupt();
    waiter.join();

    assertThat(interrupted).isTrue();
  }
}
