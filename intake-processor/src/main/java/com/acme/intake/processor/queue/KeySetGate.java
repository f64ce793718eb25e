package com.acme.intake.processor.queue;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Admits a job only while no admitted job holds any of its unique keys. Callers acquire in
 * enqueue order from a single thread, so overlapping jobs load in that order.
 */
class KeySetGate {

  private final Map<String, Integer> held = new HashMap<>();

  synchronized void acquire(Collection<String> keys) throws InterruptedException {
    while (overlaps(keys)) {
      wait();
    }
    for (String key : keys) {
      held.merge(key, 1, Integer::sum);
    }
  }

  synchronized void release(Collection<String> keys) {
    for (String key : keys) {
      held.computeIfPresent(key, (k, count) -> count == 1 ? null : count - 1);
    }
    notifyAll();
  }

  synchronized int heldKeys() {
    return held.size();
  }

  private boolean overlaps(Collection<String> keys) {
    for (String key : keys) {
      if (held.containsKey(key)) {
        return true;
      }
    }
    return false;
  }
}
