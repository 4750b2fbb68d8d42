package io.dockside.deploy.runtime;

import io.dockside.deploy.ports.ReconciliationLock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link ReconciliationLock} holding one fair lock per application.
 * <p>
 * A key's lock is dropped once no thread holds or waits for it, so the map only
 * tracks applications with a deployment in flight.
 */
public final class InMemoryReconciliationLock implements ReconciliationLock {

  private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

  @Override
  public Lease acquire(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
    KeyLock keyLock = locks.compute(key, (k, existing) -> {
      KeyLock held = existing != null ? existing : new KeyLock();
      held.users++;
      return held;
    });
    keyLock.lock.lock();
    return () -> release(key, keyLock);
  }

  private void release(String key, KeyLock keyLock) {
    keyLock.lock.unlock();
    locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
  }

  boolean isHeld(String key) {
    KeyLock keyLock = locks.get(key);
    return keyLock != null && keyLock.lock.isLocked();
  }

  int trackedKeys() {
    return locks.size();
  }

  // users is only read and written inside compute calls for its key
  private static final class KeyLock {
    private final ReentrantLock lock = new ReentrantLock(true);
    private int users;
  }
}
