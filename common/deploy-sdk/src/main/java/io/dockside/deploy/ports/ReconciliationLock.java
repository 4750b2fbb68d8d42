package io.dockside.deploy.ports;

/**
 * Serialises deployments of the same application.
 * <p>
 * The remote inspect-then-update sequence is not atomic, so two concurrent
 * reconciliations of one application could otherwise race on the same version index.
 */
public interface ReconciliationLock {

  /**
   * Block until the lease for {@code key} is held. The lease is released when closed.
   */
  Lease acquire(String key);

  @FunctionalInterface
  interface Lease extends AutoCloseable {

    @Override
    void close();
  }
}
