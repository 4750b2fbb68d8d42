package io.dockside.deploy.ports;

import io.dockside.deploy.model.ApplicationDescriptor;

/**
 * Creates or updates the orchestrator service backing an application.
 * <p>
 * Implementations re-read the remote service on every call and return once the
 * control plane accepted the request; they do not wait for tasks to converge.
 */
public interface ServiceReconciler {

  ReconcileOutcome reconcile(ApplicationDescriptor descriptor);

  enum ReconcileOutcome {
    CREATED,
    UPDATED
  }
}
