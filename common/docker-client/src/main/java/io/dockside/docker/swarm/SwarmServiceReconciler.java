package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.ServiceSpec;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.ports.ServiceReconciler;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ServiceReconciler} for Swarm services: creates the application's service when
 * it is absent and updates it otherwise.
 * <p>
 * Updates carry the version index observed by the inspect that precedes them and bump
 * the task template's force-update counter by one, so the control plane redeploys the
 * tasks even when the specification did not change. The inspect-then-act sequence is
 * not atomic; callers serialise reconciliations of one application.
 */
public final class SwarmServiceReconciler implements ServiceReconciler {

  private static final Logger log = LoggerFactory.getLogger(SwarmServiceReconciler.class);

  private final ServiceSpecComposer composer;
  private final ServiceControlPlaneProvider controlPlanes;
  private final InspectFailurePolicy inspectFailurePolicy;

  public SwarmServiceReconciler(ServiceSpecComposer composer,
                                ServiceControlPlaneProvider controlPlanes,
                                InspectFailurePolicy inspectFailurePolicy) {
    this.composer = Objects.requireNonNull(composer, "composer");
    this.controlPlanes = Objects.requireNonNull(controlPlanes, "controlPlanes");
    this.inspectFailurePolicy = inspectFailurePolicy != null
        ? inspectFailurePolicy
        : InspectFailurePolicy.TREAT_AS_ABSENT;
  }

  @Override
  public ReconcileOutcome reconcile(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    String appName = descriptor.appName();
    ComposedService composed = composer.compose(descriptor);
    ServiceControlPlane controlPlane = controlPlanes.forServer(descriptor.serverId());

    Optional<ServiceSnapshot> existing = observe(controlPlane, appName);
    if (existing.isPresent()) {
      ServiceSnapshot current = existing.get();
      ServiceSpec spec = composed.spec();
      int forceUpdate = current.forceUpdate() + 1;
      spec.getTaskTemplate().withForceUpdate(forceUpdate);
      log.info("Updating service {} ({}) at version {} with force update {}",
          appName, current.id(), current.versionIndex(), forceUpdate);
      controlPlane.updateService(current.id(), current.versionIndex(), spec);
      return ReconcileOutcome.UPDATED;
    }
    log.info("Creating service {} using image {}", appName,
        composed.spec().getTaskTemplate().getContainerSpec().getImage());
    String serviceId = controlPlane.createService(composed.spec(), composed.auth());
    log.debug("Created service {} with id {}", appName, serviceId);
    return ReconcileOutcome.CREATED;
  }

  private Optional<ServiceSnapshot> observe(ServiceControlPlane controlPlane, String appName) {
    try {
      return Optional.of(controlPlane.inspectService(appName));
    } catch (ServiceNotFoundException e) {
      log.debug("Service {} does not exist yet", appName);
      return Optional.empty();
    } catch (RuntimeException e) {
      if (inspectFailurePolicy == InspectFailurePolicy.TREAT_AS_ABSENT) {
        log.warn("Inspecting service {} failed, treating it as absent: {}", appName, e.getMessage());
        return Optional.empty();
      }
      throw e;
    }
  }
}
