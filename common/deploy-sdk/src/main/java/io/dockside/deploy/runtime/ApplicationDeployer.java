package io.dockside.deploy.runtime;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.build.BuildDispatcher;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.ports.DeploymentLog;
import io.dockside.deploy.ports.DeploymentLogFactory;
import io.dockside.deploy.ports.FileMountWriter;
import io.dockside.deploy.ports.ImageUploader;
import io.dockside.deploy.ports.ReconciliationLock;
import io.dockside.deploy.ports.ServiceReconciler;
import io.dockside.deploy.ports.ServiceReconciler.ReconcileOutcome;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one full deployment of an application: build, optional image upload and
 * service reconciliation, in that order.
 * <p>
 * The deployment log always ends with a success or failure marker and is closed
 * regardless of the outcome. Failures are rethrown to the caller after being logged.
 */
public final class ApplicationDeployer {

  private static final Logger log = LoggerFactory.getLogger(ApplicationDeployer.class);

  static final String SUCCESS_MARKER = "Docker Deployed: ✅";
  static final String FAILURE_MARKER = "Error ❌";

  private final BuildDispatcher builds;
  private final ImageUploader uploader;
  private final FileMountWriter fileMounts;
  private final ServiceReconciler reconciler;
  private final ReconciliationLock locks;
  private final DeploymentLogFactory logs;

  public ApplicationDeployer(BuildDispatcher builds,
                             ImageUploader uploader,
                             FileMountWriter fileMounts,
                             ServiceReconciler reconciler,
                             ReconciliationLock locks,
                             DeploymentLogFactory logs) {
    this.builds = Objects.requireNonNull(builds, "builds");
    this.uploader = Objects.requireNonNull(uploader, "uploader");
    this.fileMounts = fileMounts != null ? fileMounts : FileMountWriter.NOOP;
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.locks = Objects.requireNonNull(locks, "locks");
    this.logs = Objects.requireNonNull(logs, "logs");
  }

  public ReconcileOutcome deploy(ApplicationDescriptor descriptor, Path logPath) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(logPath, "logPath");
    String appName = descriptor.appName();
    try (ReconciliationLock.Lease ignored = locks.acquire(appName);
         DeploymentLog deploymentLog = logs.open(logPath)) {
      String buildType = descriptor.buildType().value();
      deploymentLog.write("\nBuild " + buildType + ": ✅\nSource Type: "
          + descriptor.sourceType().value() + ": ✅\n");
      log.info("Build {}: ✅ ({})", buildType, appName);
      try {
        builds.build(descriptor, deploymentLog);
        if (descriptor.hasRegistry()) {
          uploader.upload(descriptor, deploymentLog);
        }
        fileMounts.write(descriptor);
        ReconcileOutcome outcome = reconciler.reconcile(descriptor);
        deploymentLog.write(SUCCESS_MARKER);
        log.info("Deployed {} ({})", appName, outcome);
        return outcome;
      } catch (RuntimeException e) {
        String message = e.getMessage();
        deploymentLog.write(message == null ? FAILURE_MARKER : FAILURE_MARKER + "\n" + message);
        log.warn("Deployment of {} failed: {}", appName, message);
        throw e;
      }
    }
  }

  public Optional<BuildCommand> buildCommand(ApplicationDescriptor descriptor, Path logPath) {
    return builds.buildCommand(descriptor, logPath);
  }
}
