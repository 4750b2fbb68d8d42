package io.dockside.deployer.app;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deploy.runtime.ApplicationDeployer;
import io.dockside.deployer.config.DeployerProperties;
import io.dockside.deployer.infra.docker.UnknownServerException;
import io.dockside.docker.swarm.ServiceSpecComposer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts deployment requests and runs them in the background.
 * <p>
 * Requests are checked before they are queued: the server must be configured and the
 * service specification must compose. Everything after that is reported through the
 * deployment log.
 */
@Service
public class DeploymentService {

  private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);
  private static final DateTimeFormatter LOG_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

  private final ApplicationDeployer deployer;
  private final ServiceSpecComposer composer;
  private final DeployerProperties properties;
  private final Executor deploymentExecutor;
  private final Clock clock;

  public DeploymentService(ApplicationDeployer deployer,
                           ServiceSpecComposer composer,
                           DeployerProperties properties,
                           Executor deploymentExecutor,
                           Clock clock) {
    this.deployer = Objects.requireNonNull(deployer, "deployer");
    this.composer = Objects.requireNonNull(composer, "composer");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.deploymentExecutor = Objects.requireNonNull(deploymentExecutor, "deploymentExecutor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DeploymentTicket deploy(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    requireKnownServer(descriptor.serverId());
    composer.compose(descriptor);
    Path logPath = logPath(descriptor.appName());
    deploymentExecutor.execute(() -> {
      try {
        deployer.deploy(descriptor, logPath);
      } catch (RuntimeException e) {
        log.error("Deployment of {} failed, see {}", descriptor.appName(), logPath, e);
      }
    });
    log.info("Queued deployment of {} (log {})", descriptor.appName(), logPath);
    return new DeploymentTicket(descriptor.appName(), logPath.toString());
  }

  public Optional<BuildScript> buildScript(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    Path logPath = logPath(descriptor.appName());
    Optional<BuildCommand> command = deployer.buildCommand(descriptor, logPath);
    return command.map(c -> new BuildScript(descriptor.buildType().value(), c.toShellScript(logPath)));
  }

  Path logPath(String appName) {
    String timestamp = LocalDateTime.now(clock).format(LOG_TIMESTAMP);
    Path logsRoot = properties.getPaths().logsRoot().toAbsolutePath().normalize();
    Path directory = logsRoot.resolve(appName).normalize();
    if (!directory.startsWith(logsRoot) || directory.equals(logsRoot)) {
      throw new InvalidDescriptorException("Invalid application name '" + appName + "'");
    }
    return directory.resolve(appName + "-" + timestamp + ".log");
  }

  private void requireKnownServer(String serverId) {
    if (serverId != null && !serverId.isBlank() && properties.server(serverId).isEmpty()) {
      throw new UnknownServerException(serverId);
    }
  }

  public record DeploymentTicket(String appName, String logPath) {
  }

  public record BuildScript(String buildType, String script) {
  }
}
