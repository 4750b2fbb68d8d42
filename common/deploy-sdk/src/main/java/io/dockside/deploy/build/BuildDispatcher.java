package io.dockside.deploy.build;

import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import io.dockside.deploy.ports.DeploymentLog;
import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the {@link BuildStrategy} for an application's {@link BuildType}.
 * <p>
 * The dispatcher refuses to start unless every buildable type has exactly one
 * strategy, so adding a build type without a handler fails at wiring time.
 */
public final class BuildDispatcher {

  private static final Logger log = LoggerFactory.getLogger(BuildDispatcher.class);

  private final Map<BuildType, BuildStrategy> strategies;

  public BuildDispatcher(Collection<? extends BuildStrategy> available) {
    Objects.requireNonNull(available, "available");
    Map<BuildType, BuildStrategy> byType = new EnumMap<>(BuildType.class);
    for (BuildStrategy strategy : available) {
      BuildType type = Objects.requireNonNull(strategy.buildType(), "strategy.buildType");
      if (!type.isBuildable()) {
        throw new IllegalStateException("Build strategy registered for non-buildable type " + type);
      }
      BuildStrategy previous = byType.putIfAbsent(type, strategy);
      if (previous != null) {
        throw new IllegalStateException("Duplicate build strategies for " + type.value() + ": "
            + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
      }
    }
    for (BuildType type : BuildType.values()) {
      if (type.isBuildable() && !byType.containsKey(type)) {
        throw new IllegalStateException("No build strategy registered for " + type.value());
      }
    }
    this.strategies = Map.copyOf(byType);
  }

  public void build(ApplicationDescriptor descriptor, DeploymentLog deploymentLog) {
    Objects.requireNonNull(descriptor, "descriptor");
    BuildType type = descriptor.buildType();
    if (!type.isBuildable()) {
      log.debug("Nothing to build for {}", descriptor.appName());
      return;
    }
    log.info("Building {} with {}", descriptor.appName(), type.value());
    strategies.get(type).build(descriptor, deploymentLog);
  }

  public Optional<BuildCommand> buildCommand(ApplicationDescriptor descriptor, Path logPath) {
    Objects.requireNonNull(descriptor, "descriptor");
    BuildType type = descriptor.buildType();
    if (!type.isBuildable()) {
      return Optional.empty();
    }
    return Optional.of(strategies.get(type).describe(descriptor, logPath));
  }
}
