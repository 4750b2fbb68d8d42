package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.build.BuildStrategy;
import io.dockside.deploy.env.EnvironmentPreparer;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import io.dockside.deploy.ports.DeploymentLog;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Build strategy backed by an external command line tool. Subclasses only describe the
 * command; running it is shared.
 */
public abstract class CommandLineBuildStrategy implements BuildStrategy {

  private final BuildType buildType;
  private final ApplicationSources sources;
  private final BuildProcessRunner runner;

  protected CommandLineBuildStrategy(BuildType buildType, ApplicationSources sources, BuildProcessRunner runner) {
    this.buildType = Objects.requireNonNull(buildType, "buildType");
    this.sources = Objects.requireNonNull(sources, "sources");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public BuildType buildType() {
    return buildType;
  }

  @Override
  public void build(ApplicationDescriptor descriptor, DeploymentLog deploymentLog) {
    BuildCommand command = command(descriptor, sources.codeDirectory(descriptor));
    deploymentLog.write("Running " + command.command().get(0) + " build of " + descriptor.appName() + "\n");
    runner.run(command, deploymentLog);
  }

  @Override
  public BuildCommand describe(ApplicationDescriptor descriptor, Path logPath) {
    return command(descriptor, sources.codeDirectory(descriptor));
  }

  protected abstract BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory);

  /**
   * {@code flag K=V} pairs for every variable of the application's environment.
   */
  protected static List<String> environmentFlags(String flag, String rawEnvironment) {
    return pairFlags(flag, EnvironmentPreparer.toMap(rawEnvironment));
  }

  protected static List<String> pairFlags(String flag, Map<String, String> values) {
    List<String> flags = new ArrayList<>();
    values.forEach((key, value) -> {
      flags.add(flag);
      flags.add(key + "=" + value);
    });
    return flags;
  }
}
