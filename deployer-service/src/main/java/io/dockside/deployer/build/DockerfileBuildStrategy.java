package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.env.EnvironmentPreparer;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildSettings;
import io.dockside.deploy.model.BuildType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code docker build} of the application's own Dockerfile. The Dockerfile and the build
 * context are both relative to the source directory; build arguments use the same
 * {@code KEY=VALUE} lines as the environment.
 */
public class DockerfileBuildStrategy extends CommandLineBuildStrategy {

  static final String DEFAULT_DOCKERFILE = "Dockerfile";

  public DockerfileBuildStrategy(ApplicationSources sources, BuildProcessRunner runner) {
    super(BuildType.DOCKERFILE, sources, runner);
  }

  @Override
  protected BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory) {
    BuildSettings settings = descriptor.build();
    Path dockerfile = codeDirectory.resolve(orDefault(settings.dockerfile(), DEFAULT_DOCKERFILE)).normalize();
    Path context = codeDirectory.resolve(orDefault(settings.contextPath(), ".")).normalize();

    List<String> command = new ArrayList<>(List.of(
        "docker", "build", "-t", descriptor.appName(), "-f", dockerfile.toString()));
    if (settings.buildStage() != null && !settings.buildStage().isBlank()) {
      command.add("--target");
      command.add(settings.buildStage());
    }
    command.addAll(pairFlags("--build-arg", EnvironmentPreparer.toMap(descriptor.buildArgs())));
    command.add(context.toString());
    return new BuildCommand(command, context, null, null);
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
