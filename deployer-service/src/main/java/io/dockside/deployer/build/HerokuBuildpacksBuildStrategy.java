package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cloud Native Buildpacks build with the Heroku builder. The builder stack version comes
 * from the application, falling back to the configured default.
 */
public class HerokuBuildpacksBuildStrategy extends CommandLineBuildStrategy {

  private final String defaultVersion;

  public HerokuBuildpacksBuildStrategy(ApplicationSources sources, BuildProcessRunner runner, String defaultVersion) {
    super(BuildType.HEROKU_BUILDPACKS, sources, runner);
    this.defaultVersion = Objects.requireNonNull(defaultVersion, "defaultVersion");
  }

  @Override
  protected BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory) {
    String version = descriptor.build().herokuVersion();
    if (version == null || version.isBlank()) {
      version = defaultVersion;
    }
    List<String> command = new ArrayList<>(List.of(
        "pack", "build", descriptor.appName(),
        "--path", codeDirectory.toString(),
        "--builder", "heroku/builder:" + version));
    command.addAll(environmentFlags("--env", descriptor.env()));
    return new BuildCommand(command, codeDirectory, null, null);
  }
}
