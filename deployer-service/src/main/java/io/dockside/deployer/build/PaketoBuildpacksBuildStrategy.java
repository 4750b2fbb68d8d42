package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class PaketoBuildpacksBuildStrategy extends CommandLineBuildStrategy {

  private final String builder;

  public PaketoBuildpacksBuildStrategy(ApplicationSources sources, BuildProcessRunner runner, String builder) {
    super(BuildType.PAKETO_BUILDPACKS, sources, runner);
    this.builder = Objects.requireNonNull(builder, "builder");
  }

  @Override
  protected BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory) {
    List<String> command = new ArrayList<>(List.of(
        "pack", "build", descriptor.appName(),
        "--path", codeDirectory.toString(),
        "--builder", builder));
    command.addAll(environmentFlags("--env", descriptor.env()));
    return new BuildCommand(command, codeDirectory, null, null);
  }
}
