package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class NixpacksBuildStrategy extends CommandLineBuildStrategy {

  public NixpacksBuildStrategy(ApplicationSources sources, BuildProcessRunner runner) {
    super(BuildType.NIXPACKS, sources, runner);
  }

  @Override
  protected BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory) {
    List<String> command = new ArrayList<>(List.of(
        "nixpacks", "build", codeDirectory.toString(), "--name", descriptor.appName()));
    command.addAll(environmentFlags("--env", descriptor.env()));
    return new BuildCommand(command, codeDirectory, null, null);
  }
}
