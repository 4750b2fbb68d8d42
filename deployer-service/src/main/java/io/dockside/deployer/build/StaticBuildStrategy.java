package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Serves the application's files with nginx. The Dockerfile is generated and passed to
 * {@code docker build} on stdin, so nothing is written into the source directory.
 */
public class StaticBuildStrategy extends CommandLineBuildStrategy {

  private final String baseImage;

  public StaticBuildStrategy(ApplicationSources sources, BuildProcessRunner runner, String baseImage) {
    super(BuildType.STATIC, sources, runner);
    this.baseImage = Objects.requireNonNull(baseImage, "baseImage");
  }

  @Override
  protected BuildCommand command(ApplicationDescriptor descriptor, Path codeDirectory) {
    List<String> command = List.of(
        "docker", "build", "-t", descriptor.appName(), "-f", "-", codeDirectory.toString());
    return new BuildCommand(command, codeDirectory, null, dockerfile(descriptor.build().publishDirectory()));
  }

  String dockerfile(String publishDirectory) {
    String source = publishDirectory == null || publishDirectory.isBlank() ? "." : publishDirectory;
    return "FROM " + baseImage + "\n"
        + "WORKDIR /usr/share/nginx/html/\n"
        + "COPY " + source + " .\n"
        + "CMD [\"nginx\", \"-g\", \"daemon off;\"]\n";
  }
}
