package io.dockside.deploy.build;

import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildType;
import io.dockside.deploy.ports.DeploymentLog;
import java.nio.file.Path;

/**
 * One toolchain able to turn application source into a local image tagged with the
 * application name.
 */
public interface BuildStrategy {

  BuildType buildType();

  /**
   * Run the build, streaming its output to {@code log}.
   *
   * @throws BuildFailedException when the toolchain fails
   */
  void build(ApplicationDescriptor descriptor, DeploymentLog log);

  /**
   * Describe the command {@link #build} would run, without side effects.
   */
  BuildCommand describe(ApplicationDescriptor descriptor, Path logPath);
}
