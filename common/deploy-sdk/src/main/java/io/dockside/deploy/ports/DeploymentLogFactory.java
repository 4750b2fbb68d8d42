package io.dockside.deploy.ports;

import java.nio.file.Path;

/**
 * Opens the deployment log at a path, appending to any existing content.
 */
@FunctionalInterface
public interface DeploymentLogFactory {

  DeploymentLog open(Path logPath);
}
