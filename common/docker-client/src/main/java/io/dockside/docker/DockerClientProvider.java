package io.dockside.docker;

import com.github.dockerjava.api.DockerClient;

/**
 * Resolves the Docker engine that fronts a deployment target.
 */
@FunctionalInterface
public interface DockerClientProvider {

  /**
   * @param serverId configured server id, or {@code null} for the local engine
   */
  DockerClient forServer(String serverId);

  default DockerClient local() {
    return forServer(null);
  }
}
