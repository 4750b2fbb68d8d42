package io.dockside.docker.swarm;

/**
 * Resolves the control plane that hosts an application's service.
 */
@FunctionalInterface
public interface ServiceControlPlaneProvider {

  ServiceControlPlane forServer(String serverId);
}
