package io.dockside.docker.swarm;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateServiceCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.ResourceVersion;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceSpec;
import io.dockside.docker.DockerCalls;
import io.dockside.docker.DockerClientProvider;
import java.util.Objects;

/**
 * {@link ServiceControlPlane} backed by the Docker Engine Swarm API.
 */
public class DockerServiceControlPlane implements ServiceControlPlane {

  private final DockerClient dockerClient;

  public DockerServiceControlPlane(DockerClient dockerClient) {
    this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
  }

  public static ServiceControlPlaneProvider provider(DockerClientProvider clients) {
    Objects.requireNonNull(clients, "clients");
    return serverId -> new DockerServiceControlPlane(clients.forServer(serverId));
  }

  @Override
  public ServiceSnapshot inspectService(String name) {
    Service service;
    try {
      service = DockerCalls.call("inspect service " + name,
          () -> dockerClient.inspectServiceCmd(name).exec());
    } catch (NotFoundException e) {
      throw new ServiceNotFoundException(name, e);
    }
    ResourceVersion version = service.getVersion();
    if (version == null) {
      throw new IllegalStateException("Service " + name + " was returned without a version index");
    }
    return new ServiceSnapshot(service.getId(), version.getIndex(), service.getSpec());
  }

  @Override
  public void updateService(String serviceId, long version, ServiceSpec spec) {
    DockerCalls.run("update service " + serviceId,
        () -> dockerClient.updateServiceCmd(serviceId, spec).withVersion(version).exec());
  }

  @Override
  public String createService(ServiceSpec spec, AuthConfig auth) {
    return DockerCalls.call("create service " + spec.getName(), () -> {
      CreateServiceCmd cmd = dockerClient.createServiceCmd(spec);
      if (auth != null) {
        cmd = cmd.withAuthConfig(auth);
      }
      return cmd.exec().getId();
    });
  }
}
