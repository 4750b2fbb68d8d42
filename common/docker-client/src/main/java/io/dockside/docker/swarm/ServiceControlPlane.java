package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.ServiceSpec;

/**
 * Service operations of one Swarm control plane.
 */
public interface ServiceControlPlane {

  /**
   * @throws ServiceNotFoundException when no service has this name
   */
  ServiceSnapshot inspectService(String name);

  /**
   * Replace the specification of an existing service.
   *
   * @param version version index observed by the preceding inspect
   */
  void updateService(String serviceId, long version, ServiceSpec spec);

  /**
   * @param auth registry credentials used to pull the image, or {@code null}
   * @return id of the created service
   */
  String createService(ServiceSpec spec, AuthConfig auth);
}
