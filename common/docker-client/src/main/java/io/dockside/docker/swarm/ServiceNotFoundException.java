package io.dockside.docker.swarm;

/**
 * The control plane has no service with the requested name.
 */
public class ServiceNotFoundException extends RuntimeException {

  private final String serviceName;

  public ServiceNotFoundException(String serviceName, Throwable cause) {
    super("Service " + serviceName + " does not exist", cause);
    this.serviceName = serviceName;
  }

  public String serviceName() {
    return serviceName;
  }
}
