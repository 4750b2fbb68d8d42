package io.dockside.deploy.model;

/**
 * Published port of the service.
 *
 * @param protocol      {@code tcp}, {@code udp} or {@code sctp}; {@code tcp} when absent
 * @param targetPort    port inside the container
 * @param publishedPort port on the routing mesh, or {@code null} to let the orchestrator pick
 * @param publishMode   {@code ingress} or {@code host}; orchestrator default when absent
 */
public record PortMapping(String protocol, int targetPort, Integer publishedPort, String publishMode) {

  public PortMapping {
    if (targetPort <= 0) {
      throw new IllegalArgumentException("targetPort must be positive");
    }
  }

  public static PortMapping tcp(int targetPort, int publishedPort) {
    return new PortMapping("tcp", targetPort, publishedPort, null);
  }
}
