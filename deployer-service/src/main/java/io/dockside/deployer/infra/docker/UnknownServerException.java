package io.dockside.deployer.infra.docker;

/**
 * An application names a server that is not configured.
 */
public class UnknownServerException extends RuntimeException {

  private final String serverId;

  public UnknownServerException(String serverId) {
    super("Unknown server '" + serverId + "'");
    this.serverId = serverId;
  }

  public String serverId() {
    return serverId;
  }
}
