package io.dockside.docker;

/**
 * The Docker engine of a deployment target could not be reached.
 */
public class DockerDaemonUnavailableException extends RuntimeException {

  public DockerDaemonUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
