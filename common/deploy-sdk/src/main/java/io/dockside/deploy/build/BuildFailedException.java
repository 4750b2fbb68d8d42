package io.dockside.deploy.build;

/**
 * A build strategy could not produce the application image.
 */
public class BuildFailedException extends RuntimeException {

  public BuildFailedException(String message) {
    super(message);
  }

  public BuildFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
