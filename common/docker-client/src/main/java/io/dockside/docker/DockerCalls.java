package io.dockside.docker;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Runs docker-java commands and turns "engine unreachable" failures into
 * {@link DockerDaemonUnavailableException}. Any other failure is rethrown as-is.
 */
public final class DockerCalls {

  private static final String DOCKER_HINT =
      "Ensure Docker is installed, running, and that the process can access the Docker socket "
          + "(for example /var/run/docker.sock) or the configured remote host.";

  private DockerCalls() {
  }

  public static <T> T call(String action, Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (RuntimeException e) {
      throw translate(action, e);
    }
  }

  public static void run(String action, Runnable runnable) {
    try {
      runnable.run();
    } catch (RuntimeException e) {
      throw translate(action, e);
    }
  }

  static RuntimeException translate(String action, RuntimeException e) {
    if (e instanceof DockerDaemonUnavailableException) {
      return e;
    }
    if (isDockerUnavailable(e)) {
      return new DockerDaemonUnavailableException(
          "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
          e);
    }
    return e;
  }

  private static boolean isDockerUnavailable(Throwable throwable) {
    for (Throwable t = throwable; t != null; t = t.getCause()) {
      if (t instanceof ConnectException
          || t instanceof NoRouteToHostException
          || t instanceof SocketTimeoutException
          || t instanceof UnknownHostException
          || t instanceof FileNotFoundException
          || t instanceof NoSuchFileException
          || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
        return true;
      }
      if ("com.sun.jna.LastErrorException".equals(t.getClass().getName())
          && messageContains(t, "No such file or directory")) {
        return true;
      }
      if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
        return true;
      }
    }
    return false;
  }

  private static boolean messageContains(Throwable t, String needle) {
    String message = t.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT)
        .contains(needle.toLowerCase(Locale.ROOT));
  }
}
