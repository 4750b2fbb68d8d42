package io.dockside.deploy.ports;

/**
 * Append-only, human-readable log of one deployment (build, upload and reconciliation).
 */
public interface DeploymentLog extends AutoCloseable {

  void write(String text);

  @Override
  void close();
}
