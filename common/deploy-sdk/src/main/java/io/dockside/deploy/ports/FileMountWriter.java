package io.dockside.deploy.ports;

import io.dockside.deploy.model.ApplicationDescriptor;

/**
 * Materialises the content of file mounts on the host before the service referencing
 * them is reconciled.
 */
@FunctionalInterface
public interface FileMountWriter {

  FileMountWriter NOOP = descriptor -> {
  };

  void write(ApplicationDescriptor descriptor);
}
