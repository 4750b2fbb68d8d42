package io.dockside.deploy.ports;

import io.dockside.deploy.model.ApplicationDescriptor;

/**
 * Pushes a locally built image to the application's registry.
 */
public interface ImageUploader {

  void upload(ApplicationDescriptor descriptor, DeploymentLog log);
}
