package io.dockside.deploy.image;

import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.RegistrySettings;
import java.util.Objects;
import java.util.Optional;

/**
 * Credentials presented to a registry when pulling or pushing the application image.
 */
public record RegistryCredentials(String username, String password, String serverAddress) {

  public static final String DOCKER_HUB_ADDRESS = "https://index.docker.io/v1/";

  /**
   * Docker-image applications authenticate against Docker Hub only when both username
   * and password are set; built applications use their registry's credentials. Anything
   * else pulls anonymously.
   */
  public static Optional<RegistryCredentials> resolve(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    if (descriptor.sourceType().isDockerImage()) {
      if (hasText(descriptor.username()) && hasText(descriptor.password())) {
        return Optional.of(new RegistryCredentials(
            descriptor.username(), descriptor.password(), DOCKER_HUB_ADDRESS));
      }
      return Optional.empty();
    }
    RegistrySettings registry = descriptor.registry();
    if (registry == null) {
      return Optional.empty();
    }
    return Optional.of(new RegistryCredentials(
        registry.username(), registry.password(), registry.registryUrl()));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }

  @Override
  public String toString() {
    return "RegistryCredentials[username=" + username + ", serverAddress=" + serverAddress + "]";
  }
}
