package io.dockside.deploy.image;

import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.RegistrySettings;
import java.util.Objects;

/**
 * Image names used by a deployment.
 */
public final class ImageReferences {

  /**
   * Image name used when a docker-image application does not name an image. The
   * deployment is left to fail on the control plane instead of being rejected here.
   */
  public static final String MISSING_IMAGE = "ERROR-NO-IMAGE-PROVIDED";

  private ImageReferences() {
  }

  /**
   * Image the service runs.
   */
  public static String serviceImage(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    if (descriptor.sourceType().isDockerImage()) {
      String image = descriptor.dockerImage();
      return image == null || image.isEmpty() ? MISSING_IMAGE : image;
    }
    if (descriptor.hasRegistry()) {
      return registryRepository(descriptor);
    }
    return descriptor.appName() + ":latest";
  }

  /**
   * Tag given to images built locally from source.
   */
  public static String localBuildTag(ApplicationDescriptor descriptor) {
    return Objects.requireNonNull(descriptor, "descriptor").appName();
  }

  /**
   * Repository of the application inside its registry, {@code registryUrl/[imagePrefix/]appName}.
   */
  public static String registryRepository(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    RegistrySettings registry = descriptor.registry();
    if (registry == null) {
      throw new IllegalArgumentException("Application " + descriptor.appName() + " has no registry");
    }
    String registryUrl = registry.registryUrl() == null ? "" : registry.registryUrl();
    String prefix = registry.imagePrefix() == null || registry.imagePrefix().isEmpty()
        ? ""
        : registry.imagePrefix() + "/";
    return registryUrl + "/" + prefix + descriptor.appName();
  }
}
