package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.ServiceSpec;
import java.util.Objects;

/**
 * Service specification ready to be sent to the control plane.
 *
 * @param auth registry credentials for pulling the image, or {@code null} for anonymous pulls
 */
public record ComposedService(ServiceSpec spec, AuthConfig auth) {

  public ComposedService {
    Objects.requireNonNull(spec, "spec");
  }
}
