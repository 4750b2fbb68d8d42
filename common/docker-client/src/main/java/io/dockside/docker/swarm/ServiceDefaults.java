package io.dockside.docker.swarm;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Deployment-wide settings applied when composing services.
 *
 * @param applicationsRoot root of the per-application directories (file mounts live below it)
 * @param defaultNetwork   overlay network services attach to when none is declared
 * @param labelPrefix      prefix of the labels identifying managed services
 */
public record ServiceDefaults(Path applicationsRoot, String defaultNetwork, String labelPrefix) {

  public ServiceDefaults {
    Objects.requireNonNull(applicationsRoot, "applicationsRoot");
    if (defaultNetwork == null || defaultNetwork.isBlank()) {
      throw new IllegalArgumentException("defaultNetwork must not be blank");
    }
    if (labelPrefix == null || labelPrefix.isBlank()) {
      throw new IllegalArgumentException("labelPrefix must not be blank");
    }
  }

  public String appLabel() {
    return labelPrefix + ".app";
  }
}
