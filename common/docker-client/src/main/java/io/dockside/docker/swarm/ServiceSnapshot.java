package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import java.util.Objects;

/**
 * A service as just observed on the control plane.
 *
 * @param id           service id
 * @param versionIndex object version that must accompany an update
 * @param spec         current specification
 */
public record ServiceSnapshot(String id, long versionIndex, ServiceSpec spec) {

  public ServiceSnapshot {
    Objects.requireNonNull(id, "id");
  }

  /**
   * Current force-update counter, {@code 0} when never set.
   */
  public int forceUpdate() {
    if (spec == null) {
      return 0;
    }
    TaskSpec taskTemplate = spec.getTaskTemplate();
    if (taskTemplate == null || taskTemplate.getForceUpdate() == null) {
      return 0;
    }
    return taskTemplate.getForceUpdate();
  }
}
