package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.HealthCheck;
import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.ServiceModeConfig;
import com.github.dockerjava.api.model.ServicePlacement;
import com.github.dockerjava.api.model.ServiceRestartPolicy;
import com.github.dockerjava.api.model.UpdateConfig;
import java.util.List;
import java.util.Map;

/**
 * Scheduling blocks of a service derived from an application descriptor.
 *
 * @param healthCheck declared probe, {@code null} when none was declared
 */
public record ServiceConfig(HealthCheck healthCheck,
                            ServiceRestartPolicy restartPolicy,
                            ServicePlacement placement,
                            Map<String, String> labels,
                            ServiceModeConfig mode,
                            UpdateConfig rollbackConfig,
                            UpdateConfig updateConfig,
                            List<NetworkAttachmentConfig> networks) {
}
