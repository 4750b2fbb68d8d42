package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.HealthCheck;
import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.ServiceGlobalModeOptions;
import com.github.dockerjava.api.model.ServiceModeConfig;
import com.github.dockerjava.api.model.ServicePlacement;
import com.github.dockerjava.api.model.ServiceReplicatedModeOptions;
import com.github.dockerjava.api.model.ServiceRestartCondition;
import com.github.dockerjava.api.model.ServiceRestartPolicy;
import com.github.dockerjava.api.model.UpdateConfig;
import com.github.dockerjava.api.model.UpdateFailureAction;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.SwarmSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives health check, restart policy, placement, labels, mode, update/rollback and
 * network configuration for an application's service.
 * <p>
 * Declared settings are used as given; omitted ones fall back to defaults:
 * <ul>
 *   <li>restart on failure</li>
 *   <li>pin to manager nodes when the application has mounts (host paths and local
 *   volumes only exist there)</li>
 *   <li>one replica unless {@code replicas} says otherwise</li>
 *   <li>update and rollback one task at a time, pausing on failure</li>
 *   <li>attach to the default overlay network</li>
 * </ul>
 */
public final class ServiceConfigGenerator {

  static final String MANAGER_CONSTRAINT = "node.role==manager";

  private final ServiceDefaults defaults;

  public ServiceConfigGenerator(ServiceDefaults defaults) {
    this.defaults = Objects.requireNonNull(defaults, "defaults");
  }

  public ServiceConfig generate(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    SwarmSettings swarm = descriptor.swarm();
    return new ServiceConfig(
        healthCheck(swarm.healthCheck()),
        restartPolicy(swarm.restartPolicy()),
        placement(swarm.placement(), !descriptor.mounts().isEmpty()),
        labels(descriptor.appName(), swarm.labels()),
        mode(swarm.mode(), descriptor.replicas()),
        rollbackConfig(swarm.rollback()),
        updateConfig(swarm.update()),
        networks(swarm.networks()));
  }

  private static HealthCheck healthCheck(SwarmSettings.HealthCheck declared) {
    if (declared == null) {
      return null;
    }
    HealthCheck healthCheck = new HealthCheck();
    if (!declared.test().isEmpty()) {
      healthCheck = healthCheck.withTest(declared.test());
    }
    if (declared.interval() != null) {
      healthCheck = healthCheck.withInterval(declared.interval());
    }
    if (declared.timeout() != null) {
      healthCheck = healthCheck.withTimeout(declared.timeout());
    }
    if (declared.startPeriod() != null) {
      healthCheck = healthCheck.withStartPeriod(declared.startPeriod());
    }
    if (declared.retries() != null) {
      healthCheck = healthCheck.withRetries(declared.retries());
    }
    return healthCheck;
  }

  private static ServiceRestartPolicy restartPolicy(SwarmSettings.RestartPolicy declared) {
    ServiceRestartPolicy policy = new ServiceRestartPolicy()
        .withCondition(ServiceRestartCondition.ON_FAILURE);
    if (declared == null) {
      return policy;
    }
    if (declared.condition() != null) {
      policy = policy.withCondition(switch (declared.condition()) {
        case NONE -> ServiceRestartCondition.NONE;
        case ON_FAILURE -> ServiceRestartCondition.ON_FAILURE;
        case ANY -> ServiceRestartCondition.ANY;
      });
    }
    if (declared.delay() != null) {
      policy = policy.withDelay(declared.delay());
    }
    if (declared.maxAttempts() != null) {
      policy = policy.withMaxAttempts(declared.maxAttempts());
    }
    if (declared.window() != null) {
      policy = policy.withWindow(declared.window());
    }
    return policy;
  }

  private static ServicePlacement placement(SwarmSettings.Placement declared, boolean hasMounts) {
    if (declared != null) {
      return new ServicePlacement().withConstraints(declared.constraints());
    }
    return new ServicePlacement().withConstraints(hasMounts ? List.of(MANAGER_CONSTRAINT) : List.of());
  }

  private Map<String, String> labels(String appName, Map<String, String> declared) {
    Map<String, String> labels = new LinkedHashMap<>(declared);
    labels.put(defaults.appLabel(), appName);
    return labels;
  }

  private static ServiceModeConfig mode(SwarmSettings.Mode declared, Integer replicas) {
    if (declared != null && declared.global()) {
      return new ServiceModeConfig().withGlobal(new ServiceGlobalModeOptions());
    }
    Integer count = declared != null && declared.replicas() != null ? declared.replicas() : replicas;
    int resolved = count == null ? 1 : Math.max(count, 0);
    return new ServiceModeConfig()
        .withReplicated(new ServiceReplicatedModeOptions().withReplicas(resolved));
  }

  private static UpdateConfig rollbackConfig(SwarmSettings.UpdatePolicy declared) {
    if (declared != null) {
      return toUpdateConfig(declared);
    }
    return new UpdateConfig()
        .withParallelism(1L)
        .withFailureAction(UpdateFailureAction.PAUSE);
  }

  private static UpdateConfig updateConfig(SwarmSettings.UpdatePolicy declared) {
    if (declared != null) {
      return toUpdateConfig(declared);
    }
    return new UpdateConfig()
        .withParallelism(1L)
        .withDelay(0L)
        .withFailureAction(UpdateFailureAction.PAUSE);
  }

  private static UpdateConfig toUpdateConfig(SwarmSettings.UpdatePolicy declared) {
    UpdateConfig config = new UpdateConfig();
    if (declared.parallelism() != null) {
      config = config.withParallelism(declared.parallelism());
    }
    if (declared.delay() != null) {
      config = config.withDelay(declared.delay());
    }
    if (declared.failureAction() != null) {
      config = config.withFailureAction(switch (declared.failureAction()) {
        case PAUSE -> UpdateFailureAction.PAUSE;
        case CONTINUE -> UpdateFailureAction.CONTINUE;
        case ROLLBACK -> UpdateFailureAction.ROLLBACK;
      });
    }
    if (declared.monitor() != null) {
      config = config.withMonitor(declared.monitor());
    }
    if (declared.maxFailureRatio() != null) {
      config = config.withMaxFailureRatio(declared.maxFailureRatio());
    }
    return config;
  }

  private List<NetworkAttachmentConfig> networks(List<SwarmSettings.Network> declared) {
    if (declared == null) {
      return List.of(new NetworkAttachmentConfig().withTarget(defaults.defaultNetwork()));
    }
    return declared.stream()
        .map(network -> {
          NetworkAttachmentConfig attachment = new NetworkAttachmentConfig().withTarget(network.target());
          if (!network.aliases().isEmpty()) {
            attachment = attachment.withAliases(network.aliases());
          }
          return attachment;
        })
        .toList();
  }
}
