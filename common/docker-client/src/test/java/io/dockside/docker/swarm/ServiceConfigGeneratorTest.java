package io.dockside.docker.swarm;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.ServiceRestartCondition;
import com.github.dockerjava.api.model.UpdateFailureAction;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.MountSpec;
import io.dockside.deploy.model.SwarmSettings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServiceConfigGeneratorTest {

  private final ServiceConfigGenerator generator = new ServiceConfigGenerator(
      new ServiceDefaults(Path.of("/srv/apps"), "dockside-network", "dockside"));

  @Test
  void appliesDefaultsWhenNothingIsDeclared() {
    ServiceConfig config = generator.generate(descriptor().build());

    assertThat(config.healthCheck()).isNull();
    assertThat(config.restartPolicy().getCondition()).isEqualTo(ServiceRestartCondition.ON_FAILURE);
    assertThat(config.placement().getConstraints()).isEmpty();
    assertThat(config.labels()).containsExactly(Map.entry("dockside.app", "api"));
    assertThat(config.mode().getGlobal()).isNull();
    assertThat(config.mode().getReplicated().getReplicas()).isEqualTo(1);
    assertThat(config.updateConfig().getParallelism()).isEqualTo(1L);
    assertThat(config.updateConfig().getDelay()).isEqualTo(0L);
    assertThat(config.updateConfig().getFailureAction()).isEqualTo(UpdateFailureAction.PAUSE);
    assertThat(config.rollbackConfig().getParallelism()).isEqualTo(1L);
    assertThat(config.rollbackConfig().getFailureAction()).isEqualTo(UpdateFailureAction.PAUSE);
    assertThat(config.networks()).extracting(NetworkAttachmentConfig::getTarget)
        .containsExactly("dockside-network");
  }

  @Test
  void pinsServicesWithMountsToManagers() {
    ServiceConfig config = generator.generate(descriptor()
        .mount(new MountSpec.Volume("data", "/data"))
        .build());

    assertThat(config.placement().getConstraints()).containsExactly("node.role==manager");
  }

  @Test
  void declaredPlacementWinsOverManagerDefault() {
    ServiceConfig config = generator.generate(descriptor()
        .mount(new MountSpec.Volume("data", "/data"))
        .swarm(swarm(null, new SwarmSettings.Placement(List.of("node.labels.tier==db")), null, null))
        .build());

    assertThat(config.placement().getConstraints()).containsExactly("node.labels.tier==db");
  }

  @Test
  void usesDescriptorReplicasUnlessModeDeclaresThem() {
    assertThat(generator.generate(descriptor().replicas(3).build())
        .mode().getReplicated().getReplicas()).isEqualTo(3);
    assertThat(generator.generate(descriptor().replicas(3)
            .swarm(swarm(null, null, SwarmSettings.Mode.replicated(5), null)).build())
        .mode().getReplicated().getReplicas()).isEqualTo(5);
  }

  @Test
  void globalModeHasNoReplicaCount() {
    ServiceConfig config = generator.generate(descriptor()
        .swarm(swarm(null, null, SwarmSettings.Mode.globalMode(), null))
        .build());

    assertThat(config.mode().getGlobal()).isNotNull();
    assertThat(config.mode().getReplicated()).isNull();
  }

  @Test
  void declaredRestartPolicyOverridesDefaultFields() {
    ServiceConfig config = generator.generate(descriptor()
        .swarm(swarm(new SwarmSettings.RestartPolicy(SwarmSettings.RestartCondition.ANY, 5_000_000_000L, 3L, null),
            null, null, null))
        .build());

    assertThat(config.restartPolicy().getCondition()).isEqualTo(ServiceRestartCondition.ANY);
    assertThat(config.restartPolicy().getDelay()).isEqualTo(5_000_000_000L);
    assertThat(config.restartPolicy().getMaxAttempts()).isEqualTo(3L);
  }

  @Test
  void identityLabelCannotBeOverridden() {
    ServiceConfig config = generator.generate(descriptor()
        .swarm(new SwarmSettings(null, null, null, null, null, null,
            Map.of("dockside.app", "other", "team", "core"), null))
        .build());

    assertThat(config.labels())
        .containsEntry("dockside.app", "api")
        .containsEntry("team", "core");
  }

  @Test
  void declaredNetworksReplaceTheDefault() {
    ServiceConfig config = generator.generate(descriptor()
        .swarm(new SwarmSettings(null, null, null, null, null, null, null,
            List.of(new SwarmSettings.Network("backend", List.of("api-internal")))))
        .build());

    assertThat(config.networks()).singleElement().satisfies(network -> {
      assertThat(network.getTarget()).isEqualTo("backend");
      assertThat(network.getAliases()).containsExactly("api-internal");
    });
  }

  @Test
  void declaredUpdatePolicyIsPassedThrough() {
    SwarmSettings.UpdatePolicy update = new SwarmSettings.UpdatePolicy(
        2L, 10L, SwarmSettings.FailureAction.ROLLBACK, null, 0.5f);
    ServiceConfig config = generator.generate(descriptor()
        .swarm(new SwarmSettings(null, null, null, update, null, null, null, null))
        .build());

    assertThat(config.updateConfig().getParallelism()).isEqualTo(2L);
    assertThat(config.updateConfig().getDelay()).isEqualTo(10L);
    assertThat(config.updateConfig().getFailureAction()).isEqualTo(UpdateFailureAction.ROLLBACK);
    assertThat(config.updateConfig().getMaxFailureRatio()).isEqualTo(0.5f);
    assertThat(config.rollbackConfig().getFailureAction()).isEqualTo(UpdateFailureAction.PAUSE);
  }

  private static ApplicationDescriptor.Builder descriptor() {
    return ApplicationDescriptor.builder().appName("api").dockerImage("nginx:1.25");
  }

  private static SwarmSettings swarm(SwarmSettings.RestartPolicy restart,
                                     SwarmSettings.Placement placement,
                                     SwarmSettings.Mode mode,
                                     SwarmSettings.HealthCheck healthCheck) {
    return new SwarmSettings(healthCheck, restart, placement, null, null, mode, null, null);
  }
}
