package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.EndpointSpec;
import com.github.dockerjava.api.model.PortConfig;
import com.github.dockerjava.api.model.PortConfigProtocol;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import io.dockside.deploy.env.EnvironmentPreparer;
import io.dockside.deploy.image.ImageReferences;
import io.dockside.deploy.image.RegistryCredentials;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deploy.model.PortMapping;
import java.util.List;
import java.util.Objects;

/**
 * Builds the complete Swarm service specification of an application.
 * <p>
 * Pure: nothing here talks to the control plane, and every call produces a fresh
 * specification.
 */
public final class ServiceSpecComposer {

  private final ResourceCalculator resources;
  private final MountTranslator mounts;
  private final ServiceConfigGenerator configs;

  public ServiceSpecComposer(ResourceCalculator resources,
                             MountTranslator mounts,
                             ServiceConfigGenerator configs) {
    this.resources = Objects.requireNonNull(resources, "resources");
    this.mounts = Objects.requireNonNull(mounts, "mounts");
    this.configs = Objects.requireNonNull(configs, "configs");
  }

  public static ServiceSpecComposer create(ServiceDefaults defaults, boolean enforceReservationWithinLimit) {
    return new ServiceSpecComposer(
        new ResourceCalculator(enforceReservationWithinLimit),
        new MountTranslator(defaults.applicationsRoot()),
        new ServiceConfigGenerator(defaults));
  }

  public ComposedService compose(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    String appName = descriptor.appName();
    ServiceConfig config = configs.generate(descriptor);

    ContainerSpec containerSpec = new ContainerSpec()
        .withImage(ImageReferences.serviceImage(descriptor))
        .withEnv(EnvironmentPreparer.prepare(descriptor.env()))
        .withMounts(mounts.translate(appName, descriptor.mounts()))
        .withLabels(config.labels());
    if (config.healthCheck() != null) {
      containerSpec = containerSpec.withHealthCheck(config.healthCheck());
    }
    String command = descriptor.command();
    if (command != null && !command.isBlank()) {
      containerSpec = containerSpec
          .withCommand(List.of("/bin/sh"))
          .withArgs(List.of("-c", command));
    }

    TaskSpec taskSpec = new TaskSpec()
        .withContainerSpec(containerSpec)
        .withNetworks(config.networks())
        .withRestartPolicy(config.restartPolicy())
        .withPlacement(config.placement())
        .withResources(resources.calculate(descriptor));

    ServiceSpec serviceSpec = new ServiceSpec()
        .withName(appName)
        .withTaskTemplate(taskSpec)
        .withMode(config.mode())
        .withRollbackConfig(config.rollbackConfig())
        .withUpdateConfig(config.updateConfig())
        .withEndpointSpec(new EndpointSpec().withPorts(ports(descriptor.ports())))
        .withLabels(config.labels());

    AuthConfig auth = RegistryCredentials.resolve(descriptor)
        .map(credentials -> new AuthConfig()
            .withUsername(credentials.username())
            .withPassword(credentials.password())
            .withRegistryAddress(credentials.serverAddress()))
        .orElse(null);
    return new ComposedService(serviceSpec, auth);
  }

  private static List<PortConfig> ports(List<PortMapping> ports) {
    return ports.stream()
        .map(ServiceSpecComposer::port)
        .toList();
  }

  private static PortConfig port(PortMapping mapping) {
    PortConfig port = new PortConfig()
        .withProtocol(protocol(mapping.protocol()))
        .withTargetPort(mapping.targetPort());
    if (mapping.publishedPort() != null) {
      port = port.withPublishedPort(mapping.publishedPort());
    }
    if (mapping.publishMode() != null && !mapping.publishMode().isBlank()) {
      port = port.withPublishMode(publishMode(mapping.publishMode()));
    }
    return port;
  }

  private static PortConfigProtocol protocol(String value) {
    if (value == null || value.isBlank()) {
      return PortConfigProtocol.TCP;
    }
    for (PortConfigProtocol protocol : PortConfigProtocol.values()) {
      if (protocol.name().equalsIgnoreCase(value.trim())) {
        return protocol;
      }
    }
    throw new InvalidDescriptorException("Unsupported port protocol '" + value + "'");
  }

  private static PortConfig.PublishMode publishMode(String value) {
    for (PortConfig.PublishMode mode : PortConfig.PublishMode.values()) {
      if (mode.name().equalsIgnoreCase(value.trim())) {
        return mode;
      }
    }
    throw new InvalidDescriptorException("Unsupported port publish mode '" + value + "'");
  }
}
