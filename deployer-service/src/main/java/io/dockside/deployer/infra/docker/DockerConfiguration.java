package io.dockside.deployer.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.dockside.deployer.config.DeployerProperties;
import io.dockside.docker.DockerClientProvider;
import io.dockside.docker.registry.RegistryImageUploader;
import io.dockside.docker.swarm.DockerServiceControlPlane;
import io.dockside.docker.swarm.ServiceControlPlaneProvider;
import io.dockside.docker.swarm.ServiceDefaults;
import io.dockside.docker.swarm.ServiceSpecComposer;
import io.dockside.docker.swarm.SwarmServiceReconciler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DockerConfiguration {
  private final DeployerProperties properties;

  public DockerConfiguration(DeployerProperties properties) {
    this.properties = properties;
  }

  @Bean
  public DefaultDockerClientConfig dockerClientConfig() {
    DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
    DeployerProperties.Docker docker = properties.getDocker();
    if (docker.hasHost()) {
      builder.withDockerHost(docker.host());
    } else {
      builder.withDockerHost("unix://" + docker.socketPath());
    }
    return builder.build();
  }

  @Bean
  public DockerClient dockerClient(DefaultDockerClientConfig config) {
    return newClient(config);
  }

  @Bean
  public ConfiguredDockerClients dockerClients(DockerClient dockerClient) {
    return new ConfiguredDockerClients(dockerClient, properties.getServers(),
        server -> newClient(serverConfig(server)));
  }

  @Bean
  public ServiceControlPlaneProvider serviceControlPlanes(DockerClientProvider dockerClients) {
    return DockerServiceControlPlane.provider(dockerClients);
  }

  @Bean
  public ServiceSpecComposer serviceSpecComposer() {
    ServiceDefaults defaults = new ServiceDefaults(
        properties.getPaths().applicationsRoot(),
        properties.getSwarm().defaultNetwork(),
        properties.getSwarm().labelPrefix());
    return ServiceSpecComposer.create(defaults, properties.getReconcile().enforceReservationWithinLimit());
  }

  @Bean
  public SwarmServiceReconciler serviceReconciler(ServiceSpecComposer composer,
                                                  ServiceControlPlaneProvider serviceControlPlanes) {
    return new SwarmServiceReconciler(composer, serviceControlPlanes,
        properties.getReconcile().inspectFailurePolicy());
  }

  @Bean
  public RegistryImageUploader imageUploader(DockerClientProvider dockerClients) {
    return new RegistryImageUploader(dockerClients);
  }

  static DefaultDockerClientConfig serverConfig(DeployerProperties.Server server) {
    DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder()
        .withDockerHost(server.host())
        .withDockerTlsVerify(server.tlsVerify());
    if (server.hasCertPath()) {
      builder.withDockerCertPath(server.certPath());
    }
    return builder.build();
  }

  private static DockerClient newClient(DefaultDockerClientConfig config) {
    DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
        .dockerHost(config.getDockerHost())
        .sslConfig(config.getSSLConfig())
        .build();
    return DockerClientImpl.getInstance(config, httpClient);
  }
}
