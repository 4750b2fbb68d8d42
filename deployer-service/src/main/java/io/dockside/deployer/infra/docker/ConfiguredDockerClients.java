package io.dockside.deployer.infra.docker;

import com.github.dockerjava.api.DockerClient;
import io.dockside.deployer.config.DeployerProperties;
import io.dockside.docker.DockerClientProvider;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Docker clients of the local engine and of every configured server. Remote clients
 * are created on first use and kept until shutdown, when they are closed. The local
 * client is its own bean and is closed by the container.
 */
public class ConfiguredDockerClients implements DockerClientProvider {

  private static final Logger log = LoggerFactory.getLogger(ConfiguredDockerClients.class);

  private final DockerClient localClient;
  private final Map<String, DeployerProperties.Server> servers;
  private final Function<DeployerProperties.Server, DockerClient> clientFactory;
  private final Map<String, DockerClient> remoteClients = new ConcurrentHashMap<>();

  public ConfiguredDockerClients(DockerClient localClient,
                                 Map<String, DeployerProperties.Server> servers,
                                 Function<DeployerProperties.Server, DockerClient> clientFactory) {
    this.localClient = Objects.requireNonNull(localClient, "localClient");
    this.servers = Map.copyOf(Objects.requireNonNull(servers, "servers"));
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public DockerClient forServer(String serverId) {
    if (serverId == null || serverId.isBlank()) {
      return localClient;
    }
    DeployerProperties.Server server = servers.get(serverId);
    if (server == null) {
      throw new UnknownServerException(serverId);
    }
    return remoteClients.computeIfAbsent(serverId, id -> {
      log.info("Connecting to server {} at {}", id, server.host());
      return clientFactory.apply(server);
    });
  }

  @PreDestroy
  public void closeRemoteClients() {
    remoteClients.forEach((serverId, client) -> {
      try {
        client.close();
      } catch (IOException e) {
        log.warn("Closing the client of server {} failed: {}", serverId, e.getMessage());
      }
    });
    remoteClients.clear();
  }
}
