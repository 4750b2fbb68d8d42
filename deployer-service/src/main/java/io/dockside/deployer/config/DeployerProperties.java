package io.dockside.deployer.config;

import io.dockside.docker.swarm.InspectFailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dockside.deployer")
public class DeployerProperties {

  private final Docker docker;
  private final Map<String, Server> servers;
  private final Paths paths;
  private final Swarm swarm;
  private final Reconcile reconcile;
  private final Build build;

  public DeployerProperties(@Valid Docker docker,
                            Map<String, @Valid Server> servers,
                            @Valid Paths paths,
                            @Valid Swarm swarm,
                            @Valid Reconcile reconcile,
                            @Valid Build build) {
    this.docker = docker != null ? docker : new Docker(null, null);
    this.servers = servers != null ? Map.copyOf(servers) : Map.of();
    this.paths = paths != null ? paths : new Paths(null, null);
    this.swarm = swarm != null ? swarm : new Swarm(null, null);
    this.reconcile = reconcile != null ? reconcile : new Reconcile(null, null);
    this.build = build != null ? build : new Build(null, null, null);
  }

  public Docker getDocker() {
    return docker;
  }

  public Map<String, Server> getServers() {
    return servers;
  }

  public Optional<Server> server(String serverId) {
    return Optional.ofNullable(servers.get(serverId));
  }

  public Paths getPaths() {
    return paths;
  }

  public Swarm getSwarm() {
    return swarm;
  }

  public Reconcile getReconcile() {
    return reconcile;
  }

  public Build getBuild() {
    return build;
  }

  /**
   * Engine used for builds, image pushes and applications without a server.
   */
  @Validated
  public static final class Docker {
    static final String DEFAULT_SOCKET_PATH = "/var/run/docker.sock";

    private final String host;
    private final String socketPath;

    public Docker(String host, String socketPath) {
      this.host = host;
      this.socketPath = socketPath != null && !socketPath.isBlank() ? socketPath : DEFAULT_SOCKET_PATH;
    }

    public String host() {
      return host;
    }

    public String socketPath() {
      return socketPath;
    }

    public boolean hasHost() {
      return host != null && !host.isBlank();
    }
  }

  /**
   * Remote Swarm manager reachable over TCP.
   */
  @Validated
  public static final class Server {
    private final String host;
    private final boolean tlsVerify;
    private final String certPath;

    public Server(@NotBlank String host, Boolean tlsVerify, String certPath) {
      this.host = requireNonBlank(host, "host");
      this.tlsVerify = Boolean.TRUE.equals(tlsVerify);
      this.certPath = certPath;
    }

    public String host() {
      return host;
    }

    public boolean tlsVerify() {
      return tlsVerify;
    }

    public String certPath() {
      return certPath;
    }

    public boolean hasCertPath() {
      return certPath != null && !certPath.isBlank();
    }
  }

  @Validated
  public static final class Paths {
    static final Path DEFAULT_APPLICATIONS_ROOT = Path.of("/etc/dockside/applications");
    static final Path DEFAULT_LOGS_ROOT = Path.of("/etc/dockside/logs");

    private final Path applicationsRoot;
    private final Path logsRoot;

    public Paths(Path applicationsRoot, Path logsRoot) {
      this.applicationsRoot = applicationsRoot != null ? applicationsRoot : DEFAULT_APPLICATIONS_ROOT;
      this.logsRoot = logsRoot != null ? logsRoot : DEFAULT_LOGS_ROOT;
    }

    public Path applicationsRoot() {
      return applicationsRoot;
    }

    public Path logsRoot() {
      return logsRoot;
    }
  }

  @Validated
  public static final class Swarm {
    static final String DEFAULT_NETWORK = "dockside-network";
    static final String DEFAULT_LABEL_PREFIX = "dockside";

    private final String defaultNetwork;
    private final String labelPrefix;

    public Swarm(String defaultNetwork, String labelPrefix) {
      this.defaultNetwork = orDefault(defaultNetwork, DEFAULT_NETWORK);
      this.labelPrefix = orDefault(labelPrefix, DEFAULT_LABEL_PREFIX);
    }

    public String defaultNetwork() {
      return defaultNetwork;
    }

    public String labelPrefix() {
      return labelPrefix;
    }
  }

  @Validated
  public static final class Reconcile {
    private final InspectFailurePolicy inspectFailurePolicy;
    private final boolean enforceReservationWithinLimit;

    public Reconcile(InspectFailurePolicy inspectFailurePolicy, Boolean enforceReservationWithinLimit) {
      this.inspectFailurePolicy = inspectFailurePolicy != null ? inspectFailurePolicy : InspectFailurePolicy.TREAT_AS_ABSENT;
      this.enforceReservationWithinLimit = Boolean.TRUE.equals(enforceReservationWithinLimit);
    }

    public InspectFailurePolicy inspectFailurePolicy() {
      return inspectFailurePolicy;
    }

    public boolean enforceReservationWithinLimit() {
      return enforceReservationWithinLimit;
    }
  }

  @Validated
  public static final class Build {
    static final String DEFAULT_HEROKU_BUILDER_VERSION = "24";
    static final String DEFAULT_PAKETO_BUILDER = "paketobuildpacks/builder-jammy-full";
    static final String DEFAULT_STATIC_BASE_IMAGE = "nginx:alpine";

    private final String herokuBuilderVersion;
    private final String paketoBuilder;
    private final String staticBaseImage;

    public Build(String herokuBuilderVersion, String paketoBuilder, String staticBaseImage) {
      this.herokuBuilderVersion = orDefault(herokuBuilderVersion, DEFAULT_HEROKU_BUILDER_VERSION);
      this.paketoBuilder = orDefault(paketoBuilder, DEFAULT_PAKETO_BUILDER);
      this.staticBaseImage = orDefault(staticBaseImage, DEFAULT_STATIC_BASE_IMAGE);
    }

    public String herokuBuilderVersion() {
      return herokuBuilderVersion;
    }

    public String paketoBuilder() {
      return paketoBuilder;
    }

    public String staticBaseImage() {
      return staticBaseImage;
    }
  }

  private static String orDefault(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }

  private static String requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }
}
