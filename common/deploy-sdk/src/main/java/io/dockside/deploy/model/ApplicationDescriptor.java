package io.dockside.deploy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declarative description of one application's desired deployment.
 * <p>
 * Resource values are kept as entered by users (cores and MiB) and are only
 * converted when a service specification is composed. The application name doubles
 * as the Swarm service name and as a directory name on the host, so it is restricted to
 * {@code [a-zA-Z0-9][a-zA-Z0-9_.-]*}.
 */
public record ApplicationDescriptor(
    String appName,
    String serverId,
    SourceType sourceType,
    BuildType buildType,
    String dockerImage,
    String username,
    String password,
    String env,
    String buildArgs,
    String command,
    String cpuLimit,
    String cpuReservation,
    String memoryLimit,
    String memoryReservation,
    Integer replicas,
    List<PortMapping> ports,
    List<MountSpec> mounts,
    RegistrySettings registry,
    BuildSettings build,
    SwarmSettings swarm
) {

  private static final Pattern APP_NAME = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9_.-]*");

  public ApplicationDescriptor {
    if (appName == null || appName.isBlank()) {
      throw new IllegalArgumentException("appName must not be blank");
    }
    if (!APP_NAME.matcher(appName).matches()) {
      throw new InvalidDescriptorException("Invalid application name '" + appName + "'");
    }
    Objects.requireNonNull(sourceType, "sourceType");
    buildType = buildType == null ? BuildType.NONE : buildType;
    ports = ports == null ? List.of() : List.copyOf(ports);
    mounts = mounts == null ? List.of() : List.copyOf(mounts);
    build = build == null ? BuildSettings.empty() : build;
    swarm = swarm == null ? SwarmSettings.empty() : swarm;
  }

  public boolean hasRegistry() {
    return registry != null;
  }

  public Builder toBuilder() {
    return new Builder()
        .appName(appName)
        .serverId(serverId)
        .sourceType(sourceType)
        .buildType(buildType)
        .dockerImage(dockerImage)
        .username(username)
        .password(password)
        .env(env)
        .buildArgs(buildArgs)
        .command(command)
        .cpuLimit(cpuLimit)
        .cpuReservation(cpuReservation)
        .memoryLimit(memoryLimit)
        .memoryReservation(memoryReservation)
        .replicas(replicas)
        .ports(ports)
        .mounts(mounts)
        .registry(registry)
        .build(build)
        .swarm(swarm);
  }

  @Override
  public String toString() {
    return "ApplicationDescriptor[appName=" + appName
        + ", serverId=" + serverId
        + ", sourceType=" + sourceType
        + ", buildType=" + buildType
        + ", dockerImage=" + dockerImage
        + ", registry=" + registry + "]";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String appName;
    private String serverId;
    private SourceType sourceType = SourceType.DOCKER;
    private BuildType buildType = BuildType.NONE;
    private String dockerImage;
    private String username;
    private String password;
    private String env;
    private String buildArgs;
    private String command;
    private String cpuLimit;
    private String cpuReservation;
    private String memoryLimit;
    private String memoryReservation;
    private Integer replicas;
    private List<PortMapping> ports = new ArrayList<>();
    private List<MountSpec> mounts = new ArrayList<>();
    private RegistrySettings registry;
    private BuildSettings build;
    private SwarmSettings swarm;

    public Builder appName(String appName) {
      this.appName = appName;
      return this;
    }

    public Builder serverId(String serverId) {
      this.serverId = serverId;
      return this;
    }

    public Builder sourceType(SourceType sourceType) {
      this.sourceType = sourceType;
      return this;
    }

    public Builder buildType(BuildType buildType) {
      this.buildType = buildType;
      return this;
    }

    public Builder dockerImage(String dockerImage) {
      this.dockerImage = dockerImage;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder env(String env) {
      this.env = env;
      return this;
    }

    public Builder buildArgs(String buildArgs) {
      this.buildArgs = buildArgs;
      return this;
    }

    public Builder command(String command) {
      this.command = command;
      return this;
    }

    public Builder cpuLimit(String cpuLimit) {
      this.cpuLimit = cpuLimit;
      return this;
    }

    public Builder cpuReservation(String cpuReservation) {
      this.cpuReservation = cpuReservation;
      return this;
    }

    public Builder memoryLimit(String memoryLimit) {
      this.memoryLimit = memoryLimit;
      return this;
    }

    public Builder memoryReservation(String memoryReservation) {
      this.memoryReservation = memoryReservation;
      return this;
    }

    public Builder replicas(Integer replicas) {
      this.replicas = replicas;
      return this;
    }

    public Builder ports(List<PortMapping> ports) {
      this.ports = ports == null ? new ArrayList<>() : new ArrayList<>(ports);
      return this;
    }

    public Builder port(PortMapping port) {
      this.ports.add(port);
      return this;
    }

    public Builder mounts(List<MountSpec> mounts) {
      this.mounts = mounts == null ? new ArrayList<>() : new ArrayList<>(mounts);
      return this;
    }

    public Builder mount(MountSpec mount) {
      this.mounts.add(mount);
      return this;
    }

    public Builder registry(RegistrySettings registry) {
      this.registry = registry;
      return this;
    }

    public Builder build(BuildSettings build) {
      this.build = build;
      return this;
    }

    public Builder swarm(SwarmSettings swarm) {
      this.swarm = swarm;
      return this;
    }

    public ApplicationDescriptor build() {
      return new ApplicationDescriptor(appName, serverId, sourceType, buildType, dockerImage,
          username, password, env, buildArgs, command, cpuLimit, cpuReservation, memoryLimit,
          memoryReservation, replicas, ports, mounts, registry, build, swarm);
    }
  }
}
