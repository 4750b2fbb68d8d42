package io.dockside.deploy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Optional Swarm scheduling settings of an application. Every block may be {@code null},
 * in which case the orchestrator-safe default is applied when the service is composed.
 */
public record SwarmSettings(HealthCheck healthCheck,
                            RestartPolicy restartPolicy,
                            Placement placement,
                            UpdatePolicy update,
                            UpdatePolicy rollback,
                            Mode mode,
                            Map<String, String> labels,
                            List<Network> networks) {

  private static final SwarmSettings EMPTY =
      new SwarmSettings(null, null, null, null, null, null, null, null);

  public SwarmSettings {
    labels = labels == null ? Map.of() : Map.copyOf(labels);
    networks = networks == null ? null : List.copyOf(networks);
  }

  public static SwarmSettings empty() {
    return EMPTY;
  }

  /**
   * Container probe, passed through unchanged. Durations are in nanoseconds.
   */
  public record HealthCheck(List<String> test, Long interval, Long timeout, Long startPeriod, Integer retries) {

    public HealthCheck {
      test = test == null ? List.of() : List.copyOf(test);
    }
  }

  public record RestartPolicy(RestartCondition condition, Long delay, Long maxAttempts, Long window) {
  }

  public record Placement(List<String> constraints) {

    public Placement {
      constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
  }

  /**
   * Shared shape of the update and rollback configuration.
   */
  public record UpdatePolicy(Long parallelism,
                             Long delay,
                             FailureAction failureAction,
                             Long monitor,
                             Float maxFailureRatio) {
  }

  /**
   * Either {@code global} (one task per node) or replicated with {@code replicas} tasks.
   */
  public record Mode(boolean global, Integer replicas) {

    public static Mode replicated(int replicas) {
      return new Mode(false, replicas);
    }

    public static Mode globalMode() {
      return new Mode(true, null);
    }
  }

  public record Network(String target, List<String> aliases) {

    public Network {
      if (target == null || target.isBlank()) {
        throw new IllegalArgumentException("network target must not be blank");
      }
      aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
  }

  public enum RestartCondition {
    NONE("none"),
    ON_FAILURE("on-failure"),
    ANY("any");

    private final String value;

    RestartCondition(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }

    @JsonCreator
    public static RestartCondition fromValue(String value) {
      return lookup(values(), value, RestartCondition::value, "restart condition");
    }
  }

  public enum FailureAction {
    PAUSE("pause"),
    CONTINUE("continue"),
    ROLLBACK("rollback");

    private final String value;

    FailureAction(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }

    @JsonCreator
    public static FailureAction fromValue(String value) {
      return lookup(values(), value, FailureAction::value, "failure action");
    }
  }

  private static <E extends Enum<E>> E lookup(E[] candidates,
                                              String value,
                                              java.util.function.Function<E, String> wire,
                                              String what) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (E candidate : candidates) {
      if (wire.apply(candidate).equals(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown " + what + " '" + value + "'");
  }
}
