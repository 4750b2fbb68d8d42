package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.ResourceRequirements;
import com.github.dockerjava.api.model.ResourceSpecs;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.InvalidDescriptorException;
import java.util.Objects;

/**
 * Converts user-entered CPU (cores) and memory (MiB) values into Swarm resource
 * requirements.
 * <p>
 * Missing, blank and zero values are left out of the result so the control plane
 * keeps its defaults; a side without any value is omitted altogether.
 */
public final class ResourceCalculator {

  static final long NANO_CPUS_PER_CORE = 1_000_000_000L;
  static final long BYTES_PER_MEBIBYTE = 1024L * 1024L;

  private final boolean enforceReservationWithinLimit;

  public ResourceCalculator() {
    this(false);
  }

  /**
   * @param enforceReservationWithinLimit reject reservations above the matching limit
   */
  public ResourceCalculator(boolean enforceReservationWithinLimit) {
    this.enforceReservationWithinLimit = enforceReservationWithinLimit;
  }

  public ResourceRequirements calculate(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    return calculate(descriptor.cpuLimit(), descriptor.cpuReservation(),
        descriptor.memoryLimit(), descriptor.memoryReservation());
  }

  public ResourceRequirements calculate(String cpuLimit,
                                        String cpuReservation,
                                        String memoryLimit,
                                        String memoryReservation) {
    Long cpuLimitNanos = convert("cpuLimit", cpuLimit, NANO_CPUS_PER_CORE);
    Long cpuReservationNanos = convert("cpuReservation", cpuReservation, NANO_CPUS_PER_CORE);
    Long memoryLimitBytes = convert("memoryLimit", memoryLimit, BYTES_PER_MEBIBYTE);
    Long memoryReservationBytes = convert("memoryReservation", memoryReservation, BYTES_PER_MEBIBYTE);

    if (enforceReservationWithinLimit) {
      requireWithinLimit("cpu", cpuReservationNanos, cpuLimitNanos);
      requireWithinLimit("memory", memoryReservationBytes, memoryLimitBytes);
    }

    ResourceRequirements requirements = new ResourceRequirements();
    ResourceSpecs limits = specs(cpuLimitNanos, memoryLimitBytes);
    if (limits != null) {
      requirements = requirements.withLimits(limits);
    }
    ResourceSpecs reservations = specs(cpuReservationNanos, memoryReservationBytes);
    if (reservations != null) {
      requirements = requirements.withReservations(reservations);
    }
    return requirements;
  }

  private static ResourceSpecs specs(Long nanoCpus, Long memoryBytes) {
    if (nanoCpus == null && memoryBytes == null) {
      return null;
    }
    ResourceSpecs specs = new ResourceSpecs();
    if (nanoCpus != null) {
      specs = specs.withNanoCPUs(nanoCpus);
    }
    if (memoryBytes != null) {
      specs = specs.withMemoryBytes(memoryBytes);
    }
    return specs;
  }

  private static Long convert(String field, String raw, long factor) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    double value;
    try {
      value = Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      throw new InvalidDescriptorException("Invalid " + field + " '" + raw + "': not a number", e);
    }
    if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
      throw new InvalidDescriptorException("Invalid " + field + " '" + raw + "': must be a positive number");
    }
    double scaled = value * factor;
    if (scaled >= Long.MAX_VALUE) {
      throw new InvalidDescriptorException("Invalid " + field + " '" + raw + "': value is too large");
    }
    long converted = Math.round(scaled);
    return converted == 0 ? null : converted;
  }

  private static void requireWithinLimit(String resource, Long reservation, Long limit) {
    if (reservation != null && limit != null && reservation > limit) {
      throw new InvalidDescriptorException(
          resource + " reservation (" + reservation + ") exceeds the limit (" + limit + ")");
    }
  }
}
