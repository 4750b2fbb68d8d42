package io.dockside.docker.swarm;

import com.github.dockerjava.api.model.Mount;
import com.github.dockerjava.api.model.MountType;
import com.github.dockerjava.api.model.VolumeOptions;
import io.dockside.deploy.files.FileMountPaths;
import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deploy.model.MountSpec;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates declared mounts into Swarm mount descriptors, one variant at a time.
 * <p>
 * File mounts are bound from the application's files directory, where their content
 * must already have been written.
 */
public final class MountTranslator {

  private final Path applicationsRoot;

  public MountTranslator(Path applicationsRoot) {
    this.applicationsRoot = Objects.requireNonNull(applicationsRoot, "applicationsRoot");
  }

  /**
   * All mounts in the order volumes, binds, files.
   */
  public List<Mount> translate(String appName, List<MountSpec> mounts) {
    List<Mount> all = new ArrayList<>(volumeMounts(mounts));
    all.addAll(bindMounts(mounts));
    all.addAll(fileMounts(appName, mounts));
    return all;
  }

  public List<Mount> volumeMounts(List<MountSpec> mounts) {
    List<Mount> result = new ArrayList<>();
    for (MountSpec mount : safe(mounts)) {
      if (mount instanceof MountSpec.Volume volume) {
        result.add(new Mount()
            .withType(MountType.VOLUME)
            .withSource(require(volume.name(), "volume mount name"))
            .withTarget(require(volume.mountPath(), "volume mount path"))
            .withVolumeOptions(new VolumeOptions()));
      }
    }
    return result;
  }

  public List<Mount> bindMounts(List<MountSpec> mounts) {
    List<Mount> result = new ArrayList<>();
    for (MountSpec mount : safe(mounts)) {
      if (mount instanceof MountSpec.Bind bind) {
        result.add(new Mount()
            .withType(MountType.BIND)
            .withSource(require(bind.hostPath(), "bind mount host path"))
            .withTarget(require(bind.mountPath(), "bind mount path")));
      }
    }
    return result;
  }

  public List<Mount> fileMounts(String appName, List<MountSpec> mounts) {
    List<Mount> result = new ArrayList<>();
    for (MountSpec mount : safe(mounts)) {
      if (mount instanceof MountSpec.File file) {
        Path source = FileMountPaths.resolve(applicationsRoot, appName, file.filePath());
        result.add(new Mount()
            .withType(MountType.BIND)
            .withSource(source.toString())
            .withTarget(require(file.mountPath(), "file mount path")));
      }
    }
    return result;
  }

  private static List<MountSpec> safe(List<MountSpec> mounts) {
    return mounts == null ? List.of() : mounts;
  }

  private static String require(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new InvalidDescriptorException("Missing " + what);
    }
    return value;
  }
}
