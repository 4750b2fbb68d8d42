package io.dockside.deploy.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One storage mount declared by an application. Exactly one of the three variants.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MountSpec.Volume.class, name = "volume"),
    @JsonSubTypes.Type(value = MountSpec.Bind.class, name = "bind"),
    @JsonSubTypes.Type(value = MountSpec.File.class, name = "file")
})
public sealed interface MountSpec {

  /** Absolute path inside the container. */
  String mountPath();

  /** Named volume managed by the engine. */
  record Volume(String name, String mountPath) implements MountSpec {
  }

  /** Host directory or file bound into the container. */
  record Bind(String hostPath, String mountPath) implements MountSpec {
  }

  /**
   * Inline file content. The content is written under the application's files
   * directory at {@code filePath} and then bound into the container.
   */
  record File(String filePath, String content, String mountPath) implements MountSpec {
  }
}
