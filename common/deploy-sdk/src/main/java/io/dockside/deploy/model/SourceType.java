package io.dockside.deploy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Where the application's runnable image comes from.
 * <p>
 * {@link #DOCKER} means a pre-built image is pulled as-is; every other source
 * produces the image by building checked-out code.
 */
public enum SourceType {

  DOCKER("docker"),
  GITHUB("github"),
  GITLAB("gitlab"),
  BITBUCKET("bitbucket"),
  GIT("git"),
  DROP("drop");

  private final String value;

  SourceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isDockerImage() {
    return this == DOCKER;
  }

  @JsonCreator
  public static SourceType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("sourceType must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SourceType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown sourceType '" + value + "'");
  }
}
