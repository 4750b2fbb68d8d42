package io.dockside.deploy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Toolchain used to turn application source into an image.
 * <p>
 * {@link #NONE} covers applications that are deployed from a pre-built image and
 * therefore have nothing to build.
 */
public enum BuildType {

  NIXPACKS("nixpacks"),
  HEROKU_BUILDPACKS("heroku_buildpacks"),
  PAKETO_BUILDPACKS("paketo_buildpacks"),
  DOCKERFILE("dockerfile"),
  STATIC("static"),
  NONE("none");

  private final String value;

  BuildType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isBuildable() {
    return this != NONE;
  }

  /**
   * Resolve a wire value. Unknown or missing tags resolve to {@link #NONE} so that
   * no build step runs for them.
   */
  @JsonCreator
  public static BuildType fromValue(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (BuildType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    return NONE;
  }
}
