package io.dockside.deploy.files;

import io.dockside.deploy.model.InvalidDescriptorException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of file-mount contents on the host: {@code <root>/<appName>/files/<filePath>}.
 */
public final class FileMountPaths {

  private FileMountPaths() {
  }

  public static Path filesDirectory(Path applicationsRoot, String appName) {
    Objects.requireNonNull(applicationsRoot, "applicationsRoot");
    Path root = applicationsRoot.toAbsolutePath().normalize();
    Path directory = root.resolve(requireNonBlank(appName, "appName")).resolve("files").normalize();
    if (!directory.startsWith(root)) {
      throw new InvalidDescriptorException("Invalid application name '" + appName + "'");
    }
    return directory;
  }

  public static Path resolve(Path applicationsRoot, String appName, String filePath) {
    Path directory = filesDirectory(applicationsRoot, appName);
    if (filePath == null || filePath.isBlank()) {
      throw new InvalidDescriptorException("File mount of " + appName + " has no filePath");
    }
    // Joined like a path segment: a leading slash does not make it absolute.
    Path resolved = directory.resolve(filePath.replaceFirst("^/+", "")).normalize();
    if (!resolved.startsWith(directory) || resolved.equals(directory)) {
      throw new InvalidDescriptorException(
          "File mount path '" + filePath + "' escapes the files directory of " + appName);
    }
    return resolved;
  }

  private static String requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }
}
