package io.dockside.deployer.build;

import io.dockside.deploy.model.ApplicationDescriptor;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves where an application's checked-out source lives:
 * {@code <applications-root>/<appName>/code}, or the descriptor's {@code codePath}.
 */
public class ApplicationSources {

  private final Path applicationsRoot;

  public ApplicationSources(Path applicationsRoot) {
    this.applicationsRoot = Objects.requireNonNull(applicationsRoot, "applicationsRoot")
        .toAbsolutePath()
        .normalize();
  }

  public Path codeDirectory(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    Path defaultDirectory = applicationsRoot.resolve(descriptor.appName()).resolve("code");
    String codePath = descriptor.build().codePath();
    if (codePath == null || codePath.isBlank()) {
      return defaultDirectory;
    }
    Path declared = Path.of(codePath);
    if (declared.isAbsolute()) {
      return declared.normalize();
    }
    return defaultDirectory.resolve(declared).normalize();
  }
}
