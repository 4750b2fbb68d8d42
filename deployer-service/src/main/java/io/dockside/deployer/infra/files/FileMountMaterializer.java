package io.dockside.deployer.infra.files;

import io.dockside.deploy.files.FileMountPaths;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.MountSpec;
import io.dockside.deploy.ports.FileMountWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the content of file mounts below the application's files directory, where
 * the service binds them from. Existing files are overwritten.
 */
public class FileMountMaterializer implements FileMountWriter {

  private static final Logger log = LoggerFactory.getLogger(FileMountMaterializer.class);

  private final Path applicationsRoot;

  public FileMountMaterializer(Path applicationsRoot) {
    this.applicationsRoot = Objects.requireNonNull(applicationsRoot, "applicationsRoot");
  }

  @Override
  public void write(ApplicationDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    for (MountSpec mount : descriptor.mounts()) {
      if (mount instanceof MountSpec.File file) {
        Path target = FileMountPaths.resolve(applicationsRoot, descriptor.appName(), file.filePath());
        try {
          Files.createDirectories(target.getParent());
          Files.writeString(target, file.content() == null ? "" : file.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
          throw new UncheckedIOException("Failed to write file mount " + target, e);
        }
        log.debug("Wrote file mount {} of {}", target, descriptor.appName());
      }
    }
  }
}
