package io.dockside.deployer.infra.log;

import io.dockside.deploy.ports.DeploymentLog;
import io.dockside.deploy.ports.DeploymentLogFactory;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Deployment logs as UTF-8 text files. Every write is flushed so the log can be
 * followed while the deployment runs.
 */
public class FileDeploymentLogFactory implements DeploymentLogFactory {

  @Override
  public DeploymentLog open(Path logPath) {
    Objects.requireNonNull(logPath, "logPath");
    try {
      Path parent = logPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      return new FileDeploymentLog(logPath, Files.newBufferedWriter(logPath, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open deployment log " + logPath, e);
    }
  }

  static final class FileDeploymentLog implements DeploymentLog {
    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;

    FileDeploymentLog(Path path, BufferedWriter writer) {
      this.path = path;
      this.writer = writer;
    }

    @Override
    public synchronized void write(String text) {
      if (closed) {
        throw new IllegalStateException("Deployment log " + path + " is closed");
      }
      try {
        writer.write(text);
        writer.flush();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write deployment log " + path, e);
      }
    }

    @Override
    public synchronized void close() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        writer.close();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to close deployment log " + path, e);
      }
    }
  }
}
