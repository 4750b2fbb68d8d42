package io.dockside.docker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.NoSuchFileException;
import org.junit.jupiter.api.Test;

class DockerCallsTest {

  @Test
  void returnsResult() {
    assertThat(DockerCalls.call("list services", () -> "ok")).isEqualTo("ok");
  }

  @Test
  void translatesConnectionRefused() {
    assertThatThrownBy(() -> DockerCalls.run("list services", () -> {
      throw new RuntimeException(new ConnectException("Connection refused"));
    }))
        .isInstanceOf(DockerDaemonUnavailableException.class)
        .hasMessageContaining("Unable to list services")
        .hasRootCauseInstanceOf(ConnectException.class);
  }

  @Test
  void translatesMissingSocket() {
    assertThatThrownBy(() -> DockerCalls.call("inspect service api", () -> {
      throw new RuntimeException(new NoSuchFileException("/var/run/docker.sock"));
    })).isInstanceOf(DockerDaemonUnavailableException.class);

    assertThatThrownBy(() -> DockerCalls.call("inspect service api", () -> {
      throw new RuntimeException(new IOException("No such file or directory"));
    })).isInstanceOf(DockerDaemonUnavailableException.class);
  }

  @Test
  void translatesSocketPermissionProblems() {
    assertThatThrownBy(() -> DockerCalls.run("create service api", () -> {
      throw new RuntimeException("permission denied while trying to connect to the Docker daemon socket");
    })).isInstanceOf(DockerDaemonUnavailableException.class);
  }

  @Test
  void leavesOtherFailuresUntouched() {
    IllegalStateException failure = new IllegalStateException("update out of sequence");

    assertThatThrownBy(() -> DockerCalls.run("update service api", () -> {
      throw failure;
    })).isSameAs(failure);
  }
}
