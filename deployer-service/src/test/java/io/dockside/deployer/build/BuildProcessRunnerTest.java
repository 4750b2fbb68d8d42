package io.dockside.deployer.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.build.BuildFailedException;
import io.dockside.deploy.ports.DeploymentLog;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BuildProcessRunnerTest {

  @TempDir
  Path workDir;

  private final BuildProcessRunner runner = new BuildProcessRunner();
  private final StringBuilder output = new StringBuilder();
  private final DeploymentLog deploymentLog = new DeploymentLog() {
    @Override
    public void write(String text) {
      output.append(text);
    }

    @Override
    public void close() {
    }
  };

  @Test
  void copiesStdoutAndStderrToLog() {
    runner.run(shell("echo building; echo warning >&2"), deploymentLog);

    assertThat(output.toString()).contains("building\n", "warning\n");
  }

  @Test
  void runsInWorkingDirectoryWithEnvironment() throws Exception {
    Files.writeString(workDir.resolve("package.json"), "{}");

    runner.run(new BuildCommand(List.of("sh", "-c", "ls; echo \"$GREETING\""), workDir,
        Map.of("GREETING", "hello"), null), deploymentLog);

    assertThat(output.toString()).contains("package.json\n", "hello\n");
  }

  @Test
  void feedsStdin() {
    runner.run(new BuildCommand(List.of("cat"), workDir, null, "FROM nginx:alpine\n"), deploymentLog);

    assertThat(output.toString()).isEqualTo("FROM nginx:alpine\n");
  }

  @Test
  void nonZeroExitFailsTheBuild() {
    assertThatThrownBy(() -> runner.run(shell("echo broken; exit 3"), deploymentLog))
        .isInstanceOf(BuildFailedException.class)
        .hasMessage("sh exited with code 3");
    assertThat(output.toString()).contains("broken");
  }

  @Test
  void missingToolFailsTheBuild() {
    assertThatThrownBy(() -> runner.run(
        new BuildCommand(List.of("dockside-no-such-tool"), workDir, null, null), deploymentLog))
        .isInstanceOf(BuildFailedException.class)
        .hasMessageContaining("Could not start dockside-no-such-tool");
  }

  private BuildCommand shell(String script) {
    return new BuildCommand(List.of("sh", "-c", script), workDir, null, null);
  }
}
