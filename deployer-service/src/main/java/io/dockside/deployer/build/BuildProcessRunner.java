package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.build.BuildFailedException;
import io.dockside.deploy.ports.DeploymentLog;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a build command as a child process, copying its combined stdout and stderr to
 * the deployment log line by line.
 */
public class BuildProcessRunner {

  private static final Logger log = LoggerFactory.getLogger(BuildProcessRunner.class);

  public void run(BuildCommand command, DeploymentLog deploymentLog) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(deploymentLog, "deploymentLog");
    String program = command.command().get(0);
    ProcessBuilder builder = new ProcessBuilder(command.command())
        .directory(command.workingDirectory().toFile())
        .redirectErrorStream(true);
    builder.environment().putAll(command.environment());

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new BuildFailedException("Could not start " + program + ": " + e.getMessage(), e);
    }
    log.debug("[BUILD] started {} in {}", program, command.workingDirectory());
    try {
      feed(process, command.stdin());
      try (BufferedReader reader = new BufferedReader(
          new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          deploymentLog.write(line + "\n");
        }
      }
      int exit = process.waitFor();
      log.debug("[BUILD] exit={} program={}", exit, program);
      if (exit != 0) {
        throw new BuildFailedException(program + " exited with code " + exit);
      }
    } catch (IOException e) {
      process.destroyForcibly();
      throw new BuildFailedException("Reading the output of " + program + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new BuildFailedException("Interrupted while running " + program, e);
    }
  }

  private static void feed(Process process, String stdin) throws IOException {
    OutputStream input = process.getOutputStream();
    if (stdin == null) {
      input.close();
      return;
    }
    try (Writer writer = new OutputStreamWriter(input, StandardCharsets.UTF_8)) {
      writer.write(stdin);
    }
  }
}
