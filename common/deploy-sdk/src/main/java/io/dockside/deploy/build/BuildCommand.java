package io.dockside.deploy.build;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Command line of a build, described rather than executed.
 *
 * @param command          program and arguments
 * @param workingDirectory directory the command runs in
 * @param environment      extra environment for the process
 * @param stdin            text piped to the process, or {@code null}
 */
public record BuildCommand(List<String> command,
                           Path workingDirectory,
                           Map<String, String> environment,
                           String stdin) {

  private static final String HEREDOC_MARKER = "DOCKSIDE_EOF";

  public BuildCommand {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    command = List.copyOf(command);
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Shell rendering that appends the build output to {@code logPath}.
   */
  public String toShellScript(Path logPath) {
    Objects.requireNonNull(logPath, "logPath");
    String log = quote(logPath.toString());
    StringBuilder script = new StringBuilder("set -e\n");
    script.append("cd ").append(quote(workingDirectory.toString())).append('\n');
    environment.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> script.append("export ").append(e.getKey()).append('=')
            .append(quote(e.getValue())).append('\n'));
    String commandLine = command.stream().map(BuildCommand::quote).collect(Collectors.joining(" "));
    if (stdin != null) {
      script.append(commandLine).append(" >> ").append(log).append(" 2>&1 <<'")
          .append(HEREDOC_MARKER).append("'\n")
          .append(stdin);
      if (!stdin.endsWith("\n")) {
        script.append('\n');
      }
      script.append(HEREDOC_MARKER).append('\n');
    } else {
      script.append(commandLine).append(" >> ").append(log).append(" 2>&1\n");
    }
    script.append("echo ").append(quote(command.get(0) + " build finished")).append(" >> ")
        .append(log).append('\n');
    return script.toString();
  }

  static String quote(String value) {
    if (value.matches("[A-Za-z0-9_./:=@%+,-]+")) {
      return value;
    }
    return "'" + value.replace("'", "'\"'\"'") + "'";
  }
}
