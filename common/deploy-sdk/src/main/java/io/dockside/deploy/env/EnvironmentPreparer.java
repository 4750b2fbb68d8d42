package io.dockside.deploy.env;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the raw environment text entered for an application into container
 * environment entries.
 * <p>
 * Parsing is permissive: {@code KEY=VALUE} lines are normalised by trimming the
 * whitespace around the key, blank lines are dropped and any other line is passed
 * through unchanged. Line order is preserved.
 */
public final class EnvironmentPreparer {

  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
  private static final Pattern ASSIGNMENT =
      Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_.\\-]*)\\s*=(.*)$");

  private EnvironmentPreparer() {
  }

  public static List<String> prepare(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> entries = new ArrayList<>();
    for (String line : LINE_BREAK.split(raw, -1)) {
      if (line.isBlank()) {
        continue;
      }
      Matcher matcher = ASSIGNMENT.matcher(line);
      if (matcher.matches()) {
        entries.add(matcher.group(1) + "=" + matcher.group(2));
      } else {
        entries.add(line);
      }
    }
    return List.copyOf(entries);
  }

  /**
   * Variables as a map for build tooling flags. Malformed lines are ignored and
   * the last assignment of a key wins.
   */
  public static Map<String, String> toMap(String raw) {
    Map<String, String> variables = new LinkedHashMap<>();
    for (String entry : prepare(raw)) {
      Matcher matcher = ASSIGNMENT.matcher(entry);
      if (matcher.matches()) {
        variables.put(matcher.group(1), matcher.group(2));
      }
    }
    return variables;
  }
}
