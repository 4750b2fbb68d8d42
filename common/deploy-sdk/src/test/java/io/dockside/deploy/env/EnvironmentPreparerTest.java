package io.dockside.deploy.env;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class EnvironmentPreparerTest {

  @Test
  void keepsDeclarationOrderAndSkipsBlankLines() {
    List<String> env = EnvironmentPreparer.prepare("B=2\n\nA=1\n   \nC=3\n");

    assertThat(env).containsExactly("B=2", "A=1", "C=3");
  }

  @Test
  void trimsWhitespaceAroundKeysButKeepsValues() {
    List<String> env = EnvironmentPreparer.prepare("  PORT =8080\r\nGREETING=hello world ");

    assertThat(env).containsExactly("PORT=8080", "GREETING=hello world ");
  }

  @Test
  void passesUnrecognisedLinesThrough() {
    List<String> env = EnvironmentPreparer.prepare("# comment\nnot an assignment\nKEY=value");

    assertThat(env).containsExactly("# comment", "not an assignment", "KEY=value");
  }

  @Test
  void valuesMayContainEqualsSigns() {
    assertThat(EnvironmentPreparer.prepare("DATABASE_URL=postgres://u:p@db/app?ssl=true"))
        .containsExactly("DATABASE_URL=postgres://u:p@db/app?ssl=true");
  }

  @Test
  void isIdempotentOnItsOwnOutput() {
    String raw = "\n  A = 1\r\nfree text\n\nB==x\n C=\n#x=y\n";

    List<String> first = EnvironmentPreparer.prepare(raw);
    List<String> second = EnvironmentPreparer.prepare(String.join("\n", first));

    assertThat(second).isEqualTo(first);
  }

  @Test
  void emptyOrMissingBlobYieldsNoEntries() {
    assertThat(EnvironmentPreparer.prepare(null)).isEmpty();
    assertThat(EnvironmentPreparer.prepare("  \n\n")).isEmpty();
  }

  @Test
  void mapIgnoresMalformedLinesAndLastAssignmentWins() {
    assertThat(EnvironmentPreparer.toMap("A=1\nnoise\nB=2\nA=3"))
        .containsExactly(
            org.assertj.core.api.Assertions.entry("A", "3"),
            org.assertj.core.api.Assertions.entry("B", "2"));
  }
}
