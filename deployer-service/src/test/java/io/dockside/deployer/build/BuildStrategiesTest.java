package io.dockside.deployer.build;

import static org.assertj.core.api.Assertions.assertThat;

import io.dockside.deploy.build.BuildCommand;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.BuildSettings;
import io.dockside.deploy.model.BuildType;
import io.dockside.deploy.model.SourceType;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class BuildStrategiesTest {

  private static final Path LOG = Path.of("/logs/shop/shop.log");
  private static final Path CODE = Path.of("/apps/shop/code");

  private final ApplicationSources sources = new ApplicationSources(Path.of("/apps"));
  private final BuildProcessRunner runner = new BuildProcessRunner();

  @Test
  void nixpacksPassesEnvironment() {
    BuildCommand command = new NixpacksBuildStrategy(sources, runner)
        .describe(app(BuildType.NIXPACKS).env("NODE_ENV=production\nPORT=3000").build(), LOG);

    assertThat(command.command()).containsExactly(
        "nixpacks", "build", "/apps/shop/code", "--name", "shop",
        "--env", "NODE_ENV=production", "--env", "PORT=3000");
    assertThat(command.workingDirectory()).isEqualTo(CODE);
    assertThat(command.stdin()).isNull();
  }

  @Test
  void herokuUsesApplicationVersionOrDefault() {
    HerokuBuildpacksBuildStrategy strategy = new HerokuBuildpacksBuildStrategy(sources, runner, "24");

    assertThat(strategy.describe(app(BuildType.HEROKU_BUILDPACKS).build(), LOG).command())
        .containsExactly("pack", "build", "shop", "--path", "/apps/shop/code", "--builder", "heroku/builder:24");
    assertThat(strategy.describe(app(BuildType.HEROKU_BUILDPACKS)
            .build(new BuildSettings(null, null, null, null, null, "22")).build(), LOG).command())
        .contains("heroku/builder:22");
  }

  @Test
  void paketoUsesConfiguredBuilder() {
    BuildCommand command = new PaketoBuildpacksBuildStrategy(sources, runner, "paketobuildpacks/builder-jammy-full")
        .describe(app(BuildType.PAKETO_BUILDPACKS).env("BP_NODE_VERSION=20").build(), LOG);

    assertThat(command.command()).containsExactly(
        "pack", "build", "shop", "--path", "/apps/shop/code",
        "--builder", "paketobuildpacks/builder-jammy-full", "--env", "BP_NODE_VERSION=20");
  }

  @Test
  void dockerfileBuildsWithStageAndBuildArgsInContext() {
    BuildCommand command = new DockerfileBuildStrategy(sources, runner)
        .describe(app(BuildType.DOCKERFILE)
            .buildArgs("VERSION=1.2\nCOMMIT=abc")
            .build(new BuildSettings(null, "docker/Dockerfile.prod", "services/web", "runtime", null, null))
            .build(), LOG);

    assertThat(command.command()).containsExactly(
        "docker", "build", "-t", "shop", "-f", "/apps/shop/code/docker/Dockerfile.prod",
        "--target", "runtime",
        "--build-arg", "VERSION=1.2", "--build-arg", "COMMIT=abc",
        "/apps/shop/code/services/web");
    assertThat(command.workingDirectory()).isEqualTo(Path.of("/apps/shop/code/services/web"));
  }

  @Test
  void dockerfileDefaults() {
    BuildCommand command = new DockerfileBuildStrategy(sources, runner).describe(app(BuildType.DOCKERFILE).build(), LOG);

    assertThat(command.command()).containsExactly(
        "docker", "build", "-t", "shop", "-f", "/apps/shop/code/Dockerfile", "/apps/shop/code");
  }

  @Test
  void staticFeedsGeneratedDockerfileOnStdin() {
    BuildCommand command = new StaticBuildStrategy(sources, runner, "nginx:alpine")
        .describe(app(BuildType.STATIC)
            .build(new BuildSettings(null, null, null, null, "dist", null))
            .build(), LOG);

    assertThat(command.command()).containsExactly("docker", "build", "-t", "shop", "-f", "-", "/apps/shop/code");
    assertThat(command.stdin()).isEqualTo("""
        FROM nginx:alpine
        WORKDIR /usr/share/nginx/html/
        COPY dist .
        CMD ["nginx", "-g", "daemon off;"]
        """);
  }

  @Test
  void staticCopiesWholeSourceWithoutPublishDirectory() {
    StaticBuildStrategy strategy = new StaticBuildStrategy(sources, runner, "nginx:alpine");

    assertThat(strategy.dockerfile(null)).contains("COPY . .\n");
  }

  @Test
  void codePathResolvesAgainstApplicationCodeDirectory() {
    assertThat(sources.codeDirectory(app(BuildType.NIXPACKS)
        .build(new BuildSettings("frontend", null, null, null, null, null)).build()))
        .isEqualTo(Path.of("/apps/shop/code/frontend"));
    assertThat(sources.codeDirectory(app(BuildType.NIXPACKS)
        .build(new BuildSettings("/srv/checkout", null, null, null, null, null)).build()))
        .isEqualTo(Path.of("/srv/checkout"));
  }

  @Test
  void describedCommandRendersToScriptAppendingToLog() {
    String script = new NixpacksBuildStrategy(sources, runner)
        .describe(app(BuildType.NIXPACKS).build(), LOG)
        .toShellScript(LOG);

    assertThat(script).contains("nixpacks build /apps/shop/code --name shop >> /logs/shop/shop.log 2>&1");
  }

  private static ApplicationDescriptor.Builder app(BuildType type) {
    return ApplicationDescriptor.builder()
        .appName("shop")
        .sourceType(SourceType.GITHUB)
        .buildType(type);
  }
}
