package io.dockside.deployer.build;

import io.dockside.deploy.build.BuildDispatcher;
import io.dockside.deploy.build.BuildStrategy;
import io.dockside.deployer.config.DeployerProperties;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BuildConfiguration {
  private final DeployerProperties properties;

  public BuildConfiguration(DeployerProperties properties) {
    this.properties = properties;
  }

  @Bean
  public ApplicationSources applicationSources() {
    return new ApplicationSources(properties.getPaths().applicationsRoot());
  }

  @Bean
  public BuildProcessRunner buildProcessRunner() {
    return new BuildProcessRunner();
  }

  @Bean
  public NixpacksBuildStrategy nixpacksBuildStrategy(ApplicationSources sources, BuildProcessRunner runner) {
    return new NixpacksBuildStrategy(sources, runner);
  }

  @Bean
  public HerokuBuildpacksBuildStrategy herokuBuildpacksBuildStrategy(ApplicationSources sources,
                                                                     BuildProcessRunner runner) {
    return new HerokuBuildpacksBuildStrategy(sources, runner, properties.getBuild().herokuBuilderVersion());
  }

  @Bean
  public PaketoBuildpacksBuildStrategy paketoBuildpacksBuildStrategy(ApplicationSources sources,
                                                                     BuildProcessRunner runner) {
    return new PaketoBuildpacksBuildStrategy(sources, runner, properties.getBuild().paketoBuilder());
  }

  @Bean
  public DockerfileBuildStrategy dockerfileBuildStrategy(ApplicationSources sources, BuildProcessRunner runner) {
    return new DockerfileBuildStrategy(sources, runner);
  }

  @Bean
  public StaticBuildStrategy staticBuildStrategy(ApplicationSources sources, BuildProcessRunner runner) {
    return new StaticBuildStrategy(sources, runner, properties.getBuild().staticBaseImage());
  }

  @Bean
  public BuildDispatcher buildDispatcher(List<BuildStrategy> strategies) {
    return new BuildDispatcher(strategies);
  }
}
