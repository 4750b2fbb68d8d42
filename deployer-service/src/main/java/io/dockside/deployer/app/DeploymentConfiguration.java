package io.dockside.deployer.app;

import io.dockside.deploy.build.BuildDispatcher;
import io.dockside.deploy.ports.DeploymentLogFactory;
import io.dockside.deploy.ports.FileMountWriter;
import io.dockside.deploy.ports.ImageUploader;
import io.dockside.deploy.ports.ReconciliationLock;
import io.dockside.deploy.ports.ServiceReconciler;
import io.dockside.deploy.runtime.ApplicationDeployer;
import io.dockside.deploy.runtime.InMemoryReconciliationLock;
import io.dockside.deployer.config.DeployerProperties;
import io.dockside.deployer.infra.files.FileMountMaterializer;
import io.dockside.deployer.infra.log.FileDeploymentLogFactory;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DeploymentConfiguration {
  private final DeployerProperties properties;

  public DeploymentConfiguration(DeployerProperties properties) {
    this.properties = properties;
  }

  @Bean
  public ReconciliationLock reconciliationLock() {
    return new InMemoryReconciliationLock();
  }

  @Bean
  public DeploymentLogFactory deploymentLogFactory() {
    return new FileDeploymentLogFactory();
  }

  @Bean
  public FileMountWriter fileMountWriter() {
    return new FileMountMaterializer(properties.getPaths().applicationsRoot());
  }

  @Bean
  public ApplicationDeployer applicationDeployer(BuildDispatcher buildDispatcher,
                                                 ImageUploader imageUploader,
                                                 FileMountWriter fileMountWriter,
                                                 ServiceReconciler serviceReconciler,
                                                 ReconciliationLock reconciliationLock,
                                                 DeploymentLogFactory deploymentLogFactory) {
    return new ApplicationDeployer(buildDispatcher, imageUploader, fileMountWriter, serviceReconciler,
        reconciliationLock, deploymentLogFactory);
  }

  @Bean
  public ThreadPoolTaskExecutor deploymentExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("deploy-");
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
