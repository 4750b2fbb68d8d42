package io.dockside.deployer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.dockside.deployer.config")
public class DeployerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeployerApplication.class, args);
  }
}
