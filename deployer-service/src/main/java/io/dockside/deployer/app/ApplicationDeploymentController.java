package io.dockside.deployer.app;

import io.dockside.deploy.model.ApplicationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/applications")
public class ApplicationDeploymentController {
  private static final Logger log = LoggerFactory.getLogger(ApplicationDeploymentController.class);
  private final DeploymentService deployments;

  public ApplicationDeploymentController(DeploymentService deployments) {
    this.deployments = deployments;
  }

  @PostMapping(value = "/deploy",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DeploymentService.DeploymentTicket> deploy(@RequestBody ApplicationDescriptor descriptor) {
    log.info("[REST] POST /api/applications/deploy app={}", descriptor.appName());
    DeploymentService.DeploymentTicket ticket = deployments.deploy(descriptor);
    log.info("[REST] POST /api/applications/deploy -> status=202 log={}", ticket.logPath());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(ticket);
  }

  @PostMapping(value = "/build-command",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DeploymentService.BuildScript> buildCommand(@RequestBody ApplicationDescriptor descriptor) {
    log.info("[REST] POST /api/applications/build-command app={} buildType={}",
        descriptor.appName(), descriptor.buildType().value());
    return deployments.buildScript(descriptor)
        .map(ResponseEntity::ok)
        .orElseGet(() -> {
          log.info("[REST] POST /api/applications/build-command -> status=204");
          return ResponseEntity.noContent().build();
        });
  }
}
