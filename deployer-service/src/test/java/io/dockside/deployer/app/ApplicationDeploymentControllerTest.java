package io.dockside.deployer.app;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deployer.infra.docker.UnknownServerException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ApplicationDeploymentControllerTest {
  private static final String DESCRIPTOR = """
      {
        "appName": "shop",
        "sourceType": "docker",
        "dockerImage": "nginx:1.25",
        "ports": [{"protocol": "tcp", "targetPort": 80, "publishedPort": 8080}]
      }
      """;

  private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
  private DeploymentService deployments;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    deployments = mock(DeploymentService.class);
    mvc = MockMvcBuilders.standaloneSetup(new ApplicationDeploymentController(deployments))
        .setControllerAdvice(new ApiExceptionHandler())
        .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
        .build();
  }

  @Test
  void deployIsAccepted() throws Exception {
    when(deployments.deploy(any())).thenReturn(
        new DeploymentService.DeploymentTicket("shop", "/logs/shop/shop-1.log"));

    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.appName").value("shop"))
        .andExpect(jsonPath("$.logPath").value("/logs/shop/shop-1.log"));
  }

  @Test
  void buildCommandReturnsScript() throws Exception {
    when(deployments.buildScript(any())).thenReturn(Optional.of(
        new DeploymentService.BuildScript("nixpacks", "set -e\n")));

    mvc.perform(post("/api/applications/build-command").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.buildType").value("nixpacks"))
        .andExpect(jsonPath("$.script").value("set -e\n"));
  }

  @Test
  void buildCommandIsEmptyForImageDeployments() throws Exception {
    when(deployments.buildScript(any())).thenReturn(Optional.empty());

    mvc.perform(post("/api/applications/build-command").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isNoContent());
  }

  @Test
  void invalidDescriptorIsBadRequest() throws Exception {
    when(deployments.deploy(any())).thenThrow(new InvalidDescriptorException("Invalid memoryLimit 'lots'"));

    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid memoryLimit 'lots'"));
  }

  @Test
  void unknownServerIsBadRequest() throws Exception {
    when(deployments.deploy(any())).thenThrow(new UnknownServerException("edge-9"));

    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unreadableDescriptorIsBadRequest() throws Exception {
    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON)
            .content("{\"appName\": \"\", \"sourceType\": \"docker\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void pathLikeApplicationNameIsBadRequest() throws Exception {
    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON)
            .content("{\"appName\": \"../../tmp/evil\", \"sourceType\": \"docker\", \"dockerImage\": \"nginx\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unexpectedFailureIsServerError() throws Exception {
    when(deployments.deploy(any())).thenThrow(new IllegalStateException("boom"));

    mvc.perform(post("/api/applications/deploy").contentType(MediaType.APPLICATION_JSON).content(DESCRIPTOR))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Internal Server Error"));
  }
}
