package io.dockside.deploy.image;

import static org.assertj.core.api.Assertions.assertThat;

import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.model.RegistrySettings;
import io.dockside.deploy.model.SourceType;
import org.junit.jupiter.api.Test;

class RegistryCredentialsTest {

  @Test
  void dockerSourceWithUsernameAndPasswordAuthenticatesAgainstDockerHub() {
    ApplicationDescriptor app = ApplicationDescriptor.builder()
        .appName("web")
        .sourceType(SourceType.DOCKER)
        .dockerImage("private/web:1")
        .username("u")
        .password("p")
        .build();

    assertThat(RegistryCredentials.resolve(app))
        .contains(new RegistryCredentials("u", "p", "https://index.docker.io/v1/"));
  }

  @Test
  void dockerSourceWithoutPasswordPullsAnonymously() {
    ApplicationDescriptor app = ApplicationDescriptor.builder()
        .appName("web")
        .sourceType(SourceType.DOCKER)
        .username("u")
        .build();

    assertThat(RegistryCredentials.resolve(app)).isEmpty();
  }

  @Test
  void builtSourceUsesRegistryCredentials() {
    ApplicationDescriptor app = ApplicationDescriptor.builder()
        .appName("api")
        .sourceType(SourceType.GITLAB)
        .registry(new RegistrySettings("reg.example.com", null, "ci", "secret"))
        .build();

    assertThat(RegistryCredentials.resolve(app))
        .contains(new RegistryCredentials("ci", "secret", "reg.example.com"));
  }

  @Test
  void builtSourceWithoutRegistryHasNoCredentials() {
    ApplicationDescriptor app = ApplicationDescriptor.builder()
        .appName("api")
        .sourceType(SourceType.GITLAB)
        .username("ignored")
        .password("ignored")
        .build();

    assertThat(RegistryCredentials.resolve(app)).isEmpty();
  }

  @Test
  void toStringDoesNotExposePassword() {
    assertThat(new RegistryCredentials("u", "hunter2", "reg").toString()).doesNotContain("hunter2");
  }
}
