package io.dockside.docker.swarm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dockerjava.api.model.Mount;
import com.github.dockerjava.api.model.MountType;
import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deploy.model.MountSpec;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class MountTranslatorTest {

  private final MountTranslator translator = new MountTranslator(Path.of("/srv/dockside/applications"));

  private final List<MountSpec> mounts = List.of(
      new MountSpec.File("nginx.conf", "server {}", "/etc/nginx/nginx.conf"),
      new MountSpec.Volume("data", "/var/lib/data"),
      new MountSpec.Bind("/srv/cache", "/cache"),
      new MountSpec.Volume("logs", "/var/log/app"),
      new MountSpec.Bind("/etc/localtime", "/etc/localtime"));

  @Test
  void translatesVolumesInDeclarationOrder() {
    List<Mount> volumes = translator.volumeMounts(mounts);

    assertThat(volumes).extracting(Mount::getType).containsOnly(MountType.VOLUME);
    assertThat(volumes).extracting(Mount::getSource).containsExactly("data", "logs");
    assertThat(volumes).extracting(Mount::getTarget).containsExactly("/var/lib/data", "/var/log/app");
    assertThat(volumes).allSatisfy(m -> assertThat(m.getVolumeOptions()).isNotNull());
  }

  @Test
  void translatesBinds() {
    List<Mount> binds = translator.bindMounts(mounts);

    assertThat(binds).extracting(Mount::getType).containsOnly(MountType.BIND);
    assertThat(binds).extracting(Mount::getSource).containsExactly("/srv/cache", "/etc/localtime");
    assertThat(binds).extracting(Mount::getTarget).containsExactly("/cache", "/etc/localtime");
  }

  @Test
  void bindsFileMountsFromApplicationFilesDirectory() {
    List<Mount> files = translator.fileMounts("api", mounts);

    assertThat(files).singleElement().satisfies(mount -> {
      assertThat(mount.getType()).isEqualTo(MountType.BIND);
      assertThat(mount.getSource()).isEqualTo("/srv/dockside/applications/api/files/nginx.conf");
      assertThat(mount.getTarget()).isEqualTo("/etc/nginx/nginx.conf");
    });
  }

  @Test
  void translationIsPartitionTotalAndOrderedVolumeBindFile() {
    List<Mount> all = translator.translate("api", mounts);

    assertThat(all).hasSize(mounts.size());
    assertThat(all).extracting(Mount::getTarget).containsExactly(
        "/var/lib/data", "/var/log/app", "/cache", "/etc/localtime", "/etc/nginx/nginx.conf");
  }

  @Test
  void emptyListTranslatesToNothing() {
    assertThat(translator.translate("api", List.of())).isEmpty();
  }

  @Test
  void missingMountDataIsACompositionError() {
    assertThatThrownBy(() -> translator.volumeMounts(List.of(new MountSpec.Volume(null, "/data"))))
        .isInstanceOf(InvalidDescriptorException.class);
    assertThatThrownBy(() -> translator.bindMounts(List.of(new MountSpec.Bind("/host", " "))))
        .isInstanceOf(InvalidDescriptorException.class);
    assertThatThrownBy(() -> translator.fileMounts("api", List.of(new MountSpec.File(null, "x", "/x"))))
        .isInstanceOf(InvalidDescriptorException.class);
  }
}
