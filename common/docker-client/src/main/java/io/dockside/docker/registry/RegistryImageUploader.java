package io.dockside.docker.registry;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.PushImageCmd;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.PushResponseItem;
import com.github.dockerjava.api.model.ResponseItem;
import io.dockside.deploy.image.ImageReferences;
import io.dockside.deploy.image.RegistryCredentials;
import io.dockside.deploy.model.ApplicationDescriptor;
import io.dockside.deploy.ports.DeploymentLog;
import io.dockside.deploy.ports.ImageUploader;
import io.dockside.docker.DockerCalls;
import io.dockside.docker.DockerClientProvider;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes the locally built application image to the application's registry.
 * <p>
 * Builds run against the local engine, so the image is tagged and pushed from there.
 */
public final class RegistryImageUploader implements ImageUploader {

  private static final Logger log = LoggerFactory.getLogger(RegistryImageUploader.class);

  static final String TAG = "latest";

  private final DockerClientProvider clients;

  public RegistryImageUploader(DockerClientProvider clients) {
    this.clients = Objects.requireNonNull(clients, "clients");
  }

  @Override
  public void upload(ApplicationDescriptor descriptor, DeploymentLog deploymentLog) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(deploymentLog, "deploymentLog");
    String localImage = ImageReferences.localBuildTag(descriptor);
    String repository = ImageReferences.registryRepository(descriptor);
    DockerClient docker = clients.local();

    deploymentLog.write("Uploading " + localImage + " to " + repository + "\n");
    AuthConfig auth = RegistryCredentials.resolve(descriptor)
        .map(credentials -> new AuthConfig()
            .withUsername(credentials.username())
            .withPassword(credentials.password())
            .withRegistryAddress(credentials.serverAddress()))
        .orElse(null);
    AtomicReference<String> failure = new AtomicReference<>();
    ResultCallback.Adapter<PushResponseItem> callback = new ResultCallback.Adapter<>() {
      @Override
      public void onNext(PushResponseItem item) {
        if (item.isErrorIndicated()) {
          ResponseItem.ErrorDetail detail = item.getErrorDetail();
          failure.compareAndSet(null, detail != null && detail.getMessage() != null
              ? detail.getMessage()
              : item.getError());
        } else if (item.getStatus() != null) {
          deploymentLog.write(item.getStatus() + "\n");
        }
      }
    };

    try {
      log.info("Tagging {} as {}:{}", localImage, repository, TAG);
      DockerCalls.run("tag image " + localImage,
          () -> docker.tagImageCmd(localImage, repository, TAG).exec());
      DockerCalls.call("push image " + repository, () -> {
        PushImageCmd push = docker.pushImageCmd(repository).withTag(TAG);
        if (auth != null) {
          push = push.withAuthConfig(auth);
        }
        return push.exec(callback);
      }).awaitCompletion();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ImageUploadException("Interrupted while pushing " + repository, e);
    } catch (RuntimeException e) {
      throw new ImageUploadException("Uploading " + localImage + " to " + repository + " failed: "
          + e.getMessage(), e);
    }
    if (failure.get() != null) {
      throw new ImageUploadException("Pushing " + repository + " failed: " + failure.get());
    }
    deploymentLog.write("Image uploaded: " + repository + ":" + TAG + "\n");
    log.info("Pushed {}:{}", repository, TAG);
  }
}
