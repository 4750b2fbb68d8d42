package io.dockside.deploy.model;

/**
 * Private registry the built image is pushed to and pulled from.
 */
public record RegistrySettings(String registryUrl, String imagePrefix, String username, String password) {

  @Override
  public String toString() {
    return "RegistrySettings[registryUrl=" + registryUrl
        + ", imagePrefix=" + imagePrefix
        + ", username=" + username
        + ", password=" + (password == null ? null : "****") + "]";
  }
}
