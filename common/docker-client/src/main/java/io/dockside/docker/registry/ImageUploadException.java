package io.dockside.docker.registry;

/**
 * Tagging or pushing the built image to the application's registry failed.
 */
public class ImageUploadException extends RuntimeException {

  public ImageUploadException(String message) {
    super(message);
  }

  public ImageUploadException(String message, Throwable cause) {
    super(message, cause);
  }
}
