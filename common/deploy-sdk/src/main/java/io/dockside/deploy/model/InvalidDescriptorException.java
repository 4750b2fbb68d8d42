package io.dockside.deploy.model;

/**
 * Raised when descriptor data cannot be translated into a service specification,
 * for example a malformed resource value or a mount without its required fields.
 */
public class InvalidDescriptorException extends RuntimeException {

  public InvalidDescriptorException(String message) {
    super(message);
  }

  public InvalidDescriptorException(String message, Throwable cause) {
    super(message, cause);
  }
}
