package io.dockside.deployer.app;

import io.dockside.deploy.model.InvalidDescriptorException;
import io.dockside.deployer.infra.docker.UnknownServerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({InvalidDescriptorException.class, UnknownServerException.class})
  public ResponseEntity<ErrorResponse> badDescriptor(RuntimeException e) {
    log.warn("[REST] rejected descriptor: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
    Throwable cause = e.getMostSpecificCause();
    log.warn("[REST] unreadable descriptor: {}", cause.getMessage());
    return error(HttpStatus.BAD_REQUEST, cause.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> unexpected(RuntimeException e) {
    log.error("[REST] request failed", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), message));
  }

  public record ErrorResponse(String error, String message) {
  }
}
