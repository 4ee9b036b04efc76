package com.example.password_expiry.api;

import com.example.password_expiry.directory.DirectoryIntegrationException;
import com.example.password_expiry.mail.MailDeliveryException;
import com.example.password_expiry.repository.PersistenceException;
import com.example.password_expiry.service.ProfileNotFoundException;
import com.example.password_expiry.service.TemplateRenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({IllegalArgumentException.class, TemplateRenderException.class})
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({ProfileNotFoundException.class, QueueItemNotFoundException.class})
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(IllegalStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("NOT_CONFIGURED", ex.getMessage()));
  }

  @ExceptionHandler(DirectoryIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleDirectoryIntegration(
      DirectoryIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case NOT_CONFIGURED -> "DIRECTORY_NOT_CONFIGURED";
          case UNAUTHORIZED -> "DIRECTORY_UNAUTHORIZED";
          case FORBIDDEN -> "DIRECTORY_FORBIDDEN";
          case NOT_FOUND -> "DIRECTORY_NOT_FOUND";
          case TIMEOUT -> "DIRECTORY_TIMEOUT";
          case INVALID_RESPONSE -> "DIRECTORY_INVALID_RESPONSE";
          case BAD_GATEWAY -> "DIRECTORY_BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case NOT_CONFIGURED -> HttpStatus.CONFLICT;
          case UNAUTHORIZED, INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
          case FORBIDDEN -> HttpStatus.FORBIDDEN;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    logger.warn("directory request failed code={} message={}", code, ex.getMessage());
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(MailDeliveryException.class)
  public ResponseEntity<ApiErrorResponse> handleMailDelivery(MailDeliveryException ex) {
    logger.warn("smtp request failed message={}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("SMTP_FAILED", ex.getMessage()));
  }

  @ExceptionHandler(PersistenceException.class)
  public ResponseEntity<ApiErrorResponse> handlePersistence(PersistenceException ex) {
    logger.error("storage write failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("STORAGE_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", ex.getMessage()));
  }
}
