package io.intellixity.tabula.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.TransientStoreException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.ingest.BulkIngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/** Maps the error taxonomy onto HTTP statuses with a small JSON body. */
@RestControllerAdvice
public final class ApiErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ApiError(String error, String message, Integer serverVersion,
                         Integer rowsCommitted, List<Integer> failedBatches) {
    static ApiError of(String error, String message) {
      return new ApiError(error, message, null, null, null);
    }
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiError> notFound(NotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", e.getMessage()));
  }

  @ExceptionHandler(VersionConflictException.class)
  public ResponseEntity<ApiError> conflict(VersionConflictException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiError("version_conflict", e.getMessage(), e.actualVersion(), null, null));
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> validation(ValidationException e) {
    return ResponseEntity.badRequest().body(ApiError.of("validation", e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(ApiError.of("validation", "Malformed request body"));
  }

  @ExceptionHandler(TransientStoreException.class)
  public ResponseEntity<ApiError> unavailable(TransientStoreException e) {
    log.warn("tabula.api transient failure: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.of("transient", e.getMessage()));
  }

  @ExceptionHandler(BulkIngestionException.class)
  public ResponseEntity<ApiError> ingestion(BulkIngestionException e) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiError("ingestion_failed", e.getMessage(), null, e.rowsCommitted(), e.failedBatches()));
  }
}
