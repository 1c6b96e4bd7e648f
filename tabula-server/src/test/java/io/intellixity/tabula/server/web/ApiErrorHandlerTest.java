package io.intellixity.tabula.server.web;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.TransientStoreException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.error.VersionConflictException;
import io.intellixity.tabula.ingest.BulkIngestionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ApiErrorHandlerTest {
  private final ApiErrorHandler handler = new ApiErrorHandler();

  @Test
  void versionConflict_is409WithServerVersion() {
    ResponseEntity<ApiErrorHandler.ApiError> r = handler.conflict(new VersionConflictException("v1", 3, 5));
    assertEquals(409, r.getStatusCode().value());
    assertEquals("version_conflict", r.getBody().error());
    assertEquals(5, r.getBody().serverVersion());
  }

  @Test
  void taxonomy_mapsToStatuses() {
    assertEquals(404, handler.notFound(new NotFoundException("view", "v1")).getStatusCode().value());
    assertEquals(400, handler.validation(new ValidationException("bad")).getStatusCode().value());
    assertEquals(503, handler.unavailable(new TransientStoreException("down")).getStatusCode().value());
  }

  @Test
  void validationMessage_isSurfacedVerbatim() {
    assertEquals("Cannot delete the last table",
        handler.validation(new ValidationException("Cannot delete the last table")).getBody().message());
  }

  @Test
  void bulkIngestionFailure_reportsCommittedRowsAndFailedBatches() {
    BulkIngestionException e = new BulkIngestionException("t1", 35_000, List.of(1), new IllegalStateException("copy"));
    ApiErrorHandler.ApiError body = handler.ingestion(e).getBody();
    assertEquals(35_000, body.rowsCommitted());
    assertEquals(List.of(1), body.failedBatches());
  }
}
