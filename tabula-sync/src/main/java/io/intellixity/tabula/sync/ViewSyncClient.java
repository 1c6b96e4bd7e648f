package io.intellixity.tabula.sync;

import io.intellixity.tabula.model.ViewRecord;
import io.intellixity.tabula.patch.Patch;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client side of the view API.\n
 *
 * Futures fail with the error taxonomy: {@code VersionConflictException} for a stale version,
 * {@code NotFoundException} / {@code ValidationException} for non-retryable rejections and
 * {@code TransientStoreException} for network trouble.\n
 */
public interface ViewSyncClient {
  CompletableFuture<AppliedPatches> applyPatches(String viewId, int version, List<Patch> patches);

  CompletableFuture<List<ViewRecord>> listViews(String tableId);

  CompletableFuture<ViewRecord> createView(String tableId, String name);

  CompletableFuture<Void> deleteView(String viewId);
}
