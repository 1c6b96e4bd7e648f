package io.intellixity.tabula.server.service;

import io.intellixity.tabula.governance.GovernedTableAccess;
import io.intellixity.tabula.ingest.BatchPlanner;
import io.intellixity.tabula.ingest.BulkIngestionPipeline;
import io.intellixity.tabula.ingest.IngestionListener;
import io.intellixity.tabula.ingest.IngestionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public final class RowIngestionService {
  private static final Logger log = LoggerFactory.getLogger(RowIngestionService.class);

  private final GovernedTableAccess access;
  private final BulkIngestionPipeline pipeline;

  public RowIngestionService(GovernedTableAccess access, BulkIngestionPipeline pipeline) {
    this.access = access;
    this.pipeline = pipeline;
  }

  public IngestionResult ingestRows(String tableId, int count) {
    access.requireOwnedTable(tableId);
    return pipeline.ingest(tableId, count, new ProgressLogger(tableId));
  }

  private record ProgressLogger(String tableId) implements IngestionListener {
    @Override
    public void onBatchCommitted(BatchPlanner.Batch batch, int rowsCommitted, int totalRows) {
      log.info("tabula.ingest progress tableId={} batch={} committed={}/{}", tableId, batch.index(), rowsCommitted, totalRows);
    }
  }
}
