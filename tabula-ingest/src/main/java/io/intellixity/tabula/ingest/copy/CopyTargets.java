package io.intellixity.tabula.ingest.copy;

/** COPY statements for the two relations a batch writes. Column order matches the encoded lines. */
public final class CopyTargets {
  private CopyTargets() {}

  public static final String ROWS =
      "COPY data_row (id, table_id, cache, search) FROM STDIN " + CopyLineEncoder.COPY_OPTIONS;

  public static final String CELLS =
      "COPY data_cell (id, row_id, column_id, v_text, v_number) FROM STDIN " + CopyLineEncoder.COPY_OPTIONS;
}
