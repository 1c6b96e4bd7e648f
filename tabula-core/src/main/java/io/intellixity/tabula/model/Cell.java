package io.intellixity.tabula.model;

import io.intellixity.tabula.error.ValidationException;

import java.time.Instant;
import java.util.Objects;

/** Type-tagged cell value: exactly one of {@code text}/{@code number} may be populated. */
public record Cell(String id, String rowId, String columnId, String text, Double number,
                   Instant createdAt, Instant updatedAt) {
  public Cell {
    Objects.requireNonNull(rowId, "rowId");
    Objects.requireNonNull(columnId, "columnId");
    if (text != null && number != null) {
      throw new IllegalArgumentException("Cell cannot carry both text and number");
    }
  }

  /** Scalar view of the populated slot (null when empty). */
  public Object value() {
    return text != null ? text : number;
  }

  /**
   * Coerce a raw value into the slot matching the column's declared type.
   *
   * @throws ValidationException when a NUMBER column receives a non-numeric value
   */
  public static Cell of(String id, String rowId, Column column, Object value) {
    Objects.requireNonNull(column, "column");
    if (value == null) return new Cell(id, rowId, column.id(), null, null, null, null);
    return switch (column.type()) {
      case TEXT -> new Cell(id, rowId, column.id(), String.valueOf(value), null, null, null);
      case NUMBER -> new Cell(id, rowId, column.id(), null, toNumber(column, value), null, null);
    };
  }

  private static Double toNumber(Column column, Object value) {
    if (value instanceof Number n) return n.doubleValue();
    String s = String.valueOf(value).trim();
    if (s.isEmpty()) return null;
    try {
      return Double.valueOf(s);
    } catch (NumberFormatException e) {
      throw new ValidationException("Column '" + column.name() + "' expects a number, got: " + s);
    }
  }
}
