package io.intellixity.tabula.server.service;

import io.intellixity.tabula.error.NotFoundException;
import io.intellixity.tabula.error.ValidationException;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.model.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.tabula.server.service.ServiceFixture.as;
import static org.junit.jupiter.api.Assertions.*;

final class TableServiceTest {
  private final ServiceFixture f = new ServiceFixture();

  @Test
  void createTable_addsDefaultColumnsForCurrentUser() {
    TableRef t = as("u1", () -> f.tables.createTable(" People ", false));

    assertEquals("u1", t.ownerId());
    assertEquals("People", t.name());
    List<Column> cols = as("u1", () -> f.tables.listColumns(t.id()));
    assertEquals(List.of("Name", "Email", "Age"), cols.stream().map(Column::name).toList());
    assertEquals(List.of(ColumnType.TEXT, ColumnType.TEXT, ColumnType.NUMBER), cols.stream().map(Column::type).toList());
    assertEquals(0, f.copies.begun.get());
  }

  @Test
  void createTable_withSampleData_ingestsSampleRows() {
    as("u1", () -> f.tables.createTable("People", true));

    assertEquals(1, f.copies.begun.get());
    assertEquals(TableService.SAMPLE_ROWS, f.copies.committedRowLines.get());
  }

  @Test
  void createTable_rejectsBlankAndLongNames() {
    assertThrows(ValidationException.class, () -> as("u1", () -> f.tables.createTable("", false)));
    assertThrows(ValidationException.class, () -> as("u1", () -> f.tables.createTable("x".repeat(101), false)));
    assertTrue(f.stores.tableById.isEmpty());
  }

  @Test
  void listTables_onlyReturnsOwnTables() {
    as("u1", () -> f.tables.createTable("A", false));
    as("u2", () -> f.tables.createTable("B", false));

    assertEquals(List.of("A"), as("u1", () -> f.tables.listTables()).stream().map(TableRef::name).toList());
  }

  @Test
  void deleteTable_refusesLastTable() {
    TableRef a = as("u1", () -> f.tables.createTable("A", false));
    assertThrows(ValidationException.class, () -> as("u1", () -> f.tables.deleteTable(a.id())));

    TableRef b = as("u1", () -> f.tables.createTable("B", false));
    as("u1", () -> f.tables.deleteTable(a.id()));

    assertEquals(List.of(b.id()), as("u1", () -> f.tables.listTables()).stream().map(TableRef::id).toList());
    assertThrows(NotFoundException.class, () -> as("u1", () -> f.tables.getTable(a.id())));
  }

  @Test
  void deleteTable_foreignTable_isNotFound() {
    TableRef a = as("u1", () -> f.tables.createTable("A", false));
    as("u2", () -> f.tables.createTable("B", false));
    as("u2", () -> f.tables.createTable("C", false));

    assertThrows(NotFoundException.class, () -> as("u2", () -> f.tables.deleteTable(a.id())));
    assertTrue(f.stores.tableById.containsKey(a.id()));
  }

  @Test
  void renameTable_updatesNameAndCachedOwnerView() {
    TableRef a = as("u1", () -> f.tables.createTable("A", false));
    TableRef renamed = as("u1", () -> f.tables.renameTable(a.id(), "Renamed"));

    assertEquals("Renamed", renamed.name());
    assertEquals("Renamed", as("u1", () -> f.tables.getTable(a.id())).name());
  }

  @Test
  void addColumn_rejectsDuplicateNameIgnoringCase() {
    TableRef t = as("u1", () -> f.tables.createTable("People", false));

    ValidationException e = assertThrows(ValidationException.class,
        () -> as("u1", () -> f.tables.addColumn(t.id(), " email ", ColumnType.TEXT)));
    assertTrue(e.getMessage().contains("already exists"));
  }

  @Test
  void addColumn_leavesExistingRowsUntouched() {
    TableRef t = as("u1", () -> f.tables.createTable("People", false));
    String name = as("u1", () -> f.tables.listColumns(t.id())).get(0).id();
    as("u1", () -> f.rows.addRow(t.id(), Map.of(name, "Ada")));
    Map<String, Object> before = f.stores.rowById.values().iterator().next().cache();

    Column city = as("u1", () -> f.tables.addColumn(t.id(), "City", ColumnType.TEXT));

    assertEquals(4, as("u1", () -> f.tables.listColumns(t.id())).size());
    assertEquals(before, f.stores.rowById.values().iterator().next().cache());
    assertNull(f.stores.rowById.values().iterator().next().valueOf(city.id()));
  }

  @Test
  void deleteColumn_removesColumnAndItsCells() {
    TableRef t = as("u1", () -> f.tables.createTable("People", false));
    Column age = as("u1", () -> f.tables.listColumns(t.id())).get(2);
    as("u1", () -> f.rows.addRow(t.id(), Map.of(age.id(), 42)));

    as("u1", () -> f.tables.deleteColumn(age.id()));

    assertFalse(f.stores.columnById.containsKey(age.id()));
    assertTrue(f.stores.cellByKey.values().stream().noneMatch(c -> c.columnId().equals(age.id())));
  }
}
