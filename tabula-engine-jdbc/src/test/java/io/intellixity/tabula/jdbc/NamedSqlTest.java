package io.intellixity.tabula.jdbc;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NamedSqlTest {

  @Test
  void compile_replacesNamesInOrderOfAppearance() {
    SqlStatement ss = NamedSql.query("SELECT * FROM data_row WHERE table_id = :tableId AND id > :id",
        Map.of("tableId", Bind.text("t1"), "id", Bind.text("r9")));

    assertEquals("SELECT * FROM data_row WHERE table_id = ? AND id > ?", ss.sql());
    assertEquals(2, ss.binds().size());
    assertEquals("t1", ss.binds().get(0).value());
    assertEquals("r9", ss.binds().get(1).value());
    assertEquals(SqlStatement.ExecKind.QUERY, ss.execKind());
  }

  @Test
  void compile_leavesCastsAndQuotedTextAlone() {
    SqlStatement ss = NamedSql.update(
        "UPDATE data_row SET search = ':notAParam', cache = :cache::jsonb WHERE note = 'it''s :x'",
        Map.of("cache", Bind.json("{}")));

    assertEquals("UPDATE data_row SET search = ':notAParam', cache = ?::jsonb WHERE note = 'it''s :x'", ss.sql());
    assertEquals(1, ss.binds().size());
    assertEquals(BindType.JSON, ss.binds().get(0).type());
  }

  @Test
  void compile_bindsRepeatedNameTwice() {
    SqlStatement ss = NamedSql.query("SELECT :v = :v", Map.of("v", Bind.integer(3)));
    assertEquals("SELECT ? = ?", ss.sql());
    assertEquals(2, ss.binds().size());
  }

  @Test
  void compile_rejectsMissingParam() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> NamedSql.query("SELECT * FROM data_table WHERE id = :id", Map.of()));
    assertTrue(e.getMessage().contains("id"));
  }
}
