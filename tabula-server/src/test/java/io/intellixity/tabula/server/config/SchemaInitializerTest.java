package io.intellixity.tabula.server.config;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaInitializerTest {

  @Test
  void statements_dropCommentsAndTrailingSemicolons() {
    List<String> out = SchemaInitializer.statements(
        "-- header\nCREATE TABLE a (\n  id text\n);\n\nCREATE INDEX a_idx ON a (id);\n");

    assertEquals(2, out.size());
    assertTrue(out.get(0).startsWith("CREATE TABLE a ("));
    assertTrue(out.get(0).endsWith(")"));
    assertEquals("CREATE INDEX a_idx ON a (id)", out.get(1));
  }

  @Test
  void bundledSchema_createsEveryRelationIdempotently() throws Exception {
    String script;
    try (InputStream in = getClass().getClassLoader().getResourceAsStream(SchemaInitializer.SCHEMA_RESOURCE)) {
      assertNotNull(in);
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    List<String> stmts = SchemaInitializer.statements(script);

    for (String table : List.of("data_table", "data_column", "data_row", "data_cell", "table_view")) {
      assertTrue(stmts.stream().anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS " + table + " ")), table);
    }
    assertTrue(stmts.stream().allMatch(s -> s.contains("IF NOT EXISTS")));
    assertTrue(stmts.stream().anyMatch(s -> s.contains("UNIQUE (row_id, column_id)")));
  }
}
