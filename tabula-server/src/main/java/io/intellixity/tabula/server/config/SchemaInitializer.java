package io.intellixity.tabula.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** Applies {@code schema/tabula.sql} at start-up when {@code tabula.db.init-schema} is true. */
@Component
public final class SchemaInitializer implements InitializingBean {
  private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);
  static final String SCHEMA_RESOURCE = "schema/tabula.sql";

  private final DataSource dataSource;
  private final TabulaProperties props;

  public SchemaInitializer(DataSource dataSource, TabulaProperties props) {
    this.dataSource = dataSource;
    this.props = props;
  }

  @Override
  public void afterPropertiesSet() {
    if (!props.getDb().isInitSchema()) {
      log.info("tabula.schema skipped initSchema=false");
      return;
    }
    List<String> statements = statements(load());
    try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
      for (String sql : statements) st.execute(sql);
    } catch (SQLException e) {
      throw new IllegalStateException("Schema initialization failed", e);
    }
    log.info("tabula.schema applied statements={}", statements.size());
  }

  private static String load() {
    try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) throw new IllegalStateException("Missing resource: " + SCHEMA_RESOURCE);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + SCHEMA_RESOURCE, e);
    }
  }

  /** Splits on semicolons at line ends and drops {@code --} comment lines. */
  static List<String> statements(String script) {
    List<String> out = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    for (String line : script.split("\n")) {
      String t = line.trim();
      if (t.isEmpty() || t.startsWith("--")) continue;
      cur.append(line).append('\n');
      if (t.endsWith(";")) {
        String stmt = cur.toString().trim();
        out.add(stmt.substring(0, stmt.length() - 1));
        cur.setLength(0);
      }
    }
    if (!cur.toString().isBlank()) out.add(cur.toString().trim());
    return out;
  }
}
