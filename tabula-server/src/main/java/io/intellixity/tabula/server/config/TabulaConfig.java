package io.intellixity.tabula.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tabula.governance.GovernedTableAccess;
import io.intellixity.tabula.governance.internal.LruTtlCache;
import io.intellixity.tabula.ingest.BulkIngestionPipeline;
import io.intellixity.tabula.ingest.StreamingRowWriter;
import io.intellixity.tabula.jdbc.JdbcExecutor;
import io.intellixity.tabula.jdbc.postgres.PostgresCopySessionFactory;
import io.intellixity.tabula.jdbc.postgres.PostgresJdbcBinder;
import io.intellixity.tabula.jdbc.store.JdbcRowStore;
import io.intellixity.tabula.jdbc.store.JdbcTableStore;
import io.intellixity.tabula.jdbc.store.JdbcViewStore;
import io.intellixity.tabula.model.TableRef;
import io.intellixity.tabula.page.PaginationEngine;
import io.intellixity.tabula.store.RowStore;
import io.intellixity.tabula.store.TableStore;
import io.intellixity.tabula.store.ViewStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
@EnableConfigurationProperties(TabulaProperties.class)
public class TabulaConfig {

  @Bean(destroyMethod = "close")
  @Primary
  public HikariDataSource dataSource(TabulaProperties props) {
    TabulaProperties.Db db = props.getDb();
    return pool("tabula-rw", db.getJdbcUrl(), db, false);
  }

  @Bean(destroyMethod = "close")
  @Qualifier("readOnly")
  public HikariDataSource readOnlyDataSource(TabulaProperties props) {
    TabulaProperties.Db db = props.getDb();
    String url = db.getReadOnlyJdbcUrl() != null && !db.getReadOnlyJdbcUrl().isBlank()
        ? db.getReadOnlyJdbcUrl()
        : db.getJdbcUrl();
    return pool("tabula-ro", url, db, true);
  }

  private static HikariDataSource pool(String name, String url, TabulaProperties.Db db, boolean readOnly) {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing tabula.db.jdbc-url");
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(name);
    hc.setJdbcUrl(url);
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setSchema(db.getSchema());
    hc.setReadOnly(readOnly);
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }

  @Bean
  @Primary
  public JdbcExecutor jdbcExecutor(HikariDataSource dataSource) {
    return new JdbcExecutor("jdbc:rw", dataSource, new PostgresJdbcBinder());
  }

  @Bean
  @Qualifier("readOnly")
  public JdbcExecutor readOnlyJdbcExecutor(@Qualifier("readOnly") HikariDataSource readOnlyDataSource) {
    return new JdbcExecutor("jdbc:ro", readOnlyDataSource, new PostgresJdbcBinder());
  }

  @Bean
  public TableStore tableStore(JdbcExecutor jdbc) {
    return new JdbcTableStore(jdbc);
  }

  @Bean
  @Primary
  public RowStore rowStore(JdbcExecutor jdbc, TableStore tables) {
    return new JdbcRowStore(jdbc, tables);
  }

  @Bean
  public ViewStore viewStore(JdbcExecutor jdbc) {
    return new JdbcViewStore(jdbc);
  }

  @Bean
  public GovernedTableAccess governedTableAccess(TableStore tables, ViewStore views, RowStore rows,
                                                 TabulaProperties props) {
    TabulaProperties.Ownership o = props.getOwnership();
    LruTtlCache<String, TableRef> cache = new LruTtlCache<>(o.getCacheSize(), o.getCacheTtlMillis());
    return new GovernedTableAccess(tables, views, rows, cache);
  }

  @Bean
  public PaginationEngine paginationEngine(@Qualifier("readOnly") JdbcExecutor readOnly, TableStore tables,
                                           TabulaProperties props) {
    // Page reads go through the read-only pool; writes never do.
    return new PaginationEngine(new JdbcRowStore(readOnly, tables), props.getPaging().toPolicy(),
        props.getPaging().toRetry());
  }

  @Bean
  public BulkIngestionPipeline bulkIngestionPipeline(HikariDataSource dataSource, TableStore tables,
                                                     TabulaProperties props) {
    TabulaProperties.Ingest ingest = props.getIngest();
    StreamingRowWriter writer = new StreamingRowWriter(new PostgresCopySessionFactory(dataSource), ingest.getCopyBufferBytes());
    return new BulkIngestionPipeline(tables, writer, ingest.toOptions());
  }
}
