package io.intellixity.tabula.server.config;

import io.intellixity.tabula.ingest.IngestOptions;
import io.intellixity.tabula.page.PagePolicy;
import io.intellixity.tabula.page.ReadRetry;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tabula")
public class TabulaProperties {
  private final Db db = new Db();
  private final Ingest ingest = new Ingest();
  private final Paging paging = new Paging();
  private final Ownership ownership = new Ownership();

  public Db getDb() { return db; }
  public Ingest getIngest() { return ingest; }
  public Paging getPaging() { return paging; }
  public Ownership getOwnership() { return ownership; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;
    private boolean initSchema = true;

    /** Optional read-only JDBC URL for page and count queries; if absent, jdbcUrl will be used. */
    private String readOnlyJdbcUrl;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public boolean isInitSchema() { return initSchema; }
    public void setInitSchema(boolean initSchema) { this.initSchema = initSchema; }
    public String getReadOnlyJdbcUrl() { return readOnlyJdbcUrl; }
    public void setReadOnlyJdbcUrl(String readOnlyJdbcUrl) { this.readOnlyJdbcUrl = readOnlyJdbcUrl; }
  }

  public static class Ingest {
    private int batchSize = 35_000;
    private int maxConcurrency = 2;
    private int copyBufferBytes = 1 << 20;

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    public int getCopyBufferBytes() { return copyBufferBytes; }
    public void setCopyBufferBytes(int copyBufferBytes) { this.copyBufferBytes = copyBufferBytes; }

    public IngestOptions toOptions() {
      return new IngestOptions(batchSize, maxConcurrency, copyBufferBytes);
    }
  }

  public static class Paging {
    private int firstPageSize = PagePolicy.DEFAULT_FIRST_PAGE;
    private int maxPageSize = PagePolicy.DEFAULT_MAX_PAGE;
    private int retryAttempts = ReadRetry.DEFAULT_ATTEMPTS;
    private long retryBaseMillis = ReadRetry.DEFAULT_BASE_MILLIS;
    private long retryCapMillis = ReadRetry.DEFAULT_CAP_MILLIS;

    public int getFirstPageSize() { return firstPageSize; }
    public void setFirstPageSize(int firstPageSize) { this.firstPageSize = firstPageSize; }
    public int getMaxPageSize() { return maxPageSize; }
    public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }

    public int getRetryAttempts() { return retryAttempts; }
    public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }
    public long getRetryBaseMillis() { return retryBaseMillis; }
    public void setRetryBaseMillis(long retryBaseMillis) { this.retryBaseMillis = retryBaseMillis; }
    public long getRetryCapMillis() { return retryCapMillis; }
    public void setRetryCapMillis(long retryCapMillis) { this.retryCapMillis = retryCapMillis; }

    public PagePolicy toPolicy() {
      return new PagePolicy(firstPageSize, maxPageSize);
    }

    public ReadRetry toRetry() {
      return new ReadRetry(retryAttempts, retryBaseMillis, retryCapMillis);
    }
  }

  public static class Ownership {
    private int cacheSize = 1_000;
    private long cacheTtlMillis = 10 * 60_000L;

    public int getCacheSize() { return cacheSize; }
    public void setCacheSize(int cacheSize) { this.cacheSize = cacheSize; }
    public long getCacheTtlMillis() { return cacheTtlMillis; }
    public void setCacheTtlMillis(long cacheTtlMillis) { this.cacheTtlMillis = cacheTtlMillis; }
  }
}
