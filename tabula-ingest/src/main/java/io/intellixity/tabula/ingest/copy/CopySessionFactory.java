package io.intellixity.tabula.ingest.copy;

@FunctionalInterface
public interface CopySessionFactory {
  /** Open a connection and begin a transaction. */
  CopySession begin();
}
