package io.intellixity.tabula.jdbc;

import io.intellixity.tabula.error.TransientStoreException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

final class SqlErrorsTest {

  @Test
  void connectionLossAndSerializationFailuresAreRetryable() {
    for (String state : new String[] {"08006", "08001", "40001", "40P01", "57014"}) {
      RuntimeException e = SqlErrors.translate("row.range", new SQLException("boom", state));
      TransientStoreException t = assertInstanceOf(TransientStoreException.class, e, state);
      assertTrue(t.retryable());
    }
    assertInstanceOf(TransientStoreException.class,
        SqlErrors.translate("row.count", new SQLTimeoutException("slow")));
  }

  @Test
  void constraintViolationIsNotRetryable() {
    SQLException cause = new SQLException("duplicate key", "23505");
    RuntimeException e = SqlErrors.translate("column.add", cause);
    assertInstanceOf(IllegalStateException.class, e);
    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().contains("23505"));
  }
}
