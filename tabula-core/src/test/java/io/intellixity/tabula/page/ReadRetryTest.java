package io.intellixity.tabula.page;

import io.intellixity.tabula.error.TransientStoreException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ReadRetryTest {

  @Test
  void delay_doublesUpToCap() {
    ReadRetry r = new ReadRetry(10, 100, 500, ms -> {});
    assertEquals(100, r.delayMillis(1));
    assertEquals(200, r.delayMillis(2));
    assertEquals(400, r.delayMillis(3));
    assertEquals(500, r.delayMillis(4));
    assertEquals(500, r.delayMillis(60));
  }

  @Test
  void nonTransientFailure_isNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    ReadRetry r = new ReadRetry(3, 100, 500, ms -> fail("no wait expected"));

    assertThrows(IllegalStateException.class, () -> r.call("row.range", () -> {
      calls.incrementAndGet();
      throw new IllegalStateException("syntax");
    }));
    assertEquals(1, calls.get());
  }

  @Test
  void interruptedWait_stopsRetryingAndKeepsInterruptFlag() {
    AtomicInteger calls = new AtomicInteger();
    ReadRetry r = new ReadRetry(3, 100, 500, ms -> {
      throw new InterruptedException();
    });

    TransientStoreException e = assertThrows(TransientStoreException.class, () -> r.call("row.count", () -> {
      calls.incrementAndGet();
      throw new TransientStoreException("connection reset");
    }));
    assertEquals(1, calls.get());
    assertEquals(1, e.getSuppressed().length);
    assertTrue(Thread.interrupted());
  }

  @Test
  void singleAttempt_neverWaits() {
    List<Long> waits = new ArrayList<>();
    ReadRetry r = new ReadRetry(1, 100, 500, waits::add);

    assertThrows(TransientStoreException.class, () -> r.call("row.count", () -> {
      throw new TransientStoreException("down");
    }));
    assertTrue(waits.isEmpty());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new ReadRetry(0, 100, 500));
    assertThrows(IllegalArgumentException.class, () -> new ReadRetry(3, 600, 500));
  }
}
