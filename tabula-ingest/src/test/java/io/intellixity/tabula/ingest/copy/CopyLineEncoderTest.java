package io.intellixity.tabula.ingest.copy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class CopyLineEncoderTest {
  @Test
  void quotesEveryValue_andDoublesInnerQuotes() {
    assertEquals("\"a\",\"say \"\"hi\"\"\",\"42\"\n", CopyLineEncoder.line("a", "say \"hi\"", 42));
  }

  @Test
  void nullIsUnquotedSentinel_distinctFromLiteralText() {
    assertEquals("\\N,\"\\N\"\n", CopyLineEncoder.line(null, "\\N"));
  }

  @Test
  void keepsSeparatorsAndNewlinesInsideQuotes() {
    assertEquals("\"a,b\",\"line1\nline2\"\n", CopyLineEncoder.line("a,b", "line1\nline2"));
  }

  @Test
  void integralDoublesAreWrittenWithoutFraction() {
    assertEquals("\"7\",\"2.5\"\n", CopyLineEncoder.line(7.0d, 2.5d));
  }

  @Test
  void emptyStringIsQuotedNotNull() {
    assertEquals("\"\"\n", CopyLineEncoder.line(""));
  }
}
