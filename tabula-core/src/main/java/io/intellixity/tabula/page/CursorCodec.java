package io.intellixity.tabula.page;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;

/**
 * Opaque cursor tokens: URL-safe Base64 (no padding) of {@code "<createdAtMicros>:<id>"}.\n
 *
 * Decoding never fails; anything that does not parse, or whose timestamp lies outside what the
 * store can hold, yields empty so callers serve the first page.
 */
public final class CursorCodec {
  private static final char SEP = ':';
  // PostgreSQL timestamptz starts in 4713 BC; long micros since 1970 never reach its upper end
  static final long MIN_MICROS =
      Cursor.toMicros(LocalDate.of(-4712, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC));

  private CursorCodec() {}

  public static String encode(Cursor c) {
    String raw = c.createdAtMicros() + String.valueOf(SEP) + c.id();
    return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  public static Optional<Cursor> decode(String token) {
    if (token == null || token.isBlank()) return Optional.empty();
    try {
      String raw = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.UTF_8);
      int i = raw.indexOf(SEP);
      if (i <= 0 || i == raw.length() - 1) return Optional.empty();
      long micros = Long.parseLong(raw.substring(0, i));
      if (micros < MIN_MICROS) return Optional.empty();
      return Optional.of(new Cursor(micros, raw.substring(i + 1)));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException too
      return Optional.empty();
    }
  }
}
