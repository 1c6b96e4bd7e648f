package io.intellixity.tabula.ingest;

import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;

import java.util.List;
import java.util.SplittableRandom;
import java.util.regex.Pattern;

/** Column-aware synthetic values: the column name picks the generator, the type bounds it. */
final class SyntheticValues {
  private SyntheticValues() {}

  static final List<String> FIRST_NAMES = List.of(
      "Liam", "Noah", "Olivia", "Emma", "Ava", "Mia", "Amelia", "Sophia", "Isabella", "James",
      "Benjamin", "Lucas", "Henry", "Alexander", "Charlotte", "Harper", "Evelyn", "Ella", "Jack", "Leo");

  static final List<String> WORDS = List.of(
      "alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel", "india", "juliet", "kilo",
      "lima", "mike", "november", "oscar", "papa", "quebec", "romeo", "sierra", "tango", "uniform");

  private static final Pattern AGE = Pattern.compile("(^|[^a-z])age([^a-z]|$)");

  enum Kind { PERSON_NAME, EMAIL, WORD, AGE, NUMBER }

  static Kind kindOf(Column c) {
    String n = c.normalizedName();
    if (c.type() == ColumnType.NUMBER) {
      return AGE.matcher(n).find() ? Kind.AGE : Kind.NUMBER;
    }
    if (n.contains("email") || n.contains("e-mail")) return Kind.EMAIL;
    if (n.contains("name")) return Kind.PERSON_NAME;
    return Kind.WORD;
  }

  /** TEXT kinds yield String; NUMBER kinds yield Integer. */
  static Object next(Kind kind, SplittableRandom rnd) {
    return switch (kind) {
      case PERSON_NAME -> FIRST_NAMES.get(rnd.nextInt(FIRST_NAMES.size()));
      case EMAIL -> "user" + (100_000 + rnd.nextInt(900_000)) + "@example.com";
      case WORD -> WORDS.get(rnd.nextInt(WORDS.size()));
      case AGE -> 18 + rnd.nextInt(63);
      case NUMBER -> 1 + rnd.nextInt(100);
    };
  }
}
