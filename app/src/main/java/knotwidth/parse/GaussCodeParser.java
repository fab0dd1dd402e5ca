package knotwidth.parse;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import knotwidth.core.GaussCode;
import knotwidth.core.GaussCodeParseException;

/** Turns raw Gauss code tokens such as {@code "-1"}, {@code "2,"} into a {@link GaussCode}. */
public final class GaussCodeParser {
  private static final CharMatcher SEPARATOR = CharMatcher.is(',');
  private static final Splitter LINE_SPLITTER =
      Splitter.on(CharMatcher.anyOf(",;[]()").or(CharMatcher.whitespace()))
          .omitEmptyStrings()
          .trimResults();

  private GaussCodeParser() {}

  /**
   * Converts each token to a signed integer after removing embedded commas.
   *
   * @throws GaussCodeParseException if a token is not an integer or is zero
   */
  public static GaussCode parse(List<String> tokens) {
    Objects.requireNonNull(tokens, "tokens");
    int[] entries = new int[tokens.size()];
    for (int i = 0; i < tokens.size(); i++) {
      entries[i] = parseToken(tokens.get(i), i);
    }
    return GaussCode.of(entries);
  }

  /** Splits a free-form line like {@code "[-1, 2, -3, 1, -2, 3]"} and parses the pieces. */
  public static GaussCode parseText(String line) {
    Objects.requireNonNull(line, "line");
    return parse(tokenize(line));
  }

  public static List<String> tokenize(String line) {
    return new ArrayList<>(LINE_SPLITTER.splitToList(line));
  }

  private static int parseToken(String raw, int position) {
    if (raw == null) {
      throw new GaussCodeParseException(null, position, "Missing token at position " + position);
    }
    String stripped = SEPARATOR.removeFrom(raw).trim();
    int value;
    try {
      value = Integer.parseInt(stripped);
    } catch (NumberFormatException ex) {
      throw new GaussCodeParseException(
          raw,
          position,
          "Invalid Gauss code token at position " + position + ": '" + raw + "'",
          ex);
    }
    if (value == 0) {
      throw new GaussCodeParseException(
          raw, position, "Crossing labels must be nonzero (position " + position + ")");
    }
    return value;
  }
}
