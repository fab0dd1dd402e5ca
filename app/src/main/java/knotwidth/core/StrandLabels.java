package knotwidth.core;

/** Spreadsheet-style display names for strand indices: A..Z, AA, AB and so on. */
public final class StrandLabels {
  private static final int ALPHABET = 26;

  private StrandLabels() {}

  public static String label(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative: " + index);
    }
    StringBuilder builder = new StringBuilder();
    int remaining = index + 1;
    while (remaining > 0) {
      int digit = (remaining - 1) % ALPHABET;
      builder.append((char) ('A' + digit));
      remaining = (remaining - 1) / ALPHABET;
    }
    return builder.reverse().toString();
  }
}
