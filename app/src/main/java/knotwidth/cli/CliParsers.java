package knotwidth.cli;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing and Gauss code file loading. */
final class CliParsers {
  private static final Splitter LINES = Splitter.onPattern("\r?\n");
  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_-."));

  private CliParsers() {}

  /** One Gauss code read from a file, with a display name. */
  record NamedCode(String name, int lineNumber, String code) {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code --option value}, {@code --option=value} and flags against {@code specs}. */
  static void parseOptions(
      String[] args, Map<String, OptionSpec> specs, CliOptions.Builder builder) {
    for (int i = 0; i < args.length; i++) {
      String raw = args[i];
      String option = raw;
      String value = null;
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          option = raw.substring(0, equalsIndex);
          value = raw.substring(equalsIndex + 1);
        }
      }
      OptionSpec spec = specs.get(option);
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (!spec.requiresValue() && value != null) {
        throw new IllegalArgumentException("Flag takes no value: " + raw);
      }
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + option);
        }
        value = args[++i];
      }
      spec.apply().accept(builder, value);
    }
  }

  /** Lines holding Gauss codes: blank lines and {@code #} comments are skipped. */
  static List<NamedCode> readCodes(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Gauss code file not found: " + path);
    }
    String content = Files.readString(path, StandardCharsets.UTF_8);
    List<NamedCode> codes = new ArrayList<>();
    int lineNumber = 0;
    for (String line : LINES.split(content)) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      codes.add(toNamedCode(trimmed, lineNumber));
    }
    return codes;
  }

  static NamedCode firstCode(Path path) throws IOException {
    List<NamedCode> codes = readCodes(path);
    if (codes.isEmpty()) {
      throw new IllegalArgumentException("No Gauss code found in " + path);
    }
    return codes.get(0);
  }

  // "8_18: 1, -2, ..." names the code; anything else is named after its line
  private static NamedCode toNamedCode(String line, int lineNumber) {
    int colon = line.indexOf(':');
    if (colon > 0) {
      String name = line.substring(0, colon).trim();
      if (!name.isEmpty() && NAME_CHARS.matchesAllOf(name)) {
        return new NamedCode(name, lineNumber, line.substring(colon + 1).trim());
      }
    }
    return new NamedCode("line" + lineNumber, lineNumber, line);
  }

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }
  }
}
