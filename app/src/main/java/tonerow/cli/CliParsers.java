package tonerow.cli;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;
import java.util.List;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter PITCH_CLASS_SPLITTER =
      Splitter.on(CharMatcher.anyOf(", \t[]")).omitEmptyStrings().trimResults();

  /** Stand-in for a token that is not an integer; never a valid pitch class. */
  static final int UNPARSEABLE = -1;

  private CliParsers() {}

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

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  /**
   * Splits a list of pitch classes written with spaces, commas or brackets, e.g. {@code "0 11 7"},
   * {@code "0,11,7"} or {@code "[0, 11, 7]"}. Values are not checked for range or length.
   */
  static int[] parsePitchClasses(String raw) {
    if (raw == null || raw.isBlank()) {
      return new int[0];
    }
    List<String> tokens = PITCH_CLASS_SPLITTER.splitToList(raw);
    int[] values = new int[tokens.size()];
    for (int i = 0; i < values.length; i++) {
      try {
        values[i] = Integer.parseInt(tokens.get(i));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            "Invalid pitch class '" + tokens.get(i) + "' in: " + raw);
      }
    }
    return values;
  }

  /**
   * Like {@link #parsePitchClasses(String)}, but maps tokens that are not integers to {@link
   * #UNPARSEABLE} so the row is rejected by validation instead of failing here.
   */
  static int[] parseRowTokens(String raw) {
    if (raw == null || raw.isBlank()) {
      return new int[0];
    }
    List<String> tokens = PITCH_CLASS_SPLITTER.splitToList(raw);
    int[] values = new int[tokens.size()];
    for (int i = 0; i < values.length; i++) {
      Integer value = Ints.tryParse(tokens.get(i));
      values[i] = value == null ? UNPARSEABLE : value;
    }
    return values;
  }
}
