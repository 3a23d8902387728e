package tonerow.core.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import tonerow.core.PitchClass;
import tonerow.core.ToneRow;

/**
 * A transformed instance of the prime row, e.g. {@code P6} or {@code RI5}.
 *
 * <p>The level is the distance in semitones between the first note of this form and the first
 * note of the untransposed form of the same kind (P0, R0, I0 or RI0).
 */
public record Transformation(TransformationKind kind, int level) {
  private static final Pattern LABEL = Pattern.compile("(RI|P|R|I)(\\d{1,2})");

  /** Orders labels by their text, the way the persisted label strings are sorted. */
  public static final Comparator<Transformation> BY_LABEL =
      Comparator.comparing(Transformation::label);

  public Transformation {
    Objects.requireNonNull(kind, "kind");
    if (!PitchClass.isValid(level)) {
      throw new IllegalArgumentException("level must be in [0, 11] but was " + level);
    }
  }

  public String label() {
    return kind.prefix() + level;
  }

  public boolean isIdentityLevel() {
    return level == 0;
  }

  /**
   * Parses a label such as {@code "P6"}, {@code "R11"} or {@code "RI0"}.
   *
   * @throws IllegalArgumentException for anything that is not a kind prefix followed by a level
   *     in {@code [0, 11]} written without leading zeros
   */
  public static Transformation parse(String label) {
    Objects.requireNonNull(label, "label");
    Matcher matcher = LABEL.matcher(label.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid transformation label: " + label);
    }
    String digits = matcher.group(2);
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      throw new IllegalArgumentException("Invalid transformation label: " + label);
    }
    int level = Integer.parseInt(digits);
    if (!PitchClass.isValid(level)) {
      throw new IllegalArgumentException("Invalid transformation label: " + label);
    }
    return new Transformation(TransformationKind.fromPrefix(matcher.group(1)), level);
  }

  /**
   * Realizes this form for {@code row}: P and I forms are P0 and I0 transposed by the level, R and
   * RI forms are those read backwards.
   */
  public int[] apply(ToneRow row) {
    Objects.requireNonNull(row, "row");
    int[] base = kind.isInverted() ? row.inversion() : row.prime();
    int[] form = new int[base.length];
    for (int i = 0; i < base.length; i++) {
      form[i] = PitchClass.transpose(base[i], level);
    }
    return kind.isRetrograde() ? ToneRow.reversed(form) : form;
  }

  @Override
  public String toString() {
    return label();
  }
}
