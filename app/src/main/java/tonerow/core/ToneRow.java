package tonerow.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordering of the twelve pitch classes in which each appears exactly once, together with the
 * twelve-tone matrix derived from it.
 *
 * <p>The matrix is built once at construction and shared by every accessor. All returned arrays
 * are copies.
 */
public final class ToneRow {
  private static final int FULL_AGGREGATE = (1 << PitchClass.COUNT) - 1;
  private static final int NOT_A_PITCH_CLASS = -1;

  private final int[] prime;
  private final ToneRowMatrix matrix;

  private ToneRow(int[] prime) {
    this.prime = prime;
    this.matrix = ToneRowMatrix.build(prime);
  }

  /**
   * Validates and wraps a prime row.
   *
   * @throws InvalidToneRowException if the row does not have twelve entries or is not a
   *     permutation of {@code 0..11}
   */
  public static ToneRow of(int... pitchClasses) {
    Objects.requireNonNull(pitchClasses, "pitchClasses");
    int[] copy = pitchClasses.clone();
    validate(copy);
    return new ToneRow(copy);
  }

  /**
   * Validates and wraps a boxed prime row. A null entry is not a pitch class and is reported like
   * any other out-of-range value.
   *
   * @throws InvalidToneRowException if the row does not have twelve entries or is not a
   *     permutation of {@code 0..11}
   */
  public static ToneRow of(List<Integer> pitchClasses) {
    Objects.requireNonNull(pitchClasses, "pitchClasses");
    int[] values = new int[pitchClasses.size()];
    for (int i = 0; i < values.length; i++) {
      Integer value = pitchClasses.get(i);
      values[i] = value == null ? NOT_A_PITCH_CLASS : value;
    }
    validate(values);
    return new ToneRow(values);
  }

  public static boolean isValid(int[] candidate) {
    return candidate != null && candidate.length == PitchClass.COUNT && isPermutation(candidate);
  }

  static void validate(int[] candidate) {
    if (candidate.length != PitchClass.COUNT) {
      throw new InvalidToneRowException(InvalidToneRowException.Reason.WRONG_LENGTH, candidate);
    }
    if (!isPermutation(candidate)) {
      throw new InvalidToneRowException(
          InvalidToneRowException.Reason.NOT_A_PERMUTATION, candidate);
    }
  }

  private static boolean isPermutation(int[] candidate) {
    int seen = 0;
    for (int value : candidate) {
      if (!PitchClass.isValid(value)) {
        return false;
      }
      seen |= 1 << value;
    }
    return seen == FULL_AGGREGATE;
  }

  /**
   * Transposes every note of {@code row} by {@code interval} semitones.
   *
   * @throws InvalidToneRowException if {@code row} is not a valid tone row
   * @throws TranspositionRangeException if {@code interval} is outside {@code [-11, 11]}
   */
  public static ToneRow transpose(int[] row, int interval) {
    Objects.requireNonNull(row, "row");
    validate(row);
    if (interval < -(PitchClass.COUNT - 1) || interval > PitchClass.COUNT - 1) {
      throw new TranspositionRangeException(interval);
    }
    int shift = PitchClass.normalize(interval);
    int[] transposed = new int[PitchClass.COUNT];
    for (int i = 0; i < transposed.length; i++) {
      transposed[i] = PitchClass.transpose(row[i], shift);
    }
    return new ToneRow(transposed);
  }

  public ToneRow transposed(int interval) {
    return transpose(prime, interval);
  }

  public ToneRowMatrix matrix() {
    return matrix;
  }

  /** P0: matrix row 0. */
  public int[] prime() {
    return matrix.row(0);
  }

  /** I0: matrix column 0. */
  public int[] inversion() {
    return matrix.column(0);
  }

  /** R0: P0 read backwards. */
  public int[] retrograde() {
    return reversed(prime());
  }

  /** RI0: I0 read backwards. */
  public int[] retrogradeInversion() {
    return reversed(inversion());
  }

  public int pitchClass(int position) {
    return prime[position];
  }

  /** Space separated pitch classes, e.g. {@code "0 11 7 8 3 1 2 10 6 5 4 9"}. */
  public String toNotation() {
    return Arrays.stream(prime).mapToObj(String::valueOf).collect(Collectors.joining(" "));
  }

  public static int[] reversed(int[] values) {
    int[] reversed = new int[values.length];
    for (int i = 0; i < values.length; i++) {
      reversed[i] = values[values.length - 1 - i];
    }
    return reversed;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ToneRow)) {
      return false;
    }
    return Arrays.equals(prime, ((ToneRow) other).prime);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(prime);
  }

  @Override
  public String toString() {
    return "ToneRow[" + toNotation() + "]";
  }
}
