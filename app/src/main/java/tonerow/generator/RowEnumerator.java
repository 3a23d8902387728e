package tonerow.generator;

import com.google.common.math.LongMath;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import tonerow.core.PitchClass;
import tonerow.core.ToneRow;

/**
 * Lazily enumerates every tone row that begins with a fixed prefix, in lexicographic order of the
 * remaining positions.
 *
 * <p>Only the current permutation is held in memory. Each step is the standard next-permutation
 * rearrangement of the free suffix, so {@link #startingAtZero()} walks all 11! = 39,916,800 rows
 * beginning with pitch class 0 from {@code 0 1 2 ... 11} to {@code 0 11 10 ... 1}. An enumerator is
 * single pass; construct a new one to restart.
 */
public final class RowEnumerator implements Iterator<ToneRow> {
  /** Number of rows produced by {@link #startingAtZero()}. */
  public static final long ROWS_STARTING_AT_ZERO = LongMath.factorial(PitchClass.COUNT - 1);

  private final int prefixLength;
  private final int[] current;
  private final long expectedCount;
  private long produced;
  private boolean exhausted;

  private RowEnumerator(int[] prefix) {
    this.prefixLength = prefix.length;
    this.current = new int[PitchClass.COUNT];
    this.expectedCount = LongMath.factorial(PitchClass.COUNT - prefix.length);

    boolean[] used = new boolean[PitchClass.COUNT];
    System.arraycopy(prefix, 0, current, 0, prefix.length);
    for (int pitchClass : prefix) {
      used[pitchClass] = true;
    }
    int position = prefix.length;
    for (int pitchClass = 0; pitchClass < PitchClass.COUNT; pitchClass++) {
      if (!used[pitchClass]) {
        current[position++] = pitchClass;
      }
    }
  }

  /** All rows with pitch class 0 in position 0. */
  public static RowEnumerator startingAtZero() {
    return startingWith(0);
  }

  /**
   * All rows whose first notes are {@code prefix}.
   *
   * @throws IllegalArgumentException if the prefix is longer than twelve notes, repeats a pitch
   *     class or contains a value outside {@code [0, 11]}
   */
  public static RowEnumerator startingWith(int... prefix) {
    int[] copy = prefix == null ? new int[0] : prefix.clone();
    if (copy.length > PitchClass.COUNT) {
      throw new IllegalArgumentException(
          "Prefix must have at most " + PitchClass.COUNT + " notes: " + Arrays.toString(copy));
    }
    boolean[] seen = new boolean[PitchClass.COUNT];
    for (int pitchClass : copy) {
      if (!PitchClass.isValid(pitchClass) || seen[pitchClass]) {
        throw new IllegalArgumentException(
            "Prefix must contain distinct pitch classes 0-11: " + Arrays.toString(copy));
      }
      seen[pitchClass] = true;
    }
    return new RowEnumerator(copy);
  }

  /** Total number of rows this enumerator yields, i.e. {@code (12 - prefixLength)!}. */
  public long expectedCount() {
    return expectedCount;
  }

  public long remaining() {
    return expectedCount - produced;
  }

  @Override
  public boolean hasNext() {
    return !exhausted;
  }

  @Override
  public ToneRow next() {
    return ToneRow.of(nextPitchClasses());
  }

  /** Advances without building a {@link ToneRow}; returns a fresh array each call. */
  public int[] nextPitchClasses() {
    if (exhausted) {
      throw new NoSuchElementException("All " + expectedCount + " rows have been produced");
    }
    int[] row = current.clone();
    produced++;
    advance();
    return row;
  }

  /** Lazily streams the rows not yet consumed from this enumerator. */
  public Stream<ToneRow> stream() {
    Spliterator<ToneRow> spliterator =
        Spliterators.spliterator(
            this,
            remaining(),
            Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false);
  }

  private void advance() {
    int pivot = current.length - 2;
    while (pivot >= prefixLength && current[pivot] >= current[pivot + 1]) {
      pivot--;
    }
    if (pivot < prefixLength) {
      exhausted = true;
      return;
    }
    int successor = current.length - 1;
    while (current[successor] <= current[pivot]) {
      successor--;
    }
    swap(pivot, successor);
    for (int left = pivot + 1, right = current.length - 1; left < right; left++, right--) {
      swap(left, right);
    }
  }

  private void swap(int i, int j) {
    int tmp = current[i];
    current[i] = current[j];
    current[j] = tmp;
  }
}
