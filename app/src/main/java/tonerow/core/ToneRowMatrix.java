package tonerow.core;

import java.util.Locale;

/**
 * The 12x12 twelve-tone matrix derived from a prime row.
 *
 * <p>Row 0 is the prime row. Row {@code i} is the prime row transposed so that its first note
 * equals the {@code i}-th note of the inversion; consequently column 0 reads the inversion
 * top-to-bottom, every row is a transposed prime form and every column a transposed inversion.
 *
 * <p>Instances are immutable. Accessors hand out copies, never the backing table.
 */
public final class ToneRowMatrix {
  public static final int SIZE = PitchClass.COUNT;

  private final int[][] cells;

  private ToneRowMatrix(int[][] cells) {
    this.cells = cells;
  }

  /**
   * Builds the matrix for an already validated prime row.
   *
   * <p>The inversion used to place the rows is the plain negation of the prime row; only the
   * intervals between its entries matter, so the transposition for row {@code i} is {@code
   * inversion[i] - inversion[0]}.
   */
  static ToneRowMatrix build(int[] prime) {
    int[][] cells = new int[SIZE][SIZE];
    cells[0] = prime.clone();

    int[] inversion = new int[SIZE];
    for (int i = 0; i < SIZE; i++) {
      inversion[i] = PitchClass.invert(prime[i]);
    }

    for (int i = 1; i < SIZE; i++) {
      int interval = PitchClass.interval(inversion[0], inversion[i]);
      for (int j = 0; j < SIZE; j++) {
        cells[i][j] = PitchClass.transpose(prime[j], interval);
      }
    }
    return new ToneRowMatrix(cells);
  }

  public int get(int row, int column) {
    return cells[row][column];
  }

  public int[] row(int index) {
    return cells[index].clone();
  }

  public int[] column(int index) {
    int[] column = new int[SIZE];
    for (int i = 0; i < SIZE; i++) {
      column[i] = cells[i][index];
    }
    return column;
  }

  /** Deep copy of the full table. */
  public int[][] toArray() {
    int[][] copy = new int[SIZE][];
    for (int i = 0; i < SIZE; i++) {
      copy[i] = cells[i].clone();
    }
    return copy;
  }

  /** Renders the table as right-aligned columns, one matrix row per line. */
  public String render() {
    StringBuilder builder = new StringBuilder(SIZE * SIZE * 3);
    for (int[] row : cells) {
      for (int j = 0; j < SIZE; j++) {
        if (j > 0) {
          builder.append(' ');
        }
        builder.append(String.format(Locale.ROOT, "%2d", row[j]));
      }
      builder.append(System.lineSeparator());
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
