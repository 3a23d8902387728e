package tonerow.core;

/**
 * Modular arithmetic on pitch classes.
 *
 * <p>A pitch class is an integer in {@code [0, 11]}; every operation here reduces its result to the
 * non-negative residue mod 12.
 */
public final class PitchClass {
  /** Number of pitch classes in the equal-tempered octave. */
  public static final int COUNT = 12;

  private PitchClass() {}

  public static int normalize(int value) {
    return ((value % COUNT) + COUNT) % COUNT;
  }

  public static boolean isValid(int value) {
    return value >= 0 && value < COUNT;
  }

  public static int transpose(int pitchClass, int interval) {
    return normalize(pitchClass + interval);
  }

  /** Interval in semitones that lifts {@code from} onto {@code to}. */
  public static int interval(int from, int to) {
    return normalize(to - from);
  }

  public static int invert(int pitchClass) {
    return normalize(-pitchClass);
  }
}
