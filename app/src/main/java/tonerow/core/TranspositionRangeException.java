package tonerow.core;

/** Raised when a transposition interval falls outside {@code [-11, 11]}. */
public final class TranspositionRangeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int interval;

  TranspositionRangeException(int interval) {
    super("Interval size must be between -11 and 11 but was " + interval);
    this.interval = interval;
  }

  public int interval() {
    return interval;
  }
}
