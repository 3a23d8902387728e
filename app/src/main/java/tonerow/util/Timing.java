package tonerow.util;

/** Lightweight timer for tracking phase durations. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  /** Rows (or any unit) per second over the elapsed time; 0 before any time has passed. */
  public double ratePerSecond(long units) {
    long nanos = elapsedNanos();
    return nanos <= 0 ? 0.0 : units * 1_000_000_000.0 / nanos;
  }
}
