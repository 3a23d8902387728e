package tonerow.pipeline;

import java.util.Locale;

/**
 * Tracks a single bulk analysis run.
 *
 * <p>Stores per-phase wall-clock time, summed in nanoseconds across batches, plus how many rows
 * were analyzed and how many input rows were rejected as invalid.
 */
public final class AnalysisRun {

  public enum Phase {
    ENUMERATION,
    ANALYSIS,
    WRITE,
    TOTAL
  }

  private final long[] phaseNanos = new long[Phase.values().length];
  private long rowsAnalyzed;
  private long rowsRejected;
  private int batches;

  // ----- Recording -----

  public void addPhaseNanos(Phase phase, long nanos) {
    phaseNanos[phase.ordinal()] += nanos;
  }

  public void recordPhaseNanos(Phase phase, long nanos) {
    phaseNanos[phase.ordinal()] = nanos;
  }

  void recordBatch(int analyzed) {
    rowsAnalyzed += analyzed;
    batches++;
  }

  void recordRejected() {
    rowsRejected++;
  }

  // ----- Accessors -----

  public long phaseNanos(Phase phase) {
    return phaseNanos[phase.ordinal()];
  }

  /** Accumulated time of {@code phase}, converted to milliseconds only here. */
  public long phaseMs(Phase phase) {
    return phaseNanos(phase) / 1_000_000L;
  }

  public long rowsAnalyzed() {
    return rowsAnalyzed;
  }

  public long rowsRejected() {
    return rowsRejected;
  }

  public int batches() {
    return batches;
  }

  public long totalMs() {
    return phaseMs(Phase.TOTAL);
  }

  /** Share of the total time spent in each non-total phase. */
  public String percentageBreakdown() {
    long total = Math.max(1, phaseNanos(Phase.TOTAL));
    StringBuilder builder = new StringBuilder();
    for (Phase phase : Phase.values()) {
      if (phase == Phase.TOTAL) {
        continue;
      }
      builder.append(
          String.format(
              Locale.ROOT,
              "  %-12s %8d ms (%5.1f%%)%n",
              phase.name().toLowerCase(Locale.ROOT),
              phaseMs(phase),
              phaseNanos(phase) * 100.0 / total));
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "AnalysisRun[analyzed=%d, rejected=%d, batches=%d, total=%d ms]",
        rowsAnalyzed,
        rowsRejected,
        batches,
        totalMs());
  }
}
