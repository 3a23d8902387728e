package tonerow.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tonerow.core.InvalidToneRowException;
import tonerow.core.ToneRow;
import tonerow.generator.RowEnumerator;
import tonerow.pipeline.AnalysisRun.Phase;
import tonerow.sink.AnalysisSink;
import tonerow.util.Timing;

/**
 * Drives the analysis of many rows: pulls a batch from the source, validates it, analyzes it
 * (optionally on a {@link ForkJoinPool}), writes the results in source order and flushes the sink.
 *
 * <p>Invalid input rows are logged and skipped, or abort the run when {@link
 * AnalysisOptions#failFast()} is set. Sink failures always abort the run.
 */
public final class BulkAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(BulkAnalyzer.class);

  private final AnalysisPipeline pipeline;
  private final AnalysisOptions options;

  public BulkAnalyzer(AnalysisOptions options) {
    this(new AnalysisPipeline(), options);
  }

  public BulkAnalyzer(AnalysisPipeline pipeline, AnalysisOptions options) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.options = AnalysisOptions.normalize(options);
  }

  /** Analyzes the rows of {@code enumerator} that it has not produced yet. */
  public AnalysisRun run(RowEnumerator enumerator, AnalysisSink sink) throws IOException {
    Objects.requireNonNull(enumerator, "enumerator");
    Iterator<int[]> rows =
        new Iterator<>() {
          @Override
          public boolean hasNext() {
            return enumerator.hasNext();
          }

          @Override
          public int[] next() {
            return enumerator.nextPitchClasses();
          }
        };
    return run(rows, enumerator.remaining(), sink);
  }

  /**
   * Analyzes raw rows from {@code rows}.
   *
   * @param expectedTotal rows the source is expected to yield, used for progress percentages; 0 or
   *     negative when unknown
   * @throws InvalidToneRowException for an invalid row when fail-fast is enabled
   * @throws IOException if the sink fails
   */
  public AnalysisRun run(Iterator<int[]> rows, long expectedTotal, AnalysisSink sink)
      throws IOException {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(sink, "sink");
    long target = progressTarget(expectedTotal);
    LOG.info(
        "Starting bulk analysis (rows: {}, batch size: {}, parallelism: {})",
        target > 0 ? target : "unknown",
        options.batchSize(),
        options.parallelism());

    AnalysisRun run = new AnalysisRun();
    Timing total = Timing.start();
    ForkJoinPool pool = options.isParallel() ? new ForkJoinPool(options.parallelism()) : null;
    long consumed = 0;
    long nextProgress = options.progressInterval();
    try {
      while (rows.hasNext() && !limitReached(consumed)) {
        Timing phase = Timing.start();
        List<int[]> raw = new ArrayList<>(options.batchSize());
        while (raw.size() < options.batchSize() && rows.hasNext() && !limitReached(consumed)) {
          raw.add(rows.next());
          consumed++;
        }
        run.addPhaseNanos(Phase.ENUMERATION, phase.elapsedNanos());

        phase = Timing.start();
        List<ToneRow> valid = validate(raw, run);
        List<CombinatorialAnalysis> analyses = analyze(valid, pool);
        run.addPhaseNanos(Phase.ANALYSIS, phase.elapsedNanos());

        phase = Timing.start();
        for (CombinatorialAnalysis analysis : analyses) {
          sink.accept(analysis);
        }
        sink.flush();
        run.addPhaseNanos(Phase.WRITE, phase.elapsedNanos());
        run.recordBatch(analyses.size());

        if (options.progressInterval() > 0 && consumed >= nextProgress) {
          logProgress(consumed, target, total);
          while (nextProgress <= consumed) {
            nextProgress += options.progressInterval();
          }
        }
      }
    } finally {
      if (pool != null) {
        pool.shutdown();
      }
      run.recordPhaseNanos(Phase.TOTAL, total.elapsedNanos());
    }

    LOG.info(
        "Bulk analysis finished: {} rows analyzed, {} rejected in {} ms",
        run.rowsAnalyzed(),
        run.rowsRejected(),
        run.totalMs());
    return run;
  }

  private List<ToneRow> validate(List<int[]> raw, AnalysisRun run) {
    List<ToneRow> valid = new ArrayList<>(raw.size());
    for (int[] candidate : raw) {
      try {
        valid.add(ToneRow.of(candidate));
      } catch (InvalidToneRowException ex) {
        if (options.failFast()) {
          LOG.error("Aborting on invalid row {}", Arrays.toString(candidate));
          throw ex;
        }
        run.recordRejected();
        LOG.warn("Skipping invalid row: {}", ex.getMessage());
      }
    }
    return valid;
  }

  private List<CombinatorialAnalysis> analyze(List<ToneRow> rows, ForkJoinPool pool) {
    if (pool == null) {
      List<CombinatorialAnalysis> analyses = new ArrayList<>(rows.size());
      for (ToneRow row : rows) {
        analyses.add(pipeline.analyze(row));
      }
      return analyses;
    }
    return pool.submit(() -> rows.parallelStream().map(pipeline::analyze).toList()).join();
  }

  private boolean limitReached(long consumed) {
    return options.isLimited() && consumed >= options.limit();
  }

  private long progressTarget(long expectedTotal) {
    if (options.isLimited()) {
      return expectedTotal > 0 ? Math.min(options.limit(), expectedTotal) : options.limit();
    }
    return Math.max(0, expectedTotal);
  }

  private void logProgress(long consumed, long target, Timing total) {
    double rate = total.ratePerSecond(consumed);
    if (target > 0) {
      LOG.info(
          "[PROGRESS] {}% complete ({} rows processed, {} rows/s)",
          String.format(Locale.ROOT, "%.1f", consumed * 100.0 / target),
          consumed,
          Math.round(rate));
    } else {
      LOG.info("[PROGRESS] {} rows processed ({} rows/s)", consumed, Math.round(rate));
    }
  }
}
