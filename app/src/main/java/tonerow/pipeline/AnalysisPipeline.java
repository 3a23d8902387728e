package tonerow.pipeline;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tonerow.core.ToneRow;
import tonerow.core.model.Transformation;
import tonerow.detect.CombinatorialityDetector;
import tonerow.partitions.SegmentSize;

/** Runs the detector at every segment size and assembles the result record for one row. */
public final class AnalysisPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(AnalysisPipeline.class);

  private final CombinatorialityDetector detector;

  public AnalysisPipeline() {
    this(new CombinatorialityDetector());
  }

  public AnalysisPipeline(CombinatorialityDetector detector) {
    this.detector = Objects.requireNonNull(detector, "detector");
  }

  public CombinatorialAnalysis analyze(ToneRow row) {
    Objects.requireNonNull(row, "row");
    Map<SegmentSize, List<Transformation>> found = detector.detectAll(row);
    CombinatorialAnalysis analysis =
        new CombinatorialAnalysis(
            row,
            found.get(SegmentSize.HEXACHORD),
            found.get(SegmentSize.TETRACHORD),
            found.get(SegmentSize.TRICHORD));
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "{} -> hex [{}] tet [{}] tri [{}]",
          analysis.primeRowString(),
          analysis.hexachordalString(),
          analysis.tetrachordalString(),
          analysis.trichordalString());
    }
    return analysis;
  }

  /**
   * Validates and analyzes a raw row.
   *
   * @throws tonerow.core.InvalidToneRowException if the values are not a tone row
   */
  public CombinatorialAnalysis analyze(int... pitchClasses) {
    return analyze(ToneRow.of(pitchClasses));
  }
}
