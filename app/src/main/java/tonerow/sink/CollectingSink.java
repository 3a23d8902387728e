package tonerow.sink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import tonerow.pipeline.CombinatorialAnalysis;

/** Keeps every analysis in memory. Meant for tests and small runs. */
public final class CollectingSink implements AnalysisSink {
  private final List<CombinatorialAnalysis> analyses = new ArrayList<>();
  private int flushes;

  @Override
  public void accept(CombinatorialAnalysis analysis) {
    analyses.add(Objects.requireNonNull(analysis, "analysis"));
  }

  @Override
  public void flush() {
    flushes++;
  }

  public List<CombinatorialAnalysis> analyses() {
    return List.copyOf(analyses);
  }

  public int flushes() {
    return flushes;
  }
}
