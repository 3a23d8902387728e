package tonerow.sink;

import java.io.Writer;
import tonerow.pipeline.CombinatorialAnalysis;

/** Writes a header line followed by one fully quoted CSV row per analysis. */
public final class CsvAnalysisSink extends WriterAnalysisSink {

  public CsvAnalysisSink(Writer writer, boolean ownsWriter) {
    super(writer, ownsWriter);
  }

  @Override
  String header() {
    return CombinatorialAnalysis.CSV_HEADER;
  }

  @Override
  String format(CombinatorialAnalysis analysis) {
    return analysis.toCsvRow();
  }
}
