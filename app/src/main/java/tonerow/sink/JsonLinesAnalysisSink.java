package tonerow.sink;

import com.google.gson.Gson;
import java.io.Writer;
import tonerow.pipeline.CombinatorialAnalysis;

/** Writes one compact JSON object per line, keyed by the storage column names. */
public final class JsonLinesAnalysisSink extends WriterAnalysisSink {
  private final Gson gson = new Gson();

  public JsonLinesAnalysisSink(Writer writer, boolean ownsWriter) {
    super(writer, ownsWriter);
  }

  @Override
  String header() {
    return null;
  }

  @Override
  String format(CombinatorialAnalysis analysis) {
    return gson.toJson(analysis.toMap());
  }
}
