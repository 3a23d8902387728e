package tonerow.sink;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import tonerow.pipeline.CombinatorialAnalysis;

/** Base for sinks that emit one text line per analysis to a {@link Writer}. */
abstract class WriterAnalysisSink implements AnalysisSink {
  private final Writer writer;
  private final boolean ownsWriter;
  private boolean started;
  private long written;

  WriterAnalysisSink(Writer writer, boolean ownsWriter) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.ownsWriter = ownsWriter;
  }

  /** Line written before the first record, or null for none. */
  abstract String header();

  abstract String format(CombinatorialAnalysis analysis);

  @Override
  public final void accept(CombinatorialAnalysis analysis) throws IOException {
    Objects.requireNonNull(analysis, "analysis");
    start();
    writer.write(format(analysis));
    writer.write('\n');
    written++;
  }

  @Override
  public final void flush() throws IOException {
    writer.flush();
  }

  @Override
  public final void close() throws IOException {
    start();
    if (ownsWriter) {
      writer.close();
    } else {
      writer.flush();
    }
  }

  public long written() {
    return written;
  }

  private void start() throws IOException {
    if (started) {
      return;
    }
    started = true;
    String header = header();
    if (header != null) {
      writer.write(header);
      writer.write('\n');
    }
  }
}
