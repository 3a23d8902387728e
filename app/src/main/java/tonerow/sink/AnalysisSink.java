package tonerow.sink;

import java.io.Closeable;
import java.io.IOException;
import tonerow.pipeline.CombinatorialAnalysis;

/**
 * Destination for assembled analyses. Implementations may buffer; {@link #flush()} is called once
 * per batch by the bulk driver.
 */
public interface AnalysisSink extends Closeable {

  void accept(CombinatorialAnalysis analysis) throws IOException;

  default void flush() throws IOException {}

  @Override
  default void close() throws IOException {}
}
