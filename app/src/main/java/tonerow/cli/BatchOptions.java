package tonerow.cli;

import com.google.common.primitives.Ints;
import java.nio.file.Path;
import java.util.List;
import tonerow.pipeline.AnalysisOptions;
import tonerow.sink.SinkFormat;

record BatchOptions(
    AnalysisOptions analysis,
    List<Integer> prefix,
    Path inputPath,
    Path outputPath,
    SinkFormat format) {

  BatchOptions {
    analysis = AnalysisOptions.normalize(analysis);
    prefix = prefix == null ? List.of(0) : List.copyOf(prefix);
    format = format == null ? SinkFormat.CSV : format;
  }

  int[] prefixArray() {
    return Ints.toArray(prefix);
  }

  boolean hasInput() {
    return inputPath != null;
  }

  boolean hasOutput() {
    return outputPath != null;
  }

  static Builder builder(AnalysisOptions base) {
    return new Builder(base);
  }

  static final class Builder {
    private long limit;
    private int batchSize;
    private int parallelism;
    private long progressInterval;
    private boolean failFast;
    private List<Integer> prefix;
    private Path inputPath;
    private Path outputPath;
    private SinkFormat format = SinkFormat.CSV;

    private Builder(AnalysisOptions base) {
      AnalysisOptions effective = AnalysisOptions.normalize(base);
      this.limit = effective.limit();
      this.batchSize = effective.batchSize();
      this.parallelism = effective.parallelism();
      this.progressInterval = effective.progressInterval();
      this.failFast = effective.failFast();
    }

    Builder limit(long limit) {
      this.limit = limit;
      return this;
    }

    Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    Builder progressInterval(long progressInterval) {
      this.progressInterval = progressInterval;
      return this;
    }

    Builder failFast(boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    Builder prefix(int[] prefix) {
      this.prefix = prefix == null ? null : Ints.asList(prefix.clone());
      return this;
    }

    Builder inputPath(Path inputPath) {
      this.inputPath = inputPath;
      return this;
    }

    Builder outputPath(Path outputPath) {
      this.outputPath = outputPath;
      return this;
    }

    Builder format(SinkFormat format) {
      this.format = format;
      return this;
    }

    BatchOptions build() {
      if (inputPath != null && prefix != null) {
        throw new IllegalArgumentException("Provide at most one of --input or --prefix");
      }
      if (limit < 0) {
        throw new IllegalArgumentException("--limit must be non-negative");
      }
      return new BatchOptions(
          new AnalysisOptions(limit, batchSize, parallelism, progressInterval, failFast),
          prefix,
          inputPath,
          outputPath,
          format);
    }
  }
}
