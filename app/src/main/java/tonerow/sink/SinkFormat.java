package tonerow.sink;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Output formats supported by the file-backed sinks. */
public enum SinkFormat {
  CSV,
  JSONL;

  public AnalysisSink create(Writer writer, boolean ownsWriter) {
    return switch (this) {
      case CSV -> new CsvAnalysisSink(writer, ownsWriter);
      case JSONL -> new JsonLinesAnalysisSink(writer, ownsWriter);
    };
  }

  /** Opens (creating or truncating) {@code path}; closing the sink closes the file. */
  public AnalysisSink open(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return create(Files.newBufferedWriter(path, StandardCharsets.UTF_8), true);
  }

  /** Wraps {@code stream} without taking ownership of it. */
  public AnalysisSink to(PrintStream stream) {
    return create(new OutputStreamWriter(stream, StandardCharsets.UTF_8), false);
  }

  public static SinkFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return CSV;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "csv" -> CSV;
      case "jsonl", "json", "ndjson" -> JSONL;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }
}
