package tonerow.cli;

import com.google.common.primitives.Ints;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tonerow.generator.RowEnumerator;
import tonerow.pipeline.AnalysisOptions;
import tonerow.pipeline.AnalysisRun;
import tonerow.pipeline.BulkAnalyzer;
import tonerow.sink.AnalysisSink;
import tonerow.sink.SinkFormat;

/** Runs the bulk analyzer over enumerated rows or rows read from a file. */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);

  private final PrintStream out;

  BatchCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) throws IOException {
    BatchOptions options = parseArgs(args, AnalysisOptions.fromEnvironment());
    BulkAnalyzer analyzer = new BulkAnalyzer(options.analysis());

    AnalysisRun run;
    try (AnalysisSink sink = openSink(options)) {
      if (options.hasInput()) {
        run = runFromFile(analyzer, options.inputPath(), sink);
      } else {
        RowEnumerator enumerator = RowEnumerator.startingWith(options.prefixArray());
        LOG.info(
            "Enumerating {} rows starting with {}",
            enumerator.expectedCount(),
            options.prefix());
        run = analyzer.run(enumerator, sink);
      }
    }

    LOG.info("{}", run);
    if (LOG.isInfoEnabled()) {
      LOG.info("Phase breakdown:{}{}", System.lineSeparator(), run.percentageBreakdown());
    }
    return 0;
  }

  private AnalysisRun runFromFile(BulkAnalyzer analyzer, Path input, AnalysisSink sink)
      throws IOException {
    if (!Files.isRegularFile(input)) {
      throw new IllegalArgumentException("Input file not found: " + input);
    }
    try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
      try {
        return analyzer.run(new RowFileIterator(reader), 0, sink);
      } catch (UncheckedIOException ex) {
        throw ex.getCause();
      }
    }
  }

  private AnalysisSink openSink(BatchOptions options) throws IOException {
    SinkFormat format = options.format();
    if (options.hasOutput()) {
      LOG.info("Writing {} output to {}", format, options.outputPath());
      return format.open(options.outputPath());
    }
    return format.to(out);
  }

  BatchOptions parseArgs(String[] args, AnalysisOptions base) {
    String[] effectiveArgs = stripCommand(args);
    Map<String, OptionSpec> specs = optionSpecs();
    BatchOptions.Builder builder = BatchOptions.builder(base);

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= effectiveArgs.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = effectiveArgs[++i];
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    AnalysisOptions defaults = AnalysisOptions.defaults();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--limit",
        OptionSpec.withValue(
            (b, raw) -> b.limit(CliParsers.parseLong(raw, defaults.limit(), "--limit"))));
    specs.put(
        "--batch-size",
        OptionSpec.withValue(
            (b, raw) ->
                b.batchSize(CliParsers.parseInt(raw, defaults.batchSize(), "--batch-size"))));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) ->
                b.parallelism(CliParsers.parseInt(raw, defaults.parallelism(), "--parallelism"))));
    specs.put(
        "--progress-every",
        OptionSpec.withValue(
            (b, raw) ->
                b.progressInterval(
                    CliParsers.parseLong(raw, defaults.progressInterval(), "--progress-every"))));
    specs.put(
        "--prefix",
        OptionSpec.withValue((b, raw) -> b.prefix(CliParsers.parsePitchClasses(raw))));
    specs.put("--input", OptionSpec.withValue((b, raw) -> b.inputPath(Path.of(raw))));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.outputPath(Path.of(raw))));
    specs.put("--format", OptionSpec.withValue((b, raw) -> b.format(SinkFormat.parse(raw))));
    specs.put("--fail-fast", OptionSpec.flag(b -> b.failFast(true)));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("batch".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  /**
   * Reads one row per line, skipping blank lines and {@code #} comments. Lines that do not parse
   * are still returned, so the analyzer's skip or fail-fast policy applies to them.
   */
  private static final class RowFileIterator implements Iterator<int[]> {
    private final BufferedReader reader;
    private int[] pending;
    private int lineNumber;

    RowFileIterator(BufferedReader reader) {
      this.reader = reader;
    }

    @Override
    public boolean hasNext() {
      if (pending != null) {
        return true;
      }
      try {
        String line;
        while ((line = reader.readLine()) != null) {
          lineNumber++;
          String trimmed = line.strip();
          if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            continue;
          }
          pending = CliParsers.parseRowTokens(trimmed);
          if (Ints.contains(pending, CliParsers.UNPARSEABLE)) {
            LOG.warn(
                "Line {}: '{}' contains a value that is not a pitch class", lineNumber, trimmed);
          }
          return true;
        }
        return false;
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }

    @Override
    public int[] next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int[] row = pending;
      pending = null;
      return row;
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<BatchOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<BatchOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<BatchOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(BatchOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
