package tonerow.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import tonerow.core.ToneRow;
import tonerow.partitions.SegmentSize;
import tonerow.pipeline.AnalysisPipeline;
import tonerow.pipeline.CombinatorialAnalysis;

/**
 * Handles the {@code analyze} command: one row in, matrix and combinatorial forms out. Repeated
 * {@code --size} options restrict the report to those segment sizes.
 */
final class AnalyzeCommand {
  private final PrintStream out;

  AnalyzeCommand(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  int execute(String[] args) {
    boolean json = false;
    Set<SegmentSize> sizes = EnumSet.noneOf(SegmentSize.class);
    List<String> rowTokens = new ArrayList<>();
    List<String> effectiveArgs = stripCommand(args);
    for (int i = 0; i < effectiveArgs.size(); i++) {
      String arg = effectiveArgs.get(i);
      if ("--json".equals(arg)) {
        json = true;
      } else if ("--size".equals(arg)) {
        if (i + 1 >= effectiveArgs.size()) {
          throw new IllegalArgumentException("Missing value for --size");
        }
        sizes.add(SegmentSize.parse(effectiveArgs.get(++i)));
      } else if (arg.startsWith("--size=")) {
        sizes.add(SegmentSize.parse(arg.substring("--size=".length())));
      } else if (arg.startsWith("--")) {
        throw new IllegalArgumentException("Unknown option: " + arg);
      } else {
        rowTokens.add(arg);
      }
    }
    if (sizes.isEmpty()) {
      sizes = EnumSet.allOf(SegmentSize.class);
    }
    if (rowTokens.isEmpty()) {
      throw new IllegalArgumentException("analyze requires a row of 12 pitch classes");
    }

    ToneRow row = ToneRow.of(CliParsers.parsePitchClasses(String.join(" ", rowTokens)));
    CombinatorialAnalysis analysis = new AnalysisPipeline().analyze(row);

    if (json) {
      out.println(new JsonReportBuilder().build(analysis, sizes));
    } else {
      printText(analysis, sizes);
    }
    return 0;
  }

  private void printText(CombinatorialAnalysis analysis, Set<SegmentSize> sizes) {
    ToneRow row = analysis.row();
    out.println("Prime row: " + analysis.primeRowString());
    out.println("=".repeat(40));
    out.print(row.matrix().render());
    out.println("-".repeat(40));
    out.printf("%-4s %s%n", "P0", format(row.prime()));
    out.printf("%-4s %s%n", "I0", format(row.inversion()));
    out.printf("%-4s %s%n", "R0", format(row.retrograde()));
    out.printf("%-4s %s%n", "RI0", format(row.retrogradeInversion()));
    out.println("-".repeat(40));
    for (SegmentSize size : sizes) {
      String labels = analysis.labelString(size);
      out.printf("%-13s %s%n", size.adjective() + ":", labels.isEmpty() ? "(none)" : labels);
    }
  }

  private static String format(int[] form) {
    return Arrays.stream(form).mapToObj(String::valueOf).collect(Collectors.joining(" "));
  }

  private static List<String> stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return List.of();
    }
    String first = args[0];
    if ("analyze".equalsIgnoreCase(first) || "analyse".equalsIgnoreCase(first)) {
      return Arrays.asList(args).subList(1, args.length);
    }
    return Arrays.asList(args);
  }
}
