package tonerow.cli;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import tonerow.pipeline.AnalysisOptions;
import tonerow.sink.SinkFormat;

final class BatchCommandTest {
  private final BatchCommand command = new BatchCommand(System.out);

  @Test
  void defaultsEnumerateFromZeroToCsv() {
    BatchOptions options = command.parseArgs(new String[] {"batch"}, AnalysisOptions.defaults());
    assertEquals(List.of(0), options.prefix());
    assertEquals(SinkFormat.CSV, options.format());
    assertFalse(options.hasInput());
    assertFalse(options.hasOutput());
    assertEquals(AnalysisOptions.defaults(), options.analysis());
  }

  @Test
  void parsesEveryOption() {
    BatchOptions options =
        command.parseArgs(
            new String[] {
              "batch",
              "--limit=10",
              "--batch-size",
              "5",
              "--parallelism",
              "3",
              "--progress-every=1000",
              "--prefix",
              "0,11",
              "--output",
              "out.jsonl",
              "--format",
              "jsonl",
              "--fail-fast"
            },
            AnalysisOptions.defaults());
    assertEquals(new AnalysisOptions(10, 5, 3, 1000, true), options.analysis());
    assertEquals(List.of(0, 11), options.prefix());
    assertArrayEquals(new int[] {0, 11}, options.prefixArray());
    assertEquals(Path.of("out.jsonl"), options.outputPath());
    assertEquals(SinkFormat.JSONL, options.format());
    assertNull(options.inputPath());
  }

  @Test
  void environmentBaseIsOverriddenByFlags() {
    AnalysisOptions base = new AnalysisOptions(0, 500, 8, 100_000, false);
    BatchOptions inherited = command.parseArgs(new String[0], base);
    assertEquals(500, inherited.analysis().batchSize());
    assertEquals(8, inherited.analysis().parallelism());

    BatchOptions overridden = command.parseArgs(new String[] {"--parallelism", "2"}, base);
    assertEquals(2, overridden.analysis().parallelism());
  }

  @Test
  void identicalArgumentsGiveEqualOptions() {
    String[] args = {"--prefix", "0,11,7", "--limit", "3"};
    BatchOptions first = command.parseArgs(args, AnalysisOptions.defaults());
    BatchOptions second = command.parseArgs(args, AnalysisOptions.defaults());
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotSame(first.prefixArray(), first.prefixArray());
    first.prefixArray()[0] = 5;
    assertEquals(List.of(0, 11, 7), first.prefix());
  }

  @Test
  void rejectsConflictingAndMalformedArguments() {
    AnalysisOptions base = AnalysisOptions.defaults();
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--input", "a.txt", "--prefix", "0"}, base));
    assertThrows(
        IllegalArgumentException.class, () -> command.parseArgs(new String[] {"--limit"}, base));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--limit", "-1"}, base));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--batch-size", "ten"}, base));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--format", "xml"}, base));
    assertThrows(
        IllegalArgumentException.class, () -> command.parseArgs(new String[] {"extra"}, base));
  }

  @Test
  void pitchClassListsAcceptSeveralSeparators() {
    assertArrayEquals(new int[] {0, 11, 7}, CliParsers.parsePitchClasses("0 11 7"));
    assertArrayEquals(new int[] {0, 11, 7}, CliParsers.parsePitchClasses("[0, 11,7]"));
    assertArrayEquals(new int[0], CliParsers.parsePitchClasses("  "));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parsePitchClasses("0 a"));
    assertEquals(4, CliParsers.parseInt(null, 4, "--x"));
  }

  @Test
  void rowTokensMarkValuesThatAreNotIntegers() {
    assertArrayEquals(new int[] {0, 11, 7}, CliParsers.parseRowTokens("[0, 11, 7]"));
    assertArrayEquals(
        new int[] {0, CliParsers.UNPARSEABLE, 3}, CliParsers.parseRowTokens("0 x 3"));
    assertArrayEquals(new int[] {CliParsers.UNPARSEABLE}, CliParsers.parseRowTokens("1.5"));
  }
}
