package tonerow.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code analyze 0 11 7 8 3 1 2 10 6 5 4 9 [--json] [--size hex]} prints the matrix and
 *       combinatorial forms of one row
 *   <li>{@code batch [--limit N] [--prefix 0,1] [--input rows.txt] [--output out.csv] [--format
 *       csv|jsonl] [--batch-size N] [--parallelism N] [--progress-every N] [--fail-fast]} analyzes
 *       many rows, by default every row beginning with pitch class 0
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 I/O failure, 2 invalid arguments or input.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0) {
      printUsage(out);
      return 2;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    try {
      return switch (command) {
        case "analyze", "analyse" -> new AnalyzeCommand(out).execute(args);
        case "batch" -> new BatchCommand(out).execute(args);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield 0;
        }
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          printUsage(out);
          yield 2;
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return 2;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return 1;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  analyze <12 pitch classes> [--json] [--size hex|tet|tri]...");
    out.println(
        "  batch [--limit N] [--prefix a,b,..] [--input FILE] [--output FILE]"
            + " [--format csv|jsonl]");
    out.println("        [--batch-size N] [--parallelism N] [--progress-every N] [--fail-fast]");
  }
}
