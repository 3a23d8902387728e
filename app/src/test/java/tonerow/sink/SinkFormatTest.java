package tonerow.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tonerow.pipeline.AnalysisPipeline;
import tonerow.pipeline.CombinatorialAnalysis;

final class SinkFormatTest {
  private static final CombinatorialAnalysis CHROMATIC =
      new AnalysisPipeline().analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
  private static final CombinatorialAnalysis BERG =
      new AnalysisPipeline().analyze(0, 11, 7, 4, 2, 9, 3, 8, 10, 1, 5, 6);

  @TempDir Path tempDir;

  @Test
  void csvSinkWritesHeaderThenOneLinePerAnalysis() throws IOException {
    StringWriter out = new StringWriter();
    CsvAnalysisSink sink = new CsvAnalysisSink(out, false);
    sink.accept(CHROMATIC);
    sink.accept(BERG);
    sink.close();

    String[] lines = out.toString().split("\n");
    assertEquals(3, lines.length);
    assertEquals(CombinatorialAnalysis.CSV_HEADER, lines[0]);
    assertEquals(CHROMATIC.toCsvRow(), lines[1]);
    assertEquals(BERG.toCsvRow(), lines[2]);
    assertEquals(2, sink.written());
  }

  @Test
  void emptyCsvStillHasAHeader() throws IOException {
    StringWriter out = new StringWriter();
    new CsvAnalysisSink(out, false).close();
    assertEquals(CombinatorialAnalysis.CSV_HEADER + "\n", out.toString());
  }

  @Test
  void jsonLinesSinkWritesOneObjectPerLine() throws IOException {
    StringWriter out = new StringWriter();
    try (JsonLinesAnalysisSink sink = new JsonLinesAnalysisSink(out, false)) {
      sink.accept(CHROMATIC);
      sink.accept(BERG);
    }

    String[] lines = out.toString().split("\n");
    assertEquals(2, lines.length);
    JsonObject first = JsonParser.parseString(lines[0]).getAsJsonObject();
    assertEquals("0 1 2 3 4 5 6 7 8 9 10 11", first.get("prime_row").getAsString());
    assertEquals("I11 P6 RI5", first.get("hexachordal_combinatorials").getAsString());
    JsonObject second = JsonParser.parseString(lines[1]).getAsJsonObject();
    assertEquals(BERG.trichordalString(), second.get("trichordal_combinatorials").getAsString());
  }

  @Test
  void openCreatesParentDirectoriesAndOwnsTheFile() throws IOException {
    Path target = tempDir.resolve("nested").resolve("rows.csv");
    try (AnalysisSink sink = SinkFormat.CSV.open(target)) {
      sink.accept(CHROMATIC);
    }
    List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
    assertEquals(List.of(CombinatorialAnalysis.CSV_HEADER, CHROMATIC.toCsvRow()), lines);
  }

  @Test
  void parseAcceptsAliases() {
    assertEquals(SinkFormat.CSV, SinkFormat.parse(null));
    assertEquals(SinkFormat.CSV, SinkFormat.parse("CSV"));
    assertEquals(SinkFormat.JSONL, SinkFormat.parse("ndjson"));
    assertEquals(SinkFormat.JSONL, SinkFormat.parse("json"));
    assertThrows(IllegalArgumentException.class, () -> SinkFormat.parse("xml"));
    assertInstanceOf(
        JsonLinesAnalysisSink.class, SinkFormat.JSONL.create(new StringWriter(), true));
    assertInstanceOf(CsvAnalysisSink.class, SinkFormat.CSV.create(new StringWriter(), true));
  }
}
