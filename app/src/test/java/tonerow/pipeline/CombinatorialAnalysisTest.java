package tonerow.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tonerow.core.InvalidToneRowException;
import tonerow.core.ToneRow;
import tonerow.core.model.Transformation;
import tonerow.partitions.SegmentSize;

final class CombinatorialAnalysisTest {
  private final AnalysisPipeline pipeline = new AnalysisPipeline();

  @Test
  void chromaticRowLabelStringsAreSortedAsText() {
    CombinatorialAnalysis analysis = pipeline.analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
    assertEquals("0 1 2 3 4 5 6 7 8 9 10 11", analysis.primeRowString());
    assertEquals("I11 P6 RI5", analysis.hexachordalString());
    assertEquals("I11 I3 I7 P4 P8 R4 R8 RI11 RI3 RI7", analysis.tetrachordalString());
    assertEquals(
        "I11 I2 I5 I8 P3 P6 P9 R3 R6 R9 RI11 RI2 RI5 RI8", analysis.trichordalString());
  }

  @Test
  void allCombinatorialRowHexachords() {
    CombinatorialAnalysis analysis = pipeline.analyze(0, 1, 4, 5, 8, 9, 2, 3, 6, 7, 10, 11);
    assertEquals("I11 I3 I7 P10 P2 P6 R4 R8 RI1 RI5 RI9", analysis.hexachordalString());
    assertEquals(analysis.hexachordal(), analysis.forSize(SegmentSize.HEXACHORD));
  }

  @Test
  void csvRowQuotesEveryField() {
    CombinatorialAnalysis analysis = pipeline.analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
    assertEquals(
        "\"0 1 2 3 4 5 6 7 8 9 10 11\",\"I11 P6 RI5\","
            + "\"I11 I3 I7 P4 P8 R4 R8 RI11 RI3 RI7\","
            + "\"I11 I2 I5 I8 P3 P6 P9 R3 R6 R9 RI11 RI2 RI5 RI8\"",
        analysis.toCsvRow());
  }

  @Test
  void emptyLabelSetsBecomeEmptyStrings() {
    CombinatorialAnalysis analysis =
        new CombinatorialAnalysis(
            ToneRow.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11), List.of(), List.of(), List.of());
    assertEquals("\"0 1 2 3 4 5 6 7 8 9 10 11\",\"\",\"\",\"\"", analysis.toCsvRow());
  }

  @Test
  void mapKeysFollowTheStorageColumns() {
    Map<String, String> fields = pipeline.analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11).toMap();
    assertEquals(
        List.of(
            "prime_row",
            "hexachordal_combinatorials",
            "tetrachordal_combinatorials",
            "trichordal_combinatorials"),
        List.copyOf(fields.keySet()));
    assertEquals(String.join(",", fields.keySet()), CombinatorialAnalysis.CSV_HEADER);
  }

  @Test
  void toStringListsEverySize() {
    String text = pipeline.analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11).toString();
    assertTrue(text.startsWith("ToneRow Analysis:"), text);
    assertTrue(text.contains("Hexachordal Combinatorials: I11 P6 RI5"), text);
  }

  @Test
  void labelListsAreImmutable() {
    CombinatorialAnalysis analysis = pipeline.analyze(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
    assertThrows(
        UnsupportedOperationException.class,
        () -> analysis.hexachordal().add(Transformation.parse("P1")));
  }

  @Test
  void rawRowsAreValidated() {
    assertThrows(InvalidToneRowException.class, () -> pipeline.analyze(0, 1, 2));
  }
}
