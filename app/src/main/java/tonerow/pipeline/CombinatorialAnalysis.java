package tonerow.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import tonerow.core.ToneRow;
import tonerow.core.model.Transformation;
import tonerow.partitions.SegmentSize;

/**
 * Full combinatoriality analysis of one prime row: the forms found at each segment size.
 *
 * <p>The string views are what the storage side consumes: the prime row as space separated pitch
 * classes and each label set sorted by label text and joined with single spaces (so {@code I11}
 * sorts before {@code I2}).
 */
public record CombinatorialAnalysis(
    ToneRow row,
    List<Transformation> hexachordal,
    List<Transformation> tetrachordal,
    List<Transformation> trichordal) {

  public static final String CSV_HEADER =
      "prime_row,hexachordal_combinatorials,tetrachordal_combinatorials,trichordal_combinatorials";

  public CombinatorialAnalysis {
    Objects.requireNonNull(row, "row");
    hexachordal = List.copyOf(Objects.requireNonNull(hexachordal, "hexachordal"));
    tetrachordal = List.copyOf(Objects.requireNonNull(tetrachordal, "tetrachordal"));
    trichordal = List.copyOf(Objects.requireNonNull(trichordal, "trichordal"));
  }

  public List<Transformation> forSize(SegmentSize size) {
    return switch (size) {
      case HEXACHORD -> hexachordal;
      case TETRACHORD -> tetrachordal;
      case TRICHORD -> trichordal;
    };
  }

  public String primeRowString() {
    return row.toNotation();
  }

  public String labelString(SegmentSize size) {
    return forSize(size).stream()
        .sorted(Transformation.BY_LABEL)
        .map(Transformation::label)
        .collect(Collectors.joining(" "));
  }

  public String hexachordalString() {
    return labelString(SegmentSize.HEXACHORD);
  }

  public String tetrachordalString() {
    return labelString(SegmentSize.TETRACHORD);
  }

  public String trichordalString() {
    return labelString(SegmentSize.TRICHORD);
  }

  /** Field name to string value, in storage column order. */
  public Map<String, String> toMap() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("prime_row", primeRowString());
    fields.put("hexachordal_combinatorials", hexachordalString());
    fields.put("tetrachordal_combinatorials", tetrachordalString());
    fields.put("trichordal_combinatorials", trichordalString());
    return fields;
  }

  /** One CSV line matching {@link #CSV_HEADER}; every field is double-quoted. */
  public String toCsvRow() {
    return toMap().values().stream().map(v -> '"' + v + '"').collect(Collectors.joining(","));
  }

  @Override
  public String toString() {
    String nl = System.lineSeparator();
    return "ToneRow Analysis:"
        + nl
        + "Prime Row: "
        + primeRowString()
        + nl
        + "Hexachordal Combinatorials: "
        + hexachordalString()
        + nl
        + "Tetrachordal Combinatorials: "
        + tetrachordalString()
        + nl
        + "Trichordal Combinatorials: "
        + trichordalString();
  }
}
