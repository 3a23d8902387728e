package tonerow.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import tonerow.core.ToneRow;
import tonerow.core.model.Transformation;
import tonerow.partitions.SegmentSize;
import tonerow.pipeline.CombinatorialAnalysis;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(CombinatorialAnalysis analysis, Set<SegmentSize> sizes) {
    ToneRow row = analysis.row();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    root.put("prime_row", analysis.primeRowString());
    root.put("forms", forms(row));
    root.put("matrix", row.matrix().toArray());
    root.put("combinatorials", combinatorials(analysis, sizes));
    return gson.toJson(root);
  }

  private Map<String, Object> forms(ToneRow row) {
    Map<String, Object> forms = new LinkedHashMap<>();
    forms.put("P0", row.prime());
    forms.put("I0", row.inversion());
    forms.put("R0", row.retrograde());
    forms.put("RI0", row.retrogradeInversion());
    return forms;
  }

  private Map<String, Object> combinatorials(
      CombinatorialAnalysis analysis, Set<SegmentSize> sizes) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (SegmentSize size : sizes) {
      List<String> labels = new ArrayList<>();
      analysis.forSize(size).stream()
          .sorted(Transformation.BY_LABEL)
          .map(Transformation::label)
          .forEach(labels::add);
      result.put(size.adjective(), labels);
    }
    return result;
  }
}
