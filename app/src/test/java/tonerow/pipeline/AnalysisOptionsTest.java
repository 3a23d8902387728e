package tonerow.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

final class AnalysisOptionsTest {

  @Test
  void normalizeRepairsOutOfRangeValues() {
    AnalysisOptions normalized =
        AnalysisOptions.normalize(new AnalysisOptions(-5, 0, -2, -1, true));
    assertEquals(0, normalized.limit());
    assertEquals(AnalysisOptions.defaults().batchSize(), normalized.batchSize());
    assertEquals(1, normalized.parallelism());
    assertEquals(0, normalized.progressInterval());
    assertTrue(normalized.failFast());
    assertEquals(AnalysisOptions.defaults(), AnalysisOptions.normalize(null));
  }

  @Test
  void limitAndParallelismFlags() {
    AnalysisOptions defaults = AnalysisOptions.defaults();
    assertFalse(defaults.isLimited());
    assertFalse(defaults.isParallel());
    assertTrue(new AnalysisOptions(10, 100, 1, 0, false).isLimited());
    assertTrue(new AnalysisOptions(0, 10, 4, 0, false).isParallel());
  }

  @Test
  void propertiesTakePrecedenceOverEnvironment() {
    Properties properties = new Properties();
    properties.setProperty(AnalysisOptions.BATCH_SIZE_PROPERTY, "250");
    Map<String, String> env =
        Map.of(AnalysisOptions.BATCH_SIZE_ENV, "50", AnalysisOptions.PARALLELISM_ENV, "3");

    AnalysisOptions options = AnalysisOptions.fromEnvironment(properties, env);
    assertEquals(250, options.batchSize());
    assertEquals(3, options.parallelism());
    assertEquals(AnalysisOptions.defaults().limit(), options.limit());
  }

  @Test
  void missingSettingsFallBackToDefaults() {
    assertEquals(
        AnalysisOptions.defaults(), AnalysisOptions.fromEnvironment(new Properties(), Map.of()));
  }

  @Test
  void malformedSettingNamesItsSource() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                AnalysisOptions.fromEnvironment(
                    new Properties(), Map.of(AnalysisOptions.PARALLELISM_ENV, "many")));
    assertTrue(ex.getMessage().contains(AnalysisOptions.PARALLELISM_ENV), ex.getMessage());
  }
}
