package tonerow.pipeline;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for a bulk analysis run.
 *
 * @param limit maximum rows to analyze; 0 or negative means every row the source yields
 * @param batchSize rows analyzed (and flushed to the sink) together
 * @param parallelism worker threads used to analyze a batch; 1 runs on the calling thread
 * @param progressInterval log progress every this many rows; 0 disables progress logging
 * @param failFast abort on the first invalid input row instead of skipping it
 */
public record AnalysisOptions(
    long limit, int batchSize, int parallelism, long progressInterval, boolean failFast) {

  static final String BATCH_SIZE_PROPERTY = "tonerow.batchSize";
  static final String BATCH_SIZE_ENV = "TONEROW_BATCH_SIZE";
  static final String PARALLELISM_PROPERTY = "tonerow.parallelism";
  static final String PARALLELISM_ENV = "TONEROW_PARALLELISM";

  public static AnalysisOptions defaults() {
    return new AnalysisOptions(0, 100, 1, 100_000, false);
  }

  public static AnalysisOptions normalize(AnalysisOptions options) {
    if (options == null) {
      return defaults();
    }
    AnalysisOptions defaults = defaults();
    long limit = Math.max(0, options.limit());
    int batchSize = options.batchSize() > 0 ? options.batchSize() : defaults.batchSize();
    int parallelism = Math.max(1, options.parallelism());
    long progressInterval = Math.max(0, options.progressInterval());
    return new AnalysisOptions(limit, batchSize, parallelism, progressInterval, options.failFast());
  }

  /** Defaults with batch size and parallelism taken from the running JVM's properties/env. */
  public static AnalysisOptions fromEnvironment() {
    return fromEnvironment(System.getProperties(), System.getenv());
  }

  /**
   * Defaults overridden by {@code tonerow.batchSize} / {@code tonerow.parallelism} system
   * properties, falling back to {@code TONEROW_BATCH_SIZE} / {@code TONEROW_PARALLELISM}
   * environment variables.
   *
   * @throws IllegalArgumentException if a present value is not an integer
   */
  public static AnalysisOptions fromEnvironment(Properties properties, Map<String, String> env) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(env, "env");
    AnalysisOptions defaults = defaults();
    int batchSize =
        intSetting(properties, env, BATCH_SIZE_PROPERTY, BATCH_SIZE_ENV, defaults.batchSize());
    int parallelism =
        intSetting(
            properties, env, PARALLELISM_PROPERTY, PARALLELISM_ENV, defaults.parallelism());
    return normalize(
        new AnalysisOptions(
            defaults.limit(),
            batchSize,
            parallelism,
            defaults.progressInterval(),
            defaults.failFast()));
  }

  public boolean isLimited() {
    return limit > 0;
  }

  public boolean isParallel() {
    return parallelism > 1;
  }

  private static int intSetting(
      Properties properties,
      Map<String, String> env,
      String property,
      String variable,
      int defaultValue) {
    String raw = properties.getProperty(property);
    String source = property;
    if (raw == null) {
      raw = env.get(variable);
      source = variable;
    }
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + source + ": " + raw, ex);
    }
  }
}
