package tonerow.core.model;

import java.util.Locale;

/** The four serial operations applied to a prime row. */
public enum TransformationKind {
  PRIME("P", false, false),
  RETROGRADE("R", true, false),
  INVERSION("I", false, true),
  RETROGRADE_INVERSION("RI", true, true);

  private final String prefix;
  private final boolean retrograde;
  private final boolean inverted;

  TransformationKind(String prefix, boolean retrograde, boolean inverted) {
    this.prefix = prefix;
    this.retrograde = retrograde;
    this.inverted = inverted;
  }

  /** Label prefix: {@code P}, {@code R}, {@code I} or {@code RI}. */
  public String prefix() {
    return prefix;
  }

  /** True when forms of this kind are read back to front. */
  public boolean isRetrograde() {
    return retrograde;
  }

  /** True when forms of this kind are taken from matrix columns. */
  public boolean isInverted() {
    return inverted;
  }

  public static TransformationKind fromPrefix(String prefix) {
    String normalized = prefix == null ? "" : prefix.trim().toUpperCase(Locale.ROOT);
    for (TransformationKind kind : values()) {
      if (kind.prefix.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown transformation prefix: " + prefix);
  }
}
